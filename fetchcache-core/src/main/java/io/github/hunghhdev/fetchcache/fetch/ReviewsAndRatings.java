package io.github.hunghhdev.fetchcache.fetch;

/**
 * Review lists and average ratings for a set of treatments, fetched concurrently.
 *
 * @param <R> review list type
 * @param <A> average rating type
 */
public final class ReviewsAndRatings<R, A> {

    private final BatchResult<R> reviews;
    private final BatchResult<A> averageRatings;
    private final long elapsedMs;

    ReviewsAndRatings(BatchResult<R> reviews, BatchResult<A> averageRatings, long elapsedMs) {
        this.reviews = reviews;
        this.averageRatings = averageRatings;
        this.elapsedMs = elapsedMs;
    }

    public BatchResult<R> getReviews() {
        return reviews;
    }

    public BatchResult<A> getAverageRatings() {
        return averageRatings;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }
}
