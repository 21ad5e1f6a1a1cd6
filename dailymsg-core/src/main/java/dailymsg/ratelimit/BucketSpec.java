package dailymsg.ratelimit;

/**
 * Configured shape of one resource's bucket.
 *
 * @param capacity        maximum tokens held, and the initial fill
 * @param refillPerSecond tokens added per second; {@code 0} means the bucket never refills
 */
public record BucketSpec(int capacity, double refillPerSecond) {

    public BucketSpec {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        if (refillPerSecond < 0 || Double.isNaN(refillPerSecond) || Double.isInfinite(refillPerSecond)) {
            throw new IllegalArgumentException("refillPerSecond must be a finite value >= 0, got: " + refillPerSecond);
        }
    }

    /**
     * Convenience for limits expressed per minute, for example {@code perMinute(100)}.
     */
    public static BucketSpec perMinute(int requestsPerMinute) {
        return new BucketSpec(requestsPerMinute, requestsPerMinute / 60.0);
    }

    /**
     * Convenience for limits expressed per second.
     */
    public static BucketSpec perSecond(int requestsPerSecond) {
        return new BucketSpec(requestsPerSecond, requestsPerSecond);
    }

    void checkCost(String resource, int cost) {
        if (cost < 1 || cost > capacity) {
            throw new IllegalArgumentException("cost for '" + resource + "' must be in [1, "
                + capacity + "], got: " + cost);
        }
    }
}
