package dailymsg.ratelimit;

/**
 * Token-bucket quota check for named resources such as the generation API or the
 * SMS gateway.
 *
 * <p>Both implementations share one contract and one arithmetic ({@link TokenBucket});
 * they differ only in where bucket state lives.
 *
 * @see LocalRateLimiter
 * @see DistributedRateLimiter
 */
public interface RateLimiter {

    /**
     * Refills the resource's bucket for the time elapsed since its last refill and, if
     * it holds at least {@code cost} tokens, debits them in the same atomic step.
     *
     * @param resource configured resource name
     * @param cost     tokens to take, {@code 1..capacity}
     * @return whether the tokens were taken, and if not, how long until they could be
     * @throws IllegalArgumentException       if the resource is unknown or the cost is out of range
     * @throws RateLimitUnavailableException if shared bucket state cannot be read or written
     */
    Acquisition tryAcquire(String resource, int cost);
}
