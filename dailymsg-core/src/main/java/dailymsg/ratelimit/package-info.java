/**
 * Token-bucket rate limiting for outbound calls.
 *
 * <p>{@link dailymsg.ratelimit.DistributedRateLimiter} keeps buckets in a shared store and
 * is correct across processes. {@link dailymsg.ratelimit.LocalRateLimiter} keeps them in
 * memory and is correct only within one process.
 *
 * @see dailymsg.ratelimit.RateLimiter
 */
package dailymsg.ratelimit;
