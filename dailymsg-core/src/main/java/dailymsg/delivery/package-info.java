/**
 * Claim, generate, throttle, send and retry of due deliveries.
 *
 * <p>{@link dailymsg.delivery.DeliveryWorker} is the only component that moves a row out of
 * PENDING. {@link dailymsg.delivery.RetryPolicy} decides when a failed row is due again.
 *
 * @see dailymsg.delivery.DeliveryWorker
 * @see dailymsg.delivery.ExponentialBackoffRetryPolicy
 */
package dailymsg.delivery;
