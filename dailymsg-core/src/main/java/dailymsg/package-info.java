/**
 * Daily personalized message pipeline.
 *
 * <p>{@link dailymsg.schedule.Scheduler} creates one delivery row per subscriber and day;
 * {@link dailymsg.delivery.DeliveryWorker} claims due rows, generates content through a
 * {@link dailymsg.Generator}, sends it through a {@link dailymsg.Sender} and retries
 * failures, with every external call gated by a {@link dailymsg.ratelimit.RateLimiter}.
 *
 * <p>The interfaces in this package are implemented by the host application:
 * <ul>
 *   <li>{@link dailymsg.SubscriberDirectory} - subscriber lookup</li>
 *   <li>{@link dailymsg.Generator} - message generation</li>
 *   <li>{@link dailymsg.Sender} - SMS gateway</li>
 *   <li>{@link dailymsg.HistoryStore} - sent-message fingerprints (a JDBC implementation ships in {@code dailymsg-jdbc})</li>
 * </ul>
 *
 * @see dailymsg.spi
 */
package dailymsg;
