/**
 * Wall-clock to UTC conversion of per-subscriber delivery windows.
 *
 * @see dailymsg.time.TimezoneResolver
 */
package dailymsg.time;
