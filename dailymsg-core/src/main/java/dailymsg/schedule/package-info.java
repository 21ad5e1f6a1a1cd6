/**
 * Daily creation of delivery rows.
 *
 * @see dailymsg.schedule.Scheduler
 */
package dailymsg.schedule;
