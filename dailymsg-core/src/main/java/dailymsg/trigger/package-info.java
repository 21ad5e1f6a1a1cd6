/**
 * In-process timer that runs the daily scheduling pass and periodic worker ticks.
 */
package dailymsg.trigger;
