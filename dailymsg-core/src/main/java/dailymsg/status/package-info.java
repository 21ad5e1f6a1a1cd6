/**
 * Read and cancel access to delivery rows.
 */
package dailymsg.status;
