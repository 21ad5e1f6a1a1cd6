/**
 * JDBC implementations of the delivery, rate-limit bucket and history stores.
 *
 * <p>The SQL is portable across H2, PostgreSQL and MySQL: single-row conditional
 * {@code UPDATE}s, {@code LIMIT ?} pagination and duplicate-key detection by SQLSTATE.
 */
package dailymsg.jdbc.store;
