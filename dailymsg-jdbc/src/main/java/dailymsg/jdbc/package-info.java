/**
 * JDBC support: connection provider, statement helper and table name validation.
 *
 * <p>Store implementations live in {@link dailymsg.jdbc.store}. DDL for H2, PostgreSQL and
 * MySQL ships as {@code /schema/h2.sql}, {@code /schema/postgresql.sql} and
 * {@code /schema/mysql.sql} on the classpath.
 *
 * @see dailymsg.jdbc.DataSourceConnectionProvider
 * @see dailymsg.jdbc.JdbcTemplate
 */
package dailymsg.jdbc;
