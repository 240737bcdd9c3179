/**
 * JDBC persistence for the outreach engine.
 *
 * <p>Stores take an explicit {@link java.sql.Connection} per call (the research store
 * takes a {@link outreach.spi.ConnectionProvider}) and never manage transactions.
 * Table DDL for each supported database ships under {@code outreach/jdbc/schema/}.
 *
 * @see outreach.jdbc.store.JdbcAttemptStores
 */
package outreach.jdbc;
