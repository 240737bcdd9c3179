/**
 * Database-specific attempt stores, the portable budget store and the research store
 * adapter.
 *
 * <p>Attempt stores are registered through {@link java.util.ServiceLoader} and chosen
 * from the JDBC URL by {@link outreach.jdbc.store.JdbcAttemptStores#detect}.
 */
package outreach.jdbc.store;
