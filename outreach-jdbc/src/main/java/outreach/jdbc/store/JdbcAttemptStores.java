package outreach.jdbc.store;

import outreach.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC attempt stores with auto-detection support.
 *
 * <p>Attempt stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/outreach.jdbc.store.AbstractJdbcAttemptStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcAttemptStore store = JdbcAttemptStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcAttemptStore store = JdbcAttemptStores.detect("jdbc:mysql://localhost/outreach");
 *
 * // Get by name
 * AbstractJdbcAttemptStore store = JdbcAttemptStores.get("postgresql");
 * }</pre>
 */
public final class JdbcAttemptStores {

  private static final List<AbstractJdbcAttemptStore> STORES;
  private static final Map<String, AbstractJdbcAttemptStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcAttemptStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcAttemptStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcAttemptStores() {
  }

  /**
   * Returns all registered attempt stores.
   */
  public static List<AbstractJdbcAttemptStore> all() {
    return STORES;
  }

  /**
   * Gets an attempt store by name.
   *
   * @param name attempt store name (case-insensitive)
   * @return the attempt store
   * @throws IllegalArgumentException if no attempt store found
   */
  public static AbstractJdbcAttemptStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcAttemptStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown attempt store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the attempt store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected attempt store
   * @throws IllegalStateException if detection fails or no matching attempt store
   */
  public static AbstractJdbcAttemptStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect attempt store from DataSource", e);
    }
  }

  /**
   * Auto-detects the attempt store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected attempt store
   * @throws IllegalArgumentException if no matching attempt store found
   */
  public static AbstractJdbcAttemptStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcAttemptStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No attempt store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Auto-detects the attempt store from a DataSource and configures it with a custom
   * {@link JsonCodec}.
   *
   * @throws IllegalStateException if detection fails or no matching attempt store
   */
  public static AbstractJdbcAttemptStore detect(DataSource dataSource, JsonCodec jsonCodec) {
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    return detect(dataSource).withJsonCodec(jsonCodec);
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
