package outreach.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import outreach.jdbc.TestDatabases;
import outreach.util.JsonCodec;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAttemptStoresTest {

  @Test
  void allReturnsBuiltInAttemptStores() {
    List<AbstractJdbcAttemptStore> stores = JdbcAttemptStores.all();

    assertTrue(stores.size() >= 3);
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcAttemptStores.get("MySQL").name());
    assertEquals("postgresql", JdbcAttemptStores.get("POSTGRESQL").name());
    assertEquals("h2", JdbcAttemptStores.get("h2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcAttemptStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown attempt store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcAttemptStores.detect("jdbc:mysql://localhost:3306/outreach").name());
    assertEquals("mysql", JdbcAttemptStores.detect("jdbc:tidb://localhost:4000/outreach").name());
    assertEquals("postgresql",
        JdbcAttemptStores.detect("jdbc:postgresql://localhost:5432/outreach").name());
    assertEquals("h2", JdbcAttemptStores.detect("jdbc:h2:mem:test").name());
  }

  @Test
  void detectFromJdbcUrlThrowsForUnknownOrEmpty() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcAttemptStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No attempt store found"));
    assertThrows(IllegalArgumentException.class, () -> JdbcAttemptStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcAttemptStores.detect((String) null));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = TestDatabases.h2();
    assertEquals("h2", JdbcAttemptStores.detect(ds).name());
  }

  @Test
  void detectWithCodecReturnsNewInstance() {
    JdbcDataSource ds = TestDatabases.h2();
    AbstractJdbcAttemptStore registered = JdbcAttemptStores.get("h2");

    AbstractJdbcAttemptStore store = JdbcAttemptStores.detect(ds, JsonCodec.getDefault());

    assertEquals("h2", store.name());
    assertNotSame(registered, store);
  }

  @Test
  void schemaResourcesExistForEveryStore() {
    for (AbstractJdbcAttemptStore store : JdbcAttemptStores.all()) {
      assertNotNull(getClass().getClassLoader().getResource(store.schemaResource()),
          store.schemaResource());
    }
  }
}
