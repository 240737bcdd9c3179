package outreach.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void delegatesToDataSource() throws Exception {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(TestDatabases.h2());
    try (Connection conn = provider.getConnection()) {
      assertTrue(conn.isValid(1));
    }
  }

  @Test
  void nullDataSourceThrowsNPE() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }
}
