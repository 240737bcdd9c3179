package outreach.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import outreach.jdbc.TestDatabases;
import outreach.model.CompanyBudget;
import outreach.util.DaemonThreadFactory;
import outreach.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcBudgetStoreTest {
  private static final String WAVE = "2025-spring";

  private JdbcDataSource dataSource;
  private Connection conn;
  private JdbcBudgetStore store;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = TestDatabases.h2();
    TestDatabases.createSchema(dataSource, "outreach/jdbc/schema/h2.sql");
    conn = dataSource.getConnection();
    store = new JdbcBudgetStore();
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void saveIfAbsentKeepsFirstBudget() {
    CompanyBudget first = new CompanyBudget(7, WAVE, List.of(3L, 1L, 2L), 3, 0);
    CompanyBudget second = new CompanyBudget(7, WAVE, List.of(1L), 1, 0);

    assertEquals(first, store.saveIfAbsent(conn, first));
    assertEquals(first, store.saveIfAbsent(conn, second));
    assertEquals(List.of(3L, 1L, 2L), store.find(conn, 7, WAVE).orElseThrow().ranking());
  }

  @Test
  void budgetsAreScopedPerWave() {
    store.saveIfAbsent(conn, new CompanyBudget(7, WAVE, List.of(1L), 1, 0));

    assertTrue(store.find(conn, 7, "2025-fall").isEmpty());
    assertTrue(store.find(conn, 8, WAVE).isEmpty());
  }

  @Test
  void tryConsumeStopsAtCap() {
    store.saveIfAbsent(conn, new CompanyBudget(7, WAVE, List.of(1L, 2L, 3L, 4L), 3, 0));

    assertTrue(store.tryConsume(conn, 7, WAVE, 1));
    assertTrue(store.tryConsume(conn, 7, WAVE, 2));
    assertFalse(store.tryConsume(conn, 7, WAVE, 1));
    assertEquals(3, store.find(conn, 7, WAVE).orElseThrow().consumed());
  }

  @Test
  void tryConsumeWithoutBudgetFails() {
    assertFalse(store.tryConsume(conn, 7, WAVE, 1));
  }

  @Test
  void releaseNeverGoesBelowZero() {
    store.saveIfAbsent(conn, new CompanyBudget(7, WAVE, List.of(1L, 2L), 2, 0));
    store.tryConsume(conn, 7, WAVE, 1);

    store.release(conn, 7, WAVE, 1);
    assertEquals(0, store.find(conn, 7, WAVE).orElseThrow().consumed());
    store.release(conn, 7, WAVE, 2);
    assertEquals(0, store.find(conn, 7, WAVE).orElseThrow().consumed());
    assertTrue(store.tryConsume(conn, 7, WAVE, 2));
  }

  @Test
  void nonPositiveUnitsRejected() {
    assertThrows(IllegalArgumentException.class, () -> store.tryConsume(conn, 7, WAVE, 0));
    assertThrows(IllegalArgumentException.class, () -> store.release(conn, 7, WAVE, -1));
  }

  @Test
  void concurrentConsumersNeverExceedCap() throws Exception {
    store.saveIfAbsent(conn, new CompanyBudget(7, WAVE, List.of(1L, 2L, 3L, 4L, 5L), 3, 0));
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads, new DaemonThreadFactory("budget-test-"));
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Integer>> results = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      results.add(pool.submit(() -> {
        start.await();
        int granted = 0;
        try (Connection c = dataSource.getConnection()) {
          for (int j = 0; j < 3; j++) {
            if (store.tryConsume(c, 7, WAVE, 1)) {
              granted++;
            }
          }
        }
        return granted;
      }));
    }
    start.countDown();
    int total = 0;
    for (Future<Integer> result : results) {
      total += result.get(10, TimeUnit.SECONDS);
    }
    pool.shutdown();

    assertEquals(3, total);
    assertEquals(3, store.find(conn, 7, WAVE).orElseThrow().consumed());
  }

  @Test
  void invalidTableNameRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new JdbcBudgetStore("budget-table", JsonCodec.getDefault()));
  }
}
