package outreach.budget;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetCounterTest {

  @Test
  void consumeStopsAtCap() {
    BudgetCounter counter = new BudgetCounter(3, 0);

    assertTrue(counter.tryConsume(1));
    assertTrue(counter.tryConsume(2));
    assertFalse(counter.tryConsume(1));
    assertEquals(3, counter.consumed());
    assertEquals(0, counter.remaining());
  }

  @Test
  void rejectedConsumeLeavesCountUnchanged() {
    BudgetCounter counter = new BudgetCounter(3, 2);

    assertFalse(counter.tryConsume(2));
    assertEquals(2, counter.consumed());
  }

  @Test
  void releaseNeverGoesBelowZero() {
    BudgetCounter counter = new BudgetCounter(3, 1);

    counter.release(5);

    assertEquals(0, counter.consumed());
  }

  @Test
  void invalidArgumentsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new BudgetCounter(-1, 0));
    assertThrows(IllegalArgumentException.class, () -> new BudgetCounter(2, 3));
    assertThrows(IllegalArgumentException.class, () -> new BudgetCounter(2, 0).tryConsume(0));
    assertThrows(IllegalArgumentException.class, () -> new BudgetCounter(2, 0).release(0));
  }

  @Test
  void concurrentConsumersNeverExceedCap() throws Exception {
    for (int round = 0; round < 50; round++) {
      BudgetCounter counter = new BudgetCounter(3, 0);
      int threads = 16;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(pool.submit(() -> {
          start.await();
          return counter.tryConsume(1);
        }));
      }
      start.countDown();
      int granted = 0;
      for (Future<Boolean> result : results) {
        if (result.get(5, TimeUnit.SECONDS)) {
          granted++;
        }
      }
      pool.shutdown();

      assertEquals(3, granted);
      assertEquals(3, counter.consumed());
    }
  }
}
