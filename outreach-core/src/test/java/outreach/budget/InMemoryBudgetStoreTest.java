package outreach.budget;

import outreach.model.CompanyBudget;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryBudgetStoreTest {
  private final InMemoryBudgetStore store = new InMemoryBudgetStore();

  @Test
  void firstSavedBudgetWins() {
    CompanyBudget first = new CompanyBudget(1, "w1", List.of(1L, 2L), 2, 0);
    CompanyBudget second = new CompanyBudget(1, "w1", List.of(2L, 1L), 2, 0);

    store.saveIfAbsent(null, first);
    CompanyBudget stored = store.saveIfAbsent(null, second);

    assertEquals(List.of(1L, 2L), stored.ranking());
  }

  @Test
  void consumeAndReleaseAreReflectedInSnapshots() {
    store.saveIfAbsent(null, new CompanyBudget(1, "w1", List.of(1L, 2L), 2, 0));

    assertTrue(store.tryConsume(null, 1, "w1", 1));
    assertTrue(store.tryConsume(null, 1, "w1", 1));
    assertFalse(store.tryConsume(null, 1, "w1", 1));
    assertEquals(2, store.find(null, 1, "w1").orElseThrow().consumed());

    store.release(null, 1, "w1", 1);
    assertEquals(1, store.find(null, 1, "w1").orElseThrow().remaining());
  }

  @Test
  void wavesAreIndependent() {
    store.saveIfAbsent(null, new CompanyBudget(1, "w1", List.of(1L), 1, 0));
    store.saveIfAbsent(null, new CompanyBudget(1, "w2", List.of(1L), 1, 0));

    assertTrue(store.tryConsume(null, 1, "w1", 1));
    assertTrue(store.tryConsume(null, 1, "w2", 1));
  }

  @Test
  void unknownBudgetRejectsConsume() {
    assertFalse(store.tryConsume(null, 9, "w1", 1));
    assertTrue(store.find(null, 9, "w1").isEmpty());
  }
}
