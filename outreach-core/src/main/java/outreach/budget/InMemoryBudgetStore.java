package outreach.budget;

import outreach.model.CompanyBudget;
import outreach.spi.BudgetStore;

import java.sql.Connection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link BudgetStore} held in memory, one {@link BudgetCounter} per company and wave.
 * Connections are ignored. Suitable for single-process runs and tests.
 */
public final class InMemoryBudgetStore implements BudgetStore {
  private final Map<Key, Entry> budgets = new ConcurrentHashMap<>();

  @Override
  public CompanyBudget saveIfAbsent(Connection conn, CompanyBudget budget) {
    Entry entry = budgets.computeIfAbsent(new Key(budget.companyId(), budget.wave()),
        k -> new Entry(budget, new BudgetCounter(budget.cap(), budget.consumed())));
    return entry.snapshot();
  }

  @Override
  public Optional<CompanyBudget> find(Connection conn, long companyId, String wave) {
    Entry entry = budgets.get(new Key(companyId, wave));
    return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
  }

  @Override
  public boolean tryConsume(Connection conn, long companyId, String wave, int n) {
    Entry entry = budgets.get(new Key(companyId, wave));
    return entry != null && entry.counter.tryConsume(n);
  }

  @Override
  public void release(Connection conn, long companyId, String wave, int n) {
    Entry entry = budgets.get(new Key(companyId, wave));
    if (entry != null) {
      entry.counter.release(n);
    }
  }

  private record Key(long companyId, String wave) {
  }

  private record Entry(CompanyBudget budget, BudgetCounter counter) {
    CompanyBudget snapshot() {
      return budget.withConsumed(counter.consumed());
    }
  }
}
