package outreach.spi;

import outreach.model.CompanyBudget;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence for per-(company, wave) budgets. The consumed count only changes through
 * {@link #tryConsume} and {@link #release}, both single atomic updates.
 *
 * @see outreach.budget.InMemoryBudgetStore
 * @see outreach.jdbc.store.JdbcBudgetStore
 */
public interface BudgetStore {

  /**
   * Stores the budget unless one already exists for its company and wave.
   *
   * @return the stored budget: the existing one if present, otherwise {@code budget}
   */
  CompanyBudget saveIfAbsent(Connection conn, CompanyBudget budget);

  Optional<CompanyBudget> find(Connection conn, long companyId, String wave);

  /**
   * Adds {@code n} to the consumed count if the result stays within the cap.
   *
   * @return {@code true} if consumed, {@code false} if the cap would be exceeded or no
   *     budget exists
   */
  boolean tryConsume(Connection conn, long companyId, String wave, int n);

  /**
   * Returns {@code n} units of capacity. The consumed count never drops below zero.
   */
  void release(Connection conn, long companyId, String wave, int n);
}
