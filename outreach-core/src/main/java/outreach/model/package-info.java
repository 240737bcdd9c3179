/**
 * Immutable domain types: research records, budgets, treatments, attempts and
 * generated messages.
 *
 * <p>Status-like enums that are persisted ({@link outreach.model.AttemptState}) carry a
 * stable integer code, the same way the JDBC stores encode them.
 */
package outreach.model;
