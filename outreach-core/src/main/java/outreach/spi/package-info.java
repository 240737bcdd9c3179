/**
 * Extension points for the outreach engine: research access, generation, delivery,
 * reply signals, persistence and metrics.
 *
 * @see outreach.spi.ResearchStore
 * @see outreach.spi.GenerationService
 * @see outreach.spi.DeliveryService
 * @see outreach.spi.AttemptStore
 */
package outreach.spi;
