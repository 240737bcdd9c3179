/**
 * Micrometer bridge for the engine's counters and the follow-up backlog gauge.
 *
 * @see outreach.micrometer.MicrometerMetricsExporter
 */
package outreach.micrometer;
