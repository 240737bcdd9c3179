/**
 * Wave orchestration: batch classification, bounded-concurrency composition and sends.
 */
package outreach.wave;
