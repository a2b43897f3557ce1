/**
 * Micrometer bridge for ledger metrics.
 *
 * @see ledger.micrometer.MicrometerMetricsExporter
 */
package ledger.micrometer;
