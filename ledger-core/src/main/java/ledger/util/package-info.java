/**
 * Small utilities: JSON codec, thread factory and glob matching.
 */
package ledger.util;
