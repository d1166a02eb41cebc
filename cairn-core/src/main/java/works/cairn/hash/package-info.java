/**
 * Stable, process-independent digests of values, for use as durable cache keys.
 */
package works.cairn.hash;
