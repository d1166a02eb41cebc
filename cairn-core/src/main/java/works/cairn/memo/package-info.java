/**
 * Per-instance memoization of methods and computed properties.
 * <p>
 * A class lists its cached attributes in {@link works.cairn.annotations.Cache @Cache},
 * implements {@link works.cairn.memo.Memoized}, and creates a {@link works.cairn.memo.CacheMeta}
 * from which it obtains a {@link works.cairn.memo.CachedProperty} or {@link works.cairn.memo.CachedMethod}
 * for each attribute.
 * Method results are keyed by the {@link works.cairn.hash.CanonicalHash canonical digest}
 * of the arguments after {@link works.cairn.coercion coercion}.
 */
package works.cairn.memo;
