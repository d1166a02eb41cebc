package works.cairn.memo;

/**
 * An object with {@link CachedAttribute cached attributes}.
 * Implementations hold a single {@link CacheSlots} for their whole lifetime:
 *
 * <pre>
 * private final CacheSlots cacheSlots = new CacheSlots();
 *
 * &#64;Override
 * public CacheSlots cacheSlots() {
 *     return cacheSlots;
 * }
 * </pre>
 */
public interface Memoized {
	CacheSlots cacheSlots();
}
