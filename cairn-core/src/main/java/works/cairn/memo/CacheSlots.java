package works.cairn.memo;

import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import works.cairn.hash.Digest;

/**
 * The cached values of one {@link Memoized} instance.
 * <p>
 * A property slot holds at most one value, written once.
 * A method slot holds a table from argument {@link Digest} to result, with no eviction.
 * <p>
 * Thread-safe, but population isn't atomic: concurrent first reads
 * may each run the computation, and the first result stored wins.
 * Slots are never populated inside {@code computeIfAbsent},
 * so a computation can read other cached attributes of the same instance.
 */
public final class CacheSlots {
	private final ConcurrentHashMap<SlotKey, Object> properties = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<SlotKey, ConcurrentHashMap<Digest, Object>> methodTables = new ConcurrentHashMap<>();

	/**
	 * @return whether {@code owner}'s attribute {@code name} has any cached value for this instance
	 */
	public boolean isPopulated(Class<?> owner, String name) {
		SlotKey key = new SlotKey(owner, name);
		if (properties.containsKey(key)) {
			return true;
		}
		ConcurrentHashMap<Digest, Object> table = methodTables.get(key);
		return table != null && !table.isEmpty();
	}

	/**
	 * @return the number of distinct argument lists cached for {@code owner}'s method {@code name}
	 */
	public int methodEntryCount(Class<?> owner, String name) {
		ConcurrentHashMap<Digest, Object> table = methodTables.get(new SlotKey(owner, name));
		return (table == null) ? 0 : table.size();
	}

	/**
	 * @return the stored value, or {@link #ABSENT}
	 */
	Object property(SlotKey key) {
		return unmask(properties.getOrDefault(key, ABSENT));
	}

	/**
	 * @return the value now stored, which is {@code value} unless another thread got there first
	 */
	@Nullable Object storeProperty(SlotKey key, @Nullable Object value) {
		Object existing = properties.putIfAbsent(key, mask(value));
		return (existing == null) ? value : unmask(existing);
	}

	/**
	 * @return the stored result, or {@link #ABSENT}
	 */
	Object methodResult(SlotKey key, Digest arguments) {
		ConcurrentHashMap<Digest, Object> table = methodTables.get(key);
		if (table == null) {
			return ABSENT;
		}
		return unmask(table.getOrDefault(arguments, ABSENT));
	}

	@Nullable Object storeMethodResult(SlotKey key, Digest arguments, @Nullable Object value) {
		ConcurrentHashMap<Digest, Object> table = methodTables.computeIfAbsent(key, k -> new ConcurrentHashMap<>());
		Object existing = table.putIfAbsent(arguments, mask(value));
		return (existing == null) ? value : unmask(existing);
	}

	private static Object mask(@Nullable Object value) {
		return (value == null) ? NULL : value;
	}

	private static @Nullable Object unmask(Object value) {
		return (value == NULL) ? null : value;
	}

	static final Object ABSENT = new Object();

	/**
	 * {@link ConcurrentHashMap} can't hold nulls.
	 */
	private static final Object NULL = new Object();

	@Override
	public String toString() {
		return "CacheSlots{properties=" + properties.keySet() + ", methods=" + methodTables.keySet() + "}";
	}
}
