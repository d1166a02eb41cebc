package works.cairn.memo;

import java.lang.invoke.MethodHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A zero-argument {@link works.cairn.annotations.Property @Property} computed at most once per instance,
 * barring races between threads.
 */
public final class CachedProperty<T extends Memoized, R> extends CachedAttribute<T, R> {
	CachedProperty(SlotKey key, Class<R> resultType, MethodHandle body) {
		super(key, resultType, body);
	}

	public R get(T instance) {
		CacheSlots slots = instance.cacheSlots();
		Object existing = slots.property(key);
		if (existing != CacheSlots.ABSENT) {
			return resultType.cast(existing);
		}
		LOGGER.trace("Computing {}", key);
		R computed = invokeBody(instance, NO_ARGUMENTS);
		return resultType.cast(slots.storeProperty(key, computed));
	}

	private static final Object[] NO_ARGUMENTS = new Object[0];
	private static final Logger LOGGER = LoggerFactory.getLogger(CachedProperty.class);
}
