package works.cairn.memo;

import java.lang.invoke.MethodHandle;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.coercion.Arguments;
import works.cairn.coercion.BoundArguments;
import works.cairn.coercion.Signature;
import works.cairn.hash.CanonicalHash;
import works.cairn.hash.Digest;

/**
 * A method whose results are cached per instance, keyed by the {@link Digest} of its coerced arguments.
 * <p>
 * Calls that bind to the same normalized arguments share an entry,
 * whether the arguments were passed by position or by name, defaulted,
 * or coerced from different but equivalent values.
 */
public final class CachedMethod<T extends Memoized, R> extends CachedAttribute<T, R> {
	private final Signature signature;
	private final Class<?>[] parameterTypes;

	CachedMethod(SlotKey key, Class<R> resultType, MethodHandle body, Signature signature, Class<?>[] parameterTypes) {
		super(key, resultType, body);
		this.signature = signature;
		this.parameterTypes = parameterTypes.clone();
	}

	public Signature signature() {
		return signature;
	}

	public R call(T instance, @Nullable Object... positional) {
		return call(instance, Arguments.of(positional));
	}

	/**
	 * @throws works.cairn.exceptions.ValidationException if the arguments can't be bound or coerced
	 * @throws works.cairn.exceptions.UnhashableValueException if a coerced argument can't be part of a cache key
	 */
	public R call(T instance, Arguments arguments) {
		BoundArguments coerced = signature.bindAndCoerce(arguments);
		Digest digest = CanonicalHash.sequence(coerced.values());
		CacheSlots slots = instance.cacheSlots();
		Object existing = slots.methodResult(key, digest);
		if (existing != CacheSlots.ABSENT) {
			return resultType.cast(existing);
		}
		LOGGER.trace("Computing {}{}", key, arguments);
		R computed = invokeBody(instance, coerced.invocationArguments(parameterTypes));
		return resultType.cast(slots.storeMethodResult(key, digest, computed));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CachedMethod.class);
}
