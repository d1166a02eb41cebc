package works.cairn.memo;

import java.lang.invoke.MethodHandle;
import works.cairn.exceptions.IllegalMutationException;

/**
 * An accessor for one attribute listed in {@link works.cairn.annotations.Cache @Cache}.
 * Obtained from {@link CacheMeta}, and shared by every instance of the owner class.
 */
public abstract sealed class CachedAttribute<T extends Memoized, R> permits CachedProperty, CachedMethod {
	final SlotKey key;
	final Class<R> resultType;

	/**
	 * The original method, invoked non-virtually with the receiver as its first argument.
	 */
	final MethodHandle body;

	CachedAttribute(SlotKey key, Class<R> resultType, MethodHandle body) {
		this.key = key;
		this.resultType = resultType;
		this.body = body;
	}

	public String name() {
		return key.name();
	}

	public Class<?> owner() {
		return key.owner();
	}

	public Class<R> resultType() {
		return resultType;
	}

	/**
	 * Always fails: cached attributes are read-only.
	 *
	 * @throws IllegalMutationException always
	 */
	public void set(T instance, Object value) {
		throw new IllegalMutationException("Cached attribute " + key + " can't be set");
	}

	/**
	 * Always fails: cached values can't be evicted.
	 *
	 * @throws IllegalMutationException always
	 */
	public void delete(T instance) {
		throw new IllegalMutationException("Cached attribute " + key + " can't be deleted");
	}

	final R invokeBody(T instance, Object[] arguments) {
		Object[] withReceiver = new Object[arguments.length + 1];
		withReceiver[0] = instance;
		System.arraycopy(arguments, 0, withReceiver, 1, arguments.length);
		Object result;
		try {
			result = body.invokeWithArguments(withReceiver);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to compute cached attribute " + key, e);
		}
		return resultType.cast(result);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + key + ")";
	}
}
