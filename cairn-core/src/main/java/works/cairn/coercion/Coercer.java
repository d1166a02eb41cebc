package works.cairn.coercion;

import org.jetbrains.annotations.Nullable;

/**
 * Validates a value and converts it to some exact type,
 * throwing {@link works.cairn.exceptions.ValidationException} if that's not possible.
 * <p>
 * Coercers must be pure: they're applied to call arguments before those
 * arguments become cache keys, and they may run any number of times.
 */
@FunctionalInterface
public interface Coercer<T> {
	T coerce(@Nullable Object value);

	/**
	 * Used in diagnostics, and to tell apart coercers with different parameters.
	 */
	default String name() {
		return getClass().getSimpleName();
	}
}
