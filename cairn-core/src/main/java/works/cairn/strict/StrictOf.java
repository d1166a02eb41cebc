package works.cairn.strict;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import org.jetbrains.annotations.Nullable;
import works.cairn.coercion.Coercer;
import works.cairn.exceptions.UsageException;

/**
 * The generic strict coercer, parameterized by a type argument
 * rather than a {@link Class} object:
 *
 * <pre>
 * Coercer&lt;Long&gt; strictLong = new StrictOf&lt;Long&gt;() {};
 * </pre>
 *
 * Equivalent to {@link Strict#of} for the erasure of the type argument.
 * A raw subclass has no type argument to go by, and fails on construction.
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class StrictOf<T> implements Coercer<T> {
	private final Coercer<T> delegate;

	@SuppressWarnings("unchecked")
	protected StrictOf() {
		Type superclass = getClass().getGenericSuperclass();
		if (!(superclass instanceof ParameterizedType)) {
			throw new UsageException("StrictOf can't be used without a type parameter: " + getClass().getName());
		}
		Type typeArgument = ((ParameterizedType) superclass).getActualTypeArguments()[0];
		this.delegate = (Coercer<T>) Strict.of(rawClass(typeArgument));
	}

	@Override
	public T coerce(@Nullable Object value) {
		return delegate.coerce(value);
	}

	@Override
	public String name() {
		return delegate.name();
	}

	@Override
	public String toString() {
		return name();
	}

	private static Class<?> rawClass(Type type) {
		if (type instanceof Class) {
			return (Class<?>) type;
		} else if (type instanceof ParameterizedType) {
			return (Class<?>) ((ParameterizedType) type).getRawType();
		} else {
			throw new UsageException("StrictOf needs a concrete type argument, not " + type.getTypeName());
		}
	}
}
