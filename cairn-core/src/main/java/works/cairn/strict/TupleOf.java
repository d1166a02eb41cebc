package works.cairn.strict;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.cairn.coercion.Coercer;

/**
 * Builds an immutable {@link PVector}, which {@link works.cairn.hash.CanonicalHash}
 * treats as an ordered sequence, from an {@link Iterable} or an array.
 * <p>
 * With an element coercer, each element is coerced in order,
 * and the first failure propagates.
 */
public final class TupleOf<T> implements Coercer<PVector<T>> {
	private final @Nullable Coercer<? extends T> element;
	private final String name;

	private TupleOf(@Nullable Coercer<? extends T> element, String name) {
		this.element = element;
		this.name = name;
	}

	public static <T> TupleOf<T> of(Coercer<? extends T> element) {
		return new TupleOf<>(element, "tuple[" + element.name() + "]");
	}

	/**
	 * @return a coercer that converts to a {@link PVector} without validating the elements
	 */
	public static TupleOf<Object> plain() {
		return new TupleOf<>(null, "tuple");
	}

	@Override
	@SuppressWarnings("unchecked")
	public PVector<T> coerce(@Nullable Object value) {
		List<T> result = new ArrayList<>();
		for (Object item : items(value)) {
			if (element == null) {
				result.add((T) item);
			} else {
				result.add(element.coerce(item));
			}
		}
		return TreePVector.from(result);
	}

	private static Iterable<?> items(@Nullable Object value) {
		if (value instanceof Iterable) {
			return (Iterable<?>) value;
		} else if (value != null && value.getClass().isArray()) {
			int length = Array.getLength(value);
			List<Object> result = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				result.add(Array.get(value, i));
			}
			return result;
		} else {
			throw Strict.mismatch("an iterable", value);
		}
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return name.equals(((TupleOf<?>) o).name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return name;
	}
}
