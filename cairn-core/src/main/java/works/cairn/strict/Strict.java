package works.cairn.strict;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import works.cairn.coercion.Coercer;
import works.cairn.exceptions.ValidationException;
import works.cairn.hash.Kind;

/**
 * Coercers that accept a value only if it already is, in substance, of the target type,
 * and convert it to exactly that type.
 * <p>
 * These never parse text and never truncate:
 * {@code Strict.INT.coerce("1")} and {@code Strict.INT.coerce(1.0)} both fail,
 * while {@code Strict.INT.coerce(1)} returns {@code 1L}.
 */
public final class Strict {
	private Strict() { }

	/**
	 * Accepts any integral value and returns a {@link Long}.
	 */
	public static final Coercer<Long> INT = new StrictCoercer<>("strictint", Strict::toLong);

	/**
	 * Accepts any integral or floating-point value and returns a {@link Double}.
	 */
	public static final Coercer<Double> FLOAT = new StrictCoercer<>("strictfloat", Strict::toDouble);

	/**
	 * Accepts only {@link String}s.
	 */
	public static final Coercer<String> STR = new StrictCoercer<>("strictstr", v -> instance(String.class, v));

	/**
	 * The strict constructor of {@code type}.
	 * <p>
	 * Numeric types accept the values they can represent exactly,
	 * and {@link String} accepts only strings, as for {@link #INT}, {@link #FLOAT} and {@link #STR}.
	 * Every other type accepts only its own instances.
	 * Primitive types are treated as their boxed counterparts.
	 */
	@SuppressWarnings("unchecked")
	public static <T> Coercer<T> of(Class<T> type) {
		Class<T> boxed = (Class<T>) boxed(type);
		Function<Object, ?> constructor = CONSTRUCTORS.get(boxed);
		if (constructor == null) {
			return new StrictCoercer<>("strict[" + boxed.getSimpleName() + "]", v -> instance(boxed, v));
		} else {
			return new StrictCoercer<>("strict[" + boxed.getSimpleName() + "]", (Function<Object, T>) constructor);
		}
	}

	private static Long toLong(@Nullable Object value) {
		BigInteger big = toBigInteger(value);
		if (big.bitLength() >= Long.SIZE) {
			throw new ValidationException("Integer out of range for Long: " + big);
		}
		return big.longValue();
	}

	private static Function<Object, Object> narrowInteger(long min, long max, Function<Long, Object> cast) {
		return value -> {
			long l = toLong(value);
			if (l < min || l > max) {
				throw new ValidationException("Integer out of range [" + min + ", " + max + "]: " + l);
			}
			return cast.apply(l);
		};
	}

	private static BigInteger toBigInteger(@Nullable Object value) {
		if (value instanceof BigInteger) {
			return (BigInteger) value;
		} else if (value != null && Kind.isIntegral(value)) {
			return BigInteger.valueOf(((Number) value).longValue());
		} else {
			throw mismatch("an integer", value);
		}
	}

	private static Double toDouble(@Nullable Object value) {
		if (value instanceof Double) {
			return (Double) value;
		} else if (value instanceof Float) {
			return ((Float) value).doubleValue();
		} else if (value instanceof BigInteger) {
			double result = ((BigInteger) value).doubleValue();
			if (Double.isInfinite(result)) {
				throw new ValidationException("Integer out of range for Double: " + value);
			}
			return result;
		} else if (value != null && Kind.isIntegral(value)) {
			return (double) ((Number) value).longValue();
		} else {
			throw mismatch("a real number", value);
		}
	}

	private static Float toFloat(@Nullable Object value) {
		if (value instanceof Float) {
			return (Float) value;
		} else if (value != null && Kind.isIntegral(value)) {
			return ((Number) value).floatValue();
		} else {
			throw mismatch("a Float or an integer", value);
		}
	}

	private static <T> T instance(Class<T> type, @Nullable Object value) {
		if (type.isInstance(value)) {
			return type.cast(value);
		} else {
			throw mismatch("an object of type " + type.getSimpleName(), value);
		}
	}

	static ValidationException mismatch(String expected, @Nullable Object value) {
		if (value == null) {
			return new ValidationException("Expected " + expected + " but got null");
		} else {
			return new ValidationException("Expected " + expected + " but got " + value + " of type " + value.getClass().getSimpleName());
		}
	}

	private static Class<?> boxed(Class<?> type) {
		if (!type.isPrimitive()) {
			return type;
		}
		return PRIMITIVE_BOXES.get(type);
	}

	private static final Map<Class<?>, Class<?>> PRIMITIVE_BOXES = Map.of(
		boolean.class, Boolean.class,
		byte.class, Byte.class,
		short.class, Short.class,
		int.class, Integer.class,
		long.class, Long.class,
		float.class, Float.class,
		double.class, Double.class,
		char.class, Character.class,
		void.class, Void.class);

	private static final Map<Class<?>, Function<Object, ?>> CONSTRUCTORS = Map.of(
		Long.class, Strict::toLong,
		Integer.class, narrowInteger(Integer.MIN_VALUE, Integer.MAX_VALUE, Long::intValue),
		Short.class, narrowInteger(Short.MIN_VALUE, Short.MAX_VALUE, Long::shortValue),
		Byte.class, narrowInteger(Byte.MIN_VALUE, Byte.MAX_VALUE, Long::byteValue),
		BigInteger.class, Strict::toBigInteger,
		Double.class, Strict::toDouble,
		Float.class, Strict::toFloat);

	/**
	 * Equal when the names are equal, so two coercers for the same type compare equal.
	 */
	private static final class StrictCoercer<T> implements Coercer<T> {
		private final String name;
		private final Function<Object, T> constructor;

		StrictCoercer(String name, Function<Object, T> constructor) {
			this.name = name;
			this.constructor = constructor;
		}

		@Override
		public T coerce(@Nullable Object value) {
			return constructor.apply(value);
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
			return Objects.equals(name, ((StrictCoercer<?>) o).name);
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
}
