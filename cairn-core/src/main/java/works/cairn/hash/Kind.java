package works.cairn.hash;

import java.math.BigInteger;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PMap;
import org.pcollections.PSequence;
import org.pcollections.PSet;
import works.cairn.Complex;
import works.cairn.FrozenMapping;

/**
 * The categories of values understood by {@link CanonicalHash}.
 * Each has its own tag byte, so no two kinds share an encoding prefix.
 * <p>
 * Tags are part of the durable encoding. Never renumber them.
 */
public enum Kind {
	NONE(0x00),
	BOOLEAN(0x01),
	INTEGER(0x02),
	FLOAT(0x03),
	COMPLEX(0x04),
	TEXT(0x05),
	BYTES(0x06),
	SEQUENCE(0x07),
	SET(0x08),
	MAPPING(0x09),
	TYPE(0x0A),
	;

	final byte tag;

	Kind(int tag) {
		this.tag = (byte) tag;
	}

	/**
	 * @return the kind of {@code value}, or null if it has none
	 */
	public static @Nullable Kind ofValue(@Nullable Object value) {
		if (value == null) {
			return NONE;
		} else if (value instanceof Boolean) {
			return BOOLEAN;
		} else if (isIntegral(value)) {
			return INTEGER;
		} else if (value instanceof Double || value instanceof Float) {
			return FLOAT;
		} else if (value instanceof Complex) {
			return COMPLEX;
		} else if (value instanceof String) {
			return TEXT;
		} else if (value instanceof byte[]) {
			return BYTES;
		} else if (value instanceof PSequence) {
			return SEQUENCE;
		} else if (value instanceof PSet) {
			return SET;
		} else if (value instanceof PMap) {
			return MAPPING;
		} else if (value instanceof Class) {
			return TYPE;
		} else {
			return null;
		}
	}

	/**
	 * @return the kind whose instances are of type {@code type}, or null if there isn't one
	 */
	public static @Nullable Kind ofType(Class<?> type) {
		if (type == Void.class || type == void.class) {
			return NONE;
		} else if (type == Boolean.class || type == boolean.class) {
			return BOOLEAN;
		} else if (INTEGRAL_TYPES.contains(type)) {
			return INTEGER;
		} else if (FLOATING_TYPES.contains(type)) {
			return FLOAT;
		} else if (type == Complex.class) {
			return COMPLEX;
		} else if (type == String.class) {
			return TEXT;
		} else if (type == byte[].class) {
			return BYTES;
		} else if (PSequence.class.isAssignableFrom(type)) {
			return SEQUENCE;
		} else if (PSet.class.isAssignableFrom(type)) {
			return SET;
		} else if (PMap.class.isAssignableFrom(type) || type == FrozenMapping.class) {
			return MAPPING;
		} else if (type == Class.class) {
			return TYPE;
		} else {
			return null;
		}
	}

	public static boolean isIntegral(Object value) {
		return value instanceof Integer
			|| value instanceof Long
			|| value instanceof Short
			|| value instanceof Byte
			|| value instanceof BigInteger;
	}

	private static final Set<Class<?>> INTEGRAL_TYPES = Set.of(
		Byte.class, Short.class, Integer.class, Long.class, BigInteger.class,
		byte.class, short.class, int.class, long.class);

	private static final Set<Class<?>> FLOATING_TYPES = Set.of(
		Float.class, Double.class, float.class, double.class);
}
