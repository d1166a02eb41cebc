package works.cairn.hash;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.cairn.Complex;
import works.cairn.exceptions.UnhashableValueException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Computes a {@link Digest} of a value that is stable across calls, threads,
 * and process restarts, so it can serve as a durable cache key.
 * <p>
 * Every value is encoded as {@link #ENCODING_VERSION}, then its {@link Kind} tag,
 * then a kind-specific payload, and the result is hashed with SHA-1.
 * Containers encode the digests of their elements rather than the elements themselves:
 * <ul>
 *     <li>
 *         {@link Kind#SEQUENCE sequences} in order, so swapping two unequal elements changes the digest;
 *     </li>
 *     <li>
 *         {@link Kind#SET sets} and {@link Kind#MAPPING mappings} sorted by digest,
 *         so iteration order has no effect.
 *     </li>
 * </ul>
 *
 * A {@link Digestible} supplies its own digest. Anything else without a {@link Kind}
 * throws {@link UnhashableValueException}.
 */
public final class CanonicalHash {
	/**
	 * Changing the encoding of any kind invalidates every digest ever stored.
	 * If that's ever necessary, bump this.
	 */
	public static final byte ENCODING_VERSION = 1;

	private CanonicalHash() { }

	public static Digest of(@Nullable Object value) {
		if (value instanceof Digestible) {
			return requireNonNull(((Digestible) value).digest(), () -> "Null digest from " + value.getClass().getName());
		}
		Kind kind = Kind.ofValue(value);
		if (kind == null) {
			throw new UnhashableValueException(value.getClass());
		}
		Encoder encoder = new Encoder(kind);
		switch (kind) {
			case NONE -> { }
			case BOOLEAN -> encoder.writeByte(((Boolean) value) ? 1 : 0);
			case INTEGER -> encoder.writeInteger(bigIntegerValue((Number) value));
			case FLOAT -> encoder.writeDouble(((Number) value).doubleValue());
			case COMPLEX -> {
				Complex c = (Complex) value;
				encoder.writeDouble(c.real());
				encoder.writeDouble(c.imaginary());
			}
			case TEXT -> encoder.writeBytes(((String) value).getBytes(UTF_8));
			case BYTES -> encoder.writeBytes((byte[]) value);
			case SEQUENCE -> encoder.writeDigests(elementDigests((Collection<?>) value));
			case SET -> encoder.writeDigests(sorted(elementDigests((Collection<?>) value)));
			case MAPPING -> encoder.writeDigests(sorted(pairDigests((Map<?, ?>) value)));
			case TYPE -> {
				Class<?> type = (Class<?>) value;
				Kind named = Kind.ofType(type);
				if (named == null) {
					throw new UnhashableValueException(type, "Unhashable type " + type.getName());
				}
				encoder.writeByte(named.tag);
			}
		}
		return encoder.finish();
	}

	/**
	 * @return the digest {@link #of} would compute for an immutable sequence
	 * with the given elements. Saves copying {@code elements} just to hash them.
	 */
	public static Digest sequence(List<?> elements) {
		Encoder encoder = new Encoder(Kind.SEQUENCE);
		encoder.writeDigests(elementDigests(elements));
		return encoder.finish();
	}

	/**
	 * @return the digest {@link #of} would compute for an immutable map with the given entries.
	 */
	public static Digest mapping(Map<?, ?> entries) {
		Encoder encoder = new Encoder(Kind.MAPPING);
		encoder.writeDigests(sorted(pairDigests(entries)));
		return encoder.finish();
	}

	private static List<Digest> elementDigests(Collection<?> elements) {
		List<Digest> result = new ArrayList<>(elements.size());
		for (Object element : elements) {
			result.add(of(element));
		}
		return result;
	}

	private static List<Digest> pairDigests(Map<?, ?> entries) {
		List<Digest> result = new ArrayList<>(entries.size());
		entries.forEach((k, v) -> {
			Encoder pair = new Encoder(null);
			pair.writeDigest(of(k));
			pair.writeDigest(of(v));
			result.add(pair.finish());
		});
		return result;
	}

	private static List<Digest> sorted(List<Digest> digests) {
		digests.sort(null);
		return digests;
	}

	private static BigInteger bigIntegerValue(Number n) {
		if (n instanceof BigInteger) {
			return (BigInteger) n;
		} else {
			return BigInteger.valueOf(n.longValue());
		}
	}

	/**
	 * Feeds the canonical encoding of a single node to a {@link MessageDigest}.
	 */
	private static final class Encoder {
		private final MessageDigest md;

		/**
		 * @param kind null for the untagged pair nodes of a mapping
		 */
		Encoder(@Nullable Kind kind) {
			try {
				md = MessageDigest.getInstance(ALGORITHM);
			} catch (NoSuchAlgorithmException e) {
				throw new IllegalStateException("Every Java platform is required to support " + ALGORITHM, e);
			}
			md.update(ENCODING_VERSION);
			if (kind != null) {
				md.update(kind.tag);
			}
		}

		void writeByte(int b) {
			md.update((byte) b);
		}

		void writeInt(int value) {
			md.update((byte) (value >>> 24));
			md.update((byte) (value >>> 16));
			md.update((byte) (value >>> 8));
			md.update((byte) value);
		}

		void writeLong(long value) {
			writeInt((int) (value >>> 32));
			writeInt((int) value);
		}

		void writeDouble(double value) {
			writeLong(Double.doubleToLongBits(value));
		}

		void writeBytes(byte[] bytes) {
			writeInt(bytes.length);
			md.update(bytes);
		}

		/**
		 * Sign, then magnitude.
		 */
		void writeInteger(BigInteger value) {
			writeByte(value.signum());
			writeBytes(value.abs().toByteArray());
		}

		void writeDigest(Digest digest) {
			md.update(digest.rawBytes());
		}

		void writeDigests(List<Digest> digests) {
			writeInt(digests.size());
			digests.forEach(this::writeDigest);
		}

		Digest finish() {
			return Digest.wrap(md.digest());
		}
	}

	private static final String ALGORITHM = "SHA-1";
}
