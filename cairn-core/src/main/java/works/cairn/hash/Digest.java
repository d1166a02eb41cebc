package works.cairn.hash;

import java.util.Arrays;
import java.util.HexFormat;
import org.jetbrains.annotations.NotNull;
import works.cairn.exceptions.ValidationException;

/**
 * The fixed-length output of {@link CanonicalHash}.
 * <p>
 * Digests are totally ordered by unsigned byte value,
 * which is what makes {@link CanonicalHash}'s encoding of unordered collections
 * independent of iteration order.
 */
public final class Digest implements Comparable<Digest> {
	public static final int LENGTH = 20;

	@NotNull
	private final byte[] bytes;

	private Digest(@NotNull byte[] bytes) {
		this.bytes = bytes;
	}

	/**
	 * @param bytes exactly {@link #LENGTH} bytes, used verbatim
	 */
	public static Digest of(byte[] bytes) {
		if (bytes.length != LENGTH) {
			throw new ValidationException("Digest must have " + LENGTH + " bytes, not " + bytes.length);
		}
		return new Digest(bytes.clone());
	}

	public static Digest fromHex(String hex) {
		try {
			return of(HEX.parseHex(hex));
		} catch (IllegalArgumentException e) {
			throw new ValidationException("Malformed digest \"" + hex + "\"", e);
		}
	}

	static Digest wrap(byte[] bytes) {
		if (bytes.length != LENGTH) {
			throw new IllegalStateException("Expected " + LENGTH + " digest bytes; got " + bytes.length);
		}
		return new Digest(bytes);
	}

	public byte[] bytes() {
		return bytes.clone();
	}

	public String hex() {
		return HEX.formatHex(bytes);
	}

	byte[] rawBytes() {
		return bytes;
	}

	@Override
	public int compareTo(Digest other) {
		return Arrays.compareUnsigned(this.bytes, other.bytes);
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Digest that = (Digest) o;
		return Arrays.equals(bytes, that.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return hex();
	}

	private static final HexFormat HEX = HexFormat.of();
}
