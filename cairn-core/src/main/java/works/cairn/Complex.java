package works.cairn;

/**
 * A complex number with double-precision parts.
 * <p>
 * {@link works.cairn.hash.CanonicalHash} gives complex numbers their own kind,
 * so {@code Complex.of(1, 0)} never digests like {@code 1.0} or {@code 1}.
 */
public record Complex(double real, double imaginary) {
	public static Complex of(double real, double imaginary) {
		return new Complex(real, imaginary);
	}

	@Override
	public String toString() {
		return "(" + real + (Double.compare(imaginary, 0.0) < 0 ? "" : "+") + imaginary + "j)";
	}
}
