package works.cairn.hash;

/**
 * A value that defines its own canonical digest.
 * <p>
 * {@link CanonicalHash} uses the returned digest verbatim,
 * without any kind tag of its own,
 * so implementations are responsible for keeping their digests
 * distinct from those of other kinds. The usual way to do that
 * is to compute them with {@link CanonicalHash} from some
 * canonical representation of the value.
 */
public interface Digestible {
	Digest digest();
}
