package works.cairn.coercion;

/**
 * What {@link Signature#of(java.lang.reflect.Method, ParameterNameMode)} does
 * when a class was compiled without {@code -parameters},
 * so its parameter names are unavailable.
 */
public enum ParameterNameMode {
	/**
	 * Throw {@link works.cairn.exceptions.UsageException}.
	 */
	REQUIRE,

	/**
	 * Treat every unnamed parameter as {@link ParameterKind#POSITIONAL_ONLY}, and log a warning.
	 */
	POSITIONAL_ONLY,
}
