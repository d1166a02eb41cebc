package works.cairn.coercion;

/**
 * How arguments are matched to a parameter, in the order parameters of each kind must appear.
 */
public enum ParameterKind {
	POSITIONAL_ONLY,
	POSITIONAL_OR_KEYWORD,
	VAR_POSITIONAL,
	KEYWORD_ONLY,
	VAR_KEYWORD,
	;

	public boolean isPositional() {
		return this == POSITIONAL_ONLY || this == POSITIONAL_OR_KEYWORD;
	}

	public boolean isVariadic() {
		return this == VAR_POSITIONAL || this == VAR_KEYWORD;
	}

	public boolean acceptsKeyword() {
		return this == POSITIONAL_OR_KEYWORD || this == KEYWORD_ONLY;
	}
}
