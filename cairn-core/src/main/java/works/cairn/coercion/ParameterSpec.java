package works.cairn.coercion;

import org.jetbrains.annotations.Nullable;

/**
 * @param coercer applied to the argument before the body runs; null means the argument is passed as-is
 * @param hasDefault whether the parameter may be omitted, in which case it gets {@code defaultValue}
 */
public record ParameterSpec(
	String name,
	ParameterKind kind,
	@Nullable Coercer<?> coercer,
	boolean hasDefault,
	@Nullable Object defaultValue
) {
	public static ParameterSpec required(String name, ParameterKind kind, @Nullable Coercer<?> coercer) {
		return new ParameterSpec(name, kind, coercer, false, null);
	}

	public static ParameterSpec withDefault(String name, ParameterKind kind, @Nullable Coercer<?> coercer, @Nullable Object defaultValue) {
		return new ParameterSpec(name, kind, coercer, true, defaultValue);
	}

	@Override
	public String toString() {
		String prefix = switch (kind) {
			case VAR_POSITIONAL -> "*";
			case VAR_KEYWORD -> "**";
			default -> "";
		};
		String suffix = (coercer == null) ? "" : ": " + coercer.name();
		if (hasDefault) {
			suffix += " = " + defaultValue;
		}
		return prefix + name + suffix;
	}
}
