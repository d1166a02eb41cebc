package works.cairn.coercion;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.FrozenMapping;
import works.cairn.annotations.Coerce;
import works.cairn.annotations.KeywordOnly;
import works.cairn.annotations.NullDefault;
import works.cairn.annotations.PositionalOnly;
import works.cairn.annotations.VarKeyword;
import works.cairn.exceptions.ArgumentBindingException;
import works.cairn.exceptions.UsageException;
import works.cairn.exceptions.ValidationException;
import works.cairn.strict.TupleOf;

import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.joining;
import static works.cairn.coercion.ParameterKind.KEYWORD_ONLY;
import static works.cairn.coercion.ParameterKind.POSITIONAL_ONLY;
import static works.cairn.coercion.ParameterKind.POSITIONAL_OR_KEYWORD;
import static works.cairn.coercion.ParameterKind.VAR_KEYWORD;
import static works.cairn.coercion.ParameterKind.VAR_POSITIONAL;

/**
 * The parameters of a callable, with the {@link Coercer}s that normalize their arguments.
 * <p>
 * Arguments are matched to parameters as follows:
 * positional arguments fill the positional parameters in order, with any extras going to
 * the {@link ParameterKind#VAR_POSITIONAL} parameter; keyword arguments are matched by name,
 * with any unmatched ones going to the {@link ParameterKind#VAR_KEYWORD} parameter.
 * <p>
 * The positional parameters must come first, positional-only before positional-or-keyword,
 * and once one of them has a default, all subsequent ones must too.
 * Java requires varargs to be last, so the remaining kinds may appear in any order.
 * There may be at most one variadic parameter of each kind.
 */
public final class Signature {
	private final String name;
	private final List<ParameterSpec> parameters;
	private final Map<String, ParameterSpec> parametersByName;
	private final List<ParameterSpec> positionalParameters;
	private final @Nullable ParameterSpec varPositional;
	private final @Nullable ParameterSpec varKeyword;

	private Signature(String name, List<ParameterSpec> parameters) {
		this.name = name;
		this.parameters = unmodifiableList(new ArrayList<>(parameters));
		this.parametersByName = new HashMap<>();
		List<ParameterSpec> positional = new ArrayList<>();
		ParameterSpec varPositional = null;
		ParameterSpec varKeyword = null;
		ParameterKind previousPositionalKind = POSITIONAL_ONLY;
		boolean seenNonPositional = false;
		boolean seenDefault = false;
		for (ParameterSpec p : parameters) {
			if (parametersByName.put(p.name(), p) != null) {
				throw new UsageException("Duplicate parameter name in " + name + ": " + p.name());
			}
			ParameterKind kind = p.kind();
			if (kind.isPositional()) {
				if (seenNonPositional) {
					throw new UsageException("Positional parameter " + p.name() + " of " + name + " follows a non-positional parameter");
				}
				if (kind.compareTo(previousPositionalKind) < 0) {
					throw new UsageException("Positional-only parameter " + p.name() + " of " + name + " follows a positional-or-keyword parameter");
				}
				if (seenDefault && !p.hasDefault()) {
					throw new UsageException("Parameter " + p.name() + " of " + name + " without a default follows a parameter with a default");
				}
				previousPositionalKind = kind;
				seenDefault |= p.hasDefault();
				positional.add(p);
			} else {
				seenNonPositional = true;
				if (kind.isVariadic() && p.hasDefault()) {
					throw new UsageException("Variadic parameter " + p.name() + " of " + name + " can't have a default");
				}
				if (kind == VAR_POSITIONAL) {
					if (varPositional != null) {
						throw new UsageException(name + " has more than one variadic positional parameter");
					}
					varPositional = p;
				} else if (kind == VAR_KEYWORD) {
					if (varKeyword != null) {
						throw new UsageException(name + " has more than one variadic keyword parameter");
					}
					varKeyword = p;
				}
			}
		}
		this.positionalParameters = unmodifiableList(positional);
		this.varPositional = varPositional;
		this.varKeyword = varKeyword;
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public static Signature of(Method method) {
		return of(method, ParameterNameMode.REQUIRE);
	}

	/**
	 * Derives a signature from the parameters of {@code method} and their annotations.
	 * Every parameter is {@link ParameterKind#POSITIONAL_OR_KEYWORD} unless it's
	 * {@link PositionalOnly @PositionalOnly}, {@link KeywordOnly @KeywordOnly},
	 * {@link VarKeyword @VarKeyword}, or the varargs parameter.
	 */
	public static Signature of(Method method, ParameterNameMode nameMode) {
		String methodName = method.getDeclaringClass().getSimpleName() + "." + method.getName();
		Parameter[] javaParameters = method.getParameters();
		List<ParameterSpec> specs = new ArrayList<>(javaParameters.length);
		boolean warned = false;
		for (int i = 0; i < javaParameters.length; i++) {
			Parameter p = javaParameters[i];
			ParameterKind kind = kindOf(methodName, p, method.isVarArgs() && i == javaParameters.length - 1);
			if (!p.isNamePresent()) {
				switch (nameMode) {
					case REQUIRE -> throw new UsageException("Parameter names of " + methodName + " are unavailable; compile with -parameters");
					case POSITIONAL_ONLY -> {
						if (kind == KEYWORD_ONLY) {
							throw new UsageException("Parameter names of " + methodName + " are unavailable, so parameter " + i + " can't be keyword-only");
						}
						if (!warned) {
							LOGGER.warn("Parameter names of {} are unavailable; its positional parameters will be positional-only", methodName);
							warned = true;
						}
						if (kind == POSITIONAL_OR_KEYWORD) {
							kind = POSITIONAL_ONLY;
						}
					}
				}
			}
			Coercer<?> coercer = coercerOf(methodName, p);
			if (p.isAnnotationPresent(NullDefault.class)) {
				if (p.getType().isPrimitive()) {
					throw new UsageException("Primitive parameter " + p.getName() + " of " + methodName + " can't default to null");
				}
				specs.add(ParameterSpec.withDefault(p.getName(), kind, coercer, null));
			} else {
				specs.add(ParameterSpec.required(p.getName(), kind, coercer));
			}
		}
		return new Signature(methodName, specs);
	}

	private static ParameterKind kindOf(String methodName, Parameter p, boolean isVarArgs) {
		boolean positionalOnly = p.isAnnotationPresent(PositionalOnly.class);
		boolean keywordOnly = p.isAnnotationPresent(KeywordOnly.class);
		boolean varKeyword = p.isAnnotationPresent(VarKeyword.class);
		int annotationCount = (positionalOnly ? 1 : 0) + (keywordOnly ? 1 : 0) + (varKeyword ? 1 : 0);
		if (annotationCount > 1 || (isVarArgs && annotationCount > 0)) {
			throw new UsageException("Conflicting parameter kinds for " + p.getName() + " of " + methodName);
		}
		if (isVarArgs) {
			return VAR_POSITIONAL;
		} else if (varKeyword) {
			if (p.getType() != Map.class && p.getType() != FrozenMapping.class) {
				throw new UsageException("@VarKeyword parameter " + p.getName() + " of " + methodName + " must be a Map or FrozenMapping, not " + p.getType().getSimpleName());
			}
			return VAR_KEYWORD;
		} else if (positionalOnly) {
			return POSITIONAL_ONLY;
		} else if (keywordOnly) {
			return KEYWORD_ONLY;
		} else {
			return POSITIONAL_OR_KEYWORD;
		}
	}

	private static @Nullable Coercer<?> coercerOf(String methodName, Parameter p) {
		Coerce annotation = p.getAnnotation(Coerce.class);
		if (annotation == null) {
			return null;
		}
		Class<?> coercerClass = annotation.value();
		if (!Coercer.class.isAssignableFrom(coercerClass)) {
			throw new UsageException("@Coerce on " + p.getName() + " of " + methodName + " names " + coercerClass.getSimpleName() + ", which is not a Coercer");
		}
		try {
			return (Coercer<?>) coercerClass.getDeclaredConstructor().newInstance();
		} catch (InstantiationException | IllegalAccessException | InvocationTargetException | NoSuchMethodException e) {
			throw new UsageException("Unable to instantiate coercer " + coercerClass.getSimpleName() + " for " + p.getName() + " of " + methodName, e);
		}
	}

	public String name() {
		return name;
	}

	public List<ParameterSpec> parameters() {
		return parameters;
	}

	public @Nullable ParameterSpec parameter(String name) {
		return parametersByName.get(name);
	}

	/**
	 * Matches {@code arguments} to parameters and fills in defaults.
	 *
	 * @throws ArgumentBindingException if the arguments don't fit this signature
	 */
	public BoundArguments bind(Arguments arguments) {
		List<Object> positional = arguments.positional();
		Map<String, Object> assigned = new HashMap<>();
		int numPositional = Math.min(positional.size(), positionalParameters.size());
		for (int i = 0; i < numPositional; i++) {
			assigned.put(positionalParameters.get(i).name(), positional.get(i));
		}

		List<Object> extraPositional = positional.subList(numPositional, positional.size());
		if (!extraPositional.isEmpty() && varPositional == null) {
			throw new ArgumentBindingException(name + " takes " + positionalParameters.size()
				+ " positional arguments but " + positional.size() + " were given");
		}

		Map<String, Object> extraKeywords = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : arguments.keywords().entrySet()) {
			String keyword = entry.getKey();
			ParameterSpec p = parametersByName.get(keyword);
			if (p != null && p.kind().acceptsKeyword()) {
				if (assigned.containsKey(keyword)) {
					throw new ArgumentBindingException(name + " got multiple values for argument '" + keyword + "'");
				}
				assigned.put(keyword, entry.getValue());
			} else if (varKeyword != null) {
				extraKeywords.put(keyword, entry.getValue());
			} else if (p != null && p.kind() == POSITIONAL_ONLY) {
				throw new ArgumentBindingException(name + " got a positional-only argument passed as keyword: '" + keyword + "'");
			} else {
				throw new ArgumentBindingException(name + " got an unexpected keyword argument '" + keyword + "'");
			}
		}

		LinkedHashMap<String, Object> values = new LinkedHashMap<>();
		List<String> missing = new ArrayList<>();
		for (ParameterSpec p : parameters) {
			switch (p.kind()) {
				case VAR_POSITIONAL -> values.put(p.name(), TreePVector.from(extraPositional));
				case VAR_KEYWORD -> values.put(p.name(), FrozenMapping.copyOf(extraKeywords));
				default -> {
					if (assigned.containsKey(p.name())) {
						values.put(p.name(), assigned.get(p.name()));
					} else if (p.hasDefault()) {
						values.put(p.name(), p.defaultValue());
					} else {
						missing.add(p.name());
					}
				}
			}
		}
		if (!missing.isEmpty()) {
			throw new ArgumentBindingException(name + " is missing required arguments: "
				+ missing.stream().map(s -> "'" + s + "'").collect(joining(", ")));
		}
		return new BoundArguments(this, values);
	}

	/**
	 * Applies each parameter's coercer to its bound value.
	 * A parameter with a default whose value is {@code null} is left alone.
	 *
	 * @throws ValidationException if any coercer fails; this is the coercer's own exception
	 * if it threw a {@link ValidationException}, or one naming the parameter otherwise
	 */
	public BoundArguments coerce(BoundArguments bound) {
		LinkedHashMap<String, Object> values = new LinkedHashMap<>();
		for (ParameterSpec p : parameters) {
			Object value = bound.get(p.name());
			Coercer<?> coercer = p.coercer();
			if (coercer == null || (p.hasDefault() && value == null)) {
				values.put(p.name(), value);
				continue;
			}
			Object coerced;
			try {
				coerced = coercer.coerce(value);
			} catch (ValidationException e) {
				throw e;
			} catch (RuntimeException e) {
				throw new ValidationException("Invalid argument for parameter " + p.name() + " of " + name + ": " + e.getMessage(), e);
			}
			values.put(p.name(), normalized(p, coerced));
		}
		return new BoundArguments(this, values);
	}

	/**
	 * Coercers of variadic parameters may return any sequence or mapping;
	 * this converts them back to the representation {@link #bind} produces.
	 */
	private static @Nullable Object normalized(ParameterSpec p, @Nullable Object value) {
		return switch (p.kind()) {
			case VAR_POSITIONAL -> (value instanceof PVector) ? value : TupleOf.plain().coerce(value);
			case VAR_KEYWORD -> (value instanceof FrozenMapping) ? value : FrozenMapping.from(value);
			default -> value;
		};
	}

	public BoundArguments bindAndCoerce(Arguments arguments) {
		return coerce(bind(arguments));
	}

	@Override
	public String toString() {
		StringJoiner joiner = new StringJoiner(", ", name + "(", ")");
		ParameterKind previous = null;
		for (ParameterSpec p : parameters) {
			if (previous == POSITIONAL_ONLY && p.kind() != POSITIONAL_ONLY) {
				joiner.add("/");
			}
			if (p.kind() == KEYWORD_ONLY && previous != KEYWORD_ONLY && varPositional == null) {
				joiner.add("*");
			}
			joiner.add(p.toString());
			previous = p.kind();
		}
		if (previous == POSITIONAL_ONLY) {
			joiner.add("/");
		}
		return joiner.toString();
	}

	public static final class Builder {
		private final String name;
		private final List<ParameterSpec> parameters = new ArrayList<>();

		private Builder(String name) {
			this.name = name;
		}

		public Builder parameter(ParameterSpec spec) {
			parameters.add(spec);
			return this;
		}

		public Builder parameter(String name, ParameterKind kind) {
			return parameter(ParameterSpec.required(name, kind, null));
		}

		public Builder parameter(String name, ParameterKind kind, @Nullable Coercer<?> coercer) {
			return parameter(ParameterSpec.required(name, kind, coercer));
		}

		public Builder parameter(String name, ParameterKind kind, @Nullable Coercer<?> coercer, @Nullable Object defaultValue) {
			return parameter(ParameterSpec.withDefault(name, kind, coercer, defaultValue));
		}

		/**
		 * @throws UsageException if the parameters are not in a valid order
		 */
		public Signature build() {
			return new Signature(name, parameters);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Signature.class);
}
