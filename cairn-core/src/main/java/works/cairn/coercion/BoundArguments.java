package works.cairn.coercion;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import works.cairn.FrozenMapping;
import works.cairn.exceptions.UsageException;

/**
 * The value of every parameter of a {@link Signature}, in parameter order.
 * The {@link ParameterKind#VAR_POSITIONAL} parameter holds a {@link PVector},
 * and the {@link ParameterKind#VAR_KEYWORD} parameter holds a {@link FrozenMapping}.
 */
public final class BoundArguments {
	private final Signature signature;
	private final LinkedHashMap<String, Object> values;

	BoundArguments(Signature signature, LinkedHashMap<String, Object> values) {
		this.signature = signature;
		this.values = values;
	}

	public Signature signature() {
		return signature;
	}

	/**
	 * @throws UsageException if the signature has no parameter called {@code name}
	 */
	public @Nullable Object get(String name) {
		if (!values.containsKey(name)) {
			throw new UsageException(signature.name() + " has no parameter " + name);
		}
		return values.get(name);
	}

	/**
	 * @return the parameter values in parameter order
	 */
	public List<Object> values() {
		return Collections.unmodifiableList(new ArrayList<>(values.values()));
	}

	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(values);
	}

	/**
	 * @param parameterTypes the declared types of the method's parameters, in the same order as the signature's
	 * @return the values laid out for a reflective call: the variadic positional tail as an array
	 * of the declared component type, and the variadic keyword tail as a {@link FrozenMapping}
	 * or a read-only {@link Map}, whichever is declared
	 */
	public Object[] invocationArguments(Class<?>[] parameterTypes) {
		List<ParameterSpec> parameters = signature.parameters();
		if (parameterTypes.length != parameters.size()) {
			throw new UsageException("Expected " + parameters.size() + " parameter types for " + signature.name() + "; got " + parameterTypes.length);
		}
		Object[] result = new Object[parameters.size()];
		for (int i = 0; i < result.length; i++) {
			ParameterSpec p = parameters.get(i);
			Object value = values.get(p.name());
			switch (p.kind()) {
				case VAR_POSITIONAL -> {
					List<?> tail = (List<?>) value;
					Object array = Array.newInstance(parameterTypes[i].getComponentType(), tail.size());
					for (int j = 0; j < tail.size(); j++) {
						Array.set(array, j, tail.get(j));
					}
					result[i] = array;
				}
				case VAR_KEYWORD -> {
					FrozenMapping<?, ?> tail = (FrozenMapping<?, ?>) value;
					result[i] = (parameterTypes[i] == FrozenMapping.class) ? tail : tail.asMap();
				}
				default -> result[i] = value;
			}
		}
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof BoundArguments)) {
			return false;
		}
		BoundArguments other = (BoundArguments) o;
		return signature == other.signature && values.equals(other.values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return signature.name() + values;
	}
}
