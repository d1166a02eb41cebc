package works.cairn.coercion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import works.cairn.exceptions.ArgumentBindingException;

/**
 * The actual arguments of a call: positional arguments in order,
 * followed by keyword arguments in the order they were given.
 * Either may contain nulls.
 */
public final class Arguments {
	private final List<Object> positional;
	private final Map<String, Object> keywords;

	private Arguments(List<Object> positional, Map<String, Object> keywords) {
		this.positional = Collections.unmodifiableList(positional);
		this.keywords = Collections.unmodifiableMap(keywords);
	}

	public static Arguments of(@Nullable Object... positional) {
		return new Arguments(new ArrayList<>(Arrays.asList(positional)), new LinkedHashMap<>());
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<Object> positional() {
		return positional;
	}

	public Map<String, Object> keywords() {
		return keywords;
	}

	public static final class Builder {
		private final List<Object> positional = new ArrayList<>();
		private final Map<String, Object> keywords = new LinkedHashMap<>();

		private Builder() { }

		public Builder positional(@Nullable Object... values) {
			positional.addAll(Arrays.asList(values));
			return this;
		}

		/**
		 * @throws ArgumentBindingException if {@code name} was already given
		 */
		public Builder keyword(String name, @Nullable Object value) {
			if (keywords.containsKey(name)) {
				throw new ArgumentBindingException("Keyword argument repeated: " + name);
			}
			keywords.put(name, value);
			return this;
		}

		public Arguments build() {
			return new Arguments(new ArrayList<>(positional), new LinkedHashMap<>(keywords));
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Arguments)) {
			return false;
		}
		Arguments other = (Arguments) o;
		return positional.equals(other.positional) && keywords.equals(other.keywords);
	}

	@Override
	public int hashCode() {
		return Objects.hash(positional, keywords);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("(");
		String separator = "";
		for (Object value : positional) {
			sb.append(separator).append(value);
			separator = ", ";
		}
		for (Map.Entry<String, Object> entry : keywords.entrySet()) {
			sb.append(separator).append(entry.getKey()).append("=").append(entry.getValue());
			separator = ", ";
		}
		return sb.append(")").toString();
	}
}
