package works.cairn.coercion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import works.cairn.FrozenMapping;
import works.cairn.exceptions.ValidationException;

/**
 * Lenient coercers that parse text, for tests that need conversions
 * the strict coercers refuse to do.
 */
public final class TestCoercers {
	private TestCoercers() { }

	public static final class ToText implements Coercer<String> {
		@Override
		public String coerce(Object value) {
			return String.valueOf(value);
		}

		@Override
		public String name() {
			return "str";
		}
	}

	/**
	 * Throws {@link NumberFormatException} for malformed text.
	 */
	public static final class ToInt implements Coercer<Integer> {
		@Override
		public Integer coerce(Object value) {
			if (value instanceof Number) {
				return ((Number) value).intValue();
			} else {
				return Integer.parseInt(String.valueOf(value));
			}
		}

		@Override
		public String name() {
			return "int";
		}
	}

	public static final class ToBool implements Coercer<Boolean> {
		@Override
		public Boolean coerce(Object value) {
			if (value instanceof Boolean) {
				return (Boolean) value;
			} else if (value instanceof Number) {
				return ((Number) value).doubleValue() != 0;
			} else {
				throw new ValidationException("Not a truth value: " + value);
			}
		}
	}

	public static final class TextElements implements Coercer<List<String>> {
		@Override
		public List<String> coerce(Object value) {
			List<String> result = new ArrayList<>();
			for (Object element : (Iterable<?>) value) {
				result.add(String.valueOf(element));
			}
			return result;
		}
	}

	public static final class TextValues implements Coercer<Map<Object, String>> {
		@Override
		public Map<Object, String> coerce(Object value) {
			Map<Object, String> result = new HashMap<>();
			((FrozenMapping<?, ?>) value).entries().forEach(e -> result.put(e.getKey(), String.valueOf(e.getValue())));
			return result;
		}
	}
}
