package works.cairn.exceptions;

/**
 * The value has no stable canonical encoding, so it can't be part of a cache key.
 */
public class UnhashableValueException extends IllegalArgumentException {
	private final Class<?> valueClass;

	public Class<?> valueClass() {
		return this.valueClass;
	}

	public UnhashableValueException(Class<?> valueClass) {
		super("Unhashable value of type " + valueClass.getName());
		this.valueClass = valueClass;
	}

	public UnhashableValueException(Class<?> valueClass, String message) {
		super(message);
		this.valueClass = valueClass;
	}
}
