package works.cairn.exceptions;

/**
 * A value handed to a constructor or {@link works.cairn.coercion.Coercer} has the wrong type or shape.
 */
public class ValidationException extends IllegalArgumentException {
	public ValidationException(String message) {
		super(message);
	}

	public ValidationException(String message, Throwable cause) {
		super(message, cause);
	}
}
