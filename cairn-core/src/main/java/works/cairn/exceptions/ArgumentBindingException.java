package works.cairn.exceptions;

/**
 * The actual arguments of a call can't be bound to the parameters of a
 * {@link works.cairn.coercion.Signature}.
 */
public class ArgumentBindingException extends ValidationException {
	public ArgumentBindingException(String message) {
		super(message);
	}
}
