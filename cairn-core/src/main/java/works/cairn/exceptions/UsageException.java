package works.cairn.exceptions;

/**
 * The library has been used in a way that can never work,
 * such as a malformed declaration. Detectable by the programmer;
 * never the result of runtime data.
 */
public class UsageException extends IllegalStateException {
	public UsageException(String message) {
		super(message);
	}

	public UsageException(String message, Throwable cause) {
		super(message, cause);
	}
}
