package works.cairn.exceptions;

public class InvalidAttributeException extends UsageException {
	private final Class<?> containingClass;
	private final String attributeName;

	public Class<?> containingClass() {
		return this.containingClass;
	}

	public String attributeName() {
		return this.attributeName;
	}

	public InvalidAttributeException(Class<?> containingClass, String attributeName, String message) {
		super(fullMessage(containingClass, message));
		this.containingClass = containingClass;
		this.attributeName = attributeName;
	}

	public InvalidAttributeException(Class<?> containingClass, String attributeName, String message, Throwable cause) {
		super(fullMessage(containingClass, message), cause);
		this.containingClass = containingClass;
		this.attributeName = attributeName;
	}

	private static String fullMessage(Class<?> containingClass, String message) {
		return "Invalid cache declaration in " + containingClass.getSimpleName() + ": " + message;
	}
}
