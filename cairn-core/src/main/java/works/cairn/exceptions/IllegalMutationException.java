package works.cairn.exceptions;

public class IllegalMutationException extends UnsupportedOperationException {
	public IllegalMutationException(String message) {
		super(message);
	}
}
