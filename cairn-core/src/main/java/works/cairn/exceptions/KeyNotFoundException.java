package works.cairn.exceptions;

import java.util.NoSuchElementException;

public class KeyNotFoundException extends NoSuchElementException {
	private final transient Object key;

	public Object key() {
		return this.key;
	}

	public KeyNotFoundException(Object key) {
		super("No such key: " + key);
		this.key = key;
	}
}
