package works.cairn.memo;

/**
 * Identifies a cached attribute by its declaring class as well as its name,
 * so a subclass attribute never shares a slot with a superclass attribute of the same name.
 */
record SlotKey(Class<?> owner, String name) {
	@Override
	public String toString() {
		return owner.getSimpleName() + "." + name;
	}
}
