/**
 * The exceptions thrown by Cairn.
 * <p>
 * Everything here is unchecked, and each class extends the JDK exception
 * closest in meaning, so callers who don't care about the distinction
 * can catch {@link java.lang.IllegalArgumentException},
 * {@link java.util.NoSuchElementException} and so on.
 */
package works.cairn.exceptions;
