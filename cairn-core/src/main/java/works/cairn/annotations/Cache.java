package works.cairn.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Lists the members of the annotated class whose results are memoized per instance.
 * <p>
 * Each name must be a method declared by the annotated class itself:
 * either a {@link Property} or an ordinary instance method.
 * The declaration takes effect when the class creates its {@code CacheMeta}.
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface Cache {
	String[] value();
}
