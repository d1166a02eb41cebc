package works.cairn.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a zero-argument method as a computed property.
 * When it's also listed in {@link Cache}, it's computed at most once per instance.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface Property {
}
