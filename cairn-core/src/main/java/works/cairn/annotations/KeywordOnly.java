package works.cairn.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The parameter can only be passed by name.
 */
@Retention(RUNTIME)
@Target(PARAMETER)
public @interface KeywordOnly {
}
