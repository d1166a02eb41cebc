package works.cairn.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The parameter may be omitted, in which case it's {@code null}.
 * A {@code null} argument for such a parameter bypasses its {@link Coerce coercer}.
 */
@Retention(RUNTIME)
@Target(PARAMETER)
public @interface NullDefault {
}
