package works.cairn.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The parameter collects every keyword argument that doesn't match another parameter.
 * Its type must be {@link java.util.Map} or {@code FrozenMapping}.
 */
@Retention(RUNTIME)
@Target(PARAMETER)
public @interface VarKeyword {
}
