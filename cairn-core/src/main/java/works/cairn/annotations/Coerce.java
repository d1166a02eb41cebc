package works.cairn.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares the coercer applied to a parameter's argument before the method runs.
 * <p>
 * The class must implement {@code works.cairn.coercion.Coercer}
 * and have a no-argument constructor accessible to Cairn.
 */
@Retention(RUNTIME)
@Target(PARAMETER)
public @interface Coerce {
	Class<?> value();
}
