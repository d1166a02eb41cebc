/**
 * Binding call arguments to parameters, and normalizing them with {@link works.cairn.coercion.Coercer}s
 * before the callee sees them.
 */
package works.cairn.coercion;
