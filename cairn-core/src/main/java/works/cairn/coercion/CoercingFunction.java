package works.cairn.coercion;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import org.jetbrains.annotations.Nullable;
import works.cairn.exceptions.UsageException;

import static java.util.Objects.requireNonNull;

/**
 * A callable whose arguments are bound to its {@link Signature} and coerced
 * before its body runs. If any coercer fails, the body doesn't run.
 */
public final class CoercingFunction<R> {
	private final Signature signature;
	private final Body<R> body;

	/**
	 * Receives the coerced arguments.
	 */
	@FunctionalInterface
	public interface Body<R> {
		R apply(BoundArguments arguments) throws Exception;
	}

	private CoercingFunction(Signature signature, Body<R> body) {
		this.signature = signature;
		this.body = body;
	}

	/**
	 * Wraps an explicit body. The signature is used verbatim.
	 */
	public static <R> CoercingFunction<R> of(Signature signature, Body<R> body) {
		return new CoercingFunction<>(signature, body);
	}

	/**
	 * Wraps a static method.
	 */
	public static <R> CoercingFunction<R> of(MethodHandles.Lookup lookup, Method method, Class<R> resultType) {
		if (!Modifier.isStatic(method.getModifiers())) {
			throw new UsageException("Method " + method.getName() + " is not static; supply a receiver");
		}
		return of(lookup, method, resultType, null);
	}

	/**
	 * Wraps an instance method bound to {@code receiver}, or a static method if {@code receiver} is null.
	 */
	public static <R> CoercingFunction<R> of(MethodHandles.Lookup lookup, Method method, Class<R> resultType, @Nullable Object receiver) {
		Class<?> returnType = MethodType.methodType(method.getReturnType()).wrap().returnType();
		if (!resultType.isAssignableFrom(returnType)) {
			throw new UsageException("Method " + method.getName() + " returns " + returnType.getSimpleName() + ", not " + resultType.getSimpleName());
		}
		MethodHandle handle;
		try {
			handle = lookup.unreflect(method).asFixedArity();
		} catch (IllegalAccessException e) {
			throw new UsageException("Unable to access method " + method.getName(), e);
		}
		if (!Modifier.isStatic(method.getModifiers())) {
			handle = handle.bindTo(requireNonNull(receiver, "receiver"));
		}
		Signature signature = Signature.of(method);
		Class<?>[] parameterTypes = method.getParameterTypes();
		MethodHandle target = handle;
		return new CoercingFunction<>(signature, args -> resultType.cast(invoke(target, args.invocationArguments(parameterTypes))));
	}

	public Signature signature() {
		return signature;
	}

	/**
	 * @throws works.cairn.exceptions.ValidationException if the arguments can't be bound or coerced
	 * @throws IllegalStateException wrapping any checked exception thrown by the body
	 */
	public R call(Arguments arguments) {
		BoundArguments coerced = signature.bindAndCoerce(arguments);
		try {
			return body.apply(coerced);
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Exception from " + signature.name() + ": " + e.getMessage(), e);
		}
	}

	public R call(@Nullable Object... positional) {
		return call(Arguments.of(positional));
	}

	/**
	 * Calls {@code handle}, letting unchecked exceptions and errors through.
	 */
	public static Object invoke(MethodHandle handle, Object[] arguments) throws Exception {
		try {
			return handle.invokeWithArguments(arguments);
		} catch (Exception | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unexpected throwable", e);
		}
	}

	@Override
	public String toString() {
		return "CoercingFunction" + signature;
	}
}
