package works.cairn.memo;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.cairn.annotations.Cache;
import works.cairn.annotations.Property;
import works.cairn.coercion.Signature;
import works.cairn.exceptions.InvalidAttributeException;
import works.cairn.exceptions.UsageException;

import static java.lang.reflect.Modifier.isAbstract;
import static java.lang.reflect.Modifier.isPrivate;
import static java.lang.reflect.Modifier.isStatic;
import static java.util.stream.Collectors.toList;

/**
 * The cached attributes of one class, as listed in its {@link Cache @Cache} annotation.
 * <p>
 * Create it once, in the class itself, so that it can see the class's private methods:
 *
 * <pre>
 * &#64;Cache({"area", "scaled"})
 * class Shape implements Memoized {
 *     private static final CacheMeta&lt;Shape&gt; META = CacheMeta.of(Shape.class, MethodHandles.lookup());
 *     private static final CachedProperty&lt;Shape, Double&gt; AREA = META.property("area", Double.class);
 *     ...
 * }
 * </pre>
 *
 * Each listed name must be a method declared by the class itself: either a zero-argument
 * {@link Property @Property}, which becomes a {@link CachedProperty},
 * or any other non-void instance method, which becomes a {@link CachedMethod}.
 * <p>
 * The original methods are invoked non-virtually, so a subclass overriding a cached method
 * doesn't change what the superclass's accessor computes.
 */
public final class CacheMeta<T extends Memoized> {
	private final Class<T> owner;
	private final Map<String, CachedAttribute<T, ?>> attributes;

	private CacheMeta(Class<T> owner, Map<String, CachedAttribute<T, ?>> attributes) {
		this.owner = owner;
		this.attributes = Collections.unmodifiableMap(attributes);
	}

	public static <T extends Memoized> CacheMeta<T> of(Class<T> owner, Lookup lookup) {
		return of(owner, lookup, CacheSettings.DEFAULT);
	}

	/**
	 * @param lookup must be created by {@code owner} itself, via {@link MethodHandles#lookup()}
	 * @throws InvalidAttributeException if a listed name can't be cached
	 * @throws UsageException if {@code owner} has no {@link Cache @Cache} annotation, or {@code lookup} belongs to another class
	 */
	public static <T extends Memoized> CacheMeta<T> of(Class<T> owner, Lookup lookup, CacheSettings settings) {
		Cache cache = owner.getAnnotation(Cache.class);
		if (cache == null) {
			throw new UsageException("Class " + owner.getSimpleName() + " has no @" + Cache.class.getSimpleName() + " annotation");
		}
		if (lookup.lookupClass() != owner || (lookup.lookupModes() & Lookup.PRIVATE) == 0) {
			throw new UsageException("CacheMeta for " + owner.getSimpleName() + " requires a private lookup from that class; got " + lookup);
		}

		Map<String, CachedAttribute<T, ?>> attributes = new LinkedHashMap<>();
		for (String name : cache.value()) {
			if (attributes.containsKey(name)) {
				throw new InvalidAttributeException(owner, name, "Attribute listed twice in @Cache: " + name);
			}
			attributes.put(name, cachedAttribute(owner, lookup, settings, name));
		}

		if (attributes.isEmpty()) {
			LOGGER.warn("Found no cached attributes in {}; may be misconfigured", owner.getSimpleName());
		} else {
			LOGGER.info("Registered {} cached attribute{} in {}", attributes.size(), (attributes.size() >= 2) ? "s" : "", owner.getSimpleName());
		}
		return new CacheMeta<>(owner, attributes);
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static <T extends Memoized> CachedAttribute<T, ?> cachedAttribute(Class<T> owner, Lookup lookup, CacheSettings settings, String name) {
		List<Method> candidates = Arrays.stream(owner.getDeclaredMethods())
			.filter(m -> m.getName().equals(name) && !m.isSynthetic() && !m.isBridge())
			.collect(toList());
		if (candidates.isEmpty()) {
			if (Arrays.stream(owner.getDeclaredFields()).anyMatch(f -> f.getName().equals(name))) {
				throw cannotCache(owner, name, "field");
			}
			throw new InvalidAttributeException(owner, name, "Attribute listed in @Cache is undefined: " + name);
		} else if (candidates.size() >= 2) {
			throw cannotCache(owner, name, "overloaded method");
		}

		Method method = candidates.get(0);
		if (isStatic(method.getModifiers())) {
			throw cannotCache(owner, name, "static method");
		} else if (isAbstract(method.getModifiers())) {
			throw cannotCache(owner, name, "abstract method");
		} else if (method.getReturnType() == void.class) {
			throw cannotCache(owner, name, "void method");
		}

		SlotKey key = new SlotKey(owner, name);
		Class resultType = MethodType.methodType(method.getReturnType()).wrap().returnType();
		MethodHandle body = nonVirtualHandle(owner, lookup, method);
		if (method.isAnnotationPresent(Property.class)) {
			if (method.getParameterCount() != 0) {
				throw cannotCache(owner, name, "property with parameters");
			}
			return new CachedProperty(key, resultType, body);
		} else {
			Signature signature;
			try {
				signature = Signature.of(method, settings.getParameterNames());
			} catch (UsageException e) {
				throw new InvalidAttributeException(owner, name, "Unable to derive signature of " + name + ": " + e.getMessage(), e);
			}
			return new CachedMethod(key, resultType, body, signature, method.getParameterTypes());
		}
	}

	private static MethodHandle nonVirtualHandle(Class<?> owner, Lookup lookup, Method method) {
		try {
			MethodHandle handle;
			if (isPrivate(method.getModifiers())) {
				handle = lookup.unreflect(method);
			} else {
				handle = lookup.unreflectSpecial(method, owner);
			}
			return handle.asFixedArity();
		} catch (IllegalAccessException e) {
			throw new InvalidAttributeException(owner, method.getName(), "Unable to access method " + method.getName(), e);
		}
	}

	private static InvalidAttributeException cannotCache(Class<?> owner, String name, String kind) {
		return new InvalidAttributeException(owner, name, "Don't know how to cache attribute " + name + ": " + kind);
	}

	public Class<T> owner() {
		return owner;
	}

	public Set<String> names() {
		return attributes.keySet();
	}

	/**
	 * @throws UsageException if {@code name} is not a cached property, or doesn't return a {@code resultType}
	 */
	@SuppressWarnings("unchecked")
	public <R> CachedProperty<T, R> property(String name, Class<R> resultType) {
		CachedAttribute<T, ?> attribute = attribute(name);
		if (!(attribute instanceof CachedProperty)) {
			throw new UsageException("Cached attribute " + attribute.key + " is not a property");
		}
		checkResultType(attribute, resultType);
		return (CachedProperty<T, R>) attribute;
	}

	/**
	 * @throws UsageException if {@code name} is not a cached method, or doesn't return a {@code resultType}
	 */
	@SuppressWarnings("unchecked")
	public <R> CachedMethod<T, R> method(String name, Class<R> resultType) {
		CachedAttribute<T, ?> attribute = attribute(name);
		if (!(attribute instanceof CachedMethod)) {
			throw new UsageException("Cached attribute " + attribute.key + " is not a method");
		}
		checkResultType(attribute, resultType);
		return (CachedMethod<T, R>) attribute;
	}

	public CachedAttribute<T, ?> attribute(String name) {
		CachedAttribute<T, ?> result = attributes.get(name);
		if (result == null) {
			throw new UsageException("No cached attribute " + name + " in " + owner.getSimpleName());
		}
		return result;
	}

	private static void checkResultType(CachedAttribute<?, ?> attribute, Class<?> requested) {
		Class<?> requestedBoxed = MethodType.methodType(requested).wrap().returnType();
		if (!requestedBoxed.isAssignableFrom(attribute.resultType)) {
			throw new UsageException("Cached attribute " + attribute.key + " returns " + attribute.resultType.getSimpleName()
				+ ", not " + requested.getSimpleName());
		}
	}

	@Override
	public String toString() {
		return "CacheMeta(" + owner.getSimpleName() + ", " + attributes.keySet() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CacheMeta.class);
}
