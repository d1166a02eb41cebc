package works.cairn;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.lang.reflect.Array;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import works.cairn.coercion.Coercer;
import works.cairn.exceptions.IllegalMutationException;
import works.cairn.exceptions.KeyNotFoundException;
import works.cairn.exceptions.UsageException;
import works.cairn.exceptions.ValidationException;
import works.cairn.hash.CanonicalHash;
import works.cairn.hash.Digest;
import works.cairn.hash.Digestible;
import works.cairn.strict.Strict;

import static java.util.Objects.requireNonNull;

/**
 * An immutable, hashable mapping from non-null keys to possibly-null values,
 * suitable as part of a cache key.
 * <p>
 * This is not a {@link Map}: it has no mutators at all,
 * and it never equals a plain {@link Map}.
 * Use {@link #asMap()} to pass one where a read-only {@link Map} is expected,
 * or {@link #copy()} for a mutable copy.
 * <p>
 * Insertion order is not meaningful. Two instances with the same entries
 * are {@link #equals equal} and have the same {@link #digest() digest}.
 */
public final class FrozenMapping<K, V> implements Digestible, Serializable {
	/**
	 * Replaced by an equal instance's store during {@link #equals}
	 * so that equal mappings share memory.
	 */
	private volatile PMap<K, V> backing;
	private transient volatile @Nullable Digest digest;

	private static final FrozenMapping<?, ?> EMPTY = new FrozenMapping<>(HashTreePMap.empty());

	private FrozenMapping(PMap<K, V> backing) {
		this.backing = backing;
	}

	@SuppressWarnings("unchecked")
	public static <KK, VV> FrozenMapping<KK, VV> of() {
		return (FrozenMapping<KK, VV>) EMPTY;
	}

	public static <KK, VV> FrozenMapping<KK, VV> of(KK k1, VV v1) {
		return new FrozenMapping<>(HashTreePMap.singleton(checkedKey(k1), v1));
	}

	public static <KK, VV> FrozenMapping<KK, VV> of(KK k1, VV v1, KK k2, VV v2) {
		return new FrozenMapping<>(HashTreePMap.<KK, VV>empty()
			.plus(checkedKey(k1), v1)
			.plus(checkedKey(k2), v2));
	}

	public static <KK, VV> FrozenMapping<KK, VV> of(KK k1, VV v1, KK k2, VV v2, KK k3, VV v3) {
		return new FrozenMapping<>(HashTreePMap.<KK, VV>empty()
			.plus(checkedKey(k1), v1)
			.plus(checkedKey(k2), v2)
			.plus(checkedKey(k3), v3));
	}

	public static <KK, VV> FrozenMapping<KK, VV> copyOf(Map<? extends KK, ? extends VV> map) {
		if (map instanceof MapView) {
			@SuppressWarnings("unchecked")
			FrozenMapping<KK, VV> owner = (FrozenMapping<KK, VV>) ((MapView<?, ?>) map).owner();
			return owner;
		}
		PMap<KK, VV> result = HashTreePMap.empty();
		for (Map.Entry<? extends KK, ? extends VV> entry : map.entrySet()) {
			result = result.plus(checkedKey(entry.getKey()), entry.getValue());
		}
		return new FrozenMapping<>(result);
	}

	/**
	 * Later entries replace earlier ones with the same key.
	 */
	public static <KK, VV> FrozenMapping<KK, VV> copyOf(Iterable<? extends Map.Entry<? extends KK, ? extends VV>> entries) {
		PMap<KK, VV> result = HashTreePMap.empty();
		for (Map.Entry<? extends KK, ? extends VV> entry : entries) {
			result = result.plus(checkedKey(entry.getKey()), entry.getValue());
		}
		return new FrozenMapping<>(result);
	}

	/**
	 * Builds a mapping from anything that reasonably describes one:
	 * a {@link Map}, a {@link FrozenMapping}, or an {@link Iterable}, array or {@link Stream} of pairs,
	 * where each pair is a {@link Map.Entry}, a two-element {@link List} or a two-element array.
	 * Later pairs replace earlier ones with the same key.
	 *
	 * @throws ValidationException if {@code source} is none of those things
	 */
	public static FrozenMapping<Object, Object> from(@Nullable Object source) {
		return from(source, Function.identity(), Function.identity());
	}

	@SuppressWarnings("unchecked")
	private static <KK, VV> FrozenMapping<KK, VV> from(
		@Nullable Object source,
		Function<Object, ? extends KK> keyCoercer,
		Function<Object, ? extends VV> valueCoercer
	) {
		if (source instanceof FrozenMapping) {
			return from(((FrozenMapping<?, ?>) source).backing, keyCoercer, valueCoercer);
		} else if (source instanceof Map) {
			PMap<KK, VV> result = HashTreePMap.empty();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) source).entrySet()) {
				result = result.plus(checkedKey(keyCoercer.apply(entry.getKey())), valueCoercer.apply(entry.getValue()));
			}
			return new FrozenMapping<>(result);
		} else if (source instanceof Iterable) {
			return fromPairs(((Iterable<Object>) source).iterator(), keyCoercer, valueCoercer);
		} else if (source instanceof Stream) {
			return fromPairs(((Stream<Object>) source).iterator(), keyCoercer, valueCoercer);
		} else if (source != null && source.getClass().isArray()) {
			return fromPairs(arrayElements(source).iterator(), keyCoercer, valueCoercer);
		} else {
			throw new ValidationException("Can't build a FrozenMapping from " + describe(source));
		}
	}

	private static <KK, VV> FrozenMapping<KK, VV> fromPairs(
		Iterator<Object> pairs,
		Function<Object, ? extends KK> keyCoercer,
		Function<Object, ? extends VV> valueCoercer
	) {
		PMap<KK, VV> result = HashTreePMap.empty();
		while (pairs.hasNext()) {
			Object pair = pairs.next();
			Object key;
			Object value;
			if (pair instanceof Map.Entry) {
				key = ((Map.Entry<?, ?>) pair).getKey();
				value = ((Map.Entry<?, ?>) pair).getValue();
			} else {
				List<?> elements = pairElements(pair);
				key = elements.get(0);
				value = elements.get(1);
			}
			result = result.plus(checkedKey(keyCoercer.apply(key)), valueCoercer.apply(value));
		}
		return new FrozenMapping<>(result);
	}

	private static List<?> pairElements(@Nullable Object pair) {
		List<?> elements;
		if (pair instanceof List) {
			elements = (List<?>) pair;
		} else if (pair != null && pair.getClass().isArray()) {
			elements = arrayElements(pair);
		} else {
			throw new ValidationException("Expected a key-value pair but got " + describe(pair));
		}
		if (elements.size() != 2) {
			throw new ValidationException("Expected a key-value pair but got " + elements.size() + " elements: " + elements);
		}
		return elements;
	}

	private static List<Object> arrayElements(Object array) {
		int length = Array.getLength(array);
		Object[] result = new Object[length];
		for (int i = 0; i < length; i++) {
			result[i] = Array.get(array, i);
		}
		return Arrays.asList(result);
	}

	private static <KK> KK checkedKey(@Nullable KK key) {
		if (key == null) {
			throw new ValidationException("FrozenMapping keys can't be null");
		}
		return key;
	}

	private static String describe(@Nullable Object value) {
		return value == null ? "null" : value + " of type " + value.getClass().getSimpleName();
	}

	/**
	 * @return a {@link Coercer} that builds mappings from anything {@link #from} accepts,
	 * passing every key through {@link Strict#of Strict.of(keyType)}
	 * and every value through {@link Strict#of Strict.of(valueType)}.
	 */
	public static <KK, VV> Factory<KK, VV> typed(Class<KK> keyType, Class<VV> valueType) {
		return new Factory<>(keyType, valueType);
	}

	/**
	 * Reflective counterpart of {@link #typed}, for callers that hold the type parameters in an array.
	 *
	 * @throws UsageException unless exactly two types are given
	 */
	public static Factory<?, ?> parameterize(Class<?>... typeParameters) {
		if (typeParameters.length != 2) {
			throw new UsageException("FrozenMapping takes exactly 2 type parameters; got " + typeParameters.length);
		}
		return typed(typeParameters[0], typeParameters[1]);
	}

	public static final class Factory<K, V> implements Coercer<FrozenMapping<K, V>> {
		private final Coercer<K> keyCoercer;
		private final Coercer<V> valueCoercer;
		private final String name;

		private Factory(Class<K> keyType, Class<V> valueType) {
			this.keyCoercer = Strict.of(keyType);
			this.valueCoercer = Strict.of(valueType);
			this.name = "FrozenMapping[" + keyType.getSimpleName() + ", " + valueType.getSimpleName() + "]";
		}

		@Override
		public FrozenMapping<K, V> coerce(@Nullable Object value) {
			return from(value, keyCoercer::coerce, v -> v == null ? null : valueCoercer.coerce(v));
		}

		@Override
		public String name() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			if (o == null || getClass() != o.getClass()) {
				return false;
			}
			return name.equals(((Factory<?, ?>) o).name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * @throws KeyNotFoundException if there's no entry for {@code key}
	 */
	public V get(Object key) {
		PMap<K, V> map = backing;
		V result = map.get(key);
		if (result == null && !map.containsKey(key)) {
			throw new KeyNotFoundException(key);
		}
		return result;
	}

	public V getOrDefault(Object key, V defaultValue) {
		return backing.getOrDefault(key, defaultValue);
	}

	public boolean containsKey(Object key) {
		return backing.containsKey(key);
	}

	/**
	 * Iteration order is unspecified.
	 */
	public Set<K> keys() {
		return asMap().keySet();
	}

	public Collection<V> values() {
		return asMap().values();
	}

	public Set<Map.Entry<K, V>> entries() {
		return asMap().entrySet();
	}

	public int size() {
		return backing.size();
	}

	public boolean isEmpty() {
		return backing.isEmpty();
	}

	/**
	 * @return a fresh mutable map with the same entries
	 */
	public HashMap<K, V> copy() {
		return new HashMap<>(backing);
	}

	/**
	 * @return a read-only {@link Map} view whose mutators throw {@link IllegalMutationException}
	 */
	public Map<K, V> asMap() {
		return new MapView<>(this);
	}

	@Override
	public Digest digest() {
		Digest result = digest;
		if (result == null) {
			digest = result = CanonicalHash.mapping(backing);
		}
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof FrozenMapping)) {
			return false;
		}
		@SuppressWarnings("unchecked")
		FrozenMapping<K, V> other = (FrozenMapping<K, V>) obj;
		PMap<K, V> mine = this.backing;
		PMap<K, V> theirs = other.backing;
		if (mine == theirs) {
			return true;
		}
		if (mine.equals(theirs)) {
			this.backing = theirs;
			return true;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return backing.hashCode();
	}

	@Override
	public String toString() {
		return "FrozenMapping" + backing;
	}

	/**
	 * Read-only view of the entries. Every mutator throws,
	 * including the ones {@link AbstractMap} would otherwise delegate to the entry set.
	 */
	private static final class MapView<K, V> extends AbstractMap<K, V> {
		private final FrozenMapping<K, V> owner;

		MapView(FrozenMapping<K, V> owner) {
			this.owner = owner;
		}

		FrozenMapping<K, V> owner() {
			return owner;
		}

		@Override
		public @NotNull Set<Entry<K, V>> entrySet() {
			Set<Entry<K, V>> entries = owner.backing.entrySet();
			return new AbstractSet<>() {
				@Override
				public @NotNull Iterator<Entry<K, V>> iterator() {
					Iterator<Entry<K, V>> iter = entries.iterator();
					return new Iterator<>() {
						@Override
						public boolean hasNext() {
							return iter.hasNext();
						}

						@Override
						public Entry<K, V> next() {
							Entry<K, V> e = iter.next();
							return new SimpleImmutableEntry<>(e.getKey(), e.getValue()) {
								@Override
								public V setValue(V value) {
									throw mutation("setValue");
								}
							};
						}

						@Override
						public void remove() {
							throw mutation("remove");
						}
					};
				}

				@Override
				public int size() {
					return entries.size();
				}

				@Override
				public boolean remove(Object o) {
					throw mutation("remove");
				}

				@Override
				public void clear() {
					throw mutation("clear");
				}
			};
		}

		@Override
		public V get(Object key) {
			return owner.backing.get(key);
		}

		@Override
		public boolean containsKey(Object key) {
			return owner.backing.containsKey(key);
		}

		@Override
		public int size() {
			return owner.backing.size();
		}

		@Override
		public V put(K key, V value) {
			throw mutation("put");
		}

		@Override
		public V remove(Object key) {
			throw mutation("remove");
		}

		@Override
		public void putAll(@NotNull Map<? extends K, ? extends V> m) {
			throw mutation("putAll");
		}

		@Override
		public void clear() {
			throw mutation("clear");
		}

		@Override
		public V putIfAbsent(K key, V value) {
			throw mutation("putIfAbsent");
		}

		@Override
		public V compute(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
			throw mutation("compute");
		}

		@Override
		public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
			throw mutation("computeIfAbsent");
		}

		@Override
		public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
			throw mutation("computeIfPresent");
		}

		@Override
		public V merge(K key, V value, BiFunction<? super V, ? super V, ? extends V> remappingFunction) {
			throw mutation("merge");
		}

		@Override
		public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
			throw mutation("replaceAll");
		}

		private static IllegalMutationException mutation(String operation) {
			return new IllegalMutationException("FrozenMapping does not support " + operation);
		}
	}

	private Object writeReplace() {
		return new SerializedForm(copy());
	}

	private void readObject(ObjectInputStream stream) throws InvalidObjectException {
		throw new InvalidObjectException("Use SerializedForm");
	}

	private static final class SerializedForm implements Serializable {
		private final HashMap<?, ?> entries;

		SerializedForm(HashMap<?, ?> entries) {
			this.entries = requireNonNull(entries);
		}

		private Object readResolve() {
			return copyOf(entries);
		}

		private static final long serialVersionUID = 1L;
	}

	private static final long serialVersionUID = 1L;
}
