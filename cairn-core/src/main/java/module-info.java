/**
 * Core Cairn library: stable digests of values, strict coercion,
 * immutable mappings, and memoized attributes.
 * <p>
 * Start with {@link works.cairn.memo.CacheMeta} to cache attributes of your own classes,
 * or {@link works.cairn.hash.CanonicalHash} to compute cache keys directly.
 */
module works.cairn.core {
	requires transitive org.jetbrains.annotations;
	requires transitive org.pcollections;
	requires org.slf4j;

	requires static lombok;

	exports works.cairn;
	exports works.cairn.annotations;
	exports works.cairn.coercion;
	exports works.cairn.exceptions;
	exports works.cairn.hash;
	exports works.cairn.memo;
	exports works.cairn.strict;
}
