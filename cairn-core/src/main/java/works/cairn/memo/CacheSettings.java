package works.cairn.memo;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.cairn.coercion.ParameterNameMode;

import static works.cairn.coercion.ParameterNameMode.REQUIRE;

@Value
@Builder(toBuilder = true)
public class CacheSettings {
	/**
	 * What to do with cached methods whose parameter names weren't compiled into the class file.
	 * Default is {@link ParameterNameMode#REQUIRE REQUIRE}, because binding
	 * keyword arguments to made-up names would silently miss the cache.
	 */
	@Default ParameterNameMode parameterNames = REQUIRE;

	public static final CacheSettings DEFAULT = CacheSettings.builder().build();
}
