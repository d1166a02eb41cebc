package works.cairn.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.ConcurrentHashMap;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.DeserializationConfig;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.deser.Deserializers;
import tools.jackson.databind.ser.Serializers;
import tools.jackson.databind.type.TypeFactory;
import works.cairn.FrozenMapping;
import works.cairn.exceptions.ValidationException;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.START_ARRAY;
import static tools.jackson.core.JsonToken.VALUE_NULL;
import static works.cairn.jackson.CairnJacksonModule.expect;

/**
 * Writes a {@link FrozenMapping} as a JSON array of two-element {@code [key, value]} arrays,
 * so keys needn't be strings.
 * Reading uses the declared key and value types, and rejects null or duplicate keys.
 */
public final class FrozenMappingModule extends CairnJacksonModule {
	private static final TypeFactory typeFactory = TypeFactory.createDefaultInstance();

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new FrozenMappingSerializers());
		context.addDeserializers(new FrozenMappingDeserializers());
	}

	private static final class FrozenMappingSerializers extends Serializers.Base {
		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			if (FrozenMapping.class.isAssignableFrom(type.getRawClass())) {
				return SERIALIZER;
			} else {
				return null;
			}
		}

		private static final ValueSerializer<FrozenMapping<?, ?>> SERIALIZER = new ValueSerializer<>() {
			@Override
			public void serialize(FrozenMapping<?, ?> value, JsonGenerator gen, SerializationContext serializers) {
				gen.writeStartArray();
				for (Entry<?, ?> entry : value.entries()) {
					gen.writeStartArray();
					writeElement(entry.getKey(), gen, serializers);
					writeElement(entry.getValue(), gen, serializers);
					gen.writeEndArray();
				}
				gen.writeEndArray();
			}
		};

		private static void writeElement(Object element, JsonGenerator gen, SerializationContext serializers) {
			if (element == null) {
				gen.writeNull();
			} else {
				ValueSerializer<Object> serializer = serializers.findValueSerializer(element.getClass());
				serializer.serialize(element, gen, serializers);
			}
		}
	}

	private static final class FrozenMappingDeserializers extends Deserializers.Base {
		private final Map<JavaType, ValueDeserializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			if (FrozenMapping.class.isAssignableFrom(type.getRawClass())) {
				return memo.computeIfAbsent(type, FrozenMappingDeserializers::frozenMappingDeserializer);
			} else {
				return null;
			}
		}

		@Override
		public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
			return FrozenMapping.class.isAssignableFrom(valueType);
		}

		private static ValueDeserializer<FrozenMapping<Object, Object>> frozenMappingDeserializer(JavaType type) {
			JavaType[] parameters = type.findTypeParameters(FrozenMapping.class);
			JavaType keyType = (parameters.length == 2) ? parameters[0] : typeFactory.constructType(Object.class);
			JavaType valueType = (parameters.length == 2) ? parameters[1] : typeFactory.constructType(Object.class);
			return new ValueDeserializer<>() {
				@Override
				public FrozenMapping<Object, Object> deserialize(JsonParser p, DeserializationContext ctxt) {
					ValueDeserializer<Object> keyDeserializer = ctxt.findContextualValueDeserializer(keyType, null);
					ValueDeserializer<Object> valueDeserializer = ctxt.findContextualValueDeserializer(valueType, null);
					LinkedHashMap<Object, Object> result = new LinkedHashMap<>();
					expect(START_ARRAY, p);
					while (p.nextToken() != END_ARRAY) {
						expect(START_ARRAY, p);
						JsonToken keyToken = p.nextToken();
						if (keyToken == VALUE_NULL) {
							throw new StreamReadException(p, "FrozenMapping key can't be null");
						} else if (keyToken == END_ARRAY) {
							throw wrongArity(p);
						}
						Object key = keyDeserializer.deserialize(p, ctxt);
						JsonToken valueToken = p.nextToken();
						if (valueToken == END_ARRAY) {
							throw wrongArity(p);
						}
						Object value = (valueToken == VALUE_NULL) ? null : valueDeserializer.deserialize(p, ctxt);
						if (p.nextToken() != END_ARRAY) {
							throw wrongArity(p);
						}
						if (result.containsKey(key)) {
							throw new StreamReadException(p, "FrozenMapping key appears twice: " + key);
						}
						result.put(key, value);
					}
					try {
						return FrozenMapping.copyOf(result);
					} catch (ValidationException e) {
						throw new StreamReadException(p, "Invalid FrozenMapping: " + e.getMessage());
					}
				}

				@Override
				public boolean isCachable() {
					return true;
				}
			};
		}

		private static StreamReadException wrongArity(JsonParser p) {
			return new StreamReadException(p, "FrozenMapping entry must have exactly two elements");
		}
	}
}
