package works.cairn.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
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
import works.cairn.exceptions.ValidationException;
import works.cairn.hash.Digest;

import static tools.jackson.core.JsonToken.VALUE_STRING;
import static works.cairn.jackson.CairnJacksonModule.expect;

/**
 * Writes a {@link Digest} as its lowercase {@link Digest#hex() hex} string.
 */
public final class DigestModule extends CairnJacksonModule {
	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new Serializers.Base() {
			@Override
			public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
				return (type.getRawClass() == Digest.class) ? SERIALIZER : null;
			}
		});
		context.addDeserializers(new Deserializers.Base() {
			@Override
			public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
				return (type.getRawClass() == Digest.class) ? DESERIALIZER : null;
			}

			@Override
			public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
				return valueType == Digest.class;
			}
		});
	}

	private static final ValueSerializer<Digest> SERIALIZER = new ValueSerializer<>() {
		@Override
		public void serialize(Digest value, JsonGenerator gen, SerializationContext serializers) {
			gen.writeString(value.hex());
		}
	};

	private static final ValueDeserializer<Digest> DESERIALIZER = new ValueDeserializer<>() {
		@Override
		public Digest deserialize(JsonParser p, DeserializationContext ctxt) {
			expect(VALUE_STRING, p);
			try {
				return Digest.fromHex(p.getString());
			} catch (ValidationException e) {
				throw new StreamReadException(p, e.getMessage());
			}
		}

		@Override
		public boolean isCachable() {
			return true;
		}
	};
}
