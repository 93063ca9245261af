package works.varia.jackson;

import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.TokenStreamLocation;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import works.varia.ArrayBuilder;
import works.varia.EncodedVariant;
import works.varia.ObjectBuilder;
import works.varia.ValidationSettings;
import works.varia.ValueAppender;
import works.varia.Variant;
import works.varia.VariantBuilder;
import works.varia.VariantObject;
import works.varia.VariantValidator;
import works.varia.exceptions.JsonParseException;
import works.varia.exceptions.VariantBuildException;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.PROPERTY_NAME;

/**
 * Converts between JSON text and the variant encoding.
 * <p>
 * Parsing maps integral numbers to the narrowest integer kind and all other numbers to double.
 * Object keys go through the builder's dictionary, which is finalized once the whole
 * document has been read, so rendering emits each object's fields in name order
 * regardless of their order in the input.
 * <p>
 * Rendering handles every kind: kinds with no JSON counterpart become strings
 * (binary as base64, dates and times as ISO-8601, UUIDs in canonical form,
 * non-finite floating point numbers as <code>"NaN"</code>, <code>"Infinity"</code> and <code>"-Infinity"</code>),
 * and decimals become JSON numbers.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class JsonBridge {
	private final Settings settings;
	private final ObjectMapper mapper;
	private final VariantValidator validator;

	public JsonBridge() {
		this(Settings.DEFAULT);
	}

	public JsonBridge(Settings settings) {
		this.settings = settings;
		this.mapper = JsonMapper.builder().build();
		this.validator = new VariantValidator(new ValidationSettings(settings.maxDepth()));
	}

	/**
	 * @param bigIntegerMode how to handle integral literals that don't fit in a long
	 * @param maxDepth the deepest nesting of arrays and objects accepted, in either direction
	 */
	public record Settings(
		BigIntegerMode bigIntegerMode,
		int maxDepth
	) {
		public static final Settings DEFAULT = new Settings(BigIntegerMode.FAIL, ValidationSettings.DEFAULT_MAX_DEPTH);

		public Settings {
			if (bigIntegerMode == null) {
				throw new IllegalArgumentException("bigIntegerMode cannot be null");
			}
			if (maxDepth < 1) {
				throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
			}
		}

		public Settings withBigIntegerMode(BigIntegerMode bigIntegerMode) {
			return new Settings(bigIntegerMode, maxDepth);
		}

		public Settings withMaxDepth(int maxDepth) {
			return new Settings(bigIntegerMode, maxDepth);
		}
	}

	/**
	 * @throws JsonParseException if the text is not a single well-formed JSON value,
	 *                            or holds something the encoding can't represent,
	 *                            such as a duplicate key
	 */
	public EncodedVariant fromJson(String json) {
		return parseWith(() -> mapper.createParser(json));
	}

	public EncodedVariant fromJson(Reader json) {
		return parseWith(() -> mapper.createParser(json));
	}

	/**
	 * The encoding is detected as Jackson does: UTF-8 unless a byte order mark or the first bytes say otherwise.
	 * The stream is not closed.
	 */
	public EncodedVariant fromJson(InputStream json) {
		return parseWith(() -> mapper.createParser(json));
	}

	/**
	 * Validates the buffers, then renders them.
	 *
	 * @throws works.varia.exceptions.VariantFormatException if the buffers are not a well-formed variant
	 */
	public String toJson(byte[] metadata, byte[] value) {
		return toJson(validator.validate(metadata, value));
	}

	public String toJson(EncodedVariant encoded) {
		return toJson(encoded.metadata(), encoded.value());
	}

	/**
	 * Renders an already-decoded value. No validation is performed.
	 */
	public String toJson(Variant value) {
		StringWriter out = new StringWriter();
		try (JsonGenerator gen = mapper.createGenerator(out)) {
			write(gen, value);
		}
		return out.toString();
	}

	/**
	 * The same rendering as {@link #toJson(Variant)}, as a Jackson tree.
	 */
	public JsonNode toJsonNode(Variant value) {
		return switch (value.kind()) {
			case OBJECT -> {
				ObjectNode result = mapper.createObjectNode();
				for (VariantObject.Field field: value.getObject().fields()) {
					result.set(field.name(), toJsonNode(field.value()));
				}
				yield result;
			}
			case ARRAY -> {
				ArrayNode result = mapper.createArrayNode();
				for (Variant element: value.getArray()) {
					result.add(toJsonNode(element));
				}
				yield result;
			}
			default -> {
				ArrayNode holder = mapper.createArrayNode();
				addScalar(holder, value);
				yield holder.get(0);
			}
		};
	}

	public JsonNode toJsonNode(byte[] metadata, byte[] value) {
		return toJsonNode(validator.validate(metadata, value));
	}

	private interface ParserSource {
		JsonParser open();
	}

	private EncodedVariant parseWith(ParserSource source) {
		try (JsonParser p = source.open()) {
			EncodedVariant result = parse(p);
			LOGGER.trace("Parsed JSON into {}", result);
			return result;
		} catch (JacksonException e) {
			LOGGER.debug("Rejected JSON: {}", e.getOriginalMessage());
			throw parseError(e.getOriginalMessage(), e.getLocation(), e);
		}
	}

	private EncodedVariant parse(JsonParser p) {
		VariantBuilder builder = new VariantBuilder();
		if (p.nextToken() == null) {
			throw parseError("No JSON value in input", p.currentLocation(), null);
		}
		parseValue(p, builder, 0);
		if (p.nextToken() != null) {
			throw parseError("Unexpected content after the JSON value", p.currentTokenLocation(), null);
		}
		return builder.finish();
	}

	/**
	 * Appends the value starting at the parser's current token,
	 * leaving the parser on that value's last token.
	 */
	private void parseValue(JsonParser p, ValueAppender appender, int depth) {
		JsonToken token = p.currentToken();
		if (token == null) {
			throw parseError("Unexpected end of input", p.currentLocation(), null);
		}
		try {
			switch (token) {
				case START_OBJECT -> parseObject(p, appender, enter(p, depth));
				case START_ARRAY -> parseArray(p, appender, enter(p, depth));
				case VALUE_STRING -> appender.appendString(p.getString());
				case VALUE_NUMBER_INT -> appendInteger(p, appender);
				case VALUE_NUMBER_FLOAT -> appendFloatingPoint(p, appender);
				case VALUE_TRUE -> appender.appendBoolean(true);
				case VALUE_FALSE -> appender.appendBoolean(false);
				case VALUE_NULL -> appender.appendNull();
				default -> throw parseError("Unexpected token " + token, p.currentTokenLocation(), null);
			}
		} catch (VariantBuildException e) {
			throw parseError(e.getMessage(), p.currentTokenLocation(), e);
		}
	}

	private int enter(JsonParser p, int depth) {
		int nested = depth + 1;
		if (nested > settings.maxDepth()) {
			throw parseError("Nesting exceeds maximum depth " + settings.maxDepth(), p.currentTokenLocation(), null);
		}
		return nested;
	}

	private void parseObject(JsonParser p, ValueAppender appender, int depth) {
		try (ObjectBuilder object = appender.startObject()) {
			while (p.nextToken() == PROPERTY_NAME) {
				object.key(p.currentName());
				p.nextToken();
				parseValue(p, object, depth);
			}
			if (!p.hasToken(JsonToken.END_OBJECT)) {
				throw parseError("Unexpected end of input in object", p.currentLocation(), null);
			}
			object.end();
		}
	}

	private void parseArray(JsonParser p, ValueAppender appender, int depth) {
		try (ArrayBuilder array = appender.startArray()) {
			while (p.nextToken() != END_ARRAY) {
				if (!p.hasCurrentToken()) {
					throw parseError("Unexpected end of input in array", p.currentLocation(), null);
				}
				parseValue(p, array, depth);
			}
			array.end();
		}
	}

	private void appendInteger(JsonParser p, ValueAppender appender) {
		Number number = p.getNumberValue();
		if (number instanceof BigInteger big) {
			if (settings.bigIntegerMode() == BigIntegerMode.DECIMAL) {
				appender.appendDecimal(new BigDecimal(big));
			} else {
				throw parseError("Integer " + number + " is outside the 64-bit range", p.currentTokenLocation(), null);
			}
		} else {
			appender.appendLong(number.longValue());
		}
	}

	private void appendFloatingPoint(JsonParser p, ValueAppender appender) {
		double value = p.getDoubleValue();
		if (!Double.isFinite(value)) {
			throw parseError("Number " + p.getString() + " is outside the range of a double", p.currentTokenLocation(), null);
		}
		appender.appendDouble(value);
	}

	private static JsonParseException parseError(String message, TokenStreamLocation location, Throwable cause) {
		long offset = -1;
		int line = -1;
		int column = -1;
		if (location != null) {
			offset = location.getCharOffset() >= 0 ? location.getCharOffset() : location.getByteOffset();
			line = location.getLineNr();
			column = location.getColumnNr();
		}
		if (cause == null) {
			return new JsonParseException(message, offset, line, column);
		} else {
			return new JsonParseException(message, offset, line, column, cause);
		}
	}

	private void write(JsonGenerator gen, Variant value) {
		switch (value.kind()) {
			case OBJECT -> {
				gen.writeStartObject();
				for (VariantObject.Field field: value.getObject().fields()) {
					gen.writeName(field.name());
					write(gen, field.value());
				}
				gen.writeEndObject();
			}
			case ARRAY -> {
				gen.writeStartArray();
				for (Variant element: value.getArray()) {
					write(gen, element);
				}
				gen.writeEndArray();
			}
			case NULL -> gen.writeNull();
			case BOOLEAN -> gen.writeBoolean(value.getBoolean());
			case INT8, INT16, INT32, INT64 -> gen.writeNumber(value.getLong());
			case FLOAT -> {
				float f = value.getFloat();
				if (Float.isFinite(f)) {
					gen.writeNumber(f);
				} else {
					gen.writeString(Float.toString(f));
				}
			}
			case DOUBLE -> {
				double d = value.getDouble();
				if (Double.isFinite(d)) {
					gen.writeNumber(d);
				} else {
					gen.writeString(Double.toString(d));
				}
			}
			case DECIMAL4, DECIMAL8, DECIMAL16 -> gen.writeNumber(value.getDecimal());
			default -> gen.writeString(scalarString(value));
		}
	}

	private void addScalar(ArrayNode holder, Variant value) {
		switch (value.kind()) {
			case NULL -> holder.addNull();
			case BOOLEAN -> holder.add(value.getBoolean());
			case INT8, INT16, INT32, INT64 -> holder.add(value.getLong());
			case FLOAT -> {
				float f = value.getFloat();
				if (Float.isFinite(f)) {
					holder.add(f);
				} else {
					holder.add(Float.toString(f));
				}
			}
			case DOUBLE -> {
				double d = value.getDouble();
				if (Double.isFinite(d)) {
					holder.add(d);
				} else {
					holder.add(Double.toString(d));
				}
			}
			case DECIMAL4, DECIMAL8, DECIMAL16 -> holder.add(value.getDecimal());
			default -> holder.add(scalarString(value));
		}
	}

	/**
	 * The string rendering of each scalar kind that has no JSON counterpart of its own.
	 */
	private static String scalarString(Variant value) {
		return switch (value.kind()) {
			case SHORT_STRING, STRING -> value.getString();
			case DATE -> value.getDate().toString();
			case TIMESTAMP_MICROS, TIMESTAMP_NANOS -> value.getInstant().toString();
			case TIMESTAMP_NTZ_MICROS, TIMESTAMP_NTZ_NANOS -> value.getLocalDateTime().toString();
			case TIME_NTZ_MICROS -> value.getTime().toString();
			case UUID -> value.getUuid().toString();
			case BINARY -> Base64.getEncoder().encodeToString(value.getBinaryBytes());
			default -> throw new AssertionError("Unexpected kind " + value.kind());
		};
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonBridge.class);
}
