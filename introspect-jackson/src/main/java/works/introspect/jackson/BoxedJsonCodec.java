package works.introspect.jackson;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.JsonNodeType;
import works.introspect.Boxed;
import works.introspect.exceptions.TypeMismatchException;
import works.introspect.types.TypeTag;

import static java.util.Objects.requireNonNull;
import static works.introspect.types.TypeTag.Kind.VECTOR;

/**
 * Converts between {@link JsonNode}s and {@link Boxed} values, driven by {@link TypeTag}.
 * <p>
 * Decoding is strict about JSON node kinds: a JSON string never decodes as an {@code int}.
 * For text typed in by a person, use {@link #coerce} instead.
 * <p>
 * Instances are immutable; {@link #withConverter} returns a new codec.
 */
public final class BoxedJsonCodec {
	private final ObjectMapper mapper;
	private final Map<TypeTag, Converter> customConverters;

	private record Converter(
		Function<Boxed, JsonNode> encoder,
		Function<JsonNode, Boxed> decoder
	) { }

	public BoxedJsonCodec() {
		this(JsonMapper.builder().build(), Map.of());
	}

	public BoxedJsonCodec(ObjectMapper mapper) {
		this(mapper, Map.of());
	}

	private BoxedJsonCodec(ObjectMapper mapper, Map<TypeTag, Converter> customConverters) {
		this.mapper = requireNonNull(mapper);
		this.customConverters = Map.copyOf(customConverters);
	}

	/**
	 * @return a codec that uses the given functions for {@code tag}, ahead of any built-in conversion
	 */
	public BoxedJsonCodec withConverter(TypeTag tag, Function<Boxed, JsonNode> encoder, Function<JsonNode, Boxed> decoder) {
		Map<TypeTag, Converter> converters = new HashMap<>(customConverters);
		converters.put(tag, new Converter(requireNonNull(encoder), requireNonNull(decoder)));
		return new BoxedJsonCodec(mapper, converters);
	}

	public ObjectMapper mapper() {
		return mapper;
	}

	public boolean supports(TypeTag tag) {
		if (customConverters.containsKey(tag)) {
			return true;
		}
		return switch (tag.kind()) {
			case VOID, PRIMITIVE, STRING -> true;
			case VECTOR -> supports(tag.elementTag());
			default -> false;
		};
	}

	/**
	 * Unsupported tags encode as JSON {@code null}, as do non-finite floating-point numbers.
	 */
	public JsonNode encode(Boxed value) {
		Converter custom = customConverters.get(value.tag());
		if (custom != null) {
			return custom.encoder().apply(value);
		}
		return encodeRaw(value.tag(), value.peek());
	}

	private JsonNode encodeRaw(TypeTag tag, Object value) {
		if (value == null || !supports(tag)) {
			return NULL;
		}
		if (tag.kind() == VECTOR) {
			ArrayNode result = mapper.createArrayNode();
			for (Object element : (List<?>) value) {
				result.add(encodeRaw(tag.elementTag(), element));
			}
			return result;
		}
		if (value instanceof Character c) {
			return mapper.valueToTree(c.toString());
		} else if (value instanceof Double d && !Double.isFinite(d)) {
			return NULL;
		} else if (value instanceof Float f && !Float.isFinite(f)) {
			return NULL;
		}
		return mapper.valueToTree(value);
	}

	/**
	 * @throws TypeMismatchException if {@code json} is the wrong kind of node for {@code tag},
	 * or {@code tag} is not supported
	 */
	public Boxed decode(TypeTag tag, JsonNode json) {
		Converter custom = customConverters.get(tag);
		if (custom != null) {
			return custom.decoder().apply(json);
		}
		return Boxed.of(tag, decodeRaw(tag, json));
	}

	private Object decodeRaw(TypeTag tag, JsonNode json) {
		if (json == null || json.isNull()) {
			if (tag.isNullable()) {
				return null;
			}
			throw mismatch(tag, json);
		}
		switch (tag.kind()) {
			case STRING -> {
				if (json.getNodeType() == JsonNodeType.STRING) {
					return json.asString();
				}
			}
			case PRIMITIVE -> {
				return decodePrimitive(tag, json);
			}
			case VECTOR -> {
				if (json.isArray() && supports(tag.elementTag())) {
					List<Object> elements = new ArrayList<>(json.size());
					for (int i = 0; i < json.size(); i++) {
						elements.add(decodeRaw(tag.elementTag(), json.get(i)));
					}
					return elements;
				}
			}
			default -> {
			}
		}
		throw mismatch(tag, json);
	}

	private Object decodePrimitive(TypeTag tag, JsonNode json) {
		if (tag.equals(TypeTag.BOOL)) {
			if (json.isBoolean()) {
				return json.booleanValue();
			}
		} else if (tag.equals(TypeTag.CHAR)) {
			if (json.getNodeType() == JsonNodeType.STRING && json.asString().length() == 1) {
				return json.asString().charAt(0);
			}
		} else if (tag.equals(TypeTag.DOUBLE)) {
			if (json.isNumber()) {
				return json.doubleValue();
			}
		} else if (tag.equals(TypeTag.FLOAT)) {
			if (json.isNumber()) {
				return (float) json.doubleValue();
			}
		} else if (json.isIntegralNumber()) {
			if (tag.equals(TypeTag.LONG) && json.canConvertToLong()) {
				return json.longValue();
			} else if (json.canConvertToInt()) {
				int i = json.intValue();
				if (tag.equals(TypeTag.INT)) {
					return i;
				} else if (tag.equals(TypeTag.SHORT) && i == (short) i) {
					return (short) i;
				} else if (tag.equals(TypeTag.BYTE) && i == (byte) i) {
					return (byte) i;
				}
			}
		}
		throw mismatch(tag, json);
	}

	/**
	 * Lenient conversion of user-entered text:
	 * integers and floating-point numbers are parsed,
	 * {@code bool} is true exactly for {@code "true"} and {@code "1"},
	 * and {@code string} is taken verbatim.
	 *
	 * @throws TypeMismatchException if the text can't be parsed, or {@code tag} has no text form
	 */
	public Boxed coerce(TypeTag tag, String text) {
		requireNonNull(text);
		try {
			if (tag.equals(TypeTag.STRING)) {
				return Boxed.of(text);
			} else if (tag.equals(TypeTag.INT)) {
				return Boxed.of(Integer.parseInt(text.trim()));
			} else if (tag.equals(TypeTag.LONG)) {
				return Boxed.of(Long.parseLong(text.trim()));
			} else if (tag.equals(TypeTag.SHORT)) {
				return Boxed.of(Short.parseShort(text.trim()));
			} else if (tag.equals(TypeTag.BYTE)) {
				return Boxed.of(Byte.parseByte(text.trim()));
			} else if (tag.equals(TypeTag.DOUBLE)) {
				return Boxed.of(Double.parseDouble(text.trim()));
			} else if (tag.equals(TypeTag.FLOAT)) {
				return Boxed.of(Float.parseFloat(text.trim()));
			} else if (tag.equals(TypeTag.BOOL)) {
				return Boxed.of(text.equals("true") || text.equals("1"));
			} else if (tag.equals(TypeTag.CHAR) && text.length() == 1) {
				return Boxed.of(text.charAt(0));
			}
		} catch (NumberFormatException e) {
			throw new TypeMismatchException(tag.name(), "string", "Cannot parse \"" + text + "\"", e);
		}
		throw new TypeMismatchException(tag.name(), "string", "Cannot coerce \"" + text + "\"");
	}

	private static TypeMismatchException mismatch(TypeTag tag, JsonNode json) {
		String actual = (json == null) ? "missing" : json.getNodeType().name().toLowerCase(Locale.ROOT);
		return new TypeMismatchException(tag.name(), "JSON " + actual, "Cannot decode JSON");
	}

	private static final JsonNode NULL = JsonNodeFactory.instance.nullNode();
}
