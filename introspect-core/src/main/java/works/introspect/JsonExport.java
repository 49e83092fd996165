package works.introspect;

import java.util.List;
import works.introspect.types.TypeTag;

/**
 * Writes the members of an instance as one flat JSON object, {@code {"name":value,...}},
 * in member order.
 * <p>
 * Built-in scalars and vectors are written as their JSON counterparts;
 * {@code char} becomes a one-character string;
 * non-finite floating-point values, and members of any other tag, become {@code null}.
 */
public final class JsonExport {
	private JsonExport(){}

	public static String toJson(TypeDescriptor descriptor, Object instance) {
		StringBuilder sb = new StringBuilder("{");
		String sep = "";
		for (MemberDescriptor member : descriptor.members()) {
			sb.append(sep);
			sep = ",";
			appendString(sb, member.name());
			sb.append(':');
			appendValue(sb, member.tag(), member.get(instance).peek());
		}
		return sb.append('}').toString();
	}

	static void appendValue(StringBuilder sb, TypeTag tag, Object value) {
		if (value == null) {
			sb.append("null");
			return;
		}
		switch (tag.kind()) {
			case STRING -> appendString(sb, (String) value);
			case PRIMITIVE -> appendPrimitive(sb, value);
			case VECTOR -> {
				sb.append('[');
				String sep = "";
				for (Object element : (List<?>) value) {
					sb.append(sep);
					sep = ",";
					appendValue(sb, tag.elementTag(), element);
				}
				sb.append(']');
			}
			default -> sb.append("null");
		}
	}

	private static void appendPrimitive(StringBuilder sb, Object value) {
		if (value instanceof Character c) {
			appendString(sb, c.toString());
		} else if (value instanceof Double d && !Double.isFinite(d)) {
			sb.append("null");
		} else if (value instanceof Float f && !Float.isFinite(f)) {
			sb.append("null");
		} else {
			// Numbers and booleans print as valid JSON literals
			sb.append(value);
		}
	}

	static void appendString(StringBuilder sb, String s) {
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				case '\b': sb.append("\\b"); break;
				case '\f': sb.append("\\f"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\t': sb.append("\\t"); break;
				default:
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		sb.append('"');
	}
}
