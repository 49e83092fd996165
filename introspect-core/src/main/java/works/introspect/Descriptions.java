package works.introspect;

import works.introspect.types.TypeTag;

/**
 * Human-readable listings of registered types and their member values.
 */
public final class Descriptions {
	private Descriptions(){}

	/**
	 * @return e.g. {@code "age (int): 30"}
	 */
	public static String describeMember(TypeDescriptor descriptor, Object instance, String name) {
		MemberDescriptor member = descriptor.member(name);
		return member.name() + " (" + member.tag() + "): " + member.get(instance).peek();
	}

	/**
	 * Lists the class name, the members with their tags,
	 * and the methods with their return and parameter tags, one per line.
	 */
	public static String describeClass(TypeDescriptor descriptor) {
		StringBuilder sb = new StringBuilder();
		sb.append("Class: ").append(descriptor.className()).append('\n');
		sb.append("Members:\n");
		for (MemberDescriptor member : descriptor.members()) {
			sb.append("  ").append(member.name()).append(" (").append(member.tag()).append(")\n");
		}
		sb.append("Methods:\n");
		for (MethodDescriptor method : descriptor.methods()) {
			sb.append("  ").append(method.name()).append(" -> ").append(method.returnType());
			if (!method.parameterTypes().isEmpty()) {
				sb.append(" (params: ");
				String sep = "";
				for (TypeTag parameter : method.parameterTypes()) {
					sb.append(sep).append(parameter);
					sep = ", ";
				}
				sb.append(')');
			}
			sb.append('\n');
		}
		return sb.toString();
	}
}
