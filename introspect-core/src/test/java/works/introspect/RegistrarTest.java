package works.introspect;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import works.introspect.TypeRegistry.DuplicatePolicy;
import works.introspect.exceptions.DuplicateRegistrationException;
import works.introspect.exceptions.InvalidRegistrationException;
import works.introspect.handles.TypedHandles;
import works.introspect.types.TypeTag;

import static java.lang.invoke.MethodHandles.lookup;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegistrarTest {
	final TypeRegistry registry = new TypeRegistry();

	static class Widget {
		private String label = "widget";
		private final int serial = 1;
		private AtomicReference<Double> weight = new AtomicReference<>(2.5);
		private Integer stock;

		String label() {
			return label;
		}

		void resize(int width) {}

		void resize(int width, int height) {}

		static int count() {
			return 3;
		}

		Integer stock() {
			return stock;
		}

		void restock(Integer amount) {
			stock = amount;
		}
	}

	@Test
	void privateField_registers() {
		TypeDescriptor descriptor = registry.descriptorFor(Widget.class, r -> r
			.field("label", lookup())
			.field("weight", lookup()));
		assertEquals(List.of("label", "weight"), descriptor.memberNames());
		assertEquals(TypeTag.STRING, descriptor.member("label").tag());
		assertEquals("double*", descriptor.member("weight").tag().name());
		assertEquals("Widget", descriptor.className());
	}

	@Test
	void fieldUnderDifferentName_registers() {
		TypeDescriptor descriptor = registry.descriptorFor(Widget.class, r -> r
			.field("title", "label", lookup()));
		Widget widget = new Widget();
		assertEquals("widget", descriptor.member("title").get(widget).asString());
	}

	@Test
	void missingField_throws() {
		InvalidRegistrationException e = assertThrows(InvalidRegistrationException.class,
			() -> registry.descriptorFor(Widget.class, r -> r.field("nonexistent", lookup())));
		assertEquals(Widget.class, e.containingClass());
		assertEquals("nonexistent", e.name());
		assertFalse(registry.isRegistered(Widget.class), "Failed registration must not publish a descriptor");
	}

	@Test
	void finalField_throws() {
		assertThrows(InvalidRegistrationException.class,
			() -> registry.descriptorFor(Widget.class, r -> r.field("serial", lookup())));
	}

	@Test
	void wrapperTypedMembers_throw() {
		InvalidRegistrationException e = assertThrows(InvalidRegistrationException.class,
			() -> registry.descriptorFor(Widget.class, r -> r.field("stock", lookup())));
		assertEquals("stock", e.name());
		assertThrows(InvalidRegistrationException.class,
			() -> registry.descriptorFor(Widget.class, r -> r.member("stock", Integer.class, w -> w.stock, (w, v) -> w.stock = v)));
		assertThrows(InvalidRegistrationException.class,
			() -> registry.descriptorFor(Widget.class, r -> r.method("stock", lookup())));
		assertFalse(registry.isRegistered(Widget.class));
	}

	@Test
	void primitiveClassMember_andWrapperParameter_register() {
		TypeDescriptor descriptor = registry.descriptorFor(Widget.class, r -> r
			.member("stock", int.class, w -> w.stock == null ? 0 : w.stock, (w, v) -> w.stock = v)
			.method("restock", lookup()));
		Widget widget = new Widget();
		assertEquals(Boxed.of(0), descriptor.member("stock").get(widget));
		descriptor.method("restock").invoke(widget, List.of(Boxed.of(4)));
		assertEquals(Boxed.of(4), descriptor.member("stock").get(widget));
	}

	@Test
	void overloadedMethod_needsParameterTypes() {
		assertThrows(InvalidRegistrationException.class,
			() -> registry.descriptorFor(Widget.class, r -> r.method("resize", lookup())));
		TypeDescriptor descriptor = registry.descriptorFor(Widget.class, r -> r
			.method("resize", lookup(), int.class, int.class));
		assertEquals(List.of(TypeTag.INT, TypeTag.INT), descriptor.method("resize").parameterTypes());
	}

	@Test
	void missingMethod_throws() {
		assertThrows(InvalidRegistrationException.class,
			() -> registry.descriptorFor(Widget.class, r -> r.method("nonexistent", lookup())));
		assertThrows(InvalidRegistrationException.class,
			() -> registry.descriptorFor(Widget.class, r -> r.method("resize", lookup(), String.class)));
	}

	@Test
	void staticMethod_registers() {
		TypeDescriptor descriptor = registry.descriptorFor(Widget.class, r -> r.method("count", lookup()));
		MethodDescriptor count = descriptor.method("count");
		assertEquals(List.of(), count.parameterTypes());
		assertEquals(3, count.invoke(new Widget(), List.of()).asInt());
	}

	@Test
	void handleForWrongReceiver_throws() {
		assertThrows(InvalidRegistrationException.class, () -> registry.descriptorFor(Widget.class, r -> r
			.method("length", TypedHandles.function(String.class, TypeTag.INT, String::length))));
		assertThrows(InvalidRegistrationException.class, () -> registry.descriptorFor(Widget.class, r -> r
			.member("length", TypeTag.INT,
				TypedHandles.function(String.class, TypeTag.INT, String::length),
				TypedHandles.biConsumer(Widget.class, TypeTag.INT, (w, v) -> {}))));
	}

	@Test
	void accessorWithWrongTag_throws() {
		assertThrows(InvalidRegistrationException.class, () -> registry.descriptorFor(Widget.class, r -> r
			.member("label", TypeTag.INT,
				TypedHandles.function(Widget.class, TypeTag.STRING, Widget::label),
				TypedHandles.biConsumer(Widget.class, TypeTag.INT, (w, v) -> {}))));
	}

	@Test
	void emptyName_throws() {
		assertThrows(InvalidRegistrationException.class, () -> registry.descriptorFor(Widget.class, r -> r
			.member("", String.class, Widget::label, (w, v) -> w.label = v)));
	}

	@Test
	void named_overridesClassName() {
		TypeDescriptor descriptor = registry.descriptorFor(Widget.class, r -> r.named("Gizmo"));
		assertEquals("Gizmo", descriptor.className());
		assertTrue(descriptor.memberNames().isEmpty());
	}

	@Test
	void registrarAfterBuild_throws() {
		AtomicReference<Registrar<Widget>> escaped = new AtomicReference<>();
		registry.descriptorFor(Widget.class, escaped::set);
		assertThrows(IllegalStateException.class, () -> escaped.get().field("label", lookup()));
	}

	@Test
	void duplicateName_replacePolicy_lastWinsInFirstPosition() {
		TypeDescriptor descriptor = new TypeRegistry(new TypeRegistry.Settings(DuplicatePolicy.REPLACE))
			.descriptorFor(Widget.class, r -> r
				.member("label", String.class, w -> "first", (w, v) -> {})
				.field("weight", lookup())
				.member("label", String.class, w -> "second", (w, v) -> {}));
		assertEquals(List.of("label", "weight"), descriptor.memberNames());
		assertEquals("second", descriptor.member("label").get(new Widget()).asString());
	}

	@Test
	void duplicateName_rejectPolicy_throws() {
		TypeRegistry rejecting = new TypeRegistry(new TypeRegistry.Settings(DuplicatePolicy.REJECT));
		DuplicateRegistrationException e = assertThrows(DuplicateRegistrationException.class,
			() -> rejecting.descriptorFor(Widget.class, r -> r
				.method("count", lookup())
				.method("count", lookup())));
		assertEquals("count", e.name());
	}

	@Test
	void memberAndMethod_mayShareName() {
		TypeDescriptor descriptor = new TypeRegistry(new TypeRegistry.Settings(DuplicatePolicy.REJECT))
			.descriptorFor(Widget.class, r -> r
				.field("label", lookup())
				.method("label", lookup()));
		assertTrue(descriptor.hasMember("label"));
		assertTrue(descriptor.hasMethod("label"));
	}
}
