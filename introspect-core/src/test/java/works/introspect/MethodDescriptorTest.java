package works.introspect;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.introspect.exceptions.ArityMismatchException;
import works.introspect.exceptions.InvocationFailedException;
import works.introspect.exceptions.TypeMismatchException;
import works.introspect.handles.TypedHandles;
import works.introspect.types.TypeTag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.introspect.types.TypeTag.DOUBLE;
import static works.introspect.types.TypeTag.INT;
import static works.introspect.types.TypeTag.STRING;
import static works.introspect.types.TypeTag.VOID;

class MethodDescriptorTest {
	final TypeRegistry registry = new TypeRegistry();
	final Person person = new Person("Alice", 30, 1.7);
	final TypeDescriptor descriptor = registry.descriptorFor(Person.class, r -> {
		Person.register(r);
		r.method("liar", TypedHandles.function(Person.class, INT, p -> "not an int"));
		r.method("fail", TypedHandles.consumer(Person.class, p -> {
			throw new UnsupportedOperationException("nope");
		}));
		r.method("sum", TypedHandles.invoker(Person.class, DOUBLE, List.of(INT, DOUBLE, INT),
			(p, args) -> (Integer) args.get(0) + (Double) args.get(1) + (Integer) args.get(2)));
	});

	@Test
	void capturedSignature_matchesMethod() {
		MethodDescriptor method = descriptor.method("setNameAgeAndHeight");
		assertEquals(VOID, method.returnType());
		assertEquals(List.of(STRING, INT, DOUBLE), method.parameterTypes());
		assertEquals(3, method.arity());
	}

	@Test
	void voidMethod_returnsEmpty() {
		Boxed result = descriptor.method("introduce").invoke(person, List.of());
		assertSame(Boxed.empty(), result);
		assertEquals(1, person.introductions);
	}

	@Test
	void returnValue_isBoxedWithReturnTag() {
		Boxed result = descriptor.method("greet").invoke(person, List.of(Boxed.of("Bob")));
		assertEquals(STRING, result.tag());
		assertEquals("Hello Bob, I'm Alice", result.asString());
	}

	@Test
	void anyArity_usesSameDispatch() {
		assertEquals(30, descriptor.method("getAge").invoke(person, List.of()).asInt());
		descriptor.method("setNameAgeAndHeight").invoke(person, List.of(Boxed.of("Carol"), Boxed.of(41), Boxed.of(1.6)));
		assertEquals("Carol", person.getName());
		assertEquals(41, person.getAge());
		assertEquals(1.6, person.getHeight());
		assertEquals(6.5, descriptor.method("sum").invoke(person, List.of(Boxed.of(1), Boxed.of(2.5), Boxed.of(3))).asDouble());
	}

	@Test
	void wrongArity_throwsBeforeInvoking() {
		ArityMismatchException e = assertThrows(ArityMismatchException.class,
			() -> descriptor.method("introduce").invoke(person, List.of(Boxed.of(1), Boxed.of(2), Boxed.of(3))));
		assertEquals(0, e.expected());
		assertEquals(3, e.actual());
		assertEquals("Incorrect number of arguments for method 'introduce'. Expected 0, got 3", e.getMessage());
		assertEquals(0, person.introductions);
	}

	@Test
	void wrongArgumentType_throwsBeforeInvoking() {
		TypeMismatchException e = assertThrows(TypeMismatchException.class,
			() -> descriptor.method("setNameAndAge").invoke(person, List.of(Boxed.of("Toto"), Boxed.of(22.0))));
		assertEquals("int", e.expectedTag());
		assertEquals("double", e.actualTag());
		assertEquals("Alice", person.getName(), "The first argument must not have been applied");
		assertEquals(30, person.getAge());
	}

	@Test
	void wrongReturnType_throws() {
		TypeMismatchException e = assertThrows(TypeMismatchException.class,
			() -> descriptor.method("liar").invoke(person, List.of()));
		assertEquals("int", e.expectedTag());
		assertEquals("string", e.actualTag());
	}

	@Test
	void targetThrows_invocationFailed() {
		InvocationFailedException e = assertThrows(InvocationFailedException.class,
			() -> descriptor.method("fail").invoke(person, List.of()));
		assertTrue(e.getCause() instanceof UnsupportedOperationException);
	}

	@Test
	void wrongReceiver_throws() {
		assertThrows(IllegalArgumentException.class,
			() -> descriptor.method("introduce").invoke("not a person", List.of()));
	}

	@Test
	void toString_showsSignature() {
		assertEquals("setNameAndAge(string, int)->void", descriptor.method("setNameAndAge").toString());
	}
}
