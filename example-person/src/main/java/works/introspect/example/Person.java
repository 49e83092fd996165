package works.introspect.example;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.introspect.Reflective;
import works.introspect.Registrar;
import works.introspect.TypeDescriptor;
import works.introspect.TypeRegistry;

import static java.lang.invoke.MethodHandles.lookup;

public class Person implements Reflective {
	private String name = "";
	private int age = 0;
	private double height = 0.0;

	public Person() {}

	public Person(String name, int age, double height) {
		this.name = name;
		this.age = age;
		this.height = height;
	}

	static void register(Registrar<Person> registrar) {
		registrar
			.field("name", lookup())
			.field("age", lookup())
			.field("height", lookup())
			.method("introduce", lookup())
			.method("getName", lookup())
			.method("setName", lookup())
			.method("getAge", lookup())
			.method("setAge", lookup())
			.method("getHeight", lookup())
			.method("setHeight", lookup())
			.method("setNameAndAge", lookup())
			.method("setNameAgeAndHeight", lookup())
			.method("getDescription", lookup());
	}

	@Override
	public TypeDescriptor typeDescriptor() {
		return TypeRegistry.global().descriptorFor(Person.class, Person::register);
	}

	public void introduce() {
		LOGGER.info("Hello, I'm {}, {} years old, {}m tall.", name, age, height);
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public int getAge() {
		return age;
	}

	public void setAge(int age) {
		this.age = age;
	}

	public double getHeight() {
		return height;
	}

	public void setHeight(double height) {
		this.height = height;
	}

	public void setNameAndAge(String name, int age) {
		setName(name);
		setAge(age);
	}

	public void setNameAgeAndHeight(String name, int age, double height) {
		setNameAndAge(name, age);
		setHeight(height);
	}

	public String getDescription() {
		return String.format(Locale.ROOT, "%s (%d years, %.2fm)", name, age, height);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Person.class);
}
