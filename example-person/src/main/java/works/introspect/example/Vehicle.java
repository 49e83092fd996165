package works.introspect.example;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.introspect.Reflective;
import works.introspect.Registrar;
import works.introspect.TypeDescriptor;
import works.introspect.TypeRegistry;

import static java.lang.invoke.MethodHandles.lookup;

/**
 * The {@code isRunning} member is backed by the {@code running} field.
 */
public class Vehicle implements Reflective {
	private String brand = "";
	private String model = "";
	private int year = 0;
	private double mileage = 0.0;
	private boolean running = false;

	public Vehicle() {}

	public Vehicle(String brand, String model, int year) {
		this.brand = brand;
		this.model = model;
		this.year = year;
	}

	static void register(Registrar<Vehicle> registrar) {
		registrar
			.field("brand", lookup())
			.field("model", lookup())
			.field("year", lookup())
			.field("mileage", lookup())
			.field("isRunning", "running", lookup())
			.method("getBrand", lookup())
			.method("setBrand", lookup())
			.method("getModel", lookup())
			.method("setModel", lookup())
			.method("getYear", lookup())
			.method("setYear", lookup())
			.method("getMileage", lookup())
			.method("setMileage", lookup())
			.method("getIsRunning", lookup())
			.method("start", lookup())
			.method("stop", lookup())
			.method("drive", lookup())
			.method("getInfo", lookup());
	}

	@Override
	public TypeDescriptor typeDescriptor() {
		return TypeRegistry.global().descriptorFor(Vehicle.class, Vehicle::register);
	}

	public String getBrand() {
		return brand;
	}

	public void setBrand(String brand) {
		this.brand = brand;
	}

	public String getModel() {
		return model;
	}

	public void setModel(String model) {
		this.model = model;
	}

	public int getYear() {
		return year;
	}

	public void setYear(int year) {
		this.year = year;
	}

	public double getMileage() {
		return mileage;
	}

	public void setMileage(double mileage) {
		this.mileage = mileage;
	}

	public boolean getIsRunning() {
		return running;
	}

	public void start() {
		running = true;
		LOGGER.info("{} {} started", brand, model);
	}

	public void stop() {
		running = false;
		LOGGER.info("{} {} stopped", brand, model);
	}

	/**
	 * Has no effect unless the vehicle has been {@link #start() started}.
	 */
	public void drive(double miles) {
		if (running) {
			mileage += miles;
			LOGGER.info("Drove {} miles; total mileage {}", miles, mileage);
		} else {
			LOGGER.info("{} {} is not running; can't drive", brand, model);
		}
	}

	public String getInfo() {
		return String.format(Locale.ROOT, "%s %s (%d) - %.1f miles", brand, model, year, mileage);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Vehicle.class);
}
