package works.introspect;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

import static java.lang.invoke.MethodHandles.lookup;
import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonExportTest {
	final TypeRegistry registry = new TypeRegistry();

	static class Sample {
		String text = "plain";
		int count = 3;
		long big = 1L << 40;
		double ratio = 0.5;
		float scale = Float.NaN;
		boolean flag = true;
		char initial = 'Q';
		List<String> tags = new ArrayList<>(List.of("a", "b"));
		List<Double> weights = new ArrayList<>(List.of(1.5, Double.POSITIVE_INFINITY));
		AtomicReference<Integer> pointer = new AtomicReference<>(7);
		Object opaque = new Object();
	}

	TypeDescriptor descriptor() {
		return registry.descriptorFor(Sample.class, r -> {
			for (String name : List.of("text", "count", "big", "ratio", "scale", "flag", "initial", "tags", "weights", "pointer", "opaque")) {
				r.field(name, lookup());
			}
		});
	}

	@Test
	void allTags_exportInMemberOrder() {
		assertEquals(
			"{\"text\":\"plain\",\"count\":3,\"big\":1099511627776,\"ratio\":0.5,\"scale\":null,\"flag\":true,"
				+ "\"initial\":\"Q\",\"tags\":[\"a\",\"b\"],\"weights\":[1.5,null],\"pointer\":null,\"opaque\":null}",
			JsonExport.toJson(descriptor(), new Sample()));
	}

	@Test
	void strings_areEscaped() {
		Sample sample = new Sample();
		sample.text = "quote\" backslash\\ newline\n tab\t bell\u0007 é";
		String json = JsonExport.toJson(descriptor(), sample);
		assertEquals("{\"text\":\"quote\\\" backslash\\\\ newline\\n tab\\t bell\\u0007 é\"", json.substring(0, json.indexOf(",\"count\"")));
	}

	@Test
	void nullReferences_exportAsNull() {
		Sample sample = new Sample();
		sample.text = null;
		sample.tags = null;
		String json = JsonExport.toJson(descriptor(), sample);
		assertEquals("{\"text\":null,", json.substring(0, json.indexOf("\"count\"")));
		assertEquals(true, json.contains("\"tags\":null"));
	}

	@Test
	void noMembers_emptyObject() {
		TypeDescriptor empty = new TypeRegistry().descriptorFor(Sample.class, r -> {});
		assertEquals("{}", JsonExport.toJson(empty, new Sample()));
	}
}
