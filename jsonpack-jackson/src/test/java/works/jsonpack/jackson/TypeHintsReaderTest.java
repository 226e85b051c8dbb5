package works.jsonpack.jackson;

import java.io.ByteArrayInputStream;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.jsonpack.TypeHints;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TypeHintsReaderTest {
	private final TypeHintsReader reader = new TypeHintsReader();

	@Test
	void arraysAndBareStrings() {
		TypeHints expected = TypeHints.builder()
			.hint("", "int64", "uint64")
			.hint("ChangeOn", "uint64")
			.hint("Ratio", "float64")
			.build();
		assertEquals(expected, reader.read("{\"\": [\"int64\", \"uint64\"], \"ChangeOn\": [\"uint64\"], \"Ratio\": \"float64\"}"));
	}

	@Test
	void emptyObject_isNone() {
		assertSame(TypeHints.none(), reader.read("{}"));
	}

	@Test
	void inputStream() throws Exception {
		TypeHints hints = reader.read(new ByteArrayInputStream("{\"x\": \"int8\"}".getBytes(UTF_8)));
		assertEquals(List.of("int8"), hints.tagsFor("x"));
	}

	@Test
	void unknownTags_areKept() {
		assertEquals(List.of("decimal"), reader.read("{\"x\": [\"decimal\"]}").tagsFor("x"));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"[]",
		"\"int64\"",
		"{\"x\": 1}",
		"{\"x\": [1]}",
		"{\"x\": [\"int64\", null]}",
		"{\"x\": {}}",
		"{\"x\": []}",
		"{\"x\": [\"int64\"]",
		"{} {}",
		"",
	})
	void malformed_throws(String json) {
		assertThrows(IllegalArgumentException.class, () -> reader.read(json));
	}

	@Test
	void errorMessage_namesKey() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
			() -> reader.read("{\"Fee\": [true]}"));
		assertThat(e.getMessage(), containsString("Fee"));
	}
}
