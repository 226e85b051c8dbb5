package works.jsonpack.jackson;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.jsonpack.TypeHints;
import works.jsonpack.TypeTag;
import works.jsonpack.exceptions.UnsupportedNumericValueException;
import works.jsonpack.exceptions.UpstreamParseException;
import works.jsonpack.value.NumberValue;
import works.jsonpack.value.ObjectValue;
import works.jsonpack.value.StringValue;
import works.jsonpack.value.Value;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JacksonJsonPackConverterTest {
	private final JacksonJsonPackConverter converter = new JacksonJsonPackConverter();

	@Test
	void parse_buildsValues() throws Exception {
		Value expected = ObjectValue.builder()
			.member("n", NumberValue.of(1))
			.member("f", NumberValue.of(2.5))
			.member("s", StringValue.of("x"))
			.build();
		assertEquals(expected, converter.parse(bytes("{\"n\": 1, \"f\": 2.5, \"s\": \"x\"}")));
	}

	@Test
	void parse_integersAndFloatsAreAlike() throws Exception {
		assertEquals(converter.parse(bytes("100")), converter.parse(bytes("1e2")));
		assertEquals(converter.parse(bytes("100")), converter.parse(bytes("100.0")));
	}

	@Test
	void parse_duplicateMember_lastWins() throws Exception {
		assertEquals(
			ObjectValue.builder().member("a", NumberValue.of(2)).build(),
			converter.parse(bytes("{\"a\": 1, \"a\": 2}")));
	}

	@Test
	void convertJson_scenarios() throws Exception {
		assertEquals("a3666f6f", hex(converter.convertJson("\"foo\"", TypeHints.none())));
		assertEquals("c4020f00", hex(converter.convertJson("\"DwA=\"", TypeHints.none())));
		assertEquals("81a3666f6fa9626565666561746572", hex(converter.convertJson("{\"foo\": \"beefeater\"}", TypeHints.none())));
		assertEquals("c0", hex(converter.convertJson("null", TypeHints.none())));
		assertEquals("92c3c2", hex(converter.convertJson("[true, false]", TypeHints.none())));
	}

	@Test
	void convertJson_positionalHints() throws Exception {
		TypeHints hints = TypeHints.builder().hint("", TypeTag.INT64, TypeTag.UINT64).build();
		assertEquals(
			"9192d3000007127db7c000cf00000002540be400",
			hex(converter.convertJson("[[7776000000000,10000000000]]", hints)));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		"   ",
		"{",
		"[1, 2",
		"{\"a\" 1}",
		"nul",
		"1 2",
		"{} []",
		"'single quotes'",
		"NaN",
	})
	void malformedInput_isUpstreamParseException(String json) {
		assertThrows(UpstreamParseException.class, () -> converter.parse(bytes(json)));
		assertThrows(UpstreamParseException.class, () -> converter.convertJson(json, TypeHints.none()));
	}

	@Test
	void invalidUtf8Input_isUpstreamParseException() {
		byte[] json = {'"', (byte) 0xff, '"'};
		assertThrows(UpstreamParseException.class, () -> converter.parse(json));
	}

	@Test
	void loneSurrogateEscape_becomesReplacementCharacter() throws Exception {
		assertEquals("a3efbfbd", hex(converter.convert(converter.parse(bytes("\"\\ud800\"")))));
		assertEquals("81a3efbfbdc0", hex(converter.convertJson("{\"\\udc00\": null}", TypeHints.none())));
		assertEquals("a5efbfbd6869", hex(converter.convertJson("\"\\ud800hi\"", TypeHints.none())));
	}

	@Test
	void negativeZero_keepsItsSign() throws Exception {
		TypeHints hints = TypeHints.builder().hint("", TypeTag.FLOAT64).build();
		assertEquals("cb8000000000000000", hex(converter.convertJson("-0", hints)));
		assertEquals("cb8000000000000000", hex(converter.convertJson("-0.0", hints)));
		assertEquals("cb0000000000000000", hex(converter.convertJson("0", hints)));
	}

	@ParameterizedTest
	@ValueSource(strings = {"1e400", "-1e400", "[1e309]"})
	void numbersBeyondDoubleRange_areUpstreamParseException(String json) {
		TypeHints hints = TypeHints.builder().hint("", TypeTag.FLOAT64).build();
		UpstreamParseException e = assertThrows(UpstreamParseException.class, () -> converter.convertJson(json, hints));
		assertThat(e.getMessage(), containsString("out of range"));
	}

	@Test
	void deeplyNestedDocument_isAccepted() throws Exception {
		int depth = 1000;
		String json = "[".repeat(depth) + "]".repeat(depth);
		byte[] result = converter.convertJson(json, TypeHints.none());
		assertEquals(depth, result.length);
		assertEquals("9190", hex(new byte[]{result[depth - 2], result[depth - 1]}));
	}

	@Test
	void defaultMapper_raisesNestingLimit() {
		assertEquals(JacksonJsonPackConverter.MAX_NESTING_DEPTH,
			converter.mapper().tokenStreamFactory().streamReadConstraints().getMaxNestingDepth());
	}

	@Test
	void trailingWhitespace_isFine() throws Exception {
		assertEquals(NumberValue.of(1), converter.parse(bytes(" 1 \n")));
	}

	@Test
	void convertStream_parseFailure_writesNothing() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		UpstreamParseException e = assertThrows(UpstreamParseException.class,
			() -> converter.convertStream(input("[1,"), out, TypeHints.none()));
		assertThat(e.getMessage(), startsWith("convertStream unmarshalling JSON"));
		assertEquals(0, out.size());
	}

	@Test
	void convertStream_encodeFailure_writesNothing() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		assertThrows(UnsupportedNumericValueException.class,
			() -> converter.convertStream(input("[1, 2, 0.5]"), out, TypeHints.none()));
		assertEquals(0, out.size());
	}

	@Test
	void convertStream_readFailure_isWrapped() {
		InputStream broken = new InputStream() {
			@Override
			public int read() throws IOException {
				throw new IOException("disk on fire");
			}
		};
		IOException e = assertThrows(IOException.class,
			() -> converter.convertStream(broken, new ByteArrayOutputStream(), TypeHints.none()));
		assertEquals("convertStream reading input", e.getMessage());
		assertEquals("disk on fire", e.getCause().getMessage());
	}

	@Test
	void convertStream_writeFailure_isWrapped() {
		OutputStream broken = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw new IOException("pipe closed");
			}
		};
		IOException e = assertThrows(IOException.class,
			() -> converter.convertStream(input("1"), broken, TypeHints.none()));
		assertEquals("convertStream writing output", e.getMessage());
	}

	@Test
	void convertStream_leavesStreamsOpen() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		converter.convertStream(input("{\"x\": {}}"), out, TypeHints.none());
		out.write(0xc0);
		assertEquals("81a17880c0", hex(out.toByteArray()));
	}

	@Test
	void parseErrors_keepJacksonCause() {
		UpstreamParseException e = assertThrows(UpstreamParseException.class, () -> converter.parse(bytes("[1,")));
		assertThat(e.getCause().getClass().getName(), containsString("jackson"));
	}

	@Test
	void mapper_isExposed() {
		JacksonJsonPackConverter other = new JacksonJsonPackConverter(converter.config(), converter.mapper());
		assertSame(converter.mapper(), other.mapper());
	}

	private static byte[] bytes(String json) {
		return json.getBytes(UTF_8);
	}

	private static InputStream input(String json) {
		return new ByteArrayInputStream(bytes(json));
	}

	private static String hex(byte[] bytes) {
		return HexFormat.of().formatHex(bytes);
	}
}
