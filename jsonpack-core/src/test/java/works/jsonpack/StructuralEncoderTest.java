package works.jsonpack;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.jsonpack.exceptions.EncodeException;
import works.jsonpack.msgpack.MessagePackWriter;
import works.jsonpack.value.ArrayValue;
import works.jsonpack.value.BooleanValue;
import works.jsonpack.value.BytesValue;
import works.jsonpack.value.FloatValue;
import works.jsonpack.value.NullValue;
import works.jsonpack.value.NumberValue;
import works.jsonpack.value.ObjectValue;
import works.jsonpack.value.StringValue;
import works.jsonpack.value.Value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static works.jsonpack.HexStrings.bytes;
import static works.jsonpack.HexStrings.hex;
import static works.jsonpack.HexStrings.normalized;

/**
 * Checks the context each value hands on to whatever follows it.
 */
class StructuralEncoderTest {
	private StructuralEncoder encoder;
	private MessagePackWriter out;

	@BeforeEach
	void setUp() {
		encoder = new StructuralEncoder(
			new StringClassifier(IdentifierValidator.none()),
			new NumericResolver(TypeHints.none()));
		out = new MessagePackWriter();
	}

	@Test
	void scalars_leaveContextUnchanged() throws EncodeException {
		ConversionContext context = new ConversionContext("k", 3);
		for (Value scalar : new Value[]{
			NullValue.NULL,
			BooleanValue.TRUE,
			NumberValue.of(5),
			StringValue.of("s"),
			new FloatValue(1f),
			BytesValue.of(new byte[]{1}),
		}) {
			assertSame(context, encoder.encode(scalar, context, out));
		}
		assertEquals(normalized("c0 c3 05 a1 73 ca 3f 80 00 00 c4 01 01"), hex(out.toByteArray()));
	}

	@Test
	void array_returnsCounterPastItsLastElement() throws EncodeException {
		ArrayValue array = ArrayValue.of(NumberValue.of(1), NumberValue.of(2), NumberValue.of(3));
		ConversionContext after = encoder.encode(array, new ConversionContext("k", 9), out);
		assertEquals(new ConversionContext("k", 3), after);
	}

	@Test
	void emptyArray_resetsCounter() throws EncodeException {
		ConversionContext after = encoder.encode(ArrayValue.EMPTY, new ConversionContext("k", 9), out);
		assertEquals(new ConversionContext("k", 0), after);
	}

	@Test
	void object_returnsLastKeyInSortedOrder() throws EncodeException {
		ObjectValue object = ObjectValue.builder()
			.member("zebra", NullValue.NULL)
			.member("apple", NullValue.NULL)
			.build();
		ConversionContext after = encoder.encode(object, ConversionContext.initial(), out);
		assertEquals(new ConversionContext("zebra", 0), after);
	}

	@Test
	void emptyObject_keepsKey() throws EncodeException {
		ConversionContext before = new ConversionContext("k", 2);
		assertEquals(before, encoder.encode(ObjectValue.EMPTY, before, out));
		assertEquals(normalized("80"), hex(out.toByteArray()));
	}

	@Test
	void nonUtf8String_writtenAsBinary() throws EncodeException {
		encoder.encode(StringValue.ofBytes(bytes("c3 28")), ConversionContext.initial(), out);
		assertEquals(normalized("c4 02 c3 28"), hex(out.toByteArray()));
	}

	@Test
	void unpairedSurrogateInMemberName_writtenAsReplacementCharacter() throws EncodeException {
		ObjectValue object = ObjectValue.builder()
			.member("\ud800", NullValue.NULL)
			.build();
		encoder.encode(object, ConversionContext.initial(), out);
		assertEquals(normalized("81 a3 ef bf bd c0"), hex(out.toByteArray()));
	}
}
