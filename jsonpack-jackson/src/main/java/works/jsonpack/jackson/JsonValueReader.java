package works.jsonpack.jackson;

import java.util.ArrayList;
import java.util.List;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import works.jsonpack.value.ArrayValue;
import works.jsonpack.value.BooleanValue;
import works.jsonpack.value.NullValue;
import works.jsonpack.value.NumberValue;
import works.jsonpack.value.ObjectValue;
import works.jsonpack.value.StringValue;
import works.jsonpack.value.Value;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.PROPERTY_NAME;

/**
 * Builds {@link Value} trees from a Jackson token stream.
 * <p>
 * Every JSON number becomes a {@link NumberValue}, whether or not it was written with a fraction or exponent.
 * {@code -0} keeps its sign.
 * Numbers too large for a {@code double} are rejected rather than read as infinity.
 * When an object repeats a member name, the last occurrence wins.
 */
final class JsonValueReader {
	private JsonValueReader() { }

	/**
	 * Reads the value starting at the parser's current token.
	 * Leaves the parser sitting on the value's last token.
	 */
	static Value readValue(JsonParser p) {
		JsonToken token = p.currentToken();
		if (token == null) {
			throw new StreamReadException(p, "No JSON content");
		}
		switch (token) {
			case START_OBJECT:
				return readObject(p);
			case START_ARRAY:
				return readArray(p);
			case VALUE_STRING:
				return StringValue.of(p.getString());
			case VALUE_NUMBER_INT:
				if ("-0".equals(p.getString())) {
					return NumberValue.of(-0.0);
				}
				return readNumber(p);
			case VALUE_NUMBER_FLOAT:
				return readNumber(p);
			case VALUE_TRUE:
				return BooleanValue.TRUE;
			case VALUE_FALSE:
				return BooleanValue.FALSE;
			case VALUE_NULL:
				return NullValue.NULL;
			default:
				throw new StreamReadException(p, "Unexpected token " + token);
		}
	}

	private static NumberValue readNumber(JsonParser p) {
		double value = p.getDoubleValue();
		if (!Double.isFinite(value)) {
			throw new StreamReadException(p, "Number out of range: " + p.getString());
		}
		return NumberValue.of(value);
	}

	private static ObjectValue readObject(JsonParser p) {
		ObjectValue.Builder builder = ObjectValue.builder();
		while (p.nextToken() != END_OBJECT) {
			JacksonJsonPackConverter.expect(PROPERTY_NAME, p);
			String name = p.currentName();
			p.nextToken();
			builder.member(name, readValue(p));
		}
		return builder.build();
	}

	private static ArrayValue readArray(JsonParser p) {
		List<Value> elements = new ArrayList<>();
		while (p.nextToken() != END_ARRAY) {
			elements.add(readValue(p));
		}
		return new ArrayValue(elements);
	}
}
