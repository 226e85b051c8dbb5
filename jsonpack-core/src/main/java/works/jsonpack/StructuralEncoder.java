package works.jsonpack;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import works.jsonpack.exceptions.EncodeException;
import works.jsonpack.msgpack.MessagePackWriter;
import works.jsonpack.value.ArrayValue;
import works.jsonpack.value.BooleanValue;
import works.jsonpack.value.BytesValue;
import works.jsonpack.value.FloatValue;
import works.jsonpack.value.IntegerValue;
import works.jsonpack.value.NativeValue;
import works.jsonpack.value.NullValue;
import works.jsonpack.value.NumberValue;
import works.jsonpack.value.ObjectValue;
import works.jsonpack.value.StringValue;
import works.jsonpack.value.Value;

/**
 * Walks a {@link Value} tree and writes it as MessagePack.
 * <p>
 * Object members are written sorted by the bytes of their UTF-8 names,
 * so equal documents produce equal bytes regardless of member order.
 * Strings go through the {@link StringClassifier} and numbers through the {@link NumericResolver};
 * {@link NativeValue}s bypass both and are written as what they are.
 */
@RequiredArgsConstructor
public final class StructuralEncoder {
	private final StringClassifier stringClassifier;
	private final NumericResolver numericResolver;

	/**
	 * @return the context in effect after {@code value}, for use by whatever follows it
	 */
	public ConversionContext encode(Value value, ConversionContext context, MessagePackWriter out) throws EncodeException {
		if (value instanceof NullValue) {
			out.writeNil();
			return context;
		} else if (value instanceof BooleanValue b) {
			out.writeBoolean(b.value());
			return context;
		} else if (value instanceof NumberValue n) {
			numericResolver.resolve(n.value(), context).write(n.value(), out);
			return context;
		} else if (value instanceof StringValue s) {
			writeClassified(stringClassifier.classify(s), out);
			return context;
		} else if (value instanceof ArrayValue a) {
			return encodeArray(a, context, out);
		} else if (value instanceof ObjectValue o) {
			return encodeObject(o, context, out);
		} else if (value instanceof NativeValue n) {
			writeNative(n, out);
			return context;
		} else {
			throw new AssertionError("Unexpected value type: " + value.getClass());
		}
	}

	private ConversionContext encodeArray(ArrayValue array, ConversionContext context, MessagePackWriter out) throws EncodeException {
		out.writeArrayHeader(array.size());
		ConversionContext current = context.enteringArray();
		for (Value element : array.elements()) {
			current = encode(element, current, out).nextElement();
		}
		return current;
	}

	private ConversionContext encodeObject(ObjectValue object, ConversionContext context, MessagePackWriter out) throws EncodeException {
		out.writeMapHeader(object.size());
		ConversionContext current = context;
		for (Member member : sortedMembers(object)) {
			out.writeString(member.utf8Name);
			current = encode(member.value, current.withKey(member.name), out);
		}
		return current;
	}

	private static List<Member> sortedMembers(ObjectValue object) {
		List<Member> members = new ArrayList<>(object.size());
		for (Map.Entry<String, Value> entry : object.members().entrySet()) {
			members.add(new Member(entry.getKey(), StringValue.utf8(entry.getKey()), entry.getValue()));
		}
		members.sort(Comparator.comparing((Member m) -> m.utf8Name, Arrays::compareUnsigned));
		return members;
	}

	private record Member(String name, byte[] utf8Name, Value value) { }

	private static void writeClassified(ClassifiedString classified, MessagePackWriter out) {
		if (classified instanceof ClassifiedString.Text t) {
			out.writeString(t.utf8());
		} else if (classified instanceof ClassifiedString.Blob b) {
			out.writeBinary(b.bytes());
		}
	}

	private static void writeNative(NativeValue value, MessagePackWriter out) {
		if (value instanceof IntegerValue i) {
			if (i.unsigned()) {
				out.writeUnsigned(i.bits());
			} else {
				out.writeSigned(i.bits());
			}
		} else if (value instanceof FloatValue f) {
			out.writeFloat32(f.value());
		} else if (value instanceof BytesValue b) {
			out.writeBinary(b.bytes());
		}
	}
}
