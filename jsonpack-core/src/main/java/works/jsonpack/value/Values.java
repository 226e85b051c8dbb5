package works.jsonpack.value;

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.jetbrains.annotations.Nullable;

/**
 * Adapts plain in-memory Java structures to {@link Value} trees.
 * <p>
 * This is the only way arbitrary objects reach the converter.
 * It understands the shapes a JSON document can take, plus typed scalars,
 * and nothing else: records, beans and other structured types are rejected,
 * because there is no schema-less way to choose their field names and types.
 */
public final class Values {
	private Values() { }

	/**
	 * Mappings:
	 * <ul>
	 *     <li>{@code null} and {@link Optional#empty()} become {@link NullValue};
	 *         a present {@link Optional} is unwrapped.</li>
	 *     <li>{@link Value} objects are returned unchanged.</li>
	 *     <li>{@link Double} becomes {@link NumberValue}, exactly like a parsed JSON number.</li>
	 *     <li>{@link Float} becomes {@link FloatValue}.</li>
	 *     <li>{@link Byte}, {@link Short}, {@link Integer}, {@link Long} and the atomic integer types
	 *         become signed {@link IntegerValue}s.</li>
	 *     <li>{@link BigInteger} becomes a signed {@link IntegerValue} if it fits in a {@code long},
	 *         or an unsigned one if it fits in 64 unsigned bits.</li>
	 *     <li>{@link CharSequence} becomes {@link StringValue}; {@code byte[]} becomes {@link BytesValue}.</li>
	 *     <li>{@link Map}s with {@link String} keys become {@link ObjectValue}s.</li>
	 *     <li>{@link Iterable}s and other Java arrays become {@link ArrayValue}s.</li>
	 * </ul>
	 *
	 * @throws IllegalArgumentException if {@code object}, or anything inside it, has no mapping
	 */
	public static Value from(@Nullable Object object) {
		if (object == null) {
			return NullValue.NULL;
		} else if (object instanceof Value v) {
			return v;
		} else if (object instanceof Optional<?> o) {
			return from(o.orElse(null));
		} else if (object instanceof Boolean b) {
			return BooleanValue.of(b);
		} else if (object instanceof Double d) {
			return NumberValue.of(d);
		} else if (object instanceof Float f) {
			return new FloatValue(f);
		} else if (object instanceof Byte || object instanceof Short || object instanceof Integer || object instanceof Long
			|| object instanceof AtomicInteger || object instanceof AtomicLong) {
			return IntegerValue.signed(((Number) object).longValue());
		} else if (object instanceof BigInteger big) {
			return fromBigInteger(big);
		} else if (object instanceof CharSequence s) {
			return StringValue.of(s.toString());
		} else if (object instanceof byte[] bytes) {
			return BytesValue.of(bytes);
		} else if (object instanceof Map<?, ?> map) {
			return fromMap(map);
		} else if (object instanceof Iterable<?> iterable) {
			List<Value> elements = new ArrayList<>();
			for (Object element : iterable) {
				elements.add(from(element));
			}
			return new ArrayValue(elements);
		} else if (object.getClass().isArray()) {
			int length = Array.getLength(object);
			List<Value> elements = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				elements.add(from(Array.get(object, i)));
			}
			return new ArrayValue(elements);
		} else {
			throw new IllegalArgumentException("Cannot convert " + object.getClass().getName()
				+ "; flatten it to maps, lists and scalars first");
		}
	}

	private static IntegerValue fromBigInteger(BigInteger big) {
		if (big.bitLength() <= 63) {
			return IntegerValue.signed(big.longValueExact());
		} else if (big.signum() > 0 && big.bitLength() <= 64) {
			return IntegerValue.unsigned(big.longValue());
		} else {
			throw new IllegalArgumentException("BigInteger out of 64-bit range: " + big);
		}
	}

	private static ObjectValue fromMap(Map<?, ?> map) {
		LinkedHashMap<String, Value> members = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			if (entry.getKey() instanceof String key) {
				members.put(key, from(entry.getValue()));
			} else {
				throw new IllegalArgumentException("Map keys must be strings; found "
					+ (entry.getKey() == null ? "null" : entry.getKey().getClass().getName()));
			}
		}
		return new ObjectValue(members);
	}
}
