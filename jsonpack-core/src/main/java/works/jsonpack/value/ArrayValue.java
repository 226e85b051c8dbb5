package works.jsonpack.value;

import java.util.List;

/**
 * An ordered sequence of values. Order is preserved on the wire.
 */
public record ArrayValue(List<Value> elements) implements Value {
	public static final ArrayValue EMPTY = new ArrayValue(List.of());

	public ArrayValue {
		elements = List.copyOf(elements);
	}

	public static ArrayValue of(Value... elements) {
		return new ArrayValue(List.of(elements));
	}

	public int size() {
		return elements.size();
	}

	@Override
	public String kind() {
		return "array";
	}

	@Override
	public String toString() {
		return elements.toString();
	}
}
