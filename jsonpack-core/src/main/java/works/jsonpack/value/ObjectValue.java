package works.jsonpack.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A mapping from member names to values.
 * <p>
 * The iteration order of {@link #members()} is the order the members were supplied in.
 * It has no effect on the encoding: members are always written in sorted key order.
 */
public record ObjectValue(Map<String, Value> members) implements Value {
	public static final ObjectValue EMPTY = new ObjectValue(Map.of());

	public ObjectValue {
		LinkedHashMap<String, Value> copy = new LinkedHashMap<>();
		members.forEach((k, v) -> copy.put(requireNonNull(k, "member name"), requireNonNull(v, "member value")));
		members = Collections.unmodifiableMap(copy);
	}

	public static Builder builder() {
		return new Builder();
	}

	public int size() {
		return members.size();
	}

	@Override
	public String kind() {
		return "object";
	}

	@Override
	public String toString() {
		return members.toString();
	}

	public static final class Builder {
		private final LinkedHashMap<String, Value> members = new LinkedHashMap<>();

		Builder() { }

		/**
		 * A later member with the same name replaces the earlier one.
		 */
		public Builder member(String name, Value value) {
			members.put(requireNonNull(name), requireNonNull(value));
			return this;
		}

		public ObjectValue build() {
			return new ObjectValue(members);
		}
	}
}
