package works.jsonpack;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * Tells the converter which numeric type to use for numbers JSON cannot describe precisely.
 * <p>
 * Each entry maps a <em>hint key</em> to a non-empty list of type tag names.
 * A number is looked up by the most recent object member name seen during the conversion
 * (not necessarily the member that contains it),
 * and the tag is taken from the list at the number's position in its innermost array,
 * wrapping around cyclically. A number outside any array uses the first tag.
 * <p>
 * Two common shapes:
 * <ul>
 *     <li>
 *         One tag per field, as in {@code {"Fee": ["int64"], "ChangeOn": ["uint64"]}},
 *         to type every occurrence of a field the same way.
 *     </li>
 *     <li>
 *         A positional hint under the empty key, as in {@code {"": ["int64", "uint64"]}},
 *         for unnamed arrays of pairs like {@code [[0,1],[-2,3],[4,5]]}.
 *         The empty key also applies to numbers encountered before any member name.
 *     </li>
 * </ul>
 *
 * The counter behind positional hints is reset whenever <em>any</em> array begins,
 * so only the innermost of nested arrays can be addressed positionally.
 * <p>
 * Tag names are checked when a number actually uses them, not here;
 * see {@link TypeTag} for the recognized names.
 */
public final class TypeHints {
	private static final TypeHints NONE = new TypeHints(Map.of());

	private final Map<String, List<String>> tagsByKey;

	private TypeHints(Map<String, List<String>> tagsByKey) {
		this.tagsByKey = tagsByKey;
	}

	public static TypeHints none() {
		return NONE;
	}

	/**
	 * @throws IllegalArgumentException if any list is empty
	 * @throws NullPointerException if any key, list, or tag is null
	 */
	public static TypeHints of(Map<String, ? extends List<String>> tagsByKey) {
		Builder builder = builder();
		tagsByKey.forEach(builder::hint);
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the tag names for {@code key}, or null if there is no hint for it
	 */
	public @Nullable List<String> tagsFor(String key) {
		return tagsByKey.get(key);
	}

	public boolean isEmpty() {
		return tagsByKey.isEmpty();
	}

	public Map<String, List<String>> asMap() {
		return tagsByKey;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return tagsByKey.equals(((TypeHints) o).tagsByKey);
	}

	@Override
	public int hashCode() {
		return tagsByKey.hashCode();
	}

	@Override
	public String toString() {
		return "TypeHints" + tagsByKey;
	}

	public static final class Builder {
		private final LinkedHashMap<String, List<String>> tagsByKey = new LinkedHashMap<>();

		Builder() { }

		/**
		 * Replaces any earlier hint for the same key.
		 */
		public Builder hint(String key, List<String> tagNames) {
			requireNonNull(key, "Hint key can't be null; use \"\" for positional hints");
			if (tagNames.isEmpty()) {
				throw new IllegalArgumentException("Type hint \"" + key + "\" has no tags");
			}
			tagsByKey.put(key, List.copyOf(tagNames));
			return this;
		}

		public Builder hint(String key, String... tagNames) {
			return hint(key, asList(tagNames));
		}

		public Builder hint(String key, TypeTag... tags) {
			return hint(key, Stream.of(tags).map(TypeTag::tagName).toList());
		}

		public TypeHints build() {
			if (tagsByKey.isEmpty()) {
				return NONE;
			}
			return new TypeHints(Collections.unmodifiableMap(new LinkedHashMap<>(tagsByKey)));
		}
	}
}
