package works.jsonpack;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonpack.exceptions.EncodeException;
import works.jsonpack.exceptions.NumericRangeException;
import works.jsonpack.exceptions.UnsupportedNumericValueException;
import works.jsonpack.exceptions.UnsupportedTypeHintException;

/**
 * Chooses the MessagePack type for a JSON number.
 * <p>
 * A hint for the {@link ConversionContext#currentKey() current key} always wins,
 * its tag chosen by the context's array position.
 * Without a hint, only numbers that are exactly a 64-bit signed integer are accepted.
 */
@RequiredArgsConstructor
public final class NumericResolver {
	private final TypeHints hints;
	private final boolean strictNumericRange;

	public NumericResolver(TypeHints hints) {
		this(hints, false);
	}

	public TypeTag resolve(double value, ConversionContext context) throws EncodeException {
		String key = context.currentKey();
		List<String> tags = hints.tagsFor(key);
		if (tags != null) {
			String tagName = tags.get(Math.floorMod(context.currentHint(), tags.size()));
			Optional<TypeTag> tag = TypeTag.fromTagName(tagName);
			if (tag.isEmpty()) {
				throw new UnsupportedTypeHintException(key, tagName);
			}
			if (strictNumericRange && !tag.get().fits(value)) {
				throw new NumericRangeException(key, tag.get(), value);
			}
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Number {} at {} hinted as {}", value, context, tag.get());
			}
			return tag.get();
		} else if (isLosslessInt64(value)) {
			return TypeTag.INT64;
		} else {
			throw new UnsupportedNumericValueException(value);
		}
	}

	/**
	 * {@code (long)} saturates rather than failing, so the range needs checking separately.
	 */
	static boolean isLosslessInt64(double value) {
		return value >= -0x1p63
			&& value < 0x1p63
			&& value == (double) (long) value;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NumericResolver.class);
}
