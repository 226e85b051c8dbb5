package works.jsonpack;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonpack.exceptions.EncodeException;
import works.jsonpack.msgpack.MessagePackWriter;
import works.jsonpack.value.Value;
import works.jsonpack.value.Values;

import static java.util.Objects.requireNonNull;

/**
 * Converts JSON-shaped documents to MessagePack deterministically:
 * converting equal documents with equal hints always produces equal bytes.
 * <p>
 * Instances are immutable and may be shared between threads;
 * each call has its own buffer and context.
 *
 * @see TypeHints
 * @see StringClassifier
 */
public class JsonPackConverter {
	private final ConverterConfig config;
	private final StringClassifier stringClassifier;

	public JsonPackConverter(@NotNull ConverterConfig config) {
		this.config = requireNonNull(config);
		this.stringClassifier = new StringClassifier(config.identifierValidator());
	}

	public JsonPackConverter() {
		this(ConverterConfig.defaults());
	}

	public ConverterConfig config() {
		return config;
	}

	public byte[] convert(@NotNull Value document) throws EncodeException {
		return convert(document, TypeHints.none());
	}

	/**
	 * @return the complete MessagePack encoding of {@code document}
	 * @throws EncodeException at the first value that cannot be encoded; no partial output is returned
	 */
	public byte[] convert(@NotNull Value document, @NotNull TypeHints hints) throws EncodeException {
		requireNonNull(document);
		requireNonNull(hints);
		StructuralEncoder encoder = new StructuralEncoder(
			stringClassifier,
			new NumericResolver(hints, config.strictNumericRange()));
		MessagePackWriter out = new MessagePackWriter();
		try {
			encoder.encode(document, ConversionContext.initial(), out);
		} catch (EncodeException e) {
			LOGGER.debug("Conversion of {} failed: {}", document.kind(), e.getMessage());
			throw e;
		}
		LOGGER.debug("Converted {} to {} bytes using {}", document.kind(), out.size(), hints);
		return out.toByteArray();
	}

	/**
	 * Converts an in-memory structure of maps, lists and scalars.
	 *
	 * @throws IllegalArgumentException if {@code document} contains something {@link Values#from} can't adapt
	 */
	public byte[] convertObject(@Nullable Object document, @NotNull TypeHints hints) throws EncodeException {
		return convert(Values.from(document), hints);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + config + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonPackConverter.class);
}
