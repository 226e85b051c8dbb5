package works.jsonpack.jackson;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.StreamReadConstraints;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.core.json.JsonFactory;
import tools.jackson.databind.json.JsonMapper;
import works.jsonpack.ConverterConfig;
import works.jsonpack.JsonPackConverter;
import works.jsonpack.TypeHints;
import works.jsonpack.exceptions.EncodeException;
import works.jsonpack.exceptions.UpstreamParseException;
import works.jsonpack.value.Value;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonPackConverter} that also accepts JSON text, parsed with Jackson.
 * <p>
 * Input must be exactly one JSON value, optionally surrounded by whitespace.
 * The default mapper allows nesting up to {@value #MAX_NESTING_DEPTH} levels;
 * supply a {@link JsonMapper} to choose a different limit.
 */
public class JacksonJsonPackConverter extends JsonPackConverter {
	public static final int MAX_NESTING_DEPTH = 10_000;

	private final JsonMapper mapper;

	public JacksonJsonPackConverter(@NotNull ConverterConfig config, @NotNull JsonMapper mapper) {
		super(config);
		this.mapper = requireNonNull(mapper);
	}

	public JacksonJsonPackConverter(@NotNull ConverterConfig config) {
		this(config, defaultMapper());
	}

	public JacksonJsonPackConverter() {
		this(ConverterConfig.defaults());
	}

	/**
	 * Reads all of {@code in}, converts it, and writes the result to {@code out}.
	 * <p>
	 * Nothing is written unless the conversion succeeds;
	 * then the whole result is written at once and {@code out} is flushed.
	 * Neither stream is closed.
	 *
	 * @throws UpstreamParseException if the input is not a single well-formed JSON value
	 * @throws EncodeException if the document can't be converted
	 * @throws IOException if reading or writing fails
	 */
	public void convertStream(@NotNull InputStream in, @NotNull OutputStream out, @NotNull TypeHints hints) throws IOException, EncodeException {
		byte[] json;
		try {
			json = in.readAllBytes();
		} catch (IOException e) {
			throw new IOException("convertStream reading input", e);
		}
		Value document;
		try {
			document = parse(json);
		} catch (UpstreamParseException e) {
			throw new UpstreamParseException("convertStream unmarshalling JSON: " + e.getMessage(), e.getCause());
		}
		byte[] result = convert(document, hints);
		try {
			out.write(result);
			out.flush();
		} catch (IOException e) {
			throw new IOException("convertStream writing output", e);
		}
		LOGGER.debug("convertStream read {} bytes and wrote {}", json.length, result.length);
	}

	public byte[] convertJson(@NotNull String json, @NotNull TypeHints hints) throws EncodeException {
		return convert(parse(json.getBytes(UTF_8)), hints);
	}

	/**
	 * @throws UpstreamParseException if {@code json} is not a single well-formed JSON value in UTF-8
	 */
	public Value parse(byte[] json) throws UpstreamParseException {
		try (JsonParser p = mapper.createParser(json)) {
			p.nextToken();
			Value result = JsonValueReader.readValue(p);
			JsonToken trailing = p.nextToken();
			if (trailing != null) {
				throw new StreamReadException(p, "Unexpected content after the JSON value: " + trailing);
			}
			return result;
		} catch (JacksonException e) {
			throw new UpstreamParseException(e.getOriginalMessage(), e);
		}
	}

	public JsonMapper mapper() {
		return mapper;
	}

	/**
	 * A mapper that accepts documents nested up to {@link #MAX_NESTING_DEPTH} levels deep.
	 */
	public static JsonMapper defaultMapper() {
		JsonFactory factory = JsonFactory.builder()
			.streamReadConstraints(StreamReadConstraints.builder()
				.maxNestingDepth(MAX_NESTING_DEPTH)
				.build())
			.build();
		return JsonMapper.builder(factory).build();
	}

	static void expect(JsonToken expected, JsonParser p) {
		if (p.currentToken() != expected) {
			throw new StreamReadException(p, "Expected " + expected + "; found " + p.currentToken());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonJsonPackConverter.class);
}
