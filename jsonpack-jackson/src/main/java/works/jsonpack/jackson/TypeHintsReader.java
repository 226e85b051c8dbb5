package works.jsonpack.jackson;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.json.JsonMapper;
import works.jsonpack.TypeHints;

import static java.nio.charset.StandardCharsets.UTF_8;
import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.PROPERTY_NAME;
import static tools.jackson.core.JsonToken.START_ARRAY;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Reads {@link TypeHints} written as JSON, like
 * <pre>
 * {"": ["int64", "uint64"], "ChangeOn": ["uint64"], "Ratio": "float64"}
 * </pre>
 * A bare string stands for a list of one tag.
 * Tag names are not checked here; see {@link TypeHints}.
 */
@RequiredArgsConstructor
public final class TypeHintsReader {
	private final JsonMapper mapper;

	public TypeHintsReader() {
		this(JsonMapper.builder().build());
	}

	/**
	 * @throws IllegalArgumentException if {@code json} is malformed or not shaped like a hint table
	 */
	public TypeHints read(String json) {
		return read(json.getBytes(UTF_8));
	}

	public TypeHints read(InputStream in) throws IOException {
		return read(in.readAllBytes());
	}

	public TypeHints read(byte[] json) {
		try (JsonParser p = mapper.createParser(json)) {
			p.nextToken();
			TypeHints result = readHints(p);
			if (p.nextToken() != null) {
				throw new StreamReadException(p, "Unexpected content after type hints");
			}
			return result;
		} catch (JacksonException e) {
			throw new IllegalArgumentException("Malformed type hints: " + e.getOriginalMessage(), e);
		}
	}

	private static TypeHints readHints(JsonParser p) {
		if (p.currentToken() != START_OBJECT) {
			throw new IllegalArgumentException("Type hints must be a JSON object; found " + p.currentToken());
		}
		TypeHints.Builder builder = TypeHints.builder();
		while (p.nextToken() != END_OBJECT) {
			JacksonJsonPackConverter.expect(PROPERTY_NAME, p);
			String key = p.currentName();
			p.nextToken();
			builder.hint(key, readTags(key, p));
		}
		return builder.build();
	}

	private static List<String> readTags(String key, JsonParser p) {
		JsonToken token = p.currentToken();
		if (token == VALUE_STRING) {
			return List.of(p.getString());
		} else if (token != START_ARRAY) {
			throw new IllegalArgumentException("Type hint \"" + key + "\" must be a string or an array of strings; found " + token);
		}
		List<String> tags = new ArrayList<>();
		while (p.nextToken() != END_ARRAY) {
			if (p.currentToken() != VALUE_STRING) {
				throw new IllegalArgumentException("Type hint \"" + key + "\" has a non-string tag: " + p.currentToken());
			}
			tags.add(p.getString());
		}
		if (tags.isEmpty()) {
			throw new IllegalArgumentException("Type hint \"" + key + "\" has no tags");
		}
		return tags;
	}
}
