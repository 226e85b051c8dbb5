package works.jsonpack;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonpack.ClassifiedString.Blob;
import works.jsonpack.ClassifiedString.Text;
import works.jsonpack.value.StringValue;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Decides whether a JSON string is text or an encoded byte string.
 * <p>
 * The rules, in order; the first that applies wins:
 * <ol>
 *     <li>If the bytes are not valid UTF-8, they are a byte string, as-is.</li>
 *     <li>If the {@link IdentifierValidator} recognizes the text, it is text.
 *         This must come before the base64 check,
 *         because some identifiers are also valid base64.</li>
 *     <li>If the text is standard, padded base64, its decoded bytes are a byte string.</li>
 *     <li>Otherwise, it is text.</li>
 * </ol>
 *
 * Every string gets an answer; classification cannot fail.
 */
@RequiredArgsConstructor
public final class StringClassifier {
	private final IdentifierValidator identifierValidator;

	public ClassifiedString classify(StringValue string) {
		byte[] bytes = string.bytes();
		String text = decodeStrictly(bytes);
		if (text == null) {
			trace("not UTF-8", string);
			return new Blob(bytes);
		} else if (identifierValidator.isValid(text)) {
			trace("identifier", string);
			return new Text(bytes);
		}
		byte[] decoded = decodePaddedBase64(text);
		if (decoded == null) {
			trace("text", string);
			return new Text(bytes);
		} else {
			trace("base64", string);
			return new Blob(decoded);
		}
	}

	/**
	 * @return null if {@code bytes} is not well-formed UTF-8
	 */
	static @Nullable String decodeStrictly(byte[] bytes) {
		CharsetDecoder decoder = UTF_8.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes));
			return chars.toString();
		} catch (CharacterCodingException e) {
			return null;
		}
	}

	/**
	 * Accepts only the standard alphabet, with padding, as a whole number of 4-character groups.
	 * Line breaks are ignored.
	 *
	 * @return null if {@code text} is not standard padded base64
	 */
	static byte @Nullable [] decodePaddedBase64(String text) {
		String stripped = (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0)
			? text.replace("\n", "").replace("\r", "")
			: text;
		if (stripped.length() % 4 != 0) {
			return null;
		}
		try {
			return Base64.getDecoder().decode(stripped);
		} catch (IllegalArgumentException e) {
			return null;
		}
	}

	private static void trace(String classification, StringValue string) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("String {} classified as {}", string, classification);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StringClassifier.class);
}
