package works.varia.encoding;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import works.varia.exceptions.InvalidUtf8Exception;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Strict UTF-8 conversion: malformed input is reported, never replaced.
 */
public final class Utf8 {
	private Utf8() {}

	/**
	 * @param reportedOffset the byte offset to attach to the exception if decoding fails
	 * @throws InvalidUtf8Exception if the bytes are not well-formed UTF-8
	 */
	public static String decode(byte[] bytes, int offset, int length, int reportedOffset) {
		CharsetDecoder decoder = UTF_8.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			return decoder.decode(ByteBuffer.wrap(bytes, offset, length)).toString();
		} catch (CharacterCodingException e) {
			throw new InvalidUtf8Exception("Invalid UTF-8 in " + length + "-byte string", reportedOffset, e);
		}
	}

	/**
	 * @throws CharacterCodingException if <code>s</code> contains an unpaired surrogate
	 */
	public static byte[] encode(String s) throws CharacterCodingException {
		CharsetEncoder encoder = UTF_8.newEncoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		ByteBuffer encoded = encoder.encode(CharBuffer.wrap(s));
		byte[] result = new byte[encoded.remaining()];
		encoded.get(result);
		return result;
	}
}
