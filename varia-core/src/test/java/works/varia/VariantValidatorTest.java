package works.varia;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.varia.exceptions.InvalidUtf8Exception;
import works.varia.exceptions.MalformedVariantException;
import works.varia.exceptions.OffsetOutOfBoundsException;
import works.varia.exceptions.RecursionLimitExceededException;
import works.varia.exceptions.UnsortedDictionaryException;
import works.varia.exceptions.UnsupportedVersionException;
import works.varia.exceptions.VariantFormatException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VariantValidatorTest {
	private static final byte[] EMPTY_METADATA = { 0x11, 0x00, 0x00 };

	/**
	 * <code>{"a":1,"b":"x"}</code>
	 */
	private static final byte[] AB_METADATA = { 0x11, 0x02, 0x00, 0x01, 0x02, 'a', 'b' };
	private static final byte[] AB_VALUE = { 0x02, 0x02, 0x00, 0x01, 0x00, 0x02, 0x04, 0x0C, 0x01, 0x05, 'x' };

	private final VariantValidator validator = new VariantValidator();

	@ParameterizedTest
	@MethodSource("documents")
	void builderOutputIsValid(EncodedVariant encoded) {
		validator.validate(encoded.metadata(), encoded.value());
	}

	@Test
	void handWrittenExampleIsValid() {
		Variant decoded = validator.validate(AB_METADATA, AB_VALUE);
		assertEquals("x", decoded.getPath("b").orElseThrow().getString());
	}

	@Test
	void unsupportedVersion() {
		byte[] metadata = AB_METADATA.clone();
		metadata[0] = 0x12;
		UnsupportedVersionException e = assertThrows(UnsupportedVersionException.class, () -> validator.validate(metadata, AB_VALUE));
		assertEquals(0, e.byteOffset());
	}

	@Test
	void childOffsetPastSpan() {
		byte[] value = AB_VALUE.clone();
		value[6] = 0x09;
		OffsetOutOfBoundsException e = assertThrows(OffsetOutOfBoundsException.class, () -> validator.validate(AB_METADATA, value));
		assertEquals(6, e.byteOffset());
	}

	@Test
	void fieldIdOutOfRange() {
		byte[] value = AB_VALUE.clone();
		value[3] = 0x05;
		OffsetOutOfBoundsException e = assertThrows(OffsetOutOfBoundsException.class, () -> validator.validate(AB_METADATA, value));
		assertEquals(3, e.byteOffset());
	}

	@Test
	void fieldsOutOfOrder() {
		byte[] value = AB_VALUE.clone();
		value[2] = 0x01;
		value[3] = 0x00;
		MalformedVariantException e = assertThrows(MalformedVariantException.class, () -> validator.validate(AB_METADATA, value));
		assertEquals(3, e.byteOffset());
	}

	@Test
	void trailingValueBytes() {
		byte[] value = Arrays.copyOf(AB_VALUE, AB_VALUE.length + 1);
		assertThrows(MalformedVariantException.class, () -> validator.validate(AB_METADATA, value));
		assertThrows(MalformedVariantException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x00, 0x00)));
	}

	@Test
	void trailingMetadataBytes() {
		assertThrows(MalformedVariantException.class, () -> validator.validate(bytes(0x11, 0x00, 0x00, 0x99), bytes(0x00)));
	}

	@Test
	void dictionaryFlaggedSortedButIsNot() {
		byte[] metadata = { 0x11, 0x02, 0x00, 0x01, 0x02, 'b', 'a' };
		UnsortedDictionaryException e = assertThrows(UnsortedDictionaryException.class, () -> validator.validate(metadata, bytes(0x00)));
		assertEquals(3, e.byteOffset());
	}

	@Test
	void unsortedDictionaryWithoutFlagIsValid() {
		byte[] metadata = { 0x01, 0x02, 0x00, 0x01, 0x02, 'b', 'a' };
		// object {"a": null, "b": null}: "a" has id 1, "b" has id 0
		byte[] value = { 0x02, 0x02, 0x01, 0x00, 0x00, 0x01, 0x02, 0x00, 0x00 };
		Variant decoded = validator.validate(metadata, value);
		assertEquals(2, decoded.getObject().size());
		assertEquals("a", decoded.getObject().fieldName(0));
	}

	@Test
	void invalidUtf8() {
		assertThrows(InvalidUtf8Exception.class, () -> validator.validate(EMPTY_METADATA, bytes(0x05, 0xFF)));
		assertThrows(InvalidUtf8Exception.class, () -> validator.validate(bytes(0x11, 0x01, 0x00, 0x01, 0xC3), bytes(0x00)));
		byte[] longString = new byte[1 + 4 + 64];
		longString[0] = 0x40;
		longString[1] = 64;
		Arrays.fill(longString, 5, longString.length, (byte) 'a');
		longString[longString.length - 1] = (byte) 0xC3;
		assertThrows(InvalidUtf8Exception.class, () -> validator.validate(EMPTY_METADATA, longString));
	}

	@Test
	void shortStringInLongEncoding() {
		MalformedVariantException e = assertThrows(MalformedVariantException.class,
			() -> validator.validate(EMPTY_METADATA, bytes(0x40, 0x01, 0x00, 0x00, 0x00, 'a')));
		assertEquals(0, e.byteOffset());
		assertThrows(MalformedVariantException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x40, 0x00, 0x00, 0x00, 0x00)));

		byte[] sixtyFour = new byte[1 + 4 + 64];
		sixtyFour[0] = 0x40;
		sixtyFour[1] = 64;
		Arrays.fill(sixtyFour, 5, sixtyFour.length, (byte) 'a');
		assertEquals(64, validator.validate(EMPTY_METADATA, sixtyFour).getString().length());
	}

	@Test
	void timeOfDayOutOfRange() {
		MalformedVariantException negative = assertThrows(MalformedVariantException.class,
			() -> validator.validate(EMPTY_METADATA, bytes(17 << 2, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF)));
		assertEquals(1, negative.byteOffset());
		MalformedVariantException fullDay = assertThrows(MalformedVariantException.class,
			() -> validator.validate(EMPTY_METADATA, bytes(17 << 2, 0x00, 0x60, 0xD7, 0x1D, 0x14, 0x00, 0x00, 0x00)));
		assertEquals(1, fullDay.byteOffset());

		Variant lastMicro = validator.validate(EMPTY_METADATA, bytes(17 << 2, 0xFF, 0x5F, 0xD7, 0x1D, 0x14, 0x00, 0x00, 0x00));
		assertEquals(86_399_999_999L, lastMicro.getTimeMicros());
	}

	@Test
	void truncatedValues() {
		assertThrows(OffsetOutOfBoundsException.class, () -> validator.validate(EMPTY_METADATA, new byte[0]));
		assertThrows(OffsetOutOfBoundsException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x18, 0x01, 0x02, 0x03)));
		assertThrows(OffsetOutOfBoundsException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x09, 'a')));
		assertThrows(OffsetOutOfBoundsException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x40, 0xFF, 0xFF, 0xFF, 0xFF)));
		assertThrows(OffsetOutOfBoundsException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x03, 0x05, 0x00)));
	}

	@Test
	void unknownPrimitiveType() {
		assertThrows(MalformedVariantException.class, () -> validator.validate(EMPTY_METADATA, bytes(21 << 2)));
	}

	@Test
	void decimalOutOfRange() {
		// decimal4 with scale 10
		assertThrows(MalformedVariantException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x20, 10, 0x01, 0x00, 0x00, 0x00)));
		// decimal4 with unscaled value 1_000_000_000
		assertThrows(MalformedVariantException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x20, 0, 0x00, 0xCA, 0x9A, 0x3B)));
		// decimal4 with unscaled value 999_999_999
		validator.validate(EMPTY_METADATA, bytes(0x20, 0, 0xFF, 0xC9, 0x9A, 0x3B));
	}

	@Test
	void nonIncreasingOffsets() {
		assertThrows(MalformedVariantException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x03, 0x02, 0x00, 0x00, 0x01, 0x00)));
		assertThrows(MalformedVariantException.class, () -> validator.validate(EMPTY_METADATA, bytes(0x03, 0x01, 0x01, 0x02, 0x00, 0x00)));
	}

	@Test
	void depthLimit() {
		EncodedVariant deep = nestedArrays(5);
		new VariantValidator(new ValidationSettings(5)).validate(deep.metadata(), deep.value());
		RecursionLimitExceededException e = assertThrows(RecursionLimitExceededException.class,
			() -> new VariantValidator(new ValidationSettings(4)).validate(deep.metadata(), deep.value()));
		assertEquals(4 * 4, e.byteOffset()); // each enclosing array takes four bytes before its child
	}

	@Test
	void defaultDepthLimit() {
		EncodedVariant ok = nestedArrays(ValidationSettings.DEFAULT_MAX_DEPTH);
		validator.validate(ok.metadata(), ok.value());
		EncodedVariant tooDeep = nestedArrays(ValidationSettings.DEFAULT_MAX_DEPTH + 1);
		assertThrows(RecursionLimitExceededException.class, () -> validator.validate(tooDeep.metadata(), tooDeep.value()));
	}

	@Test
	void settingsRejectNonPositiveDepth() {
		assertThrows(IllegalArgumentException.class, () -> new ValidationSettings(0));
		assertEquals(7, ValidationSettings.DEFAULT.withMaxDepth(7).maxDepth());
	}

	@ParameterizedTest
	@MethodSource("documents")
	void everyTruncationIsRejected(EncodedVariant encoded) {
		for (int length = 0; length < encoded.value().length; length++) {
			byte[] truncated = Arrays.copyOf(encoded.value(), length);
			assertThrows(VariantFormatException.class, () -> validator.validate(encoded.metadata(), truncated), "length " + length);
		}
		for (int length = 0; length < encoded.metadata().length; length++) {
			byte[] truncated = Arrays.copyOf(encoded.metadata(), length);
			assertThrows(VariantFormatException.class, () -> validator.validate(truncated, encoded.value()), "metadata length " + length);
		}
	}

	/**
	 * Corrupting any single byte either still yields a valid variant, which can then be fully decoded,
	 * or is rejected with a {@link VariantFormatException}. Nothing else is thrown.
	 */
	@ParameterizedTest
	@MethodSource("documents")
	void singleByteCorruption(EncodedVariant encoded) {
		int[] replacements = { 0x00, 0x01, 0x7F, 0x80, 0xFF };
		for (int position = 0; position < encoded.value().length; position++) {
			for (int replacement: replacements) {
				byte[] corrupted = encoded.value().clone();
				corrupted[position] = (byte) replacement;
				checkCorrupted(encoded.metadata(), corrupted);
			}
		}
		for (int position = 0; position < encoded.metadata().length; position++) {
			for (int replacement: replacements) {
				byte[] corrupted = encoded.metadata().clone();
				corrupted[position] = (byte) replacement;
				checkCorrupted(corrupted, encoded.value());
			}
		}
	}

	private void checkCorrupted(byte[] metadata, byte[] value) {
		Variant decoded;
		try {
			decoded = validator.validate(metadata, value);
		} catch (VariantFormatException e) {
			return;
		}
		VariantBuilder copy = new VariantBuilder();
		copy.appendVariant(decoded);
		copy.finish().validate();
	}

	static Stream<EncodedVariant> documents() {
		VariantBuilder scalars = new VariantBuilder();
		try (ObjectBuilder object = scalars.startObject()) {
			object.key("null").appendNull();
			object.key("bool").appendBoolean(true);
			object.key("int").appendLong(-300);
			object.key("long").appendLong(1L << 40);
			object.key("float").appendFloat(1.25f);
			object.key("double").appendDouble(Math.PI);
			object.key("dec4").appendDecimal(new BigDecimal("-1.5"));
			object.key("dec8").appendDecimal(new BigDecimal("12345678901.5"));
			object.key("dec16").appendDecimal(new BigDecimal("1234567890123456789012.5"));
			object.key("date").appendDate(LocalDate.of(2000, 1, 1));
			object.key("ts").appendTimestamp(Instant.ofEpochSecond(1_700_000_000L));
			object.key("uuid").appendUuid(new UUID(1, 2));
			object.key("bin").appendBinary(new byte[] { 9, 8, 7 });
			object.key("short").appendString("hello");
			object.key("long string").appendString("y".repeat(70));
			object.end();
		}

		VariantBuilder nested = new VariantBuilder();
		try (ArrayBuilder array = nested.startArray()) {
			array.appendLong(1);
			try (ObjectBuilder object = array.startObject()) {
				object.key("k").appendString("v");
				try (ArrayBuilder inner = object.key("list").startArray()) {
					inner.appendBoolean(false);
					inner.appendNull();
					inner.end();
				}
				object.end();
			}
			array.startArray().end();
			array.end();
		}

		VariantBuilder string = new VariantBuilder();
		string.appendString("just a string");

		return Stream.of(scalars.finish(), nested.finish(), string.finish(), nestedArrays(3));
	}

	/**
	 * <code>depth</code> arrays, each the sole element of the one enclosing it; the innermost holds a null.
	 */
	private static EncodedVariant nestedArrays(int depth) {
		VariantBuilder builder = new VariantBuilder();
		appendNested(builder, depth);
		return builder.finish();
	}

	private static void appendNested(ValueAppender appender, int depth) {
		if (depth == 0) {
			appender.appendNull();
		} else {
			try (ArrayBuilder array = appender.startArray()) {
				appendNested(array, depth - 1);
				array.end();
			}
		}
	}

	private static byte[] bytes(int... values) {
		byte[] result = new byte[values.length];
		for (int i = 0; i < values.length; i++) {
			result[i] = (byte) values[i];
		}
		return result;
	}
}
