package works.varia;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.varia.exceptions.UnsortedDictionaryException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataBuilderTest {

	@Test
	void addKey_isIdempotent() {
		MetadataBuilder builder = new MetadataBuilder();
		int a = builder.addKey("a");
		int b = builder.addKey("b");
		assertEquals(a, builder.addKey("a"));
		assertEquals(b, builder.addKey("b"));
		assertEquals(2, builder.size());
	}

	@Test
	void finish_sorted_exactBytes() {
		MetadataBuilder builder = new MetadataBuilder();
		builder.addKey("b");
		builder.addKey("a");
		MetadataBuilder.Finished finished = builder.finish(true);
		assertArrayEquals(new byte[] { 0x11, 0x02, 0x00, 0x01, 0x02, 'a', 'b' }, finished.bytes());
		assertEquals(1, finished.positionOf(0));
		assertEquals(0, finished.positionOf(1));
		assertFalse(finished.isIdentity());
	}

	@Test
	void finish_empty() {
		MetadataBuilder.Finished finished = new MetadataBuilder().finish(true);
		assertArrayEquals(new byte[] { 0x11, 0x00, 0x00 }, finished.bytes());
		assertTrue(finished.isIdentity());
	}

	@Test
	void finish_insertionOrder_sortedFlagOnlyWhenAlreadyIncreasing() {
		MetadataBuilder inOrder = new MetadataBuilder();
		inOrder.addKey("a");
		inOrder.addKey("b");
		assertTrue(VariantMetadata.of(inOrder.finish(false).bytes()).isSorted());

		MetadataBuilder outOfOrder = new MetadataBuilder();
		outOfOrder.addKey("b");
		outOfOrder.addKey("a");
		MetadataBuilder.Finished finished = outOfOrder.finish(false);
		VariantMetadata metadata = VariantMetadata.of(finished.bytes());
		assertFalse(metadata.isSorted());
		assertTrue(finished.isIdentity());
		assertEquals("b", metadata.get(0));
		assertEquals("a", metadata.get(1));
	}

	@Test
	void finish_widensOffsetsForLongNames() {
		MetadataBuilder builder = new MetadataBuilder();
		builder.addKey("x".repeat(300));
		VariantMetadata metadata = VariantMetadata.of(builder.finish(true).bytes());
		assertEquals(2, metadata.offsetSize());
		assertEquals("x".repeat(300), metadata.get(0));
	}

	@Test
	void truncate_forgetsNewerNames() {
		MetadataBuilder builder = new MetadataBuilder();
		builder.addKey("kept");
		builder.addKey("dropped");
		builder.truncate(1);
		assertEquals(1, builder.size());
		assertEquals(1, builder.addKey("another"));
		assertEquals(0, builder.addKey("kept"));
	}

	@ParameterizedTest
	@MethodSource("nameSets")
	void find_agreesWithLinearScan(List<String> names) {
		MetadataBuilder builder = new MetadataBuilder();
		names.forEach(builder::addKey);
		VariantMetadata metadata = VariantMetadata.of(builder.finish(true).bytes());
		assertTrue(metadata.isSorted());
		for (int id = 1; id < metadata.size(); id++) {
			assertTrue(metadata.compareEntries(id - 1, id) < 0, "entries must strictly increase");
		}
		for (String probe: Stream.concat(names.stream(), Stream.of("", "zzz", "absent", "é")).toList()) {
			assertEquals(linearScan(metadata, probe), metadata.find(probe), probe);
		}
	}

	static Stream<List<String>> nameSets() {
		return Stream.of(
			List.of(),
			List.of("only"),
			List.of("b", "a", "c"),
			List.of("Zebra", "apple", "Apple", "zebra"),
			List.of("é", "e", "f", "ø", "😀", "A"),
			List.of("a", "ab", "abc", "b", "ba", "")
		);
	}

	@Test
	void find_onUnsortedDictionary_throws() {
		MetadataBuilder builder = new MetadataBuilder();
		builder.addKey("b");
		builder.addKey("a");
		VariantMetadata metadata = VariantMetadata.of(builder.finish(false).bytes());
		assertThrows(UnsortedDictionaryException.class, () -> metadata.find("a"));
	}

	private static OptionalInt linearScan(VariantMetadata metadata, String name) {
		for (int id = 0; id < metadata.size(); id++) {
			if (metadata.get(id).equals(name)) {
				return OptionalInt.of(id);
			}
		}
		return OptionalInt.empty();
	}
}
