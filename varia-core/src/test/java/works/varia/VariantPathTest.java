package works.varia;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.varia.VariantPath.Field;
import works.varia.VariantPath.Index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariantPathTest {

	@Test
	void dottedNamesAndIndexes() {
		assertEquals(
			List.of(new Field("a"), new Field("b"), new Index(3), new Field("c")),
			VariantPath.parse("a.b[3].c").segments());
	}

	@Test
	void ofSegments() {
		assertEquals(VariantPath.parse("a[1]"), VariantPath.of(new Field("a"), new Index(1)));
	}

	@Test
	void leadingIndex() {
		assertEquals(List.of(new Index(0), new Index(12)), VariantPath.parse("[0][12]").segments());
	}

	@Test
	void quotedNames() {
		assertEquals(
			List.of(new Field("a"), new Field("x.y"), new Field("it's"), new Field("q\"uote")),
			VariantPath.parse("a[\"x.y\"]['it\\'s'][\"q\\\"uote\"]").segments());
	}

	@Test
	void empty() {
		assertTrue(VariantPath.parse("").isEmpty());
		assertEquals(VariantPath.empty(), VariantPath.parse(""));
	}

	@Test
	void toString_roundTrips() {
		VariantPath path = VariantPath.empty().then("a").then(2).then("b.c").then("").then("d");
		assertEquals("a[2][\"b.c\"][\"\"].d", path.toString());
		assertEquals(path, VariantPath.parse(path.toString()));
	}

	@ParameterizedTest
	@ValueSource(strings = { ".a", "a.", "a..b", "a[", "a[]", "a[x]", "a[1", "a]", "a[\"unterminated]", "a[-1]", "a[99999999999]", "a[1]b" })
	void malformed(String path) {
		assertThrows(IllegalArgumentException.class, () -> VariantPath.parse(path));
	}
}
