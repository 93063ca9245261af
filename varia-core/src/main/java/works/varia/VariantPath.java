package works.varia;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A sequence of object field names and array indexes leading from a value to one of its descendants.
 * <p>
 * The text form is a dot-separated list of field names, with array indexes in brackets:
 * <code>a.b[3].c</code>. Field names containing <code>.</code>, <code>[</code> or <code>]</code>
 * go in quoted brackets, with backslash escaping the quote and the backslash:
 * <code>a["x.y"]</code> or <code>a['x.y']</code>.
 * The empty string is the empty path, which denotes the value itself.
 */
public final class VariantPath {
	private final List<Segment> segments;

	private VariantPath(List<Segment> segments) {
		this.segments = List.copyOf(segments);
	}

	public static VariantPath of(Segment... segments) {
		return new VariantPath(List.of(segments));
	}

	public static VariantPath empty() {
		return EMPTY;
	}

	/**
	 * @throws IllegalArgumentException if <code>path</code> is not well-formed
	 */
	public static VariantPath parse(String path) {
		return new Parser(path).parse();
	}

	public List<Segment> segments() {
		return segments;
	}

	public boolean isEmpty() {
		return segments.isEmpty();
	}

	public VariantPath then(String fieldName) {
		return then(new Field(fieldName));
	}

	public VariantPath then(int index) {
		return then(new Index(index));
	}

	private VariantPath then(Segment segment) {
		List<Segment> result = new ArrayList<>(segments);
		result.add(segment);
		return new VariantPath(result);
	}

	public sealed interface Segment permits Field, Index { }

	public record Field(String name) implements Segment {
		public Field {
			requireNonNull(name);
		}
	}

	public record Index(int index) implements Segment {
		public Index {
			if (index < 0) {
				throw new IllegalArgumentException("Negative array index: " + index);
			}
		}
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof VariantPath other && other.segments.equals(segments);
	}

	@Override
	public int hashCode() {
		return segments.hashCode();
	}

	/**
	 * The text form, which {@link #parse} accepts.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Segment segment: segments) {
			if (segment instanceof Index index) {
				sb.append('[').append(index.index()).append(']');
			} else if (segment instanceof Field field) {
				String name = field.name();
				if (isPlainName(name)) {
					if (sb.length() > 0) {
						sb.append('.');
					}
					sb.append(name);
				} else {
					sb.append("[\"").append(name.replace("\\", "\\\\").replace("\"", "\\\"")).append("\"]");
				}
			}
		}
		return sb.toString();
	}

	private static boolean isPlainName(String name) {
		if (name.isEmpty()) {
			return false;
		}
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (c == '.' || c == '[' || c == ']' || c == '"' || c == '\'' || c == '\\') {
				return false;
			}
		}
		return true;
	}

	private static final class Parser {
		final String text;
		final List<Segment> segments = new ArrayList<>();
		int pos = 0;

		Parser(String text) {
			this.text = requireNonNull(text);
		}

		VariantPath parse() {
			if (text.isEmpty()) {
				return EMPTY;
			}
			if (peek() != '[') {
				plainName();
			}
			while (pos < text.length()) {
				char c = text.charAt(pos);
				if (c == '.') {
					pos++;
					plainName();
				} else if (c == '[') {
					pos++;
					bracket();
				} else {
					throw error("Expected '.' or '['");
				}
			}
			return new VariantPath(segments);
		}

		private void plainName() {
			int start = pos;
			while (pos < text.length()) {
				char c = text.charAt(pos);
				if (c == '.' || c == '[') {
					break;
				} else if (c == ']' || c == '"' || c == '\'' || c == '\\') {
					throw error("Unexpected '" + c + "' in field name");
				}
				pos++;
			}
			if (pos == start) {
				throw error("Empty field name");
			}
			segments.add(new Field(text.substring(start, pos)));
		}

		private void bracket() {
			char c = peek();
			if (c == '"' || c == '\'') {
				pos++;
				segments.add(new Field(quoted(c)));
			} else {
				int start = pos;
				while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
					pos++;
				}
				if (pos == start) {
					throw error("Expected an array index or a quoted field name");
				}
				try {
					segments.add(new Index(Integer.parseInt(text.substring(start, pos))));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Array index too large at position " + start + " in path \"" + text + "\"", e);
				}
			}
			if (peek() != ']') {
				throw error("Expected ']'");
			}
			pos++;
		}

		private String quoted(char quote) {
			StringBuilder sb = new StringBuilder();
			while (true) {
				if (pos >= text.length()) {
					throw error("Unterminated quoted field name");
				}
				char c = text.charAt(pos++);
				if (c == quote) {
					return sb.toString();
				} else if (c == '\\') {
					if (pos >= text.length()) {
						throw error("Unterminated escape");
					}
					char escaped = text.charAt(pos++);
					if (escaped != '\\' && escaped != '"' && escaped != '\'') {
						throw error("Unsupported escape '\\" + escaped + "'");
					}
					sb.append(escaped);
				} else {
					sb.append(c);
				}
			}
		}

		private char peek() {
			return pos < text.length() ? text.charAt(pos) : '\0';
		}

		private IllegalArgumentException error(String message) {
			return new IllegalArgumentException(message + " at position " + pos + " in path \"" + text + "\"");
		}
	}

	private static final VariantPath EMPTY = new VariantPath(List.of());
}
