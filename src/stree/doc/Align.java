package stree.doc;

import java.util.List;
import java.util.Objects;

/**
 * 
 * Lines started inside an Align continue under a fixed-width prefix: either a number of
 * spaces, or a literal prefix string (e.g. "# " to keep continuation lines inside a comment).
 * Unlike {@link Indent}, the prefix is placed exactly, regardless of the indentation unit.
 *
 */
public class Align extends Container {
	private final String prefix;

	public Align(int width, List<Document> children) {
		this(spaces(width), children);
	}

	public Align(String prefix, List<Document> children) {
		super(children, false);
		if (prefix.indexOf('\n') != -1 || prefix.indexOf('\r') != -1) {
			throw new MalformedDocumentException("alignment prefix must not contain line breaks");
		}
		this.prefix = prefix;
	}

	private static String spaces(int width) {
		if (width < 0) {
			throw new MalformedDocumentException("alignment width must not be negative, got " + width);
		}
		StringBuilder sb = new StringBuilder(width);
		for (int i = 0; i < width; ++i) {
			sb.append(' ');
		}
		return sb.toString();
	}

	public String getPrefix() {
		return prefix;
	}

	@Override
	public Align copy() {
		return new Align(prefix, copyChildren());
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return super.equals(o) && Objects.equals(prefix, ((Align) o).prefix);
	}

	@Override
	public int hashCode() {
		return 31 * super.hashCode() + prefix.hashCode();
	}
}
