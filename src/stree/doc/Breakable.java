package stree.doc;

import java.util.Objects;

/**
 * 
 * A point that renders as its separator when the nearest enclosing group is flat, and as
 * a newline followed by the current indentation when that group breaks.
 * 
 * The indent delta adjusts the indentation of the line this break starts only. A negative
 * delta removes columns from the current indentation, clamped at column 0.
 *
 */
public class Breakable extends Document {
	private final String separator;
	private final int indentDelta;

	public Breakable(String separator, int indentDelta) {
		super(Text.displayWidth(separator), false);
		if (separator.indexOf('\n') != -1 || separator.indexOf('\r') != -1) {
			throw new MalformedDocumentException("breakable separator must not contain line breaks");
		}
		this.separator = separator;
		this.indentDelta = indentDelta;
	}

	public String getSeparator() {
		return separator;
	}

	public int getIndentDelta() {
		return indentDelta;
	}

	@Override
	public Breakable copy() {
		return new Breakable(separator, indentDelta);
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Breakable breakable = (Breakable) o;
		return indentDelta == breakable.indentDelta &&
				Objects.equals(separator, breakable.separator);
	}

	@Override
	public int hashCode() {
		return Objects.hash(separator, indentDelta);
	}
}
