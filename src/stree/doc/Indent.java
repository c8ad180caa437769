package stree.doc;

import java.util.List;

/**
 * Increases the indentation of lines started inside its children by a number of columns.
 */
public class Indent extends Container {
	private final int delta;

	public Indent(int delta, List<Document> children) {
		super(children, false);
		if (delta < 0) {
			throw new MalformedDocumentException("indent delta must not be negative, got " + delta);
		}
		this.delta = delta;
	}

	public int getDelta() {
		return delta;
	}

	@Override
	public Indent copy() {
		return new Indent(delta, copyChildren());
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return super.equals(o) && delta == ((Indent) o).delta;
	}

	@Override
	public int hashCode() {
		return 31 * super.hashCode() + delta;
	}
}
