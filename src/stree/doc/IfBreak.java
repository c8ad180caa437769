package stree.doc;

import java.util.Objects;

/**
 * 
 * Renders exactly one of two alternatives depending on whether the nearest enclosing
 * group broke. Only the flat alternative is measured: its width and its forced groups are
 * what the enclosing group's fit decision sees.
 *
 */
public class IfBreak extends Document {
	private final Document flat;
	private final Document broken;

	public IfBreak(Document flat, Document broken) {
		super(flat.getFlatWidth(), flat.containsForcedBreak());
		if (flat == broken) {
			throw new MalformedDocumentException("both alternatives of a conditional break are the same node");
		}
		this.flat = flat;
		this.broken = broken;
	}

	public Document getFlat() {
		return flat;
	}

	public Document getBroken() {
		return broken;
	}

	@Override
	public IfBreak copy() {
		return new IfBreak(flat.copy(), broken.copy());
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		IfBreak ifBreak = (IfBreak) o;
		return Objects.equals(flat, ifBreak.flat) &&
				Objects.equals(broken, ifBreak.broken);
	}

	@Override
	public int hashCode() {
		return Objects.hash(flat, broken);
	}
}
