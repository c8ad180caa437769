package stree.doc;

import java.util.List;

/**
 * 
 * The unit over which the renderer makes a single fit/break decision. Every breakable
 * and conditional whose nearest enclosing group is this one follows that decision.
 *
 */
public class Group extends Container {
	private final BreakMode mode;

	public Group(BreakMode mode, List<Document> children) {
		super(children, mode == BreakMode.FORCED);
		this.mode = mode;
	}

	public BreakMode getMode() {
		return mode;
	}

	@Override
	public Group copy() {
		return new Group(mode, copyChildren());
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return super.equals(o) && mode == ((Group) o).mode;
	}

	@Override
	public int hashCode() {
		return 31 * super.hashCode() + mode.hashCode();
	}
}
