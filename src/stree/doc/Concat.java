package stree.doc;

import java.util.List;

/**
 * A plain sequence with no layout behaviour of its own.
 */
public class Concat extends Container {

	public Concat(List<Document> children) {
		super(children, false);
	}

	@Override
	public Concat copy() {
		return new Concat(copyChildren());
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
