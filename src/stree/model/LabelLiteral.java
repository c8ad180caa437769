package stree.model;

import stree.util.SourceLocation;

/**
 * The key of a label-style hash entry or keyword argument, colon included.
 */
public class LabelLiteral extends Leaf {

	public LabelLiteral(SourceLocation location, String value) {
		super(location, value);
	}

	@Override
	public String getType() {
		return "label";
	}
}
