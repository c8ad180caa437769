package stree.model;

import stree.util.SourceLocation;

/**
 * An integer or float literal, as written.
 */
public class NumberLiteral extends Leaf {

	public NumberLiteral(SourceLocation location, String value) {
		super(location, value);
	}

	@Override
	public String getType() {
		return "number";
	}
}
