package stree.model;

import stree.util.SourceLocation;

public class ConstRef extends Leaf {

	public ConstRef(SourceLocation location, String value) {
		super(location, value);
	}

	@Override
	public String getType() {
		return "const_ref";
	}
}
