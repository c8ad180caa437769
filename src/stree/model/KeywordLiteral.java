package stree.model;

import stree.util.SourceLocation;

public class KeywordLiteral extends Leaf {

	public KeywordLiteral(SourceLocation location, String value) {
		super(location, value);
	}

	@Override
	public String getType() {
		return "keyword";
	}
}
