package stree.model;

import stree.util.SourceLocation;

/**
 * :name or :"name"
 */
public class SymbolLiteral extends Leaf {

	public SymbolLiteral(SourceLocation location, String value) {
		super(location, value);
	}

	@Override
	public String getType() {
		return "symbol";
	}
}
