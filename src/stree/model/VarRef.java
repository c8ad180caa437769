package stree.model;

import stree.util.SourceLocation;

/**
 * A reference to a local, instance, class or global variable.
 */
public class VarRef extends Leaf {

	public VarRef(SourceLocation location, String value) {
		super(location, value);
	}

	@Override
	public String getType() {
		return "var_ref";
	}
}
