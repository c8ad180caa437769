package stree.doc;

public enum BreakMode {
	// measured against the remaining width, breaks only if the group does not fit
	AUTO,
	// always breaks its own breakables; enclosing AUTO groups break as well
	FORCED,
}
