package stree.layout;

enum LayoutMode {
	// no group has been entered yet
	OUTSIDE_GROUP,
	FLAT,
	BROKEN,
}
