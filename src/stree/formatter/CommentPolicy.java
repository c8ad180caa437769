package stree.formatter;

/**
 * What happens to blank lines between a block of own-line comments and the statement after it.
 */
public enum CommentPolicy {
	// keep them, up to the configured maximum
	PRESERVE,
	// drop them, so the comments sit directly on top of the statement
	COLLAPSE,
}
