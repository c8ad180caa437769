package stree.formatter;

import stree.STreeException;

/**
 * Thrown when the syntax tree handed to a {@link TreeWalker} is cyclic or has a node with
 * more than one parent.
 */
public class NonTreeInputException extends STreeException {

	private static final long serialVersionUID = -6224950176123379035L;
	private static final String prefix = "Non-tree input";

	public NonTreeInputException(String msg) {
		super(prefix, msg);
	}
}
