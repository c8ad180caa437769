package stree.doc;

import stree.STreeException;

/**
 * Thrown when document construction violates the nesting rules of the layout model.
 */
public class MalformedDocumentException extends STreeException {

	private static final long serialVersionUID = 3088437561126571406L;
	private static final String prefix = "Malformed document";

	public MalformedDocumentException(String msg) {
		super(prefix, msg);
	}
}
