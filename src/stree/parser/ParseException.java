package stree.parser;

import stree.STreeException;
import stree.util.SourceLocation;

/**
 * Thrown when the parser meets a token the grammar does not allow at that point.
 */
public class ParseException extends STreeException {

	private static final long serialVersionUID = 4613393285014728640L;
	private static final String prefix = "Parse error";

	private final SourceLocation location;

	public ParseException(SourceLocation location, String msg) {
		super(prefix, msg + " (column " + location.getStartColumn() + ")", location.getStartLine());
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}
}
