package stree.lexer;

import stree.STreeException;

public class LexerException extends STreeException {

	private static final long serialVersionUID = -6019734583017470311L;

	private final int column;

	public LexerException(int lineN, int column, String msg) {
		super("Lexer error", msg + " (column " + column + ")", lineN);
		this.column = column;
	}

	public int getColumn() {
		return column;
	}
}
