package stree.lexer;

public enum TokenType {
	IDENT,
	CONSTANT,
	// @instance, @@class and $global variables
	SIGIL_VARIABLE,
	// key: in hashes, argument lists and parameter lists
	LABEL,
	NUMBER,
	// raw text, quotes included
	STRING,
	SYMBOL,
	KEYWORD,
	OPERATOR,
	NEWLINE,
	// raw text, leading # included
	COMMENT,
	EOF,
}
