package stree.lexer;

import stree.util.SourceLocatable;
import stree.util.SourceLocation;

import java.util.Objects;

public class Token extends SourceLocatable {

	private final String value;
	private final TokenType type;
	private final SourceLocation location;
	private final boolean spaceBefore;

	public Token(String value, TokenType type, SourceLocation location, boolean spaceBefore) {
		this.value = value;
		this.type = type;
		this.location = location;
		this.spaceBefore = spaceBefore;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public TokenType getType() {
		return type;
	}

	/**
	 * @return whether whitespace separates this token from the one before it on the same line
	 */
	public boolean hasSpaceBefore() {
		return spaceBefore;
	}

	public boolean is(TokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	public boolean isOperator(String value) {
		return is(TokenType.OPERATOR, value);
	}

	public boolean isKeyword(String value) {
		return is(TokenType.KEYWORD, value);
	}

	@Override
	public String toString() {
		return "Token [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, location);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Token other = (Token) obj;
		return type == other.type && Objects.equals(value, other.value) && Objects.equals(location, other.location);
	}

}
