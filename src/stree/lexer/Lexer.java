package stree.lexer;

import stree.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A lexer for the Ruby subset stree formats.
 *
 * Input is scanned line by line. Each line yields its tokens followed by a NEWLINE token,
 * comments are kept as COMMENT tokens so the parser can hand them to the formatter, and a
 * line break followed by a line starting with {@code .} or {@code &.} is dropped so that
 * leading-dot method chains read as one expression.
 */
public class Lexer {

	static final Pattern WHITESPACE = Pattern.compile("[ \\t\\r\\f]+");

	static final Pattern COMMENT = Pattern.compile("#[^\\r]*");

	static final Pattern[] NUMBER = {
		Pattern.compile("0[xX][0-9a-fA-F][0-9a-fA-F_]*"),
		Pattern.compile("0[bB][01][01_]*"),
		Pattern.compile("[0-9][0-9_]*(\\.[0-9][0-9_]*)?([eE][+-]?[0-9]+)?"),
	};

	static final Pattern STRING = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*'");

	static final Pattern SYMBOL = Pattern.compile(":(?:[a-zA-Z_][a-zA-Z0-9_]*[?!=]?|\"(?:[^\"\\\\]|\\\\.)*\")");

	static final Pattern SIGIL_VARIABLE = Pattern.compile("(?:@@?|\\$)[a-zA-Z_][a-zA-Z0-9_]*");

	static final Pattern LABEL = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*[?!]?:(?!:)");

	// a ? or ! suffix belongs to the name unless it starts an operator like != or ?=
	static final Pattern WORD = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*(?:[?!](?!=))?");

	static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
		"def",
		"end",
		"if",
		"elsif",
		"else",
		"unless",
		"while",
		"until",
		"case",
		"when",
		"then",
		"do",
		"return",
		"class",
		"module",
		"and",
		"or",
		"not",
		"nil",
		"true",
		"false",
		"self"
	));

	static final String[] OPERATORS = {
		// assignment
		"=", "+=", "-=", "*=", "/=", "%=", "**=", "||=", "&&=", "|=", "&=", "^=", "<<=", ">>=",
		// comparison
		"==", "!=", "===", "=~", "!~", "<", ">", "<=", ">=", "<=>",
		// logic
		"&&", "||", "!",
		// arithmetic and bits
		"+", "-", "*", "/", "%", "**", "&", "|", "^", "~", "<<", ">>",
		// ranges
		"..", "...",
		// punctuation
		"(", ")", "[", "]", "{", "}", ",", ";", ".", "&.", "::", ":", "?", "=>", "->",
	};

	private final Path filename;
	private final CharSequence source;

	public Lexer(Path filename, CharSequence source) {
		this.filename = filename;
		this.source = source;
	}

	private Token makeToken(String value, TokenType type, int lineStart, int lineNum, int column, boolean spaceBefore) {
		int startOffset = lineStart + column;
		return new Token(value, type, new SourceLocation(filename, startOffset, startOffset + value.length(),
				lineNum, lineNum, column + 1, column + 1 + value.length()), spaceBefore);
	}

	/**
	 * @return the tokens scanned from the source, ending with an EOF token
	 * @throws LexerException if the lexer cannot understand part of the input
	 */
	public List<Token> readTokens() throws LexerException {
		List<Token> tokens = new ArrayList<>();
		int lineStart = 0;
		int lineNum = 0;
		while (lineStart <= source.length()) {
			++lineNum;
			int lineEnd = lineStart;
			while (lineEnd < source.length() && source.charAt(lineEnd) != '\n') {
				++lineEnd;
			}
			String line = source.subSequence(lineStart, lineEnd).toString();
			readLine(tokens, line, lineStart, lineNum);
			if (lineEnd == source.length()) {
				break;
			}
			tokens.add(makeToken("\n", TokenType.NEWLINE, lineStart, lineNum, lineEnd - lineStart, false));
			lineStart = lineEnd + 1;
		}
		int lastColumn = source.length() - lastLineStart(source);
		tokens.add(new Token("", TokenType.EOF, new SourceLocation(filename, source.length(), source.length(),
				lineNum, lineNum, lastColumn + 1, lastColumn + 1), false));
		return joinLeadingDotLines(tokens);
	}

	private static int lastLineStart(CharSequence source) {
		int pos = source.length();
		while (pos > 0 && source.charAt(pos - 1) != '\n') {
			--pos;
		}
		return pos;
	}

	private void readLine(List<Token> tokens, String line, int lineStart, int lineNum) throws LexerException {
		int column = 0;
		int oldColumn = -1;
		boolean spaceBefore = false;
		while (column < line.length()) {
			// test for the lexer getting stuck, either the lexer has a problem
			// or the source file does
			if (column == oldColumn) {
				throw new LexerException(lineNum, column + 1,
						"unexpected character '" + line.charAt(column) + "'");
			}
			oldColumn = column;

			Matcher m = WHITESPACE.matcher(line);
			m.region(column, line.length());
			if (m.lookingAt()) {
				column = m.end();
				spaceBefore = true;
				continue;
			}

			m = COMMENT.matcher(line);
			m.region(column, line.length());
			if (m.lookingAt()) {
				tokens.add(makeToken(m.group(), TokenType.COMMENT, lineStart, lineNum, column, spaceBefore));
				column = m.end();
				continue;
			}

			char c = line.charAt(column);
			if (c == '"' || c == '\'') {
				m = STRING.matcher(line);
				m.region(column, line.length());
				if (!m.lookingAt()) {
					throw new LexerException(lineNum, column + 1, "unterminated string literal");
				}
				tokens.add(makeToken(m.group(), TokenType.STRING, lineStart, lineNum, column, spaceBefore));
				column = m.end();
				spaceBefore = false;
				continue;
			}

			// try to match the biggest number we can
			String possibleNumber = null;
			for (Pattern numberPattern : NUMBER) {
				m = numberPattern.matcher(line);
				m.region(column, line.length());
				if (m.lookingAt() && (possibleNumber == null || m.group().length() > possibleNumber.length())) {
					possibleNumber = m.group();
				}
			}
			if (possibleNumber != null) {
				tokens.add(makeToken(possibleNumber, TokenType.NUMBER, lineStart, lineNum, column, spaceBefore));
				column += possibleNumber.length();
				spaceBefore = false;
				continue;
			}

			// "::" is always the scope operator, a lone ":" before a name starts a symbol
			if (!line.startsWith("::", column)) {
				m = SYMBOL.matcher(line);
				m.region(column, line.length());
				if (m.lookingAt()) {
					tokens.add(makeToken(m.group(), TokenType.SYMBOL, lineStart, lineNum, column, spaceBefore));
					column = m.end();
					spaceBefore = false;
					continue;
				}
			}

			m = SIGIL_VARIABLE.matcher(line);
			m.region(column, line.length());
			if (m.lookingAt()) {
				tokens.add(makeToken(m.group(), TokenType.SIGIL_VARIABLE, lineStart, lineNum, column, spaceBefore));
				column = m.end();
				spaceBefore = false;
				continue;
			}

			m = LABEL.matcher(line);
			m.region(column, line.length());
			if (m.lookingAt() && !KEYWORDS.contains(m.group().substring(0, m.group().length() - 1))) {
				tokens.add(makeToken(m.group(), TokenType.LABEL, lineStart, lineNum, column, spaceBefore));
				column = m.end();
				spaceBefore = false;
				continue;
			}

			m = WORD.matcher(line);
			m.region(column, line.length());
			if (m.lookingAt()) {
				String word = m.group();
				TokenType type;
				if (KEYWORDS.contains(word)) {
					type = TokenType.KEYWORD;
				} else if (Character.isUpperCase(word.charAt(0))) {
					type = TokenType.CONSTANT;
				} else {
					type = TokenType.IDENT;
				}
				tokens.add(makeToken(word, type, lineStart, lineNum, column, spaceBefore));
				column = m.end();
				spaceBefore = false;
				continue;
			}

			// match the longest operator we can
			String possibleOperator = null;
			for (String operator : OPERATORS) {
				if (possibleOperator != null && operator.length() <= possibleOperator.length()) {
					continue;
				}
				if (line.startsWith(operator, column)) {
					possibleOperator = operator;
				}
			}
			if (possibleOperator != null) {
				tokens.add(makeToken(possibleOperator, TokenType.OPERATOR, lineStart, lineNum, column, spaceBefore));
				column += possibleOperator.length();
				spaceBefore = false;
			}
		}
	}

	private static List<Token> joinLeadingDotLines(List<Token> tokens) {
		List<Token> result = new ArrayList<>(tokens.size());
		for (int i = 0; i < tokens.size(); ++i) {
			Token token = tokens.get(i);
			if (token.getType() == TokenType.NEWLINE) {
				int next = i + 1;
				while (next < tokens.size() && (tokens.get(next).getType() == TokenType.NEWLINE ||
						tokens.get(next).getType() == TokenType.COMMENT)) {
					++next;
				}
				if (next < tokens.size() && (tokens.get(next).isOperator(".") || tokens.get(next).isOperator("&."))) {
					continue;
				}
			}
			result.add(token);
		}
		return result;
	}
}
