package stree.parser;

import stree.lexer.Lexer;
import stree.lexer.Token;
import stree.lexer.TokenType;
import stree.model.*;
import stree.util.SourceLocatable;
import stree.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 *
 *  <p>
 *  A recursive descent parser for the Ruby subset stree formats.
 *  </p>
 *
 *  <p>
 *  Comments are separated from the token stream before parsing starts and are returned on the
 *  {@link Program}, in source order, for the formatter to place. Start reading with
 *  {@link Parser#readProgram}.
 *  </p>
 *
 *  <h3> Operators </h3>
 *
 *  <p>Binary operators are parsed by precedence climbing over the static precedence table
 *  below. Assignment, the ternary operator, ranges, {@code not}, {@code and} and {@code or} bind
 *  more loosely than any of them and have parse methods of their own.</p>
 *
 *  <h3> Line breaks </h3>
 *
 *  <p>A line break ends a statement, except inside brackets and after an operator or a comma.
 *  The lexer has already joined lines that start with {@code .} or {@code &.} to the line
 *  before.</p>
 *
 *  <h3> Command calls </h3>
 *
 *  <p>A name followed by whitespace and something that can only start an argument, such as
 *  {@code puts x} or {@code foo -1}, is a call with unparenthesised arguments.</p>
 *
 */
public class Parser {

	private static final Map<String, Integer> BINARY_PRECEDENCE = new HashMap<>();
	private static final Set<String> RIGHT_ASSOCIATIVE = new HashSet<>(Collections.singletonList("**"));

	static {
		put(1, "||");
		put(2, "&&");
		put(3, "==", "!=", "===", "=~", "!~", "<=>");
		put(4, "<", "<=", ">", ">=");
		put(5, "|", "^");
		put(6, "&");
		put(7, "<<", ">>");
		put(8, "+", "-");
		put(9, "*", "/", "%");
		put(10, "**");
	}

	private static void put(int precedence, String... operators) {
		for (String operator : operators) {
			BINARY_PRECEDENCE.put(operator, precedence);
		}
	}

	private static final Set<String> ASSIGNMENT_OPERATORS = new HashSet<>(Arrays.asList(
			"=", "+=", "-=", "*=", "/=", "%=", "**=", "||=", "&&=", "|=", "&=", "^=", "<<=", ">>="));

	private static final Set<String> MODIFIER_KEYWORDS = new HashSet<>(Arrays.asList(
			"if", "unless", "while", "until"));

	private static final Set<String> VALUE_KEYWORDS = new HashSet<>(Arrays.asList(
			"nil", "true", "false", "self"));

	// operators that start a command argument when written against it, as in foo -1 or foo *args
	private static final Set<String> PREFIX_ARGUMENT_OPERATORS = new HashSet<>(Arrays.asList(
			"-", "*", "**", "&", "::", "!"));

	private final Path file;
	private final CharSequence source;
	private final List<Token> tokens = new ArrayList<>();
	private final List<Comment> comments = new ArrayList<>();
	private int pos = 0;
	// inside a while or until predicate a do belongs to the loop, not to a call
	private int noDoBlock = 0;

	public Parser(Path file, CharSequence source) {
		this.file = file;
		this.source = source;
	}

	public static Program parse(Path file, CharSequence source) {
		return new Parser(file, source).readProgram();
	}

	/**
	 * @throws stree.lexer.LexerException if the source cannot be tokenized
	 * @throws ParseException if the tokens do not form a program
	 */
	public Program readProgram() {
		separateComments(new Lexer(file, source).readTokens());
		SourceLocation start = new SourceLocation(file, 0, 0, 1, 1, 1, 1);
		Statements statements = parseStatements(start, t -> false);
		Token eof = expect(TokenType.EOF, "end of input");
		return new Program(start.combine(eof.getLocation()), statements, comments);
	}

	private void separateComments(List<Token> all) {
		Token previous = null;
		for (Token token : all) {
			if (token.getType() == TokenType.COMMENT) {
				boolean inline = previous != null && previous.getType() != TokenType.NEWLINE &&
						previous.getLocation().getEndLine() == token.getLocation().getStartLine();
				String value = token.getValue().replaceAll("\\s+$", "");
				comments.add(new Comment(token.getLocation(), value, inline));
			} else {
				tokens.add(token);
				previous = token;
			}
		}
	}

	// token stream

	private Token current() {
		return tokens.get(pos);
	}

	private Token peek(int ahead) {
		return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
	}

	private Token previous() {
		return tokens.get(pos - 1);
	}

	private Token advance() {
		Token token = current();
		if (token.getType() != TokenType.EOF) {
			++pos;
		}
		return token;
	}

	private boolean atSeparator() {
		return current().getType() == TokenType.NEWLINE || current().isOperator(";");
	}

	private void skipNewlines() {
		while (current().getType() == TokenType.NEWLINE) {
			++pos;
		}
	}

	private void skipSeparators() {
		while (atSeparator()) {
			++pos;
		}
	}

	private ParseException unexpected(String expected) {
		Token token = current();
		String found;
		switch (token.getType()) {
			case EOF:
				found = "end of input";
				break;
			case NEWLINE:
				found = "line break";
				break;
			default:
				found = "'" + token.getValue() + "'";
		}
		return new ParseException(token.getLocation(), "expected " + expected + " but found " + found);
	}

	private Token expect(TokenType type, String description) {
		if (current().getType() != type) {
			throw unexpected(description);
		}
		return advance();
	}

	private Token expectOperator(String operator) {
		if (!current().isOperator(operator)) {
			throw unexpected("'" + operator + "'");
		}
		return advance();
	}

	private Token expectKeyword(String keyword) {
		if (!current().isKeyword(keyword)) {
			throw unexpected("'" + keyword + "'");
		}
		return advance();
	}

	private SourceLocation span(SourceLocatable start) {
		return start.getLocation().combine(previous().getLocation());
	}

	private SourceLocation between(SourceLocation before, SourceLocation after) {
		return new SourceLocation(file, before.getEndOffset(), after.getStartOffset(), before.getEndLine(),
				after.getStartLine(), before.getEndColumn(), after.getStartColumn());
	}

	// statements

	private Statements parseStatements(SourceLocation header, Predicate<Token> isTerminator) {
		int saved = noDoBlock;
		noDoBlock = 0;
		try {
			List<Node> body = new ArrayList<>();
			skipSeparators();
			while (!isTerminator.test(current()) && current().getType() != TokenType.EOF) {
				body.add(parseStatement());
				if (!isTerminator.test(current()) && current().getType() != TokenType.EOF) {
					if (!atSeparator()) {
						throw unexpected("a line break");
					}
				}
				skipSeparators();
			}
			return new Statements(between(header, current().getLocation()), body);
		} finally {
			noDoBlock = saved;
		}
	}

	private Node parseStatement() {
		Node statement = parseLogical();
		while (current().getType() == TokenType.KEYWORD && MODIFIER_KEYWORDS.contains(current().getValue())) {
			String keyword = advance().getValue();
			Node predicate = parseLogical();
			statement = new Modifier(statement.getLocation().combine(predicate.getLocation()), keyword, statement,
					predicate);
		}
		return statement;
	}

	// and, or
	private Node parseLogical() {
		Node left = parseNot();
		while (current().isKeyword("and") || current().isKeyword("or")) {
			String operator = advance().getValue();
			skipNewlines();
			Node right = parseNot();
			left = new Binary(left.getLocation().combine(right.getLocation()), left, operator, right);
		}
		return left;
	}

	private Node parseNot() {
		if (current().isKeyword("not")) {
			Token start = advance();
			Node operand = parseNot();
			return new Unary(start.getLocation().combine(operand.getLocation()), "not", operand);
		}
		return parseExpression();
	}

	// expressions

	private Node parseExpression() {
		if (current().isKeyword("return")) {
			Token start = advance();
			Node value = null;
			if (startsExpression(current())) {
				value = parseExpression();
			}
			return new Return(span(start), value);
		}
		Node left = parseTernary();
		Token operator = current();
		if (operator.getType() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(operator.getValue())) {
			if (!isAssignable(left)) {
				throw new ParseException(operator.getLocation(), "cannot assign to " + left.getType());
			}
			advance();
			skipNewlines();
			Node value = parseExpression();
			return new Assign(left.getLocation().combine(value.getLocation()), left, operator.getValue(), value);
		}
		return left;
	}

	private static boolean isAssignable(Node node) {
		if (node instanceof Call) {
			Call call = (Call) node;
			return call.getReceiver() != null && call.getArguments() == null && call.getBlock() == null;
		}
		return node instanceof VarRef || node instanceof Index || node instanceof ConstRef ||
				node instanceof ConstPath;
	}

	private boolean startsExpression(Token token) {
		switch (token.getType()) {
			case NEWLINE:
			case EOF:
				return false;
			case KEYWORD:
				return !token.getValue().equals("end") && !token.getValue().equals("then") &&
						!token.getValue().equals("do") && !MODIFIER_KEYWORDS.contains(token.getValue()) &&
						!token.getValue().equals("and") && !token.getValue().equals("or");
			case OPERATOR:
				return !token.isOperator(";") && !token.isOperator(")") && !token.isOperator("]") &&
						!token.isOperator("}") && !token.isOperator(",");
			default:
				return true;
		}
	}

	private Node parseTernary() {
		Node predicate = parseRange();
		if (current().isOperator("?")) {
			advance();
			skipNewlines();
			Node consequent = parseTernary();
			skipNewlines();
			expectOperator(":");
			skipNewlines();
			Node alternative = parseTernary();
			return new Ternary(predicate.getLocation().combine(alternative.getLocation()), predicate, consequent,
					alternative);
		}
		return predicate;
	}

	private Node parseRange() {
		Node left = parseBinary(1);
		if (current().isOperator("..") || current().isOperator("...")) {
			String operator = advance().getValue();
			Node right = parseBinary(1);
			return new Binary(left.getLocation().combine(right.getLocation()), left, operator, right);
		}
		return left;
	}

	private Node parseBinary(int minPrecedence) {
		Node left = parseUnary();
		while (true) {
			Token operator = current();
			Integer precedence = operator.getType() == TokenType.OPERATOR ?
					BINARY_PRECEDENCE.get(operator.getValue()) : null;
			if (precedence == null || precedence < minPrecedence) {
				return left;
			}
			advance();
			skipNewlines();
			Node right = parseBinary(RIGHT_ASSOCIATIVE.contains(operator.getValue()) ? precedence : precedence + 1);
			left = new Binary(left.getLocation().combine(right.getLocation()), left, operator.getValue(), right);
		}
	}

	private Node parseUnary() {
		Token start = current();
		if (start.isOperator("!") || start.isOperator("-") || start.isOperator("~") || start.isOperator("+")) {
			advance();
			Node operand = parseUnary();
			return new Unary(start.getLocation().combine(operand.getLocation()), start.getValue(), operand);
		}
		return parsePostfix();
	}

	private Node parsePostfix() {
		Token start = current();
		Node node = parsePrimary();
		while (true) {
			Token token = current();
			if (token.isOperator(".") || token.isOperator("&.")) {
				advance();
				skipNewlines();
				Token name = current();
				if (name.getType() != TokenType.IDENT && name.getType() != TokenType.CONSTANT &&
						name.getType() != TokenType.KEYWORD) {
					throw unexpected("a method name");
				}
				advance();
				node = parseCallRest(start, node, token.getValue(), name);
				if (node instanceof Command) {
					return node;
				}
			} else if (token.isOperator("::")) {
				advance();
				Token name = current();
				if (name.getType() == TokenType.CONSTANT && !(peek(1).isOperator("(") && !peek(1).hasSpaceBefore())) {
					advance();
					node = new ConstPath(span(start), node, name.getValue());
				} else if (name.getType() == TokenType.IDENT || name.getType() == TokenType.CONSTANT) {
					advance();
					node = parseCallRest(start, node, "::", name);
					if (node instanceof Command) {
						return node;
					}
				} else {
					throw unexpected("a constant or method name");
				}
			} else if (token.isOperator("[") && !token.hasSpaceBefore()) {
				advance();
				List<Node> indexes = parseDelimited("]", this::parseArgument);
				expectOperator("]");
				node = new Index(span(start), node, indexes);
			} else {
				return node;
			}
		}
	}

	/**
	 * Parses what follows a method name: parenthesised arguments, command arguments, a block.
	 */
	private Node parseCallRest(Token start, Node receiver, String operator, Token name) {
		if (current().isOperator("(") && !current().hasSpaceBefore()) {
			Args arguments = parseArgs();
			Block block = parseBlockIfPresent();
			return new Call(span(start), receiver, operator, name.getValue(), arguments, block);
		}
		if (startsCommandArgument()) {
			List<Node> arguments = new ArrayList<>();
			// a do block after the arguments belongs to the command, not to its last argument
			++noDoBlock;
			try {
				arguments.add(parseArgument());
				while (current().isOperator(",")) {
					advance();
					skipNewlines();
					arguments.add(parseArgument());
				}
			} finally {
				--noDoBlock;
			}
			Block block = null;
			if (current().isKeyword("do") && noDoBlock == 0) {
				block = parseBlock();
			}
			return new Command(span(start), receiver, operator, name.getValue(), arguments, block);
		}
		Block block = parseBlockIfPresent();
		if (receiver == null && block == null && name.getType() == TokenType.IDENT &&
				!name.getValue().endsWith("?") && !name.getValue().endsWith("!")) {
			return new VarRef(name.getLocation(), name.getValue());
		}
		return new Call(span(start), receiver, operator, name.getValue(), null, block);
	}

	private boolean startsCommandArgument() {
		Token token = current();
		if (!token.hasSpaceBefore()) {
			return false;
		}
		switch (token.getType()) {
			case NUMBER:
			case STRING:
			case SYMBOL:
			case SIGIL_VARIABLE:
			case IDENT:
			case CONSTANT:
			case LABEL:
				return true;
			case KEYWORD:
				return VALUE_KEYWORDS.contains(token.getValue()) || token.getValue().equals("not") ||
						token.getValue().equals("def");
			case OPERATOR:
				if (token.isOperator("[") || token.isOperator("(")) {
					return true;
				}
				Token next = peek(1);
				return PREFIX_ARGUMENT_OPERATORS.contains(token.getValue()) && !next.hasSpaceBefore() &&
						next.getType() != TokenType.NEWLINE && next.getType() != TokenType.EOF;
			default:
				return false;
		}
	}

	private Node parsePrimary() {
		Token token = current();
		switch (token.getType()) {
			case NUMBER:
				advance();
				return new NumberLiteral(token.getLocation(), token.getValue());
			case STRING:
				advance();
				return new StringLiteral(token.getLocation(), token.getValue());
			case SYMBOL:
				advance();
				return new SymbolLiteral(token.getLocation(), token.getValue());
			case SIGIL_VARIABLE:
				advance();
				return new VarRef(token.getLocation(), token.getValue());
			case IDENT:
				advance();
				return parseCallRest(token, null, null, token);
			case CONSTANT:
				advance();
				if (current().isOperator("(") && !current().hasSpaceBefore()) {
					return parseCallRest(token, null, null, token);
				}
				return new ConstRef(token.getLocation(), token.getValue());
			case KEYWORD:
				return parseKeyword();
			case OPERATOR:
				return parseBracketed();
			default:
				throw unexpected("an expression");
		}
	}

	private Node parseKeyword() {
		Token token = current();
		switch (token.getValue()) {
			case "nil":
			case "true":
			case "false":
			case "self":
				advance();
				return new KeywordLiteral(token.getLocation(), token.getValue());
			case "def":
				return parseDef();
			case "class":
				return parseClass();
			case "module":
				return parseModule();
			case "if":
			case "unless":
				return parseIf(advance());
			case "while":
			case "until":
				return parseWhile();
			case "case":
				return parseCase();
			default:
				throw unexpected("an expression");
		}
	}

	private Node parseBracketed() {
		Token open = current();
		switch (open.getValue()) {
			case "(": {
				advance();
				int saved = noDoBlock;
				noDoBlock = 0;
				Node contents;
				try {
					skipNewlines();
					contents = parseStatement();
					skipNewlines();
				} finally {
					noDoBlock = saved;
				}
				expectOperator(")");
				return new Paren(span(open), contents);
			}
			case "[": {
				advance();
				List<Node> elements = parseDelimited("]", this::parseArgument);
				expectOperator("]");
				return new ArrayLiteral(span(open), elements);
			}
			case "{": {
				advance();
				List<Node> entries = parseDelimited("}", this::parseHashEntry);
				expectOperator("}");
				return new HashLiteral(span(open), entries);
			}
			case "::": {
				advance();
				Token name = expect(TokenType.CONSTANT, "a constant");
				return new ConstPath(span(open), null, name.getValue());
			}
			default:
				throw unexpected("an expression");
		}
	}

	// lists

	private <T extends Node> List<T> parseDelimited(String close, Supplier<T> element) {
		int saved = noDoBlock;
		noDoBlock = 0;
		try {
			List<T> items = new ArrayList<>();
			skipNewlines();
			while (!current().isOperator(close)) {
				items.add(element.get());
				skipNewlines();
				if (!current().isOperator(close)) {
					expectOperator(",");
					skipNewlines();
				}
			}
			return items;
		} finally {
			noDoBlock = saved;
		}
	}

	private Args parseArgs() {
		Token open = expectOperator("(");
		List<Node> arguments = parseDelimited(")", this::parseArgument);
		expectOperator(")");
		return new Args(span(open), arguments);
	}

	private Node parseArgument() {
		Token start = current();
		if (start.isOperator("*") || start.isOperator("**") || start.isOperator("&")) {
			advance();
			Node value = parseTernary();
			return new Splat(span(start), start.getValue(), value);
		}
		if (start.getType() == TokenType.LABEL) {
			return parseLabelledEntry();
		}
		Node expression = parseExpression();
		if (current().isOperator("=>")) {
			advance();
			skipNewlines();
			Node value = parseExpression();
			return new Assoc(expression.getLocation().combine(value.getLocation()), expression, value);
		}
		return expression;
	}

	private Node parseHashEntry() {
		Token start = current();
		if (start.isOperator("**")) {
			advance();
			Node value = parseTernary();
			return new Splat(span(start), "**", value);
		}
		if (start.getType() == TokenType.LABEL) {
			return parseLabelledEntry();
		}
		Node key = parseExpression();
		skipNewlines();
		expectOperator("=>");
		skipNewlines();
		Node value = parseExpression();
		return new Assoc(key.getLocation().combine(value.getLocation()), key, value);
	}

	private Node parseLabelledEntry() {
		Token label = advance();
		skipNewlines();
		Node value = parseExpression();
		return new Assoc(label.getLocation().combine(value.getLocation()),
				new LabelLiteral(label.getLocation(), label.getValue()), value);
	}

	// blocks

	private Block parseBlockIfPresent() {
		if (current().isOperator("{") || (current().isKeyword("do") && noDoBlock == 0)) {
			return parseBlock();
		}
		return null;
	}

	private Block parseBlock() {
		Token open = advance();
		boolean braces = open.isOperator("{");
		List<Param> params = new ArrayList<>();
		if (current().isOperator("|")) {
			advance();
			while (!current().isOperator("|")) {
				params.add(parseParam(true));
				if (!current().isOperator("|")) {
					expectOperator(",");
				}
			}
			advance();
		} else if (current().isOperator("||")) {
			advance();
		}
		Statements body = parseStatements(previous().getLocation(),
				braces ? t -> t.isOperator("}") : t -> t.isKeyword("end"));
		if (braces) {
			expectOperator("}");
		} else {
			expectKeyword("end");
		}
		return new Block(span(open), params, body);
	}

	// definitions

	private Param parseParam(boolean inBlock) {
		Token start = current();
		if (start.isOperator("*") || start.isOperator("**") || start.isOperator("&")) {
			advance();
			String name = "";
			if (current().getType() == TokenType.IDENT && !current().hasSpaceBefore()) {
				name = advance().getValue();
			}
			Param.Kind kind = start.isOperator("*") ? Param.Kind.REST :
					start.isOperator("**") ? Param.Kind.KEYWORD_REST : Param.Kind.BLOCK;
			return new Param(span(start), kind, name, null);
		}
		if (start.getType() == TokenType.LABEL) {
			advance();
			String name = start.getValue().substring(0, start.getValue().length() - 1);
			Node defaultValue = null;
			if (!current().isOperator(",") && !current().isOperator(")") && !current().isOperator("|") &&
					!atSeparator()) {
				defaultValue = inBlock ? parsePostfix() : parseTernary();
			}
			return new Param(span(start), Param.Kind.KEYWORD, name, defaultValue);
		}
		Token name = expect(TokenType.IDENT, "a parameter name");
		if (current().isOperator("=")) {
			advance();
			Node defaultValue = inBlock ? parsePostfix() : parseTernary();
			return new Param(span(start), Param.Kind.OPTIONAL, name.getValue(), defaultValue);
		}
		return new Param(name.getLocation(), Param.Kind.REQUIRED, name.getValue(), null);
	}

	private String parseMethodName() {
		StringBuilder name = new StringBuilder();
		if (current().isKeyword("self") && peek(1).isOperator(".")) {
			advance();
			advance();
			name.append("self.");
		}
		Token token = advance();
		switch (token.getType()) {
			case IDENT:
			case CONSTANT:
			case KEYWORD:
				name.append(token.getValue());
				// a setter, def name=(value)
				if (current().isOperator("=") && !current().hasSpaceBefore() && peek(1).isOperator("(")) {
					advance();
					name.append('=');
				}
				return name.toString();
			case OPERATOR:
				if (token.isOperator("[")) {
					expectOperator("]");
					name.append("[]");
					if (current().isOperator("=") && !current().hasSpaceBefore()) {
						advance();
						name.append('=');
					}
					return name.toString();
				}
				if (!token.isOperator("(") && !token.isOperator(")") && !token.isOperator(",") &&
						!token.isOperator(";")) {
					return name.append(token.getValue()).toString();
				}
				break;
			default:
				break;
		}
		throw new ParseException(token.getLocation(), "expected a method name but found '" + token.getValue() + "'");
	}

	private Def parseDef() {
		Token start = expectKeyword("def");
		String name = parseMethodName();
		Params params = null;
		if (current().isOperator("(")) {
			Token open = advance();
			List<Param> list = new ArrayList<>();
			skipNewlines();
			while (!current().isOperator(")")) {
				list.add(parseParam(false));
				skipNewlines();
				if (!current().isOperator(")")) {
					expectOperator(",");
					skipNewlines();
				}
			}
			advance();
			params = new Params(span(open), list);
		} else if (!atSeparator()) {
			Token first = current();
			List<Param> list = new ArrayList<>();
			list.add(parseParam(false));
			while (current().isOperator(",")) {
				advance();
				list.add(parseParam(false));
			}
			params = new Params(span(first), list);
		}
		Statements body = parseStatements(previous().getLocation(), t -> t.isKeyword("end"));
		expectKeyword("end");
		return new Def(span(start), name, params, body);
	}

	private Node parseConstantName() {
		Token start = current();
		Node name;
		if (start.isOperator("::")) {
			advance();
			name = new ConstPath(span(start), null, expect(TokenType.CONSTANT, "a constant").getValue());
		} else {
			Token constant = expect(TokenType.CONSTANT, "a constant");
			name = new ConstRef(constant.getLocation(), constant.getValue());
		}
		while (current().isOperator("::")) {
			advance();
			Token constant = expect(TokenType.CONSTANT, "a constant");
			name = new ConstPath(span(start), name, constant.getValue());
		}
		return name;
	}

	private ClassDecl parseClass() {
		Token start = expectKeyword("class");
		Node name = parseConstantName();
		Node superclass = null;
		if (current().isOperator("<")) {
			advance();
			superclass = parsePostfix();
		}
		Statements body = parseStatements(previous().getLocation(), t -> t.isKeyword("end"));
		expectKeyword("end");
		return new ClassDecl(span(start), name, superclass, body);
	}

	private ModuleDecl parseModule() {
		Token start = expectKeyword("module");
		Node name = parseConstantName();
		Statements body = parseStatements(previous().getLocation(), t -> t.isKeyword("end"));
		expectKeyword("end");
		return new ModuleDecl(span(start), name, body);
	}

	// control flow

	/**
	 * @param start the if, unless or elsif keyword, already consumed
	 */
	private If parseIf(Token start) {
		String keyword = start.getValue();
		Node predicate = parseLogical();
		if (current().isKeyword("then")) {
			advance();
		}
		Statements consequent = parseStatements(previous().getLocation(),
				t -> t.isKeyword("elsif") || t.isKeyword("else") || t.isKeyword("end"));
		Node alternative = null;
		if (current().isKeyword("elsif") && !keyword.equals("unless")) {
			alternative = parseIf(advance());
		} else if (current().isKeyword("else")) {
			alternative = parseElse();
		}
		if (keyword.equals("elsif")) {
			Node last = alternative != null ? alternative : consequent;
			return new If(start.getLocation().combine(last.getLocation()), keyword, predicate, consequent,
					alternative);
		}
		expectKeyword("end");
		return new If(span(start), keyword, predicate, consequent, alternative);
	}

	private Else parseElse() {
		Token start = expectKeyword("else");
		Statements body = parseStatements(start.getLocation(), t -> t.isKeyword("end"));
		return new Else(start.getLocation().combine(body.getLocation()), body);
	}

	private While parseWhile() {
		Token start = advance();
		Node predicate;
		++noDoBlock;
		try {
			predicate = parseLogical();
		} finally {
			--noDoBlock;
		}
		if (current().isKeyword("do")) {
			advance();
		}
		Statements body = parseStatements(previous().getLocation(), t -> t.isKeyword("end"));
		expectKeyword("end");
		return new While(span(start), start.getValue(), predicate, body);
	}

	private Case parseCase() {
		Token start = expectKeyword("case");
		Node value = null;
		if (!atSeparator()) {
			value = parseLogical();
		}
		skipSeparators();
		List<When> whens = new ArrayList<>();
		while (current().isKeyword("when")) {
			whens.add(parseWhen());
		}
		if (whens.isEmpty()) {
			throw unexpected("'when'");
		}
		Else alternative = null;
		if (current().isKeyword("else")) {
			alternative = parseElse();
		}
		expectKeyword("end");
		return new Case(span(start), value, whens, alternative);
	}

	private When parseWhen() {
		Token start = expectKeyword("when");
		List<Node> conditions = new ArrayList<>();
		conditions.add(parseArgument());
		while (current().isOperator(",")) {
			advance();
			skipNewlines();
			conditions.add(parseArgument());
		}
		if (current().isKeyword("then")) {
			advance();
		}
		Statements body = parseStatements(previous().getLocation(),
				t -> t.isKeyword("when") || t.isKeyword("else") || t.isKeyword("end"));
		return new When(start.getLocation().combine(body.getLocation()), conditions, body);
	}
}
