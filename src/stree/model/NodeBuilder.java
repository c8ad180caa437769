package stree.model;

import stree.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builds trees without source locations, for code that synthesizes nodes rather than parsing them.
 */
public class NodeBuilder {
	private NodeBuilder() {}

	private static SourceLocation loc() {
		return SourceLocation.unknown();
	}

	public static Program program(Node... statements) {
		return new Program(loc(), stmts(statements), Collections.emptyList());
	}

	public static Statements stmts(Node... body) {
		return new Statements(loc(), Arrays.asList(body));
	}

	// definitions

	public static Def def(String name, List<Param> params, Node... body) {
		return new Def(loc(), name, params == null ? null : new Params(loc(), params), stmts(body));
	}

	public static List<Param> params(Param... params) {
		return Arrays.asList(params);
	}

	public static Param param(String name) {
		return new Param(loc(), Param.Kind.REQUIRED, name, null);
	}

	public static Param param(Param.Kind kind, String name, Node defaultValue) {
		return new Param(loc(), kind, name, defaultValue);
	}

	public static ClassDecl classDecl(Node name, Node superclass, Node... body) {
		return new ClassDecl(loc(), name, superclass, stmts(body));
	}

	public static ModuleDecl moduleDecl(Node name, Node... body) {
		return new ModuleDecl(loc(), name, stmts(body));
	}

	// control flow

	public static If ifNode(String keyword, Node predicate, Statements consequent, Node alternative) {
		return new If(loc(), keyword, predicate, consequent, alternative);
	}

	public static Else elseNode(Node... body) {
		return new Else(loc(), stmts(body));
	}

	public static While whileNode(String keyword, Node predicate, Node... body) {
		return new While(loc(), keyword, predicate, stmts(body));
	}

	public static Case caseNode(Node value, List<When> whens, Else alternative) {
		return new Case(loc(), value, whens, alternative);
	}

	public static When when(List<Node> conditions, Node... body) {
		return new When(loc(), conditions, stmts(body));
	}

	public static Return ret(Node value) {
		return new Return(loc(), value);
	}

	public static Modifier modifier(String keyword, Node statement, Node predicate) {
		return new Modifier(loc(), keyword, statement, predicate);
	}

	// expressions

	public static Assign assign(Node target, String operator, Node value) {
		return new Assign(loc(), target, operator, value);
	}

	public static Binary binop(Node left, String operator, Node right) {
		return new Binary(loc(), left, operator, right);
	}

	public static Unary unop(String operator, Node operand) {
		return new Unary(loc(), operator, operand);
	}

	public static Ternary ternary(Node predicate, Node consequent, Node alternative) {
		return new Ternary(loc(), predicate, consequent, alternative);
	}

	public static Call call(Node receiver, String name, Args arguments) {
		return new Call(loc(), receiver, receiver == null ? null : ".", name, arguments, null);
	}

	public static Call call(Node receiver, String operator, String name, Args arguments, Block block) {
		return new Call(loc(), receiver, operator, name, arguments, block);
	}

	public static Command command(String name, Node... arguments) {
		return new Command(loc(), null, null, name, Arrays.asList(arguments), null);
	}

	public static Command command(Node receiver, String name, List<Node> arguments, Block block) {
		return new Command(loc(), receiver, receiver == null ? null : ".", name, arguments, block);
	}

	public static Args args(Node... arguments) {
		return new Args(loc(), Arrays.asList(arguments));
	}

	public static Block block(List<Param> params, Node... body) {
		return new Block(loc(), params, stmts(body));
	}

	public static Index index(Node receiver, Node... indexes) {
		return new Index(loc(), receiver, Arrays.asList(indexes));
	}

	public static ArrayLiteral array(Node... elements) {
		return new ArrayLiteral(loc(), Arrays.asList(elements));
	}

	public static HashLiteral hash(Node... entries) {
		return new HashLiteral(loc(), Arrays.asList(entries));
	}

	public static Assoc assoc(Node key, Node value) {
		return new Assoc(loc(), key, value);
	}

	public static Splat splat(String operator, Node value) {
		return new Splat(loc(), operator, value);
	}

	public static Paren paren(Node contents) {
		return new Paren(loc(), contents);
	}

	// leaves

	public static NumberLiteral num(String value) {
		return new NumberLiteral(loc(), value);
	}

	public static NumberLiteral num(int value) {
		return num(Integer.toString(value));
	}

	public static StringLiteral str(String literal) {
		return new StringLiteral(loc(), literal);
	}

	public static SymbolLiteral sym(String name) {
		return new SymbolLiteral(loc(), ":" + name);
	}

	public static LabelLiteral label(String name) {
		return new LabelLiteral(loc(), name + ":");
	}

	public static KeywordLiteral kw(String keyword) {
		return new KeywordLiteral(loc(), keyword);
	}

	public static VarRef var(String name) {
		return new VarRef(loc(), name);
	}

	public static ConstRef constant(String name) {
		return new ConstRef(loc(), name);
	}

	public static ConstPath constPath(Node parent, String name) {
		return new ConstPath(loc(), parent, name);
	}
}
