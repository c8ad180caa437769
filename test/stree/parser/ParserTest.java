package stree.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import static stree.model.NodeBuilder.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import stree.model.Param;
import stree.model.Program;

@RunWith(Parameterized.class)
public class ParserTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"", program()},
				{"foo(bar, baz)", program(call(null, "foo", args(var("bar"), var("baz"))))},
				{"foo()", program(call(null, "foo", args()))},
				{"x = 1", program(assign(var("x"), "=", num(1)))},
				{"a ||= b", program(assign(var("a"), "||=", var("b")))},
				{"a[1] = 2", program(assign(index(var("a"), num(1)), "=", num(2)))},
				{"foo.bar = 1", program(assign(call(var("foo"), ".", "bar", null, null), "=", num(1)))},

				// operators
				{"1 + 2 * 3", program(binop(num(1), "+", binop(num(2), "*", num(3))))},
				{"a - b - c", program(binop(binop(var("a"), "-", var("b")), "-", var("c")))},
				{"2 ** 3 ** 4", program(binop(num(2), "**", binop(num(3), "**", num(4))))},
				{"a || b && c", program(binop(var("a"), "||", binop(var("b"), "&&", var("c"))))},
				{"a and b or c", program(binop(binop(var("a"), "and", var("b")), "or", var("c")))},
				{"not x", program(unop("not", var("x")))},
				{"!x.y?", program(unop("!", call(var("x"), ".", "y?", null, null)))},
				{"x ? 1 : 2", program(ternary(var("x"), num(1), num(2)))},
				{"(1)", program(paren(num(1)))},
				{"1..2", program(binop(num(1), "..", num(2)))},

				// commands
				{"puts x, y", program(command("puts", var("x"), var("y")))},
				{"foo -1", program(command("foo", unop("-", num(1))))},
				{"foo - 1", program(binop(var("foo"), "-", num(1)))},
				{"foo bar do |x|\nend", program(command(null, "foo", Arrays.asList(var("bar")), block(params(param("x")))))},
				{"foo { |x| x }", program(call(null, null, "foo", null, block(params(param("x")), var("x"))))},

				// literals
				{"{a: 1, 'b' => :c}", program(hash(assoc(label("a"), num(1)), assoc(str("'b'"), sym("c"))))},
				{"[*a, 1]", program(array(splat("*", var("a")), num(1)))},
				{"Foo::Bar", program(constPath(constant("Foo"), "Bar"))},
				{"x.y&.z", program(call(call(var("x"), ".", "y", null, null), "&.", "z", null, null))},
				{"@a = nil", program(assign(var("@a"), "=", kw("nil")))},

				// statements
				{"foo if bar", program(modifier("if", var("foo"), var("bar")))},
				{"return", program(ret(null))},
				{"return 1 unless x", program(modifier("unless", ret(num(1)), var("x")))},
				{"a; b\n\nc", program(var("a"), var("b"), var("c"))},
				{
					"def foo(a, b = 1, *rest, key:, &blk)\nend",
					program(def("foo", params(
							param("a"),
							param(Param.Kind.OPTIONAL, "b", num(1)),
							param(Param.Kind.REST, "rest", null),
							param(Param.Kind.KEYWORD, "key", null),
							param(Param.Kind.BLOCK, "blk", null))))
				},
				{"def self.call\n1\nend", program(def("self.call", null, num(1)))},
				{"def ==(other)\nend", program(def("==", params(param("other"))))},
				{"class A < B\nend", program(classDecl(constant("A"), constant("B")))},
				{"module A::B\nX = 1\nend", program(moduleDecl(constPath(constant("A"), "B"),
						assign(constant("X"), "=", num(1))))},
				{"if a\nb\nelse\nc\nend", program(ifNode("if", var("a"), stmts(var("b")), elseNode(var("c"))))},
				{
					"if a then b elsif c then d end",
					program(ifNode("if", var("a"), stmts(var("b")), ifNode("elsif", var("c"), stmts(var("d")), null)))
				},
				{"while x do\ny\nend", program(whileNode("while", var("x"), var("y")))},
				{"until done?\nstep\nend", program(whileNode("until", call(null, null, "done?", null, null), var("step")))},
				{
					"case x\nwhen 1, 2 then y\nelse z\nend",
					program(caseNode(var("x"), Arrays.asList(when(Arrays.asList(num(1), num(2)), var("y"))),
							elseNode(var("z"))))
				},
		});
	}

	private final String source;
	private final Program expected;

	public ParserTest(String source, Program expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void parses() {
		assertEquals(expected, Parser.parse(null, source));
	}
}
