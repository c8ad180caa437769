package stree.formatter;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import stree.STree;

@RunWith(Parameterized.class)
public class FormattingTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"", 80, ""},
				{"\n\n", 80, ""},
				{"foo(bar,baz)", 80, "foo(bar, baz)\n"},
				{"foo(bar,baz)", 5, "foo(\n  bar,\n  baz\n)\n"},
				{"x=1", 80, "x = 1\n"},
				{"x  +=  1", 80, "x += 1\n"},
				{"1+2*3", 80, "1 + 2 * 3\n"},
				{"(1..10)", 80, "(1..10)\n"},
				{"a = b ? c : d", 80, "a = b ? c : d\n"},
				{"x = [1,2,3]", 80, "x = [1, 2, 3]\n"},
				{"h = {a: 1, :b => 2}", 80, "h = { a: 1, :b => 2 }\n"},
				{"x = []", 80, "x = []\n"},
				{"Foo::Bar.baz(1)", 80, "Foo::Bar.baz(1)\n"},
				{"foo[1]", 80, "foo[1]\n"},
				{"puts 'hi'", 80, "puts \"hi\"\n"},
				{"puts 'say \"hi\"'", 80, "puts 'say \"hi\"'\n"},

				// definitions
				{"def foo(a,b)\nbar\nend", 80, "def foo(a, b)\n  bar\nend\n"},
				{"def foo\nend", 80, "def foo\nend\n"},
				{"class Foo < Bar\ndef baz\nend\nend", 80, "class Foo < Bar\n  def baz\n  end\nend\n"},
				{"module A\nX = 1\nend", 80, "module A\n  X = 1\nend\n"},

				// control flow
				{"if x\ny\nelsif z\nw\nelse\nv\nend", 80, "if x\n  y\nelsif z\n  w\nelse\n  v\nend\n"},
				{"while x do\ny\nend", 80, "while x\n  y\nend\n"},
				{"case x\nwhen 1,2\ny\nelse\nz\nend", 80, "case x\nwhen 1, 2\n  y\nelse\n  z\nend\n"},
				{"foo if bar", 80, "foo if bar\n"},
				{"return 1 if x", 80, "return 1 if x\n"},
				{"foo(x) if some_condition", 15, "if some_condition\n  foo(x)\nend\n"},

				// blocks and commands
				{"foo.each { |x| puts x }", 80, "foo.each { |x| puts x }\n"},
				{"foo.each { |x| a; b }", 80, "foo.each do |x|\n  a\n  b\nend\n"},
				{"foo bar do\n  x\nend", 80, "foo bar do\n  x\nend\n"},
				{"foo bar do\nend", 80, "foo bar do\nend\n"},
				{"foo bar { x }", 80, "foo bar { x }\n"},
				{"y = foo bar do |z|\n  z\nend", 80, "y = foo bar do |z|\n  z\nend\n"},
				{"puts aaaaaaaaaa, bbbbbbbbbb", 20, "puts aaaaaaaaaa,\n     bbbbbbbbbb\n"},
				{
					"some_method_name(argument_number_one, argument_number_two, argument_number_three)", 80,
					"some_method_name(\n  argument_number_one,\n  argument_number_two,\n  argument_number_three\n)\n"
				},

				// blank lines and comments
				{"a\n\n\n\nb", 80, "a\n\nb\n"},
				{"a\nb", 80, "a\nb\n"},
				{"# hi\nfoo # trailing\n", 80, "# hi\nfoo # trailing\n"},
				{"a\n\n# note\nb", 80, "a\n\n# note\nb\n"},
				{"def foo\n# todo\nend", 80, "def foo\n  # todo\nend\n"},
				{"# only a comment", 80, "# only a comment\n"},
		});
	}

	private final String input;
	private final int width;
	private final String expected;

	public FormattingTest(String input, int width, String expected) {
		this.input = input;
		this.width = width;
		this.expected = expected;
	}

	private String format(String source) {
		return STree.format(source, FormatterConfig.builder().printWidth(width).build());
	}

	@Test
	public void formats() {
		assertThat(format(input), is(expected));
	}

	@Test
	public void isIdempotent() {
		assertThat(format(expected), is(expected));
	}
}
