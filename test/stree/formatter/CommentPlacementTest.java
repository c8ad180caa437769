package stree.formatter;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.List;

import org.junit.Test;

import stree.STree;
import stree.model.Comment;
import stree.model.Program;

public class CommentPlacementTest {

	private static void assertFormats(String source, String expected) {
		assertThat(STree.format(source), is(expected));
		assertThat(STree.format(expected), is(expected));
	}

	@Test
	public void parserSeparatesComments() {
		Program program = STree.parse("a # one\n# two\nb");
		List<Comment> comments = program.getComments();
		assertThat(comments.size(), is(2));
		assertThat(comments.get(0).getValue(), is("# one"));
		assertTrue(comments.get(0).isInline());
		assertThat(comments.get(1).getValue(), is("# two"));
		assertFalse(comments.get(1).isInline());
	}

	@Test
	public void commentBetweenNodesStaysBetweenThem() {
		for (String gap : new String[] {"", " ", "\n", "\n\n"}) {
			String source = "first_node" + gap + " # between\nsecond_node";
			String formatted = STree.format(source);
			int first = formatted.indexOf("first_node");
			int comment = formatted.indexOf("# between");
			int second = formatted.indexOf("second_node");
			assertTrue(formatted, first < comment);
			assertTrue(formatted, comment < second);
		}
	}

	@Test
	public void trailingCommentStaysOnItsLine() {
		assertFormats("x = 1 # one\ny = 2", "x = 1 # one\ny = 2\n");
	}

	@Test
	public void trailingCommentStripsWhitespace() {
		assertFormats("x = 1 # one   \n", "x = 1 # one\n");
	}

	@Test
	public void commentAfterHeader() {
		assertFormats("def foo # c\nbar\nend", "def foo # c\n  bar\nend\n");
	}

	@Test
	public void commentInArgumentsForcesBreak() {
		assertFormats("foo(a, # first\n  b)", "foo(\n  a, # first\n  b\n)\n");
	}

	@Test
	public void commentInEmptyArray() {
		assertFormats("x = [\n# nothing\n]", "x = [\n  # nothing\n]\n");
	}

	@Test
	public void commentAtEndOfFile() {
		assertFormats("a\n# end", "a\n# end\n");
		assertFormats("a\n\n\n# end", "a\n\n# end\n");
	}

	@Test
	public void commentAtEndOfBody() {
		assertFormats("if x\ny\n# done\nend", "if x\n  y\n  # done\nend\n");
	}

	@Test
	public void leadingCommentsKeepOrder() {
		assertFormats("# a\n# b\nfoo", "# a\n# b\nfoo\n");
	}

	@Test
	public void blankLineAfterHeaderCommentIsKept() {
		assertFormats("# header\n\nx\n", "# header\n\nx\n");
		assertFormats("\n\n# header\nx\n", "# header\nx\n");
	}

	@Test
	public void blankLineAfterCommentAtStartOfBodyIsKept() {
		assertFormats("def foo\n  # a\n\n  x\nend\n", "def foo\n  # a\n\n  x\nend\n");
		assertFormats("def foo\n\n  # a\n  x\nend\n", "def foo\n  # a\n  x\nend\n");
	}
}
