package stree.layout;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import static stree.doc.Docs.*;

import org.junit.Test;

import stree.doc.Document;
import stree.doc.MalformedDocumentException;

public class RendererTest {

	private static Document fooBarBaz() {
		return group(
				text("foo("),
				indent(2, softline(), text("bar"), breakable(","), text("baz")),
				softline(),
				text(")"));
	}

	@Test
	public void fitsOnOneLine() {
		assertThat(new Renderer(80).render(fooBarBaz()), is("foo(bar,baz)"));
	}

	@Test
	public void brokenGroupBreaksEveryBreakable() {
		assertThat(new Renderer(5).render(fooBarBaz()), is("foo(\n  bar\n  baz\n)"));
	}

	@Test
	public void exactFitIsFlat() {
		// "foo(bar,baz)" is 12 columns
		assertThat(new Renderer(12).render(fooBarBaz()), is("foo(bar,baz)"));
		assertThat(new Renderer(11).render(fooBarBaz()), is("foo(\n  bar\n  baz\n)"));
	}

	@Test
	public void forcedGroupBreaksAtAnyWidth() {
		Document doc = forced(text("a"), line(), text("b"));
		assertThat(new Renderer(1000).render(doc), is("a\nb"));
		assertThat(new Renderer(10).render(doc), is("a\nb"));
	}

	@Test
	public void forcedGroupBreaksItsAncestors() {
		Document doc = group(text("x"), line(), group(text("y"), breakParent()), line(), text("z"));
		assertThat(new Renderer(1000).render(doc), is("x\ny\nz"));
	}

	@Test
	public void nestedGroupsDecideAtTheirOwnColumn() {
		Document inner = group(text("["), indent(2, softline(), text("1,"), line(), text("2")), softline(), text("]"));
		Document doc = group(text("call("), indent(2, softline(), inner), softline(), text(")"));
		assertThat(new Renderer(10).render(doc), is("call(\n  [1, 2]\n)"));
	}

	@Test
	public void ifBreakFollowsItsGroup() {
		Document flat = group(text("a"), line(), text("b"), ifBreak(text(""), text(",")));
		assertThat(new Renderer(80).render(flat), is("a b"));
		Document broken = group(text("a"), line(), text("b"), ifBreak(text(""), text(",")));
		assertThat(new Renderer(2).render(broken), is("a\nb,"));
	}

	@Test
	public void ifBreakMeasuresOnlyTheFlatAlternative() {
		Document doc = group(text("ab"), ifBreak(text(""), text("this is very long")));
		assertThat(doc.getFlatWidth(), is(2));
		assertThat(new Renderer(2).render(doc), is("ab"));
	}

	@Test
	public void indentationIsRestoredAfterForcedGroup() {
		Document doc = forced(
				text("begin"),
				indent(2, line(), forced(text("a"), line(), text("b"))),
				line(),
				text("end"));
		assertThat(new Renderer(80).render(doc), is("begin\n  a\n  b\nend"));
	}

	@Test
	public void alignUsesExactPrefix() {
		Document doc = forced(text("# "), align("# ", text("one"), line(), text("two")));
		assertThat(new Renderer(80).render(doc), is("# one\n# two"));

		Document spaces = forced(text("when "), align(5, text("a,"), line(), text("b")));
		assertThat(new Renderer(80).render(spaces), is("when a,\n     b"));
	}

	@Test
	public void negativeDeltaDedents() {
		Document doc = forced(indent(4, text("a"), breakable("", -2), text("b")));
		assertThat(new Renderer(80).render(doc), is("a\n  b"));
	}

	@Test
	public void emptyLinesGetNoIndentation() {
		Document doc = forced(indent(2, text("a"), line(), line(), text("b")));
		assertThat(new Renderer(80).render(doc), is("a\n\n  b"));
	}

	@Test
	public void emptyDocumentRendersNothing() {
		assertThat(new Renderer(80).render(empty()), is(""));
	}

	@Test(expected = MalformedDocumentException.class)
	public void breakableOutsideGroup() {
		new Renderer(80).render(concat(text("a"), line(), text("b")));
	}

	@Test(expected = MalformedDocumentException.class)
	public void ifBreakOutsideGroup() {
		new Renderer(80).render(ifBreak(text("a"), text("b")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void widthMustBePositive() {
		new Renderer(0);
	}

	@Test
	public void rendersSameDocumentTwice() {
		Renderer renderer = new Renderer(5);
		Document doc = fooBarBaz();
		assertEquals(renderer.render(doc), renderer.render(doc));
	}
}
