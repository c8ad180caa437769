package stree.formatter;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import static stree.model.NodeBuilder.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import stree.STree;
import stree.model.ArrayLiteral;
import stree.model.Node;
import stree.model.Program;
import stree.model.VarRef;
import stree.util.SourceLocation;

public class TreeWalkerTest {

	private static String walk(Node root, int width) {
		Formatter formatter = new Formatter("", Collections.emptyList(),
				FormatterConfig.builder().printWidth(width).build());
		return new TreeWalker(formatter).walk(root);
	}

	@Test
	public void emptyProgramFormatsToEmptyString() {
		assertThat(walk(program(), 80), is(""));
	}

	@Test
	public void lowersSynthesizedTree() {
		Program tree = program(
				assign(var("x"), "=", num(1)),
				call(null, "foo", args(var("bar"), var("baz"))));
		assertThat(walk(tree, 80), is("x = 1\nfoo(bar, baz)\n"));
		assertThat(STree.format(tree, 80), is("x = 1\nfoo(bar, baz)\n"));
	}

	@Test
	public void widthDecidesLayout() {
		Program tree = program(call(null, "foo", args(var("bar"), var("baz"))));
		assertThat(walk(tree, 80), is("foo(bar, baz)\n"));
		assertThat(walk(tree, 5), is("foo(\n  bar,\n  baz\n)\n"));
	}

	@Test
	public void sharedChildIsRejected() {
		VarRef shared = var("x");
		Program tree = program(binop(shared, "+", shared));
		try {
			walk(tree, 80);
			fail("a node with two parents should be rejected");
		} catch (NonTreeInputException e) {
			assertThat(e.getMessage(), containsString("more than one parent"));
		}
	}

	@Test(expected = NonTreeInputException.class)
	public void cycleIsRejected() {
		List<Node> elements = new ArrayList<>();
		ArrayLiteral array = new ArrayLiteral(SourceLocation.unknown(), elements);
		elements.add(array);
		walk(program(array), 80);
	}

	@Test(expected = NonTreeInputException.class)
	public void cycleThroughRootIsRejected() {
		List<Node> elements = new ArrayList<>();
		ArrayLiteral array = new ArrayLiteral(SourceLocation.unknown(), elements);
		elements.add(num(1));
		elements.add(array);
		TreeWalker.checkTree(array);
	}

	@Test
	public void nothingIsWrittenForRejectedInput() {
		VarRef shared = var("x");
		Formatter formatter = new Formatter("", Collections.emptyList(), FormatterConfig.defaults());
		try {
			new TreeWalker(formatter).walk(program(shared, modifier("if", num(1), shared)));
			fail("a node with two parents should be rejected");
		} catch (NonTreeInputException e) {
			assertTrue(formatter.isEmpty());
		}
	}

	@Test(expected = IllegalStateException.class)
	public void formatterServesOneWalker() {
		Formatter formatter = new Formatter("", Collections.emptyList(), FormatterConfig.defaults());
		new TreeWalker(formatter);
		new TreeWalker(formatter);
	}
}
