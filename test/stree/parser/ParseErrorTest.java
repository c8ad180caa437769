package stree.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.file.Paths;

import org.junit.Test;

import stree.STree;

public class ParseErrorTest {

	private static ParseException parseFailure(String source) {
		try {
			STree.parse(source);
		} catch (ParseException e) {
			return e;
		}
		fail("expected a parse error for: " + source);
		return null;
	}

	@Test
	public void missingEnd() {
		ParseException e = parseFailure("if x\n  y\n");
		assertThat(e.getMessage(), containsString("expected 'end' but found end of input"));
		assertThat(e.getLine(), is(3));
	}

	@Test
	public void unclosedArguments() {
		ParseException e = parseFailure("foo(1, 2");
		assertThat(e.getMessage(), containsString("expected ','"));
	}

	@Test
	public void invalidAssignmentTarget() {
		ParseException e = parseFailure("1 = 2");
		assertThat(e.getMessage(), containsString("cannot assign to number"));
		assertThat(e.getLocation().getStartColumn(), is(3));
	}

	@Test
	public void twoExpressionsOnOneLine() {
		ParseException e = parseFailure("foo(1) bar");
		assertThat(e.getMessage(), containsString("expected a line break but found 'bar'"));
	}

	@Test
	public void strayEnd() {
		ParseException e = parseFailure("end");
		assertThat(e.getMessage(), containsString("expected an expression but found 'end'"));
	}

	@Test
	public void locationNamesTheFile() {
		try {
			STree.parse(Paths.get("lib", "broken.rb"), "def\n");
			fail("def without a name should not parse");
		} catch (ParseException e) {
			assertThat(e.getLocation().getFile(), is(Paths.get("lib", "broken.rb")));
			assertThat(e.getLocation().prettyString("def\n"), containsString("in file " + Paths.get("lib", "broken.rb")));
		}
	}
}
