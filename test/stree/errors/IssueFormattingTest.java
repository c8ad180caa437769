package stree.errors;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.nio.file.Paths;

import org.junit.Test;

import stree.STree;
import stree.parser.ParseException;

public class IssueFormattingTest {

	@Test
	public void countsIssues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());
		ctx.error(new OptionParserIssue("unknown action \"fmt\""));
		assertTrue(ctx.hasErrors());
		assertThat(ctx.format(), is("Detected 1 issue(s):\nunable to parse options: unknown action \"fmt\""));
	}

	@Test
	public void nestsFileContext() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		IssueContext fileCtx = ctx.withContext(new WhileProcessingFile(Paths.get("a.rb")));
		fileCtx.error(new UnformattedFileIssue(Paths.get("a.rb")));
		assertTrue(fileCtx.hasErrors());
		assertThat(ctx.getIssues().get(0), instanceOf(IssueWithContext.class));
		assertThat(ctx.format(), is("Detected 1 issue(s):\nwhile processing a.rb\n  file is not formatted: a.rb"));
	}

	@Test
	public void parsingIssuePointsAtSource() {
		String source = "foo(1, 2";
		ParseException error;
		try {
			STree.parse(source);
			fail("unclosed call should not parse");
			return;
		} catch (ParseException e) {
			error = e;
		}
		ParsingIssue issue = new ParsingIssue("ruby", error, source);
		String message = issue.getMessage();
		assertThat(message, startsWith("error parsing ruby: Parse error: expected ','"));
		assertThat(message, containsString("\n  at 1:9"));
		assertThat(message, containsString("\n  foo(1, 2\n          ^ EOF"));
		assertSame(error, issue.getCause());
	}

	@Test
	public void ioErrorIssue() {
		IOErrorIssue issue = new IOErrorIssue(new IOException("disk on fire"));
		assertThat(issue.getMessage(), is("IO Error: java.io.IOException: disk on fire"));
	}

	@Test
	public void nonIdempotentIssueFindsFirstDifference() {
		NonIdempotentIssue issue = new NonIdempotentIssue(Paths.get("b.rb"), "a\nb\nc\n", "a\nb\nd\n");
		assertThat(issue.getFirstDifferingLine(), is(3));
		assertThat(issue.getMessage(),
				is("formatting is not idempotent for b.rb, output changes on a second pass at line 3"));
	}
}
