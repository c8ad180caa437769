package stree.util;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

public class SourceLocationTest {

	@Test
	public void combineSpansBoth() {
		SourceLocation a = new SourceLocation(null, 0, 3, 1, 1, 1, 4);
		SourceLocation b = new SourceLocation(null, 10, 12, 2, 2, 3, 5);
		SourceLocation combined = b.combine(a);
		assertThat(combined.getStartOffset(), is(0));
		assertThat(combined.getEndOffset(), is(12));
		assertThat(combined.getStartLine(), is(1));
		assertThat(combined.getEndColumn(), is(5));
	}

	@Test
	public void unknownIsNeutral() {
		SourceLocation a = new SourceLocation(null, 0, 3, 1, 1, 1, 4);
		assertSame(a, SourceLocation.unknown().combine(a));
		assertSame(a, a.combine(SourceLocation.unknown()));
	}

	@Test
	public void prettyStringUnderlines() {
		String source = "x = 1\nfoo bar\n";
		SourceLocation loc = new SourceLocation(null, 10, 13, 2, 2, 5, 8);
		assertThat(loc.prettyString(source), is("at 2:5-7\nfoo bar\n    ^^^"));
	}
}
