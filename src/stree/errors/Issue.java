package stree.errors;

import stree.STreeException;
import stree.layout.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found while processing input, collected by an {@link IssueContext} instead of
 * stopping the run.
 */
public abstract class Issue extends STreeException {

	private static final long serialVersionUID = -3383404622640395476L;

	public Issue() {
		super("Issue", "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
