package stree.errors;

import java.io.IOException;

public class IOErrorIssue extends Issue {

	private static final long serialVersionUID = 8004337051264950826L;

	private final IOException error;

	public IOErrorIssue(IOException e) {
		super();
		initCause(e);
		this.error = e;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
