package stree.errors;

import stree.STreeException;

/**
 * Lowering a parsed tree failed: the tree was not a tree, or a node built a malformed document.
 */
public class FormattingIssue extends Issue {

	private static final long serialVersionUID = -5402580049146834553L;

	private final STreeException error;

	public FormattingIssue(STreeException error) {
		initCause(error);
		this.error = error;
	}

	public STreeException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
