package stree.errors;

import stree.STreeException;

/**
 * The input could not be tokenized or parsed.
 */
public class ParsingIssue extends Issue {

	private static final long serialVersionUID = 5560312094302106207L;

	private final String language;
	private final STreeException error;
	private final CharSequence source;

	public ParsingIssue(String language, STreeException error, CharSequence source) {
		initCause(error);
		this.language = language;
		this.error = error;
		this.source = source;
	}

	public STreeException getError() {
		return error;
	}

	public String getLanguage() {
		return language;
	}

	public CharSequence getSource() {
		return source;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
