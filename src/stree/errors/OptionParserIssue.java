package stree.errors;

public class OptionParserIssue extends Issue {

	private static final long serialVersionUID = -1181049658218049232L;

	private final String detail;

	public OptionParserIssue(String detail) {
		this.detail = detail;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
