package stree.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(FormattingIssue formattingIssue) throws E;
	public abstract T visit(UnformattedFileIssue unformattedFileIssue) throws E;
	public abstract T visit(NonIdempotentIssue nonIdempotentIssue) throws E;
}
