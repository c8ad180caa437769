package stree.errors;

import stree.layout.IndentingWriter;
import stree.parser.ParseException;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent(2)) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDetail());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing " + parsingIssue.getLanguage() + ": ");
		out.write(parsingIssue.getError().getMessage());
		if (parsingIssue.getError() instanceof ParseException && parsingIssue.getSource() != null) {
			try (IndentingWriter.Indent ignored = out.indent(2)) {
				out.newLine();
				((ParseException) parsingIssue.getError()).getLocation().writePretty(out, parsingIssue.getSource());
			}
		}
		return null;
	}

	@Override
	public Void visit(FormattingIssue formattingIssue) throws IOException {
		out.write("unable to format: ");
		out.write(formattingIssue.getError().getMessage());
		return null;
	}

	@Override
	public Void visit(UnformattedFileIssue unformattedFileIssue) throws IOException {
		out.write("file is not formatted: ");
		out.write(unformattedFileIssue.getFile().toString());
		return null;
	}

	@Override
	public Void visit(NonIdempotentIssue nonIdempotentIssue) throws IOException {
		out.write("formatting is not idempotent for ");
		out.write(nonIdempotentIssue.getFile().toString());
		out.write(", output changes on a second pass at line ");
		out.write(Integer.toString(nonIdempotentIssue.getFirstDifferingLine()));
		return null;
	}
}
