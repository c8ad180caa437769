package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * A sequence of statements, one per line. Its location spans from the end of the header that
 * opens it to the start of the keyword that closes it, so it owns the comments in between.
 *
 */
public class Statements extends Node {
	private final List<Node> body;

	public Statements(SourceLocation location, List<Node> body) {
		super(location);
		this.body = Collections.unmodifiableList(body);
	}

	public List<Node> getBody() {
		return body;
	}

	public boolean isEmpty() {
		return body.isEmpty();
	}

	@Override
	public String getType() {
		return "statements";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.children("body", body);
	}

	@Override
	public void format(Formatter formatter) {
		int end = getLocation().getEndOffset();
		for (int i = 0; i < body.size(); ++i) {
			Node statement = body.get(i);
			if (i > 0) {
				formatter.hardline();
				formatter.leadingComments(statement.getLocation(), true);
			} else {
				// nothing is reproduced above the first statement, only between its comments and it
				formatter.leadingComments(statement.getLocation(), false, true);
			}
			formatter.visit(statement);
			int limit = i + 1 < body.size() ? body.get(i + 1).getLocation().getStartOffset() : end;
			formatter.trailingComments(limit);
		}
		formatter.danglingComments(end, body.isEmpty());
	}

	/**
	 * Lowers {@code body} on the lines after a header such as {@code def foo}, indented. The
	 * header ends on {@code headerLine}; comments later on that line stay on it. Nothing is
	 * emitted for an empty body without comments. The caller emits the closing keyword.
	 */
	public static void formatBody(Formatter formatter, int headerLine, Statements body) {
		formatter.markLine(headerLine);
		int end = body.getLocation().getEndOffset();
		formatter.trailingComments(end);
		if (body.isEmpty() && !formatter.hasCommentsBefore(end)) {
			return;
		}
		try (Formatter.Scope ignored = formatter.indent()) {
			formatter.hardline();
			formatter.visit(body);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Statements that = (Statements) o;
		return Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body);
	}
}
