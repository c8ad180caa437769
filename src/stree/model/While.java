package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * while predicate / until predicate
 *   body
 * end
 *
 */
public class While extends Node {
	private final String keyword;
	private final Node predicate;
	private final Statements body;

	public While(SourceLocation location, String keyword, Node predicate, Statements body) {
		super(location);
		this.keyword = keyword;
		this.predicate = predicate;
		this.body = body;
	}

	public String getKeyword() {
		return keyword;
	}

	public Node getPredicate() {
		return predicate;
	}

	public Statements getBody() {
		return body;
	}

	@Override
	public String getType() {
		return keyword;
	}

	@Override
	public void accept(FieldVisitor v) {
		v.field("keyword", keyword);
		v.child("predicate", predicate);
		v.child("body", body);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.forcedGroup()) {
			formatter.text(keyword + " ");
			formatter.visit(predicate);
			Statements.formatBody(formatter, predicate.getLocation().getEndLine(), body);
			formatter.hardline();
			formatter.text("end");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		While that = (While) o;
		return Objects.equals(keyword, that.keyword) &&
				Objects.equals(predicate, that.predicate) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, predicate, body);
	}
}
