package stree.model;

import stree.doc.Document;
import stree.doc.Docs;
import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A statement guarded by a trailing if, unless, while or until. Printed as written when it
 * fits on the line, otherwise as the equivalent block form:
 * 
 * statement if predicate
 * 
 * if predicate
 *   statement
 * end
 *
 */
public class Modifier extends Node {
	private final String keyword;
	private final Node statement;
	private final Node predicate;

	public Modifier(SourceLocation location, String keyword, Node statement, Node predicate) {
		super(location);
		this.keyword = keyword;
		this.statement = statement;
		this.predicate = predicate;
	}

	public String getKeyword() {
		return keyword;
	}

	public Node getStatement() {
		return statement;
	}

	public Node getPredicate() {
		return predicate;
	}

	@Override
	public String getType() {
		return keyword + "_modifier";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.field("keyword", keyword);
		v.child("statement", statement);
		v.child("predicate", predicate);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.group()) {
			Document stmt = formatter.capture(() -> formatter.visit(statement));
			Document pred = formatter.capture(() -> formatter.visit(predicate));
			formatter.ifBreak(
					Docs.concat(stmt, Docs.text(" " + keyword + " "), pred),
					Docs.concat(
							Docs.text(keyword + " "),
							pred.copy(),
							Docs.indent(formatter.getConfig().getIndentWidth(), Docs.softline(), stmt.copy()),
							Docs.softline(),
							Docs.text("end")));
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Modifier modifier = (Modifier) o;
		return Objects.equals(keyword, modifier.keyword) &&
				Objects.equals(statement, modifier.statement) &&
				Objects.equals(predicate, modifier.predicate);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, statement, predicate);
	}
}
