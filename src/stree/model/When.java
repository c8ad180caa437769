package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * One arm of a case. Conditions that do not fit on the line continue aligned under the first.
 *
 */
public class When extends Node {
	private static final String KEYWORD = "when ";

	private final List<Node> conditions;
	private final Statements body;

	public When(SourceLocation location, List<Node> conditions, Statements body) {
		super(location);
		this.conditions = Collections.unmodifiableList(conditions);
		this.body = body;
	}

	public List<Node> getConditions() {
		return conditions;
	}

	public Statements getBody() {
		return body;
	}

	@Override
	public String getType() {
		return "when";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.children("conditions", conditions);
		v.child("body", body);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.group()) {
			formatter.text(KEYWORD);
			try (Formatter.Scope ignored1 = formatter.align(KEYWORD.length())) {
				formatter.seplist(conditions, () -> {
					formatter.text(",");
					formatter.breakable();
				});
			}
		}
		int headerLine = conditions.get(conditions.size() - 1).getLocation().getEndLine();
		Statements.formatBody(formatter, headerLine, body);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		When when = (When) o;
		return Objects.equals(conditions, when.conditions) &&
				Objects.equals(body, when.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(conditions, body);
	}
}
