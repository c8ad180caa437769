package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * The else branch of an if, unless or case.
 *
 */
public class Else extends Node {
	private final Statements body;

	public Else(SourceLocation location, Statements body) {
		super(location);
		this.body = body;
	}

	public Statements getBody() {
		return body;
	}

	@Override
	public String getType() {
		return "else";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("body", body);
	}

	@Override
	public void format(Formatter formatter) {
		formatter.text("else");
		Statements.formatBody(formatter, getLocation().getStartLine(), body);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(body, ((Else) o).body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body);
	}
}
