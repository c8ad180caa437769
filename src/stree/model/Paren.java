package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * ( contents )
 *
 */
public class Paren extends Node {
	private final Node contents;

	public Paren(SourceLocation location, Node contents) {
		super(location);
		this.contents = contents;
	}

	public Node getContents() {
		return contents;
	}

	@Override
	public String getType() {
		return "paren";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("contents", contents);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.group()) {
			formatter.text("(");
			try (Formatter.Scope ignored1 = formatter.indent()) {
				formatter.softline();
				formatter.visit(contents);
			}
			formatter.softline();
			formatter.text(")");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(contents, ((Paren) o).contents);
	}

	@Override
	public int hashCode() {
		return Objects.hash(contents);
	}
}
