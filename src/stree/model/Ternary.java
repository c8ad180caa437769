package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * predicate ? consequent : alternative
 *
 */
public class Ternary extends Node {
	private final Node predicate;
	private final Node consequent;
	private final Node alternative;

	public Ternary(SourceLocation location, Node predicate, Node consequent, Node alternative) {
		super(location);
		this.predicate = predicate;
		this.consequent = consequent;
		this.alternative = alternative;
	}

	public Node getPredicate() {
		return predicate;
	}

	public Node getConsequent() {
		return consequent;
	}

	public Node getAlternative() {
		return alternative;
	}

	@Override
	public String getType() {
		return "ternary";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("predicate", predicate);
		v.child("consequent", consequent);
		v.child("alternative", alternative);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.group()) {
			formatter.visit(predicate);
			formatter.text(" ?");
			try (Formatter.Scope ignored1 = formatter.indent()) {
				formatter.breakable();
				formatter.visit(consequent);
				formatter.text(" :");
				formatter.breakable();
				formatter.visit(alternative);
			}
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Ternary ternary = (Ternary) o;
		return Objects.equals(predicate, ternary.predicate) &&
				Objects.equals(consequent, ternary.consequent) &&
				Objects.equals(alternative, ternary.alternative);
	}

	@Override
	public int hashCode() {
		return Objects.hash(predicate, consequent, alternative);
	}
}
