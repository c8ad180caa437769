package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * case value
 * when a, b
 *   ...
 * else
 *   ...
 * end
 *
 */
public class Case extends Node {
	private final Node value;
	private final List<When> whens;
	private final Else alternative;

	public Case(SourceLocation location, Node value, List<When> whens, Else alternative) {
		super(location);
		this.value = value;
		this.whens = Collections.unmodifiableList(whens);
		this.alternative = alternative;
	}

	public Node getValue() {
		return value;
	}

	public List<When> getWhens() {
		return whens;
	}

	public Else getAlternative() {
		return alternative;
	}

	@Override
	public String getType() {
		return "case";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("value", value);
		v.children("whens", whens);
		v.child("alternative", alternative);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.forcedGroup()) {
			formatter.text("case");
			if (value != null) {
				formatter.text(" ");
				formatter.visit(value);
			}
			for (When when : whens) {
				formatter.hardline();
				formatter.visit(when);
			}
			if (alternative != null) {
				formatter.hardline();
				formatter.visit(alternative);
			}
			formatter.hardline();
			formatter.text("end");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Case that = (Case) o;
		return Objects.equals(value, that.value) &&
				Objects.equals(whens, that.whens) &&
				Objects.equals(alternative, that.alternative);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, whens, alternative);
	}
}
