package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * *value, **value, &value
 *
 */
public class Splat extends Node {
	private final String operator;
	private final Node value;

	public Splat(SourceLocation location, String operator, Node value) {
		super(location);
		this.operator = operator;
		this.value = value;
	}

	public String getOperator() {
		return operator;
	}

	public Node getValue() {
		return value;
	}

	@Override
	public String getType() {
		return "splat";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.field("operator", operator);
		v.child("value", value);
	}

	@Override
	public void format(Formatter formatter) {
		formatter.text(operator);
		formatter.visit(value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Splat splat = (Splat) o;
		return Objects.equals(operator, splat.operator) &&
				Objects.equals(value, splat.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, value);
	}
}
