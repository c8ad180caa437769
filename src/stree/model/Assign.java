package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * target = value, and the operator assignments target += value, target ||= value, ...
 *
 */
public class Assign extends Node {
	private final Node target;
	private final String operator;
	private final Node value;

	public Assign(SourceLocation location, Node target, String operator, Node value) {
		super(location);
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public Node getTarget() {
		return target;
	}

	public String getOperator() {
		return operator;
	}

	public Node getValue() {
		return value;
	}

	@Override
	public String getType() {
		return operator.equals("=") ? "assign" : "opassign";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("target", target);
		v.field("operator", operator);
		v.child("value", value);
	}

	/**
	 * Values that open a bracket or a block on the first line break inside it rather than
	 * after the operator.
	 */
	static boolean hugsOperator(Node value) {
		return value instanceof ArrayLiteral || value instanceof HashLiteral || value instanceof If ||
				value instanceof Case || value instanceof While || value instanceof Call ||
				value instanceof Command && ((Command) value).getBlock() != null;
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.group()) {
			formatter.visit(target);
			formatter.text(" " + operator);
			if (hugsOperator(value)) {
				formatter.text(" ");
				formatter.visit(value);
			} else {
				try (Formatter.Scope ignored1 = formatter.indent()) {
					formatter.breakable();
					formatter.visit(value);
				}
			}
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Assign assign = (Assign) o;
		return Objects.equals(target, assign.target) &&
				Objects.equals(operator, assign.operator) &&
				Objects.equals(value, assign.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, operator, value);
	}
}
