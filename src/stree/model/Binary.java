package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * left operator right. A line that is too long breaks after the operator.
 *
 */
public class Binary extends Node {
	private final Node left;
	private final String operator;
	private final Node right;

	public Binary(SourceLocation location, Node left, String operator, Node right) {
		super(location);
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Node getLeft() {
		return left;
	}

	public String getOperator() {
		return operator;
	}

	public Node getRight() {
		return right;
	}

	@Override
	public String getType() {
		return "binary";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("left", left);
		v.field("operator", operator);
		v.child("right", right);
	}

	@Override
	public void format(Formatter formatter) {
		if (operator.equals("..") || operator.equals("...")) {
			formatter.visit(left);
			formatter.text(operator);
			formatter.visit(right);
			return;
		}
		try (Formatter.Scope ignored = formatter.group()) {
			formatter.visit(left);
			formatter.text(" " + operator);
			try (Formatter.Scope ignored1 = formatter.indent()) {
				formatter.breakable();
				formatter.visit(right);
			}
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Binary binary = (Binary) o;
		return Objects.equals(left, binary.left) &&
				Objects.equals(operator, binary.operator) &&
				Objects.equals(right, binary.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, operator, right);
	}
}
