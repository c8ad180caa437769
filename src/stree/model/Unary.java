package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * !operand, -operand, not operand
 *
 */
public class Unary extends Node {
	private final String operator;
	private final Node operand;

	public Unary(SourceLocation location, String operator, Node operand) {
		super(location);
		this.operator = operator;
		this.operand = operand;
	}

	public String getOperator() {
		return operator;
	}

	public Node getOperand() {
		return operand;
	}

	@Override
	public String getType() {
		return "unary";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.field("operator", operator);
		v.child("operand", operand);
	}

	@Override
	public void format(Formatter formatter) {
		formatter.text(operator.equals("not") ? "not " : operator);
		formatter.visit(operand);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Unary unary = (Unary) o;
		return Objects.equals(operator, unary.operator) &&
				Objects.equals(operand, unary.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operand);
	}
}
