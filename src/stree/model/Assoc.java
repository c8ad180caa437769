package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A hash entry or keyword argument: label: value, or key => value
 *
 */
public class Assoc extends Node {
	private final Node key;
	private final Node value;

	public Assoc(SourceLocation location, Node key, Node value) {
		super(location);
		this.key = key;
		this.value = value;
	}

	/**
	 * @return a {@link LabelLiteral}, or any expression for the => form
	 */
	public Node getKey() {
		return key;
	}

	public Node getValue() {
		return value;
	}

	@Override
	public String getType() {
		return "assoc";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("key", key);
		v.child("value", value);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.group()) {
			formatter.visit(key);
			if (!(key instanceof LabelLiteral)) {
				formatter.text(" =>");
			}
			if (Assign.hugsOperator(value)) {
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
		Assoc assoc = (Assoc) o;
		return Objects.equals(key, assoc.key) &&
				Objects.equals(value, assoc.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value);
	}
}
