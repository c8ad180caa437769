package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * return, return value
 *
 */
public class Return extends Node {
	private final Node value;

	public Return(SourceLocation location, Node value) {
		super(location);
		this.value = value;
	}

	public Node getValue() {
		return value;
	}

	@Override
	public String getType() {
		return "return";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("value", value);
	}

	@Override
	public void format(Formatter formatter) {
		formatter.text("return");
		if (value != null) {
			formatter.text(" ");
			formatter.visit(value);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(value, ((Return) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
