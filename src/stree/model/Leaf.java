package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A node with no children whose source text is a single token.
 *
 */
public abstract class Leaf extends Node {
	private final String value;

	protected Leaf(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public void accept(FieldVisitor v) {
		v.field("value", value);
	}

	@Override
	public void format(Formatter formatter) {
		formatter.text(value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(value, ((Leaf) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), value);
	}
}
