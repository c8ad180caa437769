package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * [a, b, c]
 *
 */
public class ArrayLiteral extends Node {
	private final List<Node> elements;

	public ArrayLiteral(SourceLocation location, List<Node> elements) {
		super(location);
		this.elements = Collections.unmodifiableList(elements);
	}

	public List<Node> getElements() {
		return elements;
	}

	@Override
	public String getType() {
		return "array";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.children("elements", elements);
	}

	@Override
	public void format(Formatter formatter) {
		Delimited.bracketed(formatter, "[", "]", elements, false, getLocation().getEndOffset() - 1, true);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(elements, ((ArrayLiteral) o).elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}
}
