package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * Parent::Name, or ::Name for a top-level constant
 *
 */
public class ConstPath extends Node {
	private final Node parent;
	private final String name;

	public ConstPath(SourceLocation location, Node parent, String name) {
		super(location);
		this.parent = parent;
		this.name = name;
	}

	/**
	 * @return the scope, or null for a top-level constant
	 */
	public Node getParent() {
		return parent;
	}

	public String getName() {
		return name;
	}

	@Override
	public String getType() {
		return "const_path";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("parent", parent);
		v.field("name", name);
	}

	@Override
	public void format(Formatter formatter) {
		if (parent != null) {
			formatter.visit(parent);
		}
		formatter.text("::" + name);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ConstPath constPath = (ConstPath) o;
		return Objects.equals(parent, constPath.parent) &&
				Objects.equals(name, constPath.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parent, name);
	}
}
