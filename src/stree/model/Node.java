package stree.model;

import stree.dump.StructureDumper;
import stree.formatter.Formattable;
import stree.util.SourceLocatable;
import stree.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 
 * The base class of every syntax tree node. A node knows its source range, how to lower
 * itself into a layout document, and how to describe its fields to a {@link FieldVisitor}.
 *
 */
public abstract class Node extends SourceLocatable implements Formattable {
	private final SourceLocation location;

	protected Node(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the name dumps use for this kind of node
	 */
	public abstract String getType();

	public abstract void accept(FieldVisitor v);

	/**
	 * @return the non-null child nodes, in source order
	 */
	public List<Node> getChildren() {
		List<Node> result = new ArrayList<>();
		accept(new FieldVisitor() {
			@Override
			public void field(String name, Object value) {
				// not a child
			}

			@Override
			public void child(String name, Node child) {
				if (child != null) {
					result.add(child);
				}
			}

			@Override
			public void children(String name, List<? extends Node> children) {
				result.addAll(children);
			}
		});
		return result;
	}

	@Override
	public String toString() {
		return StructureDumper.dump(this, 80);
	}
}
