package stree.model;

import java.util.List;

/**
 * Receives the named fields of a node, in source order.
 */
public interface FieldVisitor {

	/**
	 * @param value a String, Number, Boolean, enum constant or null
	 */
	void field(String name, Object value);

	/**
	 * @param child may be null when the node has no such part
	 */
	void child(String name, Node child);

	void children(String name, List<? extends Node> children);

}
