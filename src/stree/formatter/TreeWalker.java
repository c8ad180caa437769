package stree.formatter;

import stree.doc.Document;
import stree.model.Node;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 *
 * Walks a syntax tree in source order, lowering each node into the document of a
 * {@link Formatter}. The walker knows nothing about node kinds: each node lowers itself
 * through {@link Formattable#format(Formatter)} and visits its own children back through
 * the formatter. Comments that precede a node are placed before it.
 *
 */
public class TreeWalker {
	private final Formatter formatter;
	private final Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());

	public TreeWalker(Formatter formatter) {
		this.formatter = formatter;
		formatter.attach(this);
	}

	/**
	 * Lowers {@code root} and renders the result.
	 *
	 * @throws NonTreeInputException if {@code root} is not the root of a tree
	 */
	public String walk(Node root) {
		lowerTree(root);
		return formatter.flush();
	}

	/**
	 * Lowers {@code root} and returns the finished document without rendering it.
	 *
	 * @throws NonTreeInputException if {@code root} is not the root of a tree
	 */
	public Document lower(Node root) {
		lowerTree(root);
		return formatter.finish();
	}

	private void lowerTree(Node root) {
		checkTree(root);
		visit(root);
		if (formatter.hasCommentsBefore(Integer.MAX_VALUE)) {
			try (Formatter.Scope ignored = formatter.forcedGroup()) {
				formatter.danglingComments(Integer.MAX_VALUE, formatter.isEmpty());
			}
		}
	}

	void visit(Node node) {
		visit(node, () -> node.format(formatter));
	}

	void visit(Node node, Runnable lowering) {
		if (!visited.add(node)) {
			throw new IllegalStateException("node " + node.getType() + " at " + node.getLocation() +
					" was lowered twice");
		}
		formatter.leadingComments(node.getLocation(), false);
		lowering.run();
		formatter.markLine(node.getLocation().getEndLine());
	}

	/**
	 * Checks that every node reachable from {@code root} is reached along exactly one path.
	 */
	public static void checkTree(Node root) {
		Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		Deque<Node> toVisit = new ArrayDeque<>();
		toVisit.push(root);
		seen.add(root);
		while (!toVisit.isEmpty()) {
			Node node = toVisit.pop();
			for (Node child : node.getChildren()) {
				if (child == root) {
					throw new NonTreeInputException("cycle through the root " + root.getType() + " at " +
							root.getLocation());
				}
				if (!seen.add(child)) {
					throw new NonTreeInputException("node " + child.getType() + " at " + child.getLocation() +
							" is reachable through more than one parent");
				}
				toVisit.push(child);
			}
		}
	}
}
