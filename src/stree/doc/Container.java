package stree.doc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 
 * A document holding an ordered sequence of child documents.
 *
 */
public abstract class Container extends Document {
	private final List<Document> children;

	protected Container(List<Document> children, boolean forcesBreak) {
		super(sumWidths(children), forcesBreak || anyForced(children));
		checkDistinct(children);
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	public List<Document> getChildren() {
		return children;
	}

	protected List<Document> copyChildren() {
		return children.stream().map(Document::copy).collect(Collectors.toList());
	}

	// best effort, a child shared with another container is not caught here
	private static void checkDistinct(List<Document> children) {
		Set<Document> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		for (Document child : children) {
			if (!seen.add(child)) {
				throw new MalformedDocumentException("the same " + child.getClass().getSimpleName() +
						" appears twice in one container");
			}
		}
	}

	private static int sumWidths(List<Document> children) {
		int width = 0;
		for (Document child : children) {
			width = addWidths(width, child.getFlatWidth());
		}
		return width;
	}

	private static boolean anyForced(List<Document> children) {
		for (Document child : children) {
			if (child.containsForcedBreak()) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Container container = (Container) o;
		return children.equals(container.children);
	}

	@Override
	public int hashCode() {
		return children.hashCode();
	}
}
