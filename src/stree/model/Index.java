package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * receiver[index, ...]
 *
 */
public class Index extends Node {
	private final Node receiver;
	private final List<Node> indexes;

	public Index(SourceLocation location, Node receiver, List<Node> indexes) {
		super(location);
		this.receiver = receiver;
		this.indexes = Collections.unmodifiableList(indexes);
	}

	public Node getReceiver() {
		return receiver;
	}

	public List<Node> getIndexes() {
		return indexes;
	}

	@Override
	public String getType() {
		return "index";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("receiver", receiver);
		v.children("indexes", indexes);
	}

	@Override
	public void format(Formatter formatter) {
		formatter.visit(receiver);
		Delimited.bracketed(formatter, "[", "]", indexes, false, getLocation().getEndOffset() - 1, false);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Index index = (Index) o;
		return Objects.equals(receiver, index.receiver) &&
				Objects.equals(indexes, index.indexes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(receiver, indexes);
	}
}
