package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * { key: value, "key" => value, **rest }
 *
 */
public class HashLiteral extends Node {
	private final List<Node> entries;

	public HashLiteral(SourceLocation location, List<Node> entries) {
		super(location);
		this.entries = Collections.unmodifiableList(entries);
	}

	/**
	 * @return {@link Assoc} and double splat {@link Splat} entries
	 */
	public List<Node> getEntries() {
		return entries;
	}

	@Override
	public String getType() {
		return "hash";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.children("entries", entries);
	}

	@Override
	public void format(Formatter formatter) {
		Delimited.bracketed(formatter, "{", "}", entries, true, getLocation().getEndOffset() - 1, true);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(entries, ((HashLiteral) o).entries);
	}

	@Override
	public int hashCode() {
		return Objects.hash(entries);
	}
}
