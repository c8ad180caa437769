package stree.model;

import stree.util.SourceLocatable;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A source comment. Comments are not part of the syntax tree: the parser returns them
 * separately, ordered by position, and the formatter places them between nodes.
 *
 */
public class Comment extends SourceLocatable {
	private final SourceLocation location;
	private final String value;
	private final boolean inline;

	public Comment(SourceLocation location, String value, boolean inline) {
		this.location = location;
		this.value = value;
		this.inline = inline;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the comment text, leading '#' included, trailing whitespace removed
	 */
	public String getValue() {
		return value;
	}

	/**
	 * @return true if code precedes this comment on its line
	 */
	public boolean isInline() {
		return inline;
	}

	@Override
	public String toString() {
		return value + " at " + location;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Comment comment = (Comment) o;
		return inline == comment.inline &&
				Objects.equals(location, comment.location) &&
				Objects.equals(value, comment.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(location, value, inline);
	}
}
