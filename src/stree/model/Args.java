package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * A parenthesised argument list: (a, *b, c: 1, &d)
 *
 */
public class Args extends Node {
	private final List<Node> arguments;

	public Args(SourceLocation location, List<Node> arguments) {
		super(location);
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public List<Node> getArguments() {
		return arguments;
	}

	@Override
	public String getType() {
		return "args";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.children("arguments", arguments);
	}

	@Override
	public void format(Formatter formatter) {
		// a block argument must come last
		boolean trailingComma = arguments.isEmpty() ||
				!(arguments.get(arguments.size() - 1) instanceof Splat &&
						((Splat) arguments.get(arguments.size() - 1)).getOperator().equals("&"));
		Delimited.bracketed(formatter, "(", ")", arguments, false, getLocation().getEndOffset() - 1,
				trailingComma);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(arguments, ((Args) o).arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(arguments);
	}
}
