package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * A block passed to a call. Braces when it fits on the line, do and end otherwise:
 * 
 * { |x| x + 1 }
 * 
 * do |x|
 *   x + 1
 * end
 *
 */
public class Block extends Node {
	private final List<Param> params;
	private final Statements body;

	public Block(SourceLocation location, List<Param> params, Statements body) {
		super(location);
		this.params = Collections.unmodifiableList(params);
		this.body = body;
	}

	public List<Param> getParams() {
		return params;
	}

	public Statements getBody() {
		return body;
	}

	@Override
	public String getType() {
		return "block";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.children("params", params);
		v.child("body", body);
	}

	@Override
	public void format(Formatter formatter) {
		format(formatter, false);
	}

	/**
	 * @param forceDo whether to always use do and end, which keeps a block after unparenthesised
	 * arguments with its command
	 */
	void format(Formatter formatter, boolean forceDo) {
		formatter.text(" ");
		try (Formatter.Scope ignored = formatter.group()) {
			if (forceDo) {
				formatter.breakParent();
			}
			formatter.ifBreak("{", "do");
			if (!params.isEmpty()) {
				formatter.text(" |");
				formatter.seplist(params, () -> formatter.text(", "));
				formatter.text("|");
			}
			formatter.markLine(getLocation().getStartLine());
			int end = body.getLocation().getEndOffset();
			formatter.trailingComments(end);
			if (!body.isEmpty() || formatter.hasCommentsBefore(end)) {
				try (Formatter.Scope ignored1 = formatter.indent()) {
					formatter.breakable();
					formatter.visit(body);
				}
			}
			formatter.breakable();
			formatter.ifBreak("}", "end");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Block block = (Block) o;
		return Objects.equals(params, block.params) &&
				Objects.equals(body, block.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(params, body);
	}
}
