package stree.layout;

import stree.doc.Align;
import stree.doc.BreakMode;
import stree.doc.Breakable;
import stree.doc.Concat;
import stree.doc.Document;
import stree.doc.DocumentVisitor;
import stree.doc.Group;
import stree.doc.IfBreak;
import stree.doc.Indent;
import stree.doc.Text;

import java.io.IOException;

/**
 * 
 * Renders a document in the layout mode decided by its nearest enclosing group. A group
 * reached in broken mode (or at the root) makes its own decision and continues with a new
 * visitor in the chosen mode; a group reached in flat mode is known to fit already.
 *
 */
class RenderingVisitor extends DocumentVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final int maxWidth;
	private final LayoutMode mode;

	RenderingVisitor(IndentingWriter out, int maxWidth, LayoutMode mode) {
		this.out = out;
		this.maxWidth = maxWidth;
		this.mode = mode;
	}

	private void renderChildren(Iterable<Document> children, DocumentVisitor<Void, IOException> visitor)
			throws IOException {
		for (Document child : children) {
			child.accept(visitor);
		}
	}

	boolean fits(Group group) {
		if (group.getMode() == BreakMode.FORCED || group.containsForcedBreak()) {
			return false;
		}
		// a group exactly as wide as the remaining space fits
		return (long) out.getColumn() + group.getFlatWidth() <= maxWidth;
	}

	@Override
	public Void visit(Text text) throws IOException {
		out.write(text.getValue());
		return null;
	}

	@Override
	public Void visit(Breakable breakable) throws IOException {
		if (mode == LayoutMode.FLAT) {
			out.write(breakable.getSeparator());
		} else {
			out.newLine(breakable.getIndentDelta());
		}
		return null;
	}

	@Override
	public Void visit(Group group) throws IOException {
		if (mode == LayoutMode.FLAT) {
			renderChildren(group.getChildren(), this);
			return null;
		}
		LayoutMode chosen = fits(group) ? LayoutMode.FLAT : LayoutMode.BROKEN;
		renderChildren(group.getChildren(), new RenderingVisitor(out, maxWidth, chosen));
		return null;
	}

	@Override
	public Void visit(Indent indent) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent(indent.getDelta())) {
			renderChildren(indent.getChildren(), this);
		}
		return null;
	}

	@Override
	public Void visit(Align align) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent(align.getPrefix())) {
			renderChildren(align.getChildren(), this);
		}
		return null;
	}

	@Override
	public Void visit(IfBreak ifBreak) throws IOException {
		if (mode == LayoutMode.FLAT) {
			ifBreak.getFlat().accept(this);
		} else {
			ifBreak.getBroken().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(Concat concat) throws IOException {
		renderChildren(concat.getChildren(), this);
		return null;
	}
}
