package stree.layout;

import stree.doc.Align;
import stree.doc.Breakable;
import stree.doc.Concat;
import stree.doc.Document;
import stree.doc.DocumentVisitor;
import stree.doc.Group;
import stree.doc.IfBreak;
import stree.doc.Indent;
import stree.doc.MalformedDocumentException;
import stree.doc.Text;

/**
 * Rejects documents that use a breakable or a conditional break outside of every group.
 */
class WellFormednessCheck extends DocumentVisitor<Void, RuntimeException> {

	private final boolean insideGroup;

	WellFormednessCheck(boolean insideGroup) {
		this.insideGroup = insideGroup;
	}

	private void checkChildren(Iterable<Document> children, WellFormednessCheck check) {
		for (Document child : children) {
			child.accept(check);
		}
	}

	@Override
	public Void visit(Text text) {
		return null;
	}

	@Override
	public Void visit(Breakable breakable) {
		if (!insideGroup) {
			throw new MalformedDocumentException("breakable \"" + breakable.getSeparator() + "\" is not inside any group");
		}
		return null;
	}

	@Override
	public Void visit(Group group) {
		checkChildren(group.getChildren(), insideGroup ? this : new WellFormednessCheck(true));
		return null;
	}

	@Override
	public Void visit(Indent indent) {
		checkChildren(indent.getChildren(), this);
		return null;
	}

	@Override
	public Void visit(Align align) {
		checkChildren(align.getChildren(), this);
		return null;
	}

	@Override
	public Void visit(IfBreak ifBreak) {
		if (!insideGroup) {
			throw new MalformedDocumentException("conditional break is not inside any group");
		}
		ifBreak.getFlat().accept(this);
		ifBreak.getBroken().accept(this);
		return null;
	}

	@Override
	public Void visit(Concat concat) {
		checkChildren(concat.getChildren(), this);
		return null;
	}
}
