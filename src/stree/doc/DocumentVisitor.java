package stree.doc;

public abstract class DocumentVisitor<T, E extends Throwable> {
	public abstract T visit(Text text) throws E;
	public abstract T visit(Breakable breakable) throws E;
	public abstract T visit(Group group) throws E;
	public abstract T visit(Indent indent) throws E;
	public abstract T visit(Align align) throws E;
	public abstract T visit(IfBreak ifBreak) throws E;
	public abstract T visit(Concat concat) throws E;
}
