package stree.errors;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileProcessingFile whileProcessingFile) throws E;

}
