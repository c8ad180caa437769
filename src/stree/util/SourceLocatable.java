package stree.util;

/**
 * 
 * A common abstract base, typically meant for syntax tree nodes and tokens, for anything
 * that needs to be traced back to its original location.
 *
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
