package stree.doc;

import stree.dump.StructureDumper;

/**
 * 
 * The base class of every layout document node. Documents are immutable trees:
 * a node is owned by exactly one parent, and its flat width and whether it holds
 * a forced group are computed once, bottom-up, when it is constructed.
 *
 */
public abstract class Document {
	private final int flatWidth;
	private final boolean forcesBreak;

	protected Document(int flatWidth, boolean forcesBreak) {
		this.flatWidth = flatWidth;
		this.forcesBreak = forcesBreak;
	}

	/**
	 * @return the number of columns this document occupies when rendered without any breaks
	 */
	public int getFlatWidth() {
		return flatWidth;
	}

	/**
	 * @return true if this document is, or contains, a group in {@link BreakMode#FORCED} mode
	 */
	public boolean containsForcedBreak() {
		return forcesBreak;
	}

	/**
	 * @return a structurally equal document sharing no nodes with this one
	 */
	public abstract Document copy();

	public abstract <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return StructureDumper.dump(this, 80);
	}

	static int addWidths(int a, int b) {
		long sum = (long) a + b;
		return sum > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
	}
}
