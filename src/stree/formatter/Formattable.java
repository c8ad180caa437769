package stree.formatter;

/**
 * Something that knows how to lower itself into layout document fragments.
 */
public interface Formattable {

	/**
	 * Pushes this node's document fragments into {@code formatter}. Children are lowered by
	 * passing them to {@link Formatter#visit(stree.model.Node)}, never by calling their
	 * {@code format} method directly.
	 */
	void format(Formatter formatter);

}
