package stree.doc;

import java.util.Arrays;
import java.util.List;

/**
 * Factories for building documents directly, without a {@link stree.formatter.Formatter}.
 */
public class Docs {
	private Docs() {}

	public static Text text(String value) {
		return new Text(value);
	}

	public static Breakable breakable(String separator) {
		return new Breakable(separator, 0);
	}

	public static Breakable breakable(String separator, int indentDelta) {
		return new Breakable(separator, indentDelta);
	}

	/**
	 * @return a breakable that is a single space when flat
	 */
	public static Breakable line() {
		return breakable(" ");
	}

	/**
	 * @return a breakable that is empty when flat
	 */
	public static Breakable softline() {
		return breakable("");
	}

	public static Group group(Document... children) {
		return new Group(BreakMode.AUTO, Arrays.asList(children));
	}

	public static Group group(List<Document> children) {
		return new Group(BreakMode.AUTO, children);
	}

	public static Group forced(Document... children) {
		return new Group(BreakMode.FORCED, Arrays.asList(children));
	}

	public static Group forced(List<Document> children) {
		return new Group(BreakMode.FORCED, children);
	}

	/**
	 * @return an empty forced group; any group containing it breaks
	 */
	public static Group breakParent() {
		return forced();
	}

	public static Indent indent(int delta, Document... children) {
		return new Indent(delta, Arrays.asList(children));
	}

	public static Align align(int width, Document... children) {
		return new Align(width, Arrays.asList(children));
	}

	public static Align align(String prefix, Document... children) {
		return new Align(prefix, Arrays.asList(children));
	}

	public static IfBreak ifBreak(Document flat, Document broken) {
		return new IfBreak(flat, broken);
	}

	public static Concat concat(Document... children) {
		return new Concat(Arrays.asList(children));
	}

	public static Concat concat(List<Document> children) {
		return new Concat(children);
	}

	public static Concat empty() {
		return concat();
	}
}
