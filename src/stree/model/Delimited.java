package stree.model;

import stree.formatter.Formatter;

import java.util.List;

/**
 * Lowering shared by the bracketed lists: argument lists, arrays, hashes and index brackets.
 * Items that do not fit on the line go one per line, indented, with the closing bracket on its
 * own line.
 */
class Delimited {
	private Delimited() {}

	/**
	 * @param padded whether the flat form has spaces inside the brackets, as in { a: 1 }
	 * @param closeOffset the source offset of the closing bracket
	 * @param trailingComma whether a trailing comma may follow the last item when broken
	 */
	static void bracketed(Formatter formatter, String open, String close, List<? extends Node> items,
						  boolean padded, int closeOffset, boolean trailingComma) {
		if (items.isEmpty() && !formatter.hasCommentsBefore(closeOffset)) {
			formatter.text(open + close);
			return;
		}
		String inside = padded ? " " : "";
		try (Formatter.Scope ignored = formatter.group()) {
			formatter.text(open);
			try (Formatter.Scope ignored1 = formatter.indent()) {
				formatter.breakable(inside);
				formatter.seplist(items, () -> {
					formatter.text(",");
					formatter.breakable();
				});
				if (trailingComma && !items.isEmpty() && formatter.getConfig().isTrailingComma()) {
					formatter.ifBreak("", ",");
				}
				formatter.trailingComments(closeOffset);
				formatter.danglingComments(closeOffset, items.isEmpty());
			}
			formatter.breakable(inside);
			formatter.text(close);
		}
	}
}
