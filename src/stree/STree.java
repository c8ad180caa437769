package stree;

import stree.doc.Document;
import stree.formatter.Formatter;
import stree.formatter.FormatterConfig;
import stree.formatter.TreeWalker;
import stree.model.Comment;
import stree.model.Node;
import stree.model.Program;
import stree.parser.Parser;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Entry points for parsing and formatting source text.
 */
public class STree {
	private STree() {}

	public static Program parse(CharSequence source) {
		return parse(null, source);
	}

	/**
	 * @param file the file the source was read from, recorded in source locations; may be null
	 * @throws stree.lexer.LexerException if the source cannot be tokenized
	 * @throws stree.parser.ParseException if the source cannot be parsed
	 */
	public static Program parse(Path file, CharSequence source) {
		return Parser.parse(file, source);
	}

	public static String format(CharSequence source) {
		return format(source, FormatterConfig.defaults());
	}

	public static String format(CharSequence source, FormatterConfig config) {
		return format(parse(source), source, config);
	}

	/**
	 * Formats {@code tree} at {@code maxWidth} columns with otherwise default settings.
	 *
	 * @throws stree.formatter.NonTreeInputException if {@code tree} is cyclic or shares nodes
	 */
	public static String format(Node tree, int maxWidth) {
		return format(tree, "", FormatterConfig.defaults().toBuilder().printWidth(maxWidth).build());
	}

	/**
	 * @throws stree.formatter.NonTreeInputException if {@code tree} is cyclic or shares nodes
	 * @throws stree.doc.MalformedDocumentException if lowering a node breaks the document's nesting rules
	 */
	public static String format(Node tree, CharSequence source, FormatterConfig config) {
		Formatter formatter = new Formatter(source, commentsOf(tree), config);
		return new TreeWalker(formatter).walk(tree);
	}

	/**
	 * @return the layout document {@code tree} lowers to, before rendering
	 */
	public static Document document(Node tree, CharSequence source, FormatterConfig config) {
		Formatter formatter = new Formatter(source, commentsOf(tree), config);
		return new TreeWalker(formatter).lower(tree);
	}

	private static List<Comment> commentsOf(Node tree) {
		if (tree instanceof Program) {
			return ((Program) tree).getComments();
		}
		return Collections.emptyList();
	}
}
