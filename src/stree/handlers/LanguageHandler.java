package stree.handlers;

import stree.doc.Document;
import stree.formatter.FormatterConfig;
import stree.layout.Renderer;
import stree.model.Node;

import java.nio.file.Path;

/**
 * Parses and lowers the source files of one language.
 */
public interface LanguageHandler {

	/**
	 * @return the language name used in messages
	 */
	String getName();

	/**
	 * @param file where the source was read from, or null
	 */
	Node parse(Path file, CharSequence source);

	/**
	 * Lowers {@code tree}, parsed from {@code source}, to its layout document.
	 */
	Document document(Node tree, CharSequence source, FormatterConfig config);

	default String format(Node tree, CharSequence source, FormatterConfig config) {
		return new Renderer(config.getPrintWidth()).render(document(tree, source, config));
	}
}
