package stree.handlers;

import stree.STree;
import stree.doc.Document;
import stree.formatter.FormatterConfig;
import stree.model.Node;

import java.nio.file.Path;

public class RubyHandler implements LanguageHandler {

	@Override
	public String getName() {
		return "ruby";
	}

	@Override
	public Node parse(Path file, CharSequence source) {
		return STree.parse(file, source);
	}

	@Override
	public Document document(Node tree, CharSequence source, FormatterConfig config) {
		return STree.document(tree, source, config);
	}

	@Override
	public String format(Node tree, CharSequence source, FormatterConfig config) {
		return STree.format(tree, source, config);
	}
}
