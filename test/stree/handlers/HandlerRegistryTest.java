package stree.handlers;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import stree.doc.Document;
import stree.doc.Docs;
import stree.formatter.FormatterConfig;
import stree.model.Node;
import stree.model.NodeBuilder;
import stree.model.StringLiteral;

public class HandlerRegistryTest {

	private static class UpperCaseHandler implements LanguageHandler {
		@Override
		public String getName() {
			return "shout";
		}

		@Override
		public Node parse(Path file, CharSequence source) {
			return NodeBuilder.str("\"" + source.toString().toUpperCase() + "\"");
		}

		@Override
		public Document document(Node tree, CharSequence source, FormatterConfig config) {
			return Docs.text(((StringLiteral) tree).getValue());
		}
	}

	@Test
	public void defaultsHandleRubyFiles() {
		HandlerRegistry registry = HandlerRegistry.withDefaults();
		assertThat(registry.forFile(Paths.get("a.rb")).getName(), is("ruby"));
		assertThat(registry.forFile(Paths.get("Rakefile.rake")).getName(), is("ruby"));
		assertThat(registry.forFile(Paths.get("x.GEMSPEC")).getName(), is("ruby"));
	}

	@Test
	public void unknownExtensionsFallBack() {
		HandlerRegistry registry = HandlerRegistry.withDefaults();
		assertSame(registry.getFallback(), registry.forFile(Paths.get("notes.txt")));
		assertSame(registry.getFallback(), registry.forFile(Paths.get("Gemfile")));
		assertSame(registry.getFallback(), registry.forFile(Paths.get(".rubocop")));
		assertSame(registry.getFallback(), registry.forFile(null));
	}

	@Test
	public void registeredHandlerWins() {
		HandlerRegistry registry = HandlerRegistry.withDefaults();
		UpperCaseHandler shout = new UpperCaseHandler();
		registry.register("SHOUT", shout);
		assertSame(shout, registry.forFile(Paths.get("dir", "x.shout")));

		Node tree = shout.parse(null, "hi");
		assertThat(shout.format(tree, "hi", FormatterConfig.defaults()), is("\"HI\""));
	}

	@Test
	public void rubyHandlerFormats() {
		LanguageHandler ruby = new RubyHandler();
		String source = "foo( 1 )";
		Node tree = ruby.parse(Paths.get("a.rb"), source);
		assertThat(ruby.format(tree, source, FormatterConfig.defaults()), is("foo(1)\n"));
	}
}
