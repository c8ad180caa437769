package stree.formatter;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import stree.STree;

public class FormatterConfigTest {

	@Test
	public void defaults() {
		FormatterConfig config = FormatterConfig.defaults();
		assertThat(config.getPrintWidth(), is(80));
		assertThat(config.getIndentWidth(), is(2));
		assertThat(config.getMaxBlankLines(), is(1));
		assertFalse(config.isTrailingComma());
		assertFalse(config.isPreferSingleQuotes());
		assertThat(config.getCommentPolicy(), is(CommentPolicy.PRESERVE));
	}

	@Test
	public void toBuilderKeepsSettings() {
		FormatterConfig config = FormatterConfig.builder().printWidth(100).trailingComma(true).build();
		assertEquals(config, config.toBuilder().build());
		assertThat(config.toBuilder().indentWidth(4).build().getPrintWidth(), is(100));
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsZeroWidth() {
		FormatterConfig.builder().printWidth(0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsNegativeBlankLines() {
		FormatterConfig.builder().maxBlankLines(-1);
	}

	@Test
	public void indentWidth() {
		FormatterConfig config = FormatterConfig.builder().indentWidth(4).build();
		assertThat(STree.format("def foo\nbar\nend", config), is("def foo\n    bar\nend\n"));
	}

	@Test
	public void maxBlankLines() {
		FormatterConfig two = FormatterConfig.builder().maxBlankLines(2).build();
		assertThat(STree.format("a\n\n\n\n\nb", two), is("a\n\n\nb\n"));
		FormatterConfig none = FormatterConfig.builder().maxBlankLines(0).build();
		assertThat(STree.format("a\n\n\nb", none), is("a\nb\n"));
	}

	@Test
	public void trailingCommaWhenBroken() {
		FormatterConfig config = FormatterConfig.builder().printWidth(20).trailingComma(true).build();
		assertThat(STree.format("foo(aaaaaaaaaa, bbbbbbbbbb)", config),
				is("foo(\n  aaaaaaaaaa,\n  bbbbbbbbbb,\n)\n"));
		assertThat(STree.format("foo(a, b)", config), is("foo(a, b)\n"));
	}

	@Test
	public void trailingCommaOnlyInBrokenCollections() {
		FormatterConfig config = FormatterConfig.builder().printWidth(20).trailingComma(true).build();
		assertThat(STree.format("x = [aaaaaaaaaa, bbbbbbbbbb]", config),
				is("x = [\n  aaaaaaaaaa,\n  bbbbbbbbbb,\n]\n"));
		assertThat(STree.format("x = [a, b]", config), is("x = [a, b]\n"));
		assertThat(STree.format("h = { a: 1 }", config), is("h = { a: 1 }\n"));
		assertThat(STree.format("h = { aaaaaaaaaa: 1, bbbbbbbbbb: 2 }", config),
				is("h = {\n  aaaaaaaaaa: 1,\n  bbbbbbbbbb: 2,\n}\n"));
	}

	@Test
	public void noTrailingCommaAfterBlockArgument() {
		FormatterConfig config = FormatterConfig.builder().printWidth(20).trailingComma(true).build();
		assertThat(STree.format("foo(aaaaaaaaaa, &bbbbbbbbbb)", config),
				is("foo(\n  aaaaaaaaaa,\n  &bbbbbbbbbb\n)\n"));
	}

	@Test
	public void singleQuotes() {
		FormatterConfig config = FormatterConfig.builder().preferSingleQuotes(true).build();
		assertThat(STree.format("puts \"hi\"", config), is("puts 'hi'\n"));
		assertThat(STree.format("puts \"it's\"", config), is("puts \"it's\"\n"));
		assertThat(STree.format("puts \"#{x}\"", config), is("puts \"#{x}\"\n"));
	}

	@Test
	public void collapseBlankLineAfterComment() {
		String source = "a\n\n# note\n\nb";
		assertThat(STree.format(source), is("a\n\n# note\n\nb\n"));
		FormatterConfig collapse = FormatterConfig.builder().commentPolicy(CommentPolicy.COLLAPSE).build();
		assertThat(STree.format(source, collapse), is("a\n\n# note\nb\n"));
	}

	@Test
	public void collapseBlankLineAfterCommentAtStartOfBody() {
		FormatterConfig collapse = FormatterConfig.builder().commentPolicy(CommentPolicy.COLLAPSE).build();
		assertThat(STree.format("# header\n\nx", collapse), is("# header\nx\n"));
		assertThat(STree.format("def foo\n  # a\n\n  x\nend", collapse), is("def foo\n  # a\n  x\nend\n"));
	}
}
