package stree;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import stree.handlers.HandlerRegistry;

public class STreeMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
	private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

	private int run(String stdin, String... args) {
		return run(stdin.getBytes(StandardCharsets.UTF_8), args);
	}

	private int run(byte[] stdin, String... args) {
		ByteArrayInputStream in = new ByteArrayInputStream(stdin);
		PrintStream out = new PrintStream(outBytes, true);
		PrintStream err = new PrintStream(errBytes, true);
		return new STreeMain(args, in, out, err, HandlerRegistry.withDefaults()).run();
	}

	private String out() {
		return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private File rubyFile(String name, String contents) throws IOException {
		File file = folder.newFile(name);
		FileUtils.writeStringToFile(file, contents, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void formatsStandardInput() {
		assertThat(run("foo( 1,2 )\n", "format"), is(0));
		assertThat(out(), is("foo(1, 2)\n"));
	}

	@Test
	public void skipsByteOrderMarkOnStandardInput() {
		byte[] source = "\uFEFFx=1\n".getBytes(StandardCharsets.UTF_8);
		assertThat(run(source, "format"), is(0));
		assertThat(out(), is("x = 1\n"));
	}

	@Test
	public void formatsNamedFiles() throws IOException {
		File file = rubyFile("a.rb", "x=1\n");
		assertThat(run("", "format", file.getPath()), is(0));
		assertThat(out(), is("x = 1\n"));
	}

	@Test
	public void widthOptionReachesFormatter() {
		assertThat(run("foo(bar, baz)\n", "-w", "5", "format"), is(0));
		assertThat(out(), is("foo(\n  bar,\n  baz\n)\n"));
	}

	@Test
	public void writeRewritesUnformattedFiles() throws IOException {
		File file = rubyFile("a.rb", "x=1\n");
		assertThat(run("", "-q", "write", file.getPath()), is(0));
		assertThat(FileUtils.readFileToString(file, StandardCharsets.UTF_8), is("x = 1\n"));
		assertThat(out(), is(""));
	}

	@Test
	public void checkReportsUnformattedFiles() throws IOException {
		File formatted = rubyFile("good.rb", "x = 1\n");
		File unformatted = rubyFile("bad.rb", "x=1\n");
		assertThat(run("", "check", formatted.getPath()), is(0));
		assertThat(run("", "check", formatted.getPath(), unformatted.getPath()), is(1));
		assertThat(err(), containsString("Detected 1 issue(s):"));
		assertThat(err(), containsString("file is not formatted: " + unformatted.getPath()));
		assertThat(FileUtils.readFileToString(unformatted, StandardCharsets.UTF_8), is("x=1\n"));
	}

	@Test
	public void debugChecksIdempotence() throws IOException {
		File file = rubyFile("a.rb", "def foo(a,b)\n  a+b\nend\n");
		assertThat(run("", "-q", "debug", file.getPath()), is(0));
		assertThat(err(), is(""));
	}

	@Test
	public void dumpsTree() {
		assertThat(run("foo(1)\n", "ast"), is(0));
		assertThat(out(), is("(program (statements [(call \"foo\" (args [(number \"1\")]))]))\n"));
	}

	@Test
	public void dumpsDocument() {
		assertThat(run("foo(1)\n", "doc"), is(0));
		assertThat(out(), containsString("(text "));
	}

	@Test
	public void dumpsJson() {
		assertThat(run("foo(1)\n", "json"), is(0));
		assertThat(new JSONObject(out()).getString("type"), is("program"));
	}

	@Test
	public void reportsParseErrors() {
		assertThat(run("foo(1, 2\n", "format"), is(1));
		assertThat(err(), containsString("error parsing ruby: "));
		assertThat(out(), is(""));
	}

	@Test
	public void reportsMissingFiles() {
		File missing = new File(folder.getRoot(), "missing.rb");
		assertThat(run("", "format", missing.getPath()), is(1));
		assertThat(err(), containsString("while processing " + missing.getPath()));
		assertThat(err(), containsString("IO Error: "));
	}

	@Test
	public void keepsGoingAfterAFailingFile() throws IOException {
		File broken = rubyFile("broken.rb", "def\n");
		File fine = rubyFile("fine.rb", "y=2\n");
		assertThat(run("", "format", broken.getPath(), fine.getPath()), is(1));
		assertThat(out(), is("y = 2\n"));
	}

	@Test
	public void writeRequiresFiles() {
		assertThat(run("x=1\n", "write"), is(1));
		assertThat(err(), containsString("action \"write\" requires at least one file"));
	}

	@Test
	public void rejectsUnknownActions() {
		assertThat(run("", "reformat"), is(1));
		assertThat(err(), containsString("unknown action \"reformat\""));
		assertThat(err(), containsString("actions: "));
	}

	@Test
	public void printsVersion() {
		assertThat(run("", "version"), is(0));
		assertThat(out(), is("stree version " + STreeOptions.VERSION + "\n"));
	}

	@Test
	public void printsHelp() {
		assertThat(run("", "help"), is(0));
		assertThat(out(), containsString("actions: ast, check, debug, doc, format, help, json, version, write"));
	}
}
