package stree;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;
import stree.doc.Document;
import stree.dump.JsonDumper;
import stree.dump.StructureDumper;
import stree.errors.FormattingIssue;
import stree.errors.IOErrorIssue;
import stree.errors.IssueContext;
import stree.errors.NonIdempotentIssue;
import stree.errors.OptionParserIssue;
import stree.errors.ParsingIssue;
import stree.errors.TopLevelIssueContext;
import stree.errors.UnformattedFileIssue;
import stree.errors.WhileProcessingFile;
import stree.formatter.FormatterConfig;
import stree.handlers.HandlerRegistry;
import stree.handlers.LanguageHandler;
import stree.lexer.LexerException;
import stree.model.Node;
import stree.parser.ParseException;
import stree.util.SourceReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

public class STreeMain {
	// actions that read standard input when no files are named
	private static final Set<String> STDIN_ACTIONS = new HashSet<>(Arrays.asList("format", "ast", "doc", "json"));

	private final String[] cmdArgs;
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;
	private final HandlerRegistry handlers;
	private static Logger logger;

	public STreeMain(String[] args) {
		this(args, System.in, System.out, System.err, HandlerRegistry.withDefaults());
	}

	public STreeMain(String[] args, InputStream in, PrintStream out, PrintStream err, HandlerRegistry handlers) {
		this.cmdArgs = args;
		this.in = in;
		this.out = out;
		this.err = err;
		this.handlers = handlers;
		// Get the top Logger instance
		logger = Logger.getLogger("STreeMain");
	}

	public static void main(String[] args) {
		int status = new STreeMain(args).run();
		if (status == 0) {
			logger.fine("Finished");
		} else {
			logger.fine("Terminated with errors");
		}
		System.exit(status);
	}

	private STreeOptions parseOptions(IssueContext ctx) {
		STreeOptions opts = new STreeOptions(cmdArgs);
		try {
			opts.parse();
		} catch (STreeOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}

	/**
	 * Runs the action named on the command line.
	 *
	 * @return the process exit status, 0 when no issue was found
	 */
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		STreeOptions opts = parseOptions(ctx);
		if (ctx.hasErrors()) {
			err.println(ctx.format());
			opts.printHelp(err);
			return 1;
		}

		switch (opts.action) {
			case "version":
				out.println("stree version " + STreeOptions.VERSION);
				return 0;
			case "help":
				opts.printHelp(out);
				return 0;
			default:
				break;
		}

		List<Path> files = opts.files;
		if (files.isEmpty()) {
			if (!STDIN_ACTIONS.contains(opts.action)) {
				ctx.error(new OptionParserIssue("action \"" + opts.action + "\" requires at least one file"));
				err.println(ctx.format());
				return 1;
			}
			files = Collections.singletonList(null);
		}

		for (Path file : files) {
			IssueContext fileCtx = file == null ? ctx : ctx.withContext(new WhileProcessingFile(file));
			processFile(fileCtx, opts, file);
		}

		if (ctx.hasErrors()) {
			err.println(ctx.format());
			return 1;
		}
		return 0;
	}

	private void processFile(IssueContext ctx, STreeOptions opts, Path file) {
		LanguageHandler handler = handlers.forFile(file);
		FormatterConfig config = opts.formatterConfig;

		String source;
		Charset charset = StandardCharsets.UTF_8;
		try {
			if (file == null) {
				logger.fine("Reading standard input");
				source = IOUtils.toString(new BOMInputStream(in), StandardCharsets.UTF_8);
			} else {
				logger.fine("Reading \"" + file + "\"");
				source = SourceReader.read(file);
				charset = SourceReader.detectEncoding(Files.readAllBytes(file));
			}
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return;
		}

		Node tree;
		try {
			logger.fine("Parsing as " + handler.getName());
			tree = handler.parse(file, source);
		} catch (LexerException | ParseException e) {
			ctx.error(new ParsingIssue(handler.getName(), e, source));
			return;
		}

		try {
			switch (opts.action) {
				case "format":
					out.print(handler.format(tree, source, config));
					break;
				case "write": {
					String formatted = handler.format(tree, source, config);
					if (!formatted.equals(source)) {
						logger.info("Writing \"" + file + "\"");
						FileUtils.writeStringToFile(file.toFile(), formatted, charset);
					} else {
						logger.fine("\"" + file + "\" is already formatted");
					}
					break;
				}
				case "check": {
					String formatted = handler.format(tree, source, config);
					if (!formatted.equals(source)) {
						ctx.error(new UnformattedFileIssue(file));
					}
					break;
				}
				case "debug":
					checkIdempotent(ctx, handler, config, file, handler.format(tree, source, config));
					break;
				case "ast":
					out.println(StructureDumper.dump(tree, config.getPrintWidth()));
					break;
				case "doc": {
					Document doc = handler.document(tree, source, config);
					out.println(StructureDumper.dump(doc, config.getPrintWidth()));
					break;
				}
				case "json":
					out.println(JsonDumper.dump(tree));
					break;
				default:
					throw new IllegalStateException("unhandled action " + opts.action);
			}
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
		} catch (STreeException e) {
			ctx.error(new FormattingIssue(e));
		}
	}

	private void checkIdempotent(IssueContext ctx, LanguageHandler handler, FormatterConfig config, Path file,
	                             String firstPass) {
		Node reparsed;
		try {
			reparsed = handler.parse(file, firstPass);
		} catch (LexerException | ParseException e) {
			ctx.error(new ParsingIssue(handler.getName(), e, firstPass));
			return;
		}
		String secondPass = handler.format(reparsed, firstPass, config);
		if (!secondPass.equals(firstPass)) {
			ctx.error(new NonIdempotentIssue(file, firstPass, secondPass));
		} else {
			logger.info("\"" + file + "\" formats idempotently");
		}
	}
}
