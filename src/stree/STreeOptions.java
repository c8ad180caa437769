package stree;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;
import stree.formatter.CommentPolicy;
import stree.formatter.FormatterConfig;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

public class STreeOptions {
	public static final String VERSION = "0.1.0";

	public static final Set<String> ACTIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"format", "write", "check", "debug", "ast", "doc", "json", "version", "help")));

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-w Maximum line width, overrides the configuration file", aliases = {"-width"})
	public Integer width;

	@Option(value = "-c Path to a JSON configuration file, if any", aliases = {"-config"})
	public String configFilePath;

	public String action;
	public List<Path> files = new ArrayList<>();

	// built from the configuration file and the width option
	public FormatterConfig formatterConfig = FormatterConfig.defaults();

	private final Options plumeOptions;
	private String[] remainingArgs = new String[0];
	private String argError;

	public void printHelp(PrintStream out) {
		plumeOptions.printUsage(out);
		out.println("actions: " + String.join(", ", new TreeSet<>(ACTIONS)));
	}

	public STreeOptions(String[] args) {
		plumeOptions = new Options("stree [options] action [file...]", this);
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			argError = e.getMessage();
		}
	}

	public void parse() throws STreeOptionException {
		if (argError != null) {
			throw new STreeOptionException(argError);
		}
		if (version) {
			action = "version";
			return;
		}
		if (help) {
			action = "help";
			return;
		}
		if (remainingArgs.length == 0) {
			throw new STreeOptionException("an action is required");
		}

		action = remainingArgs[0];
		if (!ACTIONS.contains(action)) {
			throw new STreeOptionException("unknown action \"" + action + "\"");
		}
		for (int i = 1; i < remainingArgs.length; ++i) {
			files.add(Paths.get(remainingArgs[i]));
		}

		FormatterConfig.Builder builder = FormatterConfig.builder();
		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;
			try {
				s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new STreeOptionException("Error reading configuration file: " + ex.getMessage());
			}

			JSONObject config;
			try {
				config = new JSONObject(s);
			} catch (JSONException e) {
				throw new STreeOptionException(configFilePath + ": parsing error: " + e.getMessage());
			}
			applyConfig(configFilePath, config, builder);
		}
		try {
			if (width != null) {
				builder.printWidth(width);
			}
			formatterConfig = builder.build();
		} catch (IllegalArgumentException e) {
			throw new STreeOptionException(e.getMessage());
		}
	}

	/**
	 * Applies the settings of a JSON configuration file to {@code builder}.
	 *
	 * @param origin where the configuration was read from, for messages
	 */
	public static void applyConfig(String origin, JSONObject config, FormatterConfig.Builder builder)
			throws STreeOptionException {
		for (String key : config.keySet()) {
			try {
				switch (key) {
					case "print_width":
						builder.printWidth(config.getInt(key));
						break;
					case "indent_width":
						builder.indentWidth(config.getInt(key));
						break;
					case "max_blank_lines":
						builder.maxBlankLines(config.getInt(key));
						break;
					case "trailing_comma":
						builder.trailingComma(config.getBoolean(key));
						break;
					case "single_quotes":
						builder.preferSingleQuotes(config.getBoolean(key));
						break;
					case "blank_line_before_comments":
						builder.commentPolicy(CommentPolicy.valueOf(config.getString(key).toUpperCase(Locale.ROOT)));
						break;
					default:
						throw new STreeOptionException(origin + ": unknown configuration key \"" + key + "\"");
				}
			} catch (JSONException | IllegalArgumentException e) {
				throw new STreeOptionException(origin + ": invalid value for \"" + key + "\": " + e.getMessage());
			}
		}
	}
}
