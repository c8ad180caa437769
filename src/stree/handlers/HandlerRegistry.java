package stree.handlers;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 *
 * Maps file extensions to the handler for their language. Files with an extension nobody
 * registered, or with none, go to the fallback handler.
 *
 */
public class HandlerRegistry {
	private final Map<String, LanguageHandler> handlers = new HashMap<>();
	private final LanguageHandler fallback;

	public HandlerRegistry(LanguageHandler fallback) {
		this.fallback = fallback;
	}

	/**
	 * @return a registry that handles Ruby files, and anything else as Ruby
	 */
	public static HandlerRegistry withDefaults() {
		LanguageHandler ruby = new RubyHandler();
		HandlerRegistry registry = new HandlerRegistry(ruby);
		registry.register("rb", ruby);
		registry.register("rake", ruby);
		registry.register("gemspec", ruby);
		registry.register("ru", ruby);
		return registry;
	}

	/**
	 * @param extension the extension without its leading dot, matched ignoring case
	 */
	public void register(String extension, LanguageHandler handler) {
		handlers.put(extension.toLowerCase(Locale.ROOT), handler);
	}

	public LanguageHandler getFallback() {
		return fallback;
	}

	/**
	 * @param file the file to handle, or null for standard input
	 */
	public LanguageHandler forFile(Path file) {
		if (file == null || file.getFileName() == null) {
			return fallback;
		}
		String name = file.getFileName().toString();
		int dot = name.lastIndexOf('.');
		if (dot <= 0) {
			return fallback;
		}
		return handlers.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), fallback);
	}
}
