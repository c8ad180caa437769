package stree.util;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 
 * Reads source files, honouring a magic encoding comment such as {@code # encoding: ISO-8859-1}
 * or {@code # -*- coding: utf-8 -*-}. The comment is looked for on the first line, or on the
 * second line when the first one is a {@code #!} shebang. Files without one, and files starting
 * with a UTF-8 byte order mark, are read as UTF-8.
 *
 */
public class SourceReader {

	static final Pattern MAGIC_COMMENT = Pattern.compile("^#.*?\\b(?:en)?coding\\s*[:=]\\s*([\\w.-]+)",
			Pattern.CASE_INSENSITIVE);

	private SourceReader() {}

	public static String read(Path path) throws IOException {
		byte[] bytes;
		boolean hadBom;
		try (BOMInputStream in = new BOMInputStream(FileUtils.openInputStream(path.toFile()))) {
			hadBom = in.hasBOM();
			bytes = IOUtils.toByteArray(in);
		}
		Charset charset = hadBom ? StandardCharsets.UTF_8 : detectEncoding(bytes);
		return new String(bytes, charset);
	}

	/**
	 * @return the encoding named by the magic comment at the top of {@code bytes}, or UTF-8
	 * @throws IOException if the magic comment names an encoding this JVM does not support
	 */
	public static Charset detectEncoding(byte[] bytes) throws IOException {
		// every supported encoding keeps the ASCII header bytes where Latin-1 decoding puts them
		String header = new String(bytes, 0, Math.min(bytes.length, 1024), StandardCharsets.ISO_8859_1);
		String[] lines = header.split("\r?\n", 3);
		String candidate = lines[0];
		if (candidate.startsWith("#!") && lines.length > 1) {
			candidate = lines[1];
		}
		Matcher m = MAGIC_COMMENT.matcher(candidate);
		if (!m.find()) {
			return StandardCharsets.UTF_8;
		}
		String name = m.group(1);
		try {
			return Charset.forName(name);
		} catch (UnsupportedCharsetException | IllegalCharsetNameException e) {
			throw new IOException("unknown encoding name in magic comment: " + name, e);
		}
	}
}
