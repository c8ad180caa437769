package stree.layout;

import java.io.IOException;
import java.io.Writer;

/**
 * 
 * A writer that tracks the current output column and the indentation prefix of the lines it
 * starts. Indentation is written lazily, just before the first character of the next line, so
 * a line that receives no text stays empty.
 * 
 * Line breaks are always written as a single '\n'.
 *
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private String indent = "";
	private String pendingIndent = "";
	private boolean shouldIndent = false;
	private int column = 0;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final String previous;
		private final String applied;

		Indent(IndentingWriter writer, String previous, String applied) {
			this.writer = writer;
			this.previous = previous;
			this.applied = applied;
		}

		@Override
		public void close() {
			if (!writer.indent.equals(applied)) {
				throw new IllegalStateException("indentation scopes closed out of order");
			}
			writer.indent = previous;
		}

	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	/**
	 * Indents any lines started before the returned scope is closed by {@code spaces} more columns.
	 * 
	 * @param spaces number of columns, must not be negative
	 * @return an AutoCloseable that restores the previous indentation when closed
	 */
	public Indent indent(int spaces) {
		if (spaces < 0) {
			throw new IllegalArgumentException("can't indent by a negative amount: " + spaces);
		}
		return indent(spaces(spaces));
	}

	/**
	 * Appends {@code prefix} to the indentation of any lines started before the returned scope is closed.
	 */
	public Indent indent(String prefix) {
		String previous = indent;
		indent = indent + prefix;
		return new Indent(this, previous, indent);
	}

	/**
	 * @return the 0-based column the next character will be written at, counting indentation
	 * that is still pending
	 */
	public int getColumn() {
		if (shouldIndent) {
			return width(pendingIndent);
		}
		return column;
	}

	public String getIndentation() {
		return indent;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		newLine(0);
	}

	/**
	 * Ends the current line. The next line is indented by the current indentation adjusted by
	 * {@code indentDelta}: positive values add spaces, negative values remove trailing columns
	 * of the indentation, never going below column 0.
	 */
	public void newLine(int indentDelta) throws IOException {
		out.write('\n');
		column = 0;
		shouldIndent = true;
		if (indentDelta >= 0) {
			pendingIndent = indent + spaces(indentDelta);
		} else if (-indentDelta >= indent.length()) {
			pendingIndent = "";
		} else {
			pendingIndent = indent.substring(0, indent.length() + indentDelta);
		}
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			int next = data.indexOf('\n', start);
			int end = next == -1 ? data.length() : next;
			if (end > start) {
				if (shouldIndent) {
					out.write(pendingIndent);
					column = width(pendingIndent);
					shouldIndent = false;
				}
				String chunk = data.substring(start, end);
				out.write(chunk);
				column += width(chunk);
			}
			if (next == -1) {
				break;
			}
			newLine();
			start = next + 1;
		}
	}

	private static int width(String s) {
		return s.codePointCount(0, s.length());
	}

	private static String spaces(int n) {
		StringBuilder sb = new StringBuilder(n);
		for (int i = 0; i < n; ++i) {
			sb.append(' ');
		}
		return sb.toString();
	}

}
