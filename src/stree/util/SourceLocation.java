package stree.util;

import stree.layout.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 
 * A range of source text. Offsets are 0-based character offsets with an exclusive end;
 * lines and columns are 1-based, the end column pointing one past the last character.
 *
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startOffset < 0;
	}

	/**
	 * Describes this location and underlines it in {@code source}, the text it was read from.
	 */
	public String prettyString(CharSequence source) {
		StringWriter sw = new StringWriter();
		try {
			writePretty(new IndentingWriter(sw), source);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return sw.toString();
	}

	public void writePretty(IndentingWriter out, CharSequence source) throws IOException {
		if (isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		out.write("at ");
		if (startLine != endLine) {
			out.write(startLine + ":" + startColumn + "-" + endLine + ":" + endColumn);
		} else if (endColumn - startColumn > 1) {
			out.write(startLine + ":" + startColumn + "-" + (endColumn - 1));
		} else {
			out.write(startLine + ":" + startColumn);
		}
		if (file != null) {
			out.write(" in file " + file);
		}
		if (source == null || startOffset > source.length()) {
			return;
		}
		int lineStart = startOffset;
		while (lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = startOffset;
		while (lineEnd < source.length() && source.charAt(lineEnd) != '\n') {
			lineEnd++;
		}
		out.newLine();
		out.append(source, lineStart, lineEnd);
		out.newLine();
		for (int pos = lineStart; pos < startOffset; pos++) {
			out.append(source.charAt(pos) == '\t' ? '\t' : ' ');
		}
		if (startOffset == source.length()) {
			out.append("^ EOF");
			return;
		}
		int underlineEnd = Math.max(startOffset + 1, Math.min(endOffset, lineEnd));
		for (int pos = startOffset; pos < underlineEnd; pos++) {
			out.append('^');
		}
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		if (!Objects.equals(file, other.getFile())) {
			throw new IllegalArgumentException("Tried to combine source locations from two different files: " + file +
					", " + other.getFile());
		}
		SourceLocation first = startOffset <= other.startOffset ? this : other;
		SourceLocation last = endOffset >= other.endOffset ? this : other;
		return new SourceLocation(file,
				first.startOffset,
				last.endOffset,
				first.startLine,
				last.endLine,
				first.startColumn,
				last.endColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
				", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
				", endColumn=" + endColumn + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedStartOffset = Integer.compare(startOffset, o.startOffset);
		if (comparedStartOffset != 0) {
			return comparedStartOffset;
		}
		return Integer.compare(endOffset, o.endOffset);
	}

}
