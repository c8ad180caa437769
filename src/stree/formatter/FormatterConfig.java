package stree.formatter;

import java.util.Objects;

/**
 * Formatting settings. Instances are immutable; use {@link #builder()} to derive new ones.
 */
public class FormatterConfig {
	public static final int DEFAULT_PRINT_WIDTH = 80;
	public static final int DEFAULT_INDENT_WIDTH = 2;
	public static final int DEFAULT_MAX_BLANK_LINES = 1;

	private final int printWidth;
	private final int indentWidth;
	private final int maxBlankLines;
	private final boolean trailingComma;
	private final boolean preferSingleQuotes;
	private final CommentPolicy commentPolicy;

	private FormatterConfig(Builder builder) {
		this.printWidth = builder.printWidth;
		this.indentWidth = builder.indentWidth;
		this.maxBlankLines = builder.maxBlankLines;
		this.trailingComma = builder.trailingComma;
		this.preferSingleQuotes = builder.preferSingleQuotes;
		this.commentPolicy = builder.commentPolicy;
	}

	public static FormatterConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.printWidth(printWidth)
				.indentWidth(indentWidth)
				.maxBlankLines(maxBlankLines)
				.trailingComma(trailingComma)
				.preferSingleQuotes(preferSingleQuotes)
				.commentPolicy(commentPolicy);
	}

	public int getPrintWidth() {
		return printWidth;
	}

	public int getIndentWidth() {
		return indentWidth;
	}

	public int getMaxBlankLines() {
		return maxBlankLines;
	}

	public boolean isTrailingComma() {
		return trailingComma;
	}

	public boolean isPreferSingleQuotes() {
		return preferSingleQuotes;
	}

	public CommentPolicy getCommentPolicy() {
		return commentPolicy;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FormatterConfig that = (FormatterConfig) o;
		return printWidth == that.printWidth &&
				indentWidth == that.indentWidth &&
				maxBlankLines == that.maxBlankLines &&
				trailingComma == that.trailingComma &&
				preferSingleQuotes == that.preferSingleQuotes &&
				commentPolicy == that.commentPolicy;
	}

	@Override
	public int hashCode() {
		return Objects.hash(printWidth, indentWidth, maxBlankLines, trailingComma, preferSingleQuotes, commentPolicy);
	}

	@Override
	public String toString() {
		return "FormatterConfig [printWidth=" + printWidth + ", indentWidth=" + indentWidth + ", maxBlankLines=" +
				maxBlankLines + ", trailingComma=" + trailingComma + ", preferSingleQuotes=" + preferSingleQuotes +
				", commentPolicy=" + commentPolicy + "]";
	}

	public static class Builder {
		private int printWidth = DEFAULT_PRINT_WIDTH;
		private int indentWidth = DEFAULT_INDENT_WIDTH;
		private int maxBlankLines = DEFAULT_MAX_BLANK_LINES;
		private boolean trailingComma = false;
		private boolean preferSingleQuotes = false;
		private CommentPolicy commentPolicy = CommentPolicy.PRESERVE;

		private Builder() {}

		public Builder printWidth(int printWidth) {
			if (printWidth < 1) {
				throw new IllegalArgumentException("print width must be positive, got " + printWidth);
			}
			this.printWidth = printWidth;
			return this;
		}

		public Builder indentWidth(int indentWidth) {
			if (indentWidth < 0) {
				throw new IllegalArgumentException("indent width must not be negative, got " + indentWidth);
			}
			this.indentWidth = indentWidth;
			return this;
		}

		public Builder maxBlankLines(int maxBlankLines) {
			if (maxBlankLines < 0) {
				throw new IllegalArgumentException("maximum blank lines must not be negative, got " + maxBlankLines);
			}
			this.maxBlankLines = maxBlankLines;
			return this;
		}

		public Builder trailingComma(boolean trailingComma) {
			this.trailingComma = trailingComma;
			return this;
		}

		public Builder preferSingleQuotes(boolean preferSingleQuotes) {
			this.preferSingleQuotes = preferSingleQuotes;
			return this;
		}

		public Builder commentPolicy(CommentPolicy commentPolicy) {
			this.commentPolicy = Objects.requireNonNull(commentPolicy);
			return this;
		}

		public FormatterConfig build() {
			return new FormatterConfig(this);
		}
	}
}
