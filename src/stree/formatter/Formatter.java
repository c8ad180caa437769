package stree.formatter;

import stree.doc.Align;
import stree.doc.BreakMode;
import stree.doc.Breakable;
import stree.doc.Concat;
import stree.doc.Document;
import stree.doc.Docs;
import stree.doc.Group;
import stree.doc.IfBreak;
import stree.doc.Indent;
import stree.doc.MalformedDocumentException;
import stree.doc.Text;
import stree.layout.Renderer;
import stree.model.Comment;
import stree.model.Node;
import stree.util.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 *
 * Builds the layout document for one format operation. Node lowering logic pushes text and
 * breakables and opens scopes (groups, indents, alignments) that close when the returned
 * {@link Scope} is closed, normally through try-with-resources:
 *
 * <pre>
 * try (Formatter.Scope ignored = formatter.group()) {
 *     formatter.text("[");
 *     ...
 * }
 * </pre>
 *
 * Nesting mistakes are reported as {@link MalformedDocumentException} when they are made.
 * The formatter also owns the source comments still waiting to be placed.
 *
 * A formatter is single-use and not safe for use by more than one thread.
 *
 */
public class Formatter {

	private enum FrameKind {
		ROOT,
		GROUP,
		INDENT,
		ALIGN,
		CAPTURE,
	}

	private static class Frame {
		final FrameKind kind;
		final BreakMode mode;
		final int delta;
		final String prefix;
		final List<Document> children = new ArrayList<>();

		Frame(FrameKind kind, BreakMode mode, int delta, String prefix) {
			this.kind = kind;
			this.mode = mode;
			this.delta = delta;
			this.prefix = prefix;
		}

		Document build() {
			switch (kind) {
				case GROUP:
					return new Group(mode, children);
				case INDENT:
					return new Indent(delta, children);
				case ALIGN:
					return new Align(prefix, children);
				default:
					return new Concat(children);
			}
		}
	}

	public class Scope implements AutoCloseable {
		private final Frame frame;

		private Scope(Frame frame) {
			this.frame = frame;
		}

		@Override
		public void close() {
			append(closeFrame(frame));
		}
	}

	private final CharSequence source;
	private final FormatterConfig config;
	private final Deque<Comment> comments;
	private final Deque<Frame> frames = new ArrayDeque<>();
	private int openGroups = 0;
	private int lastLine = 0;
	private boolean finished = false;
	private TreeWalker walker;

	public Formatter(CharSequence source, List<Comment> comments, FormatterConfig config) {
		this.source = source;
		this.config = config;
		this.comments = new ArrayDeque<>(comments);
		this.frames.push(new Frame(FrameKind.ROOT, null, 0, null));
	}

	public FormatterConfig getConfig() {
		return config;
	}

	public CharSequence getSource() {
		return source;
	}

	void attach(TreeWalker walker) {
		if (this.walker != null) {
			throw new IllegalStateException("formatter is already driven by a tree walker");
		}
		this.walker = walker;
	}

	// document construction

	public void text(String value) {
		append(new Text(value));
	}

	/**
	 * A breakable that is a single space when flat.
	 */
	public void breakable() {
		breakable(" ", 0);
	}

	public void breakable(String separator) {
		breakable(separator, 0);
	}

	public void breakable(String separator, int indentDelta) {
		requireOpenGroup("breakable");
		append(new Breakable(separator, indentDelta));
	}

	/**
	 * A breakable that is empty when flat.
	 */
	public void softline() {
		breakable("", 0);
	}

	/**
	 * A line break that always happens: every enclosing group is forced to break.
	 */
	public void hardline() {
		breakParent();
		breakable("", 0);
	}

	/**
	 * Forces every enclosing group to break without adding a break point itself.
	 */
	public void breakParent() {
		append(Docs.breakParent());
	}

	public void ifBreak(String flat, String broken) {
		requireOpenGroup("conditional break");
		append(new IfBreak(new Text(flat), new Text(broken)));
	}

	/**
	 * @param flat built when the enclosing group fits, must not share nodes with {@code broken}
	 */
	public void ifBreak(Document flat, Document broken) {
		requireOpenGroup("conditional break");
		append(new IfBreak(flat, broken));
	}

	public void append(Document document) {
		if (finished) {
			throw new MalformedDocumentException("the document has already been flushed");
		}
		frames.peek().children.add(document);
	}

	public Scope group() {
		return open(new Frame(FrameKind.GROUP, BreakMode.AUTO, 0, null));
	}

	public Scope forcedGroup() {
		return open(new Frame(FrameKind.GROUP, BreakMode.FORCED, 0, null));
	}

	/**
	 * Indents by the configured indentation width.
	 */
	public Scope indent() {
		return indent(config.getIndentWidth());
	}

	public Scope indent(int delta) {
		if (delta < 0) {
			throw new MalformedDocumentException("indent delta must not be negative, got " + delta);
		}
		return open(new Frame(FrameKind.INDENT, null, delta, null));
	}

	public Scope align(int width) {
		if (width < 0) {
			throw new MalformedDocumentException("alignment width must not be negative, got " + width);
		}
		StringBuilder prefix = new StringBuilder();
		for (int i = 0; i < width; ++i) {
			prefix.append(' ');
		}
		return align(prefix.toString());
	}

	public Scope align(String prefix) {
		return open(new Frame(FrameKind.ALIGN, null, 0, prefix));
	}

	/**
	 * Runs {@code body} and returns what it built as a standalone document instead of
	 * appending it, so it can be placed, or copied into the other alternative of an
	 * {@link IfBreak}, by the caller.
	 */
	public Document capture(Runnable body) {
		Frame frame = new Frame(FrameKind.CAPTURE, null, 0, null);
		frames.push(frame);
		boolean completed = false;
		try {
			body.run();
			completed = true;
		} finally {
			if (!completed) {
				unwindTo(frame);
			}
		}
		return closeFrame(frame);
	}

	private Scope open(Frame frame) {
		if (finished) {
			throw new MalformedDocumentException("the document has already been flushed");
		}
		frames.push(frame);
		if (frame.kind == FrameKind.GROUP) {
			++openGroups;
		}
		return new Scope(frame);
	}

	private Document closeFrame(Frame frame) {
		if (frames.peek() != frame) {
			throw new MalformedDocumentException("scopes closed out of order: expected to close a " +
					frames.peek().kind + " but closed a " + frame.kind);
		}
		frames.pop();
		if (frame.kind == FrameKind.GROUP) {
			--openGroups;
		}
		return frame.build();
	}

	private void unwindTo(Frame frame) {
		while (!frames.isEmpty() && frames.peek().kind != FrameKind.ROOT) {
			Frame top = frames.pop();
			if (top.kind == FrameKind.GROUP) {
				--openGroups;
			}
			if (top == frame) {
				return;
			}
		}
	}

	private void requireOpenGroup(String what) {
		if (openGroups == 0) {
			throw new MalformedDocumentException(what + " is not inside any group");
		}
	}

	// tree walking

	/**
	 * Lowers {@code node} into the document, placing any comments that precede it first.
	 */
	public void visit(Node node) {
		visit(node, () -> node.format(this));
	}

	/**
	 * Like {@link #visit(Node)}, with {@code lowering} in place of the node's own lowering. For
	 * parents that need a child lowered in a particular shape.
	 */
	public void visit(Node node, Runnable lowering) {
		if (walker == null) {
			throw new IllegalStateException("formatter is not driven by a tree walker");
		}
		walker.visit(node, lowering);
	}

	/**
	 * Visits {@code items} in order, calling {@code separator} between them. Comments on the same
	 * line as an item, after its separator, stay on that line.
	 */
	public void seplist(List<? extends Node> items, Runnable separator) {
		for (int i = 0; i < items.size(); ++i) {
			Node item = items.get(i);
			visit(item);
			if (i + 1 < items.size()) {
				Node next = items.get(i + 1);
				try (Scope ignored = captureTrailing(next.getLocation().getStartOffset())) {
					separator.run();
				}
			}
		}
	}

	// the separator is emitted into a capture so that trailing comments can be placed between
	// its text and its breakable
	private Scope captureTrailing(int limit) {
		Frame frame = new Frame(FrameKind.CAPTURE, null, 0, null);
		frames.push(frame);
		return new Scope(frame) {
			@Override
			public void close() {
				Document separator = closeFrame(frame);
				List<Document> parts = separator instanceof Concat ? ((Concat) separator).getChildren()
						: Collections.singletonList(separator);
				int split = parts.size();
				while (split > 0 && parts.get(split - 1) instanceof Breakable) {
					--split;
				}
				for (Document part : parts.subList(0, split)) {
					append(part);
				}
				trailingComments(limit);
				for (Document part : parts.subList(split, parts.size())) {
					append(part);
				}
			}
		};
	}

	// comments

	/**
	 * @return true if a comment that has not been placed yet starts before {@code offset}
	 */
	public boolean hasCommentsBefore(int offset) {
		return !comments.isEmpty() && comments.peek().getLocation().getStartOffset() < offset;
	}

	/**
	 * Places the comments that start before {@code node}, each on a line of its own.
	 *
	 * @param keepBlankLines whether blank lines before the comments and the node are reproduced,
	 * as they are between statements
	 */
	public void leadingComments(SourceLocation node, boolean keepBlankLines) {
		leadingComments(node, keepBlankLines, keepBlankLines);
	}

	/**
	 * Places the comments that start before {@code node}, each on a line of its own.
	 *
	 * @param keepBlankLinesBefore whether blank lines before the first comment, or before the node
	 * when there is no comment, are reproduced
	 * @param keepBlankLinesAfter whether blank lines after a placed comment are reproduced, subject
	 * to the comment policy for the ones in front of the node
	 */
	public void leadingComments(SourceLocation node, boolean keepBlankLinesBefore, boolean keepBlankLinesAfter) {
		boolean any = false;
		while (hasCommentsBefore(node.getStartOffset())) {
			Comment comment = comments.poll();
			if (any ? keepBlankLinesAfter : keepBlankLinesBefore) {
				blankLinesBefore(comment.getLocation().getStartLine());
			}
			text(comment.getValue());
			hardline();
			markLine(comment.getLocation().getEndLine());
			any = true;
		}
		if (any ? keepBlankLinesAfter && config.getCommentPolicy() != CommentPolicy.COLLAPSE : keepBlankLinesBefore) {
			blankLinesBefore(node.getStartLine());
		}
	}

	/**
	 * Places the comments before {@code limit} that share a line with code already emitted. Stops
	 * at the first comment on a line of its own.
	 */
	public void trailingComments(int limit) {
		while (hasCommentsBefore(limit) && comments.peek().isInline()
				&& comments.peek().getLocation().getStartLine() <= lastLine) {
			Comment comment = comments.poll();
			text(" " + comment.getValue());
			breakParent();
			markLine(comment.getLocation().getEndLine());
		}
	}

	/**
	 * Places every comment before {@code limit}: inline ones at the end of the current line, the
	 * others on lines of their own. Used at the end of a body or bracketed list, before its closing
	 * delimiter.
	 *
	 * @param atStart true if nothing has been emitted in the enclosing body yet
	 * @return true if any comment was placed
	 */
	public boolean danglingComments(int limit, boolean atStart) {
		boolean any = false;
		while (hasCommentsBefore(limit)) {
			Comment comment = comments.poll();
			if (comment.isInline() && comment.getLocation().getStartLine() <= lastLine && !(atStart && !any)) {
				text(" " + comment.getValue());
				breakParent();
			} else {
				if (!(atStart && !any)) {
					hardline();
					blankLinesBefore(comment.getLocation().getStartLine());
				}
				text(comment.getValue());
				breakParent();
			}
			markLine(comment.getLocation().getEndLine());
			any = true;
		}
		return any;
	}

	/**
	 * Reproduces the blank lines between the last emitted source line and {@code line}, up to the
	 * configured maximum. Must be called right after a line break.
	 */
	public void blankLinesBefore(int line) {
		if (lastLine <= 0) {
			return;
		}
		int blank = Math.min(line - lastLine - 1, config.getMaxBlankLines());
		for (int i = 0; i < blank; ++i) {
			hardline();
		}
	}

	/**
	 * Records that source text up to {@code line} has been emitted.
	 */
	public void markLine(int line) {
		lastLine = Math.max(lastLine, line);
	}

	public int getLastLine() {
		return lastLine;
	}

	/**
	 * @return true if nothing has been added to the document yet
	 */
	public boolean isEmpty() {
		return frames.size() == 1 && frames.peek().children.isEmpty();
	}

	// output

	/**
	 * Finalizes the document.
	 *
	 * @throws MalformedDocumentException if a scope is still open
	 */
	public Document finish() {
		if (finished) {
			throw new MalformedDocumentException("the document has already been flushed");
		}
		if (frames.size() != 1) {
			throw new MalformedDocumentException((frames.size() - 1) + " scope(s) still open, innermost is a " +
					frames.peek().kind);
		}
		finished = true;
		return frames.pop().build();
	}

	/**
	 * Finalizes the document and renders it at the configured print width.
	 */
	public String flush() {
		return new Renderer(config.getPrintWidth()).render(finish());
	}
}
