package stree.dump;

import stree.doc.Align;
import stree.doc.Breakable;
import stree.doc.Concat;
import stree.doc.Container;
import stree.doc.Docs;
import stree.doc.Document;
import stree.doc.DocumentVisitor;
import stree.doc.Group;
import stree.doc.IfBreak;
import stree.doc.Indent;
import stree.doc.Text;
import stree.layout.Renderer;
import stree.model.FieldVisitor;
import stree.model.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 *
 * Dumps syntax trees, layout documents and lists of them as s-expressions, laid out by the
 * layout engine itself:
 *
 * <pre>
 * (def "foo"
 *   (params [(param REQUIRED "a")])
 *   (statements [(var_ref "a")]))
 * </pre>
 *
 * An object met again while it is still being dumped is printed as {@code ...}, so dumping a
 * structure that refers back to itself terminates.
 *
 */
public class StructureDumper {
	static final String CYCLE = "...";

	private final Set<Object> active = Collections.newSetFromMap(new IdentityHashMap<>());

	public static String dump(Object value, int width) {
		return new Renderer(width).render(Docs.group(new StructureDumper().toDocument(value)));
	}

	public Document toDocument(Object value) {
		if (value == null) {
			return Docs.text("nil");
		}
		if (value instanceof String) {
			return Docs.text(quote((String) value));
		}
		if (!(value instanceof Node) && !(value instanceof Document) && !(value instanceof List)) {
			return Docs.text(String.valueOf(value));
		}
		if (!active.add(value)) {
			return Docs.text(CYCLE);
		}
		try {
			if (value instanceof Node) {
				return nodeToDocument((Node) value);
			} else if (value instanceof Document) {
				return ((Document) value).accept(new DocumentDumpVisitor());
			} else {
				return listToDocument((List<?>) value);
			}
		} finally {
			active.remove(value);
		}
	}

	private Document nodeToDocument(Node node) {
		List<Document> parts = new ArrayList<>();
		node.accept(new FieldVisitor() {
			@Override
			public void field(String name, Object value) {
				if (value != null) {
					parts.add(toDocument(value));
				}
			}

			@Override
			public void child(String name, Node child) {
				if (child != null) {
					parts.add(toDocument(child));
				}
			}

			@Override
			public void children(String name, List<? extends Node> children) {
				parts.add(toDocument(children));
			}
		});
		return sexp(node.getType(), parts);
	}

	private Document listToDocument(List<?> list) {
		if (list.isEmpty()) {
			return Docs.text("[]");
		}
		List<Document> inner = new ArrayList<>();
		for (int i = 0; i < list.size(); ++i) {
			if (i > 0) {
				inner.add(Docs.text(","));
				inner.add(Docs.line());
			}
			inner.add(toDocument(list.get(i)));
		}
		return Docs.group(Docs.text("["), new Align(1, inner), Docs.text("]"));
	}

	static Document sexp(String head, List<Document> parts) {
		if (parts.isEmpty()) {
			return Docs.text("(" + head + ")");
		}
		List<Document> inner = new ArrayList<>();
		for (Document part : parts) {
			inner.add(Docs.line());
			inner.add(part);
		}
		return Docs.group(Docs.text("(" + head), new Indent(2, inner), Docs.text(")"));
	}

	static String quote(String value) {
		StringBuilder sb = new StringBuilder("\"");
		for (char c : value.toCharArray()) {
			switch (c) {
				case '"':
					sb.append("\\\"");
					break;
				case '\\':
					sb.append("\\\\");
					break;
				case '\n':
					sb.append("\\n");
					break;
				case '\r':
					sb.append("\\r");
					break;
				case '\t':
					sb.append("\\t");
					break;
				default:
					sb.append(c);
			}
		}
		return sb.append('"').toString();
	}

	private class DocumentDumpVisitor extends DocumentVisitor<Document, RuntimeException> {

		private List<Document> children(Container container) {
			List<Document> result = new ArrayList<>();
			for (Document child : container.getChildren()) {
				result.add(toDocument(child));
			}
			return result;
		}

		@Override
		public Document visit(Text text) {
			return sexp("text", Collections.singletonList(Docs.text(quote(text.getValue()))));
		}

		@Override
		public Document visit(Breakable breakable) {
			List<Document> parts = new ArrayList<>();
			parts.add(Docs.text(quote(breakable.getSeparator())));
			if (breakable.getIndentDelta() != 0) {
				parts.add(Docs.text(Integer.toString(breakable.getIndentDelta())));
			}
			return sexp("breakable", parts);
		}

		@Override
		public Document visit(Group group) {
			return sexp("group " + group.getMode().toString().toLowerCase(), children(group));
		}

		@Override
		public Document visit(Indent indent) {
			return sexp("indent " + indent.getDelta(), children(indent));
		}

		@Override
		public Document visit(Align align) {
			return sexp("align " + quote(align.getPrefix()), children(align));
		}

		@Override
		public Document visit(IfBreak ifBreak) {
			List<Document> parts = new ArrayList<>();
			parts.add(toDocument(ifBreak.getFlat()));
			parts.add(toDocument(ifBreak.getBroken()));
			return sexp("if_break", parts);
		}

		@Override
		public Document visit(Concat concat) {
			return sexp("concat", children(concat));
		}
	}
}
