package stree.layout;

import stree.doc.Document;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * 
 * Turns a document into text no wider than a maximum line width wherever the document allows.
 * 
 * Each group is decided once, left to right, when rendering reaches it: it is laid out flat if it
 * holds no forced group and its flat width fits in the columns left on the current line,
 * otherwise its own breakables become line breaks and nested groups are decided afresh at the
 * column where each one starts. The renderer neither adds nor trims whitespace.
 * 
 * A renderer holds no state between calls; each call renders into its own writer.
 *
 */
public class Renderer {

	private final int maxWidth;

	public Renderer(int maxWidth) {
		if (maxWidth < 1) {
			throw new IllegalArgumentException("maximum width must be positive, got " + maxWidth);
		}
		this.maxWidth = maxWidth;
	}

	public int getMaxWidth() {
		return maxWidth;
	}

	public String render(Document document) {
		StringWriter w = new StringWriter();
		try {
			render(document, w);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	/**
	 * @throws stree.doc.MalformedDocumentException before writing anything, if the document
	 * uses a breakable or conditional break outside of every group
	 */
	public void render(Document document, Writer writer) throws IOException {
		document.accept(new WellFormednessCheck(false));
		IndentingWriter out = new IndentingWriter(writer);
		document.accept(new RenderingVisitor(out, maxWidth, LayoutMode.OUTSIDE_GROUP));
		out.flush();
	}
}
