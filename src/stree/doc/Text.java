package stree.doc;

import java.util.Objects;

/**
 * 
 * Literal characters. Never contains a line break.
 *
 */
public class Text extends Document {
	private final String value;

	public Text(String value) {
		super(displayWidth(value), false);
		if (value.indexOf('\n') != -1 || value.indexOf('\r') != -1) {
			throw new MalformedDocumentException("text must not contain line breaks: " + value);
		}
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	static int displayWidth(String value) {
		return value.codePointCount(0, value.length());
	}

	@Override
	public Text copy() {
		return new Text(value);
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Text text = (Text) o;
		return Objects.equals(value, text.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
