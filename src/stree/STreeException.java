package stree;

/**
 * An stree exception consisting of a prefix (type of error), a message and, when the
 * error can be traced to the input, the line it was found on.
 *
 */
public abstract class STreeException extends RuntimeException {
	private final int line;
	private final String msg;
	private final String prefix;

	public STreeException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
		this.line = -1;
	}

	public STreeException(String prefix, String msg, int lineN) {
		super(prefix + ": " + msg + " at line " + lineN);
		this.prefix = prefix;
		this.line = lineN;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}

	public int getLine() {
		return line;
	}
}
