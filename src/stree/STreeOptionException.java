package stree;

public class STreeOptionException extends Exception {

	private static final long serialVersionUID = -2406283913066624563L;

	public STreeOptionException(String message) {
		super(message);
	}
}
