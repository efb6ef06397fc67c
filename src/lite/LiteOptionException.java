package lite;

public class LiteOptionException extends Exception {
	public LiteOptionException(String message) {
		super(message);
	}
}
