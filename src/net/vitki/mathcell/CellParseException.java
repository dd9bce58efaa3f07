package net.vitki.mathcell;

/**
 * Input that cannot be turned into cells at all:
 * no document, or text that is not well formed markup.
 *
 * @author vit
 *
 */
public class CellParseException extends Exception
{
	private static final long serialVersionUID = 1L;

	public CellParseException(String message) {
		super(message);
	}

	public CellParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
