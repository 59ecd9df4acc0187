package edu.uw.easycyk.syntax.grammar;

/**
 * Thrown by a strict {@link GrammarCompiler} when a line or an alternative can't be classified.
 */
public class GrammarFormatException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final int lineNumber;
	private final String fragment;

	public GrammarFormatException(final String message, final int lineNumber, final String fragment) {
		super("Line " + lineNumber + ": " + message + ": " + fragment);
		this.lineNumber = lineNumber;
		this.fragment = fragment;
	}

	/**
	 * 1-based line number in the grammar text.
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	public String getFragment() {
		return fragment;
	}
}
