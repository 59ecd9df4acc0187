package edu.uw.easycyk.syntax.parser;

import java.util.List;

/**
 * Callbacks from a recognizer. Listeners observe the chart being filled, but can't change the result.
 */
public interface ParserListener {
	void handleNewInput(final List<String> tokens);

	/**
	 * Called for every derivation recorded in a cell, including ones for variables already in the cell.
	 */
	void handleChartInsertion(final int start, final int end, final String variable, final Derivation derivation);

	void handleRecognitionCompletion(final boolean accepted, final Chart chart);
}
