package edu.uw.easycyk.syntax.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.uw.easycyk.syntax.grammar.Grammar;
import edu.uw.easycyk.syntax.parser.ChartCell.CellVariablesOnly;
import edu.uw.easycyk.syntax.parser.ChartCell.ChartCellFactory;

/**
 * Step-by-step CYK, for display. Runs the same dynamic program as {@link CYKRecognizer}, but keeps no backpointers and
 * instead describes every derivation it finds as a line of text.
 */
public class CYKTracer extends AbstractRecognizer {

	public CYKTracer() {
		super(Collections.emptyList());
	}

	public CYKTracer(final List<ParserListener> listeners) {
		super(listeners);
	}

	@Override
	protected ChartCellFactory getCellFactory() {
		return CellVariablesOnly.factory();
	}

	public Trace trace(final Grammar grammar, final List<String> tokens) {
		final List<String> steps = new ArrayList<>();
		final Chart chart = fillChart(grammar, tokens, new ParserListener() {

			@Override
			public void handleNewInput(final List<String> input) {
			}

			@Override
			public void handleChartInsertion(final int start, final int end, final String variable,
					final Derivation derivation) {
				steps.add(describe(start, end, variable, derivation));
			}

			@Override
			public void handleRecognitionCompletion(final boolean accepted, final Chart result) {
			}
		});

		return new Trace(isAccepted(grammar, chart), chart, steps);
	}

	static String describe(final int start, final int end, final String variable, final Derivation derivation) {
		if (derivation.isTerminal()) {
			return "Cell[" + start + "][" + end + "]: '" + derivation.getToken() + "' can be derived from " + variable;
		}
		final int split = derivation.getSplit();
		return "Cell[" + start + "][" + end + "]: " + variable + " → " + derivation.getLeft() + derivation.getRight()
				+ " (from [" + start + "][" + split + "] and [" + (split + 1) + "][" + end + "])";
	}

	public static class Trace {
		private final boolean accepted;
		private final Chart chart;
		private final List<String> steps;

		private Trace(final boolean accepted, final Chart chart, final List<String> steps) {
			this.accepted = accepted;
			this.chart = chart;
			this.steps = ImmutableList.copyOf(steps);
		}

		public boolean isAccepted() {
			return accepted;
		}

		/**
		 * Derivable variables per cell. Cells don't hold derivations.
		 */
		public Chart getChart() {
			return chart;
		}

		public List<String> getSteps() {
			return steps;
		}
	}
}
