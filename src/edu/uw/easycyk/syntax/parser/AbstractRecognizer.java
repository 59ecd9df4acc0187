package edu.uw.easycyk.syntax.parser;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.uw.easycyk.syntax.grammar.Grammar;
import edu.uw.easycyk.syntax.grammar.Grammar.Rule;
import edu.uw.easycyk.syntax.parser.ChartCell.ChartCellFactory;

/**
 * Bottom-up CYK over a CNF grammar. Subclasses decide what each cell keeps, and what to do with each derivation.
 *
 * Rules are always tried in grammar order, so the first derivation recorded for a variable in a cell is the same on
 * every run.
 */
public abstract class AbstractRecognizer {

	private final List<ParserListener> listeners;

	protected AbstractRecognizer(final List<ParserListener> listeners) {
		this.listeners = ImmutableList.copyOf(listeners);
	}

	protected abstract ChartCellFactory getCellFactory();

	public List<ParserListener> getListeners() {
		return listeners;
	}

	/**
	 * Fills the chart. Never fails on unusual grammars or inputs: the worst case is a chart with no entries.
	 */
	protected final Chart fillChart(final Grammar grammar, final List<String> tokens) {
		return fill(grammar, tokens, listeners);
	}

	/**
	 * Fills the chart, also reporting to a listener that only lives for this call.
	 */
	protected final Chart fillChart(final Grammar grammar, final List<String> tokens, final ParserListener listener) {
		return fill(grammar, tokens, ImmutableList.<ParserListener> builder().add(listener).addAll(listeners)
				.build());
	}

	private Chart fill(final Grammar grammar, final List<String> tokens, final List<ParserListener> listeners) {
		Preconditions.checkNotNull(grammar);
		Preconditions.checkNotNull(tokens);

		for (final ParserListener listener : listeners) {
			listener.handleNewInput(tokens);
		}

		final int numTokens = tokens.size();
		final Chart chart = new Chart(numTokens, getCellFactory());

		// Terminal rules fill the diagonal.
		for (int i = 0; i < numTokens; i++) {
			final String token = tokens.get(i);
			for (final String variable : grammar.getVariablesForToken(token)) {
				addEntry(chart, i, i, variable, Derivation.terminal(token), listeners);
			}
		}

		final List<Rule> binaryRules = grammar.getBinaryRules();
		for (int spanLength = 2; spanLength <= numTokens; spanLength++) {
			for (int startOfSpan = 0; startOfSpan <= numTokens - spanLength; startOfSpan++) {
				final int endOfSpan = startOfSpan + spanLength - 1;
				for (int split = startOfSpan; split < endOfSpan; split++) {
					final ChartCell left = chart.getCell(startOfSpan, split);
					final ChartCell right = chart.getCell(split + 1, endOfSpan);
					if (left.isEmpty() || right.isEmpty()) {
						continue;
					}

					for (final Rule rule : binaryRules) {
						final String leftVariable = rule.getProduction().getLeft();
						final String rightVariable = rule.getProduction().getRight();
						if (left.contains(leftVariable) && right.contains(rightVariable)) {
							addEntry(chart, startOfSpan, endOfSpan, rule.getLhs(),
									Derivation.binary(leftVariable, rightVariable, split), listeners);
						}
					}
				}
			}
		}

		final boolean accepted = isAccepted(grammar, chart);
		for (final ParserListener listener : listeners) {
			listener.handleRecognitionCompletion(accepted, chart);
		}
		return chart;
	}

	private static void addEntry(final Chart chart, final int start, final int end, final String variable,
			final Derivation derivation, final List<ParserListener> listeners) {
		chart.getCell(start, end).add(variable, derivation);
		for (final ParserListener listener : listeners) {
			listener.handleChartInsertion(start, end, variable, derivation);
		}
	}

	static boolean isAccepted(final Grammar grammar, final Chart chart) {
		return !chart.isEmpty() && chart.getTopCell().contains(grammar.getStartSymbol());
	}
}
