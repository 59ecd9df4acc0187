package edu.uw.easycyk.syntax.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import edu.uw.easycyk.syntax.grammar.Grammar;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode;
import edu.uw.easycyk.syntax.parser.ChartCell.CellWithBackpointers;
import edu.uw.easycyk.syntax.parser.ChartCell.ChartCellFactory;

/**
 * CYK recognizer that keeps backpointers, and rebuilds one parse tree for accepted inputs.
 *
 * Stateless apart from its listeners, so one instance can be shared.
 */
public class CYKRecognizer extends AbstractRecognizer {

	public CYKRecognizer() {
		this(new Builder());
	}

	protected CYKRecognizer(final Builder builder) {
		super(builder.getListeners());
	}

	@Override
	protected ChartCellFactory getCellFactory() {
		return CellWithBackpointers.factory();
	}

	public RecognitionResult recognize(final Grammar grammar, final List<String> tokens) {
		final Chart chart = fillChart(grammar, tokens);
		final boolean accepted = isAccepted(grammar, chart);
		final Optional<ParseTreeNode> tree = accepted ? ParseTreeBuilder.build(grammar, tokens, chart) : Optional
				.empty();
		return new RecognitionResult(grammar, tokens, accepted, chart, tree);
	}

	public static class Builder {
		private final List<ParserListener> listeners = new ArrayList<>();

		public Builder listener(final ParserListener listener) {
			listeners.add(listener);
			return this;
		}

		public List<ParserListener> getListeners() {
			return Collections.unmodifiableList(listeners);
		}

		public CYKRecognizer build() {
			return new CYKRecognizer(this);
		}
	}
}
