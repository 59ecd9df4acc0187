package edu.uw.easycyk.syntax.parser;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import edu.uw.easycyk.syntax.grammar.Grammar;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode;

/**
 * Output of {@link CYKRecognizer}: whether the input was accepted, the filled chart, and a parse tree if it was.
 */
public class RecognitionResult {
	private final Grammar grammar;
	private final List<String> tokens;
	private final boolean accepted;
	private final Chart chart;
	private final Optional<ParseTreeNode> tree;

	RecognitionResult(final Grammar grammar, final List<String> tokens, final boolean accepted, final Chart chart,
			final Optional<ParseTreeNode> tree) {
		this.grammar = grammar;
		this.tokens = ImmutableList.copyOf(tokens);
		this.accepted = accepted;
		this.chart = chart;
		this.tree = tree;
	}

	public Grammar getGrammar() {
		return grammar;
	}

	public List<String> getTokens() {
		return tokens;
	}

	public boolean isAccepted() {
		return accepted;
	}

	public Chart getChart() {
		return chart;
	}

	public Optional<ParseTreeNode> getTree() {
		return tree;
	}

	@Override
	public String toString() {
		return (accepted ? "ACCEPTED " : "REJECTED ") + tokens + tree.map(t -> " " + t).orElse("");
	}
}
