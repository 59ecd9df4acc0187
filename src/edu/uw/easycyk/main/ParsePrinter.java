package edu.uw.easycyk.main;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

import edu.uw.easycyk.syntax.grammar.ParseTreeNode;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode.ParseTreeNodeBinary;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode.ParseTreeNodeLeaf;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode.ParseTreeNodeUnary;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode.ParseTreeNodeVisitor;
import edu.uw.easycyk.syntax.parser.CYKTracer;
import edu.uw.easycyk.syntax.parser.Chart;
import edu.uw.easycyk.syntax.parser.RecognitionResult;
import edu.uw.easycyk.util.AsciiTreeView;
import edu.uw.easycyk.util.LabeledTree;

public abstract class ParsePrinter {
	public final static TreePrinter ASCII_PRINTER = new AsciiPrinter();
	public final static TreePrinter BRACKETED_PRINTER = new BracketedPrinter();
	public final static ParsePrinter TABLE_PRINTER = new TablePrinter();
	public final static ParsePrinter TRACE_PRINTER = new TracePrinter();
	public final static ParsePrinter ALL_PRINTER = new CompositePrinter(TABLE_PRINTER, ASCII_PRINTER, TRACE_PRINTER);

	public String print(final RecognitionResult result, final int id) {
		final StringBuilder output = new StringBuilder();
		if (id > -1) {
			printHeader(id, result, output);
		}
		printResult(result, output);
		return output.toString();
	}

	protected void printHeader(final int id, final RecognitionResult result, final StringBuilder output) {
		output.append("ID=" + id + " " + (result.isAccepted() ? "ACCEPTED" : "REJECTED") + "\n");
	}

	protected abstract void printResult(RecognitionResult result, StringBuilder output);

	/**
	 * Prints the parse tree, if there is one.
	 */
	public abstract static class TreePrinter extends ParsePrinter {

		@Override
		protected void printResult(final RecognitionResult result, final StringBuilder output) {
			if (result.getTree().isPresent()) {
				printParse(result.getTree().get(), output);
			} else {
				printFailure(output);
			}
		}

		protected void printFailure(final StringBuilder output) {
			output.append("(no parse)");
		}

		protected abstract void printParse(ParseTreeNode parse, StringBuilder output);

		public String print(final ParseTreeNode parse) {
			final StringBuilder output = new StringBuilder();
			printParse(parse, output);
			return output.toString();
		}
	}

	private static class AsciiPrinter extends TreePrinter {
		private final AsciiTreeView view = new AsciiTreeView();

		@Override
		protected void printParse(final ParseTreeNode parse, final StringBuilder output) {
			output.append(view.render(LabeledTree.of(parse)));
		}
	}

	/**
	 * (S (A a) (B b))
	 */
	private static class BracketedPrinter extends TreePrinter {

		@Override
		protected void printParse(final ParseTreeNode parse, final StringBuilder output) {
			parse.accept(new ParseTreeNodeVisitor() {

				@Override
				public void visit(final ParseTreeNodeBinary node) {
					output.append("(");
					output.append(node.getLabel());
					output.append(" ");
					node.getLeftChild().accept(this);
					output.append(" ");
					node.getRightChild().accept(this);
					output.append(")");
				}

				@Override
				public void visit(final ParseTreeNodeUnary node) {
					output.append("(" + node.getLabel() + " " + node.getToken() + ")");
				}

				@Override
				public void visit(final ParseTreeNodeLeaf node) {
					output.append("(" + node.getLabel() + ")");
				}
			});
		}
	}

	/**
	 * The chart as an n x n grid. Cells below the diagonal aren't part of the chart, and print as "-", as do empty
	 * cells.
	 */
	static class TablePrinter extends ParsePrinter {

		@Override
		protected void printResult(final RecognitionResult result, final StringBuilder output) {
			final Chart chart = result.getChart();
			final int size = chart.size();
			final String[][] contents = new String[size][size];
			int width = 1;
			for (int row = 0; row < size; row++) {
				for (int column = 0; column < size; column++) {
					final String content = column >= row ? Joiner.on(", ").join(chart.getVariables(row, column)) : "";
					contents[row][column] = content.isEmpty() ? "-" : content;
					width = Math.max(width, contents[row][column].length());
				}
			}

			final List<String> lines = new ArrayList<>();
			for (int row = 0; row < size; row++) {
				final List<String> cells = new ArrayList<>();
				for (int column = 0; column < size; column++) {
					cells.add(Strings.padEnd(contents[row][column], width, ' '));
				}
				lines.add(Joiner.on(" | ").join(cells).trim());
			}
			output.append(Joiner.on("\n").join(lines));
		}
	}

	/**
	 * Re-runs the input through {@link CYKTracer} and prints one line per derivation.
	 */
	private static class TracePrinter extends ParsePrinter {
		private final CYKTracer tracer = new CYKTracer();

		@Override
		protected void printResult(final RecognitionResult result, final StringBuilder output) {
			output.append(Joiner.on("\n").join(tracer.trace(result.getGrammar(), result.getTokens()).getSteps()));
		}
	}

	private static class CompositePrinter extends ParsePrinter {
		private final ParsePrinter[] printers;

		private CompositePrinter(final ParsePrinter... printers) {
			this.printers = printers;
		}

		@Override
		protected void printResult(final RecognitionResult result, final StringBuilder output) {
			boolean isFirst = true;
			for (final ParsePrinter printer : printers) {
				if (!isFirst) {
					output.append("\n\n");
				}
				isFirst = false;
				printer.printResult(result, output);
			}
		}
	}
}
