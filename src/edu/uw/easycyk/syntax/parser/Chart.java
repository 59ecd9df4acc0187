package edu.uw.easycyk.syntax.parser;

import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;

import edu.uw.easycyk.syntax.parser.ChartCell.ChartCellFactory;

/**
 * Triangular CYK chart. Cell (i, j) covers tokens i..j inclusive and only exists for 0 &lt;= i &lt;= j &lt; n.
 */
public class Chart {
	private final int size;
	private final ChartCell[][] cells;

	Chart(final int size, final ChartCellFactory factory) {
		Preconditions.checkArgument(size >= 0, "Negative chart size: %s", size);
		this.size = size;
		this.cells = new ChartCell[size][];
		for (int start = 0; start < size; start++) {
			// Row i only stores cells i..n-1.
			cells[start] = new ChartCell[size - start];
			for (int end = start; end < size; end++) {
				cells[start][end - start] = factory.make();
			}
		}
	}

	/**
	 * Number of tokens covered by the chart.
	 */
	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	public ChartCell getCell(final int start, final int end) {
		Preconditions.checkElementIndex(start, size, "start");
		Preconditions.checkElementIndex(end, size, "end");
		Preconditions.checkArgument(start <= end, "Cell [%s][%s] is below the diagonal", start, end);
		return cells[start][end - start];
	}

	public Set<String> getVariables(final int start, final int end) {
		return getCell(start, end).getVariables();
	}

	public boolean contains(final int start, final int end, final String variable) {
		return getCell(start, end).contains(variable);
	}

	public List<Derivation> getDerivations(final int start, final int end, final String variable) {
		return getCell(start, end).getDerivations(variable);
	}

	/**
	 * The cell covering the whole input.
	 */
	public ChartCell getTopCell() {
		return getCell(0, size - 1);
	}

	/**
	 * Two charts are equal if every cell derives the same variables in the same order.
	 */
	public boolean sameVariables(final Chart other) {
		if (other.size != size) {
			return false;
		}
		for (int start = 0; start < size; start++) {
			for (int end = start; end < size; end++) {
				if (!Iterables.elementsEqual(getVariables(start, end), other.getVariables(start, end))) {
					return false;
				}
			}
		}
		return true;
	}
}
