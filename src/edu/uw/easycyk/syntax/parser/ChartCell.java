package edu.uw.easycyk.syntax.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The variables that derive one span of the input. Variables are kept in the order they were first added.
 */
public abstract class ChartCell {

	public static abstract class ChartCellFactory {
		public abstract ChartCell make();
	}

	/**
	 * Adds a derivation for the variable. Returns true if the variable wasn't already in the cell.
	 */
	abstract boolean add(final String variable, final Derivation derivation);

	public abstract boolean contains(String variable);

	public abstract Set<String> getVariables();

	/**
	 * Derivations for the variable, in the order they were found. Empty if the cell doesn't record backpointers.
	 */
	public abstract List<Derivation> getDerivations(String variable);

	public boolean isEmpty() {
		return getVariables().isEmpty();
	}

	public int size() {
		return getVariables().size();
	}

	@Override
	public String toString() {
		return getVariables().toString();
	}

	/**
	 * Chart cell that keeps every derivation, so that a tree can be rebuilt.
	 */
	static class CellWithBackpointers extends ChartCell {
		private final Map<String, List<Derivation>> variableToDerivations = new LinkedHashMap<>();

		@Override
		boolean add(final String variable, final Derivation derivation) {
			List<Derivation> derivations = variableToDerivations.get(variable);
			final boolean isNew = derivations == null;
			if (isNew) {
				derivations = new ArrayList<>();
				variableToDerivations.put(variable, derivations);
			}
			derivations.add(derivation);
			return isNew;
		}

		@Override
		public boolean contains(final String variable) {
			return variableToDerivations.containsKey(variable);
		}

		@Override
		public Set<String> getVariables() {
			return Collections.unmodifiableSet(variableToDerivations.keySet());
		}

		@Override
		public List<Derivation> getDerivations(final String variable) {
			final List<Derivation> derivations = variableToDerivations.get(variable);
			return derivations == null ? Collections.emptyList() : Collections.unmodifiableList(derivations);
		}

		public static ChartCellFactory factory() {
			return new ChartCellFactory() {

				@Override
				public ChartCell make() {
					return new CellWithBackpointers();
				}
			};
		}
	}

	/**
	 * Chart cell that only records which variables are derivable.
	 */
	static class CellVariablesOnly extends ChartCell {
		private final Set<String> variables = new LinkedHashSet<>();

		@Override
		boolean add(final String variable, final Derivation derivation) {
			return variables.add(variable);
		}

		@Override
		public boolean contains(final String variable) {
			return variables.contains(variable);
		}

		@Override
		public Set<String> getVariables() {
			return Collections.unmodifiableSet(variables);
		}

		@Override
		public List<Derivation> getDerivations(final String variable) {
			return Collections.emptyList();
		}

		public static ChartCellFactory factory() {
			return new ChartCellFactory() {

				@Override
				public ChartCell make() {
					return new CellVariablesOnly();
				}
			};
		}
	}
}
