package edu.uw.easycyk.syntax.grammar;

import java.io.Serializable;
import java.util.Collection;
import java.util.List;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;

/**
 * An immutable CNF grammar. Rule order matters: variables are visited in the order their first rule was seen, and a
 * variable's productions in source order. The recognizer keeps the first derivation it finds, so this order decides
 * which parse is returned for ambiguous input.
 */
public class Grammar implements Serializable {
	private static final long serialVersionUID = 1L;

	public final static String DEFAULT_START_SYMBOL = "S";

	private final ImmutableSet<String> variables;
	private final ImmutableSet<String> terminals;
	private final String startSymbol;
	private final ImmutableListMultimap<String, Production> rules;

	// Cached views, used in the inner loops of the recognizer.
	private final ImmutableListMultimap<String, String> terminalToVariables;
	private final ImmutableList<Rule> binaryRules;

	public Grammar(final Collection<String> variables, final Collection<String> terminals, final String startSymbol,
			final ListMultimap<String, Production> rules) {
		this.variables = ImmutableSet.copyOf(variables);
		this.terminals = ImmutableSet.copyOf(terminals);
		this.startSymbol = Preconditions.checkNotNull(startSymbol);
		this.rules = ImmutableListMultimap.copyOf(rules);

		final ImmutableListMultimap.Builder<String, String> lexical = ImmutableListMultimap.builder();
		final ImmutableList.Builder<Rule> binary = ImmutableList.builder();
		for (final Entry<String, Production> rule : this.rules.entries()) {
			final Production production = rule.getValue();
			if (production.isSingleSymbol()) {
				// Aliases match their symbol as a token, just like terminals.
				lexical.put(production.getSymbols().get(0), rule.getKey());
			} else if (production.isBinary()) {
				binary.add(new Rule(rule.getKey(), production));
			}
		}
		this.terminalToVariables = lexical.build();
		this.binaryRules = binary.build();
	}

	public Set<String> getVariables() {
		return variables;
	}

	public Set<String> getTerminals() {
		return terminals;
	}

	public String getStartSymbol() {
		return startSymbol;
	}

	public ImmutableListMultimap<String, Production> getRules() {
		return rules;
	}

	/**
	 * Left-hand sides, in the order they were first defined.
	 */
	public Set<String> getLeftHandSides() {
		return rules.keySet();
	}

	public List<Production> getProductions(final String variable) {
		return rules.get(variable);
	}

	/**
	 * Every variable with a single-symbol production (terminal or alias) matching the token exactly. One entry per
	 * matching production, in rule order.
	 */
	public List<String> getVariablesForToken(final String token) {
		return terminalToVariables.get(token);
	}

	/**
	 * All binary rules, in rule order.
	 */
	public List<Rule> getBinaryRules() {
		return binaryRules;
	}

	public boolean isEmpty() {
		return rules.isEmpty();
	}

	public int size() {
		return rules.size();
	}

	@Override
	public int hashCode() {
		return Objects.hash(startSymbol, rules);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Grammar)) {
			return false;
		}
		final Grammar other = (Grammar) obj;
		return startSymbol.equals(other.startSymbol) && variables.equals(other.variables)
				&& terminals.equals(other.terminals) && rules.equals(other.rules);
	}

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		for (final String lhs : rules.keySet()) {
			if (result.length() > 0) {
				result.append("\n");
			}
			result.append(lhs);
			result.append(" -> ");
			boolean isFirst = true;
			for (final Production production : rules.get(lhs)) {
				if (!isFirst) {
					result.append(" | ");
				}
				isFirst = false;
				result.append(production);
			}
		}
		return result.toString();
	}

	/**
	 * A production together with its left-hand side.
	 */
	public static class Rule implements Serializable {
		private static final long serialVersionUID = 1L;
		private final String lhs;
		private final Production production;

		Rule(final String lhs, final Production production) {
			this.lhs = lhs;
			this.production = production;
		}

		public String getLhs() {
			return lhs;
		}

		public Production getProduction() {
			return production;
		}

		@Override
		public String toString() {
			return lhs + " -> " + production;
		}
	}
}
