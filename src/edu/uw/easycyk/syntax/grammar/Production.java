package edu.uw.easycyk.syntax.grammar;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Right-hand side of a CNF rule. Either a single terminal, a pair of variables, or a degenerate alias to a single
 * variable.
 */
public abstract class Production implements Serializable {
	private static final long serialVersionUID = 1L;

	public enum ProductionType {
		TERMINAL, BINARY, ALIAS
	}

	private Production() {
	}

	public static Production terminal(final String token) {
		return new TerminalProduction(token);
	}

	public static Production binary(final String left, final String right) {
		return new BinaryProduction(left, right);
	}

	public static Production alias(final String variable) {
		return new AliasProduction(variable);
	}

	public abstract ProductionType getType();

	public abstract List<String> getSymbols();

	public boolean isTerminal() {
		return getType() == ProductionType.TERMINAL;
	}

	/**
	 * Terminals and aliases. Either kind matches a token equal to its symbol.
	 */
	public boolean isSingleSymbol() {
		return getType() != ProductionType.BINARY;
	}

	public boolean isBinary() {
		return getType() == ProductionType.BINARY;
	}

	/**
	 * The token matched by a terminal production.
	 */
	public String getToken() {
		throw new UnsupportedOperationException("Not a terminal production: " + this);
	}

	public String getLeft() {
		throw new UnsupportedOperationException("Not a binary production: " + this);
	}

	public String getRight() {
		throw new UnsupportedOperationException("Not a binary production: " + this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), getSymbols());
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Production)) {
			return false;
		}
		final Production other = (Production) obj;
		return getType() == other.getType() && getSymbols().equals(other.getSymbols());
	}

	private static class TerminalProduction extends Production {
		private static final long serialVersionUID = 1L;
		private final String token;

		private TerminalProduction(final String token) {
			this.token = Preconditions.checkNotNull(token);
		}

		@Override
		public ProductionType getType() {
			return ProductionType.TERMINAL;
		}

		@Override
		public List<String> getSymbols() {
			return ImmutableList.of(token);
		}

		@Override
		public String getToken() {
			return token;
		}

		@Override
		public String toString() {
			return token.length() == 1 && Character.isLowerCase(token.charAt(0)) ? token : "\"" + token + "\"";
		}
	}

	private static class BinaryProduction extends Production {
		private static final long serialVersionUID = 1L;
		private final String left;
		private final String right;

		private BinaryProduction(final String left, final String right) {
			this.left = Preconditions.checkNotNull(left);
			this.right = Preconditions.checkNotNull(right);
		}

		@Override
		public ProductionType getType() {
			return ProductionType.BINARY;
		}

		@Override
		public List<String> getSymbols() {
			return ImmutableList.of(left, right);
		}

		@Override
		public String getLeft() {
			return left;
		}

		@Override
		public String getRight() {
			return right;
		}

		@Override
		public String toString() {
			return left + " " + right;
		}
	}

	/**
	 * A single bare symbol that isn't a terminal. Counted as a variable, but still matches a token spelled the same.
	 */
	private static class AliasProduction extends Production {
		private static final long serialVersionUID = 1L;
		private final String variable;

		private AliasProduction(final String variable) {
			this.variable = Preconditions.checkNotNull(variable);
		}

		@Override
		public ProductionType getType() {
			return ProductionType.ALIAS;
		}

		@Override
		public List<String> getSymbols() {
			return ImmutableList.of(variable);
		}

		@Override
		public String toString() {
			return variable;
		}
	}
}
