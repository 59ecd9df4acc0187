package edu.uw.easycyk.syntax.parser;

import java.io.Serializable;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A backpointer: records why a variable was added to a chart cell.
 */
public class Derivation implements Serializable {
	private static final long serialVersionUID = 1L;

	public enum DerivationType {
		TERMINAL, BINARY
	}

	private final DerivationType type;
	private final String token;
	private final String left;
	private final String right;
	private final int split;

	private Derivation(final DerivationType type, final String token, final String left, final String right,
			final int split) {
		this.type = type;
		this.token = token;
		this.left = left;
		this.right = right;
		this.split = split;
	}

	public static Derivation terminal(final String token) {
		return new Derivation(DerivationType.TERMINAL, Preconditions.checkNotNull(token), null, null, -1);
	}

	/**
	 * @param split
	 *            index of the last token covered by the left child.
	 */
	public static Derivation binary(final String left, final String right, final int split) {
		Preconditions.checkArgument(split >= 0, "Negative split: %s", split);
		return new Derivation(DerivationType.BINARY, null, Preconditions.checkNotNull(left),
				Preconditions.checkNotNull(right), split);
	}

	public DerivationType getType() {
		return type;
	}

	public boolean isTerminal() {
		return type == DerivationType.TERMINAL;
	}

	public String getToken() {
		Preconditions.checkState(isTerminal(), "Not a terminal derivation");
		return token;
	}

	public String getLeft() {
		Preconditions.checkState(!isTerminal(), "Not a binary derivation");
		return left;
	}

	public String getRight() {
		Preconditions.checkState(!isTerminal(), "Not a binary derivation");
		return right;
	}

	public int getSplit() {
		Preconditions.checkState(!isTerminal(), "Not a binary derivation");
		return split;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, token, left, right, split);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Derivation)) {
			return false;
		}
		final Derivation other = (Derivation) obj;
		return type == other.type && split == other.split && Objects.equals(token, other.token)
				&& Objects.equals(left, other.left) && Objects.equals(right, other.right);
	}

	@Override
	public String toString() {
		return isTerminal() ? "'" + token + "'" : left + " " + right + " @" + split;
	}
}
