package edu.uw.easycyk.syntax.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A node in a CNF parse tree. Nodes are immutable and never shared between trees.
 */
public abstract class ParseTreeNode implements Serializable {
	private static final long serialVersionUID = 1L;
	private final String label;

	private ParseTreeNode(final String label) {
		this.label = Preconditions.checkNotNull(label);
	}

	public String getLabel() {
		return label;
	}

	public abstract List<ParseTreeNode> getChildren();

	public abstract void accept(ParseTreeNodeVisitor v);

	public boolean isLeaf() {
		return getChildren().isEmpty();
	}

	/**
	 * The tokens covered by this node, left to right.
	 */
	public List<String> getYield() {
		final List<String> result = new ArrayList<>();
		accept(new ParseTreeNodeVisitor() {
			@Override
			public void visit(final ParseTreeNodeBinary node) {
				node.getLeftChild().accept(this);
				node.getRightChild().accept(this);
			}

			@Override
			public void visit(final ParseTreeNodeUnary node) {
				result.add(node.getToken());
			}

			@Override
			public void visit(final ParseTreeNodeLeaf node) {
			}
		});
		return result;
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, getChildren());
	}

	@Override
	public boolean equals(final Object obj) {
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		final ParseTreeNode other = (ParseTreeNode) obj;
		return label.equals(other.label) && getChildren().equals(other.getChildren());
	}

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		result.append("(");
		result.append(label);
		for (final ParseTreeNode child : getChildren()) {
			result.append(" ");
			result.append(this instanceof ParseTreeNodeUnary ? child.getLabel() : child.toString());
		}
		result.append(")");
		return result.toString();
	}

	public static class ParseTreeNodeBinary extends ParseTreeNode {
		private static final long serialVersionUID = 1L;
		private final ParseTreeNode leftChild;
		private final ParseTreeNode rightChild;

		public ParseTreeNodeBinary(final String label, final ParseTreeNode leftChild, final ParseTreeNode rightChild) {
			super(label);
			this.leftChild = Preconditions.checkNotNull(leftChild);
			this.rightChild = Preconditions.checkNotNull(rightChild);
		}

		public ParseTreeNode getLeftChild() {
			return leftChild;
		}

		public ParseTreeNode getRightChild() {
			return rightChild;
		}

		@Override
		public List<ParseTreeNode> getChildren() {
			return Arrays.asList(leftChild, rightChild);
		}

		@Override
		public void accept(final ParseTreeNodeVisitor v) {
			v.visit(this);
		}
	}

	/**
	 * A variable rewritten to a single terminal.
	 */
	public static class ParseTreeNodeUnary extends ParseTreeNode {
		private static final long serialVersionUID = 1L;
		private final ParseTreeNodeLeaf child;

		public ParseTreeNodeUnary(final String label, final String token) {
			super(label);
			this.child = new ParseTreeNodeLeaf(token);
		}

		public ParseTreeNodeLeaf getChild() {
			return child;
		}

		public String getToken() {
			return child.getLabel();
		}

		@Override
		public List<ParseTreeNode> getChildren() {
			return Collections.singletonList(child);
		}

		@Override
		public void accept(final ParseTreeNodeVisitor v) {
			v.visit(this);
		}
	}

	/**
	 * A node with no children. Either the token under a {@link ParseTreeNodeUnary}, or a variable with no recorded
	 * derivation.
	 */
	public static class ParseTreeNodeLeaf extends ParseTreeNode {
		private static final long serialVersionUID = 1L;

		public ParseTreeNodeLeaf(final String label) {
			super(label);
		}

		@Override
		public List<ParseTreeNode> getChildren() {
			return Collections.emptyList();
		}

		@Override
		public void accept(final ParseTreeNodeVisitor v) {
			v.visit(this);
		}
	}

	public interface ParseTreeNodeVisitor {
		void visit(ParseTreeNodeBinary node);

		void visit(ParseTreeNodeUnary node);

		void visit(ParseTreeNodeLeaf node);
	}
}
