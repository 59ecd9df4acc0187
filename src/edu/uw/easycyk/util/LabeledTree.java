package edu.uw.easycyk.util;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.uw.easycyk.syntax.grammar.ParseTreeNode;

/**
 * Renderer-neutral tree: a name and 0, 1 or 2 children of the same shape. This is what gets handed to a
 * {@link TreeView}.
 */
public class LabeledTree {
	private final String name;
	private final List<LabeledTree> children;

	public LabeledTree(final String name, final List<LabeledTree> children) {
		Preconditions.checkArgument(children.size() <= 2, "Too many children: %s", children.size());
		this.name = Preconditions.checkNotNull(name);
		this.children = ImmutableList.copyOf(children);
	}

	public static LabeledTree of(final ParseTreeNode node) {
		final ImmutableList.Builder<LabeledTree> children = ImmutableList.builder();
		for (final ParseTreeNode child : node.getChildren()) {
			children.add(of(child));
		}
		return new LabeledTree(node.getLabel(), children.build());
	}

	public String getName() {
		return name;
	}

	public List<LabeledTree> getChildren() {
		return children;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, children);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof LabeledTree)) {
			return false;
		}
		final LabeledTree other = (LabeledTree) obj;
		return name.equals(other.name) && children.equals(other.children);
	}

	@Override
	public String toString() {
		return children.isEmpty() ? name : name + children;
	}
}
