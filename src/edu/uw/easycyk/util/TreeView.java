package edu.uw.easycyk.util;

/**
 * Something that can draw a {@link LabeledTree}.
 */
public interface TreeView<T> {
	T render(LabeledTree tree);
}
