package edu.uw.easycyk.util;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

/**
 * Plain-text fallback for drawing trees. A node with one child is drawn as:
 *
 * <pre>
 * A
 * |
 * a
 * </pre>
 *
 * A node with two children gets a "/ \" line, then the left subtree at the same indent and the right subtree two
 * columns further in.
 */
public class AsciiTreeView implements TreeView<String> {

	@Override
	public String render(final LabeledTree tree) {
		final List<String> lines = new ArrayList<>();
		draw(tree, 0, lines);
		return Joiner.on("\n").join(lines);
	}

	private void draw(final LabeledTree node, final int indent, final List<String> lines) {
		final String padding = Strings.repeat(" ", indent);
		lines.add(padding + node.getName());
		final List<LabeledTree> children = node.getChildren();
		if (children.size() == 1) {
			lines.add(padding + "|");
			lines.add(padding + children.get(0).getName());
		} else if (children.size() == 2) {
			lines.add(padding + "/ \\");
			draw(children.get(0), indent, lines);
			draw(children.get(1), indent + 2, lines);
		}
	}
}
