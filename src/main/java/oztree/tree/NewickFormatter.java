package oztree.tree;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Stack;

import org.apache.commons.lang3.StringUtils;

import oztree.constants.GeneralConstants;

/**
 * Writes a tree as indented Newick, one node per line, for reading by people. For example
 * {@code (A:8.5,(B:7,C:7):1.5)Root;} becomes
 *
 * <pre>
 * (
 *   A:8.5,
 *   (
 *     B:7,
 *     C:7
 *   ):1.5
 * )Root;
 * </pre>
 */
public class NewickFormatter {

	private final NewickWriter labels;
	private final int indentSpaces;

	public NewickFormatter() {
		this(GeneralConstants.INDENT_SPACES.intValue());
	}

	public NewickFormatter(int indentSpaces) {
		this(indentSpaces, new NewickWriter());
	}

	public NewickFormatter(int indentSpaces, NewickWriter labels) {
		if (indentSpaces < 0) {
			throw new IllegalArgumentException("indentation must not be negative: " + indentSpaces);
		}
		this.indentSpaces = indentSpaces;
		this.labels = labels;
	}

	public String format(Tree tree) {
		StringWriter sw = new StringWriter();
		try {
			format(tree, sw);
		} catch (IOException e) {
			// StringWriter does not throw
			throw new IllegalStateException(e);
		}
		return sw.toString();
	}

	public void format(Tree tree, Writer out) throws IOException {
		String indent = StringUtils.repeat(' ', indentSpaces);
		Stack<TreeNode> nodes = new Stack<TreeNode>();
		Stack<Integer> nextChild = new Stack<Integer>();
		TreeNode root = tree.getRoot();
		nodes.push(root);
		nextChild.push(0);
		if (root.isInternal()) {
			out.write("(\n");
		}
		StringBuilder sb = new StringBuilder();
		while (!nodes.isEmpty()) {
			TreeNode cur = nodes.peek();
			int i = nextChild.pop();
			int depth = nodes.size();
			if (i < cur.getChildCount()) {
				nextChild.push(i + 1);
				if (i > 0) {
					out.write(",\n");
				}
				TreeNode child = cur.getChild(i);
				out.write(StringUtils.repeat(indent, depth));
				if (child.isInternal()) {
					out.write("(\n");
					nodes.push(child);
					nextChild.push(0);
				} else {
					sb.setLength(0);
					labels.appendLabelAndLength(sb, child);
					out.write(sb.toString());
				}
			} else {
				nodes.pop();
				if (cur.isInternal()) {
					out.write("\n");
					out.write(StringUtils.repeat(indent, depth - 1));
					out.write(")");
				}
				sb.setLength(0);
				labels.appendLabelAndLength(sb, cur);
				out.write(sb.toString());
			}
		}
		out.write(";\n");
		out.flush();
	}
}
