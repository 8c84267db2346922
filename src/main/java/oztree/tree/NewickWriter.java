package oztree.tree;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Stack;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import oztree.constants.GeneralConstants;

/**
 * Writes trees back out as single-line Newick. Directive suffixes are re-emitted in their
 * canonical form, so a written tree reads back to the same names, ids and directives.
 */
public class NewickWriter {

	private static final String QUOTE_TRIGGERS = ",;:()[]'";

	private int precision = -1;

	/**
	 * Round branch lengths to at most `digits` decimal places; a negative value (the default)
	 * writes the shortest exact decimal.
	 */
	public void setPrecision(int digits) {
		this.precision = digits;
	}

	public int getPrecision() {
		return precision;
	}

	public String write(Tree tree) {
		return write(tree.getRoot());
	}

	public void write(Tree tree, File outFile) throws IOException {
		FileUtils.writeStringToFile(outFile, write(tree) + "\n", StandardCharsets.UTF_8);
	}

	/**
	 * @return the Newick string for the subtree rooted at `root`, terminated by ';'
	 */
	public String write(TreeNode root) {
		StringBuilder sb = new StringBuilder();
		Stack<TreeNode> nodes = new Stack<TreeNode>();
		Stack<Integer> nextChild = new Stack<Integer>();
		nodes.push(root);
		nextChild.push(0);
		if (root.isInternal()) {
			sb.append('(');
		}
		while (!nodes.isEmpty()) {
			TreeNode cur = nodes.peek();
			int i = nextChild.pop();
			if (i < cur.getChildCount()) {
				nextChild.push(i + 1);
				if (i > 0) {
					sb.append(',');
				}
				TreeNode child = cur.getChild(i);
				if (child.isInternal()) {
					sb.append('(');
					nodes.push(child);
					nextChild.push(0);
				} else {
					appendLabelAndLength(sb, child);
				}
			} else {
				nodes.pop();
				if (cur.isInternal()) {
					sb.append(')');
				}
				appendLabelAndLength(sb, cur);
			}
		}
		sb.append(';');
		return sb.toString();
	}

	void appendLabelAndLength(StringBuilder sb, TreeNode node) {
		sb.append(formatLabel(node));
		if (node.hasBranchLength()) {
			sb.append(':').append(formatLength(node.getBL()));
		}
	}

	public String formatLength(double bl) {
		BigDecimal d = BigDecimal.valueOf(bl);
		if (precision >= 0) {
			d = d.setScale(precision, RoundingMode.HALF_UP);
		}
		d = d.stripTrailingZeros();
		if (d.signum() == 0) {
			return "0";
		}
		return d.toPlainString();
	}

	/**
	 * @return the label of `node` as it appears in Newick text: name, "_ott" id and any
	 *		directive suffix, single-quoted when it contains whitespace or Newick punctuation
	 */
	public static String formatLabel(TreeNode node) {
		StringBuilder sb = new StringBuilder(node.getName());
		if (node.getTaxonId() != null) {
			sb.append(GeneralConstants.TAXON_ID_PREFIX.stringValue()).append(node.getTaxonId());
		}
		if (node.isGraftPoint()) {
			Directive ex = node.getDirective(Directive.Kind.EXCLUSION);
			if (ex != null) {
				sb.append(ex.toString());
			}
			sb.append(GraftMarker.INSTANCE.toString());
		}
		String label = sb.toString();
		if (needsQuotes(label)) {
			return "'" + StringUtils.replace(label, "'", "''") + "'";
		}
		return label;
	}

	private static boolean needsQuotes(String label) {
		for (int i = 0; i < label.length(); i++) {
			char c = label.charAt(i);
			if (Character.isWhitespace(c) || QUOTE_TRIGGERS.indexOf(c) >= 0) {
				return true;
			}
		}
		return false;
	}
}
