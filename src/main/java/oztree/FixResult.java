package oztree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import oztree.tree.TreeNode;

/**
 * Edges changed by the UltrametricityFixer, and the nodes it had to leave alone.
 */
public class FixResult {

	public static class Unfixable {
		private final TreeNode node;
		private final String reason;

		Unfixable(TreeNode node, String reason) {
			this.node = node;
			this.reason = reason;
		}

		public TreeNode getNode() {return node;}

		public String getReason() {return reason;}

		@Override
		public String toString() {
			return node + ": " + reason;
		}
	}

	private final ArrayList<TreeNode> adjusted = new ArrayList<TreeNode>();
	private final ArrayList<Unfixable> unfixable = new ArrayList<Unfixable>();

	void adjusted(TreeNode node) {
		adjusted.add(node);
	}

	void unfixable(TreeNode node, String reason) {
		unfixable.add(new Unfixable(node, reason));
	}

	public List<TreeNode> getAdjusted() {
		return Collections.unmodifiableList(adjusted);
	}

	public List<Unfixable> getUnfixable() {
		return Collections.unmodifiableList(unfixable);
	}

	public boolean isComplete() {
		return unfixable.isEmpty();
	}
}
