package oztree.tree;

import gnu.trove.map.hash.TObjectDoubleHashMap;
import gnu.trove.set.hash.THashSet;

public class TreeUtils {

	/**
	 * @return true for an unresolved graft point. It stands for a tree held elsewhere, so it and
	 *		anything below it take no part in depth measurements.
	 */
	public static boolean isPlaceholder(TreeNode node) {
		return node.isGraftPoint();
	}

	/**
	 * Returns the greatest summed branch length from `inNode` down to any leaf of its subtree,
	 *	not counting the edge above `inNode`. Unknown lengths count as 0 and graft placeholders
	 *	are skipped with their subtrees. A subtree holding only placeholders has distance 0.
	 */
	public static double getGreatestDistanceToTip(TreeNode inNode) {
		TObjectDoubleHashMap<TreeNode> below = new TObjectDoubleHashMap<TreeNode>();
		double max = 0.0;
		for (TreeNode n : inNode.getDescendants(NodeOrder.POSTORDER)) {
			double d = 0.0;
			for (TreeNode c : n.getChildren()) {
				if (isPlaceholder(c)) {
					continue;
				}
				double viaChild = c.getBLOrZero() + below.get(c);
				if (viaChild > d) {
					d = viaChild;
				}
			}
			below.put(n, d);
			if (n == inNode) {
				max = d;
			}
		}
		return max;
	}

	/**
	 * @return the most recent common ancestor of `a` and `b`, or null if they are in different trees
	 */
	public static TreeNode getMRCA(TreeNode a, TreeNode b) {
		THashSet<TreeNode> ancestorsOfA = new THashSet<TreeNode>();
		for (TreeNode cur = a; cur != null; cur = cur.getParent()) {
			ancestorsOfA.add(cur);
		}
		for (TreeNode cur = b; cur != null; cur = cur.getParent()) {
			if (ancestorsOfA.contains(cur)) {
				return cur;
			}
		}
		return null;
	}

	/**
	 * @return true if `node` is `ancestor` or lies in its subtree
	 */
	public static boolean isDescendantOf(TreeNode node, TreeNode ancestor) {
		for (TreeNode cur = node; cur != null; cur = cur.getParent()) {
			if (cur == ancestor) {
				return true;
			}
		}
		return false;
	}
}
