package oztree;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.util.ArrayList;

import org.apache.log4j.Logger;

import oztree.tree.NodeOrder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;
import oztree.tree.TreeUtils;

/**
 * Repairs a tree in place so that all leaves end at the same distance from the root. Only edge
 * lengths change, never the topology.
 */
public class UltrametricityFixer {
	static Logger _LOG = Logger.getLogger(UltrametricityFixer.class);

	/**
	 * Works from the leaves up. At each internal node, the edge of every child whose subtree ends
	 * short of the deepest sibling is lengthened by the difference. Edges are never shortened, so
	 * a negative length is reported and left as it is.
	 */
	public FixResult fix(Tree tree) {
		FixResult result = new FixResult();
		TObjectDoubleHashMap<TreeNode> height = new TObjectDoubleHashMap<TreeNode>();
		for (TreeNode n : tree.nodes(NodeOrder.POSTORDER)) {
			if (n.isExternal() || TreeUtils.isPlaceholder(n)) {
				continue;
			}
			double max = Double.NEGATIVE_INFINITY;
			for (TreeNode c : n.getChildren()) {
				if (!TreeUtils.isPlaceholder(c)) {
					max = Math.max(max, c.getBLOrZero() + height.get(c));
				}
			}
			if (max == Double.NEGATIVE_INFINITY) {
				continue; // only placeholders below
			}
			for (TreeNode c : n.getChildren()) {
				if (TreeUtils.isPlaceholder(c)) {
					continue;
				}
				if (c.hasBranchLength() && c.getBL() < 0) {
					_LOG.warn("cannot fix " + c + ": negative branch length " + c.getBL());
					result.unfixable(c, "negative branch length " + c.getBL());
					continue;
				}
				double total = c.getBLOrZero() + height.get(c);
				if (total < max) {
					c.setBL(c.getBLOrZero() + (max - total));
					result.adjusted(c);
				}
			}
			height.put(n, max);
		}
		_LOG.info("lengthened " + result.getAdjusted().size() + " edge(s)");
		return result;
	}

	/**
	 * Adjusts each leaf's own edge so that it ends exactly `expectedAge` from the root. A leaf
	 * that would need a change larger than `maxAdjustment`, or a negative edge, is reported and
	 * left as it is.
	 */
	public FixResult fixToAge(Tree tree, double expectedAge, double maxAdjustment) {
		FixResult result = new FixResult();
		ArrayList<TreeNode> leaves = new ArrayList<TreeNode>();
		TDoubleArrayList depths = new TDoubleArrayList();
		UltrametricityChecker.collectLeafDepths(tree, leaves, depths);
		for (int i = 0; i < leaves.size(); i++) {
			TreeNode leaf = leaves.get(i);
			double delta = expectedAge - depths.get(i);
			if (delta == 0) {
				continue;
			}
			if (Math.abs(delta) > maxAdjustment) {
				String reason = "age " + depths.get(i) + " is " + Math.abs(delta) + " from " + expectedAge
						+ " (max allowed delta is " + maxAdjustment + ")";
				_LOG.warn("cannot fix " + leaf + ": " + reason);
				result.unfixable(leaf, reason);
				continue;
			}
			double newLength = leaf.getBLOrZero() + delta;
			if (newLength < 0) {
				_LOG.warn("cannot fix " + leaf + ": its edge would become negative");
				result.unfixable(leaf, "edge would become negative (" + newLength + ")");
				continue;
			}
			leaf.setBL(newLength);
			result.adjusted(leaf);
		}
		return result;
	}
}
