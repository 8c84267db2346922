package oztree;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Stack;

import org.apache.log4j.Logger;

import oztree.tree.Tree;
import oztree.tree.TreeNode;
import oztree.tree.TreeUtils;

/**
 * Measures root-to-leaf path lengths and reports leaves that disagree.
 *
 * Unknown branch lengths count as 0. Unresolved graft points, and anything below them, are left
 * out: they stand for trees held elsewhere.
 */
public class UltrametricityChecker {
	static Logger _LOG = Logger.getLogger(UltrametricityChecker.class);

	/**
	 * @return every pair of leaves whose depths differ by more than `epsilon`
	 */
	public List<LeafPair> check(Tree tree, double epsilon) {
		return check(tree, epsilon, Integer.MAX_VALUE);
	}

	/**
	 * Sorts the leaves by depth and sweeps once, so the work beyond the sort is proportional to
	 * the number of pairs returned.
	 *
	 * @param limit stop after this many pairs
	 * @return up to `limit` offending pairs, shallowest leaf first
	 */
	public List<LeafPair> check(Tree tree, double epsilon, int limit) {
		ArrayList<TreeNode> leaves = new ArrayList<TreeNode>();
		TDoubleArrayList depths = new TDoubleArrayList();
		collectLeafDepths(tree, leaves, depths);

		final double[] d = depths.toArray();
		Integer[] order = new Integer[d.length];
		for (int i = 0; i < order.length; i++) {
			order[i] = i;
		}
		Arrays.sort(order, new Comparator<Integer>() {
			@Override
			public int compare(Integer a, Integer b) {
				return Double.compare(d[a], d[b]);
			}
		});

		ArrayList<LeafPair> pairs = new ArrayList<LeafPair>();
		int j = 0;
		for (int i = 0; i < order.length && pairs.size() < limit; i++) {
			double di = d[order[i]];
			if (j <= i) {
				j = i + 1;
			}
			while (j < order.length && d[order[j]] - di <= epsilon) {
				j++;
			}
			for (int k = j; k < order.length && pairs.size() < limit; k++) {
				pairs.add(new LeafPair(leaves.get(order[i]), di, leaves.get(order[k]), d[order[k]]));
			}
		}
		if (!pairs.isEmpty()) {
			_LOG.warn("Not ultrametric! " + pairs.get(0));
		}
		return pairs;
	}

	public boolean isUltrametric(Tree tree, double epsilon) {
		ArrayList<TreeNode> leaves = new ArrayList<TreeNode>();
		TDoubleArrayList depths = new TDoubleArrayList();
		collectLeafDepths(tree, leaves, depths);
		if (depths.isEmpty()) {
			return true;
		}
		return depths.max() - depths.min() <= epsilon;
	}

	/**
	 * @return the distance from the root to every measured leaf
	 */
	public TObjectDoubleHashMap<TreeNode> leafDepths(Tree tree) {
		ArrayList<TreeNode> leaves = new ArrayList<TreeNode>();
		TDoubleArrayList depths = new TDoubleArrayList();
		collectLeafDepths(tree, leaves, depths);
		TObjectDoubleHashMap<TreeNode> map = new TObjectDoubleHashMap<TreeNode>(leaves.size());
		for (int i = 0; i < leaves.size(); i++) {
			map.put(leaves.get(i), depths.get(i));
		}
		return map;
	}

	/**
	 * Fills `leaves` and `depths` in parallel, left to right.
	 */
	static void collectLeafDepths(Tree tree, List<TreeNode> leaves, TDoubleArrayList depths) {
		Stack<TreeNode> nodes = new Stack<TreeNode>();
		TDoubleArrayList pathLengths = new TDoubleArrayList();
		TreeNode root = tree.getRoot();
		if (TreeUtils.isPlaceholder(root)) {
			return;
		}
		nodes.push(root);
		pathLengths.add(0.0);
		while (!nodes.isEmpty()) {
			TreeNode cur = nodes.pop();
			double curDepth = pathLengths.removeAt(pathLengths.size() - 1);
			if (cur.isExternal()) {
				leaves.add(cur);
				depths.add(curDepth);
				continue;
			}
			for (int i = cur.getChildCount() - 1; i >= 0; i--) {
				TreeNode c = cur.getChild(i);
				if (TreeUtils.isPlaceholder(c)) {
					continue;
				}
				nodes.push(c);
				pathLengths.add(curDepth + c.getBLOrZero());
			}
		}
	}
}
