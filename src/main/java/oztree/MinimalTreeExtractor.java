package oztree;

import gnu.trove.map.hash.THashMap;
import gnu.trove.set.hash.THashSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import oztree.tree.NodeOrder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Cuts a tree down to the smallest tree that still shows how a set of taxa are related.
 *
 * A node is kept when it is one of the targets or when at least two of its children lead to
 * kept nodes. Other nodes with a single kept descendant line are spliced out and their edge is
 * added to the edge below (an unknown length adds nothing; two unknowns stay unknown). The top
 * kept node becomes the root and keeps its own edge. A target below which no other target lies
 * ends up as a leaf.
 */
public class MinimalTreeExtractor {
	static Logger _LOG = Logger.getLogger(MinimalTreeExtractor.class);

	private List<String> missingTargets = new ArrayList<String>();

	/**
	 * @param targets taxon ids or labels
	 * @return a new tree, or null if none of the targets is in `tree`
	 */
	public Tree extractMinimal(Tree tree, Collection<String> targets) {
		THashSet<String> wanted = new THashSet<String>(targets);
		THashSet<String> found = new THashSet<String>();

		// copy standing for each processed node, or no entry if nothing below it is kept
		THashMap<TreeNode, TreeNode> kept = new THashMap<TreeNode, TreeNode>();
		// length of spliced-out edges still to be added above a kept copy
		THashMap<TreeNode, Double> pending = new THashMap<TreeNode, Double>();

		TreeNode top = null;
		for (TreeNode n : tree.nodes(NodeOrder.POSTORDER)) {
			boolean isTarget = false;
			if (n.getTaxonId() != null && wanted.contains(n.getTaxonId())) {
				found.add(n.getTaxonId());
				isTarget = true;
			}
			if (n.hasName() && wanted.contains(n.getName())) {
				found.add(n.getName());
				isTarget = true;
			}
			ArrayList<TreeNode> keptChildren = new ArrayList<TreeNode>();
			for (TreeNode c : n.getChildren()) {
				TreeNode k = kept.remove(c);
				if (k != null) {
					keptChildren.add(k);
				}
			}
			if (isTarget || keptChildren.size() > 1) {
				TreeNode copy = n.copyShallow();
				for (TreeNode k : keptChildren) {
					Double extra = pending.remove(k);
					if (extra != null) {
						k.setBL(k.hasBranchLength() ? k.getBL() + extra : extra);
					}
					copy.addChild(k);
				}
				kept.put(n, copy);
				top = copy;
			} else if (keptChildren.size() == 1) {
				TreeNode k = keptChildren.get(0);
				if (n.hasBranchLength()) {
					Double extra = pending.get(k);
					pending.put(k, (extra == null) ? n.getBL() : extra + n.getBL());
				}
				kept.put(n, k);
				top = k;
			}
		}

		TreeSet<String> missing = new TreeSet<String>(wanted);
		missing.removeAll(found);
		missingTargets = new ArrayList<String>(missing);
		if (!missing.isEmpty()) {
			_LOG.warn("Could not find the following taxa: " + StringUtils.join(missing, ", "));
		}
		if (found.isEmpty()) {
			return null;
		}
		return new Tree(top);
	}

	/**
	 * @return the targets of the last extraction that were not found, sorted
	 */
	public List<String> getMissingTargets() {
		return Collections.unmodifiableList(missingTargets);
	}
}
