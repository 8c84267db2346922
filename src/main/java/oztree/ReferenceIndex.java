package oztree;

import gnu.trove.map.hash.THashMap;
import gnu.trove.set.hash.THashSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.Stack;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import oztree.exceptions.AmbiguousTaxonException;
import oztree.exceptions.DuplicateTaxonException;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Lookup of clades in the reference tree by taxon id or, failing that, by label.
 *
 * The index is built once and never changes the tree it wraps. Extraction hands out deep
 * copies, so one index can serve any number of grafting runs.
 */
public class ReferenceIndex {
	static Logger _LOG = Logger.getLogger(ReferenceIndex.class);

	private final Tree reference;
	private final THashMap<String, TreeNode> byId;
	private final THashMap<String, TreeNode> byLabel;
	private final THashSet<String> ambiguousLabels;

	private ReferenceIndex(Tree reference) {
		this.reference = reference;
		this.byId = new THashMap<String, TreeNode>();
		this.byLabel = new THashMap<String, TreeNode>();
		this.ambiguousLabels = new THashSet<String>();
	}

	/**
	 * Indexes every node of `reference` in a single pass.
	 *
	 * @throws DuplicateTaxonException if two nodes share a taxon id, or two nodes without an id
	 *		share a label
	 */
	public static ReferenceIndex build(Tree reference) throws DuplicateTaxonException {
		ReferenceIndex index = new ReferenceIndex(reference);
		TreeSet<String> duplicates = new TreeSet<String>();
		THashSet<String> unidentifiedLabels = new THashSet<String>();
		Stack<TreeNode> stack = new Stack<TreeNode>();
		stack.push(reference.getRoot());
		while (!stack.isEmpty()) {
			TreeNode cur = stack.pop();
			for (int i = cur.getChildCount() - 1; i >= 0; i--) {
				stack.push(cur.getChild(i));
			}
			String id = cur.getTaxonId();
			if (id != null) {
				if (index.byId.put(id, cur) != null) {
					duplicates.add(id);
				}
			} else if (cur.hasName() && !unidentifiedLabels.add(cur.getName())) {
				duplicates.add(cur.getName());
			}
			if (cur.hasName()) {
				String label = cur.getName();
				if (index.byLabel.containsKey(label)) {
					index.ambiguousLabels.add(label);
				} else {
					index.byLabel.put(label, cur);
				}
			}
		}
		if (!duplicates.isEmpty()) {
			throw new DuplicateTaxonException("reference tree", duplicates);
		}
		_LOG.info("indexed " + index.byId.size() + " identified and " + index.byLabel.size() + " labelled reference nodes");
		if (!index.ambiguousLabels.isEmpty()) {
			_LOG.debug(index.ambiguousLabels.size() + " labels are shared by several identified nodes");
		}
		return index;
	}

	public Tree getReferenceTree() {
		return reference;
	}

	public int size() {
		return byId.size();
	}

	public boolean contains(String key) {
		return byId.containsKey(key) || byLabel.containsKey(key);
	}

	/**
	 * Finds the node for `key`, trying taxon ids before labels. The returned node belongs to the
	 * reference tree and must not be modified.
	 *
	 * @return the node, or null if nothing carries `key`
	 * @throws AmbiguousTaxonException if `key` is not an id and labels several nodes
	 */
	public TreeNode lookup(String key) {
		TreeNode hit = byId.get(key);
		if (hit != null) {
			return hit;
		}
		if (ambiguousLabels.contains(key)) {
			throw new AmbiguousTaxonException(key);
		}
		return byLabel.get(key);
	}

	public TreeNode extract(String key, Collection<String> excluded) {
		return extract(key, excluded, false);
	}

	/**
	 * Returns a deep copy of the clade for `key`, minus every descendant (and its subtree) whose
	 * id or label appears in `excluded`. The extracted root itself is never dropped.
	 *
	 * @param collapseUnifurcations replace each internal node left with a single child by that
	 *		child, summing the two edges. Never applied to the extracted root.
	 * @return the copy, or null if `key` is not in the index
	 */
	public TreeNode extract(String key, Collection<String> excluded, boolean collapseUnifurcations) {
		TreeNode source = lookup(key);
		if (source == null) {
			return null;
		}
		Set<String> drop = (excluded == null) ? Collections.<String>emptySet() : new THashSet<String>(excluded);
		TreeNode copyRoot = source.copyShallow();
		ArrayList<TreeNode> shrunk = new ArrayList<TreeNode>();
		Stack<TreeNode[]> stack = new Stack<TreeNode[]>();
		stack.push(new TreeNode[] {source, copyRoot});
		int removed = 0;
		while (!stack.isEmpty()) {
			TreeNode[] pair = stack.pop();
			boolean lostChild = false;
			for (TreeNode child : pair[0].getChildren()) {
				if (isExcluded(child, drop)) {
					removed++;
					lostChild = true;
					continue;
				}
				TreeNode childCopy = child.copyShallow();
				pair[1].addChild(childCopy);
				stack.push(new TreeNode[] {child, childCopy});
			}
			if (lostChild && pair[1].getChildCount() == 1 && pair[1] != copyRoot) {
				shrunk.add(pair[1]);
			}
		}
		if (removed > 0 && _LOG.isDebugEnabled()) {
			_LOG.debug("excluded " + removed + " subtree(s) from the copy of '" + key + "'");
		}
		if (collapseUnifurcations) {
			for (TreeNode n : shrunk) {
				collapse(n);
			}
		}
		return copyRoot;
	}

	private static boolean isExcluded(TreeNode node, Set<String> drop) {
		if (drop.isEmpty()) {
			return false;
		}
		return (node.getTaxonId() != null && drop.contains(node.getTaxonId()))
				|| (node.hasName() && drop.contains(node.getName()));
	}

	/**
	 * Splices out the single-child node `n`, moving its edge length onto the child.
	 */
	private static void collapse(TreeNode n) {
		TreeNode child = n.getChild(0);
		TreeNode parent = n.getParent();
		n.removeChild(child);
		if (n.hasBranchLength() || child.hasBranchLength()) {
			child.setBL(n.getBLOrZero() + child.getBLOrZero());
		}
		parent.replaceChild(n, child);
	}
}
