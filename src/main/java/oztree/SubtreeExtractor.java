package oztree;

import gnu.trove.set.hash.THashSet;

import java.io.File;
import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Stack;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import oztree.exceptions.DataFormatException;
import oztree.exceptions.TaxonNotFoundException;
import oztree.tree.NewickReader;
import oztree.tree.NodeOrder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Pulls several clades out of one tree in a single walk.
 *
 * A target or an excluded taxon is given either as a name (without its "_ott" suffix) or as a
 * bare taxon id. Each target found yields a copy of its clade, minus every excluded clade
 * inside it, optionally wrapped in copies of its nearest ancestors (each ancestor contributes
 * only its own label and edge, not its other children). A target found more than once is
 * taken where the postorder walk first meets it.
 */
public class SubtreeExtractor {
	static Logger _LOG = Logger.getLogger(SubtreeExtractor.class);

	/**
	 * @param ancestorCount number of enclosing ancestors to wrap each clade in; fewer are used near the root
	 * @return the extracted trees keyed by taxon id, or by name for targets without an id, in the
	 *		order they were found
	 */
	public Map<String, Tree> extractTrees(Tree tree, Collection<String> targets, Collection<String> excluded, int ancestorCount) {
		if (ancestorCount < 0) {
			throw new IllegalArgumentException("the number of ancestors cannot be negative: " + ancestorCount);
		}
		THashSet<String> wanted = new THashSet<String>(targets);
		THashSet<String> skip = new THashSet<String>(excluded);
		LinkedHashMap<String, Tree> found = new LinkedHashMap<String, Tree>();

		for (TreeNode n : tree.nodes(NodeOrder.POSTORDER)) {
			if (wanted.isEmpty()) {
				break;
			}
			if (!isListed(n, wanted)) {
				continue;
			}
			wanted.remove((n.hasName() && wanted.contains(n.getName())) ? n.getName() : n.getTaxonId());

			TreeNode top = prunedCopy(n, skip);
			TreeNode ancestor = n.getParent();
			for (int i = 0; i < ancestorCount && ancestor != null; i++) {
				TreeNode wrapper = ancestor.copyShallow();
				wrapper.addChild(top);
				top = wrapper;
				ancestor = ancestor.getParent();
			}
			found.put(n.getTaxonId() != null ? n.getTaxonId() : n.getName(), new Tree(top));
		}
		if (!wanted.isEmpty()) {
			_LOG.warn("could not find the following taxa: " + StringUtils.join(wanted, ", "));
		}
		return found;
	}

	public Map<String, Tree> extractTrees(Tree tree, Collection<String> targets) {
		return extractTrees(tree, targets, Collections.<String>emptySet(), 0);
	}

	/**
	 * @return the clade of `taxon` in the tree held in `treeFile`
	 * @throws TaxonNotFoundException if the tree has no such taxon
	 */
	public Tree extractTaxonSubtree(File treeFile, String taxon) throws IOException, DataFormatException, TaxonNotFoundException {
		Tree tree = new NewickReader().readTree(treeFile);
		Map<String, Tree> found = extractTrees(tree, Collections.singleton(taxon));
		if (found.isEmpty()) {
			throw new TaxonNotFoundException(taxon);
		}
		return found.values().iterator().next();
	}

	private static boolean isListed(TreeNode n, THashSet<String> names) {
		return (n.hasName() && names.contains(n.getName())) || (n.getTaxonId() != null && names.contains(n.getTaxonId()));
	}

	/*
	 * Copies the clade of `source` leaving out every listed clade below it. A node whose children
	 * are all left out becomes a leaf.
	 */
	private static TreeNode prunedCopy(TreeNode source, THashSet<String> skip) {
		TreeNode copyRoot = source.copyShallow();
		Stack<TreeNode[]> stack = new Stack<TreeNode[]>();
		stack.push(new TreeNode[] {source, copyRoot});
		while (!stack.isEmpty()) {
			TreeNode[] pair = stack.pop();
			for (TreeNode child : pair[0].getChildren()) {
				if (isListed(child, skip)) {
					continue;
				}
				TreeNode childCopy = child.copyShallow();
				pair[1].addChild(childCopy);
				stack.push(new TreeNode[] {child, childCopy});
			}
		}
		return copyRoot;
	}
}
