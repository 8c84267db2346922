package oztree;

import gnu.trove.set.hash.THashSet;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import oztree.exceptions.TreeBuildException;
import oztree.tree.NodeOrder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Checks a finished tree: every leaf has a key and no key is used twice, no graft point is left
 * (unless allowed), no branch length is negative, and all leaves are equally far from the root.
 */
public class TreeValidator {
	static Logger _LOG = Logger.getLogger(TreeValidator.class);

	private static final int MAX_REPORTED_PAIRS = 10;

	private final double epsilon;
	private final boolean allowUnresolved;

	public TreeValidator(double epsilon, boolean allowUnresolved) {
		this.epsilon = epsilon;
		this.allowUnresolved = allowUnresolved;
	}

	/**
	 * @return a description of each problem found; empty if the tree is sound
	 */
	public List<String> validate(Tree tree) {
		ArrayList<String> problems = new ArrayList<String>();
		THashSet<String> keys = new THashSet<String>();
		int anonymous = 0;
		int unresolved = 0;
		for (TreeNode n : tree.nodes(NodeOrder.PREORDER)) {
			if (n.isGraftPoint()) {
				unresolved++;
				if (!allowUnresolved) {
					problems.add("unresolved graft point " + n);
				}
			}
			if (n.hasBranchLength() && n.getBL() < 0) {
				problems.add("negative branch length " + n.getBL() + " above " + n);
			}
			if (n.isExternal()) {
				String key = n.getKey();
				if (key == null) {
					anonymous++;
				} else if (!keys.add(key)) {
					problems.add("leaf key " + key + " is used more than once");
				}
			}
		}
		if (anonymous > 0) {
			problems.add(anonymous + " leaf node(s) have neither a name nor an id");
		}
		List<LeafPair> pairs = new UltrametricityChecker().check(tree, epsilon, MAX_REPORTED_PAIRS);
		if (!pairs.isEmpty()) {
			problems.add("not ultrametric within " + epsilon + ": " + StringUtils.join(pairs, "; "));
		}
		if (unresolved > 0 && allowUnresolved) {
			_LOG.info(unresolved + " unresolved graft point(s) left in the tree");
		}
		return problems;
	}

	public void validateOrThrow(Tree tree) throws TreeBuildException {
		List<String> problems = validate(tree);
		if (!problems.isEmpty()) {
			throw new TreeBuildException("tree failed validation: " + StringUtils.join(problems, "\n\t"));
		}
	}
}
