package oztree;

import gnu.trove.set.hash.THashSet;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Stack;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import oztree.exceptions.AmbiguousTaxonException;
import oztree.exceptions.DataFormatException;
import oztree.exceptions.DuplicateTaxonException;
import oztree.exceptions.TreeBuildException;
import oztree.tree.Alias;
import oztree.tree.Directive;
import oztree.tree.ExclusionList;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Replaces the graft points of a skeleton tree with clades taken from the reference tree, or
 * with bespoke trees for name-only tokens.
 *
 * The skeleton is copied first and never modified. A graft point that cannot be filled is left
 * as it is, logged and recorded in the GraftResult; the run carries on.
 */
public class GraftEngine {
	static Logger _LOG = Logger.getLogger(GraftEngine.class);

	private final CalibrationReader calibrationReader = new CalibrationReader();

	public GraftResult graft(Tree skeleton, ReferenceIndex index) throws TreeBuildException, DataFormatException, IOException {
		return graft(skeleton, index, BespokeTreeLibrary.empty());
	}

	/**
	 * @param index the reference index; may be null when only bespoke trees are to be attached
	 * @param library bespoke trees for name-only tokens; their own graft points are filled
	 *		before they are attached
	 * @throws DuplicateTaxonException if one source is asked for at two graft points, or the
	 *		merged tree has two leaves with the same key
	 * @throws TreeBuildException if bespoke trees include each other in a cycle
	 */
	public GraftResult graft(Tree skeleton, ReferenceIndex index, BespokeTreeLibrary library)
			throws TreeBuildException, DataFormatException, IOException {
		Tree working = skeleton.copy();
		GraftResult result = new GraftResult(working);
		Run run = new Run(index, library, result);
		run.fill(working);
		checkLeafKeys(working);
		if (result.getUnresolvedCount() > 0) {
			_LOG.warn(result.getUnresolvedCount() + " graft point(s) could not be resolved");
		}
		_LOG.info("attached " + result.getGraftedCount() + " clade(s)");
		return result;
	}

	/**
	 * @throws DuplicateTaxonException if two leaves of `tree` share a key
	 */
	public static void checkLeafKeys(Tree tree) throws DuplicateTaxonException {
		THashSet<String> seen = new THashSet<String>();
		TreeSet<String> duplicates = new TreeSet<String>();
		for (TreeNode leaf : tree.externalNodes()) {
			String key = leaf.getKey();
			if (key != null && !seen.add(key)) {
				duplicates.add(key);
			}
		}
		if (!duplicates.isEmpty()) {
			throw new DuplicateTaxonException("grafted tree", duplicates);
		}
	}

	/**
	 * State of one grafting invocation: the sources used so far and the bespoke trees being
	 * expanded.
	 */
	private class Run {
		private final ReferenceIndex index;
		private final BespokeTreeLibrary library;
		private final GraftResult result;
		private final THashSet<String> usedSources = new THashSet<String>();
		private final LinkedHashSet<String> expanding = new LinkedHashSet<String>();

		Run(ReferenceIndex index, BespokeTreeLibrary library, GraftResult result) {
			this.index = index;
			this.library = library;
			this.result = result;
		}

		/**
		 * Fills every graft point of `tree` in place. Attached clades are not walked again.
		 */
		void fill(Tree tree) throws TreeBuildException, DataFormatException, IOException {
			ArrayList<TreeNode> graftPoints = new ArrayList<TreeNode>();
			Stack<TreeNode> stack = new Stack<TreeNode>();
			stack.push(tree.getRoot());
			while (!stack.isEmpty()) {
				TreeNode cur = stack.pop();
				if (cur.isGraftPoint()) {
					graftPoints.add(cur);
				}
				for (int i = cur.getChildCount() - 1; i >= 0; i--) {
					stack.push(cur.getChild(i));
				}
			}
			for (TreeNode placeholder : graftPoints) {
				TreeNode clade = resolve(placeholder);
				if (clade == null) {
					continue;
				}
				if (placeholder.isTheRoot()) {
					tree.setRoot(clade);
				} else {
					placeholder.getParent().replaceChild(placeholder, clade);
				}
				result.incrementGrafted();
			}
		}

		private TreeNode resolve(TreeNode placeholder) throws TreeBuildException, DataFormatException, IOException {
			ExclusionList exclusions = (ExclusionList) placeholder.getDirective(Directive.Kind.EXCLUSION);
			String key;
			boolean nameOnly = false;
			if (exclusions != null && exclusions.getSourceId() != null) {
				key = exclusions.getSourceId();
			} else if (placeholder.getTaxonId() != null) {
				key = placeholder.getTaxonId();
			} else {
				key = placeholder.hasName() ? placeholder.getName() : null;
				nameOnly = true;
			}
			if (key == null) {
				unresolved("<unnamed>", "graft point has neither a name nor an id");
				return null;
			}

			if (nameOnly && library.contains(key)) {
				if (exclusions != null && !exclusions.getExcludedIds().isEmpty()) {
					_LOG.warn("exclusions on bespoke token " + key + " are ignored");
				}
				return attachBespoke(placeholder, key);
			}
			if (index == null) {
				unresolved(key, "no reference tree");
				return null;
			}
			List<String> excluded = (exclusions == null) ? Collections.<String>emptyList() : exclusions.getExcludedIds();
			TreeNode clade;
			try {
				clade = index.extract(key, excluded);
			} catch (AmbiguousTaxonException ate) {
				unresolved(key, "label matches several reference nodes");
				return null;
			}
			if (clade == null) {
				unresolved(key, "not in the reference tree");
				return null;
			}
			claim(key);
			if (_LOG.isDebugEnabled()) {
				_LOG.debug("grafting " + key + " (" + clade.getTipCount() + " tips) at " + placeholder);
			}

			if (placeholder.hasBranchLength()) {
				clade.setBL(placeholder.getBL());
			}
			Alias alias = (Alias) placeholder.getDirective(Directive.Kind.ALIAS);
			if (alias != null) {
				clade.setName(alias.getName());
				clade.setTaxonId(alias.getTaxonId());
			} else if (placeholder.hasName() || placeholder.getTaxonId() != null) {
				clade.setName(placeholder.getName());
				clade.setTaxonId(placeholder.getTaxonId());
			}
			clade.clearDirectives();
			return clade;
		}

		private TreeNode attachBespoke(TreeNode placeholder, String token) throws TreeBuildException, DataFormatException, IOException {
			if (expanding.contains(token)) {
				throw new TreeBuildException("bespoke trees include each other: " + String.join(" -> ", expanding) + " -> " + token);
			}
			claim(token);
			BespokeTreeLibrary.Entry entry = library.getEntry(token);
			Tree included = library.loadTree(token);
			try {
				result.addIncludedConstraints(calibrationReader.readComment(included.getComment(), entry.getFile()));
			} catch (DataFormatException dfe) {
				dfe.setFilePath(library.getFile(token).getPath());
				throw dfe;
			}
			expanding.add(token);
			fill(included);
			expanding.remove(token);

			TreeNode clade = included.getRoot();
			if (entry.hasEdgeLength()) {
				clade.setBL(entry.getEdgeLength());
			} else if (placeholder.hasBranchLength()) {
				clade.setBL(placeholder.getBL());
			}
			if (entry.getTaxon() != null) {
				clade.setName(entry.getTaxon());
			} else if (!clade.hasName() && clade.getTaxonId() == null) {
				clade.setName(placeholder.getName());
			}
			_LOG.debug("attached bespoke tree " + token + " from " + entry.getFile());
			return clade;
		}

		private void claim(String key) throws DuplicateTaxonException {
			if (!usedSources.add(key)) {
				throw new DuplicateTaxonException("graft sources", Collections.singletonList(key));
			}
		}

		private void unresolved(String key, String reason) {
			_LOG.warn("unresolved graft point " + key + ": " + reason);
			result.addUnresolved(key, reason);
		}
	}
}
