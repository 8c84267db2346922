package oztree;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import oztree.constants.GeneralConstants;
import oztree.exceptions.AmbiguousTaxonException;
import oztree.tree.NodeOrder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;
import oztree.tree.TreeUtils;

/**
 * Rescales branch lengths so that the MRCA of each constraint's two taxa sits at the requested
 * age above its deepest leaf.
 *
 * Constraints are applied in list order, in place. Every known branch length strictly below the
 * MRCA is multiplied by the same factor, so the proportions inside the clade are kept and the
 * edge above the MRCA is untouched. A later constraint sees the lengths left by earlier ones,
 * which makes the later one win when clades are nested. An earlier constraint is reported as
 * overridden when a later one rescales its clade from above, or when a later one on an inner
 * clade moves the earlier clade's depth away from its age.
 */
public class CalibrationEngine {
	static Logger _LOG = Logger.getLogger(CalibrationEngine.class);

	private final double epsilon;

	public CalibrationEngine() {
		this(GeneralConstants.ULTRAMETRIC_TOLERANCE.doubleValue());
	}

	/**
	 * @param epsilon how far an earlier clade may drift from its age before it counts as overridden
	 */
	public CalibrationEngine(double epsilon) {
		this.epsilon = epsilon;
	}

	public CalibrationResult calibrate(Tree tree, List<CalibrationConstraint> constraints) {
		CalibrationResult result = new CalibrationResult();
		TaxonLocator locator = new TaxonLocator(tree);
		ArrayList<CalibrationConstraint> appliedConstraints = new ArrayList<CalibrationConstraint>();
		ArrayList<TreeNode> appliedMRCAs = new ArrayList<TreeNode>();

		for (CalibrationConstraint c : constraints) {
			TreeNode a;
			TreeNode b;
			try {
				a = locator.locate(c.getTaxonA());
				b = locator.locate(c.getTaxonB());
			} catch (AmbiguousTaxonException ate) {
				fail(result, c, ate.getMessage());
				continue;
			}
			if (a == null || b == null) {
				String missing = (a == null) ? c.getTaxonA() : c.getTaxonB();
				if (a == null && b == null) {
					missing += ", " + c.getTaxonB();
				}
				fail(result, c, "taxon not found: " + missing);
				continue;
			}
			TreeNode mrca = TreeUtils.getMRCA(a, b);
			double depth = TreeUtils.getGreatestDistanceToTip(mrca);
			if (!(depth > 0)) {
				fail(result, c, "the clade below '" + mrca + "' has no length to rescale");
				continue;
			}
			double factor = c.getTargetAge() / depth;

			// earlier clades enclosing this one that still hold their age
			ArrayList<Integer> enclosing = new ArrayList<Integer>();
			for (int i = 0; i < appliedMRCAs.size(); i++) {
				TreeNode earlier = appliedMRCAs.get(i);
				if (earlier != mrca && TreeUtils.isDescendantOf(mrca, earlier) && holdsAge(earlier, appliedConstraints.get(i))) {
					enclosing.add(i);
				}
			}
			rescaleBelow(mrca, factor);
			if (_LOG.isDebugEnabled()) {
				_LOG.debug("set age of " + mrca + " to " + c.getTargetAge() + " (factor " + factor + ")");
			}

			for (int i = 0; i < appliedMRCAs.size(); i++) {
				if (TreeUtils.isDescendantOf(appliedMRCAs.get(i), mrca)) {
					result.superseded(appliedConstraints.get(i), c);
					_LOG.warn("calibration " + appliedConstraints.get(i) + " is overridden by the later " + c);
				}
			}
			for (int i : enclosing) {
				if (!holdsAge(appliedMRCAs.get(i), appliedConstraints.get(i))) {
					result.superseded(appliedConstraints.get(i), c);
					_LOG.warn("calibration " + appliedConstraints.get(i) + " no longer holds after the later " + c);
				}
			}
			appliedConstraints.add(c);
			appliedMRCAs.add(mrca);
			result.applied();
		}
		_LOG.info("applied " + result.getAppliedCount() + " of " + constraints.size() + " calibration constraint(s)");
		return result;
	}

	/**
	 * Multiplies every known branch length in the subtree of `mrca`, except its own, by `factor`.
	 */
	public static void rescaleBelow(TreeNode mrca, double factor) {
		for (TreeNode n : mrca.getDescendants(NodeOrder.PREORDER)) {
			if (n != mrca && n.hasBranchLength()) {
				n.setBL(n.getBL() * factor);
			}
		}
	}

	private boolean holdsAge(TreeNode mrca, CalibrationConstraint c) {
		return Math.abs(TreeUtils.getGreatestDistanceToTip(mrca) - c.getTargetAge()) <= epsilon;
	}

	private static void fail(CalibrationResult result, CalibrationConstraint c, String reason) {
		_LOG.warn("calibration " + c + " not applied: " + reason);
		result.failed(c, reason);
	}
}
