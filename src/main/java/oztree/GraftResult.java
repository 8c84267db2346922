package oztree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import oztree.tree.Tree;

/**
 * The merged tree produced by a grafting run, with the graft points that could not be filled.
 */
public class GraftResult {

	/** a graft point left in place, with the reason it could not be filled */
	public static class Unresolved {
		private final String key;
		private final String reason;

		public Unresolved(String key, String reason) {
			this.key = key;
			this.reason = reason;
		}

		public String getKey() {return key;}

		public String getReason() {return reason;}

		@Override
		public String toString() {
			return key + " (" + reason + ")";
		}
	}

	private final Tree tree;
	private int graftedCount;
	private final ArrayList<Unresolved> unresolved;
	private final ArrayList<CalibrationConstraint> includedConstraints;

	public GraftResult(Tree tree) {
		this.tree = tree;
		this.graftedCount = 0;
		this.unresolved = new ArrayList<Unresolved>();
		this.includedConstraints = new ArrayList<CalibrationConstraint>();
	}

	public Tree getTree() {
		return tree;
	}

	public int getGraftedCount() {
		return graftedCount;
	}

	void incrementGrafted() {
		graftedCount++;
	}

	public List<Unresolved> getUnresolved() {
		return Collections.unmodifiableList(unresolved);
	}

	public int getUnresolvedCount() {
		return unresolved.size();
	}

	void addUnresolved(String key, String reason) {
		unresolved.add(new Unresolved(key, reason));
	}

	/**
	 * @return calibration statements found in the comment blocks of the bespoke trees that were
	 *		attached, in the order the trees were read
	 */
	public List<CalibrationConstraint> getIncludedConstraints() {
		return Collections.unmodifiableList(includedConstraints);
	}

	void addIncludedConstraints(List<CalibrationConstraint> constraints) {
		includedConstraints.addAll(constraints);
	}
}
