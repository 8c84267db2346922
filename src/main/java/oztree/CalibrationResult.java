package oztree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a calibration run did: how many constraints were applied, which could not be, and which
 * earlier constraints were overridden by later ones on the same or an enclosing clade.
 */
public class CalibrationResult {

	public static class Failure {
		private final CalibrationConstraint constraint;
		private final String reason;

		Failure(CalibrationConstraint constraint, String reason) {
			this.constraint = constraint;
			this.reason = reason;
		}

		public CalibrationConstraint getConstraint() {return constraint;}

		public String getReason() {return reason;}

		@Override
		public String toString() {
			return constraint + ": " + reason;
		}
	}

	public static class Superseded {
		private final CalibrationConstraint earlier;
		private final CalibrationConstraint later;

		Superseded(CalibrationConstraint earlier, CalibrationConstraint later) {
			this.earlier = earlier;
			this.later = later;
		}

		public CalibrationConstraint getEarlier() {return earlier;}

		public CalibrationConstraint getLater() {return later;}

		@Override
		public String toString() {
			return earlier + " overridden by " + later;
		}
	}

	private int appliedCount = 0;
	private final ArrayList<Failure> failures = new ArrayList<Failure>();
	private final ArrayList<Superseded> superseded = new ArrayList<Superseded>();

	void applied() {
		appliedCount++;
	}

	void failed(CalibrationConstraint c, String reason) {
		failures.add(new Failure(c, reason));
	}

	void superseded(CalibrationConstraint earlier, CalibrationConstraint later) {
		superseded.add(new Superseded(earlier, later));
	}

	public int getAppliedCount() {
		return appliedCount;
	}

	public List<Failure> getFailures() {
		return Collections.unmodifiableList(failures);
	}

	public List<Superseded> getSuperseded() {
		return Collections.unmodifiableList(superseded);
	}
}
