package oztree;

/**
 * Fixes the age (depth below it) of the most recent common ancestor of two taxa, e.g. the
 * statement {@code mrca: Homo_sapiens, Pan_troglodytes, fixage=6.5;}
 */
public class CalibrationConstraint {

	private final String taxonA;
	private final String taxonB;
	private final double targetAge;
	private final String source;

	public CalibrationConstraint(String taxonA, String taxonB, double targetAge) {
		this(taxonA, taxonB, targetAge, null);
	}

	/**
	 * @param source where the statement came from, e.g. "Animals.mrca:12"; may be null
	 */
	public CalibrationConstraint(String taxonA, String taxonB, double targetAge, String source) {
		if (Double.isNaN(targetAge) || targetAge < 0) {
			throw new IllegalArgumentException("calibration age must be a non-negative number, not " + targetAge);
		}
		this.taxonA = taxonA;
		this.taxonB = taxonB;
		this.targetAge = targetAge;
		this.source = source;
	}

	public String getTaxonA() {return taxonA;}

	public String getTaxonB() {return taxonB;}

	public double getTargetAge() {return targetAge;}

	public String getSource() {return source;}

	@Override
	public String toString() {
		String s = "mrca: " + taxonA + ", " + taxonB + ", fixage=" + targetAge + ";";
		return (source == null) ? s : s + " (" + source + ")";
	}
}
