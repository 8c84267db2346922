package oztree.constants;

/**
 * A general-purpose container for default values used across the build. The data objects themselves are
 * stored in the `value` parameter, and the type is indicated by the type stored in `type`. Most of these
 * can be overridden per run through BuildOptions.
 *
 */
public enum GeneralConstants {

	// largest difference between two root-to-leaf path lengths still treated as equal
	ULTRAMETRIC_TOLERANCE (Double.class, 1e-6),

	// largest single leaf edge change allowed when forcing leaves to a fixed age
	MAX_LEAF_ADJUSTMENT (Double.class, 0.000005),

	// separates a taxon name from its stable identifier in a label, e.g. Homo_sapiens_ott770315
	TAXON_ID_PREFIX (String.class, "_ott"),

	// calibration statements for skeleton.PHY are read from skeleton.mrca when present
	CALIBRATION_FILE_EXTENSION (String.class, ".mrca"),

	// extension of exported reference subtrees
	SUBTREE_FILE_EXTENSION (String.class, ".phy"),

	// weight given to the longest-path date when an undated node lies on a tie between paths
	DATING_LONG_PATH_WEIGHT (Double.class, 0.25),

	// 0 spaces imputed dates evenly along a path; positive values push them older, negative younger
	DATING_SPACING_EXPONENT (Double.class, 0.0),

	// interior nodes with a median age below this are treated as undated
	MIN_INTERIOR_AGE (Double.class, 1e-6),

	INDENT_SPACES (Integer.class, 2);

	public final Class<?> type;
	public final Object value;

	GeneralConstants(Class<?> type, Object value) {
		this.type = type;
		this.value = value;
	}

	public double doubleValue() {
		return ((Number) value).doubleValue();
	}

	public int intValue() {
		return ((Number) value).intValue();
	}

	public String stringValue() {
		return (String) value;
	}
}
