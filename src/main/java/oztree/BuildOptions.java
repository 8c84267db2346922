package oztree;

import java.io.File;

import oztree.constants.GeneralConstants;

/**
 * Settings for one TreeBuilder run. Anything left unset takes its default from GeneralConstants.
 */
public class BuildOptions {

	private File referenceFile = null;
	private File bespokeMappingFile = null;
	private File partsFolder = null;
	private File calibrationFile = null;
	private File nodeAgesFile = null;
	private File outputFile = null;
	private File reportFile = null;
	private double epsilon = GeneralConstants.ULTRAMETRIC_TOLERANCE.doubleValue();
	private boolean fixUltrametricity = true;
	private boolean allowUnresolved = true;
	private boolean failOnInvalid = false;
	private int precision = -1;

	/** the reference tree to graft from; null to attach bespoke trees only */
	public File getReferenceFile() {return referenceFile;}

	public void setReferenceFile(File f) {this.referenceFile = f;}

	/** JSON token mapping for bespoke trees; null to map the parts folder by file name */
	public File getBespokeMappingFile() {return bespokeMappingFile;}

	public void setBespokeMappingFile(File f) {this.bespokeMappingFile = f;}

	/** folder holding bespoke tree files; defaults to the skeleton's folder */
	public File getPartsFolder() {return partsFolder;}

	public void setPartsFolder(File f) {this.partsFolder = f;}

	/** calibration statements; defaults to the skeleton's .mrca sidecar when one exists */
	public File getCalibrationFile() {return calibrationFile;}

	public void setCalibrationFile(File f) {this.calibrationFile = f;}

	/** node_ages.json; when set, branch lengths are rebuilt from node dates before calibration */
	public File getNodeAgesFile() {return nodeAgesFile;}

	public void setNodeAgesFile(File f) {this.nodeAgesFile = f;}

	public File getOutputFile() {return outputFile;}

	public void setOutputFile(File f) {this.outputFile = f;}

	public File getReportFile() {return reportFile;}

	public void setReportFile(File f) {this.reportFile = f;}

	public double getEpsilon() {return epsilon;}

	public void setEpsilon(double epsilon) {
		if (!(epsilon >= 0)) {
			throw new IllegalArgumentException("tolerance must be a non-negative number, not " + epsilon);
		}
		this.epsilon = epsilon;
	}

	public boolean isFixUltrametricity() {return fixUltrametricity;}

	public void setFixUltrametricity(boolean b) {this.fixUltrametricity = b;}

	/** keep going when graft points stay unresolved */
	public boolean isAllowUnresolved() {return allowUnresolved;}

	public void setAllowUnresolved(boolean b) {this.allowUnresolved = b;}

	/** throw instead of only reporting when the finished tree fails validation */
	public boolean isFailOnInvalid() {return failOnInvalid;}

	public void setFailOnInvalid(boolean b) {this.failOnInvalid = b;}

	/** decimal places for written branch lengths; negative for exact output */
	public int getPrecision() {return precision;}

	public void setPrecision(int p) {this.precision = p;}
}
