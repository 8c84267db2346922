package oztree;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import oztree.tree.Tree;

/**
 * Summary of a TreeBuilder run, written out as JSON for the later pipeline stages.
 */
public class BuildReport {

	private final String skeletonName;
	private Tree tree;
	private GraftResult graftResult;
	private CalibrationResult calibrationResult;
	private FixResult fixResult;
	private List<LeafPair> ultrametricViolations = new ArrayList<LeafPair>();
	private List<String> validationProblems = new ArrayList<String>();
	private int constraintCount = 0;
	private Boolean dated = null;

	public BuildReport(String skeletonName) {
		this.skeletonName = skeletonName;
	}

	public String getSkeletonName() {return skeletonName;}

	public Tree getTree() {return tree;}

	void setTree(Tree tree) {this.tree = tree;}

	public GraftResult getGraftResult() {return graftResult;}

	void setGraftResult(GraftResult r) {this.graftResult = r;}

	public CalibrationResult getCalibrationResult() {return calibrationResult;}

	void setCalibrationResult(CalibrationResult r) {this.calibrationResult = r;}

	/** null when the fixer was not run */
	public FixResult getFixResult() {return fixResult;}

	void setFixResult(FixResult r) {this.fixResult = r;}

	public List<LeafPair> getUltrametricViolations() {return Collections.unmodifiableList(ultrametricViolations);}

	void setUltrametricViolations(List<LeafPair> pairs) {this.ultrametricViolations = new ArrayList<LeafPair>(pairs);}

	public List<String> getValidationProblems() {return Collections.unmodifiableList(validationProblems);}

	void setValidationProblems(List<String> problems) {this.validationProblems = new ArrayList<String>(problems);}

	public int getConstraintCount() {return constraintCount;}

	void setConstraintCount(int n) {this.constraintCount = n;}

	/** null when no node ages were given, otherwise whether the root could be dated */
	public Boolean getDated() {return dated;}

	void setDated(boolean b) {this.dated = b;}

	public boolean isValid() {
		return validationProblems.isEmpty();
	}

	@SuppressWarnings("unchecked")
	public JSONObject toJSON() {
		JSONObject j = new JSONObject();
		j.put("skeleton", skeletonName);
		if (tree != null) {
			j.put("nodes", tree.getNodeCount());
			j.put("leaves", tree.getExternalNodeCount());
		}
		if (graftResult != null) {
			j.put("grafted", graftResult.getGraftedCount());
			JSONArray unresolved = new JSONArray();
			for (GraftResult.Unresolved u : graftResult.getUnresolved()) {
				JSONObject o = new JSONObject();
				o.put("key", u.getKey());
				o.put("reason", u.getReason());
				unresolved.add(o);
			}
			j.put("unresolved", unresolved);
		}
		if (dated != null) {
			j.put("dated", dated);
		}
		j.put("constraints", constraintCount);
		if (calibrationResult != null) {
			j.put("calibrations_applied", calibrationResult.getAppliedCount());
			JSONArray failed = new JSONArray();
			for (CalibrationResult.Failure f : calibrationResult.getFailures()) {
				JSONObject o = new JSONObject();
				o.put("constraint", f.getConstraint().toString());
				o.put("reason", f.getReason());
				failed.add(o);
			}
			j.put("calibrations_failed", failed);
			JSONArray superseded = new JSONArray();
			for (CalibrationResult.Superseded s : calibrationResult.getSuperseded()) {
				JSONObject o = new JSONObject();
				o.put("earlier", s.getEarlier().toString());
				o.put("later", s.getLater().toString());
				superseded.add(o);
			}
			j.put("calibrations_superseded", superseded);
		}
		if (fixResult != null) {
			j.put("edges_lengthened", fixResult.getAdjusted().size());
			JSONArray unfixable = new JSONArray();
			for (FixResult.Unfixable u : fixResult.getUnfixable()) {
				JSONObject o = new JSONObject();
				o.put("node", u.getNode().toString());
				o.put("reason", u.getReason());
				unfixable.add(o);
			}
			j.put("unfixable", unfixable);
		}
		j.put("ultrametric", ultrametricViolations.isEmpty());
		JSONArray violations = new JSONArray();
		for (LeafPair p : ultrametricViolations) {
			violations.add(p.toString());
		}
		j.put("ultrametric_violations", violations);
		JSONArray problems = new JSONArray();
		problems.addAll(validationProblems);
		j.put("validation_problems", problems);
		return j;
	}

	public void write(File f) throws IOException {
		FileUtils.writeStringToFile(f, toJSON().toJSONString() + "\n", StandardCharsets.UTF_8);
	}
}
