package oztree;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import oztree.constants.GeneralConstants;
import oztree.exceptions.DataFormatException;
import oztree.exceptions.TreeBuildException;
import oztree.tree.NewickReader;
import oztree.tree.NewickWriter;
import oztree.tree.Tree;

/**
 * Runs the whole build for one skeleton: graft, date, calibrate, repair, check, write.
 *
 * Calibration statements are gathered from the skeleton's leading comment, then from the
 * comments of the bespoke trees attached to it, then from the sidecar file, and applied in that
 * order. Each run reads its own inputs and shares nothing with other runs.
 */
public class TreeBuilder {
	static Logger _LOG = Logger.getLogger(TreeBuilder.class);

	private final NewickReader reader = new NewickReader();
	private final CalibrationReader calibrationReader = new CalibrationReader();

	public BuildReport build(File skeletonFile, BuildOptions options) throws IOException, DataFormatException, TreeBuildException {
		long start = System.currentTimeMillis();
		_LOG.info("building from " + skeletonFile);
		Tree skeleton = reader.readTree(skeletonFile);

		ReferenceIndex index = null;
		if (options.getReferenceFile() != null) {
			_LOG.info("reading reference tree " + options.getReferenceFile());
			index = ReferenceIndex.build(reader.readTree(options.getReferenceFile()));
		}

		File partsFolder = options.getPartsFolder();
		if (partsFolder == null) {
			partsFolder = skeletonFile.getAbsoluteFile().getParentFile();
		}
		BespokeTreeLibrary library;
		if (options.getBespokeMappingFile() != null) {
			library = BespokeTreeLibrary.fromMappingFile(options.getBespokeMappingFile(), partsFolder);
		} else if (options.getPartsFolder() != null) {
			library = BespokeTreeLibrary.fromDirectory(partsFolder);
		} else {
			library = BespokeTreeLibrary.empty();
		}

		List<CalibrationConstraint> sidecar = new ArrayList<CalibrationConstraint>();
		File calibrationFile = options.getCalibrationFile();
		if (calibrationFile == null) {
			File candidate = new File(FilenameUtils.removeExtension(skeletonFile.getPath())
					+ GeneralConstants.CALIBRATION_FILE_EXTENSION.stringValue());
			if (candidate.isFile()) {
				calibrationFile = candidate;
			}
		}
		if (calibrationFile != null) {
			sidecar = calibrationReader.readFile(calibrationFile);
		}

		NodeAgeDating dating = null;
		if (options.getNodeAgesFile() != null) {
			dating = NodeAgeDating.readFile(options.getNodeAgesFile());
		}

		BuildReport report = build(skeleton, skeletonFile.getName(), index, library, dating, sidecar, options);
		if (options.getOutputFile() != null) {
			NewickWriter writer = new NewickWriter();
			writer.setPrecision(options.getPrecision());
			writer.write(report.getTree(), options.getOutputFile());
			_LOG.info("wrote " + options.getOutputFile());
		}
		if (options.getReportFile() != null) {
			report.write(options.getReportFile());
		}
		_LOG.info("build of " + skeletonFile.getName() + " took " + (System.currentTimeMillis() - start) / 1000.0 + " seconds");
		return report;
	}

	/**
	 * The in-memory part of the build. `skeleton` is not modified.
	 *
	 * @param dating node ages to rebuild branch lengths from before calibration; null to keep the lengths
	 * @param sidecar constraints applied after those found in tree comments
	 */
	public BuildReport build(Tree skeleton, String skeletonName, ReferenceIndex index, BespokeTreeLibrary library,
			NodeAgeDating dating, List<CalibrationConstraint> sidecar, BuildOptions options) throws DataFormatException, IOException, TreeBuildException {
		BuildReport report = new BuildReport(skeletonName);

		GraftResult grafted = new GraftEngine().graft(skeleton, index, library);
		report.setGraftResult(grafted);
		if (!options.isAllowUnresolved() && grafted.getUnresolvedCount() > 0) {
			throw new TreeBuildException(grafted.getUnresolvedCount() + " graft point(s) could not be resolved: " + grafted.getUnresolved());
		}
		Tree tree = grafted.getTree();
		report.setTree(tree);

		if (dating != null) {
			report.setDated(dating.date(tree));
		}

		ArrayList<CalibrationConstraint> constraints = new ArrayList<CalibrationConstraint>();
		constraints.addAll(calibrationReader.readComment(skeleton.getComment(), skeletonName));
		constraints.addAll(grafted.getIncludedConstraints());
		constraints.addAll(sidecar);
		report.setConstraintCount(constraints.size());
		report.setCalibrationResult(new CalibrationEngine(options.getEpsilon()).calibrate(tree, constraints));

		if (options.isFixUltrametricity()) {
			report.setFixResult(new UltrametricityFixer().fix(tree));
		}
		report.setUltrametricViolations(new UltrametricityChecker().check(tree, options.getEpsilon(), 100));

		TreeValidator validator = new TreeValidator(options.getEpsilon(), options.isAllowUnresolved());
		List<String> problems = validator.validate(tree);
		report.setValidationProblems(problems);
		for (String p : problems) {
			_LOG.warn(p);
		}
		if (options.isFailOnInvalid() && !problems.isEmpty()) {
			throw new TreeBuildException("tree failed validation: " + StringUtils.join(problems, "\n\t"));
		}
		return report;
	}
}
