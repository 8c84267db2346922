package oztree;

import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import oztree.constants.GeneralConstants;
import oztree.exceptions.DataFormatException;
import oztree.exceptions.MultipleHitsException;
import oztree.exceptions.TaxonNotFoundException;
import oztree.exceptions.TreeBuildException;
import oztree.tree.NewickFormatter;
import oztree.tree.NewickReader;
import oztree.tree.NewickWriter;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

public class MainRunner {

	/*
	 * Positional arguments and --key=value options of one command line. A bare --flag is stored
	 * with the value "true".
	 */
	static class CommandLine {
		final List<String> positional = new ArrayList<String>();
		final HashMap<String, String> options = new HashMap<String, String>();

		CommandLine(String[] args) {
			for (int i = 1; i < args.length; i++) {
				String a = args[i];
				if (a.startsWith("--")) {
					int eq = a.indexOf('=');
					if (eq < 0) {
						options.put(a.substring(2), "true");
					} else {
						options.put(a.substring(2, eq), a.substring(eq + 1));
					}
				} else {
					positional.add(a);
				}
			}
		}

		String get(String key) {
			return options.get(key);
		}

		File getFile(String key) {
			String v = options.get(key);
			return (v == null) ? null : new File(v);
		}

		boolean has(String key) {
			return options.containsKey(key);
		}
	}

	private final NewickReader reader = new NewickReader();

	/// @returns 0 for success, 1 for poorly formed command
	public int build(String[] args) throws IOException, DataFormatException, TreeBuildException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() != 1) {
			System.out.println("arguments should be: skeleton.PHY [--reference=file] [--mapping=file] [--parts=dir] "
					+ "[--calibration=file] [--nodeages=file] [--out=file] [--report=file] [--epsilon=x] [--precision=n] [--nofix] [--strict] [--noresolve]");
			return 1;
		}
		BuildOptions options = new BuildOptions();
		options.setReferenceFile(cl.getFile("reference"));
		options.setBespokeMappingFile(cl.getFile("mapping"));
		options.setPartsFolder(cl.getFile("parts"));
		options.setCalibrationFile(cl.getFile("calibration"));
		options.setNodeAgesFile(cl.getFile("nodeages"));
		options.setOutputFile(cl.getFile("out"));
		options.setReportFile(cl.getFile("report"));
		options.setFixUltrametricity(!cl.has("nofix"));
		options.setFailOnInvalid(cl.has("strict"));
		options.setAllowUnresolved(!cl.has("noresolve"));
		try {
			if (cl.has("epsilon")) {
				options.setEpsilon(Double.parseDouble(cl.get("epsilon")));
			}
			if (cl.has("precision")) {
				options.setPrecision(Integer.parseInt(cl.get("precision")));
			}
		} catch (IllegalArgumentException iae) {
			System.err.println("Bad option value: " + iae.getMessage());
			return 1;
		}

		File skeleton = new File(cl.positional.get(0));
		if (!skeleton.exists()) {
			System.err.println("Could not open the skeleton file '" + skeleton + "'. Exiting...");
			return -1;
		}
		BuildReport report = new TreeBuilder().build(skeleton, options);
		if (options.getOutputFile() == null) {
			NewickWriter writer = new NewickWriter();
			writer.setPrecision(options.getPrecision());
			System.out.println(writer.write(report.getTree()));
		}
		if (options.getReportFile() == null) {
			System.err.println(report.toJSON().toJSONString());
		}
		return 0;
	}

	/// @returns 0 for success, 1 for poorly formed command
	public int graft(String[] args) throws IOException, DataFormatException, TreeBuildException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 1 || cl.positional.size() > 3) {
			System.out.println("arguments should be: skeleton.PHY [reference.tre] [outfile] [--mapping=file] [--parts=dir]");
			return 1;
		}
		File skeletonFile = new File(cl.positional.get(0));
		Tree skeleton = reader.readTree(skeletonFile);
		ReferenceIndex index = null;
		if (cl.positional.size() > 1) {
			index = ReferenceIndex.build(reader.readTree(new File(cl.positional.get(1))));
		}
		File parts = cl.getFile("parts");
		BespokeTreeLibrary library = BespokeTreeLibrary.empty();
		if (cl.has("mapping")) {
			library = BespokeTreeLibrary.fromMappingFile(cl.getFile("mapping"),
					(parts != null) ? parts : skeletonFile.getAbsoluteFile().getParentFile());
		} else if (parts != null) {
			library = BespokeTreeLibrary.fromDirectory(parts);
		}
		GraftResult result = new GraftEngine().graft(skeleton, index, library);
		writeTree(result.getTree(), cl.positional.size() > 2 ? new File(cl.positional.get(2)) : null);
		if (result.getUnresolvedCount() > 0) {
			System.err.println(result.getUnresolvedCount() + " unresolved graft point(s): " + StringUtils.join(result.getUnresolved(), ", "));
		}
		return 0;
	}

	/// @returns 0 for success, 1 for poorly formed command
	public int calibrate(String[] args) throws IOException, DataFormatException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 2 || cl.positional.size() > 3) {
			System.out.println("arguments should be: treefile constraints.mrca [outfile]");
			return 1;
		}
		Tree tree = reader.readTree(new File(cl.positional.get(0)));
		List<CalibrationConstraint> constraints = new CalibrationReader().readFile(new File(cl.positional.get(1)));
		CalibrationResult result = new CalibrationEngine().calibrate(tree, constraints);
		writeTree(tree, cl.positional.size() > 2 ? new File(cl.positional.get(2)) : null);
		for (CalibrationResult.Failure f : result.getFailures()) {
			System.err.println("not applied: " + f);
		}
		for (CalibrationResult.Superseded s : result.getSuperseded()) {
			System.err.println("superseded: " + s);
		}
		return 0;
	}

	/// @returns 0 for success, 1 for poorly formed command, 3 if the root could not be dated
	public int date(String[] args) throws IOException, DataFormatException, TreeBuildException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 2 || cl.positional.size() > 3) {
			System.out.println("arguments should be: treefile node_ages.json [outfile]");
			return 1;
		}
		Tree tree = reader.readTree(new File(cl.positional.get(0)));
		boolean dated = NodeAgeDating.readFile(new File(cl.positional.get(1))).date(tree);
		writeTree(tree, cl.positional.size() > 2 ? new File(cl.positional.get(2)) : null);
		return dated ? 0 : 3;
	}

	/// @returns 0 if ultrametric, 1 for poorly formed command, 3 if not ultrametric
	public int checkUltrametric(String[] args) throws IOException, DataFormatException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 1) {
			System.out.println("arguments should be: treefile [treefile ...] [--epsilon=x] [--print_details]");
			return 1;
		}
		double epsilon = GeneralConstants.ULTRAMETRIC_TOLERANCE.doubleValue();
		if (cl.has("epsilon")) {
			epsilon = Double.parseDouble(cl.get("epsilon"));
		}
		UltrametricityChecker checker = new UltrametricityChecker();
		int ret = 0;
		for (String path : cl.positional) {
			System.out.println("====== " + new File(path).getName());
			Tree tree = reader.readTree(new File(path));
			if (cl.has("print_details")) {
				TObjectDoubleHashMap<TreeNode> depths = checker.leafDepths(tree);
				for (TreeNode leaf : tree.externalNodes()) {
					if (depths.containsKey(leaf)) {
						System.out.println(leaf + ": " + depths.get(leaf));
					}
				}
			}
			List<LeafPair> pairs = checker.check(tree, epsilon, 1);
			if (pairs.isEmpty()) {
				System.out.println("Ultrametric");
			} else {
				System.out.println("Not ultrametric! " + pairs.get(0));
				ret = 3;
			}
		}
		return ret;
	}

	/// @returns 0 for success, 1 for poorly formed command, 3 if some nodes could not be fixed
	public int fixUltrametric(String[] args) throws IOException, DataFormatException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 1 || cl.positional.size() > 2) {
			System.out.println("arguments should be: treefile [outfile] [--age=expected_age [--maxadjust=x]]");
			return 1;
		}
		Tree tree = reader.readTree(new File(cl.positional.get(0)));
		UltrametricityFixer fixer = new UltrametricityFixer();
		FixResult result;
		if (cl.has("age")) {
			double maxAdjust = GeneralConstants.MAX_LEAF_ADJUSTMENT.doubleValue();
			if (cl.has("maxadjust")) {
				maxAdjust = Double.parseDouble(cl.get("maxadjust"));
			}
			result = fixer.fixToAge(tree, Double.parseDouble(cl.get("age")), maxAdjust);
		} else {
			result = fixer.fix(tree);
		}
		writeTree(tree, cl.positional.size() > 1 ? new File(cl.positional.get(1)) : null);
		for (FixResult.Unfixable u : result.getUnfixable()) {
			System.err.println("could not fix " + u);
		}
		return result.isComplete() ? 0 : 3;
	}

	/// @returns 0 for success, 1 for poorly formed command
	public int extractSubtrees(String[] args) throws IOException, DataFormatException, TreeBuildException, TaxonNotFoundException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 3) {
			System.out.println("arguments should be: reference.tre output_dir file1.PHY [file2.PHY ...] [--strict]");
			return 1;
		}
		File referenceFile = new File(cl.positional.get(0));
		if (!referenceFile.isFile()) {
			System.err.println("Could not find the reference tree file '" + referenceFile + "'. Exiting...");
			return -1;
		}
		ArrayList<Tree> skeletons = new ArrayList<Tree>();
		for (String path : cl.positional.subList(2, cl.positional.size())) {
			skeletons.add(reader.readTree(new File(path)));
		}
		ReferenceIndex index = ReferenceIndex.build(reader.readTree(referenceFile));
		List<File> written = new SubtreeExporter(cl.has("strict"), new NewickWriter()).export(skeletons, index, new File(cl.positional.get(1)));
		System.out.println("wrote " + written.size() + " subtree file(s)");
		return 0;
	}

	/// @returns 0 for success, 1 for poorly formed command, 3 if no taxon was found
	public int extractMinimal(String[] args) throws IOException, DataFormatException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 2) {
			System.out.println("arguments should be: treefile taxon [taxon ...] [--out=file]");
			return 1;
		}
		Tree tree = reader.readTree(new File(cl.positional.get(0)));
		MinimalTreeExtractor extractor = new MinimalTreeExtractor();
		Tree minimal = extractor.extractMinimal(tree, cl.positional.subList(1, cl.positional.size()));
		if (minimal == null) {
			System.err.println("none of the taxa were found");
			return 3;
		}
		writeTree(minimal, cl.getFile("out"));
		return 0;
	}

	/// @returns 0 for success, 1 for poorly formed command, 3 if no taxon was found
	public int extractTrees(String[] args) throws IOException, DataFormatException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 1 || cl.positional.size() > 2 || StringUtils.isBlank(cl.get("taxa"))) {
			System.out.println("arguments should be: treefile [outfile] --taxa=taxon1,taxon2,... [--exclude=taxon1,...] [--ancestors=n]");
			return 1;
		}
		List<String> targets = Arrays.asList(StringUtils.split(cl.get("taxa"), ','));
		List<String> excluded = new ArrayList<String>();
		if (cl.has("exclude")) {
			excluded.addAll(Arrays.asList(StringUtils.split(cl.get("exclude"), ',')));
		}
		int ancestors = 0;
		if (cl.has("ancestors")) {
			ancestors = Integer.parseInt(cl.get("ancestors"));
			if (ancestors < 0) {
				System.err.println("Bad option value: --ancestors cannot be negative");
				return 1;
			}
		}
		Tree tree = reader.readTree(new File(cl.positional.get(0)));
		Map<String, Tree> found = new SubtreeExtractor().extractTrees(tree, targets, excluded, ancestors);
		if (found.isEmpty()) {
			System.err.println("none of the taxa were found");
			return 3;
		}
		NewickWriter writer = new NewickWriter();
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, Tree> e : found.entrySet()) {
			// a lone tree is written bare, several are each prefixed by their key
			if (found.size() > 1) {
				sb.append(e.getKey()).append(": ");
			}
			sb.append(writer.write(e.getValue())).append('\n');
		}
		if (cl.positional.size() > 1) {
			FileUtils.writeStringToFile(new File(cl.positional.get(1)), sb.toString(), StandardCharsets.UTF_8);
		} else {
			System.out.print(sb);
		}
		return 0;
	}

	/// @returns 0 for success, 1 for poorly formed command
	public int format(String[] args) throws IOException, DataFormatException {
		CommandLine cl = new CommandLine(args);
		if (cl.positional.size() < 1 || cl.positional.size() > 2) {
			System.out.println("arguments should be: treefile [outfile] [--indent=n]");
			return 1;
		}
		int indent = GeneralConstants.INDENT_SPACES.intValue();
		if (cl.has("indent")) {
			indent = Integer.parseInt(cl.get("indent"));
		}
		Tree tree = reader.readTree(new File(cl.positional.get(0)));
		NewickFormatter formatter = new NewickFormatter(indent);
		if (cl.positional.size() > 1) {
			try (Writer w = Files.newBufferedWriter(new File(cl.positional.get(1)).toPath(), StandardCharsets.UTF_8)) {
				formatter.format(tree, w);
			}
		} else {
			Writer w = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
			formatter.format(tree, w);
		}
		return 0;
	}

	private void writeTree(Tree tree, File outFile) throws IOException {
		NewickWriter writer = new NewickWriter();
		if (outFile == null) {
			System.out.println(writer.write(tree));
		} else {
			writer.write(tree, outFile);
		}
	}

	public static void printHelp() {
		System.out.println("==========================");
		System.out.println("usage: oztree-build is run as:");
		System.out.println("");
		System.out.println("build skeleton.PHY [--reference=file] [--mapping=file] [--parts=dir] [--calibration=file] [--nodeages=file]");
		System.out.println("      [--out=file] [--report=file] [--epsilon=x] [--precision=n] [--nofix] [--strict] [--noresolve]");
		System.out.println("graft skeleton.PHY [reference.tre] [outfile] [--mapping=file] [--parts=dir]");
		System.out.println("calibrate treefile constraints.mrca [outfile]");
		System.out.println("date treefile node_ages.json [outfile]");
		System.out.println("checkultrametric treefile [treefile ...] [--epsilon=x] [--print_details]");
		System.out.println("fixultrametric treefile [outfile] [--age=expected_age [--maxadjust=x]]");
		System.out.println("extractsubtrees reference.tre output_dir file1.PHY [file2.PHY ...] [--strict]");
		System.out.println("extractminimal treefile taxon [taxon ...] [--out=file]");
		System.out.println("extracttrees treefile [outfile] --taxa=taxon1,taxon2,... [--exclude=taxon1,...] [--ancestors=n]");
		System.out.println("format treefile [outfile] [--indent=n]\n");
	}

	public static int run(String[] args) {
		if (args.length < 1) {
			printHelp();
			return 1;
		}
		String command = args[0];
		if (command.compareTo("help") == 0 || args[0].equals("-h") || args[0].equals("--help")) {
			printHelp();
			return 0;
		}
		int cmdReturnCode = 0;
		String action = "Command \"" + command + "\"";
		try {
			MainRunner mr = new MainRunner();

			if (command.compareTo("build") == 0) {
				cmdReturnCode = mr.build(args);
			} else if (command.compareTo("graft") == 0) {
				cmdReturnCode = mr.graft(args);
			} else if (command.compareTo("calibrate") == 0) {
				cmdReturnCode = mr.calibrate(args);
			} else if (command.compareTo("date") == 0) {
				cmdReturnCode = mr.date(args);
			} else if (command.compareTo("checkultrametric") == 0) {
				cmdReturnCode = mr.checkUltrametric(args);
			} else if (command.compareTo("fixultrametric") == 0) {
				cmdReturnCode = mr.fixUltrametric(args);
			} else if (command.compareTo("extractsubtrees") == 0) {
				cmdReturnCode = mr.extractSubtrees(args);
			} else if (command.compareTo("extractminimal") == 0) {
				cmdReturnCode = mr.extractMinimal(args);
			} else if (command.compareTo("extracttrees") == 0) {
				cmdReturnCode = mr.extractTrees(args);
			} else if (command.compareTo("format") == 0) {
				cmdReturnCode = mr.format(args);
			} else {
				System.err.println("Unrecognized command \"" + command + "\"");
				cmdReturnCode = 2;
			}
		} catch (TaxonNotFoundException tnfx) {
			tnfx.reportFailedAction(System.err, action);
			cmdReturnCode = -1;
		} catch (TreeBuildException tbx) {
			tbx.reportFailedAction(System.err, action);
			cmdReturnCode = -1;
		} catch (DataFormatException dfx) {
			dfx.reportFailedAction(System.err, action);
			cmdReturnCode = -1;
		} catch (MultipleHitsException mhx) {
			System.err.println(action + " failed. " + mhx.getMessage());
			cmdReturnCode = -1;
		} catch (NumberFormatException nfx) {
			System.err.println(action + " failed. Could not read a number: " + nfx.getMessage());
			cmdReturnCode = 1;
		} catch (IOException iox) {
			System.err.println(action + " failed. " + iox.toString());
			cmdReturnCode = -1;
		}
		if (cmdReturnCode == 2) {
			printHelp();
		}
		return cmdReturnCode;
	}

	/**
	 * @param args
	 */
	public static void main(String[] args) {
		System.exit(run(args));
	}
}
