package oztree;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import oztree.exceptions.TreeBuildException;

public class TreeBuilderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File reference;
	private BuildOptions options;

	private File write(String name, String contents) throws Exception {
		File f = new File(folder.getRoot(), name);
		FileUtils.writeStringToFile(f, contents, StandardCharsets.UTF_8);
		return f;
	}

	private static int intValue(JSONObject json, String key) {
		return ((Number) json.get(key)).intValue();
	}

	@Before
	public void setUp() throws Exception {
		reference = write("reference.tre", "((a_ott1:1,b_ott2:1)Mammalia_ott10:3,c_ott3:2)Life_ott100;");
		options = new BuildOptions();
		options.setReferenceFile(reference);
	}

	@Test
	public void graftsCalibratesAndRepairs() throws Exception {
		File skeleton = write("skeleton.PHY", "[mrca: a_ott1, c_ott3, fixage=10;]\n(Mammalia_ott10@:1,c_ott3@:4)Root;");
		File out = new File(folder.getRoot(), "out.tre");
		File reportFile = new File(folder.getRoot(), "report.json");
		options.setOutputFile(out);
		options.setReportFile(reportFile);

		BuildReport report = new TreeBuilder().build(skeleton, options);
		assertEquals("((a_ott1:2.5,b_ott2:2.5)Mammalia_ott10:7.5,c_ott3:10)Root;\n",
				FileUtils.readFileToString(out, StandardCharsets.UTF_8));
		assertTrue(report.isValid());
		assertEquals("skeleton.PHY", report.getSkeletonName());
		assertEquals(1, report.getConstraintCount());
		assertEquals(1, report.getFixResult().getAdjusted().size());

		JSONObject json = (JSONObject) new JSONParser().parse(FileUtils.readFileToString(reportFile, StandardCharsets.UTF_8));
		assertEquals("skeleton.PHY", json.get("skeleton"));
		assertEquals(2, intValue(json, "grafted"));
		assertEquals(3, intValue(json, "leaves"));
		assertEquals(1, intValue(json, "calibrations_applied"));
		assertEquals(1, intValue(json, "edges_lengthened"));
		assertEquals(Boolean.TRUE, json.get("ultrametric"));
		assertTrue(((JSONArray) json.get("validation_problems")).isEmpty());
	}

	@Test
	public void readsTheSidecarNextToTheSkeleton() throws Exception {
		File skeleton = write("skeleton2.PHY", "(Mammalia_ott10@:1,c_ott3@:4)Root;");
		write("skeleton2.mrca", "# two ages\nmrca: a_ott1, b_ott2, fixage=3;\nmrca: a_ott1, c_ott3, fixage=10;\n");

		BuildReport report = new TreeBuilder().build(skeleton, options);
		assertEquals("((a_ott1:7.5,b_ott2:7.5)Mammalia_ott10:2.5,c_ott3:10)Root;", report.getTree().toString());
		assertEquals(2, report.getCalibrationResult().getAppliedCount());
		assertEquals(1, report.getCalibrationResult().getSuperseded().size());
		assertTrue(report.getFixResult().getAdjusted().isEmpty());
	}

	@Test
	public void explicitCalibrationFileReplacesTheSidecar() throws Exception {
		File skeleton = write("skeleton3.PHY", "(Mammalia_ott10@:1,c_ott3@:4)Root;");
		write("skeleton3.mrca", "mrca: a_ott1, c_ott3, fixage=100;\n");
		options.setCalibrationFile(write("other.mrca", "mrca: a_ott1, b_ott2, fixage=4;\n"));
		options.setFixUltrametricity(false);

		BuildReport report = new TreeBuilder().build(skeleton, options);
		assertEquals("((a_ott1:4,b_ott2:4)Mammalia_ott10:1,c_ott3:4)Root;", report.getTree().toString());
		assertNull(report.getFixResult());
		assertFalse(report.isValid());
		assertFalse(report.getUltrametricViolations().isEmpty());
	}

	@Test
	public void unresolvedGraftPointsAreKeptByDefault() throws Exception {
		File skeleton = write("partial.PHY", "(Mammalia_ott10@:3,Nope_ott999@:4)Root;");
		BuildReport report = new TreeBuilder().build(skeleton, options);
		assertEquals(1, report.getGraftResult().getUnresolvedCount());
		assertEquals("((a_ott1:1,b_ott2:1)Mammalia_ott10:3,Nope_ott999@:4)Root;", report.getTree().toString());
	}

	@Test(expected = TreeBuildException.class)
	public void unresolvedGraftPointsCanBeFatal() throws Exception {
		File skeleton = write("partial.PHY", "(Mammalia_ott10@:3,Nope_ott999@:4)Root;");
		options.setAllowUnresolved(false);
		new TreeBuilder().build(skeleton, options);
	}

	@Test(expected = TreeBuildException.class)
	public void invalidTreeCanBeFatal() throws Exception {
		File skeleton = write("bad.PHY", "(A:1,B:2)R;");
		options.setFixUltrametricity(false);
		options.setFailOnInvalid(true);
		new TreeBuilder().build(skeleton, options);
	}

	@Test
	public void attachesBespokeTreesFromThePartsFolder() throws Exception {
		File parts = folder.newFolder("parts");
		FileUtils.writeStringToFile(new File(parts, "Deuterostomia.PHY"),
				"[mrca: a_ott1, d, fixage=6;]\n(Mammalia_ott10@:1,d:2)Deuterostomia;", StandardCharsets.UTF_8);
		File skeleton = write("base.PHY", "(DEUTEROSTOMIA@:4,e:10)Root;");
		options.setPartsFolder(parts);
		options.setPrecision(3);
		File out = new File(folder.getRoot(), "base.tre");
		options.setOutputFile(out);

		BuildReport report = new TreeBuilder().build(skeleton, options);
		assertEquals(1, report.getConstraintCount());
		assertEquals("(((a_ott1:3,b_ott2:3)Mammalia_ott10:3,d:6)Deuterostomia:4,e:10)Root;\n",
				FileUtils.readFileToString(out, StandardCharsets.UTF_8));
	}

	@Test
	public void nodeAgesRebuildLengthsBeforeCalibration() throws Exception {
		File skeleton = write("dated.PHY", "(Mammalia_ott10@:1,c_ott3@:4)Root;");
		options.setNodeAgesFile(write("node_ages.json",
				"{\"node_ages\": {\"ott10\": [{\"age\": 6}], \"Root\": [{\"age\": \"20\"}, {\"age\": 18}, {\"age\": 22}]}}"));
		File reportFile = new File(folder.getRoot(), "dated.json");
		options.setReportFile(reportFile);

		BuildReport report = new TreeBuilder().build(skeleton, options);
		assertEquals(Boolean.TRUE, report.getDated());
		assertEquals("((a_ott1:6,b_ott2:6)Mammalia_ott10:14,c_ott3:20)Root;", report.getTree().toString());
		assertTrue(report.getFixResult().getAdjusted().isEmpty());
		JSONObject json = (JSONObject) new JSONParser().parse(FileUtils.readFileToString(reportFile, StandardCharsets.UTF_8));
		assertEquals(Boolean.TRUE, json.get("dated"));
	}

	@Test
	public void withoutNodeAgesNothingIsDated() throws Exception {
		BuildReport report = new TreeBuilder().build(write("plain.PHY", "(Mammalia_ott10@:3,c_ott3@:4)Root;"), options);
		assertNull(report.getDated());
		assertFalse(report.toJSON().containsKey("dated"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void toleranceMustNotBeNegative() {
		options.setEpsilon(-1);
	}
}
