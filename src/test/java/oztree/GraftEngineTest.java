package oztree;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import oztree.exceptions.DuplicateTaxonException;
import oztree.exceptions.TreeBuildException;
import oztree.tree.NewickReader;
import oztree.tree.Tree;

public class GraftEngineTest {

	private static final String REFERENCE = "((a_ott1:1,b_ott2:1)Mammalia_ott10:3,c_ott3:2)Life_ott100;";

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private NewickReader reader;
	private ReferenceIndex index;
	private GraftEngine engine;

	@Before
	public void setUp() throws Exception {
		reader = new NewickReader();
		index = ReferenceIndex.build(reader.readTree(REFERENCE));
		engine = new GraftEngine();
	}

	private GraftResult graft(String skeleton) throws Exception {
		return engine.graft(reader.readTree(skeleton), index);
	}

	@Test
	public void replacesPlaceholderKeepingItsEdge() throws Exception {
		GraftResult result = graft("(Mammalia_ott10@:5,Other:7)Root;");
		assertEquals("((a_ott1:1,b_ott2:1)Mammalia_ott10:5,Other:7)Root;", result.getTree().toString());
		assertEquals(1, result.getGraftedCount());
		assertEquals(0, result.getUnresolvedCount());
	}

	@Test
	public void usesSourceEdgeWhenPlaceholderHasNone() throws Exception {
		assertEquals("((a_ott1:1,b_ott2:1)Mammals_ott10:3,x)R;", graft("(Mammals_ott10@,x)R;").getTree().toString());
	}

	@Test
	public void sourceWithExclusionsTakesPlaceholderLabel() throws Exception {
		assertEquals("((a_ott1:1)foo_ott99:3,x)R;", graft("(foo_ott99~10-2@,x)R;").getTree().toString());
	}

	@Test
	public void shorthandExcludesFromOwnId() throws Exception {
		assertEquals("((a_ott1:1)X_ott10:3)R;", graft("(X_ott10~-2@)R;").getTree().toString());
	}

	@Test
	public void aliasWithoutId() throws Exception {
		assertEquals("((b_ott2:1)foo:3)R;", graft("(foo_ott~10-1@)R;").getTree().toString());
	}

	@Test
	public void keepsSiblingOrder() throws Exception {
		assertEquals("(x,(a_ott1:1,b_ott2:1)M_ott10:3,y)R;", graft("(x,M_ott10@,y)R;").getTree().toString());
	}

	@Test
	public void graftsAtTheRoot() throws Exception {
		assertEquals("(a_ott1:1,b_ott2:1)Mammalia_ott10:3;", graft("Mammalia_ott10@;").getTree().toString());
	}

	@Test
	public void unresolvedPlaceholderStaysAndIsCounted() throws Exception {
		GraftResult result = graft("(Known_ott10@,Unknown_ott999@)R;");
		assertEquals("((a_ott1:1,b_ott2:1)Known_ott10:3,Unknown_ott999@)R;", result.getTree().toString());
		assertEquals(1, result.getUnresolvedCount());
		assertEquals("999", result.getUnresolved().get(0).getKey());
		assertTrue(result.getTree().getRoot().getChild(1).isGraftPoint());
	}

	@Test
	public void worksWithoutReference() throws Exception {
		GraftResult result = new GraftEngine().graft(reader.readTree("(A_ott10@,B)R;"), null, BespokeTreeLibrary.empty());
		assertEquals(1, result.getUnresolvedCount());
		assertEquals("(A_ott10@,B)R;", result.getTree().toString());
	}

	@Test
	public void leavesSkeletonUntouched() throws Exception {
		Tree skeleton = reader.readTree("(Mammalia_ott10@:5,Other:7)Root;");
		engine.graft(skeleton, index);
		assertEquals("(Mammalia_ott10@:5,Other:7)Root;", skeleton.toString());
	}

	@Test(expected = DuplicateTaxonException.class)
	public void sameSourceTwiceIsFatal() throws Exception {
		graft("(A_ott10@,B_ott10@)R;");
	}

	@Test
	public void duplicateLeavesAfterGraftingAreFatal() throws Exception {
		try {
			graft("(M_ott10@,a_ott1)R;");
			fail("expected a DuplicateTaxonException");
		} catch (DuplicateTaxonException e) {
			assertTrue(e.getDuplicates().contains("1"));
		}
	}

	@Test
	public void leafKeysAreUniqueAfterGrafting() throws Exception {
		Tree tree = graft("((Mammalia_ott10@,c_ott3@)x,d)R;").getTree();
		GraftEngine.checkLeafKeys(tree);
		assertEquals(4, tree.getExternalNodeCount());
	}

	@Test
	public void attachesBespokeTrees() throws Exception {
		File parts = folder.newFolder("parts");
		FileUtils.writeStringToFile(new File(parts, "Amorphea.PHY"),
				"[mrca: x, y, fixage=4;]\n(x:1,(y:1,Mammalia_ott10@:2)z:1)Amorphea;", StandardCharsets.UTF_8);
		File mapping = folder.newFile("mapping.json");
		FileUtils.writeStringToFile(mapping,
				"{\"AMORPHEA\": {\"file\": \"Amorphea.PHY\", \"edge_length\": 50, \"taxon\": null}}", StandardCharsets.UTF_8);
		BespokeTreeLibrary library = BespokeTreeLibrary.fromMappingFile(mapping, parts);

		GraftResult result = engine.graft(reader.readTree("(AMORPHEA@,w:2)R;"), index, library);
		assertEquals("((x:1,(y:1,(a_ott1:1,b_ott2:1)Mammalia_ott10:2)z:1)Amorphea:50,w:2)R;", result.getTree().toString());
		assertEquals(2, result.getGraftedCount());
		assertEquals(1, result.getIncludedConstraints().size());
		assertEquals(4.0, result.getIncludedConstraints().get(0).getTargetAge(), 0.0);
	}

	@Test
	public void bespokeTaxonOverridesLabel() throws Exception {
		File parts = folder.newFolder("parts");
		FileUtils.writeStringToFile(new File(parts, "Amb.phy"), "(p:1,q:1):4;", StandardCharsets.UTF_8);
		File mapping = folder.newFile("mapping.json");
		FileUtils.writeStringToFile(mapping,
				"{\"AMBULACRARIA\": {\"file\": \"Amb.phy\", \"edge_length\": null, \"taxon\": \"Ambulacraria\"}}", StandardCharsets.UTF_8);
		BespokeTreeLibrary library = BespokeTreeLibrary.fromMappingFile(mapping, parts);
		GraftResult result = engine.graft(reader.readTree("(AMBULACRARIA@:20,w)R;"), index, library);
		assertEquals("((p:1,q:1)Ambulacraria:20,w)R;", result.getTree().toString());
	}

	@Test
	public void bespokeTreesThatIncludeEachOtherAreRejected() throws Exception {
		File parts = folder.newFolder("parts");
		FileUtils.writeStringToFile(new File(parts, "A.PHY"), "(B@,x)A;", StandardCharsets.UTF_8);
		FileUtils.writeStringToFile(new File(parts, "B.phy"), "(A@,y)B;", StandardCharsets.UTF_8);
		BespokeTreeLibrary library = BespokeTreeLibrary.fromDirectory(parts);
		assertEquals(2, library.size());
		try {
			engine.graft(reader.readTree("(A@)R;"), index, library);
			fail("expected a TreeBuildException");
		} catch (DuplicateTaxonException e) {
			fail("the cycle should be reported as such");
		} catch (TreeBuildException e) {
			assertTrue(e.getName().contains("include each other"));
		}
	}
}
