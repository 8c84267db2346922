package oztree;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import oztree.tree.NewickReader;
import oztree.tree.Tree;
import oztree.tree.TreeUtils;

public class CalibrationEngineTest {

	private NewickReader reader;
	private CalibrationEngine engine;

	@Before
	public void setUp() {
		reader = new NewickReader();
		engine = new CalibrationEngine();
	}

	@Test
	public void scalesTheCladeBelowTheMRCA() throws Exception {
		Tree tree = reader.readTree("(A:1,B:1)AB:1;");
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(new CalibrationConstraint("A", "B", 10)));
		assertEquals(1, result.getAppliedCount());
		assertEquals("(A:10,B:10)AB:1;", tree.toString());
	}

	@Test
	public void keepsProportionsAndTheEdgeAbove() throws Exception {
		Tree tree = reader.readTree("(((A:1,B:1)X:1,C:2)Y:4,D:6)R;");
		engine.calibrate(tree, Arrays.asList(new CalibrationConstraint("A", "C", 6)));
		assertEquals("(((A:3,B:3)X:3,C:6)Y:4,D:6)R;", tree.toString());
	}

	@Test
	public void laterConstraintOnEnclosingCladeWins() throws Exception {
		Tree tree = reader.readTree("((A:1,B:1)X:1,C:2)R;");
		CalibrationConstraint inner = new CalibrationConstraint("A", "B", 3);
		CalibrationConstraint outer = new CalibrationConstraint("A", "C", 8);
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(inner, outer));
		assertEquals("((A:6,B:6)X:2,C:4)R;", tree.toString());
		assertEquals(2, result.getAppliedCount());
		assertEquals(1, result.getSuperseded().size());
		assertSame(inner, result.getSuperseded().get(0).getEarlier());
		assertSame(outer, result.getSuperseded().get(0).getLater());
	}

	@Test
	public void innerConstraintThatDeepensTheOuterCladeOverridesIt() throws Exception {
		Tree tree = reader.readTree("((A:1,B:1)X:1,C:2)R;");
		CalibrationConstraint outer = new CalibrationConstraint("A", "C", 4);
		CalibrationConstraint inner = new CalibrationConstraint("A", "B", 10);
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(outer, inner));
		assertEquals("((A:10,B:10)X:2,C:4)R;", tree.toString());
		assertEquals(12.0, TreeUtils.getGreatestDistanceToTip(tree.getRoot()), 0);
		assertEquals(2, result.getAppliedCount());
		assertEquals(1, result.getSuperseded().size());
		assertSame(outer, result.getSuperseded().get(0).getEarlier());
		assertSame(inner, result.getSuperseded().get(0).getLater());
	}

	@Test
	public void innerConstraintThatKeepsTheOuterDepthOverridesNothing() throws Exception {
		Tree tree = reader.readTree("((A:1,B:1)X:1,C:4)R;");
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(
				new CalibrationConstraint("A", "C", 4), new CalibrationConstraint("A", "B", 2)));
		assertEquals("((A:2,B:2)X:1,C:4)R;", tree.toString());
		assertTrue(result.getSuperseded().isEmpty());
	}

	@Test
	public void sameCladeTwiceKeepsTheLastAge() throws Exception {
		Tree tree = reader.readTree("(A:1,B:1)R;");
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(
				new CalibrationConstraint("A", "B", 4), new CalibrationConstraint("B", "A", 8)));
		assertEquals("(A:8,B:8)R;", tree.toString());
		assertEquals(1, result.getSuperseded().size());
	}

	@Test
	public void missingTaxonFailsOnlyThatConstraint() throws Exception {
		Tree tree = reader.readTree("(A:1,B:1)R;");
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(
				new CalibrationConstraint("A", "Nope", 5), new CalibrationConstraint("A", "B", 2)));
		assertEquals(1, result.getAppliedCount());
		assertEquals(1, result.getFailures().size());
		assertEquals("taxon not found: Nope", result.getFailures().get(0).getReason());
		assertEquals("(A:2,B:2)R;", tree.toString());
	}

	@Test
	public void findsTaxaByIdAndFullLabel() throws Exception {
		Tree tree = reader.readTree("((Homo_ott1:1,Pan_ott2:1)Hominini_ott3:2,Gorilla_ott4:8)R;");
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(
				new CalibrationConstraint("1", "Pan_ott2", 6), new CalibrationConstraint("Homo_ott1", "Gorilla", 16)));
		assertEquals(2, result.getAppliedCount());
		assertEquals("((Homo_ott1:12,Pan_ott2:12)Hominini_ott3:4,Gorilla_ott4:16)R;", tree.toString());
	}

	@Test
	public void ambiguousTaxonFails() throws Exception {
		Tree tree = reader.readTree("((X:1,Y:1)a:1,(X:1,Z:1)b:1)R;");
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(new CalibrationConstraint("X", "Y", 5)));
		assertEquals(0, result.getAppliedCount());
		assertEquals(1, result.getFailures().size());
	}

	@Test
	public void cladeWithoutLengthFails() throws Exception {
		Tree tree = reader.readTree("(A,B)R;");
		CalibrationResult result = engine.calibrate(tree, Arrays.asList(new CalibrationConstraint("A", "B", 5)));
		assertEquals(0, result.getAppliedCount());
		assertEquals("(A,B)R;", tree.toString());
	}

	@Test
	public void unknownLengthsStayUnknown() throws Exception {
		Tree tree = reader.readTree("((A:1,B)X:1,C:2)R;");
		engine.calibrate(tree, Arrays.asList(new CalibrationConstraint("A", "C", 4)));
		assertEquals("((A:2,B)X:2,C:4)R;", tree.toString());
	}

	@Test
	public void noConstraintsChangesNothing() throws Exception {
		Tree tree = reader.readTree("(A:1,B:3)R;");
		CalibrationResult result = engine.calibrate(tree, Collections.<CalibrationConstraint>emptyList());
		assertEquals(0, result.getAppliedCount());
		assertEquals("(A:1,B:3)R;", tree.toString());
	}
}
