package oztree;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

import oztree.tree.NewickReader;
import oztree.tree.Tree;

public class UltrametricityFixerTest {

	private static final double EPS = 1e-6;

	private NewickReader reader;
	private UltrametricityFixer fixer;
	private UltrametricityChecker checker;

	@Before
	public void setUp() {
		reader = new NewickReader();
		fixer = new UltrametricityFixer();
		checker = new UltrametricityChecker();
	}

	@Test
	public void lengthensTheShortLeaf() throws Exception {
		Tree tree = reader.readTree("(A:5,(B:2,C:3):2)Root;");
		FixResult result = fixer.fix(tree);
		assertEquals("(A:5,(B:3,C:3):2)Root;", tree.toString());
		assertEquals(1, result.getAdjusted().size());
		assertEquals("B", result.getAdjusted().get(0).getName());
		assertTrue(result.isComplete());
		assertTrue(checker.isUltrametric(tree, EPS));
	}

	@Test
	public void lengthensInternalEdges() throws Exception {
		Tree tree = reader.readTree("(A:10,(B:2,C:3):2)R;");
		fixer.fix(tree);
		assertEquals("(A:10,(B:3,C:3):7)R;", tree.toString());
	}

	@Test
	public void neverShortens() throws Exception {
		Tree tree = reader.readTree("((A:1,B:1):1,C:10)R;");
		fixer.fix(tree);
		assertEquals("((A:1,B:1):9,C:10)R;", tree.toString());
	}

	@Test
	public void ultrametricTreeIsUnchanged() throws Exception {
		Tree tree = reader.readTree("((A:1,B:1):2,C:3)R;");
		FixResult result = fixer.fix(tree);
		assertTrue(result.getAdjusted().isEmpty());
		assertEquals("((A:1,B:1):2,C:3)R;", tree.toString());
	}

	@Test
	public void negativeLengthIsReported() throws Exception {
		Tree tree = reader.readTree("(A:-1,B:2)R;");
		FixResult result = fixer.fix(tree);
		assertFalse(result.isComplete());
		assertEquals(1, result.getUnfixable().size());
		assertEquals("A", result.getUnfixable().get(0).getNode().getName());
		assertEquals(-1.0, tree.getRoot().getChild(0).getBL(), 0.0);
	}

	@Test
	public void graftPointsAreLeftAlone() throws Exception {
		Tree tree = reader.readTree("(A:1,(B:3,X_ott5@:1):1)R;");
		fixer.fix(tree);
		assertEquals("(A:4,(B:3,X_ott5@:1):1)R;", tree.toString());
	}

	@Test
	public void fixesLeavesToAnAge() throws Exception {
		Tree tree = reader.readTree("((A:9.5,B:10.25):1,C:11)R;");
		FixResult result = fixer.fixToAge(tree, 11, 1);
		assertTrue(result.isComplete());
		assertEquals(2, result.getAdjusted().size());
		assertEquals("((A:10,B:10):1,C:11)R;", tree.toString());
	}

	@Test
	public void leafAdjustmentIsBounded() throws Exception {
		Tree tree = reader.readTree("(A:5,B:10)R;");
		FixResult result = fixer.fixToAge(tree, 10, 1);
		assertEquals(1, result.getUnfixable().size());
		assertEquals("(A:5,B:10)R;", tree.toString());
	}

	@Test
	public void leafEdgeCannotGoNegative() throws Exception {
		Tree tree = reader.readTree("((A:0.5):3.3,B:3)R;");
		FixResult result = fixer.fixToAge(tree, 3, 1);
		assertFalse(result.isComplete());
		assertEquals(0.5, tree.getRoot().getChild(0).getChild(0).getBL(), 0.0);
	}
}
