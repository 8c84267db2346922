package oztree;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import oztree.tree.NewickReader;
import oztree.tree.Tree;

public class MinimalTreeExtractorTest {

	private static final String TEST_TREE =
			"(A,(BA,((BBAA_ott123,BBAB,BBAC,BBAD)BAA,(BBBA)BBB,(BBCA:12.34,BBCB)BBC_ott456:78.9)BB)B_ott789,((CAA,CAB):5.25,CB)C,D)Root;";

	private Tree tree;
	private MinimalTreeExtractor extractor;

	@Before
	public void setUp() throws Exception {
		tree = new NewickReader().readTree(TEST_TREE);
		extractor = new MinimalTreeExtractor();
	}

	private String extract(String... targets) {
		Tree t = extractor.extractMinimal(tree, Arrays.asList(targets));
		return (t == null) ? null : t.toString();
	}

	@Test
	public void someMissingTaxa() {
		assertEquals("BBC_ott456:78.9;", extract("X", "BBC", "Y"));
		assertEquals(Arrays.asList("X", "Y"), extractor.getMissingTargets());
	}

	@Test
	public void allMissingTaxa() {
		assertNull(extract("X", "6789"));
		assertEquals(2, extractor.getMissingTargets().size());
	}

	@Test
	public void twoTaxa() {
		assertEquals("(BA,BBBA)B_ott789;", extract("BA", "BBBA"));
		assertTrue(extractor.getMissingTargets().isEmpty());
	}

	@Test
	public void twoTaxaNoRootName() {
		assertEquals("(CAA,CAB):5.25;", extract("CAA", "CAB"));
	}

	@Test
	public void threeTaxa() {
		assertEquals("((BA,BBC_ott456:78.9)B_ott789,C)Root;", extract("BA", "C", "BBC"));
	}

	@Test
	public void threeTaxaPolytomy() {
		assertEquals("(BBAA_ott123,BBAC,BBAD)BAA;", extract("BBAD", "BBAA", "BBAC"));
	}

	@Test
	public void twoNestedTaxa() {
		assertEquals("(BBC_ott456:78.9)B_ott789;", extract("B", "BBC"));
	}

	@Test
	public void threeNestedTaxa() {
		assertEquals("((BBC_ott456:78.9)BB)B_ott789;", extract("BB", "BBC", "B"));
	}

	@Test
	public void nestedWithImpliedTaxon() {
		assertEquals("((BBAB,BBAD)BAA)B_ott789;", extract("BBAB", "B", "BBAD"));
	}

	@Test
	public void mixedScenarios() {
		assertEquals("((BBB,(BBCA:12.34,BBCB)BBC_ott456:78.9)BB)B_ott789;", extract("BBB", "789", "BBCA", "BBCB"));
	}

	@Test
	public void findByOtt() {
		assertEquals("((BBAA_ott123,BBC_ott456:78.9)BB)B_ott789;", extract("123", "789", "456"));
	}

	@Test
	public void splicedEdgesAreAdded() throws Exception {
		Tree t = new NewickReader().readTree("(((A:1,B:1)X:2,Z:1)Y:0.5,C:3.5)R;");
		assertEquals("(A:3.5,C:3.5)R;", extractor.extractMinimal(t, Arrays.asList("A", "C")).toString());
	}

	@Test
	public void sourceTreeIsUntouched() {
		extract("BA", "C", "BBC");
		assertEquals(TEST_TREE, tree.toString());
	}
}
