package oztree.tree;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

import oztree.exceptions.NewickSyntaxException;

public class NewickReaderTest {

	private NewickReader reader;

	@Before
	public void setUp() {
		reader = new NewickReader();
	}

	@Test
	public void readsLabelsAndLengths() throws Exception {
		Tree tree = reader.readTree("(A:1,(B:1,C:1):2)Root;");
		TreeNode root = tree.getRoot();
		assertEquals("Root", root.getName());
		assertFalse(root.hasBranchLength());
		assertEquals(2, root.getChildCount());
		assertEquals("A", root.getChild(0).getName());
		assertEquals(1.0, root.getChild(0).getBL(), 0.0);
		TreeNode bc = root.getChild(1);
		assertEquals("", bc.getName());
		assertEquals(2.0, bc.getBL(), 0.0);
		assertEquals("C", bc.getChild(1).getName());
		assertEquals(3, tree.getExternalNodeCount());
		assertEquals(5, tree.getNodeCount());
	}

	@Test
	public void roundTrip() throws Exception {
		String newick = "(A:1,(B:1,C:1):2)Root;";
		assertEquals(newick, new NewickWriter().write(reader.readTree(newick)));
	}

	@Test
	public void ignoresWhitespaceBetweenTokens() throws Exception {
		Tree tree = reader.readTree("  ( A : 1 ,\n  B )R ;\n");
		assertEquals("(A:1,B)R;", tree.toString());
	}

	@Test
	public void readsQuotedLabels() throws Exception {
		Tree tree = reader.readTree("('Homo sapiens':1,'O''Brien, J.')'X (y)';");
		assertEquals("Homo sapiens", tree.getRoot().getChild(0).getName());
		assertEquals("O'Brien, J.", tree.getRoot().getChild(1).getName());
		assertEquals("X (y)", tree.getRoot().getName());
	}

	@Test
	public void keepsLeadingCommentAndSkipsOthers() throws Exception {
		Tree tree = reader.readTree("[mrca: A, B, fixage=10;]\n[second]\n(A:1[note],B[x]:1)AB;");
		assertEquals("mrca: A, B, fixage=10;", tree.getComment());
		assertEquals("(A:1,B:1)AB;", tree.toString());
	}

	@Test
	public void stripsByteOrderMark() throws Exception {
		Tree tree = reader.readTree("\uFEFF(A,B)C;");
		assertEquals("C", tree.getRoot().getName());
	}

	@Test
	public void missingLengthIsUnknown() throws Exception {
		Tree tree = reader.readTree("(A,B:0)C;");
		assertFalse(tree.getRoot().getChild(0).hasBranchLength());
		assertTrue(tree.getRoot().getChild(1).hasBranchLength());
	}

	@Test
	public void turnsGraftSuffixIntoDirectives() throws Exception {
		Tree tree = reader.readTree("(X_ott12@,foo_ott5~7-8@,Y)Z;");
		TreeNode x = tree.getRoot().getChild(0);
		assertTrue(x.isGraftPoint());
		assertEquals("X", x.getName());
		assertEquals("12", x.getTaxonId());
		TreeNode foo = tree.getRoot().getChild(1);
		ExclusionList ex = (ExclusionList) foo.getDirective(Directive.Kind.EXCLUSION);
		assertEquals("7", ex.getSourceId());
		assertEquals("8", ex.getExcludedIds().get(0));
		assertFalse(tree.getRoot().getChild(2).isGraftPoint());
	}

	@Test
	public void readsDeeplyNestedTrees() throws Exception {
		int depth = 200000;
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			sb.append('(');
		}
		sb.append("A:1");
		for (int i = 0; i < depth; i++) {
			sb.append("):1");
		}
		sb.append(';');
		Tree tree = reader.readTree(sb.toString());
		assertEquals(depth + 1, tree.getNodeCount());
		assertEquals(sb.toString(), new NewickWriter().write(tree));
		assertEquals(depth, tree.externalNodes().get(0).getDistanceFromRoot(), 0.0);
	}

	@Test
	public void unclosedParenthesis() {
		try {
			reader.readTree("(A,B");
			fail("expected a syntax error");
		} catch (NewickSyntaxException e) {
			assertEquals("expected ',' or ')'", e.getReason());
			assertEquals(4, e.getOffset());
			assertEquals(4, e.getByteOffset());
			assertEquals(1, e.getLineNumber());
			assertEquals(5, e.getColumn());
		}
	}

	@Test
	public void byteOffsetCountsMultiByteCharacters() {
		try {
			reader.readTree("(\u00c6r\u00f8,B");
			fail("expected a syntax error");
		} catch (NewickSyntaxException e) {
			assertEquals(6, e.getOffset());
			assertEquals(8, e.getByteOffset());
			assertEquals(7, e.getColumn());
			assertTrue(e.getMessage().contains("byte 8"));
		}
	}

	@Test
	public void extraClosingParenthesis() {
		try {
			reader.readTree("(A,B));");
			fail("expected a syntax error");
		} catch (NewickSyntaxException e) {
			assertEquals("expected a semicolon at the end of the tree", e.getReason());
			assertEquals(5, e.getOffset());
		}
	}

	@Test
	public void missingSemicolon() {
		try {
			reader.readTree("(A,B)C");
			fail("expected a syntax error");
		} catch (NewickSyntaxException e) {
			assertEquals("expected a semicolon at the end of the tree", e.getReason());
		}
	}

	@Test
	public void badEdgeLength() {
		try {
			reader.readTree("(A,B:x1)C;");
			fail("expected a syntax error");
		} catch (NewickSyntaxException e) {
			assertEquals("'x1' is not a valid edge length", e.getReason());
			assertEquals(5, e.getOffset());
		}
	}

	@Test
	public void rejectsNonFiniteLength() {
		try {
			reader.readTree("(A:NaN,B)C;");
			fail("expected a syntax error");
		} catch (NewickSyntaxException e) {
			assertEquals("'NaN' is not a valid edge length", e.getReason());
		}
	}

	@Test
	public void reportsLineAndColumn() {
		try {
			reader.readTree("(A,\nB,\n  C:?);");
			fail("expected a syntax error");
		} catch (NewickSyntaxException e) {
			assertEquals(3, e.getLineNumber());
			assertEquals(5, e.getColumn());
			assertTrue(e.getContext().contains("C:?"));
		}
	}

	@Test(expected = NewickSyntaxException.class)
	public void emptyInput() throws Exception {
		reader.readTree("   ");
	}

	@Test(expected = NewickSyntaxException.class)
	public void unterminatedQuote() throws Exception {
		reader.readTree("('A,B)C;");
	}

	@Test(expected = NewickSyntaxException.class)
	public void malformedGraftSuffix() throws Exception {
		reader.readTree("(X~1+2@,B)C;");
	}
}
