package oztree.tree;

import static org.junit.Assert.*;

import java.io.StringWriter;

import org.junit.Test;

public class NewickFormatterTest {

	private static final String TEST_TREE =
			"(A,(BA,((BBAA_ott123,BBAB,BBAC,BBAD)BAA,(BBBA)BBB,(BBCA:12.34,BBCB)BBC_ott456:78.9)BB)B_ott789,((CAA,CAB),CB)C,D)Root;";

	private static final String FORMATTED_TEST_TREE =
			"(\n"
			+ "  A,\n"
			+ "  (\n"
			+ "    BA,\n"
			+ "    (\n"
			+ "      (\n"
			+ "        BBAA_ott123,\n"
			+ "        BBAB,\n"
			+ "        BBAC,\n"
			+ "        BBAD\n"
			+ "      )BAA,\n"
			+ "      (\n"
			+ "        BBBA\n"
			+ "      )BBB,\n"
			+ "      (\n"
			+ "        BBCA:12.34,\n"
			+ "        BBCB\n"
			+ "      )BBC_ott456:78.9\n"
			+ "    )BB\n"
			+ "  )B_ott789,\n"
			+ "  (\n"
			+ "    (\n"
			+ "      CAA,\n"
			+ "      CAB\n"
			+ "    ),\n"
			+ "    CB\n"
			+ "  )C,\n"
			+ "  D\n"
			+ ")Root;\n";

	@Test
	public void formatsWithTwoSpaces() throws Exception {
		Tree tree = new NewickReader().readTree(TEST_TREE);
		StringWriter out = new StringWriter();
		new NewickFormatter().format(tree, out);
		assertEquals(FORMATTED_TEST_TREE, out.toString());
	}

	@Test
	public void formattedTreeReadsBack() throws Exception {
		Tree tree = new NewickReader().readTree(TEST_TREE);
		String formatted = new NewickFormatter(4).format(tree);
		assertTrue(formatted.contains("\n    A,\n"));
		assertEquals(TEST_TREE, new NewickReader().readTree(formatted).toString());
	}

	@Test
	public void singleLeaf() throws Exception {
		assertEquals("A:1;\n", new NewickFormatter().format(new NewickReader().readTree("A:1;")));
	}
}
