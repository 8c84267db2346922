package oztree.tree;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Stack;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import oztree.exceptions.DataFormatException;
import oztree.exceptions.NewickSyntaxException;

/**
 * One-pass reader for Newick trees with OneZoom label suffixes (see LabelTokenizer).
 * Open clades are kept on an explicit stack, so nesting depth is limited only by memory.
 *
 * Leading [...] comment blocks are skipped, and the text of the first one is kept on the
 * returned Tree. Comments after a label or a branch length are skipped as well.
 */
public class NewickReader {
	static Logger _LOG = Logger.getLogger(NewickReader.class);

	private static final int CONTEXT_CHARS = 20;

	private final LabelTokenizer tokenizer;

	private String pb;
	private int x;

	public NewickReader() {
		this(new LabelTokenizer());
	}

	public NewickReader(LabelTokenizer tokenizer) {
		this.tokenizer = tokenizer;
	}

	public Tree readTree(File file) throws IOException, NewickSyntaxException {
		String text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
		try {
			return readTree(text);
		} catch (NewickSyntaxException nse) {
			nse.setFilePath(file.getPath());
			throw nse;
		}
	}

	public Tree readTree(String treeString) throws NewickSyntaxException {
		this.pb = treeString;
		this.x = 0;
		if (pb.length() > 0 && pb.charAt(0) == '\uFEFF') {
			x++;
		}

		skipWhitespace();
		String comment = null;
		while (x < pb.length() && pb.charAt(x) == '[') {
			String c = readComment();
			if (comment == null) {
				comment = c;
			}
			skipWhitespace();
		}
		if (x >= pb.length()) {
			throw syntaxError("empty input: no tree found", x);
		}

		Stack<TreeNode> open = new Stack<TreeNode>();
		TreeNode root = null;
		boolean expectNode = true;
		int nodeCount = 0;
		while (true) {
			skipWhitespace();
			if (expectNode) {
				TreeNode node = new TreeNode();
				nodeCount++;
				if (open.isEmpty()) {
					root = node;
				} else {
					open.peek().addChild(node);
				}
				if (x < pb.length() && pb.charAt(x) == '(') {
					open.push(node);
					x++;
					continue;
				}
				readLabelAndLength(node);
				expectNode = false;
			} else {
				if (open.isEmpty()) {
					break;
				}
				if (x >= pb.length()) {
					throw syntaxError("expected ',' or ')'", x);
				}
				char nextChar = pb.charAt(x);
				if (nextChar == ',') {
					x++;
					expectNode = true;
				} else if (nextChar == ')') {
					x++;
					readLabelAndLength(open.pop());
				} else {
					throw syntaxError("expected ',' or ')'", x);
				}
			}
		}

		skipWhitespace();
		if (x >= pb.length() || pb.charAt(x) != ';') {
			throw syntaxError("expected a semicolon at the end of the tree", x);
		}
		x++;
		skipWhitespace();
		if (x < pb.length()) {
			throw syntaxError("unexpected text after the end of the tree", x);
		}
		if (_LOG.isDebugEnabled()) {
			_LOG.debug("read tree with " + nodeCount + " nodes");
		}
		Tree tree = new Tree(root, comment);
		this.pb = null;
		return tree;
	}

	/**
	 * Reads an optional label, then an optional ':' branch length, into `node`.
	 */
	private void readLabelAndLength(TreeNode node) throws NewickSyntaxException {
		skipWhitespace();
		int labelStart = x;
		String label;
		if (x < pb.length() && pb.charAt(x) == '\'') {
			label = readQuotedLabel();
		} else {
			while (x < pb.length() && !isDelimiter(pb.charAt(x))) {
				x++;
			}
			label = pb.substring(labelStart, x);
		}
		try {
			tokenizer.apply(label, node);
		} catch (DataFormatException dfe) {
			throw syntaxError(dfe.getReason(), labelStart);
		}
		skipWhitespaceAndComments();

		if (x < pb.length() && pb.charAt(x) == ':') {
			x++;
			skipWhitespace();
			int start = x;
			while (x < pb.length() && !isDelimiter(pb.charAt(x))) {
				x++;
			}
			String edgeL = pb.substring(start, x);
			double bl;
			try {
				bl = Double.parseDouble(edgeL);
			} catch (NumberFormatException nfe) {
				throw syntaxError("'" + edgeL + "' is not a valid edge length", start);
			}
			if (Double.isNaN(bl) || Double.isInfinite(bl)) {
				throw syntaxError("'" + edgeL + "' is not a valid edge length", start);
			}
			node.setBL(bl);
			skipWhitespaceAndComments();
		}
	}

	private String readQuotedLabel() throws NewickSyntaxException {
		int start = x;
		x++; // opening quote
		StringBuilder sb = new StringBuilder();
		while (true) {
			if (x >= pb.length()) {
				throw syntaxError("unterminated quoted label", start);
			}
			char c = pb.charAt(x);
			if (c == '\'') {
				if (x + 1 < pb.length() && pb.charAt(x + 1) == '\'') {
					sb.append('\'');
					x += 2;
					continue;
				}
				x++;
				return sb.toString();
			}
			sb.append(c);
			x++;
		}
	}

	private String readComment() throws NewickSyntaxException {
		int start = x;
		int end = pb.indexOf(']', x + 1);
		if (end < 0) {
			throw syntaxError("unterminated comment", start);
		}
		x = end + 1;
		return pb.substring(start + 1, end);
	}

	private void skipWhitespace() {
		while (x < pb.length() && Character.isWhitespace(pb.charAt(x))) {
			x++;
		}
	}

	private void skipWhitespaceAndComments() throws NewickSyntaxException {
		skipWhitespace();
		while (x < pb.length() && pb.charAt(x) == '[') {
			readComment();
			skipWhitespace();
		}
	}

	private static boolean isDelimiter(char c) {
		return c == ',' || c == ';' || c == ':' || c == '(' || c == ')' || c == '[' || Character.isWhitespace(c);
	}

	private NewickSyntaxException syntaxError(String message, int offset) {
		int line = 1;
		int lineStart = 0;
		int limit = Math.min(offset, pb.length());
		for (int i = 0; i < limit; i++) {
			if (pb.charAt(i) == '\n') {
				line++;
				lineStart = i + 1;
			}
		}
		String context = pb.substring(Math.max(offset - CONTEXT_CHARS, 0), Math.min(offset + CONTEXT_CHARS, pb.length()));
		int byteOffset = pb.substring(0, limit).getBytes(StandardCharsets.UTF_8).length;
		return new NewickSyntaxException(message, offset, byteOffset, line, offset - lineStart + 1, context);
	}
}
