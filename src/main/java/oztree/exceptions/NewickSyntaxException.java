package oztree.exceptions;

/**
 * Thrown by the Newick reader when the tree text is malformed. Carries the offset of the
 * problem (0-based) both in characters and in UTF-8 bytes, its line and column (1-based) and a
 * short excerpt of the text around it.
 */
public class NewickSyntaxException extends DataFormatException {

	private static final long serialVersionUID = 1L;
	private int offset;
	private int byteOffset;
	private int column;
	private String context;

	public NewickSyntaxException(String msg, int offset, int byteOffset, int lineNumber, int column, String context) {
		super(msg, lineNumber);
		this.offset = offset;
		this.byteOffset = byteOffset;
		this.column = column;
		this.context = context;
	}

	public int getOffset() {
		return offset;
	}

	/** offset in the UTF-8 encoded text, which differs from getOffset() once a non-ASCII character precedes the problem */
	public int getByteOffset() {
		return byteOffset;
	}

	public int getColumn() {
		return column;
	}

	public String getContext() {
		return context;
	}

	@Override
	public String getMessage() {
		return getReason() + " (line " + getLineNumber() + ", column " + column + ", byte " + byteOffset + ")";
	}

	@Override
	public String toString() {
		return super.toString() + ", column " + column + " (byte " + byteOffset + "): ..." + context + "...";
	}
}
