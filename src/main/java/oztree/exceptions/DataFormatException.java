package oztree.exceptions;

import java.io.PrintStream;

/**
 * Thrown when a tree, constraint or mapping file cannot be read because its contents do not
 * follow the expected format.
 */
public class DataFormatException extends Exception {

	private static final long serialVersionUID = 1L;
	private String message;
	private String filename;
	private int lineNumber;

	// single message constructor
	public DataFormatException(String msg) {
		super(msg);
		this.message = msg;
		this.filename = null;
		this.lineNumber = -1;
	}

	public DataFormatException(String msg, int lineNumber) {
		this(msg);
		this.lineNumber = lineNumber;
	}

	public void setFilePath(String filename) {
		this.filename = filename;
	}

	public String getFilePath() {
		return this.filename;
	}

	public void setLineNumber(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	public int getLineNumber() {
		return this.lineNumber;
	}

	public String getReason() {
		return this.message;
	}

	@Override
	public String toString() {
		String msg = "Data Format Error: " + this.message;
		if (this.filename != null) {
			msg += "\nFile \"" + this.filename + "\"";
		}
		if (this.lineNumber >= 0) {
			msg += "\nOn line " + this.lineNumber;
		}
		return msg;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String em = failedAction + " failed. " + this.toString();
		out.println(em);
	}
}
