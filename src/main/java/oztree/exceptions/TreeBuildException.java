package oztree.exceptions;

import java.io.PrintStream;

/**
 * Thrown when more specific errors classes do not apply, and a tree could not be built.
 */
public class TreeBuildException extends Exception {

	private static final long serialVersionUID = 1L;
	private String msg;

	public TreeBuildException(String error_msg) {
		super(error_msg);
		this.msg = error_msg;
	}

	public TreeBuildException(String error_msg, Throwable cause) {
		super(error_msg, cause);
		this.msg = error_msg;
	}

	public String getName() {
		return this.msg;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + ": " + this.msg;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String m = failedAction + " failed due to " + this.toString();
		out.println(m);
	}
}
