package oztree.tree;

/**
 * Marks a placeholder node, written as a trailing '@' on the label.
 */
public final class GraftMarker extends Directive {

	public static final GraftMarker INSTANCE = new GraftMarker();

	private GraftMarker() {
		super(Kind.GRAFT);
	}

	@Override
	public String toString() {
		return "@";
	}
}
