package oztree.tree;

/**
 * Structured form of the instructions that can be appended to a node label. The label
 * suffixes are turned into these objects once, by the LabelTokenizer, and every later stage
 * reads only this form.
 *
 * @see GraftMarker
 * @see ExclusionList
 * @see Alias
 */
public abstract class Directive {

	public enum Kind {
		/** the node is a placeholder to be replaced by an external subtree */
		GRAFT,
		/** identifiers to prune from the subtree before attaching it */
		EXCLUSION,
		/** label to put on the attached subtree */
		ALIAS;
	}

	private final Kind kind;

	protected Directive(Kind kind) {
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}
}
