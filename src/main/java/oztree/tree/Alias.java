package oztree.tree;

/**
 * The label (and optional taxon id) to give a grafted subtree when it is attached, replacing
 * the label of the subtree's own root.
 */
public final class Alias extends Directive {

	private final String name;
	private final String taxonId;

	public Alias(String name, String taxonId) {
		super(Kind.ALIAS);
		this.name = (name == null) ? "" : name;
		this.taxonId = taxonId;
	}

	public String getName() {
		return name;
	}

	public String getTaxonId() {
		return taxonId;
	}

	@Override
	public String toString() {
		return "alias(" + name + (taxonId == null ? "" : ", " + taxonId) + ")";
	}
}
