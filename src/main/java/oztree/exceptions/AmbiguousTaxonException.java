package oztree.exceptions;

/**
 * This class is just a wrapper for MultipleHitsException, but is reserved for the case when we find multiple
 * nodes for a taxon label where we were expecting only one.
 */
public class AmbiguousTaxonException extends MultipleHitsException {

	private static final long serialVersionUID = 1L;

	public AmbiguousTaxonException(Object searchTerm) {
		super(searchTerm);
	}
}
