package oztree.exceptions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Thrown when a taxon identifier that must be unique within a tree occurs more than once,
 * or when one reference subtree is requested at two different graft points.
 */
public class DuplicateTaxonException extends TreeBuildException {

	private static final long serialVersionUID = 1L;
	private final List<String> duplicates;

	public DuplicateTaxonException(String context, Collection<String> duplicateIds) {
		super(context + ": duplicate taxon identifier(s) " + StringUtils.join(duplicateIds, ", "));
		this.duplicates = new ArrayList<String>(duplicateIds);
	}

	public List<String> getDuplicates() {
		return duplicates;
	}
}
