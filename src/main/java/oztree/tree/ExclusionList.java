package oztree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * The '~' part of a graft token, e.g. {@code Clade_ott123~456-789-111@}. The optional first
 * entry (bare or prefixed by '+') is the identifier of the subtree to attach in place of the
 * placeholder's own id; every '-' entry is a descendant to remove from that subtree.
 */
public final class ExclusionList extends Directive {

	private final String sourceId;
	private final List<String> excludedIds;

	public ExclusionList(String sourceId, List<String> excludedIds) {
		super(Kind.EXCLUSION);
		this.sourceId = StringUtils.isEmpty(sourceId) ? null : sourceId;
		this.excludedIds = Collections.unmodifiableList(new ArrayList<String>(excludedIds));
	}

	/**
	 * @return the identifier of the subtree to attach, or null to use the placeholder's own
	 */
	public String getSourceId() {
		return sourceId;
	}

	public List<String> getExcludedIds() {
		return excludedIds;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("~");
		if (sourceId != null) {
			sb.append(sourceId);
		}
		for (String id : excludedIds) {
			sb.append('-').append(id);
		}
		return sb.toString();
	}
}
