package oztree;

import gnu.trove.map.hash.THashMap;
import gnu.trove.set.hash.THashSet;

import org.apache.commons.lang3.StringUtils;

import oztree.constants.GeneralConstants;
import oztree.exceptions.AmbiguousTaxonException;
import oztree.tree.NodeOrder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Finds nodes of a working tree by taxon id or label. Built once over the tree; only valid
 * while the topology of that tree is unchanged.
 */
public class TaxonLocator {

	private final THashMap<String, TreeNode> byId = new THashMap<String, TreeNode>();
	private final THashMap<String, TreeNode> byLabel = new THashMap<String, TreeNode>();
	private final THashSet<String> ambiguous = new THashSet<String>();
	private final String idPrefix = GeneralConstants.TAXON_ID_PREFIX.stringValue();

	public TaxonLocator(Tree tree) {
		for (TreeNode n : tree.nodes(NodeOrder.PREORDER)) {
			if (n.getTaxonId() != null) {
				remember(byId, n.getTaxonId(), n);
			}
			if (n.hasName()) {
				remember(byLabel, n.getName(), n);
			}
		}
	}

	private void remember(THashMap<String, TreeNode> map, String key, TreeNode n) {
		if (map.containsKey(key)) {
			ambiguous.add(key);
		} else {
			map.put(key, n);
		}
	}

	/**
	 * @param key a taxon id, a label, or a full label with its id such as Homo_sapiens_ott770315
	 * @return the node whose taxon id, or failing that whose label, is `key`; null if none
	 * @throws AmbiguousTaxonException if several nodes carry `key`
	 */
	public TreeNode locate(String key) {
		TreeNode hit = byId.get(key);
		if (hit == null) {
			hit = byLabel.get(key);
		}
		if (hit == null) {
			int p = key.lastIndexOf(idPrefix);
			String id = (p < 0) ? "" : key.substring(p + idPrefix.length());
			if (id.length() > 0 && StringUtils.isNumeric(id)) {
				key = id;
				hit = byId.get(id);
			}
		}
		if (hit != null && ambiguous.contains(key)) {
			throw new AmbiguousTaxonException(key);
		}
		return hit;
	}
}
