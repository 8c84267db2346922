package oztree.tree;

import java.util.ArrayList;

import org.apache.commons.lang3.StringUtils;

import oztree.constants.GeneralConstants;
import oztree.exceptions.DataFormatException;

/**
 * Splits a raw node label into its name, taxon id and directives.
 *
 * <pre>
 *	label     := name [ "_ott" digits ] [ "~" [ ["+"] sourceId ] { "-" excludedId } ] "@"
 *	examples  :  Homo_sapiens_ott770315
 *	             Brachiopoda_ott826261@
 *	             foobar_ott123~456-789-111@   (ott456 minus 789 and 111, attached as foobar_ott123)
 *	             foobar_ott123~-789-111@      (shorthand for foobar_ott123~123-789-111@)
 *	             foobar_ott~456-789@          (ott456 minus 789, attached as foobar with no id)
 *	             AMORPHEA@                    (bespoke tree looked up by name)
 * </pre>
 *
 * The '~' list is only recognized on labels carrying the '@' marker; elsewhere '~' and '-'
 * are ordinary label characters.
 */
public class LabelTokenizer {

	public static final char GRAFT_CHAR = '@';
	public static final char LIST_CHAR = '~';
	public static final char EXCLUDE_CHAR = '-';
	public static final char INCLUDE_CHAR = '+';

	private final String idPrefix;

	public LabelTokenizer() {
		this(GeneralConstants.TAXON_ID_PREFIX.stringValue());
	}

	public LabelTokenizer(String idPrefix) {
		this.idPrefix = idPrefix;
	}

	public String getIdPrefix() {
		return idPrefix;
	}

	/**
	 * Sets the name, taxon id and directives of `node` from `label`.
	 * @throws DataFormatException if the directive suffix is malformed
	 */
	public void apply(String label, TreeNode node) throws DataFormatException {
		String text = label;
		ExclusionList exclusions = null;
		boolean graft = text.length() > 0 && text.charAt(text.length() - 1) == GRAFT_CHAR;
		if (graft) {
			text = text.substring(0, text.length() - 1);
			int tilde = text.indexOf(LIST_CHAR);
			if (tilde >= 0) {
				exclusions = parseList(text.substring(tilde + 1));
				text = text.substring(0, tilde);
			}
			if (text.indexOf(GRAFT_CHAR) >= 0) {
				throw new DataFormatException("graft marker '@' may only end a label: '" + label + "'");
			}
		}

		String name = text;
		String id = null;
		int p = text.lastIndexOf(idPrefix);
		if (p >= 0) {
			String digits = text.substring(p + idPrefix.length());
			if (StringUtils.isNumeric(digits)) {
				name = text.substring(0, p);
				id = digits;
			} else if (digits.length() == 0 && exclusions != null) {
				// foobar_ott~456@ : the name carries no id of its own
				name = text.substring(0, p);
			}
		}

		node.setName(name);
		node.setTaxonId(id);
		node.clearDirectives();
		if (graft) {
			node.addDirective(GraftMarker.INSTANCE);
			if (exclusions != null) {
				node.addDirective(exclusions);
				if (exclusions.getSourceId() != null) {
					node.addDirective(new Alias(name, id));
				}
			}
		}
	}

	private ExclusionList parseList(String list) throws DataFormatException {
		String source = null;
		ArrayList<String> excluded = new ArrayList<String>();
		int pos = 0;
		int n = list.length();
		while (pos < n) {
			char sign = list.charAt(pos);
			boolean signed = (sign == EXCLUDE_CHAR || sign == INCLUDE_CHAR);
			int start = signed ? pos + 1 : pos;
			int end = start;
			while (end < n && list.charAt(end) != EXCLUDE_CHAR && list.charAt(end) != INCLUDE_CHAR) {
				end++;
			}
			String id = list.substring(start, end);
			if (id.length() == 0) {
				throw new DataFormatException("empty identifier in list '~" + list + "'");
			}
			if (id.indexOf(LIST_CHAR) >= 0) {
				throw new DataFormatException("unexpected '~' in list '~" + list + "'");
			}
			if (sign == EXCLUDE_CHAR) {
				excluded.add(id);
			} else if (pos == 0) {
				source = id;
			} else {
				throw new DataFormatException("only the first entry of '~" + list + "' may name the subtree to include");
			}
			pos = end;
		}
		return new ExclusionList(source, excluded);
	}
}
