package oztree.exceptions;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Thrown when we cannot find an indicated taxon.
 */
public class TaxonNotFoundException extends Exception {

	private static final long serialVersionUID = 1L;
	private ArrayList<String> missingNames;

	// single name constructor
	public TaxonNotFoundException(String nameOfTaxon) {
		this.missingNames = new ArrayList<String>();
		this.missingNames.add(nameOfTaxon);
	}

	// list of names constructor
	public TaxonNotFoundException(List<String> namesOfTaxa) {
		this.missingNames = new ArrayList<String>(namesOfTaxa);
	}

	public List<String> getMissingNames() {
		return missingNames;
	}

	private String getNames() {
		return StringUtils.join(this.missingNames, ", ");
	}

	public String getQuotedName() {
		return "'" + this.getNames() + "'";
	}

	@Override
	public String getMessage() {
		return toString();
	}

	@Override
	public String toString() {
		return "taxon \"" + this.getNames() + "\" is not recognized.";
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String noun = (missingNames.size() == 1 ? "taxon" : "taxa");
		out.println(failedAction + " failed; " + noun + " not recognized: " + this.getQuotedName());
	}
}
