package oztree;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import oztree.constants.GeneralConstants;
import oztree.exceptions.TaxonNotFoundException;
import oztree.tree.Directive;
import oztree.tree.ExclusionList;
import oztree.tree.NewickWriter;
import oztree.tree.NodeOrder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Writes out, as one file per taxon id, every reference clade that a set of skeleton trees asks
 * for. The ids excluded anywhere in the skeletons are left out of every exported clade. Name-only
 * tokens refer to bespoke trees and are skipped.
 */
public class SubtreeExporter {
	static Logger _LOG = Logger.getLogger(SubtreeExporter.class);

	private final boolean failOnMissing;
	private final NewickWriter writer;

	public SubtreeExporter() {
		this(false, new NewickWriter());
	}

	/**
	 * @param failOnMissing throw once all files are written if any requested id was not found
	 */
	public SubtreeExporter(boolean failOnMissing, NewickWriter writer) {
		this.failOnMissing = failOnMissing;
		this.writer = writer;
	}

	/**
	 * Adds the ids that `skeleton` grafts from to `included`, and the ids it prunes to `excluded`.
	 */
	public static void collectSources(Tree skeleton, Set<String> included, Set<String> excluded) {
		for (TreeNode n : skeleton.nodes(NodeOrder.PREORDER)) {
			if (!n.isGraftPoint()) {
				continue;
			}
			ExclusionList ex = (ExclusionList) n.getDirective(Directive.Kind.EXCLUSION);
			String source = (ex != null && ex.getSourceId() != null) ? ex.getSourceId() : n.getTaxonId();
			if (source != null) {
				included.add(source);
			}
			if (ex != null) {
				excluded.addAll(ex.getExcludedIds());
			}
		}
	}

	/**
	 * @return the files written, in id order
	 */
	public List<File> export(Collection<Tree> skeletons, ReferenceIndex index, File outputDir) throws IOException, TaxonNotFoundException {
		TreeSet<String> included = new TreeSet<String>();
		TreeSet<String> excluded = new TreeSet<String>();
		for (Tree skeleton : skeletons) {
			collectSources(skeleton, included, excluded);
		}
		_LOG.info(included.size() + " subtree(s) to extract, " + excluded.size() + " id(s) to exclude");

		FileUtils.forceMkdir(outputDir);
		ArrayList<File> written = new ArrayList<File>();
		ArrayList<String> missing = new ArrayList<String>();
		String extension = GeneralConstants.SUBTREE_FILE_EXTENSION.stringValue();
		for (String id : included) {
			TreeNode clade = index.extract(id, excluded);
			if (clade == null) {
				_LOG.warn("ott" + id + " is not in the reference tree");
				missing.add(id);
				continue;
			}
			File f = new File(outputDir, id + extension);
			_LOG.debug("Writing file: " + f);
			writer.write(new Tree(clade), f);
			written.add(f);
		}
		_LOG.info("Extracted " + written.size() + " trees from the reference tree");
		if (failOnMissing && !missing.isEmpty()) {
			throw new TaxonNotFoundException(missing);
		}
		return written;
	}
}
