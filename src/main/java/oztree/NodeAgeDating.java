package oztree;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.map.hash.THashMap;
import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import oztree.constants.GeneralConstants;
import oztree.exceptions.DataFormatException;
import oztree.exceptions.TreeBuildException;
import oztree.tree.NodeOrder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Dates the nodes of a tree from published node ages and rewrites its branch lengths from the
 * dates.
 *
 * Each node takes the median of the ages listed for its key ("ott" + taxon id, or the whole
 * name when there is no id). Leaves default to 0. An interior node with no listed age takes the
 * age implied by its children's dates and branch lengths when all of those are known. Nodes
 * still undated are then placed between their parent's date and the oldest date found below
 * them, and every edge becomes the difference between its two end dates.
 */
public class NodeAgeDating {
	static Logger _LOG = Logger.getLogger(NodeAgeDating.class);

	private static final Pattern ID_SUFFIX = Pattern.compile("[_ ](ott\\d+)$");

	// date of the oldest dated node below, and the number of edges to it
	private static class OldestPath {
		final double date;
		final int length;

		OldestPath(double date, int length) {
			this.date = date;
			this.length = length;
		}
	}

	private final TObjectDoubleHashMap<String> medians = new TObjectDoubleHashMap<String>();

	/**
	 * @param ages listed ages per key; keys with no ages are ignored
	 */
	public NodeAgeDating(Map<String, ? extends Collection<Double>> ages) {
		for (Map.Entry<String, ? extends Collection<Double>> e : ages.entrySet()) {
			TDoubleArrayList list = new TDoubleArrayList();
			for (Double d : e.getValue()) {
				list.add(d);
			}
			if (!list.isEmpty()) {
				medians.put(e.getKey(), median(list));
			}
		}
	}

	private NodeAgeDating(TObjectDoubleHashMap<String> medians) {
		this.medians.putAll(medians);
	}

	public static NodeAgeDating none() {
		return new NodeAgeDating(new TObjectDoubleHashMap<String>());
	}

	/**
	 * Reads a file of the form {@code {"node_ages": {"ott123": [{"age": 12.5}, {"age": "13"}], ...}}}.
	 */
	public static NodeAgeDating readFile(File f) throws IOException, DataFormatException {
		JSONParser jsonParser = new JSONParser();
		Object parsed;
		try (Reader reader = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
			parsed = jsonParser.parse(reader);
		} catch (ParseException pe) {
			throw fileError("invalid JSON in node ages: " + pe.toString(), f);
		}
		if (!(parsed instanceof JSONObject) || !(((JSONObject) parsed).get("node_ages") instanceof JSONObject)) {
			throw fileError("node ages must be a JSON object with a \"node_ages\" object", f);
		}
		TObjectDoubleHashMap<String> medians = new TObjectDoubleHashMap<String>();
		for (Object o : ((JSONObject) ((JSONObject) parsed).get("node_ages")).entrySet()) {
			Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
			String key = String.valueOf(e.getKey());
			if (!(e.getValue() instanceof JSONArray)) {
				throw fileError("ages of '" + key + "' must be a JSON array", f);
			}
			TDoubleArrayList ages = new TDoubleArrayList();
			for (Object entry : (JSONArray) e.getValue()) {
				Object age = (entry instanceof JSONObject) ? ((JSONObject) entry).get("age") : null;
				if (age == null) {
					throw fileError("an age of '" + key + "' has no \"age\" field", f);
				}
				try {
					ages.add(Double.parseDouble(String.valueOf(age)));
				} catch (NumberFormatException nfe) {
					throw fileError("age '" + age + "' of '" + key + "' is not a number", f);
				}
			}
			if (!ages.isEmpty()) {
				medians.put(key, median(ages));
			}
		}
		_LOG.info("read ages for " + medians.size() + " nodes from " + f);
		return new NodeAgeDating(medians);
	}

	static double median(TDoubleArrayList ages) {
		TDoubleArrayList sorted = new TDoubleArrayList(ages);
		sorted.sort();
		int mid = (sorted.size() - 1) / 2;
		if (sorted.size() % 2 == 0) {
			return (sorted.get(mid) + sorted.get(mid + 1)) / 2;
		}
		return sorted.get(mid);
	}

	/** @return the median listed age for `key`, or NaN when none is listed */
	public double getMedianAge(String key) {
		return medians.containsKey(key) ? medians.get(key) : Double.NaN;
	}

	/**
	 * "ott" + the taxon id, else an id written after a space or underscore at the end of the
	 * name, else the whole name.
	 */
	public static String ageKey(TreeNode n) {
		if (n.getTaxonId() != null) {
			return "ott" + n.getTaxonId();
		}
		Matcher m = ID_SUFFIX.matcher(n.getName());
		return m.find() ? m.group(1) : n.getName();
	}

	/**
	 * Dates from the listed ages only. Leaves that are not graft points default to 0.
	 * @return the dated nodes; undated nodes are absent
	 */
	public TObjectDoubleHashMap<TreeNode> applyNodeAges(Tree tree) {
		return assignDates(tree, false);
	}

	/**
	 * Dates from branch lengths only: leaves are 0, and a parent is the oldest of its children's
	 * date plus edge, as long as every child is dated and has a length.
	 */
	public static TObjectDoubleHashMap<TreeNode> agesFromLengths(Tree tree) {
		return none().assignDates(tree, true);
	}

	/**
	 * Listed ages first, falling back to the ages implied by branch lengths.
	 */
	public TObjectDoubleHashMap<TreeNode> assignDates(Tree tree) {
		return assignDates(tree, true);
	}

	private TObjectDoubleHashMap<TreeNode> assignDates(Tree tree, boolean useLengths) {
		TObjectDoubleHashMap<TreeNode> dates = new TObjectDoubleHashMap<TreeNode>();
		double minInteriorAge = GeneralConstants.MIN_INTERIOR_AGE.doubleValue();
		for (TreeNode n : tree.nodes(NodeOrder.POSTORDER)) {
			if (n.isExternal() && n.isGraftPoint()) {
				continue;
			}
			double listed = getMedianAge(ageKey(n));
			if (!Double.isNaN(listed)) {
				if (n.isInternal() && listed < minInteriorAge) {
					_LOG.warn("interior node " + n + " has a median age of 0, treating it as undated");
				} else {
					dates.put(n, listed);
					continue;
				}
			}
			if (n.isExternal()) {
				dates.put(n, 0.0);
				continue;
			}
			if (!useLengths) {
				continue;
			}
			double date = 0.0;
			boolean known = true;
			for (TreeNode c : n.getChildren()) {
				if (!dates.containsKey(c) || !c.hasBranchLength()) {
					known = false;
					break;
				}
				date = Math.max(date, dates.get(c) + c.getBL());
			}
			if (known) {
				dates.put(n, date);
			}
		}
		return dates;
	}

	/**
	 * Dates every node and replaces every branch length below the root with the difference of
	 * the dates at its ends. Nothing changes when the root cannot be dated.
	 *
	 * @return false if the root has no date
	 * @throws TreeBuildException if a node ends up older than its parent
	 */
	public boolean date(Tree tree) throws TreeBuildException {
		TObjectDoubleHashMap<TreeNode> dates = assignDates(tree);
		if (!dates.containsKey(tree.getRoot())) {
			_LOG.warn("the root " + tree.getRoot() + " has no age; branch lengths are left as they are");
			return false;
		}
		int listed = dates.size();
		imputeMissingDates(tree.getRoot(), dates, GeneralConstants.DATING_LONG_PATH_WEIGHT.doubleValue(),
				GeneralConstants.DATING_SPACING_EXPONENT.doubleValue());
		_LOG.info("dated " + listed + " node(s), imputed " + (dates.size() - listed));
		computeBranchLengths(tree.getRoot(), dates);
		return true;
	}

	/**
	 * Gives a date to every node of `root`'s subtree that lacks one in `dates`. Each such node
	 * is spaced along the path from its parent's date down to the oldest date below it. When
	 * several paths reach that date, the dates found along the longest and the shortest one are
	 * mixed as {@code longWeight * long + (1 - longWeight) * short}. With `spacing` 0 the nodes on a
	 * path are evenly spaced; otherwise the gaps follow exp(spacing * x).
	 *
	 * @throws IllegalArgumentException if `root` itself is undated
	 */
	public static void imputeMissingDates(TreeNode root, TObjectDoubleHashMap<TreeNode> dates, double longWeight, double spacing) {
		if (!dates.containsKey(root)) {
			throw new IllegalArgumentException("the root must be dated before the rest can be imputed");
		}
		THashMap<TreeNode, OldestPath> longest = new THashMap<TreeNode, OldestPath>();
		THashMap<TreeNode, OldestPath> shortest = new THashMap<TreeNode, OldestPath>();
		for (TreeNode n : root.getDescendants(NodeOrder.POSTORDER)) {
			if (dates.containsKey(n) || n.isExternal()) {
				// undated leaves count as the present
				OldestPath here = new OldestPath(dates.containsKey(n) ? dates.get(n) : 0.0, 0);
				longest.put(n, here);
				shortest.put(n, here);
				continue;
			}
			OldestPath bestLong = null;
			OldestPath bestShort = null;
			for (TreeNode c : n.getChildren()) {
				OldestPath l = longest.get(c);
				OldestPath s = shortest.get(c);
				if (bestLong == null || l.date > bestLong.date || (l.date == bestLong.date && l.length + 1 > bestLong.length)) {
					bestLong = new OldestPath(l.date, l.length + 1);
				}
				if (bestShort == null || s.date > bestShort.date || (s.date == bestShort.date && s.length + 1 < bestShort.length)) {
					bestShort = new OldestPath(s.date, s.length + 1);
				}
			}
			longest.put(n, bestLong);
			shortest.put(n, bestShort);
		}

		for (TreeNode n : root.getDescendants(NodeOrder.PREORDER)) {
			if (dates.containsKey(n)) {
				continue;
			}
			double above = dates.get(n.getParent());
			OldestPath l = longest.get(n);
			OldestPath s = shortest.get(n);
			double viaLong = interpolate(above, l.date, l.length, spacing);
			double viaShort = interpolate(above, s.date, s.length, spacing);
			dates.put(n, longWeight * viaLong + (1 - longWeight) * viaShort);
		}
	}

	// first step down from `above` towards `oldest`, `steps` edges below
	private static double interpolate(double above, double oldest, int steps, double spacing) {
		double total = 0.0;
		for (int i = 0; i <= steps; i++) {
			total += (steps == 0) ? 1.0 : Math.exp(spacing * i / steps);
		}
		return above - (above - oldest) / total;
	}

	/**
	 * Sets the length of every edge below `root` to the parent's date minus the child's.
	 * @throws TreeBuildException if a child is older than its parent
	 */
	public static void computeBranchLengths(TreeNode root, TObjectDoubleHashMap<TreeNode> dates) throws TreeBuildException {
		for (TreeNode n : root.getDescendants(NodeOrder.PREORDER)) {
			if (n == root) {
				continue;
			}
			double length = dates.get(n.getParent()) - dates.get(n);
			if (length < 0) {
				throw new TreeBuildException("node " + n + " (age " + dates.get(n) + ") is older than its parent "
						+ n.getParent() + " (age " + dates.get(n.getParent()) + ")");
			}
			n.setBL(length);
		}
	}

	private static DataFormatException fileError(String msg, File f) {
		DataFormatException dfe = new DataFormatException(msg);
		dfe.setFilePath(f.getPath());
		return dfe;
	}
}
