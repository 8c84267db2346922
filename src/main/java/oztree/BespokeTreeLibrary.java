package oztree;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import oztree.exceptions.DataFormatException;
import oztree.exceptions.NewickSyntaxException;
import oztree.tree.NewickReader;
import oztree.tree.Tree;

/**
 * Hand-built trees that name-only graft tokens such as {@code AMORPHEA@} stand for. Each token
 * maps to a file in the parts folder, with an optional length for the edge it is attached by
 * and an optional label to give its root.
 */
public class BespokeTreeLibrary {
	static Logger _LOG = Logger.getLogger(BespokeTreeLibrary.class);

	public static class Entry {
		private final String token;
		private final String file;
		private final double edgeLength;
		private final String taxon;

		public Entry(String token, String file, double edgeLength, String taxon) {
			this.token = token;
			this.file = file;
			this.edgeLength = edgeLength;
			this.taxon = taxon;
		}

		public String getToken() {return token;}

		public String getFile() {return file;}

		/** NaN when the file's own root length is to be used */
		public double getEdgeLength() {return edgeLength;}

		public boolean hasEdgeLength() {return !Double.isNaN(edgeLength);}

		/** null when the file's own root label is to be used */
		public String getTaxon() {return taxon;}
	}

	private final File partsFolder;
	private final TreeMap<String, Entry> entries;

	public BespokeTreeLibrary(File partsFolder, Map<String, Entry> entries) {
		this.partsFolder = partsFolder;
		this.entries = new TreeMap<String, Entry>(entries);
	}

	public static BespokeTreeLibrary empty() {
		return new BespokeTreeLibrary(new File("."), Collections.<String, Entry>emptyMap());
	}

	/**
	 * Reads a token mapping of the form
	 * {@code {"AMORPHEA": {"file": "Amorphea.PHY", "edge_length": 50, "taxon": null}, ...}}.
	 * File names are resolved against `partsFolder`.
	 */
	public static BespokeTreeLibrary fromMappingFile(File mappingFile, File partsFolder) throws IOException, DataFormatException {
		JSONParser jsonParser = new JSONParser();
		Object parsed;
		try (Reader reader = Files.newBufferedReader(mappingFile.toPath(), StandardCharsets.UTF_8)) {
			parsed = jsonParser.parse(reader);
		} catch (ParseException pe) {
			DataFormatException dfe = new DataFormatException("invalid JSON in token mapping: " + pe.toString());
			dfe.setFilePath(mappingFile.getPath());
			throw dfe;
		}
		if (!(parsed instanceof JSONObject)) {
			throw fileError("the token mapping must be a JSON object", mappingFile);
		}
		TreeMap<String, Entry> entries = new TreeMap<String, Entry>();
		for (Object o : ((JSONObject) parsed).entrySet()) {
			Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
			String token = String.valueOf(e.getKey());
			if (!(e.getValue() instanceof JSONObject)) {
				throw fileError("mapping for '" + token + "' must be a JSON object", mappingFile);
			}
			JSONObject m = (JSONObject) e.getValue();
			Object file = m.get("file");
			if (!(file instanceof String)) {
				throw fileError("mapping for '" + token + "' has no \"file\"", mappingFile);
			}
			double edgeLength = Double.NaN;
			Object el = m.get("edge_length");
			if (el instanceof Number) {
				edgeLength = ((Number) el).doubleValue();
			} else if (el != null) {
				throw fileError("\"edge_length\" of '" + token + "' must be a number or null", mappingFile);
			}
			Object taxon = m.get("taxon");
			entries.put(token, new Entry(token, (String) file, edgeLength, (taxon == null) ? null : String.valueOf(taxon)));
		}
		_LOG.info("read " + entries.size() + " bespoke tree mappings from " + mappingFile);
		return new BespokeTreeLibrary(partsFolder, entries);
	}

	/**
	 * Maps every .PHY/.phy file in `partsFolder` to the upper-cased file name without its
	 * extension, with no overrides.
	 */
	public static BespokeTreeLibrary fromDirectory(File partsFolder) throws IOException {
		File[] files = partsFolder.listFiles();
		if (files == null) {
			throw new IOException("cannot list the parts folder '" + partsFolder + "'");
		}
		TreeMap<String, Entry> entries = new TreeMap<String, Entry>();
		for (File f : files) {
			if (!f.isFile() || !FilenameUtils.getExtension(f.getName()).equalsIgnoreCase("phy")) {
				continue;
			}
			String token = FilenameUtils.getBaseName(f.getName()).toUpperCase(Locale.ROOT);
			if (entries.containsKey(token)) {
				_LOG.warn("'" + f.getName() + "' and '" + entries.get(token).getFile() + "' both map to " + token + "; keeping the first");
				continue;
			}
			entries.put(token, new Entry(token, f.getName(), Double.NaN, null));
		}
		return new BespokeTreeLibrary(partsFolder, entries);
	}

	public boolean contains(String token) {
		return entries.containsKey(token);
	}

	public Entry getEntry(String token) {
		return entries.get(token);
	}

	public int size() {
		return entries.size();
	}

	public File getFile(String token) {
		Entry e = entries.get(token);
		return (e == null) ? null : new File(partsFolder, e.getFile());
	}

	/**
	 * Parses the tree file mapped to `token`. Each call reads the file again.
	 */
	public Tree loadTree(String token) throws IOException, NewickSyntaxException {
		File f = getFile(token);
		if (f == null) {
			throw new IllegalArgumentException("no bespoke tree is mapped to '" + token + "'");
		}
		_LOG.debug("reading bespoke tree " + token + " from " + f);
		return new NewickReader().readTree(f);
	}

	private static DataFormatException fileError(String msg, File f) {
		DataFormatException dfe = new DataFormatException(msg);
		dfe.setFilePath(f.getPath());
		return dfe;
	}
}
