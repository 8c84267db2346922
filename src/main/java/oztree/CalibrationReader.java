package oztree;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import oztree.exceptions.DataFormatException;

/**
 * Reads calibration statements of the form {@code mrca: taxonA, taxonB, fixage=<number>;}.
 *
 * Sidecar files hold nothing else: blank lines and lines starting with '#' are skipped, and any
 * other text is an error. The comment block at the head of a tree file may mix statements with
 * free text; only the statements are taken from it. In both cases a statement that starts with
 * "mrca:" but does not parse is an error.
 */
public class CalibrationReader {
	static Logger _LOG = Logger.getLogger(CalibrationReader.class);

	private static final String KEYWORD = "mrca:";
	private static final Pattern STATEMENT = Pattern.compile(
			"mrca:\\s*([^,;]+?)\\s*,\\s*([^,;]+?)\\s*,\\s*fixage\\s*=\\s*([^;\\s]+)\\s*;",
			Pattern.CASE_INSENSITIVE);

	public List<CalibrationConstraint> readFile(File sidecar) throws IOException, DataFormatException {
		String text = FileUtils.readFileToString(sidecar, StandardCharsets.UTF_8);
		try {
			List<CalibrationConstraint> constraints = parse(text, sidecar.getName(), true);
			_LOG.info("read " + constraints.size() + " calibration statements from " + sidecar);
			return constraints;
		} catch (DataFormatException dfe) {
			dfe.setFilePath(sidecar.getPath());
			throw dfe;
		}
	}

	/**
	 * @return the statements found in a tree's leading comment; empty if `comment` is null
	 */
	public List<CalibrationConstraint> readComment(String comment, String sourceName) throws DataFormatException {
		if (comment == null) {
			return new ArrayList<CalibrationConstraint>();
		}
		return parse(comment, sourceName, false);
	}

	/**
	 * @param strict reject any text besides statements, blank lines and '#' lines
	 */
	public List<CalibrationConstraint> parse(String text, String sourceName, boolean strict) throws DataFormatException {
		ArrayList<CalibrationConstraint> constraints = new ArrayList<CalibrationConstraint>();
		String[] lines = text.split("\r?\n", -1);
		for (int i = 0; i < lines.length; i++) {
			int lineNumber = i + 1;
			String line = lines[i];
			String trimmed = line.trim();
			if (trimmed.length() == 0 || (strict && trimmed.charAt(0) == '#')) {
				continue;
			}
			Matcher m = STATEMENT.matcher(line);
			int pos = 0;
			while (pos < line.length()) {
				int start = StringUtils.indexOfIgnoreCase(line, KEYWORD, pos);
				String between = (start < 0) ? line.substring(pos) : line.substring(pos, start);
				if (strict && !StringUtils.isBlank(between)) {
					throw new DataFormatException("unexpected text '" + between.trim() + "' in calibration file", lineNumber);
				}
				if (start < 0) {
					break;
				}
				m.region(start, line.length());
				if (!m.lookingAt()) {
					throw new DataFormatException("malformed calibration statement '" + line.substring(start).trim()
							+ "'; expected 'mrca: taxonA, taxonB, fixage=<age>;'", lineNumber);
				}
				constraints.add(toConstraint(m, sourceName, lineNumber));
				pos = m.end();
			}
		}
		return constraints;
	}

	private static CalibrationConstraint toConstraint(Matcher m, String sourceName, int lineNumber) throws DataFormatException {
		String ageText = m.group(3);
		double age;
		try {
			age = Double.parseDouble(ageText);
		} catch (NumberFormatException nfe) {
			throw new DataFormatException("'" + ageText + "' is not a valid age", lineNumber);
		}
		if (Double.isNaN(age) || Double.isInfinite(age) || age < 0) {
			throw new DataFormatException("calibration age must be a non-negative number, not '" + ageText + "'", lineNumber);
		}
		String source = (sourceName == null) ? "line " + lineNumber : sourceName + ":" + lineNumber;
		return new CalibrationConstraint(m.group(1), m.group(2), age, source);
	}
}
