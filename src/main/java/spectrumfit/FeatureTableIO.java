/**
 * Spectrum Features Fit
 * FeatureTableIO.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * Tab separated, row oriented persistence of a {@link FeatureTable}.
 * <p>
 * Layout:
 *
 * <pre>
 * # redshift	0.0
 * # instrument	spitzer.irs.*.[12]
 * # flux_unit	MJy/sr
 * name	kind	group	geometry	temperature	temperature_min	temperature_max	tau	...
 * </pre>
 *
 * Each parameter takes three cells. {@code --} is a masked cell: a masked
 * value means the column is absent for that row, two masked bounds mean the
 * parameter is fixed. Infinite bounds are written as {@code inf}/{@code -inf}.
 * Finite numbers are written with {@link Double#toString(double)} so that a
 * save/load cycle is exact.
 */
public final class FeatureTableIO {

	static final String MASKED = "--";
	static final String PACK_DIR = "packs/";

	private static final String REDSHIFT = "redshift";
	private static final String INSTRUMENT = "instrument";
	private static final String FLUX_UNIT = "flux_unit";

	private FeatureTableIO() {}

	public static void write(final FeatureTable table, final Path file)
		throws IOException
	{
		try (BufferedWriter out = Files.newBufferedWriter(file,
			StandardCharsets.UTF_8))
		{
			write(table, out);
		}
	}

	public static void write(final FeatureTable table, final Writer writer)
		throws IOException
	{
		final BufferedWriter out = writer instanceof BufferedWriter
			? (BufferedWriter) writer : new BufferedWriter(writer);
		out.write("# " + REDSHIFT + "\t" + Double.toString(table.getRedshift()));
		out.newLine();
		out.write("# " + INSTRUMENT + "\t" + table.getInstrument());
		out.newLine();
		out.write("# " + FLUX_UNIT + "\t" + table.getFluxUnit().getLabel());
		out.newLine();

		final StringBuilder header = new StringBuilder("name\tkind\tgroup\tgeometry");
		for (final FeatureParameter p : FeatureParameter.values()) {
			final String c = p.getColumnName();
			header.append('\t').append(c).append('\t').append(c).append("_min")
				.append('\t').append(c).append("_max");
		}
		out.write(header.toString());
		out.newLine();

		for (final Feature f : table) {
			final StringBuilder row = new StringBuilder();
			row.append(f.getName()).append('\t').append(f.getKind().getTableName())
				.append('\t').append(f.getGroup()).append('\t').append(f
					.getGeometry());
			for (final FeatureParameter p : FeatureParameter.values()) {
				final BoundedParameter bp = f.get(p);
				if (bp == null) {
					row.append('\t').append(MASKED).append('\t').append(MASKED).append(
						'\t').append(MASKED);
				}
				else if (bp.isFixed()) {
					row.append('\t').append(format(bp.getValue())).append('\t').append(
						MASKED).append('\t').append(MASKED);
				}
				else {
					row.append('\t').append(format(bp.getValue())).append('\t').append(
						format(bp.getLower())).append('\t').append(format(bp.getUpper()));
				}
			}
			out.write(row.toString());
			out.newLine();
		}
		out.flush();
	}

	public static FeatureTable read(final Path file) throws IOException {
		try (BufferedReader in = Files.newBufferedReader(file,
			StandardCharsets.UTF_8))
		{
			return read(in);
		}
	}

	/**
	 * Read a science pack: a file path, or the name of a pack bundled under
	 * {@code packs/} on the classpath.
	 *
	 * @throws FileNotFoundException if neither exists
	 */
	public static FeatureTable readPack(final String pack) throws IOException {
		final Path path = Paths.get(pack);
		if (Files.isRegularFile(path)) return read(path);

		final InputStream stream = FeatureTableIO.class.getClassLoader()
			.getResourceAsStream(PACK_DIR + pack);
		if (stream == null) {
			throw new FileNotFoundException("Input pack " + pack + " not found");
		}
		try (BufferedReader in = new BufferedReader(new InputStreamReader(stream,
			StandardCharsets.UTF_8)))
		{
			return read(in);
		}
	}

	public static FeatureTable read(final Reader reader) throws IOException {
		final BufferedReader in = reader instanceof BufferedReader
			? (BufferedReader) reader : new BufferedReader(reader);
		final FeatureTable table = new FeatureTable();
		Map<String, Integer> columns = null;
		String line;
		int lineNumber = 0;
		while ((line = in.readLine()) != null) {
			lineNumber++;
			if (StringUtils.isBlank(line)) continue;
			if (line.startsWith("#")) {
				readMeta(table, line.substring(1).trim());
				continue;
			}
			final String[] cells = StringUtils.splitPreserveAllTokens(line, '\t');
			if (columns == null) {
				columns = new HashMap<>();
				for (int c = 0; c < cells.length; c++)
					columns.put(cells[c].trim(), c);
				for (final String required : new String[] { "name", "kind" }) {
					if (!columns.containsKey(required)) {
						throw new IOException("Missing column '" + required + "'");
					}
				}
				continue;
			}
			try {
				table.add(readRow(columns, cells));
			}
			catch (final IllegalArgumentException e) {
				throw new IOException("Line " + lineNumber + ": " + e.getMessage(), e);
			}
		}
		return table;
	}

	private static void readMeta(final FeatureTable table, final String meta) {
		final String key = StringUtils.substringBefore(meta, "\t").trim();
		final String value = StringUtils.substringAfter(meta, "\t").trim();
		if (REDSHIFT.equals(key)) table.setRedshift(parse(value));
		else if (INSTRUMENT.equals(key)) table.setInstrument(value);
		else if (FLUX_UNIT.equals(key)) table.setFluxUnit(FluxUnit.fromLabel(
			value));
		// other comment lines are free text
	}

	private static Feature readRow(final Map<String, Integer> columns,
		final String[] cells)
	{
		final String name = cell(columns, cells, "name");
		final FeatureKind kind = FeatureKind.fromTableName(cell(columns, cells,
			"kind"));
		final Feature f = new Feature(name, kind);
		final String group = cell(columns, cells, "group");
		final String geometry = cell(columns, cells, "geometry");
		f.setGroup(isMasked(group) ? "" : group);
		f.setGeometry(isMasked(geometry) ? "" : geometry);

		for (final FeatureParameter p : FeatureParameter.values()) {
			final String c = p.getColumnName();
			final String value = cell(columns, cells, c);
			if (isMasked(value)) continue;
			if (!kind.hasParameter(p)) {
				throw new IllegalArgumentException("Feature " + name + " (" + kind +
					") has a value for " + c);
			}
			final String min = cell(columns, cells, c + "_min");
			final String max = cell(columns, cells, c + "_max");
			f.set(p, BoundedParameter.fromColumns(parse(value), isMasked(min) ? null
				: parse(min), isMasked(max) ? null : parse(max)));
		}
		return f;
	}

	private static String cell(final Map<String, Integer> columns,
		final String[] cells, final String column)
	{
		final Integer index = columns.get(column);
		if (index == null || index >= cells.length) return "";
		return cells[index].trim();
	}

	private static boolean isMasked(final String cell) {
		return cell.isEmpty() || MASKED.equals(cell);
	}

	static String format(final double v) {
		if (v == Double.POSITIVE_INFINITY) return "inf";
		if (v == Double.NEGATIVE_INFINITY) return "-inf";
		return Double.toString(v);
	}

	static double parse(final String s) {
		final String t = StringUtils.lowerCase(s.trim());
		if ("inf".equals(t) || "+inf".equals(t) || "infinity".equals(t)) {
			return Double.POSITIVE_INFINITY;
		}
		if ("-inf".equals(t) || "-infinity".equals(t)) {
			return Double.NEGATIVE_INFINITY;
		}
		try {
			return Double.parseDouble(t);
		}
		catch (final NumberFormatException e) {
			throw new IllegalArgumentException("Not a number: '" + s + "'", e);
		}
	}
}
