/**
 * Spectrum Features Fit
 * FeatureTableIOTest.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FeatureTableIOTest {

	@TempDir
	Path dir;

	static void assertSameTable(final FeatureTable expected,
		final FeatureTable actual)
	{
		assertEquals(expected.getNames(), actual.getNames());
		assertEquals(expected.getRedshift(), actual.getRedshift(), 0.0);
		assertEquals(expected.getInstrument(), actual.getInstrument());
		assertEquals(expected.getFluxUnit(), actual.getFluxUnit());
		for (final Feature e : expected) {
			final Feature a = actual.get(e.getName());
			assertEquals(e.getKind(), a.getKind());
			assertEquals(e.getGroup(), a.getGroup());
			assertEquals(e.getGeometry(), a.getGeometry());
			assertEquals(e.getParameters(), a.getParameters(), e.getName());
		}
	}

	@Test
	void roundTripIsExact() throws IOException {
		final FeatureTable t = FeatureTableTest.sample();
		t.get("PAH_11.33um").setValue(FeatureParameter.POWER, 0.1 + 0.2);
		t.setRedshift(0.0123);
		t.setInstrument("spitzer.irs.sl.1");
		t.setFluxUnit(FluxUnit.FLUX_DENSITY);
		t.add(new Feature("silicate", FeatureKind.ATTENUATION).set(
			FeatureParameter.TAU, BoundedParameter.fromColumns(0.1, 0.0, null)));
		t.get("silicate").setGeometry("mixed");

		final Path file = dir.resolve("features.tsv");
		FeatureTableIO.write(t, file);
		final FeatureTable back = FeatureTableIO.read(file);
		assertSameTable(t, back);

		// and again, nothing drifts
		final StringWriter w = new StringWriter();
		FeatureTableIO.write(back, w);
		assertSameTable(t, FeatureTableIO.read(new StringReader(w.toString())));
	}

	@Test
	void maskedCells() throws IOException {
		final String text = "name\tkind\tgroup\tgeometry\ttemperature\t" +
			"temperature_min\ttemperature_max\ttau\ttau_min\ttau_max\n" +
			"BB35\tdust_continuum\t--\t--\t35\t--\t--\t0\t0\tinf\n";
		final FeatureTable t = FeatureTableIO.read(new StringReader(text));
		final Feature f = t.get("BB35");
		assertTrue(f.isFixed(FeatureParameter.TEMPERATURE));
		assertFalse(f.isFixed(FeatureParameter.TAU));
		assertFalse(f.get(FeatureParameter.TAU).hasUpperBound());
		assertEquals("", f.getGroup());
		assertNull(f.get(FeatureParameter.FWHM));
	}

	@Test
	void handEditedTable() throws IOException {
		final FeatureTable t;
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(
			"tables/hand_edited.tsv"))
		{
			t = FeatureTableIO.read(new InputStreamReader(in,
				StandardCharsets.UTF_8));
		}
		assertEquals(5, t.size());
		assertEquals(0.0023, t.getRedshift(), 0.0);
		assertEquals("spitzer.irs.sl.[12]", t.getInstrument());
		assertEquals(FluxUnit.FLUX_DENSITY, t.getFluxUnit());

		assertEquals(BoundedParameter.bounded(1.5e-12, 0,
			Double.POSITIVE_INFINITY), t.get("starlight").get(FeatureParameter.TAU));
		final Feature pah = t.get("PAH_7.7");
		assertEquals(BoundedParameter.unbounded(0.5), pah.get(FeatureParameter.FWHM));
		assertEquals(BoundedParameter.bounded(2, 0, Double.POSITIVE_INFINITY), pah
			.get(FeatureParameter.POWER));
		assertEquals(BoundedParameter.unbounded(0), t.get("ArII").get(
			FeatureParameter.POWER));
		assertNull(t.get("ArII").get(FeatureParameter.FWHM));
		assertTrue(t.get("H2O_6.1").isFixed(FeatureParameter.FWHM));
		assertEquals("mixed", t.get("silicate").getGeometry());
		assertEquals("", t.get("starlight").getGeometry());
	}

	@Test
	void badRowsReportLine() {
		final String text = "name\tkind\ttau\ttau_min\ttau_max\n" +
			"x\tattenuation\tabc\t--\t--\n";
		final IOException e = assertThrows(IOException.class,
			() -> FeatureTableIO.read(new StringReader(text)));
		assertTrue(e.getMessage().startsWith("Line 2"));
	}

	@Test
	void unknownKindInFile() {
		final String text = "name\tkind\nx\tcomet\n";
		assertThrows(UnsupportedKindException.class, () -> FeatureTableIO.read(
			new StringReader(text)));
	}

	@Test
	void bundledClassicPack() throws IOException {
		final FeatureTable t = FeatureTableIO.readPack("classic.tsv");
		assertEquals(1, t.countKind(FeatureKind.STARLIGHT));
		assertEquals(8, t.countKind(FeatureKind.DUST_CONTINUUM));
		assertEquals(25, t.countKind(FeatureKind.DUST_FEATURE));
		assertEquals(18, t.countKind(FeatureKind.LINE));
		assertEquals(1, t.countKind(FeatureKind.ATTENUATION));
		assertEquals(FluxUnit.INTENSITY, t.getFluxUnit());
		assertEquals("mixed", t.get("silicate").getGeometry());
		assertNull(t.get("NeII").get(FeatureParameter.FWHM));
	}

	@Test
	void packFromFile() throws IOException {
		final Path file = dir.resolve("mine.tsv");
		FeatureTableIO.write(FeatureTableTest.sample(), file);
		assertEquals(4, FeatureTableIO.readPack(file.toString()).size());
	}

	@Test
	void missingPack() {
		assertThrows(FileNotFoundException.class, () -> FeatureTableIO.readPack(
			"no-such-pack.tsv"));
	}
}
