/**
 * Spectrum Features Fit
 * FeatureGuesserTest.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FeatureGuesserTest {

	private static final String SL1 = "spitzer.irs.sl.1";
	private static final double INF = Double.POSITIVE_INFINITY;

	private final SegmentedInstrument irs = SegmentedInstrument.spitzerIrs();

	private static Spectrum flat(final double level, final double z) {
		final int n = 300;
		final double[] x = new double[n];
		final double[] y = new double[n];
		final double[] s = new double[n];
		for (int i = 0; i < n; i++) {
			x[i] = 7.5 + i * 0.02;
			y[i] = level;
			s[i] = 0.01;
		}
		return new Spectrum(x, y, s, SL1, z, FluxUnit.INTENSITY);
	}

	@Test
	void trapezoid() {
		assertEquals(4.0, FeatureGuesser.trapezoid(new double[] { 0, 1, 2 },
			new double[] { 2, 2, 2 }), 0.0);
		assertEquals(1.0, FeatureGuesser.trapezoid(new double[] { 0, 1, 2 },
			new double[] { 0, 1, 0 }), 0.0);
	}

	@Test
	void fluxIsConstantBeyondTheData() {
		final FeatureGuesser g = new FeatureGuesser(flat(3.0, 0), irs);
		assertEquals(3.0, g.flux(1.0), 0.0);
		assertEquals(3.0, g.flux(100.0), 0.0);
		assertEquals(3.0, g.flux(10.0), 1e-12);
	}

	@Test
	void starlightMatchesFluxAtShortEnd() {
		final FeatureGuesser g = new FeatureGuesser(flat(2.0, 0), irs);
		final Feature star = new Feature("starlight", FeatureKind.STARLIGHT).set(
			FeatureParameter.TEMPERATURE, BoundedParameter.fixed(5000)).set(
				FeatureParameter.TAU, BoundedParameter.bounded(0, 0, INF));
		// the short end is beyond 5 micron, the blackbody is taken at 5 micron
		assertEquals(2.0 / new BlackBody(false).shape(5.0, 5000), g.starlight(
			star), 1e-12 * g.starlight(star));
	}

	@Test
	void flatSpectrumHasNoLinePower() {
		final FeatureGuesser g = new FeatureGuesser(flat(2.0, 0), irs);
		final Feature line = new Feature("NeII", FeatureKind.LINE).set(
			FeatureParameter.POWER, BoundedParameter.bounded(0, 0, INF)).set(
				FeatureParameter.WAVELENGTH, BoundedParameter.fixed(12.813));
		assertEquals(0.0, g.linePower(line, 0.12), 1e-9);
	}

	@Test
	void guessRespectsFixedAndBounds() {
		final FeatureTable t = FeatureTable.builder().starlight("starlight",
			BoundedParameter.fixed(5000), BoundedParameter.fixed(7.0)).dustContinuum(
				"BB200", BoundedParameter.fixed(200), BoundedParameter.bounded(0, 0,
					1e-20)).dustContinuum("BB100", BoundedParameter.fixed(100),
						BoundedParameter.bounded(0, 0, INF)).line("NeII", BoundedParameter
							.bounded(1, 0, INF), BoundedParameter.fixed(12.813), null).line(
								"OIV", BoundedParameter.bounded(1, 0, INF), BoundedParameter
									.fixed(25.91), null).dustFeature("PAH_11.33um",
										BoundedParameter.bounded(0, 0, INF), BoundedParameter.fixed(
											11.33), BoundedParameter.fixed(0.36256)).build();
		new FeatureGuesser(flat(2.0, 0), irs).guess(t, new FitSettings());

		assertEquals(7.0, t.get("starlight").getValue(FeatureParameter.TAU), 0.0);
		assertEquals(1e-20, t.get("BB200").getValue(FeatureParameter.TAU), 0.0);
		assertTrue(t.get("BB100").getValue(FeatureParameter.TAU) > 0);
		// out of the segment: no power, no width
		assertEquals(0.0, t.get("OIV").getValue(FeatureParameter.POWER), 0.0);
		assertEquals(null, t.get("OIV").get(FeatureParameter.FWHM));
		// inside: instrument width
		assertEquals(1 / 8.25, t.get("NeII").getValue(FeatureParameter.FWHM),
			1e-12);
		assertTrue(t.get("NeII").isFixed(FeatureParameter.FWHM));
		final double peak = new PowerDrude(FluxUnit.INTENSITY).amplitude(t.get(
			"PAH_11.33um").getValue(FeatureParameter.POWER), 11.33, 0.36256);
		assertEquals(2.0, peak, 1e-9);
	}

	@Test
	void dustContinuumSharesTheFlux() {
		final FeatureTable t = FeatureTable.builder().dustContinuum("BB300",
			BoundedParameter.fixed(300), BoundedParameter.bounded(0, 0, INF))
			.dustContinuum("BB35", BoundedParameter.fixed(35), BoundedParameter
				.bounded(0, 0, INF)).build();
		new FeatureGuesser(flat(2.0, 0), irs).guess(t, new FitSettings());
		final BlackBody bb = new BlackBody(false);
		// 300 K peaks at 9.66 micron, inside the data
		assertEquals(1.0 / bb.shape(2898.0 / 300, 300), t.get("BB300").getValue(
			FeatureParameter.TAU), 1e-9 * t.get("BB300").getValue(
				FeatureParameter.TAU));
		// 35 K peaks beyond the data, the long end is used
		final double wmax = 7.5 + 299 * 0.02;
		assertEquals(1.0 / bb.shape(wmax, 35), t.get("BB35").getValue(
			FeatureParameter.TAU), 1e-9 * t.get("BB35").getValue(
				FeatureParameter.TAU));
	}

	@Test
	void dustContinuumMatchesPlainBlackBody() {
		final FeatureTable t = FeatureTable.builder().dustContinuum("BB35",
			BoundedParameter.fixed(35), BoundedParameter.bounded(0, 0, INF)).build();
		new FeatureGuesser(flat(2.0, 0), irs).guess(t, new FitSettings());
		final double wmax = 7.5 + 299 * 0.02;
		final double tau = t.get("BB35").getValue(FeatureParameter.TAU);
		assertEquals(2.0 / new BlackBody(false).shape(wmax, 35), tau, 1e-9 * tau);
		// the emissivity factor of the modified shape is not applied
		final double r = BlackBody.REFERENCE_WAVELENGTH / wmax;
		assertEquals(r * r, 2.0 / new BlackBody(true).shape(wmax, 35) / tau,
			1e-9);
	}

	@Test
	void redshiftMovesTheWindow() {
		// 12.813 * 1.2 = 15.4, outside the first order of the short module
		final FeatureTable t = FeatureTable.builder().line("NeII", BoundedParameter
			.bounded(1, 0, INF), BoundedParameter.fixed(12.813), null).build();
		new FeatureGuesser(flat(2.0, 0.2), irs).guess(t, new FitSettings());
		assertEquals(0.0, t.get("NeII").getValue(FeatureParameter.POWER), 0.0);
	}
}
