/**
 * Spectrum Features Fit
 * ProfileTest.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.util.FastMath;
import org.junit.jupiter.api.Test;

class ProfileTest {

	private static final FluxUnit UNIT = FluxUnit.INTENSITY;

	@Test
	void silicateAttenuationIsOneWithoutDust() {
		final double[] y = new SilicateAttenuation().value(new double[] { 5, 10,
			20 }, 0.0);
		assertArrayEquals(new double[] { 1, 1, 1 }, y, 0.0);
	}

	@Test
	void drudeAbsorptionIsZeroWithoutDepth() {
		final double[] y = new DrudeAbsorption().value(new double[] { 5, 10, 20 },
			0.0, 10.0, 0.5);
		assertArrayEquals(new double[] { 0, 0, 0 }, y, 0.0);
	}

	@Test
	void drudeAbsorptionGradientAtZeroDepth() {
		final double p = Drude.profile(10.2, 10.0, 0.5);
		final double[] g = new DrudeAbsorption().gradient(10.2, 0.0, 10.0, 0.5);
		assertEquals(-0.5 * p, g[0], 1e-15);
		assertEquals(0.0, g[1], 0.0);
		assertEquals(0.0, g[2], 0.0);
	}

	@Test
	void silicateAttenuationDeepestAtSilicatePeak() {
		final SilicateAttenuation att = new SilicateAttenuation();
		final double peak = att.value(9.75, 2.0);
		assertTrue(peak < att.value(8.0, 2.0));
		assertTrue(peak < att.value(14.0, 2.0));
		assertTrue(peak > 0 && peak < 1);
	}

	@Test
	void kvtIsContinuousAtTheTableEnds() {
		assertEquals(SilicateAttenuation.kvt(8.0), SilicateAttenuation.kvt(
			8.0 - 1e-9), 1e-8);
		// the Drude tail is not matched to the last tabulated value
		assertEquals(SilicateAttenuation.kvt(12.7 - 1e-9), SilicateAttenuation
			.kvt(12.7), 0.02);
	}

	@Test
	void mixedScreenSeriesMatchesClosedForm() {
		final double t = 1e-3;
		assertEquals(-FastMath.expm1(-t) / t, Profile.mixedScreen(t * (1 -
			1e-12)), 1e-12);
		assertEquals(1.0, Profile.mixedScreen(0.0), 0.0);
		assertEquals(-0.5, Profile.mixedScreenDerivative(0.0), 0.0);
		final double t2 = 2e-3;
		final double numeric = (Profile.mixedScreen(t2 + 1e-6) - Profile
			.mixedScreen(t2 - 1e-6)) / 2e-6;
		assertEquals(numeric, Profile.mixedScreenDerivative(t2), 1e-7);
	}

	@Test
	void powerDrudeIntegratesToPower() {
		final PowerDrude drude = new PowerDrude(UNIT);
		final double power = 1.0;
		final int n = 400000;
		final double lmin = FastMath.log(0.01);
		final double lmax = FastMath.log(1000.0);
		double sum = 0;
		double xPrev = FastMath.exp(lmin);
		double fPrev = drude.value(xPrev, power, 10.0, 0.5) / (xPrev * xPrev);
		for (int i = 1; i <= n; i++) {
			final double x = FastMath.exp(lmin + (lmax - lmin) * i / n);
			final double f = drude.value(x, power, 10.0, 0.5) / (x * x);
			sum += (x - xPrev) * (f + fPrev) / 2;
			xPrev = x;
			fPrev = f;
		}
		assertEquals(power, sum / UNIT.amplitudeFactor(), 1e-3 * power);
	}

	@Test
	void powerGaussianIntegratesToPower() {
		final PowerGaussian gauss = new PowerGaussian(UNIT);
		final double power = 2.5;
		final double mean = 12.8;
		final double sd = 0.05;
		final int n = 20000;
		final double a = mean - 12 * sd;
		final double b = mean + 12 * sd;
		double sum = 0;
		for (int i = 0; i < n; i++) {
			final double x0 = a + (b - a) * i / n;
			final double x1 = a + (b - a) * (i + 1) / n;
			sum += (x1 - x0) * (gauss.value(x0, power, mean, sd) + gauss.value(x1,
				power, mean, sd)) / 2;
		}
		assertEquals(power, gauss.powerFromArea(sum, mean), 1e-6 * power);
	}

	@Test
	void powerDrudeAmplitudeInverts() {
		final PowerDrude drude = new PowerDrude(UNIT);
		final double b = drude.amplitude(3.0, 11.33, 0.36);
		assertEquals(3.0, drude.power(b, 11.33, 0.36), 1e-12);
		assertEquals(b, drude.value(11.33, 3.0, 11.33, 0.36), 1e-12 * b);
	}

	@Test
	void drudePeakIsAmplitude() {
		assertEquals(2.0, new Drude().value(7.7, 2.0, 7.7, 0.6), 1e-15);
		assertEquals(0.5, Drude.profile(7.7 + 0.3 + 0.3 * 0.3 / 7.7 / 2, 7.7,
			0.6), 0.01);
	}

	@Test
	void drudeRejectsZeroWidth() {
		assertThrows(NotStrictlyPositiveException.class, () -> Drude.profile(10,
			10, 0));
	}

	@Test
	void wrongParameterCount() {
		assertThrows(DimensionMismatchException.class, () -> new BlackBody(false)
			.value(new double[] { 10 }, 1.0));
	}

	@Test
	void blackBodyVanishesForExtremeArguments() {
		final BlackBody bb = new BlackBody(false);
		assertEquals(0.0, bb.value(1e-3, 1.0, 10.0), 0.0);
		assertArrayEquals(new double[] { 0, 0 }, bb.gradient(1e-3, 1.0, 10.0),
			0.0);
	}

	@Test
	void modifiedBlackBodyIsOneAtReference() {
		final double x = BlackBody.REFERENCE_WAVELENGTH;
		assertEquals(new BlackBody(false).value(x, 1.0, 200), new BlackBody(true)
			.value(x, 1.0, 200), 0.0);
	}

	@Test
	void gradientsMatchFiniteDifferences() {
		final double[] xs = { 6.3, 9.7, 10.2, 11.0, 14.5 };
		for (final double x : xs) {
			checkGradient(new BlackBody(false), x, 1e-10, 5000);
			checkGradient(new BlackBody(true), x, 2e-8, 180);
			checkGradient(new Drude(), x, 0.7, 10.0, 0.8);
			checkGradient(new PowerDrude(UNIT), x, 40.0, 10.0, 0.8);
			checkGradient(new PowerGaussian(UNIT), x, 5.0, 10.0, 0.3);
			checkGradient(new SilicateAttenuation(), x, 0.8);
			checkGradient(new DrudeAbsorption(), x, 0.3, 10.0, 1.2);
		}
	}

	private static void checkGradient(final Profile profile, final double x,
		final double... p)
	{
		final double[] g = profile.gradient(x, p);
		assertEquals(p.length, g.length);
		double scale = 0;
		for (int i = 0; i < p.length; i++)
			scale = FastMath.max(scale, FastMath.abs(g[i] * p[i]));
		for (int i = 0; i < p.length; i++) {
			final double h = 1e-6 * FastMath.abs(p[i]);
			final double[] up = p.clone();
			final double[] down = p.clone();
			up[i] += h;
			down[i] -= h;
			final double numeric = (profile.value(x, up) - profile.value(x, down)) /
				(2 * h);
			assertEquals(numeric, g[i], 1e-6 * scale / FastMath.abs(p[i]) + 1e-300,
				profile.getParameterNames()[i] + " of " + profile.getClass()
					.getSimpleName() + " at " + x);
		}
	}
}
