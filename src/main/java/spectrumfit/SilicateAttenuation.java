/**
 * Spectrum Features Fit
 * SilicateAttenuation.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.util.FastMath;

/**
 * Silicate attenuation of a source mixed with its dust, (1 - e^-t) / t with
 * t = tau_sil kvt(x).
 * <p>
 * The extinction curve is the Kemper, Vriend and Tielens (2004) profile,
 * tabulated between 8.0 and 12.7 micron, with an exponential rise below 8.0
 * micron and a Drude tail above 12.7 micron, blended with a (9.7 / x)^1.7
 * power law.
 * <p>
 * Parameters: tau_sil, the optical depth at 9.7 micron.
 */
public class SilicateAttenuation extends Profile {

	private static final double[] KVT_WAV = { 8.0, 8.2, 8.4, 8.6, 8.8, 9.0, 9.2,
		9.4, 9.6, 9.7, 9.75, 9.8, 10.0, 10.2, 10.4, 10.6, 10.8, 11.0, 11.2, 11.4,
		11.6, 11.8, 12.0, 12.2, 12.4, 12.6, 12.7 };
	private static final double[] KVT_INT = { .06, .09, .16, .275, .415, .575,
		.755, .895, .98, .99, 1.0, .99, .94, .83, .745, .655, .58, .525, .43, .35,
		.27, .20, .13, .09, .06, .045, .04314 };

	private static final double KVT_MIN = KVT_WAV[0];
	private static final double KVT_MAX = KVT_WAV[KVT_WAV.length - 1];
	private static final double RISE = 2.03;
	private static final double TAIL_AMPLITUDE = 0.4;
	private static final double TAIL_CENTER = 18.0;
	private static final double TAIL_FWHM = 0.247 * TAIL_CENTER;
	private static final double POWER_LAW_WEIGHT = 0.1;
	private static final double POWER_LAW_INDEX = 1.7;

	private static final PolynomialSplineFunction KVT_SPLINE =
		new LinearInterpolator().interpolate(KVT_WAV, KVT_INT);

	private static final String[] NAMES = { "tau_sil" };

	@Override
	public String[] getParameterNames() {
		return NAMES.clone();
	}

	@Override
	public double value(final double x, final double... param) {
		final double tau = param[0];
		if (tau == 0) return 1.0;
		return mixedScreen(tau * kvt(x));
	}

	@Override
	public double[] gradient(final double x, final double... param) {
		final double ext = kvt(x);
		return new double[] { mixedScreenDerivative(param[0] * ext) * ext };
	}

	/**
	 * Normalized silicate extinction at wavelength {@code x} (micron), 1 at the
	 * 9.7 micron peak apart from the power-law blend.
	 */
	public static double kvt(final double x) {
		final double ext;
		if (x < KVT_MIN) {
			ext = KVT_INT[0] * FastMath.exp(RISE * (x - KVT_MIN));
		}
		else if (x < KVT_MAX) {
			ext = KVT_SPLINE.value(x);
		}
		else {
			ext = TAIL_AMPLITUDE * Drude.profile(x, TAIL_CENTER, TAIL_FWHM);
		}
		return (1.0 - POWER_LAW_WEIGHT) * ext + POWER_LAW_WEIGHT * FastMath.pow(
			BlackBody.REFERENCE_WAVELENGTH / x, POWER_LAW_INDEX);
	}
}
