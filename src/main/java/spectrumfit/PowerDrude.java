/**
 * Spectrum Features Fit
 * PowerDrude.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import org.apache.commons.math3.util.FastMath;

/**
 * Drude profile whose free parameter is the integrated power rather than the
 * peak height (Smith et al. 2007, section 4.1.4).
 * <p>
 * The power of a Drude profile, integrated over frequency, is
 * P = (pi c / 2) (b g / x_0). Solved for the central intensity,
 * b = 2 P x_0 / (pi c g). The unit factor k of the {@link FluxUnit} carries
 * 1/c and the unit conversions, so b = 2 P x_0 / (pi g) k, and the profile is
 * (2 k / pi) P x_0^2 fwhm / R with R as in {@link Drude}.
 * <p>
 * Parameters, in order: power, x_0, fwhm.
 */
public class PowerDrude extends Profile {

	private static final String[] NAMES = { "power", "x_0", "fwhm" };

	private final double amplitudeFactor;

	public PowerDrude(final FluxUnit unit) {
		this(unit.amplitudeFactor());
	}

	PowerDrude(final double amplitudeFactor) {
		this.amplitudeFactor = amplitudeFactor;
	}

	@Override
	public String[] getParameterNames() {
		return NAMES.clone();
	}

	@Override
	public double value(final double x, final double... param) {
		final double power = param[0];
		final double x0 = param[1];
		final double fwhm = param[2];
		return scale() * power * x0 * x0 * fwhm / Drude.denominator(x, x0, fwhm);
	}

	@Override
	public double[] gradient(final double x, final double... param) {
		final double power = param[0];
		final double x0 = param[1];
		final double fwhm = param[2];
		final double c = scale();
		final double r = Drude.denominator(x, x0, fwhm);
		final double dPower = c * x0 * x0 * fwhm / r;
		final double dX0 = c * power * fwhm * (2.0 * x0 / r - x0 * x0 / (r * r) *
			Drude.dDenominatorDx0(x, x0));
		final double dFwhm = c * power * x0 * x0 * (r - 2.0 * fwhm * fwhm) / (r *
			r);
		return new double[] { dPower, dX0, dFwhm };
	}

	/** Peak amplitude b of a profile with the given power. */
	public double amplitude(final double power, final double x0,
		final double fwhm)
	{
		final double g = fwhm / x0;
		return 2.0 * power * x0 / (FastMath.PI * g) * amplitudeFactor;
	}

	/** Inverse of {@link #amplitude(double, double, double)}. */
	public double power(final double amplitude, final double x0,
		final double fwhm)
	{
		return amplitude * FastMath.PI * fwhm / (2.0 * amplitudeFactor * x0 * x0);
	}

	private double scale() {
		return 2.0 * amplitudeFactor / FastMath.PI;
	}
}
