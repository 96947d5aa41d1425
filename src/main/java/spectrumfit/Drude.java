/**
 * Spectrum Features Fit
 * Drude.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;

/**
 * Drude profile with a peak amplitude,
 * F(x) = amplitude g^2 / ((x / x_0 - x_0 / x)^2 + g^2), g = fwhm / x_0.
 * <p>
 * Multiplying numerator and denominator by x_0^2 gives the form used here,
 * amplitude fwhm^2 / R with R = (x - x_0^2 / x)^2 + fwhm^2, which keeps the
 * derivatives short.
 * <p>
 * Parameters, in order: amplitude, x_0, fwhm.
 */
public class Drude extends Profile {

	private static final String[] NAMES = { "amplitude", "x_0", "fwhm" };

	@Override
	public String[] getParameterNames() {
		return NAMES.clone();
	}

	@Override
	public double value(final double x, final double... param) {
		return param[0] * profile(x, param[1], param[2]);
	}

	@Override
	public double[] gradient(final double x, final double... param) {
		final double amplitude = param[0];
		final double x0 = param[1];
		final double fwhm = param[2];
		final double r = denominator(x, x0, fwhm);
		return new double[] { fwhm * fwhm / r, amplitude * dProfileDx0(x, x0,
			fwhm, r), amplitude * dProfileDFwhm(x, x0, fwhm, r) };
	}

	/**
	 * Unit amplitude Drude profile.
	 *
	 * @throws NotStrictlyPositiveException if {@code fwhm <= 0}
	 */
	public static double profile(final double x, final double x0,
		final double fwhm)
	{
		if (fwhm <= 0) {
			throw new NotStrictlyPositiveException(fwhm);
		}
		return fwhm * fwhm / denominator(x, x0, fwhm);
	}

	static double denominator(final double x, final double x0,
		final double fwhm)
	{
		final double d = x - x0 * x0 / x;
		return d * d + fwhm * fwhm;
	}

	static double dDenominatorDx0(final double x, final double x0) {
		return -4.0 * x0 * (x - x0 * x0 / x) / x;
	}

	static double dProfileDx0(final double x, final double x0,
		final double fwhm, final double r)
	{
		return -fwhm * fwhm / (r * r) * dDenominatorDx0(x, x0);
	}

	static double dProfileDFwhm(final double x, final double x0,
		final double fwhm, final double r)
	{
		return 2.0 * fwhm * (r - fwhm * fwhm) / (r * r);
	}
}
