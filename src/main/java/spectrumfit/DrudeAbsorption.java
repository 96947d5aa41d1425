/**
 * Spectrum Features Fit
 * DrudeAbsorption.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

/**
 * Absorption feature with a Drude optical depth profile, (1 - e^-t) / t with
 * t = tau Drude(x; 1, x_0, fwhm).
 * <p>
 * A zero optical depth switches the component off: the factor is 0, not 1.
 * <p>
 * Parameters, in order: tau, x_0, fwhm.
 */
public class DrudeAbsorption extends Profile {

	private static final String[] NAMES = { "tau", "x_0", "fwhm" };

	@Override
	public String[] getParameterNames() {
		return NAMES.clone();
	}

	@Override
	public double value(final double x, final double... param) {
		final double tau = param[0];
		if (tau == 0) return 0.0;
		return mixedScreen(tau * Drude.profile(x, param[1], param[2]));
	}

	@Override
	public double[] gradient(final double x, final double... param) {
		final double tau = param[0];
		final double x0 = param[1];
		final double fwhm = param[2];
		final double r = Drude.denominator(x, x0, fwhm);
		final double p = fwhm * fwhm / r;
		if (tau == 0) {
			return new double[] { -0.5 * p, 0.0, 0.0 };
		}
		final double h = mixedScreenDerivative(tau * p);
		return new double[] { h * p, h * tau * Drude.dProfileDx0(x, x0, fwhm, r),
			h * tau * Drude.dProfileDFwhm(x, x0, fwhm, r) };
	}
}
