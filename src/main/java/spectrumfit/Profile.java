/**
 * Spectrum Features Fit
 * Profile.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.util.FastMath;

/**
 * A spectral profile: flux (or a transmission factor) as a function of
 * wavelength in micron, with an analytic gradient with respect to its
 * parameters. Profiles are stateless apart from constant unit factors.
 */
public abstract class Profile implements ParametricUnivariateFunction {

	/** Below this optical depth the mixed-screen law is evaluated as a series. */
	private static final double SMALL_TAU = 1e-3;

	/** Parameter names, in the order expected by {@code value} and {@code gradient}. */
	public abstract String[] getParameterNames();

	public int getParameterCount() {
		return getParameterNames().length;
	}

	/**
	 * Evaluate the profile on a wavelength grid.
	 *
	 * @param x wavelengths in micron
	 * @param param profile parameters
	 * @return the profile values, one per wavelength
	 */
	public double[] value(final double[] x, final double... param) {
		validateParameters(param);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++)
			y[i] = value(x[i], param);
		return y;
	}

	/**
	 * @throws NullArgumentException if {@code param} is {@code null}.
	 * @throws DimensionMismatchException if the number of parameters is wrong.
	 */
	protected void validateParameters(final double[] param) {
		if (param == null) {
			throw new NullArgumentException();
		}
		if (param.length != getParameterCount()) {
			throw new DimensionMismatchException(param.length, getParameterCount());
		}
	}

	/**
	 * Attenuation of a source mixed with its absorbers, (1 - e^-t) / t.
	 */
	static double mixedScreen(final double t) {
		if (FastMath.abs(t) < SMALL_TAU) {
			return 1.0 - t / 2.0 + t * t / 6.0 - t * t * t / 24.0;
		}
		return -FastMath.expm1(-t) / t;
	}

	/** d/dt of {@link #mixedScreen(double)}. */
	static double mixedScreenDerivative(final double t) {
		if (FastMath.abs(t) < SMALL_TAU) {
			return -0.5 + t / 3.0 - t * t / 8.0;
		}
		// e^-t (1 + t) - 1, written to keep the small terms
		return (FastMath.expm1(-t) * (1.0 + t) + t) / (t * t);
	}
}
