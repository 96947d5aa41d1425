/**
 * Spectrum Features Fit
 * BlackBody.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import org.apache.commons.math3.util.FastMath;

/**
 * Blackbody continuum, F(x) = amplitude * 3.97289e13 / x^3 / (exp(c2 / (x T)) - 1).
 * <p>
 * The modified variant multiplies by (9.7 / x)^2, an emissivity proportional
 * to nu^2, and is used for the dust continuum.
 * <p>
 * Parameters, in order: amplitude, temperature (K).
 */
public class BlackBody extends Profile {

	/** Second radiation constant, micron K. */
	public static final double C2 = 1.4387752e4;
	public static final double NORM = 3.97289e13;
	/** Wavelength at which the modified emissivity equals one. */
	public static final double REFERENCE_WAVELENGTH = 9.7;
	/** Wien displacement constant, micron K. */
	public static final double WIEN = 2898.0;

	private static final String[] NAMES = { "amplitude", "temperature" };

	private final boolean modified;

	public BlackBody(final boolean modified) {
		this.modified = modified;
	}

	@Override
	public String[] getParameterNames() {
		return NAMES.clone();
	}

	@Override
	public double value(final double x, final double... param) {
		return param[0] * shape(x, param[1]);
	}

	/**
	 * @param x wavelength
	 * @param param amplitude and temperature
	 * @return the partial derivatives with respect to amplitude and temperature
	 */
	@Override
	public double[] gradient(final double x, final double... param) {
		final double amplitude = param[0];
		final double temperature = param[1];
		final double u = C2 / (x * temperature);
		final double em1 = FastMath.expm1(u);
		if (Double.isInfinite(em1) || Double.isNaN(em1)) {
			return new double[] { 0.0, 0.0 };
		}
		final double s = shape(x, temperature);
		final double g = 1.0 / em1;
		return new double[] { s, amplitude * s * (1.0 + g) * u / temperature };
	}

	/** The profile for unit amplitude. */
	public double shape(final double x, final double temperature) {
		final double em1 = FastMath.expm1(C2 / (x * temperature));
		if (Double.isInfinite(em1) || Double.isNaN(em1)) return 0.0;
		double s = NORM / (x * x * x) / em1;
		if (modified) {
			final double r = REFERENCE_WAVELENGTH / x;
			s *= r * r;
		}
		return s;
	}

	/** Wavelength of the emission peak for a temperature. */
	public static double peakWavelength(final double temperature) {
		return WIEN / temperature;
	}
}
