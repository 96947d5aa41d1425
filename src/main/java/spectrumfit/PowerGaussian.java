/**
 * Spectrum Features Fit
 * PowerGaussian.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import org.apache.commons.math3.util.FastMath;

/**
 * Gaussian profile whose free parameter is the integrated power.
 * <p>
 * A line of power P has amplitude P / (stddev sqrt(2 pi)) per unit
 * wavelength; per unit frequency that is P lambda^2 / (c stddev sqrt(2 pi)),
 * approximated with lambda = mean: A = P mean^2 / (stddev sqrt(2 pi)) k.
 * <p>
 * Parameters, in order: power, mean, stddev.
 */
public class PowerGaussian extends Profile {

	/** Conversion between full width at half maximum and standard deviation. */
	public static final double SD2FWHM = 2 * FastMath.sqrt(2 * FastMath.log(2));

	private static final double SQRT2PI = FastMath.sqrt(2 * FastMath.PI);
	private static final String[] NAMES = { "power", "mean", "stddev" };

	private final double amplitudeFactor;

	public PowerGaussian(final FluxUnit unit) {
		this(unit.amplitudeFactor());
	}

	PowerGaussian(final double amplitudeFactor) {
		this.amplitudeFactor = amplitudeFactor;
	}

	@Override
	public String[] getParameterNames() {
		return NAMES.clone();
	}

	@Override
	public double value(final double x, final double... param) {
		final double power = param[0];
		final double mean = param[1];
		final double sd = param[2];
		final double z = (x - mean) / sd;
		return amplitude(power, mean, sd) * FastMath.exp(-0.5 * z * z);
	}

	@Override
	public double[] gradient(final double x, final double... param) {
		final double power = param[0];
		final double mean = param[1];
		final double sd = param[2];
		final double z = (x - mean) / sd;
		final double e = FastMath.exp(-0.5 * z * z);
		final double k = amplitudeFactor / SQRT2PI;
		final double dPower = k * mean * mean * e / sd;
		final double dMean = k * power * e / sd * (2.0 * mean + mean * mean * z /
			sd);
		final double dSd = k * power * mean * mean * e / (sd * sd) * (z * z - 1.0);
		return new double[] { dPower, dMean, dSd };
	}

	/** Peak amplitude of a line with the given power. */
	public double amplitude(final double power, final double mean,
		final double sd)
	{
		return power * mean * mean / (sd * SQRT2PI) * amplitudeFactor;
	}

	/** Power of a line whose flux integrated over wavelength is {@code area}. */
	public double powerFromArea(final double area, final double mean) {
		return area / (amplitudeFactor * mean * mean);
	}
}
