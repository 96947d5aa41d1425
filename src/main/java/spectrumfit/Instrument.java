/**
 * Spectrum Features Fit
 * Instrument.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.util.List;

/**
 * Instrument model: spectral resolution and wavelength coverage of the
 * segments of a named instrument. All wavelengths are observed frame, micron.
 */
public interface Instrument {

	/**
	 * Line width set by the resolution at {@code wavelength}. Fixed where a
	 * single segment covers the wavelength, bounded where segments overlap.
	 */
	BoundedParameter fwhm(String instrumentName, double wavelength);

	/** Whether any segment of the instrument covers the wavelength. */
	boolean withinSegment(double wavelength, String instrumentName);

	/** {min, max} of every segment of the instrument. */
	List<double[]> waveRange(String instrumentName);

	/**
	 * Check that data spanning {@code [dataMin, dataMax]} can come from the
	 * instrument.
	 *
	 * @throws RangeIncompatibilityException if the data extend beyond the
	 *           instrument coverage
	 */
	default void checkRange(final String instrumentName, final double dataMin,
		final double dataMax)
	{
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double[] r : waveRange(instrumentName)) {
			min = Math.min(min, r[0]);
			max = Math.max(max, r[1]);
		}
		if (dataMin < min || dataMax > max) {
			throw new RangeIncompatibilityException(instrumentName, dataMin,
				dataMax, min, max);
		}
	}
}
