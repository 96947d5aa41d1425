/**
 * Spectrum Features Fit
 * RangeIncompatibilityException.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

/**
 * Raised before model construction when the observed wavelength range of a
 * spectrum is not covered by the instrument it claims to come from.
 */
public class RangeIncompatibilityException extends FitModelException {

	private static final long serialVersionUID = 1L;

	public RangeIncompatibilityException(final String instrumentName,
		final double dataMin, final double dataMax, final double instrumentMin,
		final double instrumentMax)
	{
		super(String.format("Wavelength range of the input spectrum " +
			"[%1$.4g, %2$.4g] and the instrument %3$s [%4$.4g, %5$.4g] do not match",
			dataMin, dataMax, instrumentName, instrumentMin, instrumentMax));
	}
}
