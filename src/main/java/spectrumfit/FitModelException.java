/**
 * Spectrum Features Fit
 * FitModelException.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.util.LocalizedFormats;

/**
 * Base class of the errors raised while turning a feature table into a
 * fittable model, or reading results back out of it.
 */
public class FitModelException extends MathIllegalStateException {

	private static final long serialVersionUID = 1L;

	public FitModelException(final String message) {
		super(LocalizedFormats.SIMPLE_MESSAGE, message);
	}
}
