/**
 * Spectrum Features Fit
 * NoComponentsException.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

/**
 * Raised when a model is finalized without a single additive component. A
 * model made of attenuation terms alone has nothing to attenuate.
 */
public class NoComponentsException extends FitModelException {

	private static final long serialVersionUID = 1L;

	public NoComponentsException() {
		super("No additive components were registered; a model needs at " +
			"least one continuum, line or dust feature");
	}
}
