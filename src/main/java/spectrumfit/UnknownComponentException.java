/**
 * Spectrum Features Fit
 * UnknownComponentException.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

/**
 * Raised when results are requested for a component that was not registered,
 * or before the model was finalized.
 */
public class UnknownComponentException extends FitModelException {

	private static final long serialVersionUID = 1L;

	public UnknownComponentException(final String name) {
		super("No component named " + name + " in the model");
	}
}
