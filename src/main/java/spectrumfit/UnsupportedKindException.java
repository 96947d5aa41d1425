/**
 * Spectrum Features Fit
 * UnsupportedKindException.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

/**
 * Raised when a table row carries a kind (or attenuation geometry) that no
 * registration rule handles.
 */
public class UnsupportedKindException extends FitModelException {

	private static final long serialVersionUID = 1L;

	public UnsupportedKindException(final String kind) {
		super("Unsupported feature kind: " + kind);
	}

	public UnsupportedKindException(final FeatureKind kind,
		final String geometry)
	{
		super("Unsupported " + kind + " geometry: " + geometry);
	}
}
