/**
 * Spectrum Features Fit
 * FeatureKind.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import static spectrumfit.FeatureParameter.FWHM;
import static spectrumfit.FeatureParameter.POWER;
import static spectrumfit.FeatureParameter.TAU;
import static spectrumfit.FeatureParameter.TEMPERATURE;
import static spectrumfit.FeatureParameter.WAVELENGTH;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The closed set of physical component kinds. The kind fixes the parameter
 * columns a feature carries and whether the component multiplies the model
 * (attenuation, absorption) or adds to it.
 */
public enum FeatureKind {
	STARLIGHT("starlight", false, TEMPERATURE, TAU),
	DUST_CONTINUUM("dust_continuum", false, TEMPERATURE, TAU),
	LINE("line", false, POWER, WAVELENGTH, FWHM),
	DUST_FEATURE("dust_feature", false, POWER, WAVELENGTH, FWHM),
	ATTENUATION("attenuation", true, TAU),
	ABSORPTION("absorption", true, TAU, WAVELENGTH, FWHM);

	private final String tableName;
	private final boolean multiplicative;
	private final Set<FeatureParameter> parameters;

	FeatureKind(final String tableName, final boolean multiplicative,
		final FeatureParameter first, final FeatureParameter... rest)
	{
		this.tableName = tableName;
		this.multiplicative = multiplicative;
		this.parameters = Collections.unmodifiableSet(EnumSet.of(first, rest));
	}

	public String getTableName() {
		return tableName;
	}

	public boolean isMultiplicative() {
		return multiplicative;
	}

	/** Parameter columns owned by this kind, in column order. */
	public Set<FeatureParameter> getParameters() {
		return parameters;
	}

	public boolean hasParameter(final FeatureParameter p) {
		return parameters.contains(p);
	}

	/**
	 * Parse the kind column of a table row.
	 *
	 * @throws UnsupportedKindException if no kind has this name
	 */
	public static FeatureKind fromTableName(final String name) {
		for (final FeatureKind k : values()) {
			if (k.tableName.equals(name)) return k;
		}
		throw new UnsupportedKindException(name);
	}

	@Override
	public String toString() {
		return tableName;
	}
}
