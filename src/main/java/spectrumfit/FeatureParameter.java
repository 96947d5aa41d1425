/**
 * Spectrum Features Fit
 * FeatureParameter.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

/**
 * Parameter columns of the feature table. Units: temperature in K, wavelength
 * and fwhm in micron, tau dimensionless (or the blackbody amplitude for the
 * continua), power in the internal power unit of the table's {@link FluxUnit}.
 */
public enum FeatureParameter {
	TEMPERATURE("temperature"),
	TAU("tau"),
	WAVELENGTH("wavelength"),
	POWER("power"),
	FWHM("fwhm");

	private final String columnName;

	FeatureParameter(final String columnName) {
		this.columnName = columnName;
	}

	public String getColumnName() {
		return columnName;
	}

	public static FeatureParameter fromColumnName(final String name) {
		for (final FeatureParameter p : values()) {
			if (p.columnName.equals(name)) return p;
		}
		throw new IllegalArgumentException("Unknown parameter column: " + name);
	}
}
