/**
 * Spectrum Features Fit
 * FluxUnit.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

/**
 * Internal flux unit families. Every spectrum is normalized by the caller to
 * one of these before fitting; the choice decides the unit of the power
 * parameters and the conversion constant of the power-normalized profiles.
 */
public enum FluxUnit {
	/** MJy/sr, power in 1e-10 W m^-2 sr^-1 */
	INTENSITY("MJy/sr", 1e-20, 1e-10),
	/** mJy, power in 1e-22 W m^-2 */
	FLUX_DENSITY("mJy", 1e-29, 1e-22);

	/** Speed of light in micron/s. */
	public static final double C_MICRON = 2.99792458e14;

	private final String label;
	private final double fluxSI;
	private final double powerSI;

	FluxUnit(final String label, final double fluxSI, final double powerSI) {
		this.label = label;
		this.fluxSI = fluxSI;
		this.powerSI = powerSI;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * unit(power) * micron / c, expressed in this flux unit. Multiplying a
	 * power by this factor and dividing by a wavelength in micron gives a flux
	 * per unit frequency.
	 */
	public double amplitudeFactor() {
		return powerSI / fluxSI / C_MICRON;
	}

	public static FluxUnit fromLabel(final String label) {
		for (final FluxUnit u : values()) {
			if (u.label.equals(label) || u.name().equals(label)) return u;
		}
		throw new IllegalArgumentException("Flux is not density (~mJy) or " +
			"intensity (~MJy/sr): " + label);
	}
}
