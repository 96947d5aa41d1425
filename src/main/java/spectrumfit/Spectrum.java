/**
 * Spectrum Features Fit
 * Spectrum.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;

/**
 * An observed one-dimensional spectrum: wavelength (micron, observed frame),
 * flux and flux uncertainty in the internal unit, plus the instrument that
 * took it and the redshift of the source.
 */
public class Spectrum {

	private final double[] wavelength;
	private final double[] flux;
	private final double[] uncertainty;
	private final String instrument;
	private final double redshift;
	private final FluxUnit fluxUnit;

	public Spectrum(final double[] wavelength, final double[] flux,
		final double[] uncertainty, final String instrument)
	{
		this(wavelength, flux, uncertainty, instrument, 0, FluxUnit.INTENSITY);
	}

	public Spectrum(final double[] wavelength, final double[] flux,
		final double[] uncertainty, final String instrument,
		final double redshift, final FluxUnit fluxUnit)
	{
		if (ArrayUtils.isEmpty(wavelength)) {
			throw new NoDataException();
		}
		if (flux.length != wavelength.length) {
			throw new DimensionMismatchException(flux.length, wavelength.length);
		}
		if (uncertainty.length != wavelength.length) {
			throw new DimensionMismatchException(uncertainty.length,
				wavelength.length);
		}
		if (instrument == null || instrument.isEmpty()) {
			throw new IllegalArgumentException("No instrument given for the spectrum");
		}
		this.wavelength = wavelength.clone();
		this.flux = flux.clone();
		this.uncertainty = uncertainty.clone();
		this.instrument = instrument;
		this.redshift = redshift;
		this.fluxUnit = fluxUnit;
	}

	public double[] getWavelength() {
		return wavelength.clone();
	}

	public double[] getFlux() {
		return flux.clone();
	}

	public double[] getUncertainty() {
		return uncertainty.clone();
	}

	public String getInstrument() {
		return instrument;
	}

	public double getRedshift() {
		return redshift;
	}

	public FluxUnit getFluxUnit() {
		return fluxUnit;
	}

	public int size() {
		return wavelength.length;
	}

	/** Smallest finite observed wavelength. */
	public double getMinWavelength() {
		double min = Double.POSITIVE_INFINITY;
		for (final double w : wavelength)
			if (Double.isFinite(w) && w < min) min = w;
		return min;
	}

	public double getMaxWavelength() {
		double max = Double.NEGATIVE_INFINITY;
		for (final double w : wavelength)
			if (Double.isFinite(w) && w > max) max = w;
		return max;
	}

	/**
	 * Rest frame data: wavelengths shorter by 1 + z, flux and uncertainty
	 * larger by 1 + z. The result has redshift 0.
	 */
	public Spectrum restFrame() {
		final double f = 1 + redshift;
		final double[] x = new double[wavelength.length];
		final double[] y = new double[wavelength.length];
		final double[] s = new double[wavelength.length];
		for (int i = 0; i < x.length; i++) {
			x[i] = wavelength[i] / f;
			y[i] = flux[i] * f;
			s[i] = uncertainty[i] * f;
		}
		return new Spectrum(x, y, s, instrument, 0, fluxUnit);
	}
}
