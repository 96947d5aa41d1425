/**
 * Spectrum Features Fit
 * FeatureGuesser.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.util.FastMath;

/**
 * Initial estimates of the feature parameters from an observed spectrum,
 * without running the solver. Fixed parameters are left alone, except the
 * line widths when the instrument widths are requested. Every estimate is
 * moved into the bounds of its parameter.
 */
class FeatureGuesser {

	/** Half width of the line integration window, in fwhm. */
	static final double LINE_WINDOW = 1.5;
	/** Starlight is compared at the short end of the data plus this offset. */
	static final double STARLIGHT_OFFSET = 0.1;
	/** Longest wavelength at which a stellar blackbody is evaluated. */
	static final double STARLIGHT_SAFE_WAVELENGTH = 5.0;

	private final Instrument instrument;
	private final String instrumentName;
	private final double redshift;
	private final FluxUnit unit;
	// rest frame samples, sorted by wavelength, no repeated wavelengths
	private final double[] xz;
	private final double[] yz;
	private final PolynomialSplineFunction sp;

	FeatureGuesser(final Spectrum spectrum, final Instrument instrument) {
		this.instrument = instrument;
		this.instrumentName = spectrum.getInstrument();
		this.redshift = spectrum.getRedshift();
		this.unit = spectrum.getFluxUnit();

		final Spectrum rest = spectrum.restFrame();
		final double[] x = rest.getWavelength();
		final double[] y = rest.getFlux();
		final List<double[]> points = new ArrayList<>();
		for (int i = 0; i < x.length; i++) {
			if (Double.isFinite(x[i]) && Double.isFinite(y[i]))
				points.add(new double[] { x[i], y[i] });
		}
		points.sort(Comparator.comparingDouble(p -> p[0]));
		final List<double[]> unique = new ArrayList<>();
		for (final double[] p : points) {
			if (unique.isEmpty() || unique.get(unique.size() - 1)[0] < p[0])
				unique.add(p);
		}
		if (unique.size() < 2) {
			throw new IllegalArgumentException(
				"At least two finite samples are needed to guess");
		}
		xz = new double[unique.size()];
		yz = new double[unique.size()];
		for (int i = 0; i < xz.length; i++) {
			xz[i] = unique.get(i)[0];
			yz[i] = unique.get(i)[1];
		}
		sp = new LinearInterpolator().interpolate(xz, yz);
	}

	/**
	 * Update the table in place.
	 *
	 * @param table features to estimate
	 * @param settings which kinds to estimate
	 */
	void guess(final FeatureTable table, final FitSettings settings) {
		for (final Feature f : table.ofKind(FeatureKind.STARLIGHT))
			estimate(f, TAU, starlight(f));

		final int nbb = table.countKind(FeatureKind.DUST_CONTINUUM);
		for (final Feature f : table.ofKind(FeatureKind.DUST_CONTINUUM))
			estimate(f, TAU, dustContinuum(f) / nbb);

		for (final Feature f : table.ofKind(FeatureKind.LINE)) {
			final boolean inside = lineWithinSegment(f);
			if (settings.isGuessLines()) {
				estimate(f, POWER, inside ? linePower(f, instrumentFwhm(f
					.getValue(WAVELENGTH)).getValue()) : 0.0);
			}
			if (settings.isCalcLineFwhm() && inside) {
				f.set(FWHM, instrumentFwhm(f.getValue(WAVELENGTH)));
			}
		}

		if (settings.isGuessDustFeatures()) {
			for (final Feature f : table.ofKind(FeatureKind.DUST_FEATURE))
				estimate(f, POWER, dustFeaturePower(f));
		}
	}

	private void estimate(final Feature f, final FeatureParameter p,
		final double value)
	{
		final BoundedParameter current = f.require(p);
		if (current.isFixed() || !Double.isFinite(value)) return;
		f.set(p, current.withClampedValue(value));
	}

	/** Amplitude matching the flux just above the short end of the data. */
	double starlight(final Feature f) {
		final BlackBody bb = new BlackBody(false);
		final double temperature = f.getValue(TEMPERATURE);
		final double w = xz[0] + STARLIGHT_OFFSET;
		final double wbb = FastMath.min(w, STARLIGHT_SAFE_WAVELENGTH);
		return flux(w) / bb.shape(wbb, temperature);
	}

	/**
	 * Amplitude of a plain blackbody matching the flux at its peak, or at the
	 * data end nearest to it.
	 */
	double dustContinuum(final Feature f) {
		final BlackBody bb = new BlackBody(false);
		final double temperature = f.getValue(TEMPERATURE);
		final double peak = BlackBody.peakWavelength(temperature);
		final double w;
		if (peak < xz[0]) w = xz[0];
		else if (peak > xz[xz.length - 1]) w = xz[xz.length - 1];
		else w = peak;
		final double s = bb.shape(w, temperature);
		return s > 0 ? flux(w) / s : 0.0;
	}

	/**
	 * Power from the flux integrated over a window of +-1.5 fwhm, less a local
	 * linear continuum through the window ends.
	 */
	double linePower(final Feature f, final double fwhm) {
		final double w = f.getValue(WAVELENGTH);
		final double lo = w - LINE_WINDOW * fwhm;
		final double hi = w + LINE_WINDOW * fwhm;
		int first = -1;
		int last = -1;
		for (int i = 0; i < xz.length; i++) {
			if (xz[i] > lo && xz[i] < hi) {
				if (first < 0) first = i;
				last = i;
			}
		}
		if (first < 0 || last - first < 1) return 0.0;

		final double area = trapezoid(Arrays.copyOfRange(xz, first, last + 1),
			Arrays.copyOfRange(yz, first, last + 1));
		final double continuum = (yz[first] + yz[last]) / 2 * (xz[last] -
			xz[first]);
		return new PowerGaussian(unit).powerFromArea(FastMath.max(0.0, area -
			continuum), w);
	}

	/** Power of a Drude profile peaking at the flux at its center. */
	double dustFeaturePower(final Feature f) {
		final double w = f.getValue(WAVELENGTH);
		final double fwhm = f.getValue(FWHM);
		if (!(withinSegment(w) || withinSegment(w - fwhm) || withinSegment(w +
			fwhm)))
		{
			return 0.0;
		}
		final double peak = FastMath.max(0.0, flux(w));
		return new PowerDrude(unit).power(peak, w, fwhm);
	}

	/** Instrument fwhm at a rest wavelength, in the rest frame. */
	BoundedParameter instrumentFwhm(final double restWavelength) {
		return instrument.fwhm(instrumentName, restWavelength * (1 + redshift))
			.divide(1 + redshift);
	}

	private boolean lineWithinSegment(final Feature f) {
		return withinSegment(f.getValue(WAVELENGTH));
	}

	private boolean withinSegment(final double restWavelength) {
		return instrument.withinSegment(restWavelength * (1 + redshift),
			instrumentName);
	}

	/** Interpolated rest frame flux, constant beyond the data ends. */
	double flux(final double w) {
		if (w <= xz[0]) return yz[0];
		if (w >= xz[xz.length - 1]) return yz[yz.length - 1];
		return sp.value(w);
	}

	static double trapezoid(final double[] x, final double[] y) {
		double sum = 0;
		for (int i = 1; i < x.length; i++)
			sum += (x[i] - x[i - 1]) * (y[i] + y[i - 1]) / 2;
		return sum;
	}
}
