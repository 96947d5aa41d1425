/**
 * Spectrum Features Fit
 * SegmentedInstrument.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.util.FastMath;

/**
 * An instrument made of named spectral segments, each with a wavelength
 * range and a resolving power R(lambda) given as a polynomial in micron.
 * <p>
 * Instrument names may be glob patterns over the segment names, so
 * {@code spitzer.irs.*} selects every IRS module and
 * {@code spitzer.irs.*.[12]} the same set spelled out by order.
 */
public class SegmentedInstrument implements Instrument {

	private final List<Segment> segments;

	private SegmentedInstrument(final List<Segment> segments) {
		this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
	}

	public static Builder builder() {
		return new Builder();
	}

	/** Low resolution modules of the Spitzer IRS. */
	public static SegmentedInstrument spitzerIrs() {
		return builder().segment("spitzer.irs.sl.2", 5.10, 7.60, 0, 16.5)
			.segment("spitzer.irs.sl.1", 7.40, 14.50, 0, 8.25).segment(
				"spitzer.irs.ll.2", 14.00, 21.10, 0, 5.9).segment("spitzer.irs.ll.1",
					20.50, 38.50, 0, 2.9).build();
	}

	@Override
	public BoundedParameter fwhm(final String instrumentName,
		final double wavelength)
	{
		final List<Double> widths = new ArrayList<>();
		for (final Segment s : select(instrumentName)) {
			if (s.covers(wavelength)) widths.add(s.fwhm(wavelength));
		}
		if (widths.isEmpty()) {
			throw new IllegalArgumentException("Wavelength " + wavelength +
				" is outside of every segment of " + instrumentName);
		}
		if (widths.size() == 1) return BoundedParameter.fixed(widths.get(0));

		double lo = Double.POSITIVE_INFINITY;
		double hi = Double.NEGATIVE_INFINITY;
		final double[] w = new double[widths.size()];
		for (int i = 0; i < w.length; i++) {
			w[i] = widths.get(i);
			lo = FastMath.min(lo, w[i]);
			hi = FastMath.max(hi, w[i]);
		}
		return BoundedParameter.bounded(new Mean().evaluate(w), lo, hi);
	}

	@Override
	public boolean withinSegment(final double wavelength,
		final String instrumentName)
	{
		for (final Segment s : select(instrumentName)) {
			if (s.covers(wavelength)) return true;
		}
		return false;
	}

	@Override
	public List<double[]> waveRange(final String instrumentName) {
		final List<double[]> ranges = new ArrayList<>();
		for (final Segment s : select(instrumentName))
			ranges.add(new double[] { s.min, s.max });
		return ranges;
	}

	/**
	 * @throws IllegalArgumentException if no segment matches the name
	 */
	private List<Segment> select(final String instrumentName) {
		final PathMatcher matcher = FileSystems.getDefault().getPathMatcher(
			"glob:" + instrumentName);
		final List<Segment> selected = new ArrayList<>();
		for (final Segment s : segments) {
			if (s.name.equals(instrumentName) || matcher.matches(Paths.get(s.name)))
				selected.add(s);
		}
		if (selected.isEmpty()) {
			throw new IllegalArgumentException("Unknown instrument " +
				instrumentName);
		}
		return selected;
	}

	private static class Segment {

		private final String name;
		private final double min;
		private final double max;
		private final PolynomialFunction resolvingPower;

		Segment(final String name, final double min, final double max,
			final PolynomialFunction resolvingPower)
		{
			this.name = name;
			this.min = min;
			this.max = max;
			this.resolvingPower = resolvingPower;
		}

		boolean covers(final double wavelength) {
			return wavelength >= min && wavelength <= max;
		}

		double fwhm(final double wavelength) {
			return wavelength / resolvingPower.value(wavelength);
		}
	}

	public static class Builder {

		private final List<Segment> segments = new ArrayList<>();

		/**
		 * @param name segment name, dot separated
		 * @param min shortest wavelength, micron
		 * @param max longest wavelength, micron
		 * @param coefficients of R(lambda), constant term first
		 */
		public Builder segment(final String name, final double min,
			final double max, final double... coefficients)
		{
			if (!(min < max)) {
				throw new IllegalArgumentException("Empty segment " + name + ": [" +
					min + ", " + max + "]");
			}
			segments.add(new Segment(name, min, max, new PolynomialFunction(
				coefficients)));
			return this;
		}

		public SegmentedInstrument build() {
			return new SegmentedInstrument(segments);
		}
	}
}
