/**
 * Spectrum Features Fit
 * BoundedParameter.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.util.Objects;

import org.apache.commons.math3.util.FastMath;

/**
 * A parameter value together with its allowed range and a fixed flag. This is
 * the unit exchanged between the feature table and the fitter; bare doubles
 * never cross that boundary.
 * <p>
 * In the persisted table a parameter is stored as three cells (value, min,
 * max). Both bounds masked means the parameter is fixed; an unmasked infinite
 * bound means the parameter is unbounded on that side. The fixed flag is
 * derived once, in {@link #fromColumns(double, Double, Double)}.
 */
public final class BoundedParameter {

	private final double value;
	private final double lower;
	private final double upper;
	private final boolean fixed;

	private BoundedParameter(final double value, final double lower,
		final double upper, final boolean fixed)
	{
		if (Double.isNaN(value)) {
			throw new IllegalArgumentException("Parameter value is NaN");
		}
		if (!fixed) {
			if (Double.isNaN(lower) || Double.isNaN(upper)) {
				throw new IllegalArgumentException("Parameter bound is NaN");
			}
			if (lower > upper) {
				throw new IllegalArgumentException("Lower bound " + lower +
					" exceeds upper bound " + upper);
			}
			if (value < lower || value > upper) {
				throw new IllegalArgumentException("Value " + value +
					" outside of bounds [" + lower + ", " + upper + "]");
			}
		}
		this.value = value;
		this.lower = fixed ? Double.NEGATIVE_INFINITY : lower;
		this.upper = fixed ? Double.POSITIVE_INFINITY : upper;
		this.fixed = fixed;
	}

	public static BoundedParameter fixed(final double value) {
		return new BoundedParameter(value, Double.NEGATIVE_INFINITY,
			Double.POSITIVE_INFINITY, true);
	}

	public static BoundedParameter bounded(final double value,
		final double lower, final double upper)
	{
		return new BoundedParameter(value, lower, upper, false);
	}

	public static BoundedParameter unbounded(final double value) {
		return new BoundedParameter(value, Double.NEGATIVE_INFINITY,
			Double.POSITIVE_INFINITY, false);
	}

	/**
	 * Build a parameter from the three table cells.
	 *
	 * @param value the value cell
	 * @param min the min cell, {@code null} when masked
	 * @param max the max cell, {@code null} when masked
	 * @return a fixed parameter when both bounds are masked, a (possibly
	 *         half-open) bounded parameter otherwise
	 */
	public static BoundedParameter fromColumns(final double value,
		final Double min, final Double max)
	{
		if (min == null && max == null) return fixed(value);
		// a single masked bound reads as unbounded on that side
		final double lo = min == null ? Double.NEGATIVE_INFINITY : min;
		final double hi = max == null ? Double.POSITIVE_INFINITY : max;
		return bounded(value, lo, hi);
	}

	public double getValue() {
		return value;
	}

	public double getLower() {
		return lower;
	}

	public double getUpper() {
		return upper;
	}

	public boolean isFixed() {
		return fixed;
	}

	public boolean hasLowerBound() {
		return !fixed && !Double.isInfinite(lower);
	}

	public boolean hasUpperBound() {
		return !fixed && !Double.isInfinite(upper);
	}

	/** Same bounds and fixed flag, new value. */
	public BoundedParameter withValue(final double newValue) {
		return new BoundedParameter(newValue, lower, upper, fixed);
	}

	/** Same bounds and fixed flag, value moved into the bounds. */
	public BoundedParameter withClampedValue(final double newValue) {
		return withValue(clamp(newValue));
	}

	/**
	 * Multiply value and bounds by a positive factor. Used for unit changes
	 * such as fwhm to standard deviation.
	 */
	public BoundedParameter scale(final double factor) {
		if (!(factor > 0)) {
			throw new IllegalArgumentException("Scale factor must be positive: " +
				factor);
		}
		if (fixed) return fixed(value * factor);
		return bounded(value * factor, lower * factor, upper * factor);
	}

	/** Divide value and bounds by a positive factor. */
	public BoundedParameter divide(final double divisor) {
		if (!(divisor > 0)) {
			throw new IllegalArgumentException("Divisor must be positive: " +
				divisor);
		}
		if (fixed) return fixed(value / divisor);
		return bounded(value / divisor, lower / divisor, upper / divisor);
	}

	public double clamp(final double x) {
		if (fixed) return value;
		return FastMath.min(upper, FastMath.max(lower, x));
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof BoundedParameter)) return false;
		final BoundedParameter p = (BoundedParameter) o;
		return fixed == p.fixed && Double.compare(value, p.value) == 0 && Double
			.compare(lower, p.lower) == 0 && Double.compare(upper, p.upper) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, lower, upper, fixed);
	}

	@Override
	public String toString() {
		if (fixed) return String.format("%1$.4g (fixed)", value);
		return String.format("%1$.4g (%2$.4g, %3$.4g)", value, lower, upper);
	}
}
