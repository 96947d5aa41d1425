/**
 * Spectrum Features Fit
 * FitInfo.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

/**
 * Solver report of one fit.
 */
public class FitInfo {

	private final boolean converged;
	private final String message;
	private final int iterations;
	private final int evaluations;
	private final double cost;
	private final double rms;
	private final int samples;

	public FitInfo(final boolean converged, final String message,
		final int iterations, final int evaluations, final double cost,
		final double rms, final int samples)
	{
		this.converged = converged;
		this.message = message;
		this.iterations = iterations;
		this.evaluations = evaluations;
		this.cost = cost;
		this.rms = rms;
		this.samples = samples;
	}

	public boolean isConverged() {
		return converged;
	}

	public String getMessage() {
		return message;
	}

	public int getIterations() {
		return iterations;
	}

	public int getEvaluations() {
		return evaluations;
	}

	/** Square root of the weighted sum of squared residuals. */
	public double getCost() {
		return cost;
	}

	/** Weighted root mean square of the residuals. */
	public double getRMS() {
		return rms;
	}

	/** Number of samples that entered the fit. */
	public int getSamples() {
		return samples;
	}

	@Override
	public String toString() {
		return String.format(
			"%1$s: %2$s; iterations %3$d, evaluations %4$d, cost %5$.4g, RMS %6$.4g, %7$d samples",
			converged ? "Converged" : "Not converged", message, iterations,
			evaluations, cost, rms, samples);
	}
}
