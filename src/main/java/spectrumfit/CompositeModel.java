/**
 * Spectrum Features Fit
 * CompositeModel.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;

/**
 * The finalized model, (sum of additive components) times (product of
 * multiplicative components), evaluated on a fixed wavelength grid.
 * <p>
 * Only the free parameters of the components make up the solver's parameter
 * vector; fixed ones keep their registered value. The Jacobian is analytic,
 * built from the profile gradients with the product rule.
 */
class CompositeModel implements MultivariateJacobianFunction {

	private final List<ModelComponent> additive;
	private final List<ModelComponent> multiplicative;
	// (component, argument) for each free parameter, additive first
	private final List<ModelComponent> freeComponent = new ArrayList<>();
	private final List<Integer> freeArgument = new ArrayList<>();
	private double[] x;

	CompositeModel(final List<ModelComponent> additive,
		final List<ModelComponent> multiplicative)
	{
		this.additive = Collections.unmodifiableList(new ArrayList<>(additive));
		this.multiplicative = Collections.unmodifiableList(new ArrayList<>(
			multiplicative));
		for (final ModelComponent c : components()) {
			for (int i = 0; i < c.getParameterCount(); i++) {
				if (c.isFixed(i)) continue;
				freeComponent.add(c);
				freeArgument.add(i);
			}
		}
	}

	List<ModelComponent> components() {
		final List<ModelComponent> all = new ArrayList<>(additive);
		all.addAll(multiplicative);
		return all;
	}

	int getFreeParameterCount() {
		return freeComponent.size();
	}

	/** Wavelength grid used by {@link #value(RealVector)}. */
	void setGrid(final double[] grid) {
		this.x = grid.clone();
	}

	/** Current values of the free parameters. */
	RealVector getStart() {
		final RealVector start = new ArrayRealVector(getFreeParameterCount());
		for (int j = 0; j < getFreeParameterCount(); j++)
			start.setEntry(j, freeComponent.get(j).getValue(freeArgument.get(j)));
		return start;
	}

	void setFreeParameters(final RealVector point) {
		if (point.getDimension() != getFreeParameterCount()) {
			throw new DimensionMismatchException(point.getDimension(),
				getFreeParameterCount());
		}
		for (int j = 0; j < getFreeParameterCount(); j++)
			freeComponent.get(j).setValue(freeArgument.get(j), point.getEntry(j));
	}

	void reset() {
		for (final ModelComponent c : components())
			c.reset();
	}

	/** Model value at one wavelength with the current parameters. */
	double value(final double wavelength) {
		double sum = 0;
		for (final ModelComponent c : additive)
			sum += c.value(wavelength);
		double product = 1;
		for (final ModelComponent c : multiplicative)
			product *= c.value(wavelength);
		return sum * product;
	}

	double[] value(final double[] wavelengths) {
		final double[] y = new double[wavelengths.length];
		for (int i = 0; i < wavelengths.length; i++)
			y[i] = value(wavelengths[i]);
		return y;
	}

	@Override
	public Pair<RealVector, RealMatrix> value(final RealVector point) {
		setFreeParameters(point);
		final int m = multiplicative.size();
		final RealVector values = new ArrayRealVector(x.length);
		final RealMatrix jacobian = new Array2DRowRealMatrix(x.length,
			getFreeParameterCount());
		final double[] factors = new double[m];
		for (int i = 0; i < x.length; i++) {
			double sum = 0;
			for (final ModelComponent c : additive)
				sum += c.value(x[i]);
			double product = 1;
			for (int k = 0; k < m; k++) {
				factors[k] = multiplicative.get(k).value(x[i]);
				product *= factors[k];
			}
			values.setEntry(i, sum * product);

			int col = 0;
			for (final ModelComponent c : additive) {
				col = fillGradient(jacobian, i, col, c, product);
			}
			for (int k = 0; k < m; k++) {
				// product of the other factors, no division so zero factors are safe
				double others = sum;
				for (int l = 0; l < m; l++)
					if (l != k) others *= factors[l];
				col = fillGradient(jacobian, i, col, multiplicative.get(k), others);
			}
		}
		return new Pair<>(values, jacobian);
	}

	private int fillGradient(final RealMatrix jacobian, final int row,
		final int firstColumn, final ModelComponent c, final double scale)
	{
		final double[] g = c.getProfile().gradient(x[row], c.getValues());
		int col = firstColumn;
		for (int a = 0; a < g.length; a++) {
			if (c.isFixed(a)) continue;
			jacobian.setEntry(row, col++, g[a] * scale);
		}
		return col;
	}

	/** Keeps every trial point of the solver inside the parameter bounds. */
	ParameterValidator boundsValidator() {
		return new ParameterValidator() {

			@Override
			public RealVector validate(final RealVector params) {
				final RealVector valid = params.copy();
				for (int j = 0; j < getFreeParameterCount(); j++) {
					final ModelComponent c = freeComponent.get(j);
					final int a = freeArgument.get(j);
					valid.setEntry(j, FastMath.min(c.getUpper(a), FastMath.max(c.getLower(
						a), params.getEntry(j))));
				}
				return valid;
			}
		};
	}
}
