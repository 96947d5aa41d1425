/**
 * Spectrum Features Fit
 * Fitter.java
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
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;
import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

/**
 * Builds a composite spectral model one named component at a time and fits
 * it to data with the Levenberg-Marquardt optimizer.
 * <p>
 * Call order: {@link #clear()}, any number of {@code register*} calls,
 * {@link #finalizeModel()}, {@link #fit(double[], double[], double[], int)},
 * then {@link #getResult(String)} per component. Register calls take
 * parameters in table vocabulary; the conversion to profile arguments (fwhm
 * to stddev for lines) happens here and is undone by {@code getResult}.
 */
public class Fitter {

	@Parameter
	private LogService log;

	public static final double sd2FWHM = PowerGaussian.SD2FWHM;

	private static final double COST_TOLERANCE = 1e-10;
	private static final double PARAMETER_TOLERANCE = 1e-10;

	private final FluxUnit unit;
	private final Map<String, ModelComponent> components =
		new LinkedHashMap<>();
	private final List<ModelComponent> additive = new ArrayList<>();
	private final List<ModelComponent> multiplicative = new ArrayList<>();
	private CompositeModel model;
	private boolean verbose = true;

	public Fitter(final Context context, final FluxUnit unit) {
		context.inject(this);
		this.unit = unit;
	}

	public FluxUnit getFluxUnit() {
		return unit;
	}

	public void setVerbose(final boolean verbose) {
		this.verbose = verbose;
	}

	/** Forget every component, so a new model can be built. */
	public void clear() {
		components.clear();
		additive.clear();
		multiplicative.clear();
		model = null;
	}

	/** Stellar continuum, a blackbody whose amplitude is the tau column. */
	public void registerStarlight(final String name,
		final BoundedParameter temperature, final BoundedParameter tau)
	{
		register(new ModelComponent(name, FeatureKind.STARLIGHT, new BlackBody(
			false), new FeatureParameter[] { TAU, TEMPERATURE }, new double[] { 1,
				1 }, new BoundedParameter[] { tau, temperature }));
	}

	/** Dust continuum, a modified blackbody. */
	public void registerDustContinuum(final String name,
		final BoundedParameter temperature, final BoundedParameter tau)
	{
		register(new ModelComponent(name, FeatureKind.DUST_CONTINUUM,
			new BlackBody(true), new FeatureParameter[] { TAU, TEMPERATURE },
			new double[] { 1, 1 }, new BoundedParameter[] { tau, temperature }));
	}

	/** Emission line, a Gaussian in power form. */
	public void registerLine(final String name, final BoundedParameter power,
		final BoundedParameter wavelength, final BoundedParameter fwhm)
	{
		register(new ModelComponent(name, FeatureKind.LINE, new PowerGaussian(
			unit), new FeatureParameter[] { POWER, WAVELENGTH, FWHM }, new double[] {
				1, 1, 1 / sd2FWHM }, new BoundedParameter[] { power, wavelength,
					fwhm }));
	}

	/** Dust feature, a Drude profile in power form. */
	public void registerDustFeature(final String name,
		final BoundedParameter power, final BoundedParameter wavelength,
		final BoundedParameter fwhm)
	{
		register(new ModelComponent(name, FeatureKind.DUST_FEATURE,
			new PowerDrude(unit), new FeatureParameter[] { POWER, WAVELENGTH, FWHM },
			new double[] { 1, 1, 1 }, new BoundedParameter[] { power, wavelength,
				fwhm }));
	}

	/** Silicate attenuation of the mixed geometry. */
	public void registerAttenuation(final String name,
		final BoundedParameter tau)
	{
		register(new ModelComponent(name, FeatureKind.ATTENUATION,
			new SilicateAttenuation(), new FeatureParameter[] { TAU }, new double[] {
				1 }, new BoundedParameter[] { tau }));
	}

	/** Absorption feature with a Drude optical depth profile. */
	public void registerAbsorption(final String name,
		final BoundedParameter tau, final BoundedParameter wavelength,
		final BoundedParameter fwhm)
	{
		register(new ModelComponent(name, FeatureKind.ABSORPTION,
			new DrudeAbsorption(), new FeatureParameter[] { TAU, WAVELENGTH, FWHM },
			new double[] { 1, 1, 1 }, new BoundedParameter[] { tau, wavelength,
				fwhm }));
	}

	private void register(final ModelComponent c) {
		if (model != null) {
			throw new IllegalStateException("Model already finalized, call clear() first");
		}
		if (components.containsKey(c.getName())) {
			throw new IllegalArgumentException("Component " + c.getName() +
				" already registered");
		}
		components.put(c.getName(), c);
		if (c.isMultiplicative()) multiplicative.add(c);
		else additive.add(c);
		if (verbose) log.debug("Registered " + c);
	}

	/**
	 * Combine the registered components: sum of the additive ones times the
	 * product of the multiplicative ones.
	 *
	 * @throws NoComponentsException if no additive component was registered
	 */
	public void finalizeModel() {
		if (additive.isEmpty()) {
			throw new NoComponentsException();
		}
		model = new CompositeModel(additive, multiplicative);
	}

	/** Names of the registered components, in registration order. */
	public List<String> components() {
		checkFinalized();
		return Collections.unmodifiableList(new ArrayList<>(components.keySet()));
	}

	/** Kind of a registered component. */
	public FeatureKind getKind(final String name) {
		return component(name).getKind();
	}

	/** The full model at the current parameters. */
	public double[] evaluateModel(final double[] x) {
		checkFinalized();
		return model.value(x);
	}

	/**
	 * A single component at the current parameters: its flux for additive
	 * components, its transmission factor for multiplicative ones.
	 */
	public double[] evaluateComponent(final String name, final double[] x) {
		checkFinalized();
		return component(name).value(x);
	}

	/**
	 * Fit the finalized model to the data. Only samples with finite
	 * wavelength, flux and weight {@code 1/sigma^2} are used. When the solver
	 * does not converge the parameters keep their start values and the returned
	 * report says so.
	 *
	 * @param x wavelengths, micron
	 * @param y flux
	 * @param sigma flux uncertainty
	 * @param maxIterations solver iteration limit
	 * @return the solver report
	 */
	public FitInfo fit(final double[] x, final double[] y, final double[] sigma,
		final int maxIterations)
	{
		checkFinalized();
		if (x.length != y.length) {
			throw new DimensionMismatchException(y.length, x.length);
		}
		if (x.length != sigma.length) {
			throw new DimensionMismatchException(sigma.length, x.length);
		}

		final List<Integer> usable = new ArrayList<>();
		for (int i = 0; i < x.length; i++) {
			final double w = 1.0 / (sigma[i] * sigma[i]);
			if (Double.isFinite(x[i]) && Double.isFinite(y[i]) && Double.isFinite(w))
				usable.add(i);
		}
		final int n = usable.size();
		final double[] xx = new double[n];
		final double[] target = new double[n];
		final double[] weights = new double[n];
		for (int k = 0; k < n; k++) {
			final int i = usable.get(k);
			xx[k] = x[i];
			target[k] = y[i];
			weights[k] = 1.0 / (sigma[i] * sigma[i]);
		}

		final int free = model.getFreeParameterCount();
		if (n < free) {
			throw new IllegalArgumentException("Only " + n +
				" usable samples for " + free + " free parameters");
		}
		model.setGrid(xx);
		if (free == 0) {
			final double cost = weightedCost(xx, target, weights);
			return report(new FitInfo(true, "No free parameters", 0, 0, cost,
				FastMath.sqrt(cost * cost / n), n));
		}

		final LeastSquaresProblem problem = new LeastSquaresBuilder()
			.parameterValidator(model.boundsValidator()).maxEvaluations(
				Integer.MAX_VALUE).maxIterations(maxIterations).lazyEvaluation(false)
			.start(model.boundsValidator().validate(model.getStart())).target(target)
			.weight(new DiagonalMatrix(weights)).model(model).build();
		final LevenbergMarquardtOptimizer optimizer =
			new LevenbergMarquardtOptimizer().withCostRelativeTolerance(
				COST_TOLERANCE).withParameterRelativeTolerance(PARAMETER_TOLERANCE);

		final LeastSquaresOptimizer.Optimum optimum;
		try {
			optimum = optimizer.optimize(problem);
		}
		catch (final TooManyIterationsException | TooManyEvaluationsException e) {
			return notConverged(e.getMessage(), maxIterations, xx, target, weights);
		}
		catch (final ConvergenceException e) {
			return notConverged(e.getMessage(), 0, xx, target, weights);
		}

		model.setFreeParameters(optimum.getPoint());
		return report(new FitInfo(true, "Optimization converged", optimum
			.getIterations(), optimum.getEvaluations(), optimum.getCost(), optimum
				.getRMS(), n));
	}

	private FitInfo notConverged(final String message, final int iterations,
		final double[] xx, final double[] target, final double[] weights)
	{
		model.reset();
		final double cost = weightedCost(xx, target, weights);
		final FitInfo info = new FitInfo(false, message, iterations, 0, cost,
			FastMath.sqrt(cost * cost / xx.length), xx.length);
		log.warn("Fit did not converge: " + message);
		return info;
	}

	private FitInfo report(final FitInfo info) {
		if (verbose) log.info(info.toString());
		return info;
	}

	private double weightedCost(final double[] xx, final double[] target,
		final double[] weights)
	{
		final RealVector r = new ArrayRealVector(model.value(xx)).subtract(
			new ArrayRealVector(target, false));
		double chi2 = 0;
		for (int i = 0; i < xx.length; i++)
			chi2 += weights[i] * r.getEntry(i) * r.getEntry(i);
		return FastMath.sqrt(chi2);
	}

	/**
	 * Parameters of one component in table vocabulary, carrying the bounds
	 * and fixed flag it was registered with.
	 *
	 * @throws UnknownComponentException if the name is not a component of the
	 *           finalized model
	 */
	public EnumMap<FeatureParameter, BoundedParameter> getResult(
		final String name)
	{
		if (model == null) {
			throw new UnknownComponentException(name);
		}
		return component(name).toTable();
	}

	private ModelComponent component(final String name) {
		final ModelComponent c = components.get(name);
		if (c == null) {
			throw new UnknownComponentException(name);
		}
		return c;
	}

	private void checkFinalized() {
		if (model == null) {
			throw new IllegalStateException("Model not finalized");
		}
	}
}
