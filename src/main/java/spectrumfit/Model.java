/**
 * Spectrum Features Fit
 * Model.java
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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.time.StopWatch;
import org.apache.commons.math3.util.FastMath;
import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

/**
 * A feature table bound to an instrument model. Guesses start values from a
 * spectrum, builds the fitter from the table, fits and writes the results
 * back into the table.
 * <p>
 * Features that fall outside every instrument segment are left out of a fit
 * and keep their stored values. A model is not thread safe; run one fit at a
 * time per instance.
 */
public class Model {

	@Parameter
	private LogService log;

	/** Attenuation geometry understood by the fitter. */
	public static final String MIXED_GEOMETRY = "mixed";

	/** Registers one table row with a fitter. */
	interface Registration {

		void register(Fitter fitter, Feature feature);
	}

	private final Context context;
	private final FeatureTable features;
	private final Instrument instrument;
	private FitSettings settings = new FitSettings();
	private Set<String> excluded = Collections.emptySet();
	private FitInfo fitInfo;

	public Model(final Context context, final FeatureTable features,
		final Instrument instrument)
	{
		context.inject(this);
		this.context = context;
		this.features = features;
		this.instrument = instrument;
	}

	/** Model over a table saved by {@link #save(Path)}. */
	public static Model fromSaved(final Context context, final Path file,
		final Instrument instrument) throws IOException
	{
		return new Model(context, FeatureTableIO.read(file), instrument);
	}

	/**
	 * Model over a science pack, a file path or the name of a bundled pack
	 * such as {@code classic.tsv}.
	 */
	public static Model fromPack(final Context context, final String pack,
		final Instrument instrument) throws IOException
	{
		return new Model(context, FeatureTableIO.readPack(pack), instrument);
	}

	public void save(final Path file) throws IOException {
		FeatureTableIO.write(features, file);
		if (settings.isVerbose()) log.info("Saved features to " + file);
	}

	/** Independent model over a deep copy of the table. */
	public Model copy() {
		final Model m = new Model(context, features.copy(), instrument);
		m.settings = settings.copy();
		return m;
	}

	public FeatureTable getFeatures() {
		return features;
	}

	public Instrument getInstrument() {
		return instrument;
	}

	public FitSettings getSettings() {
		return settings;
	}

	public void setSettings(final FitSettings settings) {
		this.settings = settings;
	}

	/** Names left out of the last fitter that was built. */
	public Set<String> getExcludedFeatures() {
		return excluded;
	}

	/** Report of the last fit, {@code null} before the first one. */
	public FitInfo getFitInfo() {
		return fitInfo;
	}

	/**
	 * Estimate start values from the spectrum and write them into the table.
	 */
	public void guess(final Spectrum spectrum) {
		new FeatureGuesser(spectrum, instrument).guess(features, settings);
		features.setFluxUnit(spectrum.getFluxUnit());
	}

	/**
	 * Fit the table to the spectrum and store the results in the table.
	 *
	 * @return the solver report; a fit that did not converge leaves the table
	 *         at its start values
	 * @throws RangeIncompatibilityException if the data extend beyond the
	 *           instrument
	 */
	public FitInfo fit(final Spectrum spectrum) {
		final String inst = spectrum.getInstrument();
		final double z = spectrum.getRedshift();
		instrument.checkRange(inst, spectrum.getMinWavelength(), spectrum
			.getMaxWavelength());
		features.setFluxUnit(spectrum.getFluxUnit());

		final StopWatch sw = new StopWatch();
		sw.start();
		final Fitter fitter = constructFitter(inst, z, settings
			.isUseInstrumentFwhm());
		final Spectrum rest = spectrum.restFrame();
		fitInfo = fitter.fit(rest.getWavelength(), rest.getFlux(), rest
			.getUncertainty(), settings.getMaxIterations());
		sw.stop();
		if (settings.isVerbose()) {
			log.info(fitInfo.getMessage());
			log.info(String.format("Time elapsed: %1$.1f s", sw.getTime() /
				1000.0));
		}

		ingestFitResult(fitter);
		features.setRedshift(z);
		features.setInstrument(inst);
		return fitInfo;
	}

	/**
	 * Build and finalize a fitter from the table, leaving out the features
	 * outside the instrument segments. The table is not modified.
	 *
	 * @param instrumentName segments the data come from
	 * @param redshift of the source
	 * @param useInstrumentFwhm replace line widths with the instrument ones
	 */
	public Fitter constructFitter(final String instrumentName,
		final double redshift, final boolean useInstrumentFwhm)
	{
		final Set<String> skip = new LinkedHashSet<>();
		for (final Feature f : features) {
			if (!covered(f, instrumentName, redshift)) skip.add(f.getName());
		}
		excluded = Collections.unmodifiableSet(skip);
		if (!skip.isEmpty() && settings.isVerbose()) {
			log.warn("Features outside of " + instrumentName + " left out: " +
				StringUtils.join(skip, ", "));
		}

		final Map<FeatureKind, Registration> registrations = registrations(
			instrumentName, redshift, useInstrumentFwhm);
		final Fitter fitter = new Fitter(context, features.getFluxUnit());
		fitter.setVerbose(settings.isVerbose());
		for (final Feature f : features) {
			if (skip.contains(f.getName())) continue;
			final Registration r = registrations.get(f.getKind());
			if (r == null) {
				throw new UnsupportedKindException(f.getKind().getTableName());
			}
			r.register(fitter, f);
		}
		fitter.finalizeModel();
		return fitter;
	}

	private Map<FeatureKind, Registration> registrations(
		final String instrumentName, final double redshift,
		final boolean useInstrumentFwhm)
	{
		final Map<FeatureKind, Registration> r = new EnumMap<>(FeatureKind.class);
		r.put(FeatureKind.STARLIGHT, (fitter, f) -> fitter.registerStarlight(f
			.getName(), f.require(TEMPERATURE), f.require(TAU)));
		r.put(FeatureKind.DUST_CONTINUUM, (fitter, f) -> fitter
			.registerDustContinuum(f.getName(), f.require(TEMPERATURE), f.require(
				TAU)));
		r.put(FeatureKind.LINE, (fitter, f) -> {
			BoundedParameter fwhm = f.get(FWHM);
			if (useInstrumentFwhm || fwhm == null) {
				final double observed = f.getValue(WAVELENGTH) * (1 + redshift);
				fwhm = instrument.fwhm(instrumentName, observed).divide(1 + redshift);
			}
			fitter.registerLine(f.getName(), f.require(POWER), f.require(WAVELENGTH),
				fwhm);
		});
		r.put(FeatureKind.DUST_FEATURE, (fitter, f) -> fitter.registerDustFeature(
			f.getName(), f.require(POWER), f.require(WAVELENGTH), f.require(FWHM)));
		r.put(FeatureKind.ATTENUATION, (fitter, f) -> {
			final String geometry = StringUtils.defaultIfEmpty(f.getGeometry(),
				MIXED_GEOMETRY);
			if (!MIXED_GEOMETRY.equals(geometry)) {
				throw new UnsupportedKindException(f.getKind(), geometry);
			}
			fitter.registerAttenuation(f.getName(), f.require(TAU));
		});
		r.put(FeatureKind.ABSORPTION, (fitter, f) -> fitter.registerAbsorption(f
			.getName(), f.require(TAU), f.require(WAVELENGTH), f.require(FWHM)));
		return r;
	}

	/**
	 * Whether a feature reaches into a segment: the center for lines, the
	 * center or either half width edge for dust features and absorption.
	 * Continua and attenuation always do.
	 */
	private boolean covered(final Feature f, final String instrumentName,
		final double redshift)
	{
		final double zf = 1 + redshift;
		switch (f.getKind()) {
			case LINE:
				return instrument.withinSegment(f.getValue(WAVELENGTH) * zf,
					instrumentName);
			case DUST_FEATURE:
			case ABSORPTION:
				final double w = f.getValue(WAVELENGTH);
				final double fwhm = f.getValue(FWHM);
				return instrument.withinSegment(w * zf, instrumentName) || instrument
					.withinSegment((w - fwhm) * zf, instrumentName) || instrument
						.withinSegment((w + fwhm) * zf, instrumentName);
			default:
				return true;
		}
	}

	/**
	 * Copy the fitted parameters of every registered component into the
	 * table. Rows without a component are not touched.
	 */
	public void ingestFitResult(final Fitter fitter) {
		for (final String name : fitter.components()) {
			final Feature f = features.get(name);
			for (final Map.Entry<FeatureParameter, BoundedParameter> e : fitter
				.getResult(name).entrySet())
				f.set(e.getKey(), e.getValue());
		}
	}

	/**
	 * Evaluate the model on an observed frame grid, with the line widths stored
	 * in the table.
	 *
	 * @param instrumentName selects the features in range and the default grid
	 * @param redshift of the source
	 * @param wavelengths observed wavelengths, micron; {@code null} samples the
	 *          instrument range at half the fwhm of its short end
	 * @param filter rows to include; {@code null} includes every row
	 * @return the model spectrum, observed frame, zero uncertainty; the flux
	 *         is the observed frame flux, the rest frame model divided by
	 *         {@code 1 + redshift}
	 */
	public Spectrum tabulate(final String instrumentName, final double redshift,
		final double[] wavelengths, final Predicate<Feature> filter)
	{
		FeatureTable selected = features;
		if (filter != null) {
			selected = new FeatureTable();
			for (final Feature f : features)
				if (filter.test(f)) selected.add(new Feature(f));
			selected.setFluxUnit(features.getFluxUnit());
		}
		final Model sub = new Model(context, selected, instrument);
		sub.settings = new FitSettings().verbose(false);
		final Fitter fitter = sub.constructFitter(instrumentName, redshift, false);

		final double[] grid = wavelengths != null ? wavelengths.clone()
			: defaultGrid(instrumentName);
		final double zf = 1 + redshift;
		final double[] rest = new double[grid.length];
		for (int i = 0; i < grid.length; i++)
			rest[i] = grid[i] / zf;
		final double[] flux = fitter.evaluateModel(rest);
		for (int i = 0; i < flux.length; i++)
			flux[i] /= zf;
		return new Spectrum(grid, flux, new double[grid.length], instrumentName,
			redshift, features.getFluxUnit());
	}

	private double[] defaultGrid(final String instrumentName) {
		double wmin = Double.POSITIVE_INFINITY;
		double wmax = Double.NEGATIVE_INFINITY;
		for (final double[] r : instrument.waveRange(instrumentName)) {
			wmin = FastMath.min(wmin, r[0]);
			wmax = FastMath.max(wmax, r[1]);
		}
		final double step = instrument.fwhm(instrumentName, wmin).getValue() / 2;
		final int n = (int) FastMath.ceil((wmax - wmin) / step);
		final double[] grid = new double[n];
		for (int i = 0; i < n; i++)
			grid[i] = wmin + i * step;
		return grid;
	}

	@Override
	public String toString() {
		return features.toString();
	}
}
