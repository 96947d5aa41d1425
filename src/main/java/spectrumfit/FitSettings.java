/**
 * Spectrum Features Fit
 * FitSettings.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.util.prefs.Preferences;

/**
 * Options of a guess and fit cycle. Settings persist in a preferences node
 * between sessions.
 */
public class FitSettings {

	private static final String MAXITERATIONS = "maxIterations";
	private static final String USEINSTRUMENTFWHM = "useInstrumentFwhm";
	private static final String CALCLINEFWHM = "calcLineFwhm";
	private static final String GUESSLINES = "guessLines";
	private static final String GUESSDUSTFEATURES = "guessDustFeatures";
	private static final String VERBOSE = "verbose";

	private int maxIterations = 1000;
	private boolean useInstrumentFwhm = true;
	private boolean calcLineFwhm = true;
	private boolean guessLines = true;
	private boolean guessDustFeatures = true;
	private boolean verbose = true;

	public static FitSettings load(final Preferences prefs) {
		final FitSettings s = new FitSettings();
		s.maxIterations = prefs.getInt(MAXITERATIONS, s.maxIterations);
		s.useInstrumentFwhm = prefs.getBoolean(USEINSTRUMENTFWHM,
			s.useInstrumentFwhm);
		s.calcLineFwhm = prefs.getBoolean(CALCLINEFWHM, s.calcLineFwhm);
		s.guessLines = prefs.getBoolean(GUESSLINES, s.guessLines);
		s.guessDustFeatures = prefs.getBoolean(GUESSDUSTFEATURES,
			s.guessDustFeatures);
		s.verbose = prefs.getBoolean(VERBOSE, s.verbose);
		return s;
	}

	public void store(final Preferences prefs) {
		prefs.putInt(MAXITERATIONS, maxIterations);
		prefs.putBoolean(USEINSTRUMENTFWHM, useInstrumentFwhm);
		prefs.putBoolean(CALCLINEFWHM, calcLineFwhm);
		prefs.putBoolean(GUESSLINES, guessLines);
		prefs.putBoolean(GUESSDUSTFEATURES, guessDustFeatures);
		prefs.putBoolean(VERBOSE, verbose);
	}

	public FitSettings copy() {
		return new FitSettings().maxIterations(maxIterations).useInstrumentFwhm(
			useInstrumentFwhm).calcLineFwhm(calcLineFwhm).guessLines(guessLines)
			.guessDustFeatures(guessDustFeatures).verbose(verbose);
	}

	public int getMaxIterations() {
		return maxIterations;
	}

	public FitSettings maxIterations(final int n) {
		if (n < 1) {
			throw new IllegalArgumentException("maxIterations must be positive: " +
				n);
		}
		this.maxIterations = n;
		return this;
	}

	/** Replace line widths with the instrument resolution during a fit. */
	public boolean isUseInstrumentFwhm() {
		return useInstrumentFwhm;
	}

	public FitSettings useInstrumentFwhm(final boolean b) {
		this.useInstrumentFwhm = b;
		return this;
	}

	/** Write the instrument line widths to the table while guessing. */
	public boolean isCalcLineFwhm() {
		return calcLineFwhm;
	}

	public FitSettings calcLineFwhm(final boolean b) {
		this.calcLineFwhm = b;
		return this;
	}

	public boolean isGuessLines() {
		return guessLines;
	}

	public FitSettings guessLines(final boolean b) {
		this.guessLines = b;
		return this;
	}

	public boolean isGuessDustFeatures() {
		return guessDustFeatures;
	}

	public FitSettings guessDustFeatures(final boolean b) {
		this.guessDustFeatures = b;
		return this;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public FitSettings verbose(final boolean b) {
		this.verbose = b;
		return this;
	}

	@Override
	public String toString() {
		return "maxIterations=" + maxIterations + ", useInstrumentFwhm=" +
			useInstrumentFwhm + ", calcLineFwhm=" + calcLineFwhm + ", guessLines=" +
			guessLines + ", guessDustFeatures=" + guessDustFeatures + ", verbose=" +
			verbose;
	}
}
