/**
 * Spectrum Features Fit
 * FitSettingsTest.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FitSettingsTest {

	private Preferences prefs;

	@BeforeEach
	void node() {
		prefs = Preferences.userRoot().node("spectrumfit-test-" + System
			.nanoTime());
	}

	@AfterEach
	void removeNode() throws BackingStoreException {
		prefs.removeNode();
	}

	@Test
	void defaults() {
		final FitSettings s = FitSettings.load(prefs);
		assertEquals(1000, s.getMaxIterations());
		assertTrue(s.isUseInstrumentFwhm());
		assertTrue(s.isCalcLineFwhm());
		assertTrue(s.isGuessLines());
		assertTrue(s.isGuessDustFeatures());
		assertTrue(s.isVerbose());
	}

	@Test
	void storeAndLoad() {
		new FitSettings().maxIterations(250).useInstrumentFwhm(false).guessLines(
			false).verbose(false).store(prefs);
		final FitSettings s = FitSettings.load(prefs);
		assertEquals(250, s.getMaxIterations());
		assertFalse(s.isUseInstrumentFwhm());
		assertFalse(s.isGuessLines());
		assertFalse(s.isVerbose());
		assertTrue(s.isCalcLineFwhm());
	}

	@Test
	void copyIsIndependent() {
		final FitSettings s = new FitSettings().maxIterations(10);
		final FitSettings c = s.copy().maxIterations(20);
		assertEquals(10, s.getMaxIterations());
		assertEquals(20, c.getMaxIterations());
	}

	@Test
	void rejectsNonPositiveIterations() {
		assertThrows(IllegalArgumentException.class, () -> new FitSettings()
			.maxIterations(0));
	}
}
