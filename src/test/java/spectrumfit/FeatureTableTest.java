/**
 * Spectrum Features Fit
 * FeatureTableTest.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class FeatureTableTest {

	static FeatureTable sample() {
		return FeatureTable.builder().starlight("starlight", BoundedParameter
			.fixed(5000), BoundedParameter.bounded(1e-12, 0, Double.POSITIVE_INFINITY))
			.group("dust_cont").dustContinuum("BB200", BoundedParameter.fixed(200),
				BoundedParameter.bounded(1e-8, 0, Double.POSITIVE_INFINITY)).group(
					"PAH_11.3um").dustFeature("PAH_11.33um", BoundedParameter.bounded(
						50, 0, Double.POSITIVE_INFINITY), BoundedParameter.fixed(11.33),
						BoundedParameter.fixed(0.36256)).group("ionic").line("NeII",
							BoundedParameter.bounded(5, 0, Double.POSITIVE_INFINITY),
							BoundedParameter.fixed(12.813), null).build();
	}

	@Test
	void builderKeepsInsertionOrder() {
		final FeatureTable t = sample();
		assertEquals(Arrays.asList("starlight", "BB200", "PAH_11.33um", "NeII"), t
			.getNames());
		assertEquals(1, t.countKind(FeatureKind.DUST_CONTINUUM));
		assertEquals("PAH_11.3um", t.get("PAH_11.33um").getGroup());
		assertNull(t.get("NeII").get(FeatureParameter.FWHM));
	}

	@Test
	void duplicateNamesRejected() {
		final FeatureTable t = sample();
		assertThrows(IllegalArgumentException.class, () -> t.add(new Feature(
			"BB200", FeatureKind.DUST_CONTINUUM)));
	}

	@Test
	void missingNameRejected() {
		assertThrows(IllegalArgumentException.class, () -> sample().get("nope"));
		assertFalse(sample().contains("nope"));
	}

	@Test
	void columnsFollowKind() {
		final Feature f = new Feature("x", FeatureKind.ATTENUATION);
		assertThrows(IllegalArgumentException.class, () -> f.set(
			FeatureParameter.POWER, BoundedParameter.fixed(1)));
		assertThrows(IllegalStateException.class, () -> f.require(
			FeatureParameter.TAU));
		assertTrue(FeatureKind.ATTENUATION.isMultiplicative());
		assertFalse(FeatureKind.LINE.isMultiplicative());
	}

	@Test
	void unknownKind() {
		assertThrows(UnsupportedKindException.class, () -> FeatureKind
			.fromTableName("continuum"));
		assertEquals(FeatureKind.DUST_FEATURE, FeatureKind.fromTableName(
			"dust_feature"));
	}

	@Test
	void copyIsDeep() {
		final FeatureTable t = sample();
		final FeatureTable c = t.copy();
		c.get("BB200").setValue(FeatureParameter.TAU, 2e-8);
		c.setRedshift(0.5);
		assertEquals(1e-8, t.get("BB200").getValue(FeatureParameter.TAU), 0.0);
		assertEquals(0.0, t.getRedshift(), 0.0);
	}
}
