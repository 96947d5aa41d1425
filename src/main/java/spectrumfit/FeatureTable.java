/**
 * Spectrum Features Fit
 * FeatureTable.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, name-indexed collection of {@link Feature}s plus the metadata of
 * the last fit (redshift, instrument, flux unit). Order is insertion order and
 * only matters for display.
 */
public class FeatureTable implements Iterable<Feature> {

	private final Map<String, Feature> features;
	private double redshift;
	private String instrument;
	private FluxUnit fluxUnit;

	public FeatureTable() {
		this.features = new LinkedHashMap<>();
		this.redshift = 0.0;
		this.instrument = "";
		this.fluxUnit = FluxUnit.INTENSITY;
	}

	public FeatureTable copy() {
		final FeatureTable t = new FeatureTable();
		for (final Feature f : features.values())
			t.add(new Feature(f));
		t.redshift = redshift;
		t.instrument = instrument;
		t.fluxUnit = fluxUnit;
		return t;
	}

	public void add(final Feature feature) {
		if (features.containsKey(feature.getName())) {
			throw new IllegalArgumentException("Duplicate feature name: " + feature
				.getName());
		}
		features.put(feature.getName(), feature);
	}

	public boolean contains(final String name) {
		return features.containsKey(name);
	}

	/**
	 * @throws IllegalArgumentException if no feature has this name
	 */
	public Feature get(final String name) {
		final Feature f = features.get(name);
		if (f == null) {
			throw new IllegalArgumentException("No feature named " + name);
		}
		return f;
	}

	public List<Feature> ofKind(final FeatureKind kind) {
		final List<Feature> out = new ArrayList<>();
		for (final Feature f : features.values()) {
			if (f.getKind() == kind) out.add(f);
		}
		return out;
	}

	public int countKind(final FeatureKind kind) {
		int n = 0;
		for (final Feature f : features.values()) {
			if (f.getKind() == kind) n++;
		}
		return n;
	}

	public Collection<Feature> getFeatures() {
		return Collections.unmodifiableCollection(features.values());
	}

	public List<String> getNames() {
		return new ArrayList<>(features.keySet());
	}

	public int size() {
		return features.size();
	}

	public boolean isEmpty() {
		return features.isEmpty();
	}

	@Override
	public Iterator<Feature> iterator() {
		return Collections.unmodifiableCollection(features.values()).iterator();
	}

	public double getRedshift() {
		return redshift;
	}

	public void setRedshift(final double redshift) {
		this.redshift = redshift;
	}

	public String getInstrument() {
		return instrument;
	}

	public void setInstrument(final String instrument) {
		this.instrument = instrument == null ? "" : instrument;
	}

	public FluxUnit getFluxUnit() {
		return fluxUnit;
	}

	public void setFluxUnit(final FluxUnit fluxUnit) {
		this.fluxUnit = fluxUnit;
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder();
		sb.append("Features (").append(features.size()).append(" rows, z = ")
			.append(redshift).append(", ").append(fluxUnit.getLabel()).append(")\n");
		for (final Feature f : features.values())
			sb.append("  ").append(f).append('\n');
		return sb.toString();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Declarative construction of a table, one call per row.
	 */
	public static class Builder {

		private final FeatureTable table = new FeatureTable();
		private String group = "";

		/** Group tag applied to the rows added after this call. */
		public Builder group(final String newGroup) {
			this.group = newGroup;
			return this;
		}

		public Builder starlight(final String name,
			final BoundedParameter temperature, final BoundedParameter tau)
		{
			return add(new Feature(name, FeatureKind.STARLIGHT).set(
				FeatureParameter.TEMPERATURE, temperature).set(FeatureParameter.TAU,
					tau));
		}

		public Builder dustContinuum(final String name,
			final BoundedParameter temperature, final BoundedParameter tau)
		{
			return add(new Feature(name, FeatureKind.DUST_CONTINUUM).set(
				FeatureParameter.TEMPERATURE, temperature).set(FeatureParameter.TAU,
					tau));
		}

		/**
		 * @param fwhm may be {@code null}, the instrument then decides the width
		 */
		public Builder line(final String name, final BoundedParameter power,
			final BoundedParameter wavelength, final BoundedParameter fwhm)
		{
			return add(new Feature(name, FeatureKind.LINE).set(FeatureParameter.POWER,
				power).set(FeatureParameter.WAVELENGTH, wavelength).set(
					FeatureParameter.FWHM, fwhm));
		}

		public Builder dustFeature(final String name, final BoundedParameter power,
			final BoundedParameter wavelength, final BoundedParameter fwhm)
		{
			return add(new Feature(name, FeatureKind.DUST_FEATURE).set(
				FeatureParameter.POWER, power).set(FeatureParameter.WAVELENGTH,
					wavelength).set(FeatureParameter.FWHM, fwhm));
		}

		public Builder attenuation(final String name, final String geometry,
			final BoundedParameter tau)
		{
			final Feature f = new Feature(name, FeatureKind.ATTENUATION).set(
				FeatureParameter.TAU, tau);
			f.setGeometry(geometry);
			return add(f);
		}

		public Builder absorption(final String name, final BoundedParameter tau,
			final BoundedParameter wavelength, final BoundedParameter fwhm)
		{
			return add(new Feature(name, FeatureKind.ABSORPTION).set(
				FeatureParameter.TAU, tau).set(FeatureParameter.WAVELENGTH, wavelength)
				.set(FeatureParameter.FWHM, fwhm));
		}

		public Builder redshift(final double z) {
			table.setRedshift(z);
			return this;
		}

		public Builder fluxUnit(final FluxUnit unit) {
			table.setFluxUnit(unit);
			return this;
		}

		private Builder add(final Feature f) {
			f.setGroup(group);
			table.add(f);
			return this;
		}

		public FeatureTable build() {
			return table.copy();
		}
	}
}
