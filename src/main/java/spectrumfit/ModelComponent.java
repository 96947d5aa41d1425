/**
 * Spectrum Features Fit
 * ModelComponent.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.util.EnumMap;

/**
 * One registered component of the composite model: a named profile together
 * with its parameters.
 * <p>
 * Parameters are kept in two vocabularies. The table side (the
 * {@link BoundedParameter} as registered, keyed by {@link FeatureParameter})
 * and the profile side (the profile's own argument order, scaled by a
 * constant conversion factor, e.g. fwhm to stddev for a Gaussian line).
 */
class ModelComponent {

	private final String name;
	private final FeatureKind kind;
	private final Profile profile;
	private final FeatureParameter[] columns;
	private final double[] toProfile;
	private final BoundedParameter[] registered;
	private final double[] values;

	/**
	 * @param name unique component name
	 * @param kind kind of the feature it was built from
	 * @param profile the profile function
	 * @param columns table column of each profile argument
	 * @param toProfile factor from the table value to the profile argument
	 * @param registered table parameters, one per profile argument
	 */
	ModelComponent(final String name, final FeatureKind kind,
		final Profile profile, final FeatureParameter[] columns,
		final double[] toProfile, final BoundedParameter[] registered)
	{
		final int n = profile.getParameterCount();
		if (columns.length != n || toProfile.length != n ||
			registered.length != n)
		{
			throw new IllegalArgumentException("Component " + name + " expects " +
				n + " parameters");
		}
		this.name = name;
		this.kind = kind;
		this.profile = profile;
		this.columns = columns.clone();
		this.toProfile = toProfile.clone();
		this.registered = registered.clone();
		this.values = new double[n];
		for (int i = 0; i < n; i++)
			values[i] = registered[i].getValue() * toProfile[i];
	}

	public String getName() {
		return name;
	}

	public FeatureKind getKind() {
		return kind;
	}

	public boolean isMultiplicative() {
		return kind.isMultiplicative();
	}

	public Profile getProfile() {
		return profile;
	}

	int getParameterCount() {
		return values.length;
	}

	boolean isFixed(final int i) {
		return registered[i].isFixed();
	}

	/** Lower bound of profile argument {@code i}. */
	double getLower(final int i) {
		return registered[i].getLower() * toProfile[i];
	}

	double getUpper(final int i) {
		return registered[i].getUpper() * toProfile[i];
	}

	/** Current profile arguments. */
	double[] getValues() {
		return values.clone();
	}

	double getValue(final int i) {
		return values[i];
	}

	void setValue(final int i, final double v) {
		values[i] = v;
	}

	/** Back to the registered start values. */
	void reset() {
		for (int i = 0; i < values.length; i++)
			values[i] = registered[i].getValue() * toProfile[i];
	}

	double value(final double x) {
		return profile.value(x, values);
	}

	double[] value(final double[] x) {
		return profile.value(x, values);
	}

	/**
	 * Current parameters in table vocabulary, with the bounds and fixed flag
	 * they were registered with.
	 */
	EnumMap<FeatureParameter, BoundedParameter> toTable() {
		final EnumMap<FeatureParameter, BoundedParameter> result =
			new EnumMap<>(FeatureParameter.class);
		for (int i = 0; i < values.length; i++) {
			final BoundedParameter p = registered[i];
			result.put(columns[i], p.isFixed() ? p : p.withClampedValue(values[i] /
				toProfile[i]));
		}
		return result;
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder(name).append(" (").append(kind)
			.append(")");
		final String[] names = profile.getParameterNames();
		for (int i = 0; i < values.length; i++)
			sb.append(' ').append(names[i]).append('=').append(values[i]);
		return sb.toString();
	}
}
