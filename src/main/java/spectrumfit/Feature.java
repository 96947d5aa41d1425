/**
 * Spectrum Features Fit
 * Feature.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package spectrumfit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * One row of the feature table: a named physical component and its bounded
 * parameters. Only the columns owned by the feature's {@link FeatureKind} can
 * be set; any of them may be absent (for instance the width of a line before
 * the instrument model has filled it in).
 */
public class Feature {

	private final String name;
	private final FeatureKind kind;
	private String group;
	private String geometry;
	private final Map<FeatureParameter, BoundedParameter> parameters;

	public Feature(final String name, final FeatureKind kind) {
		if (StringUtils.isBlank(name)) {
			throw new IllegalArgumentException("Feature name is blank");
		}
		if (kind == null) {
			throw new IllegalArgumentException("Feature " + name + " has no kind");
		}
		this.name = name;
		this.kind = kind;
		this.group = "";
		this.geometry = "";
		this.parameters = new EnumMap<>(FeatureParameter.class);
	}

	/** Deep copy; bounded parameters are immutable and shared. */
	public Feature(final Feature other) {
		this(other.name, other.kind);
		this.group = other.group;
		this.geometry = other.geometry;
		this.parameters.putAll(other.parameters);
	}

	public String getName() {
		return name;
	}

	public FeatureKind getKind() {
		return kind;
	}

	public String getGroup() {
		return group;
	}

	public void setGroup(final String group) {
		this.group = group == null ? "" : group;
	}

	public String getGeometry() {
		return geometry;
	}

	public void setGeometry(final String geometry) {
		this.geometry = geometry == null ? "" : geometry;
	}

	public boolean has(final FeatureParameter p) {
		return parameters.containsKey(p);
	}

	/**
	 * @return the parameter, or {@code null} when the column is absent
	 */
	public BoundedParameter get(final FeatureParameter p) {
		return parameters.get(p);
	}

	/**
	 * @throws IllegalStateException when the column is absent
	 */
	public BoundedParameter require(final FeatureParameter p) {
		final BoundedParameter bp = parameters.get(p);
		if (bp == null) {
			throw new IllegalStateException("Feature " + name + " (" + kind +
				") has no " + p.getColumnName());
		}
		return bp;
	}

	public double getValue(final FeatureParameter p) {
		return require(p).getValue();
	}

	public boolean isFixed(final FeatureParameter p) {
		return require(p).isFixed();
	}

	public Feature set(final FeatureParameter p, final BoundedParameter value) {
		if (!kind.hasParameter(p)) {
			throw new IllegalArgumentException("A " + kind + " has no " + p
				.getColumnName() + " column (feature " + name + ")");
		}
		if (value == null) parameters.remove(p);
		else parameters.put(p, value);
		return this;
	}

	/** Replace the value of an existing column, keeping bounds and fixed flag. */
	public void setValue(final FeatureParameter p, final double value) {
		parameters.put(p, require(p).withValue(value));
	}

	public Map<FeatureParameter, BoundedParameter> getParameters() {
		return Collections.unmodifiableMap(parameters);
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder();
		sb.append(name).append(" [").append(kind).append("]");
		for (final Map.Entry<FeatureParameter, BoundedParameter> e : parameters
			.entrySet())
		{
			sb.append(' ').append(e.getKey().getColumnName()).append('=').append(e
				.getValue());
		}
		return sb.toString();
	}
}
