/*
 * ------------------------------------------------------------------------
 *
 *  Copyright by KNIME AG, Zurich, Switzerland
 *  Website: http://www.knime.com; Email: contact@knime.com
 *
 *  This program is free software; you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License, Version 3, as
 *  published by the Free Software Foundation.
 *
 *  This program is distributed in the hope that it will be useful, but
 *  WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program; if not, see <http://www.gnu.org/licenses>.
 *
 *  Additional permission under GNU GPL version 3 section 7:
 *
 *  KNIME interoperates with ECLIPSE solely via ECLIPSE's plug-in APIs.
 *  Hence, KNIME and ECLIPSE are both independent programs and are not
 *  derived from each other. Should, however, the interpretation of the
 *  GNU GPL Version 3 ("License") under any applicable laws result in
 *  KNIME and ECLIPSE being a combined program, KNIME AG herewith grants
 *  you the additional permission to use and propagate KNIME together with
 *  ECLIPSE with only the license terms in place for ECLIPSE applying to
 *  ECLIPSE and the GNU GPL Version 3 applying for KNIME, provided the
 *  license terms of ECLIPSE themselves allow for the respective use and
 *  propagation of ECLIPSE together with KNIME.
 *
 *  Additional permission relating to nodes for KNIME that extend the Node
 *  Extension (and in particular that are based on subclasses of NodeModel,
 *  NodeDialog, and NodeView) and that only interoperate with KNIME through
 *  standard APIs ("Nodes"):
 *  Nodes are deemed to be separate and independent programs and to not be
 *  covered works.  Notwithstanding anything to the contrary in the
 *  License, the License does not apply to Nodes, you are not required to
 *  license Nodes under the License, and you are granted a license to
 *  prepare and propagate Nodes, in each case even if such Nodes are
 *  propagated with or for interoperation with KNIME.  The owner of a Node
 *  may freely choose the license terms applicable to such Node, including
 *  when such Node is propagated with or for interoperation with KNIME.
 * ---------------------------------------------------------------------
 */
package org.blockframe.core.columnar.data;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * Stateless helpers that classify values and buffers and reconcile data specs. Promotion follows the total order
 * {@code bool < int64 < float64 < object}; datetime-like specs are never promoted to or from numerics, any mix of them
 * with another spec results in {@link ObjectDataSpec object}.
 */
public final class DataSpecs {

    private DataSpecs() {
    }

    /**
     * Maps boxed values onto the representation used by the buffers: smaller integral types become {@link Long},
     * {@link Float} becomes {@link Double}.
     *
     * @param value any value, may be null
     * @return the normalized value
     */
    public static Object normalize(final Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number)value).longValue();
        } else if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    /**
     * @param value any value
     * @return true if the value denotes a missing value ({@code null} or a floating point NaN)
     */
    public static boolean isNa(final Object value) {
        return value == null || (value instanceof Double d && d.isNaN()) || (value instanceof Float f && f.isNaN());
    }

    /**
     * @param spec a spec whose kind can hold missing values
     * @return the boxed missing value of the spec
     * @throws IllegalArgumentException if the spec cannot represent missing values
     */
    public static Object naValue(final DataSpec spec) {
        switch (spec.kind()) {
            case BOOL:
            case INTEGER:
                throw new IllegalArgumentException(String.format("%s cannot represent missing values.", spec));
            case FLOAT:
                return Double.NaN;
            case SPARSE:
                return naValue(((SparseDataSpec)spec).subtype());
            default:
                return null;
        }
    }

    /**
     * @param subtype the subtype of a sparse spec
     * @return the fill value used when none is given: missing where possible, otherwise zero or false
     */
    public static Object defaultFillValue(final DataSpec subtype) {
        switch (subtype.kind()) {
            case BOOL:
                return Boolean.FALSE;
            case INTEGER:
                return 0L;
            default:
                return naValue(subtype);
        }
    }

    /**
     * Determines whether a value can be stored in a buffer of the given spec without losing information.
     *
     * @param spec the spec
     * @param value the boxed value, may be null
     * @return true if the value can be held losslessly
     */
    public static boolean canHold(final DataSpec spec, final Object value) {
        switch (spec.kind()) {
            case BOOL:
                return value instanceof Boolean;
            case INTEGER:
                return isIntegral(value);
            case FLOAT:
                return isNa(value) || value instanceof Double || value instanceof Float
                    || (isIntegral(value) && isExactDouble(((Number)value).longValue()));
            case OBJECT:
                return !((ObjectDataSpec)spec).isText() || isNa(value) || value instanceof CharSequence;
            case DATETIME:
                return isNa(value) || (value instanceof LocalDateTime dt && inRange(dt));
            case DATETIME_TZ:
                return isNa(value) || (Temporals.isTimezoneAware(value) && inRangeAware(value));
            case TIMEDELTA:
                return isNa(value) || (value instanceof Duration d && inRange(d));
            case PERIOD:
                return isNa(value) || ((PeriodDataSpec)spec).frequency().getTemporalClass().isInstance(value);
            case CATEGORICAL:
                return isNa(value) || ((CategoricalDataSpec)spec).codeOf(value) >= 0;
            case SPARSE:
                final var sparse = (SparseDataSpec)spec;
                return canHold(sparse.subtype(), value) || isFill(sparse, value);
            default:
                throw new IllegalStateException("Unhandled kind " + spec.kind());
        }
    }

    static boolean isFill(final SparseDataSpec spec, final Object value) {
        final Object fill = spec.fillValue();
        if (isNa(fill)) {
            return isNa(value);
        }
        return fill.equals(normalize(value));
    }

    private static boolean isIntegral(final Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            final double d = ((Number)value).doubleValue();
            return !Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63;
        }
        return false;
    }

    private static boolean isExactDouble(final long value) {
        return (long)(double)value == value && value != Long.MAX_VALUE;
    }

    private static boolean inRange(final LocalDateTime dateTime) {
        try {
            Temporals.toNanos(dateTime);
            return true;
        } catch (ArithmeticException ex) { // NOSONAR out of range is the answer
            return false;
        }
    }

    private static boolean inRangeAware(final Object value) {
        try {
            Temporals.instantNanos(value);
            return true;
        } catch (ArithmeticException ex) { // NOSONAR out of range is the answer
            return false;
        }
    }

    private static boolean inRange(final Duration duration) {
        try {
            Temporals.toNanos(duration);
            return true;
        } catch (ArithmeticException ex) { // NOSONAR out of range is the answer
            return false;
        }
    }

    /**
     * Infers the spec a single value would be stored in.
     *
     * @param value the value, may be null
     * @return the spec
     */
    public static DataSpec inferSpec(final Object value) {
        final Object v = normalize(value);
        if (v == null || v instanceof Double) {
            return DataSpec.doubleSpec();
        } else if (v instanceof Boolean) {
            return DataSpec.booleanSpec();
        } else if (v instanceof Long) {
            return DataSpec.longSpec();
        } else if (v instanceof LocalDateTime) {
            return DataSpec.dateTimeSpec();
        } else if (v instanceof ZonedDateTime zoned) {
            return DataSpec.dateTimeSpec(zoned.getZone());
        } else if (v instanceof OffsetDateTime offset) {
            return DataSpec.dateTimeSpec(offset.getOffset());
        } else if (v instanceof Instant) {
            return DataSpec.dateTimeSpec(ZoneOffset.UTC);
        } else if (v instanceof Duration) {
            return DataSpec.durationSpec();
        } else if (v instanceof YearMonth) {
            return DataSpec.periodSpec(PeriodDataSpec.Frequency.MONTH);
        } else if (v instanceof Year) {
            return DataSpec.periodSpec(PeriodDataSpec.Frequency.YEAR);
        }
        return DataSpec.objectSpec();
    }

    /**
     * Infers the spec a sequence of values would be stored in. Missing values promote integers to float64 and booleans
     * to object. An empty or all-missing sequence is inferred as object.
     *
     * @param values the values
     * @return the spec
     */
    public static DataSpec inferSpec(final Collection<?> values) {
        boolean hasNa = false;
        DataSpec result = null;
        for (final Object value : values) {
            if (isNa(value)) {
                hasNa = true;
                continue;
            }
            final DataSpec spec = inferSpec(value);
            result = result == null ? spec : commonSpec(result, spec);
        }
        if (result == null) {
            return DataSpec.objectSpec();
        }
        return hasNa ? promoteForFill(result, null) : result;
    }

    /**
     * @param values a buffer
     * @return the kind of the buffer
     */
    public static Kind classifyKind(final BlockValues values) {
        return values.spec().kind();
    }

    /**
     * @param values buffers
     * @return the distinct kinds of the buffers
     */
    public static Set<Kind> kinds(final Collection<? extends BlockValues> values) {
        final Set<Kind> kinds = EnumSet.noneOf(Kind.class);
        values.forEach(v -> kinds.add(classifyKind(v)));
        return kinds;
    }

    /**
     * @param specs at least one spec
     * @return the common spec
     * @see #commonSpec(List)
     */
    public static DataSpec commonSpec(final DataSpec... specs) {
        return commonSpec(Arrays.asList(specs));
    }

    /**
     * Computes the spec that can hold the values of all given specs without losing information.
     *
     * @param specs at least one spec
     * @return the common spec
     */
    public static DataSpec commonSpec(final List<? extends DataSpec> specs) {
        Preconditions.checkArgument(!specs.isEmpty(), "Cannot compute the common spec of no specs.");
        final DataSpec first = specs.get(0);
        if (specs.stream().allMatch(first::equals)) {
            return first;
        }
        final Set<Kind> kinds = EnumSet.noneOf(Kind.class);
        specs.forEach(s -> kinds.add(s.kind()));
        if (kinds.contains(Kind.CATEGORICAL)) {
            if (kinds.size() == 1 && specs.stream()
                .allMatch(s -> ((CategoricalDataSpec)s).isTypeEqual((CategoricalDataSpec)first))) {
                return first;
            }
            return DataSpec.objectSpec();
        }
        if (kinds.contains(Kind.SPARSE)) {
            return commonSparseSpec(specs);
        }
        if (kinds.stream().anyMatch(Kind::isDatetimeLike) || kinds.contains(Kind.OBJECT)) {
            // equal specs were handled above, so this is a mix
            return DataSpec.objectSpec();
        }
        if (kinds.contains(Kind.FLOAT)) {
            return DataSpec.doubleSpec();
        }
        return kinds.contains(Kind.INTEGER) ? DataSpec.longSpec() : DataSpec.booleanSpec();
    }

    private static DataSpec commonSparseSpec(final List<? extends DataSpec> specs) {
        SparseDataSpec firstSparse = null;
        final DataSpec[] subtypes = new DataSpec[specs.size()];
        for (int i = 0; i < subtypes.length; i++) {
            final DataSpec spec = specs.get(i);
            if (spec instanceof SparseDataSpec sparse) {
                firstSparse = firstSparse == null ? sparse : firstSparse;
                subtypes[i] = sparse.subtype();
            } else {
                subtypes[i] = spec;
            }
        }
        final DataSpec subtype = commonSpec(subtypes);
        if (subtype.isExtension() || subtype.kind().isDatetimeLike()) {
            return DataSpec.objectSpec();
        }
        final Object fill = firstSparse.fillValue(); // NOSONAR a sparse spec is present
        return DataSpec.sparseSpec(subtype, canHold(subtype, fill) ? fill : null);
    }

    /**
     * Computes the spec a buffer has to be cast to before the given fill value can be written into it. A missing fill
     * promotes integers to float64 and booleans to object; any other fill that cannot be held is reconciled through
     * {@link #commonSpec(DataSpec...)} and falls back to object.
     *
     * @param spec the spec of the buffer
     * @param fillValue the fill value, {@code null} for the missing value
     * @return the spec that can hold both the values of the buffer and the fill value
     */
    public static DataSpec promoteForFill(final DataSpec spec, final Object fillValue) {
        if (spec instanceof SparseDataSpec sparse) {
            final DataSpec subtype = promoteForFill(sparse.subtype(), fillValue);
            if (subtype.equals(sparse.subtype())) {
                return spec;
            }
            if (subtype.isExtension() || subtype.kind().isDatetimeLike()) {
                return DataSpec.objectSpec();
            }
            return DataSpec.sparseSpec(subtype, canHold(subtype, sparse.fillValue()) ? sparse.fillValue() : null);
        }
        if (isNa(fillValue)) {
            switch (spec.kind()) {
                case BOOL:
                    return DataSpec.objectSpec();
                case INTEGER:
                    return DataSpec.doubleSpec();
                default:
                    return spec;
            }
        }
        if (canHold(spec, fillValue)) {
            return spec;
        }
        if (spec.isExtension()) {
            return DataSpec.objectSpec();
        }
        final DataSpec candidate = commonSpec(spec, inferSpec(fillValue));
        return canHold(candidate, fillValue) ? candidate : DataSpec.objectSpec();
    }

    /**
     * Sorts values by their natural order if all of them are of the same {@link Comparable} class.
     *
     * @param values non-missing values
     * @return a sorted copy, or the values themselves if they cannot be compared with each other
     */
    public static List<Object> sortIfComparable(final List<Object> values) {
        if (values.isEmpty()) {
            return values;
        }
        final Class<?> type = values.get(0).getClass();
        if (!Comparable.class.isAssignableFrom(type) || values.stream().anyMatch(v -> v.getClass() != type)) {
            return values;
        }
        final List<Object> sorted = new ArrayList<>(values);
        sorted.sort(null);
        return sorted;
    }
}
