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

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.blockframe.core.columnar.TypeCastException;
import org.blockframe.core.columnar.data.PeriodDataSpec.Frequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Element-wise conversion of buffers into another spec.
 *
 * <ul>
 * <li>numeric casts follow IEEE 754 and two's complement rules, float64 to int64 truncates toward zero</li>
 * <li>casts to text render the canonical text of every value, casts from text parse it</li>
 * <li>if the source holds missing values and the target cannot represent them, the target is promoted (int64 to
 * float64, bool to object)</li>
 * <li>values that cannot be converted raise a {@link TypeCastException}</li>
 * </ul>
 */
final class ValueCasts {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValueCasts.class);

    private ValueCasts() {
    }

    static BlockValues cast(final BlockValues source, final DataSpec target) {
        if (target.equals(source.spec())) {
            return source.copy();
        }
        DataSpec effective = target;
        // the spec the present values are converted to
        DataSpec conversion = target;
        if (!target.kind().canHoldMissing() && source.hasMissing()) {
            effective = DataSpecs.promoteForFill(target, null);
            LOGGER.debug("Casting {} with missing values to {} instead of {}.", source.spec(), effective, target);
        }
        if (effective instanceof CategoricalDataSpec categorical && categorical.categories().isEmpty()) {
            effective = DataSpec.categoricalSpec(Columns.inferCategories(boxedValues(source)), categorical.ordered());
            conversion = effective;
        }
        if (effective instanceof SparseDataSpec sparse) {
            final BlockValues dense = cast(source, sparse.subtype());
            try {
                return SparseValues.fromDense(dense, sparse.fillValue());
            } finally {
                dense.release();
            }
        }
        final BlockValues result = Columns.allocate(effective, source.numColumns(), source.length());
        try {
            for (int c = 0; c < source.numColumns(); c++) {
                for (int r = 0; r < source.length(); r++) {
                    final Object converted = source.isMissing(c, r) ? null : convert(source.get(c, r), conversion);
                    if (!DataSpecs.canHold(effective, converted)) {
                        throw new TypeCastException(
                            String.format("Cannot cast value '%s' to %s.", source.get(c, r), effective));
                    }
                    result.write(c, r, converted);
                }
            }
        } catch (TypeCastException ex) {
            result.release();
            throw ex;
        }
        return result;
    }

    private static List<Object> boxedValues(final BlockValues values) {
        final List<Object> result = new ArrayList<>(values.numColumns() * values.length());
        for (int c = 0; c < values.numColumns(); c++) {
            for (int r = 0; r < values.length(); r++) {
                result.add(values.get(c, r));
            }
        }
        return result;
    }

    /**
     * Converts a non-missing value.
     *
     * @return the converted value, {@code null} if the value becomes missing (e.g. a value that is not a category)
     * @throws TypeCastException if the value cannot be converted
     */
    static Object convert(final Object value, final DataSpec target) {
        try {
            final Object converted = convertOrNull(value, target);
            if (converted == FAILED) {
                throw failure(value, target, null);
            }
            return converted;
        } catch (NumberFormatException | DateTimeException | ArithmeticException ex) {
            throw failure(value, target, ex);
        }
    }

    private static final Object FAILED = new Object();

    private static TypeCastException failure(final Object value, final DataSpec target, final Exception cause) {
        final String message = String.format("Cannot cast %s '%s' to %s.",
            value == null ? "null" : value.getClass().getSimpleName(), value, target);
        return cause == null ? new TypeCastException(message) : new TypeCastException(message, cause);
    }

    private static Object convertOrNull(final Object value, final DataSpec target) { // NOSONAR one branch per kind
        switch (target.kind()) {
            case BOOL:
                return toBoolean(value);
            case INTEGER:
                return toLong(value);
            case FLOAT:
                return toDouble(value);
            case OBJECT:
                return ((ObjectDataSpec)target).isText() ? NativeFormatter.canonical(value) : value;
            case DATETIME:
                return toLocalDateTime(value);
            case DATETIME_TZ:
                return toZonedDateTime(value, (DateTimeDataSpec)target);
            case TIMEDELTA:
                return toDuration(value);
            case PERIOD:
                return toPeriod(value, ((PeriodDataSpec)target).frequency());
            case CATEGORICAL:
                final var categorical = (CategoricalDataSpec)target;
                return categorical.codeOf(value) >= 0 ? DataSpecs.normalize(value) : null;
            default:
                return FAILED;
        }
    }

    private static Object toBoolean(final Object value) {
        if (value instanceof Boolean) {
            return value;
        } else if (value instanceof Number n) {
            return n.doubleValue() != 0;
        } else if (value instanceof CharSequence text) {
            final String s = text.toString().trim().toLowerCase(Locale.ROOT);
            if ("true".equals(s)) {
                return Boolean.TRUE;
            } else if ("false".equals(s)) {
                return Boolean.FALSE;
            }
        }
        return FAILED;
    }

    private static Object toLong(final Object value) {
        if (value instanceof Double || value instanceof Float) {
            final double d = ((Number)value).doubleValue();
            if (Double.isInfinite(d)) {
                return FAILED;
            }
            return (long)d;
        } else if (value instanceof Number n) {
            return n.longValue();
        } else if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        } else if (value instanceof CharSequence text) {
            return Long.parseLong(text.toString().trim());
        } else if (value instanceof LocalDateTime dateTime) {
            return Temporals.toNanos(dateTime);
        } else if (Temporals.isTimezoneAware(value)) {
            return Temporals.instantNanos(value);
        } else if (value instanceof Duration duration) {
            return Temporals.toNanos(duration);
        }
        return FAILED;
    }

    private static Object toDouble(final Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        } else if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        } else if (value instanceof CharSequence text) {
            return Double.parseDouble(text.toString().trim());
        }
        final Object nanos = toLong(value);
        return nanos instanceof Long l ? (Object)l.doubleValue() : FAILED;
    }

    private static Object toLocalDateTime(final Object value) {
        if (value instanceof LocalDateTime) {
            return value;
        } else if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        } else if (value instanceof Long nanos) {
            return Temporals.toLocalDateTime(nanos);
        } else if (Temporals.isTimezoneAware(value)) {
            return Temporals.toLocalDateTime(Temporals.instantNanos(value));
        } else if (value instanceof CharSequence text) {
            return LocalDateTime.parse(text.toString().trim().replace(' ', 'T'));
        }
        return FAILED;
    }

    private static Object toZonedDateTime(final Object value, final DateTimeDataSpec target) {
        if (value instanceof ZonedDateTime zoned) {
            return zoned.withZoneSameInstant(target.zone());
        } else if (value instanceof OffsetDateTime offset) {
            return offset.atZoneSameInstant(target.zone());
        } else if (value instanceof Instant instant) {
            return instant.atZone(target.zone());
        } else if (value instanceof LocalDateTime dateTime) {
            // naive values are interpreted as UTC wall-clock times
            return dateTime.atZone(ZoneOffset.UTC).withZoneSameInstant(target.zone());
        } else if (value instanceof Long nanos) {
            return Temporals.toZonedDateTime(nanos, target.zone());
        } else if (value instanceof CharSequence text) {
            return ZonedDateTime.parse(text.toString().trim().replace(' ', 'T')).withZoneSameInstant(target.zone());
        }
        return FAILED;
    }

    private static Object toDuration(final Object value) {
        if (value instanceof Duration) {
            return value;
        } else if (value instanceof Long nanos) {
            return Duration.ofNanos(nanos);
        } else if (value instanceof CharSequence text) {
            return Duration.parse(text.toString().trim());
        }
        return FAILED;
    }

    private static Object toPeriod(final Object value, final Frequency frequency) {
        if (frequency.getTemporalClass().isInstance(value)) {
            return value;
        } else if (value instanceof LocalDate || value instanceof LocalDateTime || value instanceof YearMonth
            || value instanceof Year) {
            return frequency.toTemporal(frequency.ordinalOf(value));
        } else if (value instanceof Long ordinal) {
            return frequency.toTemporal(ordinal);
        } else if (value instanceof CharSequence text) {
            final String s = text.toString().trim();
            switch (frequency) {
                case DAY:
                    return LocalDate.parse(s);
                case MONTH:
                    return YearMonth.parse(s);
                default:
                    return Year.parse(s);
            }
        }
        return FAILED;
    }
}
