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
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Conversions between the {@code long} storage of datetime-like specs and their {@code java.time} representation.
 */
public final class Temporals {

    /** The missing marker ("not a time") of all datetime-like storage. */
    public static final long NAT = Long.MIN_VALUE;

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private Temporals() {
    }

    /**
     * @param dateTime a wall-clock time, interpreted in UTC
     * @return nanoseconds since the epoch
     * @throws ArithmeticException if the time is outside the representable range
     */
    public static long toNanos(final LocalDateTime dateTime) {
        return toNanos(dateTime.toInstant(ZoneOffset.UTC));
    }

    /**
     * @param instant an instant
     * @return nanoseconds since the epoch
     * @throws ArithmeticException if the instant is outside the representable range
     */
    public static long toNanos(final Instant instant) {
        final long nanos = Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
        if (nanos == NAT) {
            throw new ArithmeticException("Instant collides with the missing marker.");
        }
        return nanos;
    }

    /**
     * @param duration a duration
     * @return the duration in nanoseconds
     * @throws ArithmeticException if the duration is outside the representable range
     */
    public static long toNanos(final Duration duration) {
        final long nanos = duration.toNanos();
        if (nanos == NAT) {
            throw new ArithmeticException("Duration collides with the missing marker.");
        }
        return nanos;
    }

    /**
     * Converts a timezone-aware value into nanoseconds since the epoch.
     *
     * @param value a {@link ZonedDateTime}, {@link OffsetDateTime} or {@link Instant}
     * @return nanoseconds since the epoch
     * @throws IllegalArgumentException if the value is not timezone-aware
     */
    public static long instantNanos(final Object value) {
        if (value instanceof ZonedDateTime zoned) {
            return toNanos(zoned.toInstant());
        } else if (value instanceof OffsetDateTime offset) {
            return toNanos(offset.toInstant());
        } else if (value instanceof Instant instant) {
            return toNanos(instant);
        }
        throw new IllegalArgumentException("Not a timezone-aware value: " + value);
    }

    /**
     * @param nanos nanoseconds since the epoch
     * @return the instant
     */
    public static Instant toInstant(final long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }

    /**
     * @param nanos nanoseconds since the epoch
     * @return the wall-clock time in UTC
     */
    public static LocalDateTime toLocalDateTime(final long nanos) {
        return LocalDateTime.ofInstant(toInstant(nanos), ZoneOffset.UTC);
    }

    /**
     * @param nanos nanoseconds since the epoch
     * @param zone the zone to present the instant in
     * @return the zoned time
     */
    public static ZonedDateTime toZonedDateTime(final long nanos, final ZoneId zone) {
        return toInstant(nanos).atZone(zone);
    }

    /**
     * @param nanos nanoseconds
     * @return the duration
     */
    public static Duration toDuration(final long nanos) {
        return Duration.ofNanos(nanos);
    }

    /**
     * @param value any value
     * @return true if the value is a timezone-aware time
     */
    public static boolean isTimezoneAware(final Object value) {
        return value instanceof ZonedDateTime || value instanceof OffsetDateTime || value instanceof Instant;
    }
}
