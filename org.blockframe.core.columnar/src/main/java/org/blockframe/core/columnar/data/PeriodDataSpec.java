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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;

import com.google.common.base.Preconditions;

/**
 * Periods of a fixed {@link Frequency}, stored as {@code long} ordinals counted from the period containing
 * 1970-01-01. Missing values are {@link Temporals#NAT}.
 *
 * @param frequency the frequency of the periods
 */
public record PeriodDataSpec(Frequency frequency) implements DataSpec {

    /**
     * The supported period frequencies together with their boxed representation.
     */
    public enum Frequency {

            /** Days, boxed as {@link LocalDate}. */
            DAY(LocalDate.class) {
                @Override
                Temporal toTemporal(final long ordinal) {
                    return LocalDate.ofEpochDay(ordinal);
                }

                @Override
                long toOrdinal(final LocalDate date) {
                    return date.toEpochDay();
                }
            },
            /** Months, boxed as {@link YearMonth}. */
            MONTH(YearMonth.class) {
                @Override
                Temporal toTemporal(final long ordinal) {
                    return EPOCH_MONTH.plusMonths(ordinal);
                }

                @Override
                long toOrdinal(final LocalDate date) {
                    return ChronoUnit.MONTHS.between(EPOCH_MONTH, YearMonth.from(date));
                }
            },
            /** Years, boxed as {@link Year}. */
            YEAR(Year.class) {
                @Override
                Temporal toTemporal(final long ordinal) {
                    return Year.of(Math.toIntExact(1970 + ordinal));
                }

                @Override
                long toOrdinal(final LocalDate date) {
                    return date.getYear() - 1970L;
                }
            };

        private static final YearMonth EPOCH_MONTH = YearMonth.of(1970, 1);

        private final Class<? extends Temporal> m_temporalClass;

        Frequency(final Class<? extends Temporal> temporalClass) {
            m_temporalClass = temporalClass;
        }

        /**
         * @return the class of the boxed representation of a period of this frequency
         */
        public Class<? extends Temporal> getTemporalClass() {
            return m_temporalClass;
        }

        abstract Temporal toTemporal(long ordinal);

        abstract long toOrdinal(LocalDate date);

        /**
         * Converts a temporal into the ordinal of the period of this frequency containing it.
         *
         * @param temporal a {@link LocalDate}, {@link LocalDateTime}, {@link YearMonth} or {@link Year}
         * @return the ordinal
         * @throws IllegalArgumentException if the temporal type is not supported
         */
        long ordinalOf(final Object temporal) {
            if (temporal instanceof LocalDate date) {
                return toOrdinal(date);
            } else if (temporal instanceof LocalDateTime dateTime) {
                return toOrdinal(dateTime.toLocalDate());
            } else if (temporal instanceof YearMonth month) {
                return toOrdinal(month.atDay(1));
            } else if (temporal instanceof Year year) {
                return toOrdinal(year.atDay(1));
            }
            throw new IllegalArgumentException(
                String.format("Cannot derive a %s period from %s.", this, temporal.getClass().getSimpleName()));
        }
    }

    /**
     * @param frequency the frequency of the periods
     */
    public PeriodDataSpec {
        Preconditions.checkNotNull(frequency, "Period frequency must not be null.");
    }

    @Override
    public <R> R accept(final Mapper<R> v) {
        return v.visit(this);
    }

    @Override
    public Kind kind() {
        return Kind.PERIOD;
    }

    @Override
    public String toString() {
        return "period[" + frequency + "]";
    }
}
