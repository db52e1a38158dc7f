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
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntUnaryOperator;

import org.blockframe.core.columnar.ReferenceCounter;
import org.blockframe.core.columnar.TypeCastException;
import org.blockframe.core.columnar.data.DataSpec.Mapper;
import org.blockframe.core.columnar.data.PeriodDataSpec.Frequency;

import com.google.common.base.Preconditions;

/**
 * Factories for {@link BlockValues}. The single-argument-list factories create one column; the
 * {@code ...Columns} factories create one column per array.
 */
public final class Columns {

    private Columns() {
    }

    /**
     * Allocates a buffer of the given spec. The initial content is unspecified.
     *
     * @param spec the spec
     * @param numColumns the number of columns, exactly one for extension specs
     * @param length the number of values per column
     * @return a new, unshared buffer
     */
    public static BlockValues allocate(final DataSpec spec, final int numColumns, final int length) {
        Preconditions.checkArgument(numColumns >= 0 && length >= 0, "Negative shape (%s, %s).", numColumns, length);
        return spec.accept(new Allocator(numColumns, length));
    }

    /**
     * @param spec a spec that can hold missing values
     * @param length the number of values
     * @return one column of missing values
     * @throws IllegalArgumentException if the spec cannot hold missing values
     */
    public static BlockValues nas(final DataSpec spec, final int length) {
        Preconditions.checkArgument(DataSpecs.canHold(spec, null), "%s cannot hold missing values.", spec);
        final BlockValues values = allocate(spec, 1, length);
        for (int r = 0; r < length; r++) {
            values.write(0, r, null);
        }
        return values;
    }

    /**
     * @param spec the spec
     * @param values the boxed values of one column
     * @return the column
     * @throws TypeCastException if a value cannot be held by the spec
     */
    public static BlockValues of(final DataSpec spec, final Object... values) {
        final BlockValues column = allocate(spec, 1, values.length);
        for (int r = 0; r < values.length; r++) {
            if (!column.canHold(values[r])) {
                column.release();
                throw new TypeCastException(
                    String.format("Value '%s' at row %d cannot be held by %s.", values[r], r, spec));
            }
            column.write(0, r, values[r]);
        }
        return column;
    }

    /**
     * @param values the boxed values of one column
     * @return the column, of the spec inferred from the values
     * @see DataSpecs#inferSpec(java.util.Collection)
     */
    public static BlockValues infer(final Object... values) {
        return of(DataSpecs.inferSpec(Arrays.asList(values)), values);
    }

    public static DoubleValues doubles(final double... values) {
        return doubleColumns(values);
    }

    public static DoubleValues doubleColumns(final double[]... columns) {
        final int length = checkedLength(columns.length, c -> columns[c].length);
        final double[][] data = new double[columns.length][];
        Arrays.setAll(data, c -> columns[c].clone());
        return new DoubleValues(data, 0, length, new ReferenceCounter());
    }

    public static LongValues longs(final long... values) {
        return longColumns(values);
    }

    public static LongValues longColumns(final long[]... columns) {
        final int length = checkedLength(columns.length, c -> columns[c].length);
        final long[][] data = new long[columns.length][];
        Arrays.setAll(data, c -> columns[c].clone());
        return new LongValues(DataSpec.longSpec(), data, 0, length, new ReferenceCounter());
    }

    public static BooleanValues booleans(final boolean... values) {
        return new BooleanValues(new boolean[][]{values.clone()}, 0, values.length, new ReferenceCounter());
    }

    public static BlockValues objects(final Object... values) {
        return of(DataSpec.objectSpec(), values);
    }

    public static BlockValues texts(final String... values) {
        return of(DataSpec.textSpec(), (Object[])values);
    }

    public static BlockValues datetimes(final LocalDateTime... values) {
        return of(DataSpec.dateTimeSpec(), (Object[])values);
    }

    /**
     * @param zone the zone of the column
     * @param values zoned values, offset values or instants; presented in the zone of the column
     * @return the column
     */
    public static BlockValues datetimes(final ZoneId zone, final Object... values) {
        return of(DataSpec.dateTimeSpec(zone), values);
    }

    public static BlockValues timedeltas(final Duration... values) {
        return of(DataSpec.durationSpec(), (Object[])values);
    }

    public static BlockValues periods(final Frequency frequency, final Object... values) {
        return of(DataSpec.periodSpec(frequency), values);
    }

    /**
     * Creates an unordered categorical column whose categories are the distinct values, sorted if they are comparable.
     *
     * @param values the values, {@code null} for missing values
     * @return the column
     */
    public static CategoricalValues categorical(final Object... values) {
        return categoricalOf(inferCategories(Arrays.asList(values)), false, values);
    }

    /**
     * @param categories the categories
     * @param ordered whether the categories are ordered
     * @param values the values, each a category or {@code null}
     * @return the column
     * @throws TypeCastException if a value is not a category
     */
    public static CategoricalValues categoricalOf(final List<?> categories, final boolean ordered,
        final Object... values) {
        return (CategoricalValues)of(DataSpec.categoricalSpec(categories, ordered), values);
    }

    static List<Object> inferCategories(final Iterable<?> values) {
        final Set<Object> distinct = new LinkedHashSet<>();
        for (final Object value : values) {
            if (!DataSpecs.isNa(value)) {
                distinct.add(DataSpecs.normalize(value));
            }
        }
        return DataSpecs.sortIfComparable(List.copyOf(distinct));
    }

    /**
     * @param dense one column of a non-extension, non-datetime-like spec
     * @param fillValue the fill value, {@code null} for the default fill
     * @return the sparse encoded column
     * @see SparseValues#fromDense(BlockValues, Object)
     */
    public static SparseValues sparse(final BlockValues dense, final Object fillValue) {
        return SparseValues.fromDense(dense, fillValue);
    }

    private static int checkedLength(final int numColumns, final IntUnaryOperator lengthOf) {
        if (numColumns == 0) {
            return 0;
        }
        final int length = lengthOf.applyAsInt(0);
        for (int c = 1; c < numColumns; c++) {
            Preconditions.checkArgument(lengthOf.applyAsInt(c) == length, "All columns must have the same length.");
        }
        return length;
    }

    private static final class Allocator implements Mapper<BlockValues> {

        private final int m_numColumns;

        private final int m_length;

        Allocator(final int numColumns, final int length) {
            m_numColumns = numColumns;
            m_length = length;
        }

        @Override
        public BlockValues visit(final BooleanDataSpec spec) {
            return BooleanValues.allocateBooleans(m_numColumns, m_length);
        }

        @Override
        public BlockValues visit(final LongDataSpec spec) {
            return LongValues.allocateLongs(spec, m_numColumns, m_length);
        }

        @Override
        public BlockValues visit(final DoubleDataSpec spec) {
            return DoubleValues.allocateDoubles(m_numColumns, m_length);
        }

        @Override
        public BlockValues visit(final ObjectDataSpec spec) {
            return ObjectValues.allocateObjects(spec, m_numColumns, m_length);
        }

        @Override
        public BlockValues visit(final DateTimeDataSpec spec) {
            return LongValues.allocateLongs(spec, m_numColumns, m_length);
        }

        @Override
        public BlockValues visit(final DurationDataSpec spec) {
            return LongValues.allocateLongs(spec, m_numColumns, m_length);
        }

        @Override
        public BlockValues visit(final PeriodDataSpec spec) {
            return LongValues.allocateLongs(spec, m_numColumns, m_length);
        }

        @Override
        public BlockValues visit(final CategoricalDataSpec spec) {
            return CategoricalValues.allocateCategorical(spec, m_numColumns, m_length);
        }

        @Override
        public BlockValues visit(final SparseDataSpec spec) {
            return SparseValues.allocateSparse(spec, m_numColumns, m_length);
        }
    }
}
