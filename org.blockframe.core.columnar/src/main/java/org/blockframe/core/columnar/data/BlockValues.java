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

import java.util.List;
import java.util.Objects;

import org.blockframe.core.columnar.ReferenceCounter;
import org.blockframe.core.columnar.ReferencedData;
import org.blockframe.core.columnar.ShapeMismatchException;
import org.blockframe.core.columnar.TypeCastException;

import com.google.common.base.Preconditions;

/**
 * A type-homogeneous two-dimensional buffer of shape {@code (numColumns, length)}: every column of the buffer holds
 * the values of one logical column of a table.
 *
 * <p>
 * Buffers are reference counted. All views of the same storage (row slices, column selections, shallow copies) share
 * one {@link ReferenceCounter}. A buffer whose storage is {@link #isShared() shared} rejects every write with an
 * {@link IllegalStateException}; owners have to {@link #copy()} it first.
 *
 * <p>
 * Values are exchanged in their boxed form (see {@link #get(int, int)}); the concrete subclasses offer unboxed
 * accessors for their storage type.
 */
public abstract class BlockValues implements ReferencedData {

    private final ReferenceCounter m_refCounter;

    /**
     * @param refCounter the counter of the underlying storage
     */
    protected BlockValues(final ReferenceCounter refCounter) {
        m_refCounter = refCounter;
    }

    /**
     * Retains the storage for a new view and returns its counter.
     *
     * @return the retained counter
     */
    protected final ReferenceCounter retainedCounter() {
        m_refCounter.retain();
        return m_refCounter;
    }

    @Override
    public final void retain() {
        m_refCounter.retain();
    }

    @Override
    public final void release() {
        m_refCounter.release();
    }

    @Override
    public final boolean isShared() {
        return m_refCounter.isShared();
    }

    /**
     * @return the spec of all values in this buffer
     */
    public abstract DataSpec spec();

    /**
     * @return the kind of the spec of this buffer
     */
    public final Kind kind() {
        return spec().kind();
    }

    /**
     * @return the number of columns held by this buffer
     */
    public abstract int numColumns();

    /**
     * @return the number of values per column
     */
    public abstract int length();

    /**
     * @param column the column within this buffer
     * @param row the row
     * @return true if the value is missing
     */
    public abstract boolean isMissing(int column, int row);

    /**
     * Obtains the boxed value at the given position. Missing values box to {@code null}, except for float64 buffers
     * which box them to {@link Double#NaN}.
     *
     * @param column the column within this buffer
     * @param row the row
     * @return the boxed value
     */
    public abstract Object get(int column, int row);

    /**
     * Writes a normalized value that is known to be held by {@link #spec()}.
     */
    protected abstract void setUnchecked(int column, int row, Object value);

    /**
     * Writes the missing value. Only called for specs that can hold missing values.
     */
    protected abstract void setMissingUnchecked(int column, int row);

    /**
     * Copies one element into a buffer of the same class and spec.
     */
    protected abstract void copyElement(int srcColumn, int srcRow, BlockValues dst, int dstColumn, int dstRow);

    /**
     * Copies a range of one column into a buffer of the same class and spec.
     */
    protected void copyRange(final int srcColumn, final int srcStart, final BlockValues dst, final int dstColumn,
        final int dstStart, final int length) {
        for (int i = 0; i < length; i++) {
            copyElement(srcColumn, srcStart + i, dst, dstColumn, dstStart + i);
        }
    }

    /**
     * Allocates a new, unshared buffer of the same spec. The initial content is unspecified.
     *
     * @param numColumns the number of columns
     * @param length the number of values per column
     * @return the new buffer
     */
    public abstract BlockValues allocate(int numColumns, int length);

    /**
     * Creates a view on some columns of this buffer, sharing (and retaining) the storage.
     */
    protected abstract BlockValues viewColumns(int[] columns);

    /**
     * Creates a view on a contiguous range of rows of this buffer, sharing (and retaining) the storage.
     */
    protected abstract BlockValues viewRows(int start, int length);

    /**
     * @param value a boxed value
     * @return true if the value can be written into this buffer without losing information
     */
    public final boolean canHold(final Object value) {
        return DataSpecs.canHold(spec(), value);
    }

    /**
     * Writes a boxed value.
     *
     * @param column the column within this buffer
     * @param row the row
     * @param value the value, {@code null} for the missing value
     * @throws TypeCastException if the value cannot be held by this buffer
     * @throws IllegalStateException if the storage is shared
     */
    public final void set(final int column, final int row, final Object value) {
        checkWritable();
        Objects.checkIndex(column, numColumns());
        Objects.checkIndex(row, length());
        if (!canHold(value)) {
            throw new TypeCastException(
                String.format("Cannot set value '%s' into a buffer of type %s without upcasting.", value, spec()));
        }
        write(column, row, value);
    }

    /**
     * Writes a value that has already been validated with {@link #canHold(Object)}.
     */
    final void write(final int column, final int row, final Object value) {
        if (DataSpecs.isNa(value) && !(spec() instanceof SparseDataSpec)) {
            setMissingUnchecked(column, row);
        } else {
            setUnchecked(column, row, DataSpecs.normalize(value));
        }
    }

    /**
     * Guards every in-place write.
     *
     * @throws IllegalStateException if the storage is shared
     */
    protected final void checkWritable() {
        if (isShared()) {
            throw new IllegalStateException(
                "Attempted to write into values that are shared with other owners. Copy them first.");
        }
    }

    /**
     * Copies one column into another buffer of the same spec and length.
     *
     * @param srcColumn the column of this buffer
     * @param dst the target buffer
     * @param dstColumn the column of the target buffer
     * @throws IllegalStateException if the storage of the target is shared
     */
    public final void copyColumn(final int srcColumn, final BlockValues dst, final int dstColumn) {
        checkSameSpec(this, dst);
        ShapeMismatchException.checkLength("copied column", dst.length(), length());
        Objects.checkIndex(srcColumn, numColumns());
        Objects.checkIndex(dstColumn, dst.numColumns());
        dst.checkWritable();
        copyRange(srcColumn, 0, dst, dstColumn, 0, length());
    }

    /**
     * @return a deep, unshared copy of this buffer
     */
    public final BlockValues copy() {
        final BlockValues copy = allocate(numColumns(), length());
        for (int c = 0; c < numColumns(); c++) {
            copyRange(c, 0, copy, c, 0, length());
        }
        return copy;
    }

    /**
     * @return a view on the whole buffer that shares (and retains) the storage
     */
    public final BlockValues shallowCopy() {
        return viewRows(0, length());
    }

    /**
     * @param start the first row (inclusive)
     * @param stop the last row (exclusive)
     * @return a zero-copy view on the rows that shares (and retains) the storage
     */
    public final BlockValues sliceRows(final int start, final int stop) {
        Preconditions.checkPositionIndexes(start, stop, length());
        return viewRows(start, stop - start);
    }

    /**
     * @param columns columns of this buffer
     * @return a zero-copy view on the columns that shares (and retains) the storage
     */
    public final BlockValues selectColumns(final int[] columns) {
        for (final int column : columns) {
            Objects.checkIndex(column, numColumns());
        }
        return viewColumns(columns);
    }

    /**
     * @param columns columns of this buffer
     * @return an unshared copy of the columns
     */
    public final BlockValues takeColumns(final int[] columns) {
        final BlockValues result = allocate(columns.length, length());
        for (int i = 0; i < columns.length; i++) {
            Objects.checkIndex(columns[i], numColumns());
            copyRange(columns[i], 0, result, i, 0, length());
        }
        return result;
    }

    /**
     * Selects rows by position. If {@code allowFill} is set, position {@code -1} denotes a row without source, which is
     * filled with {@code fillValue}; the result is upcast if this buffer cannot hold the fill (see
     * {@link DataSpecs#promoteForFill(DataSpec, Object)}). Without fill, negative positions count from the end.
     *
     * @param indexer the source row of every result row
     * @param allowFill whether {@code -1} denotes a missing row
     * @param fillValue the fill value, {@code null} for the missing value of the (promoted) spec
     * @return a new, unshared buffer
     * @throws IndexOutOfBoundsException if a position is out of range
     */
    public final BlockValues take(final int[] indexer, final boolean allowFill, final Object fillValue) {
        final int[] positions = Indexers.validate(indexer, length(), allowFill);
        final boolean needsFill = allowFill && Indexers.containsMissing(positions);
        final DataSpec target = needsFill ? DataSpecs.promoteForFill(spec(), fillValue) : spec();
        final BlockValues source = target.equals(spec()) ? this : astype(target);
        try {
            final BlockValues result = source.allocate(numColumns(), positions.length);
            for (int c = 0; c < numColumns(); c++) {
                for (int r = 0; r < positions.length; r++) {
                    if (positions[r] == Indexers.MISSING) {
                        result.write(c, r, fillValue);
                    } else {
                        source.copyElement(c, positions[r], result, c, r);
                    }
                }
            }
            return result;
        } finally {
            if (source != this) {
                source.release();
            }
        }
    }

    /**
     * Casts the buffer. See {@link ValueCasts} for the conversion rules.
     *
     * @param target the target spec
     * @return a new, unshared buffer
     * @throws TypeCastException if a value cannot be converted
     */
    public final BlockValues astype(final DataSpec target) {
        return ValueCasts.cast(this, target);
    }

    /**
     * @return true if any value is missing
     */
    public final boolean hasMissing() {
        for (int c = 0; c < numColumns(); c++) {
            if (hasMissing(c)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param column a column of this buffer
     * @return true if any value of the column is missing
     */
    public boolean hasMissing(final int column) {
        for (int r = 0; r < length(); r++) {
            if (isMissing(column, r)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders every value as text for writers.
     *
     * @param options the rendering options
     * @return one array of strings per column of this buffer
     */
    public final String[][] toNativeTypes(final NativeFormatOptions options) {
        return NativeFormatter.format(this, options);
    }

    /**
     * Compares the content of two buffers. Missing values are equal to each other.
     *
     * @param other the other buffer
     * @return true if both buffers have the same spec, shape and values
     */
    public final boolean valuesEqual(final BlockValues other) {
        if (!spec().equals(other.spec()) || numColumns() != other.numColumns() || length() != other.length()) {
            return false;
        }
        for (int c = 0; c < numColumns(); c++) {
            for (int r = 0; r < length(); r++) {
                final boolean missing = isMissing(c, r);
                if (missing != other.isMissing(c, r) || (!missing && !Objects.equals(get(c, r), other.get(c, r)))) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Stacks buffers of the same spec and length along the column axis.
     *
     * @param parts the buffers in result order
     * @return a new, unshared buffer holding all columns of all parts
     */
    public static BlockValues stackColumns(final List<? extends BlockValues> parts) {
        Preconditions.checkArgument(!parts.isEmpty(), "Nothing to stack.");
        final BlockValues first = parts.get(0);
        int numColumns = 0;
        for (final BlockValues part : parts) {
            checkSameSpec(first, part);
            ShapeMismatchException.checkLength("stacked values", first.length(), part.length());
            numColumns += part.numColumns();
        }
        final BlockValues result = first.allocate(numColumns, first.length());
        int column = 0;
        for (final BlockValues part : parts) {
            for (int c = 0; c < part.numColumns(); c++) {
                part.copyRange(c, 0, result, column++, 0, part.length());
            }
        }
        return result;
    }

    /**
     * Appends buffers of the same spec and number of columns along the row axis.
     *
     * @param parts the buffers in result order
     * @return a new, unshared buffer holding all rows of all parts
     */
    public static BlockValues concatRows(final List<? extends BlockValues> parts) {
        Preconditions.checkArgument(!parts.isEmpty(), "Nothing to concatenate.");
        final BlockValues first = parts.get(0);
        int length = 0;
        for (final BlockValues part : parts) {
            checkSameSpec(first, part);
            ShapeMismatchException.checkLength("number of columns", first.numColumns(), part.numColumns());
            length += part.length();
        }
        final BlockValues result = first.allocate(first.numColumns(), length);
        int offset = 0;
        for (final BlockValues part : parts) {
            for (int c = 0; c < part.numColumns(); c++) {
                part.copyRange(c, 0, result, c, offset, part.length());
            }
            offset += part.length();
        }
        return result;
    }

    private static void checkSameSpec(final BlockValues first, final BlockValues other) {
        if (!first.spec().equals(other.spec())) {
            throw new IllegalArgumentException(
                String.format("Values of type %s and %s must be cast to a common type first.", first.spec(),
                    other.spec()));
        }
    }

    @Override
    public String toString() {
        return String.format("%s[%d x %d]", spec(), numColumns(), length());
    }
}
