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
package org.blockframe.core.columnar.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.blockframe.core.columnar.ReferencedData;
import org.blockframe.core.columnar.ShapeMismatchException;
import org.blockframe.core.columnar.TypeCastException;
import org.blockframe.core.columnar.data.BlockValues;
import org.blockframe.core.columnar.data.DataSpec;
import org.blockframe.core.columnar.data.DataSpecs;
import org.blockframe.core.columnar.data.Kind;
import org.blockframe.core.columnar.data.NativeFormatOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * A type-homogeneous buffer of shape {@code (numColumns, numRows)} together with the {@link BlockPlacement} of its
 * columns within a manager.
 *
 * <p>
 * A block owns one reference to its buffer. Writes through {@link #setValuesAt(int[], int[], Object)} and friends
 * materialize a private copy first if the buffer is shared with another block (copy-on-write). Blocks are not
 * thread-safe.
 */
public final class Block implements ReferencedData {

    private static final Logger LOGGER = LoggerFactory.getLogger(Block.class);

    private BlockValues m_values;

    private BlockPlacement m_placement;

    /**
     * Creates a block that takes over the reference of the caller to the values.
     *
     * @param values the values
     * @param placement the placement of the columns of the values
     * @throws ShapeMismatchException if the number of columns of the values and the placement differ
     */
    public Block(final BlockValues values, final BlockPlacement placement) {
        ShapeMismatchException.checkLength("placement", values.numColumns(), placement.length());
        m_values = values;
        m_placement = placement;
    }

    /**
     * @return a read-only view on the values, which has to be released by the caller
     */
    public BlockValues getValues() {
        return m_values.shallowCopy();
    }

    /**
     * @return the values of this block without retaining them; must neither be written nor kept
     */
    public BlockValues peekValues() {
        return m_values;
    }

    public BlockPlacement getPlacement() {
        return m_placement;
    }

    /**
     * @param placement the new placement, of the same length as the current one
     */
    public void setPlacement(final BlockPlacement placement) {
        ShapeMismatchException.checkLength("placement", m_placement.length(), placement.length());
        m_placement = placement;
    }

    public DataSpec spec() {
        return m_values.spec();
    }

    public Kind kind() {
        return m_values.kind();
    }

    /**
     * @return true if the block holds one-dimensional extension values and is never consolidated
     */
    public boolean isExtension() {
        return m_values.spec().isExtension();
    }

    public int numColumns() {
        return m_values.numColumns();
    }

    public int numRows() {
        return m_values.length();
    }

    /**
     * @param value a value
     * @return true if the value can be written into this block without upcasting
     */
    public boolean canHold(final Object value) {
        return m_values.canHold(value);
    }

    /**
     * @param localColumn a column of this block
     * @return a copy of the column
     */
    public BlockValues iget(final int localColumn) {
        return m_values.takeColumns(new int[]{localColumn});
    }

    /**
     * Writes a scalar into the given rows of the given local columns.
     *
     * @param rows the rows
     * @param localColumns the local columns
     * @param value the value
     * @throws TypeCastException if the value cannot be held without upcasting
     */
    public void setValuesAt(final int[] rows, final int[] localColumns, final Object value) {
        if (!canHold(value)) {
            throw new TypeCastException(
                String.format("Cannot set value '%s' into a block of type %s without upcasting.", value, spec()));
        }
        checkPositions(rows, localColumns);
        ensureWritable();
        for (final int column : localColumns) {
            for (final int row : rows) {
                m_values.set(column, row, value);
            }
        }
    }

    /**
     * Writes values into the given rows of the given local columns. Column {@code i} of the new values is written into
     * local column {@code localColumns[i]}, row {@code j} into row {@code rows[j]}.
     *
     * @param rows the rows
     * @param localColumns the local columns
     * @param newValues values of shape {@code (localColumns.length, rows.length)}
     * @throws TypeCastException if any value cannot be held without upcasting; nothing is written in that case
     */
    public void setValuesAt(final int[] rows, final int[] localColumns, final BlockValues newValues) {
        ShapeMismatchException.checkLength("new value columns", localColumns.length, newValues.numColumns());
        ShapeMismatchException.checkLength("new value rows", rows.length, newValues.length());
        checkPositions(rows, localColumns);
        final boolean sameSpec = newValues.spec().equals(spec());
        for (int c = 0; !sameSpec && c < localColumns.length; c++) {
            for (int r = 0; r < rows.length; r++) {
                if (!canHold(newValues.get(c, r))) {
                    throw new TypeCastException(String.format("Cannot set value '%s' into a block of type %s.",
                        newValues.get(c, r), spec()));
                }
            }
        }
        ensureWritable();
        for (int c = 0; c < localColumns.length; c++) {
            for (int r = 0; r < rows.length; r++) {
                m_values.set(localColumns[c], rows[r], newValues.get(c, r));
            }
        }
    }

    /**
     * Replaces a whole column with values of the same spec.
     *
     * @param localColumn the local column
     * @param column one column of the same spec and length
     */
    public void setColumn(final int localColumn, final BlockValues column) {
        Preconditions.checkArgument(column.spec().equals(spec()), "Column of type %s cannot replace %s values.",
            column.spec(), spec());
        ensureWritable();
        column.copyColumn(0, m_values, localColumn);
    }

    private void checkPositions(final int[] rows, final int[] localColumns) {
        for (final int row : rows) {
            Objects.checkIndex(row, numRows());
        }
        for (final int column : localColumns) {
            Objects.checkIndex(column, numColumns());
        }
    }

    /**
     * Materializes a private copy of the values if they are shared.
     */
    public void ensureWritable() {
        if (m_values.isShared()) {
            LOGGER.debug("Copying shared {} values of {} before writing.", spec(), m_placement);
            final BlockValues copy = m_values.copy();
            m_values.release();
            m_values = copy;
        }
    }

    /**
     * @param start the first row (inclusive)
     * @param stop the last row (exclusive)
     * @return a block sharing the values of this block
     */
    public Block sliceRows(final int start, final int stop) {
        return new Block(m_values.sliceRows(start, stop), m_placement);
    }

    /**
     * @param rowIndexer source row of every result row
     * @param allowFill whether {@code -1} denotes a missing row
     * @param fillValue the fill value, {@code null} for the missing value
     * @return a new block, upcast if the fill value cannot be held
     * @see BlockValues#take(int[], boolean, Object)
     */
    public Block take(final int[] rowIndexer, final boolean allowFill, final Object fillValue) {
        return new Block(m_values.take(rowIndexer, allowFill, fillValue), m_placement);
    }

    /**
     * @param localColumns local columns
     * @param placement the placement of the new block
     * @return a new block holding a copy of the local columns
     */
    public Block takeColumns(final int[] localColumns, final BlockPlacement placement) {
        return new Block(m_values.takeColumns(localColumns), placement);
    }

    /**
     * @param localColumns local columns
     * @param placement the placement of the new block
     * @return a new block sharing the local columns with this block
     */
    public Block viewColumns(final int[] localColumns, final BlockPlacement placement) {
        return new Block(m_values.selectColumns(localColumns), placement);
    }

    /**
     * @return one block per column, sharing the values of this block
     */
    public List<Block> split() {
        final List<Block> result = new ArrayList<>(numColumns());
        for (int i = 0; i < numColumns(); i++) {
            result.add(viewColumns(new int[]{i}, m_placement.select(i)));
        }
        return result;
    }

    /**
     * Removes local columns from this block.
     *
     * @param localColumns the local columns to remove
     */
    public void deleteLocal(final int... localColumns) {
        final boolean[] remove = new boolean[numColumns()];
        for (final int local : localColumns) {
            remove[local] = true;
        }
        final int[] keep = new int[numColumns() - localColumns.length];
        int k = 0;
        for (int i = 0; i < remove.length; i++) {
            if (!remove[i]) {
                keep[k++] = i;
            }
        }
        final BlockValues kept = m_values.selectColumns(keep);
        m_values.release();
        m_values = kept;
        m_placement = m_placement.delete(localColumns);
    }

    /**
     * @param target the target spec
     * @return a new block holding the cast values
     * @see BlockValues#astype(DataSpec)
     */
    public Block astype(final DataSpec target) {
        return new Block(m_values.astype(target), m_placement);
    }

    /**
     * @param options the rendering options
     * @return one array of strings per local column
     */
    public String[][] toNativeTypes(final NativeFormatOptions options) {
        return m_values.toNativeTypes(options);
    }

    /**
     * @param deep whether to copy the values or to share them
     * @return the copy
     */
    public Block copy(final boolean deep) {
        return new Block(deep ? m_values.copy() : m_values.shallowCopy(), m_placement);
    }

    /**
     * Replaces missing values.
     *
     * @param value the replacement
     * @return blocks covering the placement of this block; columns that cannot hold the replacement are split out and
     *         upcast
     */
    public List<Block> fillna(final Object value) {
        final boolean[][] keep = new boolean[numColumns()][numRows()];
        for (int c = 0; c < numColumns(); c++) {
            for (int r = 0; r < numRows(); r++) {
                keep[c][r] = !m_values.isMissing(c, r);
            }
        }
        return replace(keep, value);
    }

    /**
     * Keeps the values where the mask is {@code true} and replaces the others.
     *
     * @param mask one array per local column, {@code true} for the values to keep
     * @param other the replacement
     * @return blocks covering the placement of this block; columns that cannot hold the replacement are split out and
     *         upcast
     */
    public List<Block> where(final boolean[][] mask, final Object other) {
        ShapeMismatchException.checkLength("mask columns", numColumns(), mask.length);
        for (final boolean[] column : mask) {
            ShapeMismatchException.checkLength("mask rows", numRows(), column.length);
        }
        return replace(mask, other);
    }

    private List<Block> replace(final boolean[][] keep, final Object value) {
        final boolean[] affected = new boolean[numColumns()];
        boolean anyAffected = false;
        for (int c = 0; c < numColumns(); c++) {
            for (int r = 0; r < numRows() && !affected[c]; r++) {
                affected[c] = !keep[c][r];
            }
            anyAffected |= affected[c];
        }
        if (!anyAffected) {
            return List.of(copy(false));
        }
        if (canHold(value)) {
            final Block result = copy(true);
            result.writeWhereNot(keep, value);
            return List.of(result);
        }
        final DataSpec promoted = DataSpecs.promoteForFill(spec(), value);
        LOGGER.debug("Splitting {} block at {} to hold '{}' as {}.", spec(), m_placement, value, promoted);
        final List<Block> result = new ArrayList<>(numColumns());
        for (int c = 0; c < numColumns(); c++) {
            final Block column = viewColumns(new int[]{c}, m_placement.select(c));
            if (!affected[c]) {
                result.add(column);
                continue;
            }
            final Block upcast = column.astype(promoted);
            column.release();
            upcast.writeWhereNot(new boolean[][]{keep[c]}, value);
            result.add(upcast);
        }
        return result;
    }

    private void writeWhereNot(final boolean[][] keep, final Object value) {
        ensureWritable();
        for (int c = 0; c < numColumns(); c++) {
            for (int r = 0; r < numRows(); r++) {
                if (!keep[c][r]) {
                    m_values.set(c, r, value);
                }
            }
        }
    }

    @Override
    public void retain() {
        m_values.retain();
    }

    @Override
    public void release() {
        m_values.release();
    }

    @Override
    public boolean isShared() {
        return m_values.isShared();
    }

    @Override
    public long sizeOf() {
        return m_values.sizeOf();
    }

    @Override
    public String toString() {
        return "Block[" + spec() + ", " + m_placement + ", " + numRows() + " rows]";
    }
}
