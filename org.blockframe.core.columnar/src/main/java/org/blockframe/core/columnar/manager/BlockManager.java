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
package org.blockframe.core.columnar.manager;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.blockframe.core.columnar.ColumnarParameters;
import org.blockframe.core.columnar.ComputeBackend;
import org.blockframe.core.columnar.ShapeMismatchException;
import org.blockframe.core.columnar.TypeCastException;
import org.blockframe.core.columnar.block.Block;
import org.blockframe.core.columnar.block.BlockPlacement;
import org.blockframe.core.columnar.data.BlockValues;
import org.blockframe.core.columnar.data.Columns;
import org.blockframe.core.columnar.data.DataSpec;
import org.blockframe.core.columnar.data.DataSpecs;
import org.blockframe.core.columnar.data.Indexers;
import org.blockframe.core.columnar.data.NativeFormatOptions;
import org.blockframe.core.columnar.index.Index;
import org.blockframe.core.columnar.index.Indexes;
import org.blockframe.core.columnar.index.RangeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * A two-dimensional table of labelled rows and columns, stored as a list of {@link Block blocks}. The placements of
 * all blocks partition the column positions {@code 0, ..., numColumns() - 1}; every block holds all rows.
 *
 * <p>
 * Columns of the same spec are stored in one block once the manager is {@link #consolidateInPlace() consolidated}.
 * Structural changes (inserting, deleting or upcasting columns) append and split blocks instead and leave the manager
 * {@link ConsolidationState#NON_CONSOLIDATED non-consolidated}.
 *
 * <p>
 * Managers share buffers with their shallow copies and views; writes copy shared buffers first. Managers are not
 * thread-safe.
 */
public final class BlockManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockManager.class);

    private final List<Block> m_blocks;

    private Index m_columns;

    private Index m_rows;

    // block number and location within the block of every column position, null if they have to be recomputed
    private int[] m_blknos;

    private int[] m_blklocs;

    private ConsolidationState m_state;

    /**
     * Creates a manager that takes over the references of the caller to the blocks.
     *
     * @param blocks the blocks
     * @param columns the column labels
     * @param rows the row labels
     * @throws IllegalArgumentException if the blocks do not match the labels
     */
    public BlockManager(final List<Block> blocks, final Index columns, final Index rows) {
        m_blocks = new ArrayList<>(blocks);
        m_columns = columns;
        m_rows = rows;
        m_state = ConsolidationState.FRESH;
        final String violation = integrityViolation();
        Preconditions.checkArgument(violation == null, violation);
    }

    /**
     * Creates a consolidated manager from single columns. The values are copied.
     *
     * @param columns the column labels
     * @param rows the row labels
     * @param values one single-column buffer per column label
     * @return the manager
     */
    public static BlockManager fromColumns(final Index columns, final Index rows,
        final List<? extends BlockValues> values) {
        ShapeMismatchException.checkLength("column values", columns.size(), values.size());
        final Map<DataSpec, IntArrayList> positionsBySpec = new LinkedHashMap<>();
        final List<Block> blocks = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            final BlockValues column = values.get(i);
            ShapeMismatchException.checkLength("columns of value " + i, 1, column.numColumns());
            ShapeMismatchException.checkLength("column " + columns.get(i), rows.size(), column.length());
            if (column.spec().isExtension()) {
                blocks.add(new Block(column.copy(), BlockPlacement.of(i)));
            } else {
                positionsBySpec.computeIfAbsent(column.spec(), s -> new IntArrayList()).add(i);
            }
        }
        for (final IntArrayList positions : positionsBySpec.values()) {
            final List<BlockValues> parts = new ArrayList<>(positions.size());
            for (int i = 0; i < positions.size(); i++) {
                parts.add(values.get(positions.getInt(i)));
            }
            blocks.add(new Block(BlockValues.stackColumns(parts), BlockPlacement.of(positions.toIntArray())));
        }
        blocks.sort(Comparator.comparingInt(b -> b.getPlacement().get(0)));
        final var manager = new BlockManager(blocks, columns, rows);
        manager.m_state = ConsolidationState.CONSOLIDATED;
        return manager;
    }

    /**
     * @param rows the row labels
     * @return a manager without columns
     */
    public static BlockManager empty(final Index rows) {
        return new BlockManager(List.of(), Indexes.of(), rows);
    }

    private String integrityViolation() {
        final int numColumns = m_columns.size();
        final int[] counts = new int[numColumns];
        for (final Block block : m_blocks) {
            if (block.numRows() != m_rows.size()) {
                return String.format("%s does not hold %d rows.", block, m_rows.size());
            }
            for (final int pos : block.getPlacement().positions()) {
                if (pos >= numColumns) {
                    return String.format("%s refers to column %d of %d columns.", block, pos, numColumns);
                }
                counts[pos]++;
            }
        }
        for (int i = 0; i < numColumns; i++) {
            if (counts[i] != 1) {
                return String.format("Column %d is held by %d blocks.", i, counts[i]);
            }
        }
        return null;
    }

    /**
     * Checks that the placements of the blocks partition the columns and that every block holds all rows.
     *
     * @throws IllegalStateException if the manager is corrupted
     */
    public void verifyIntegrity() {
        final String violation = integrityViolation();
        if (violation != null) {
            throw new IllegalStateException(violation);
        }
    }

    public int numRows() {
        return m_rows.size();
    }

    public int numColumns() {
        return m_columns.size();
    }

    public int numBlocks() {
        return m_blocks.size();
    }

    public Index rows() {
        return m_rows;
    }

    public Index columns() {
        return m_columns;
    }

    /**
     * @param rows new row labels of the same size
     */
    public void setRows(final Index rows) {
        ShapeMismatchException.checkLength("row labels", numRows(), rows.size());
        m_rows = rows;
    }

    /**
     * @param columns new column labels of the same size
     */
    public void setColumns(final Index columns) {
        ShapeMismatchException.checkLength("column labels", numColumns(), columns.size());
        m_columns = columns;
    }

    /**
     * @return a live, unmodifiable view of the blocks; it reflects later changes of the manager
     */
    public List<Block> iterBlocks() {
        return Collections.unmodifiableList(m_blocks);
    }

    /**
     * @return a snapshot of the current blocks
     */
    public List<Block> blocks() {
        return List.copyOf(m_blocks);
    }

    /**
     * @return the spec of every column
     */
    public List<DataSpec> specs() {
        ensureLocations();
        final List<DataSpec> specs = new ArrayList<>(numColumns());
        for (int i = 0; i < numColumns(); i++) {
            specs.add(m_blocks.get(m_blknos[i]).spec());
        }
        return specs;
    }

    /**
     * @param position a column position
     * @return the number of the block holding the column
     */
    public int getBlockNumber(final int position) {
        ensureLocations();
        return m_blknos[Objects.checkIndex(position, numColumns())];
    }

    /**
     * @param position a column position
     * @return the local column of the column within its block
     */
    public int getBlockLocation(final int position) {
        ensureLocations();
        return m_blklocs[Objects.checkIndex(position, numColumns())];
    }

    private void ensureLocations() {
        if (m_blknos != null) {
            return;
        }
        final int[] blknos = new int[numColumns()];
        final int[] blklocs = new int[numColumns()];
        for (int b = 0; b < m_blocks.size(); b++) {
            final BlockPlacement placement = m_blocks.get(b).getPlacement();
            final var slice = placement.asSlice();
            if (slice.isPresent()) {
                final int start = slice.get().start();
                Arrays.fill(blknos, start, slice.get().stop(), b);
                for (int i = 0; i < placement.length(); i++) {
                    blklocs[start + i] = i;
                }
                continue;
            }
            for (int i = 0; i < placement.length(); i++) {
                blknos[placement.get(i)] = b;
                blklocs[placement.get(i)] = i;
            }
        }
        m_blknos = blknos;
        m_blklocs = blklocs;
    }

    private void invalidateLocations() {
        m_blknos = null;
        m_blklocs = null;
    }

    public ConsolidationState state() {
        return m_state;
    }

    /**
     * @param position a column position
     * @return a copy of the column
     */
    public BlockValues iget(final int position) {
        return m_blocks.get(getBlockNumber(position)).iget(getBlockLocation(position));
    }

    /**
     * @param label a column label
     * @return the column, sharing its buffer with this manager
     * @throws org.blockframe.core.columnar.KeyNotFoundException if the label does not exist
     */
    public SingleBlockManager getColumn(final Object label) {
        return getColumnAt(m_columns.lookup(label));
    }

    /**
     * @param position a column position
     * @return the column, sharing its buffer with this manager
     */
    public SingleBlockManager getColumnAt(final int position) {
        final Block block = m_blocks.get(getBlockNumber(position));
        final BlockValues view = block.peekValues().selectColumns(new int[]{getBlockLocation(position)});
        return new SingleBlockManager(view, m_rows, m_columns.get(position));
    }

    /**
     * Replaces the column with the given label or appends a new column if the label does not exist.
     *
     * @param label the label
     * @param values one column of values; copied
     */
    public void setColumn(final Object label, final BlockValues values) {
        if (m_columns.contains(label)) {
            setColumnAt(m_columns.lookup(label), values);
        } else {
            insert(numColumns(), label, values);
        }
    }

    /**
     * Replaces a column. Values of the spec of the current block are written in place (copying a shared buffer
     * first); values of another spec are stored in a new block.
     *
     * @param position the column position
     * @param values one column of values; copied
     */
    public void setColumnAt(final int position, final BlockValues values) {
        Objects.checkIndex(position, numColumns());
        ShapeMismatchException.checkLength("columns of the values", 1, values.numColumns());
        ShapeMismatchException.checkLength("column", numRows(), values.length());
        final Block block = m_blocks.get(getBlockNumber(position));
        if (block.spec().equals(values.spec())) {
            block.setColumn(getBlockLocation(position), values);
            return;
        }
        detachColumns(new int[]{position});
        m_blocks.add(new Block(values.copy(), BlockPlacement.of(position)));
        markNonConsolidated();
    }

    /**
     * Writes a scalar, upcasting the column if it cannot hold the value.
     *
     * @param row the row position
     * @param column the column position
     * @param value the value
     */
    public void setValue(final int row, final int column, final Object value) {
        setValuesAt(new int[]{row}, new int[]{column}, value, true);
    }

    /**
     * Writes a scalar into the given rows of the given columns. All validation and all copies happen before the first
     * value is written.
     *
     * @param rows row positions
     * @param columns column positions
     * @param value the value
     * @param allowUpcast whether columns that cannot hold the value are split out and upcast
     * @throws TypeCastException if a column cannot hold the value and upcasting is not allowed; nothing is written
     */
    public void setValuesAt(final int[] rows, final int[] columns, final Object value, final boolean allowUpcast) {
        for (final int row : rows) {
            Objects.checkIndex(row, numRows());
        }
        final Int2ObjectLinkedOpenHashMap<IntArrayList> localsByBlock =
            groupByBlock(Arrays.stream(columns).distinct().toArray());
        final IntArrayList upcastPositions = new IntArrayList();
        for (final var entry : localsByBlock.int2ObjectEntrySet()) {
            final Block block = m_blocks.get(entry.getIntKey());
            if (!block.canHold(value)) {
                if (!allowUpcast) {
                    throw new TypeCastException(String.format(
                        "Cannot set value '%s' into columns of type %s without upcasting.", value, block.spec()));
                }
                final IntArrayList locals = entry.getValue();
                for (int i = 0; i < locals.size(); i++) {
                    upcastPositions.add(block.getPlacement().get(locals.getInt(i)));
                }
            }
        }
        // prepare the upcast columns before anything is written
        final List<Block> upcast = new ArrayList<>(upcastPositions.size());
        for (int i = 0; i < upcastPositions.size(); i++) {
            final int position = upcastPositions.getInt(i);
            final Block block = m_blocks.get(getBlockNumber(position));
            final DataSpec promoted = DataSpecs.promoteForFill(block.spec(), value);
            LOGGER.debug("Upcasting column {} from {} to {} to hold '{}'.", position, block.spec(), promoted, value);
            final int local = getBlockLocation(position);
            final Block column = block.viewColumns(new int[]{local}, BlockPlacement.of(position));
            upcast.add(column.astype(promoted));
            column.release();
        }
        for (final var entry : localsByBlock.int2ObjectEntrySet()) {
            final Block block = m_blocks.get(entry.getIntKey());
            if (block.canHold(value)) {
                block.setValuesAt(rows, entry.getValue().toIntArray(), value);
            }
        }
        if (!upcast.isEmpty()) {
            detachColumns(upcastPositions.toIntArray());
            for (final Block block : upcast) {
                block.setValuesAt(rows, new int[]{0}, value);
                m_blocks.add(block);
            }
            markNonConsolidated();
        }
    }

    /**
     * Removes columns from their blocks and drops blocks that become empty. Placements are not renumbered.
     */
    private void detachColumns(final int[] positions) {
        for (final var entry : groupByBlock(positions).int2ObjectEntrySet()) {
            m_blocks.get(entry.getIntKey()).deleteLocal(entry.getValue().toIntArray());
        }
        m_blocks.removeIf(block -> {
            if (block.numColumns() == 0) {
                block.release();
                return true;
            }
            return false;
        });
        invalidateLocations();
    }

    /**
     * @return the local columns of the positions, keyed by block number in order of appearance
     */
    private Int2ObjectLinkedOpenHashMap<IntArrayList> groupByBlock(final int[] positions) {
        final Int2ObjectLinkedOpenHashMap<IntArrayList> localsByBlock = new Int2ObjectLinkedOpenHashMap<>();
        for (final int position : positions) {
            final int blkno = getBlockNumber(position);
            IntArrayList locals = localsByBlock.get(blkno);
            if (locals == null) {
                locals = new IntArrayList();
                localsByBlock.put(blkno, locals);
            }
            locals.add(getBlockLocation(position));
        }
        return localsByBlock;
    }

    private void markNonConsolidated() {
        m_state = ConsolidationState.NON_CONSOLIDATED;
        invalidateLocations();
    }

    /**
     * Inserts a column. The columns at and after the position move one position up.
     *
     * @param position the position of the new column in {@code [0, numColumns()]}
     * @param label the label, which must not exist yet
     * @param values one column of values; copied
     * @throws IllegalArgumentException if the label already exists
     */
    public void insert(final int position, final Object label, final BlockValues values) {
        Objects.checkIndex(position, numColumns() + 1);
        Preconditions.checkArgument(!m_columns.contains(label), "Column '%s' already exists.", label);
        ShapeMismatchException.checkLength("columns of the values", 1, values.numColumns());
        ShapeMismatchException.checkLength("column", numRows(), values.length());
        final BlockValues copy = values.copy();
        for (final Block block : m_blocks) {
            block.setPlacement(block.getPlacement().increaseAbove(position, 1));
        }
        m_blocks.add(new Block(copy, BlockPlacement.of(position)));
        m_columns = m_columns.insert(position, label);
        markNonConsolidated();
        if (m_blocks.size() > ColumnarParameters.FRAGMENTATION_WARNING_THRESHOLD) {
            LOGGER.warn("The manager holds {} blocks after inserting column '{}', which degrades performance. "
                + "Consolidate it or build all columns at once.", m_blocks.size(), label);
        }
    }

    /**
     * @param labels the labels of the columns to delete
     */
    public void delete(final List<?> labels) {
        deleteAt(m_columns.positions(labels));
    }

    /**
     * Deletes columns. Blocks that become empty are dropped, the positions of the remaining columns are renumbered.
     *
     * @param positions column positions
     */
    public void deleteAt(final int... positions) {
        final int[] removed = Arrays.stream(positions).map(p -> Objects.checkIndex(p, numColumns())).distinct()
            .sorted().toArray();
        if (removed.length == 0) {
            return;
        }
        detachColumns(removed);
        for (final Block block : m_blocks) {
            block.setPlacement(block.getPlacement().compact(removed));
        }
        m_columns = m_columns.delete(removed);
        markNonConsolidated();
    }

    /**
     * @param newRows the target row labels
     * @param fillValue the value of rows that do not exist in this manager, {@code null} for missing values
     * @return the reindexed manager
     * @see #reindex(Index, Object, ComputeBackend)
     */
    public BlockManager reindex(final Index newRows, final Object fillValue) {
        return reindex(newRows, fillValue, ColumnarParameters.COMPUTE_BACKEND);
    }

    /**
     * Conforms the rows to new labels. Rows whose label does not exist are filled, which upcasts blocks that cannot
     * hold the fill value.
     *
     * @param newRows the target row labels
     * @param fillValue the value of rows that do not exist in this manager, {@code null} for missing values
     * @param backend the strategy for the per-block work
     * @return the reindexed manager
     * @throws IllegalArgumentException if the row labels of this manager are not unique
     */
    public BlockManager reindex(final Index newRows, final Object fillValue, final ComputeBackend backend) {
        if (m_rows.equalLabels(newRows)) {
            final BlockManager copy = copy(false);
            copy.m_rows = newRows;
            return copy;
        }
        if (!m_rows.isUnique()) {
            throw new IllegalArgumentException("Cannot reindex rows with duplicate labels.");
        }
        final int[] indexer = m_rows.getIndexer(newRows);
        final List<Block> blocks =
            backend.map(m_blocks, b -> b.take(indexer, true, fillValue), (long)numColumns() * indexer.length);
        return new BlockManager(blocks, m_columns, newRows);
    }

    /**
     * Conforms the columns to new labels. Columns whose label does not exist become one new block of the fill value.
     *
     * @param newColumns the target column labels
     * @param fillValue the value of new columns, {@code null} for float64 missing values
     * @return the reindexed manager; its buffers are copies
     * @throws IllegalArgumentException if the column labels of this manager are not unique
     */
    public BlockManager reindexColumns(final Index newColumns, final Object fillValue) {
        if (!m_columns.isUnique()) {
            throw new IllegalArgumentException("Cannot reindex columns with duplicate labels.");
        }
        return selectColumns(m_columns.getIndexer(newColumns), newColumns, fillValue);
    }

    /**
     * @param positions column positions, {@code -1} for a new column of the fill value
     */
    private BlockManager selectColumns(final int[] positions, final Index newColumns, final Object fillValue) {
        ensureLocations();
        final Int2ObjectLinkedOpenHashMap<IntArrayList[]> byBlock = new Int2ObjectLinkedOpenHashMap<>();
        final IntArrayList missing = new IntArrayList();
        for (int i = 0; i < positions.length; i++) {
            if (positions[i] == Indexers.MISSING) {
                missing.add(i);
                continue;
            }
            IntArrayList[] entry = byBlock.get(m_blknos[positions[i]]);
            if (entry == null) {
                entry = new IntArrayList[]{new IntArrayList(), new IntArrayList()};
                byBlock.put(m_blknos[positions[i]], entry);
            }
            entry[0].add(m_blklocs[positions[i]]);
            entry[1].add(i);
        }
        final List<Block> blocks = new ArrayList<>();
        for (final var entry : byBlock.int2ObjectEntrySet()) {
            final Block block = m_blocks.get(entry.getIntKey());
            final IntArrayList[] locals = entry.getValue();
            blocks.add(block.takeColumns(locals[0].toIntArray(), BlockPlacement.of(locals[1].toIntArray())));
        }
        if (!missing.isEmpty()) {
            final DataSpec spec = DataSpecs.isNa(fillValue) ? DataSpec.doubleSpec() : DataSpecs.inferSpec(fillValue);
            final BlockValues values = Columns.allocate(spec, missing.size(), numRows());
            final Block block = new Block(values, BlockPlacement.of(missing.toIntArray()));
            block.setValuesAt(Indexers.identity(numRows()), Indexers.identity(missing.size()), fillValue);
            blocks.add(block);
        }
        return new BlockManager(blocks, newColumns, m_rows);
    }

    /**
     * @param indexer positions along the axis
     * @param axis the axis
     * @return the selected rows or columns; the buffers are copies
     * @see #take(int[], Axis, boolean, Object)
     */
    public BlockManager take(final int[] indexer, final Axis axis) {
        return take(indexer, axis, false, null);
    }

    /**
     * Selects rows or columns by position.
     *
     * @param indexer positions along the axis
     * @param axis the axis
     * @param allowFill whether {@code -1} denotes a new row or column of the fill value
     * @param fillValue the fill value, {@code null} for missing values
     * @return the selected rows or columns; the buffers are copies
     * @throws IndexOutOfBoundsException if a position is outside {@code [-n, n)} without fill or outside
     *             {@code [-1, n)} with fill
     */
    public BlockManager take(final int[] indexer, final Axis axis, final boolean allowFill, final Object fillValue) {
        if (axis == Axis.ROWS) {
            final int[] positions = Indexers.validate(indexer, numRows(), allowFill);
            final List<Block> blocks = ColumnarParameters.COMPUTE_BACKEND.map(m_blocks,
                b -> b.take(positions, allowFill, fillValue), (long)numColumns() * positions.length);
            return new BlockManager(blocks, m_columns, m_rows.take(positions));
        }
        final int[] positions = Indexers.validate(indexer, numColumns(), allowFill);
        return selectColumns(positions, m_columns.take(positions), fillValue);
    }

    /**
     * @param start the first row (inclusive)
     * @param stop the last row (exclusive)
     * @return a manager sharing the buffers of this manager
     */
    public BlockManager sliceRows(final int start, final int stop) {
        Preconditions.checkPositionIndexes(start, stop, numRows());
        final List<Block> blocks = new ArrayList<>(m_blocks.size());
        m_blocks.forEach(b -> blocks.add(b.sliceRows(start, stop)));
        final Index rows;
        if (m_rows instanceof RangeIndex range) {
            rows = new RangeIndex(range.getStart() + start * range.getStep(), range.getStart() + stop * range.getStep(),
                range.getStep());
        } else {
            final int[] positions = new int[stop - start];
            Arrays.setAll(positions, i -> start + i);
            rows = m_rows.take(positions);
        }
        final var slice = new BlockManager(blocks, m_columns, rows);
        slice.m_state = m_state;
        return slice;
    }

    /**
     * @return true if there is at most one block per consolidatable spec
     */
    public boolean isConsolidated() {
        if (m_state != ConsolidationState.CONSOLIDATED) {
            final long distinctSpecs = m_blocks.stream().filter(b -> !b.isExtension()).map(Block::spec).distinct()
                .count();
            final long consolidatable = m_blocks.stream().filter(b -> !b.isExtension()).count();
            if (distinctSpecs == consolidatable) {
                m_state = ConsolidationState.CONSOLIDATED;
            }
        }
        return m_state == ConsolidationState.CONSOLIDATED;
    }

    /**
     * @return a consolidated manager sharing unchanged blocks with this one
     */
    public BlockManager consolidate() {
        final BlockManager copy = copy(false);
        copy.consolidateInPlace();
        return copy;
    }

    /**
     * Merges all non-extension blocks of the same spec into one block whose columns are sorted by position and orders
     * the blocks by their first position.
     */
    public void consolidateInPlace() {
        if (isConsolidated()) {
            return;
        }
        final int before = m_blocks.size();
        final Map<DataSpec, List<Block>> bySpec = new LinkedHashMap<>();
        final List<Block> result = new ArrayList<>();
        for (final Block block : m_blocks) {
            if (block.isExtension()) {
                result.add(block);
            } else {
                bySpec.computeIfAbsent(block.spec(), s -> new ArrayList<>()).add(block);
            }
        }
        for (final List<Block> group : bySpec.values()) {
            result.add(group.size() == 1 ? group.get(0) : merge(group));
        }
        result.sort(Comparator.comparingInt(b -> b.getPlacement().get(0)));
        m_blocks.clear();
        m_blocks.addAll(result);
        m_state = ConsolidationState.CONSOLIDATED;
        invalidateLocations();
        LOGGER.debug("Consolidated {} blocks into {}.", before, m_blocks.size());
    }

    private static Block merge(final List<Block> group) {
        final List<BlockValues> parts = new ArrayList<>(group.size());
        BlockPlacement placement = BlockPlacement.of();
        for (final Block block : group) {
            parts.add(block.peekValues());
            placement = placement.append(block.getPlacement());
        }
        final int[] positions = placement.asIndexer();
        final Integer[] order = new Integer[positions.length];
        Arrays.setAll(order, i -> i);
        Arrays.sort(order, Comparator.comparingInt(i -> positions[i]));
        final int[] localOrder = Arrays.stream(order).mapToInt(Integer::intValue).toArray();
        final BlockValues stacked = BlockValues.stackColumns(parts);
        final BlockValues sorted = stacked.takeColumns(localOrder);
        stacked.release();
        group.forEach(Block::release);
        Arrays.sort(positions);
        return new Block(sorted, BlockPlacement.of(positions));
    }

    /**
     * @param deep whether to copy the buffers or to share them
     * @return the copy
     */
    public BlockManager copy(final boolean deep) {
        return copy(deep, ColumnarParameters.COMPUTE_BACKEND);
    }

    /**
     * @param deep whether to copy the buffers or to share them
     * @param backend the strategy for copying the blocks
     * @return the copy
     */
    public BlockManager copy(final boolean deep, final ComputeBackend backend) {
        final List<Block> blocks = backend.map(m_blocks, b -> b.copy(deep), (long)numColumns() * numRows());
        final var copy = new BlockManager(blocks, m_columns, m_rows);
        copy.m_state = m_state;
        return copy;
    }

    /**
     * Releases the references of this manager to its buffers. The manager must not be used afterwards.
     */
    public void release() {
        m_blocks.forEach(Block::release);
    }

    /**
     * @param value the replacement of missing values
     * @return a manager without missing values; columns that cannot hold the value are upcast
     */
    public BlockManager fillna(final Object value) {
        final List<Block> blocks = new ArrayList<>();
        m_blocks.forEach(b -> blocks.addAll(b.fillna(value)));
        return new BlockManager(blocks, m_columns, m_rows);
    }

    /**
     * @param mask one array per column position, {@code true} for the values to keep
     * @param other the replacement of the other values
     * @return the new manager; columns that cannot hold the replacement are upcast
     */
    public BlockManager where(final boolean[][] mask, final Object other) {
        ShapeMismatchException.checkLength("mask columns", numColumns(), mask.length);
        final List<Block> blocks = new ArrayList<>();
        for (final Block block : m_blocks) {
            final boolean[][] blockMask = new boolean[block.numColumns()][];
            for (int i = 0; i < blockMask.length; i++) {
                blockMask[i] = mask[block.getPlacement().get(i)];
            }
            blocks.addAll(block.where(blockMask, other));
        }
        return new BlockManager(blocks, m_columns, m_rows);
    }

    /**
     * @param spec the target spec
     * @return a manager with all columns cast to the spec
     * @throws TypeCastException if a value cannot be cast
     */
    public BlockManager astype(final DataSpec spec) {
        final List<Block> blocks = new ArrayList<>();
        try {
            for (final Block block : m_blocks) {
                if (spec.isExtension() && block.numColumns() > 1) {
                    for (final Block column : block.split()) {
                        try {
                            blocks.add(column.astype(spec));
                        } finally {
                            column.release();
                        }
                    }
                } else {
                    blocks.add(block.astype(spec));
                }
            }
        } catch (TypeCastException ex) {
            blocks.forEach(Block::release);
            throw ex;
        }
        return new BlockManager(blocks, m_columns, m_rows);
    }

    /**
     * Renders all values as text, e.g. for writing them.
     *
     * @param options the rendering options
     * @return one array of strings per column position
     */
    public String[][] toNativeTypes(final NativeFormatOptions options) {
        final String[][] result = new String[numColumns()][];
        for (final Block block : m_blocks) {
            final String[][] rendered = block.toNativeTypes(options);
            for (int i = 0; i < rendered.length; i++) {
                result[block.getPlacement().get(i)] = rendered[i];
            }
        }
        return result;
    }

    /**
     * @param other another manager
     * @return true if both managers hold the same labels, specs and values, regardless of their block layout
     */
    public boolean contentEquals(final BlockManager other) {
        if (!m_columns.equalLabels(other.m_columns) || !m_rows.equalLabels(other.m_rows)
            || !specs().equals(other.specs())) {
            return false;
        }
        for (int i = 0; i < numColumns(); i++) {
            final BlockValues mine = m_blocks.get(getBlockNumber(i)).peekValues();
            final BlockValues theirs = other.m_blocks.get(other.getBlockNumber(i)).peekValues();
            final int myLocal = getBlockLocation(i);
            final int theirLocal = other.getBlockLocation(i);
            for (int r = 0; r < numRows(); r++) {
                final boolean missing = mine.isMissing(myLocal, r);
                if (missing != theirs.isMissing(theirLocal, r)
                    || (!missing && !Objects.equals(mine.get(myLocal, r), theirs.get(theirLocal, r)))) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("BlockManager[").append(numRows()).append(" rows, ")
            .append(numColumns()).append(" columns, ").append(m_state).append("]");
        m_blocks.forEach(b -> sb.append("\n  ").append(b));
        return sb.toString();
    }
}
