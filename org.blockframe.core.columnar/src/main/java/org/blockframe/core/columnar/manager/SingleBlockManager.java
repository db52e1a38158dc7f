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

import java.util.Objects;

import org.blockframe.core.columnar.ShapeMismatchException;
import org.blockframe.core.columnar.block.Block;
import org.blockframe.core.columnar.block.BlockPlacement;
import org.blockframe.core.columnar.data.BlockValues;
import org.blockframe.core.columnar.data.DataSpec;
import org.blockframe.core.columnar.data.DataSpecs;
import org.blockframe.core.columnar.data.Indexers;
import org.blockframe.core.columnar.index.Index;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single labelled column, stored in one block. Unlike {@link BlockManager} it needs no placement bookkeeping.
 */
public final class SingleBlockManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SingleBlockManager.class);

    private Block m_block;

    private final Index m_index;

    private final Object m_name;

    /**
     * Creates a column that takes over the reference of the caller to the values.
     *
     * @param values one column of values
     * @param index the row labels
     * @param name the name of the column, may be null
     */
    public SingleBlockManager(final BlockValues values, final Index index, final Object name) {
        ShapeMismatchException.checkLength("columns of the values", 1, values.numColumns());
        ShapeMismatchException.checkLength("values", index.size(), values.length());
        m_block = new Block(values, BlockPlacement.of(0));
        m_index = index;
        m_name = name;
    }

    public int length() {
        return m_index.size();
    }

    public Index index() {
        return m_index;
    }

    public Object name() {
        return m_name;
    }

    public DataSpec spec() {
        return m_block.spec();
    }

    /**
     * @return true if the buffer is shared with a manager or another column
     */
    public boolean isShared() {
        return m_block.isShared();
    }

    /**
     * @param position a row position
     * @return the boxed value
     */
    public Object get(final int position) {
        return m_block.peekValues().get(0, position);
    }

    /**
     * @param label a row label
     * @return the boxed value
     * @throws org.blockframe.core.columnar.KeyNotFoundException if the label does not exist
     */
    public Object getLabel(final Object label) {
        return get(m_index.lookup(label));
    }

    /**
     * Writes a value, upcasting the column if it cannot hold the value. A shared buffer is copied first.
     *
     * @param position a row position
     * @param value the value
     * @throws IndexOutOfBoundsException if the position is out of range; the column is left untouched
     */
    public void set(final int position, final Object value) {
        Objects.checkIndex(position, length());
        if (!m_block.canHold(value)) {
            final DataSpec promoted = DataSpecs.promoteForFill(spec(), value);
            LOGGER.debug("Upcasting column '{}' from {} to {} to hold '{}'.", m_name, spec(), promoted, value);
            final Block upcast = m_block.astype(promoted);
            m_block.release();
            m_block = upcast;
        }
        m_block.setValuesAt(new int[]{position}, new int[]{0}, value);
    }

    /**
     * @return a read-only view on the values, which has to be released by the caller
     */
    public BlockValues values() {
        return m_block.getValues();
    }

    /**
     * @param indexer row positions
     * @param allowFill whether {@code -1} denotes a row of the fill value
     * @param fillValue the fill value, {@code null} for the missing value
     * @return the selected rows
     */
    public SingleBlockManager take(final int[] indexer, final boolean allowFill, final Object fillValue) {
        final int[] positions = Indexers.validate(indexer, length(), allowFill);
        return new SingleBlockManager(m_block.peekValues().take(positions, allowFill, fillValue),
            m_index.take(positions), m_name);
    }

    /**
     * @param newIndex the target row labels
     * @param fillValue the value of rows that do not exist, {@code null} for missing values
     * @return the reindexed column
     * @throws IllegalArgumentException if the row labels are not unique
     */
    public SingleBlockManager reindex(final Index newIndex, final Object fillValue) {
        if (m_index.equalLabels(newIndex)) {
            return new SingleBlockManager(m_block.getValues(), newIndex, m_name);
        }
        if (!m_index.isUnique()) {
            throw new IllegalArgumentException("Cannot reindex rows with duplicate labels.");
        }
        final int[] indexer = m_index.getIndexer(newIndex);
        return new SingleBlockManager(m_block.peekValues().take(indexer, true, fillValue), newIndex, m_name);
    }

    /**
     * @param deep whether to copy the buffer or to share it
     * @return the copy
     */
    public SingleBlockManager copy(final boolean deep) {
        final BlockValues values = deep ? m_block.peekValues().copy() : m_block.getValues();
        return new SingleBlockManager(values, m_index, m_name);
    }

    /**
     * Releases the reference of this column to its buffer.
     */
    public void release() {
        m_block.release();
    }

    @Override
    public String toString() {
        return "SingleBlockManager['" + m_name + "', " + spec() + ", " + length() + " rows]";
    }
}
