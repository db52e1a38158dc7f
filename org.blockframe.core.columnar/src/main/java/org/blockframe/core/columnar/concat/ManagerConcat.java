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
package org.blockframe.core.columnar.concat;

import java.util.ArrayList;
import java.util.List;

import org.blockframe.core.columnar.block.Block;
import org.blockframe.core.columnar.data.BlockValues;
import org.blockframe.core.columnar.index.Index;
import org.blockframe.core.columnar.index.Indexes;
import org.blockframe.core.columnar.manager.Axis;
import org.blockframe.core.columnar.manager.BlockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Concatenates {@link BlockManager block managers} along one of their axes. The inputs are left untouched and the
 * result is consolidated.
 */
public final class ManagerConcat {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManagerConcat.class);

    private ManagerConcat() {
    }

    /**
     * Concatenates managers.
     *
     * <ul>
     * <li>{@link Axis#ROWS} appends the rows of the managers. Their columns are aligned by label, the column labels of
     * the result are all labels in order of first appearance, and columns that a manager does not have are missing
     * values.</li>
     * <li>{@link Axis#COLUMNS} appends the columns of the managers. Their rows are aligned by label in the same way.
     * The buffers of the inputs are shared with the result unless they have to be reindexed.</li>
     * </ul>
     *
     * @param managers at least one manager
     * @param axis the axis to concatenate along
     * @return the concatenated manager
     * @throws IllegalArgumentException if no manager is given or labels that have to be aligned are not unique
     * @throws org.blockframe.core.columnar.TimezoneMismatchException if datetimes of different timezones end up in one
     *             column
     */
    public static BlockManager concat(final List<BlockManager> managers, final Axis axis) {
        Preconditions.checkArgument(!managers.isEmpty(), "No managers to concatenate.");
        final BlockManager result = axis == Axis.ROWS ? concatRows(managers) : concatColumns(managers);
        result.consolidateInPlace();
        return result;
    }

    private static BlockManager concatRows(final List<BlockManager> managers) {
        final Index columns = alignedLabels(managers, Axis.COLUMNS);
        final List<BlockManager> aligned = new ArrayList<>(managers.size());
        try {
            for (final BlockManager manager : managers) {
                aligned.add(manager.columns().equalLabels(columns) ? manager.copy(false)
                    : manager.reindexColumns(columns, null));
            }
            final List<Index> rows = new ArrayList<>(managers.size());
            aligned.forEach(m -> rows.add(m.rows()));
            final Index newRows = Indexes.concat(rows);
            if (sameLayout(aligned)) {
                LOGGER.debug("Concatenating {} managers block by block.", aligned.size());
                return concatBlockwise(aligned, columns, newRows);
            }
            return concatColumnwise(aligned, columns, newRows);
        } finally {
            aligned.forEach(BlockManager::release);
        }
    }

    private static boolean sameLayout(final List<BlockManager> managers) {
        final List<Block> first = managers.get(0).iterBlocks();
        for (final BlockManager manager : managers) {
            final List<Block> blocks = manager.iterBlocks();
            if (blocks.size() != first.size()) {
                return false;
            }
            for (int i = 0; i < blocks.size(); i++) {
                if (!blocks.get(i).spec().equals(first.get(i).spec())
                    || !blocks.get(i).getPlacement().equals(first.get(i).getPlacement())) {
                    return false;
                }
            }
        }
        return true;
    }

    private static BlockManager concatBlockwise(final List<BlockManager> managers, final Index columns,
        final Index rows) {
        final List<Block> first = managers.get(0).iterBlocks();
        final List<Block> blocks = new ArrayList<>(first.size());
        for (int i = 0; i < first.size(); i++) {
            final List<BlockValues> parts = new ArrayList<>(managers.size());
            for (final BlockManager manager : managers) {
                parts.add(manager.iterBlocks().get(i).peekValues());
            }
            blocks.add(new Block(BlockValues.concatRows(parts), first.get(i).getPlacement()));
        }
        return new BlockManager(blocks, columns, rows);
    }

    private static BlockManager concatColumnwise(final List<BlockManager> managers, final Index columns,
        final Index rows) {
        final List<BlockValues> concatenated = new ArrayList<>(columns.size());
        try {
            for (int c = 0; c < columns.size(); c++) {
                final List<BlockValues> parts = new ArrayList<>(managers.size());
                try {
                    for (final BlockManager manager : managers) {
                        parts.add(manager.iget(c));
                    }
                    concatenated.add(ArrayConcat.concat(parts));
                } finally {
                    parts.forEach(BlockValues::release);
                }
            }
            return BlockManager.fromColumns(columns, rows, concatenated);
        } finally {
            concatenated.forEach(BlockValues::release);
        }
    }

    private static BlockManager concatColumns(final List<BlockManager> managers) {
        final Index rows = alignedLabels(managers, Axis.ROWS);
        final List<Block> blocks = new ArrayList<>();
        final List<Index> columns = new ArrayList<>(managers.size());
        int offset = 0;
        for (final BlockManager manager : managers) {
            final BlockManager aligned =
                manager.rows().equalLabels(rows) ? manager.copy(false) : manager.reindex(rows, null);
            for (final Block block : aligned.iterBlocks()) {
                final Block shifted = block.copy(false);
                shifted.setPlacement(block.getPlacement().add(offset));
                blocks.add(shifted);
            }
            columns.add(aligned.columns());
            offset += aligned.numColumns();
            aligned.release();
        }
        return new BlockManager(blocks, Indexes.concat(columns), rows);
    }

    /**
     * @return the labels of the given axis if all managers share them, otherwise their union
     */
    private static Index alignedLabels(final List<BlockManager> managers, final Axis axis) {
        final Index first = labels(managers.get(0), axis);
        if (managers.stream().allMatch(m -> labels(m, axis).equalLabels(first))) {
            return first;
        }
        final List<Index> indexes = new ArrayList<>(managers.size());
        for (final BlockManager manager : managers) {
            final Index labels = labels(manager, axis);
            Preconditions.checkArgument(labels.isUnique(), "Cannot align %s with duplicate labels.", axis);
            indexes.add(labels);
        }
        return Indexes.union(indexes);
    }

    private static Index labels(final BlockManager manager, final Axis axis) {
        return axis == Axis.ROWS ? manager.rows() : manager.columns();
    }
}
