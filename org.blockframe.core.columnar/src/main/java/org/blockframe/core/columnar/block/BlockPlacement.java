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

import java.util.Arrays;
import java.util.Optional;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * The column positions within a manager that the columns of a block occupy: local column {@code i} of the block is
 * column {@code get(i)} of the manager. Positions are non-negative and unique, but not necessarily sorted.
 *
 * <p>
 * Placements are immutable; all operations return new placements.
 */
public final class BlockPlacement {

    /**
     * A contiguous ascending range of positions.
     *
     * @param start the first position (inclusive)
     * @param stop the last position (exclusive)
     */
    public record Slice(int start, int stop) {
    }

    private static final BlockPlacement EMPTY = new BlockPlacement(new int[0]);

    private final int[] m_positions;

    private BlockPlacement(final int[] positions) {
        m_positions = positions;
    }

    /**
     * @param positions unique, non-negative positions; the array is copied
     * @return the placement
     * @throws IllegalArgumentException if a position is negative or duplicated
     */
    public static BlockPlacement of(final int... positions) {
        return of(positions, Integer.MAX_VALUE);
    }

    /**
     * @param positions unique positions in {@code [0, bound)}; the array is copied
     * @param bound the number of columns of the manager
     * @return the placement
     * @throws IllegalArgumentException if a position is out of range or duplicated
     */
    public static BlockPlacement of(final int[] positions, final int bound) {
        final var seen = new IntOpenHashSet(positions.length);
        for (final int pos : positions) {
            Preconditions.checkArgument(pos >= 0 && pos < bound, "Position %s is out of range [0, %s).", pos, bound);
            Preconditions.checkArgument(seen.add(pos), "Position %s occurs more than once.", pos);
        }
        return positions.length == 0 ? EMPTY : new BlockPlacement(positions.clone());
    }

    /**
     * @param start the first position (inclusive)
     * @param stop the last position (exclusive)
     * @return the placement {@code start, ..., stop - 1}
     */
    public static BlockPlacement range(final int start, final int stop) {
        Preconditions.checkArgument(start >= 0 && start <= stop, "Invalid range [%s, %s).", start, stop);
        final int[] positions = new int[stop - start];
        Arrays.setAll(positions, i -> start + i);
        return new BlockPlacement(positions);
    }

    /**
     * @return the number of positions
     */
    public int length() {
        return m_positions.length;
    }

    /**
     * @return true if the placement holds no position
     */
    public boolean isEmpty() {
        return m_positions.length == 0;
    }

    /**
     * @param i the local column
     * @return the position of the local column
     */
    public int get(final int i) {
        return m_positions[i];
    }

    /**
     * @return an unmodifiable list of the positions
     */
    public IntList positions() {
        return IntLists.unmodifiable(IntArrayList.wrap(m_positions));
    }

    /**
     * @return the positions as a new array, e.g. as an indexer for a take
     */
    public int[] asIndexer() {
        return m_positions.clone();
    }

    /**
     * @param position a position
     * @return the local column of the position or {@code -1}
     */
    public int indexOf(final int position) {
        for (int i = 0; i < m_positions.length; i++) {
            if (m_positions[i] == position) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @param offset the offset, may be negative as long as no position becomes negative
     * @return the placement with every position shifted by the offset
     */
    public BlockPlacement add(final int offset) {
        final int[] positions = new int[m_positions.length];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = m_positions[i] + offset;
            Preconditions.checkArgument(positions[i] >= 0, "Offset %s results in negative position.", offset);
        }
        return new BlockPlacement(positions);
    }

    /**
     * Shifts every position greater than or equal to {@code loc}.
     *
     * @param loc the lowest position to shift
     * @param by the shift
     * @return the new placement
     */
    public BlockPlacement increaseAbove(final int loc, final int by) {
        final int[] positions = m_positions.clone();
        for (int i = 0; i < positions.length; i++) {
            if (positions[i] >= loc) {
                positions[i] += by;
            }
        }
        return new BlockPlacement(positions);
    }

    /**
     * Renumbers the positions after other positions of the manager have been removed: every position is decreased by
     * the number of removed positions below it.
     *
     * @param removed the removed positions, sorted ascending and disjoint from this placement
     * @return the new placement
     */
    public BlockPlacement compact(final int[] removed) {
        final int[] positions = new int[m_positions.length];
        for (int i = 0; i < positions.length; i++) {
            final int pos = m_positions[i];
            final int below = Arrays.binarySearch(removed, pos);
            Preconditions.checkArgument(below < 0, "Position %s has been removed.", pos);
            positions[i] = pos - (-below - 1);
        }
        return new BlockPlacement(positions);
    }

    /**
     * @param localColumns the local columns to remove
     * @return the placement without the given local columns
     */
    public BlockPlacement delete(final int... localColumns) {
        final boolean[] remove = new boolean[m_positions.length];
        for (final int local : localColumns) {
            remove[local] = true;
        }
        final var kept = new IntArrayList(m_positions.length);
        for (int i = 0; i < m_positions.length; i++) {
            if (!remove[i]) {
                kept.add(m_positions[i]);
            }
        }
        return new BlockPlacement(kept.toIntArray());
    }

    /**
     * @param localColumns local columns of this placement
     * @return the positions of the local columns
     */
    public BlockPlacement select(final int... localColumns) {
        final int[] positions = new int[localColumns.length];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = m_positions[localColumns[i]];
        }
        return of(positions);
    }

    /**
     * @param other another placement, disjoint from this one
     * @return the positions of this placement followed by the positions of the other placement
     */
    public BlockPlacement append(final BlockPlacement other) {
        final int[] positions = Arrays.copyOf(m_positions, m_positions.length + other.m_positions.length);
        System.arraycopy(other.m_positions, 0, positions, m_positions.length, other.m_positions.length);
        return of(positions);
    }

    /**
     * @return true if the positions form a contiguous ascending range
     */
    public boolean isContiguousAscending() {
        for (int i = 1; i < m_positions.length; i++) {
            if (m_positions[i] != m_positions[i - 1] + 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the positions as a slice if they form a contiguous ascending range
     */
    public Optional<Slice> asSlice() {
        if (!isContiguousAscending()) {
            return Optional.empty();
        }
        return m_positions.length == 0 ? Optional.of(new Slice(0, 0))
            : Optional.of(new Slice(m_positions[0], m_positions[m_positions.length - 1] + 1));
    }

    @Override
    public boolean equals(final Object obj) {
        return obj == this || (obj instanceof BlockPlacement other && Arrays.equals(m_positions, other.m_positions));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(m_positions);
    }

    @Override
    public String toString() {
        return asSlice().map(s -> "BlockPlacement[" + s.start() + ":" + s.stop() + "]")
            .orElseGet(() -> "BlockPlacement" + Arrays.toString(m_positions));
    }
}
