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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.blockframe.core.columnar.block.BlockPlacement.Slice;
import org.junit.jupiter.api.Test;

final class BlockPlacementTest {

    @Test
    void testPositionsMustBeUniqueAndInRange() {
        assertThrows(IllegalArgumentException.class, () -> BlockPlacement.of(1, 1));
        assertThrows(IllegalArgumentException.class, () -> BlockPlacement.of(-1));
        assertThrows(IllegalArgumentException.class, () -> BlockPlacement.of(new int[]{0, 3}, 3));
        assertEquals(2, BlockPlacement.of(new int[]{0, 2}, 3).length());
        assertTrue(BlockPlacement.of().isEmpty());
    }

    @Test
    void testPositionsAreCopied() {
        final int[] positions = {3, 1};
        final BlockPlacement placement = BlockPlacement.of(positions);
        positions[0] = 7;
        assertEquals(3, placement.get(0));
        placement.asIndexer()[0] = 9;
        assertEquals(3, placement.get(0));
        assertThrows(UnsupportedOperationException.class, () -> placement.positions().set(0, 5));
    }

    @Test
    void testSlices() {
        assertEquals(Optional.of(new Slice(2, 5)), BlockPlacement.range(2, 5).asSlice());
        assertEquals(Optional.of(new Slice(4, 5)), BlockPlacement.of(4).asSlice());
        assertEquals(Optional.empty(), BlockPlacement.of(0, 2).asSlice());
        assertEquals(Optional.empty(), BlockPlacement.of(1, 0).asSlice());
        assertFalse(BlockPlacement.of(3, 2, 1).isContiguousAscending());
        assertEquals(BlockPlacement.of(2, 3, 4), BlockPlacement.range(2, 5));
        assertEquals("BlockPlacement[2:5]", BlockPlacement.range(2, 5).toString());
        assertEquals("BlockPlacement[0, 2]", BlockPlacement.of(0, 2).toString());
    }

    @Test
    void testAdd() {
        assertEquals(BlockPlacement.of(5, 3), BlockPlacement.of(2, 0).add(3));
        assertEquals(BlockPlacement.of(0, 1), BlockPlacement.of(2, 3).add(-2));
        assertThrows(IllegalArgumentException.class, () -> BlockPlacement.of(1).add(-2));
    }

    @Test
    void testIncreaseAbove() {
        assertEquals(BlockPlacement.of(0, 3, 4), BlockPlacement.of(0, 2, 3).increaseAbove(2, 1));
        assertEquals(BlockPlacement.of(0, 1), BlockPlacement.of(0, 1).increaseAbove(2, 1));
    }

    @Test
    void testCompact() {
        // positions 1 and 3 of the manager are gone
        assertEquals(BlockPlacement.of(0, 1, 2), BlockPlacement.of(0, 2, 4).compact(new int[]{1, 3}));
        assertThrows(IllegalArgumentException.class, () -> BlockPlacement.of(1).compact(new int[]{1}));
    }

    @Test
    void testDeleteSelectAppend() {
        final BlockPlacement placement = BlockPlacement.of(4, 0, 2);
        assertEquals(BlockPlacement.of(4, 2), placement.delete(1));
        assertEquals(BlockPlacement.of(2, 4), placement.select(2, 0));
        assertEquals(BlockPlacement.of(4, 0, 2, 1), placement.append(BlockPlacement.of(1)));
        assertThrows(IllegalArgumentException.class, () -> placement.append(BlockPlacement.of(0)));
        assertEquals(1, placement.indexOf(0));
        assertEquals(-1, placement.indexOf(1));
        assertArrayEquals(new int[]{4, 0, 2}, placement.asIndexer());
    }
}
