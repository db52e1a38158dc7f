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

import static org.blockframe.core.columnar.testing.TestValueUtils.assertColumn;
import static org.blockframe.core.columnar.testing.TestValueUtils.assertValues;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.blockframe.core.columnar.ShapeMismatchException;
import org.blockframe.core.columnar.TypeCastException;
import org.blockframe.core.columnar.data.BlockValues;
import org.blockframe.core.columnar.data.Columns;
import org.blockframe.core.columnar.data.DataSpec;
import org.blockframe.core.columnar.data.NativeFormatOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests writes, copy-on-write and the splitting of {@link Block blocks}.
 */
final class BlockTest {

    private Block m_block;

    @BeforeEach
    void createBlock() {
        m_block = new Block(Columns.doubleColumns(new double[]{1.0, Double.NaN}, new double[]{3.0, 4.0}),
            BlockPlacement.of(2, 0));
    }

    @AfterEach
    void releaseBlock() {
        m_block.release();
    }

    @Test
    void testPlacementMustMatchColumns() {
        final BlockValues values = Columns.longs(1, 2);
        assertThrows(ShapeMismatchException.class, () -> new Block(values, BlockPlacement.of(0, 1)));
        final Block block = new Block(values, BlockPlacement.of(0));
        assertThrows(ShapeMismatchException.class, () -> block.setPlacement(BlockPlacement.of(0, 1)));
        block.release();
    }

    @Test
    void testWritesCopySharedValues() {
        final BlockValues view = m_block.getValues();
        assertTrue(m_block.isShared());
        m_block.setValuesAt(new int[]{0}, new int[]{1}, 30.0);
        assertFalse(m_block.isShared());
        assertColumn(view, 1, 3.0, 4.0);
        assertColumn(m_block.peekValues(), 1, 30.0, 4.0);
        view.release();
    }

    @Test
    void testShallowCopiesAreIsolatedFromWrites() {
        final Block shallow = m_block.copy(false);
        shallow.setValuesAt(new int[]{1}, new int[]{0}, 2.0);
        assertColumn(m_block.peekValues(), 0, 1.0, null);
        assertColumn(shallow.peekValues(), 0, 1.0, 2.0);
        shallow.release();
        assertFalse(m_block.isShared());
    }

    @Test
    void testScalarWritesDoNotUpcast() {
        assertThrows(TypeCastException.class, () -> m_block.setValuesAt(new int[]{0}, new int[]{0}, "x"));
        assertThrows(IndexOutOfBoundsException.class, () -> m_block.setValuesAt(new int[]{2}, new int[]{0}, 1.0));
    }

    @Test
    void testValueWritesAreAtomic() {
        final BlockValues newValues = Columns.objects(5.0, "x");
        assertThrows(TypeCastException.class,
            () -> m_block.setValuesAt(new int[]{0, 1}, new int[]{1}, newValues));
        assertColumn(m_block.peekValues(), 1, 3.0, 4.0);
        newValues.release();

        final BlockValues ints = Columns.longs(7, 8);
        m_block.setValuesAt(new int[]{1, 0}, new int[]{0}, ints);
        assertColumn(m_block.peekValues(), 0, 8.0, 7.0);
        ints.release();
    }

    @Test
    void testSetColumn() {
        final BlockValues column = Columns.doubles(5.0, 6.0);
        m_block.setColumn(1, column);
        assertColumn(m_block.peekValues(), 1, 5.0, 6.0);
        column.release();
        final BlockValues ints = Columns.longs(1, 2);
        assertThrows(IllegalArgumentException.class, () -> m_block.setColumn(0, ints));
        ints.release();
    }

    @Test
    void testIget() {
        final BlockValues column = m_block.iget(1);
        assertFalse(m_block.isShared());
        assertValues(column, 3.0, 4.0);
        column.release();
    }

    @Test
    void testFillnaWithHeldValue() {
        final List<Block> filled = m_block.fillna(0.5);
        assertEquals(1, filled.size());
        final Block block = filled.get(0);
        assertEquals(m_block.getPlacement(), block.getPlacement());
        assertColumn(block.peekValues(), 0, 1.0, 0.5);
        assertColumn(m_block.peekValues(), 0, 1.0, null);
        block.release();
    }

    @Test
    void testFillnaSplitsAndUpcastsAffectedColumns() {
        final List<Block> filled = m_block.fillna("n/a");
        assertEquals(2, filled.size());
        final Block upcast = filled.get(0);
        assertEquals(DataSpec.objectSpec(), upcast.spec());
        assertEquals(BlockPlacement.of(2), upcast.getPlacement());
        assertValues(upcast.peekValues(), 1.0, "n/a");
        final Block untouched = filled.get(1);
        assertEquals(DataSpec.doubleSpec(), untouched.spec());
        assertEquals(BlockPlacement.of(0), untouched.getPlacement());
        assertValues(untouched.peekValues(), 3.0, 4.0);
        filled.forEach(Block::release);
    }

    @Test
    void testFillnaWithoutMissingValuesSharesValues() {
        final Block ints = new Block(Columns.longs(1, 2), BlockPlacement.of(0));
        final List<Block> filled = ints.fillna(0.5);
        assertEquals(1, filled.size());
        assertEquals(DataSpec.longSpec(), filled.get(0).spec());
        assertTrue(ints.isShared());
        filled.get(0).release();
        ints.release();
    }

    @Test
    void testWhereUpcastsIntegers() {
        final Block ints = new Block(Columns.longColumns(new long[]{1, 2}, new long[]{3, 4}), BlockPlacement.of(0, 1));
        final List<Block> result = ints.where(new boolean[][]{{true, false}, {true, true}}, 0.5);
        assertEquals(2, result.size());
        assertEquals(DataSpec.doubleSpec(), result.get(0).spec());
        assertValues(result.get(0).peekValues(), 1.0, 0.5);
        assertEquals(DataSpec.longSpec(), result.get(1).spec());
        assertValues(result.get(1).peekValues(), 3L, 4L);
        result.forEach(Block::release);

        assertThrows(ShapeMismatchException.class, () -> ints.where(new boolean[][]{{true, true}}, 0L));
        ints.release();
    }

    @Test
    void testSplit() {
        final List<Block> split = m_block.split();
        assertEquals(2, split.size());
        assertEquals(BlockPlacement.of(2), split.get(0).getPlacement());
        assertEquals(BlockPlacement.of(0), split.get(1).getPlacement());
        assertValues(split.get(1).peekValues(), 3.0, 4.0);
        assertTrue(m_block.isShared());
        split.forEach(Block::release);
    }

    @Test
    void testDeleteLocal() {
        m_block.deleteLocal(0);
        assertEquals(1, m_block.numColumns());
        assertEquals(BlockPlacement.of(0), m_block.getPlacement());
        assertValues(m_block.peekValues(), 3.0, 4.0);
    }

    @Test
    void testTakeAndSliceRows() {
        final Block taken = m_block.take(new int[]{1, -1}, true, null);
        assertColumn(taken.peekValues(), 1, 4.0, null);
        taken.release();
        final Block slice = m_block.sliceRows(1, 2);
        assertEquals(1, slice.numRows());
        assertEquals(m_block.getPlacement(), slice.getPlacement());
        slice.release();
    }

    @Test
    void testAstypeAndNativeTypes() {
        final Block texts = m_block.astype(DataSpec.textSpec());
        assertEquals(DataSpec.textSpec(), texts.spec());
        texts.release();
        final String[][] rendered = m_block.toNativeTypes(NativeFormatOptions.defaults());
        assertArrayEquals(new String[]{"3.0", "4.0"}, rendered[1]);
    }
}
