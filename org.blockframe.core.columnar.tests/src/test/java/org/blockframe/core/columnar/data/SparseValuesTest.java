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

import static org.blockframe.core.columnar.testing.TestValueUtils.assertValues;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests {@link SparseValues}.
 */
final class SparseValuesTest {

    @Test
    void testFromDenseStoresOnlyNonFillValues() {
        final BlockValues dense = Columns.doubles(0.0, 1.5, 0.0, Double.NaN);
        final SparseValues sparse = SparseValues.fromDense(dense, 0.0);
        assertEquals(DataSpec.sparseSpec(DataSpec.doubleSpec(), 0.0), sparse.spec());
        assertArrayEquals(new int[]{1, 3}, sparse.indices());
        assertEquals(2, sparse.numStored());
        assertValues(sparse, 0.0, 1.5, 0.0, null);
        final BlockValues decoded = sparse.toDense();
        assertTrue(decoded.valuesEqual(dense));
        decoded.release();
        sparse.release();
        dense.release();
    }

    @Test
    void testDefaultFillValues() {
        assertTrue(DataSpecs.isNa(DataSpec.sparseSpec(DataSpec.doubleSpec(), null).fillValue()));
        assertEquals(0L, DataSpec.sparseSpec(DataSpec.longSpec(), null).fillValue());
        assertEquals(false, DataSpec.sparseSpec(DataSpec.booleanSpec(), null).fillValue());
        assertThrows(IllegalArgumentException.class, () -> DataSpec.sparseSpec(DataSpec.dateTimeSpec(), null));
        assertEquals(DataSpec.sparseSpec(DataSpec.doubleSpec(), 0.0), DataSpec.sparseSpec(DataSpec.doubleSpec(), 0));
        assertThrows(IllegalArgumentException.class, () -> DataSpec.sparseSpec(DataSpec.longSpec(), 1.5));
    }

    @Test
    void testWritesInsertAndRemoveStoredValues() {
        final BlockValues dense = Columns.longs(0, 0, 7, 0);
        final SparseValues sparse = SparseValues.fromDense(dense, 0L);
        sparse.set(0, 0, 3L);
        sparse.set(0, 2, 0L);
        sparse.set(0, 3, 9L);
        assertArrayEquals(new int[]{0, 3}, sparse.indices());
        assertValues(sparse, 3L, 0L, 0L, 9L);
        sparse.release();
        dense.release();
    }

    @Test
    void testOfValidatesItsParts() {
        final SparseDataSpec spec = DataSpec.sparseSpec(DataSpec.longSpec(), 0L);
        final BlockValues stored = Columns.longs(4, 5);
        final SparseValues sparse = SparseValues.of(spec, 5, new int[]{1, 4}, stored);
        assertValues(sparse, 0L, 4L, 0L, 0L, 5L);
        assertThrows(IllegalArgumentException.class, () -> SparseValues.of(spec, 5, new int[]{4, 1}, stored));
        assertThrows(IllegalArgumentException.class, () -> SparseValues.of(spec, 4, new int[]{1, 4}, stored));
        assertThrows(IllegalArgumentException.class, () -> SparseValues.of(spec, 5, new int[]{1}, stored));
        sparse.release();
        stored.release();
    }

    @Test
    void testSlicesAndTakes() {
        final BlockValues dense = Columns.longs(0, 1, 0, 2, 0);
        final SparseValues sparse = SparseValues.fromDense(dense, 0L);
        final BlockValues slice = sparse.sliceRows(1, 4);
        assertValues(slice, 1L, 0L, 2L);
        assertArrayEquals(new int[]{0, 2}, ((SparseValues)slice).indices());
        final BlockValues taken = sparse.take(new int[]{3, 0, 1}, false, null);
        assertValues(taken, 2L, 0L, 1L);
        final BlockValues filled = sparse.take(new int[]{1, -1}, true, null);
        assertEquals(DataSpec.sparseSpec(DataSpec.doubleSpec(), 0.0), filled.spec());
        assertValues(filled, 1.0, null);
        filled.release();
        taken.release();
        slice.release();
        sparse.release();
        dense.release();
    }

    @Test
    void testConcatRowsMergesIndices() {
        final BlockValues firstDense = Columns.longs(1, 0);
        final BlockValues secondDense = Columns.longs(0, 2);
        final SparseValues first = SparseValues.fromDense(firstDense, 0L);
        final SparseValues second = SparseValues.fromDense(secondDense, 0L);
        firstDense.release();
        secondDense.release();
        final BlockValues concatenated = BlockValues.concatRows(List.of(first, second));
        assertArrayEquals(new int[]{0, 3}, ((SparseValues)concatenated).indices());
        assertValues(concatenated, 1L, 0L, 0L, 2L);
        concatenated.release();
        first.release();
        second.release();
    }
}
