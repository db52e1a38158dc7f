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

import static org.blockframe.core.columnar.testing.TestValueUtils.assertColumn;
import static org.blockframe.core.columnar.testing.TestValueUtils.assertIntact;
import static org.blockframe.core.columnar.testing.TestValueUtils.assertSpec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import org.blockframe.core.columnar.TimezoneMismatchException;
import org.blockframe.core.columnar.block.Block;
import org.blockframe.core.columnar.data.Columns;
import org.blockframe.core.columnar.data.DataSpec;
import org.blockframe.core.columnar.index.Indexes;
import org.blockframe.core.columnar.index.RangeIndex;
import org.blockframe.core.columnar.manager.Axis;
import org.blockframe.core.columnar.manager.BlockManager;
import org.blockframe.core.columnar.testing.TestManagerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Tests {@link ManagerConcat} along both axes.
 */
final class ManagerConcatTest {

    private final List<BlockManager> m_managers = new ArrayList<>();

    private BlockManager manage(final BlockManager manager) {
        m_managers.add(manager);
        return manager;
    }

    @AfterEach
    void releaseManagers() {
        m_managers.forEach(BlockManager::release);
        m_managers.clear();
    }

    @Test
    void testRowsOfManagersWithOneLayout() {
        final BlockManager first = manage(TestManagerBuilder.withRows(2) //
            .column("a", Columns.longs(1, 2)) //
            .column("b", Columns.doubles(0.5, 1.5)) //
            .build());
        final BlockManager second = manage(TestManagerBuilder.withRows(new RangeIndex(2, 3, 1)) //
            .column("a", Columns.longs(3)) //
            .column("b", Columns.doubles(2.5)) //
            .build());
        final BlockManager result = manage(ManagerConcat.concat(List.of(first, second), Axis.ROWS));
        assertEquals(Indexes.range(3), result.rows());
        assertInstanceOf(RangeIndex.class, result.rows());
        assertEquals(2, result.numBlocks());
        assertColumn(result, 0, 1L, 2L, 3L);
        assertColumn(result, 1, 0.5, 1.5, 2.5);
        assertTrue(result.isConsolidated());
        assertFalse(first.iterBlocks().get(0).isShared());
        assertIntact(result);
    }

    @Test
    void testRowsWithMissingColumnsAreFilled() {
        final BlockManager first = manage(TestManagerBuilder.withRows(2) //
            .column("a", Columns.longs(1, 2)) //
            .column("c", Columns.longs(7, 8)) //
            .build());
        final BlockManager second = manage(TestManagerBuilder.withRows(1) //
            .column("b", Columns.texts("x")) //
            .column("a", Columns.longs(3)) //
            .build());
        final BlockManager result = manage(ManagerConcat.concat(List.of(first, second), Axis.ROWS));
        assertEquals(List.of("a", "c", "b"), result.columns().labels());
        assertEquals(List.of(0L, 1L, 0L), result.rows().labels());
        assertSpec(result, 0, DataSpec.longSpec());
        assertColumn(result, 0, 1L, 2L, 3L);
        assertSpec(result, 1, DataSpec.doubleSpec());
        assertColumn(result, 1, 7.0, 8.0, null);
        assertSpec(result, 2, DataSpec.objectSpec());
        assertColumn(result, 2, null, null, "x");
        assertTrue(result.isConsolidated());
        assertIntact(result);
    }

    @Test
    void testRowsOfFragmentedManagers() {
        final BlockManager fragmented = manage(TestManagerBuilder.withRows(1) //
            .column("a", Columns.longs(1)) //
            .column("b", Columns.longs(2)) //
            .buildFragmented());
        final BlockManager consolidated = manage(TestManagerBuilder.withRows(1) //
            .column("a", Columns.longs(3)) //
            .column("b", Columns.booleans(true)) //
            .build());
        final BlockManager result = manage(ManagerConcat.concat(List.of(fragmented, consolidated), Axis.ROWS));
        assertColumn(result, 0, 1L, 3L);
        assertColumn(result, 1, 2L, 1L);
        assertEquals(1, result.numBlocks());
    }

    @Test
    void testRowConcatIsAssociative() {
        final BlockManager a = manage(TestManagerBuilder.withRows(1) //
            .column("x", Columns.longs(1)) //
            .build());
        final BlockManager b = manage(TestManagerBuilder.withRows(2) //
            .column("x", Columns.doubles(2.5, Double.NaN)) //
            .column("y", Columns.texts("p", "q")) //
            .build());
        final BlockManager c = manage(TestManagerBuilder.withRows(1) //
            .column("y", Columns.texts("r")) //
            .build());
        final BlockManager ab = manage(ManagerConcat.concat(List.of(a, b), Axis.ROWS));
        final BlockManager left = manage(ManagerConcat.concat(List.of(ab, c), Axis.ROWS));
        final BlockManager bc = manage(ManagerConcat.concat(List.of(b, c), Axis.ROWS));
        final BlockManager right = manage(ManagerConcat.concat(List.of(a, bc), Axis.ROWS));
        final BlockManager all = manage(ManagerConcat.concat(List.of(a, b, c), Axis.ROWS));
        assertTrue(left.contentEquals(right));
        assertTrue(left.contentEquals(all));
        assertColumn(all, 0, 1.0, 2.5, null, null);
    }

    @Test
    void testColumnsShareBuffers() {
        final BlockManager first = manage(TestManagerBuilder.withRows(2) //
            .column("a", Columns.longs(1, 2)) //
            .build());
        final BlockManager second = manage(TestManagerBuilder.withRows(2) //
            .column("b", Columns.doubles(0.5, 1.5)) //
            .build());
        final BlockManager result = manage(ManagerConcat.concat(List.of(first, second), Axis.COLUMNS));
        assertEquals(List.of("a", "b"), result.columns().labels());
        assertColumn(result, 1, 0.5, 1.5);
        assertTrue(first.iterBlocks().get(0).isShared());
        assertTrue(second.iterBlocks().get(0).isShared());

        result.setValue(0, 0, 10L);
        assertColumn(first, 0, 1L, 2L);
        assertColumn(result, 0, 10L, 2L);
    }

    @Test
    void testColumnsOfOneSpecAreConsolidated() {
        final BlockManager first = manage(TestManagerBuilder.withRows(1) //
            .column("a", Columns.longs(1)) //
            .column("b", Columns.doubles(0.5)) //
            .build());
        final BlockManager second = manage(TestManagerBuilder.withRows(1) //
            .column("c", Columns.longs(3)) //
            .build());
        final BlockManager result = manage(ManagerConcat.concat(List.of(first, second), Axis.COLUMNS));
        assertEquals(2, result.numBlocks());
        final Block ints = result.iterBlocks().get(0);
        assertEquals(DataSpec.longSpec(), ints.spec());
        assertEquals(List.of(0, 2), ints.getPlacement().positions());
        assertColumn(result, 2, 3L);
        assertIntact(result);
    }

    @Test
    void testColumnsWithMisalignedRows() {
        final BlockManager first = manage(TestManagerBuilder.withRows(Indexes.of("r1", "r2")) //
            .column("a", Columns.longs(1, 2)) //
            .build());
        final BlockManager second = manage(TestManagerBuilder.withRows(Indexes.of("r2", "r3")) //
            .column("b", Columns.booleans(true, false)) //
            .build());
        final BlockManager result = manage(ManagerConcat.concat(List.of(first, second), Axis.COLUMNS));
        assertEquals(List.of("r1", "r2", "r3"), result.rows().labels());
        assertSpec(result, 0, DataSpec.doubleSpec());
        assertColumn(result, 0, 1.0, 2.0, null);
        assertSpec(result, 1, DataSpec.objectSpec());
        assertColumn(result, 1, null, true, false);
    }

    @Test
    void testDuplicateLabelsCannotBeAligned() {
        final BlockManager duplicated = manage(TestManagerBuilder.withRows(1) //
            .column("a", Columns.longs(1)) //
            .column("a", Columns.longs(2)) //
            .build());
        final BlockManager other = manage(TestManagerBuilder.withRows(1) //
            .column("b", Columns.longs(3)) //
            .build());
        assertThrows(IllegalArgumentException.class,
            () -> ManagerConcat.concat(List.of(duplicated, other), Axis.ROWS));
        final BlockManager same = manage(ManagerConcat.concat(List.of(duplicated, duplicated), Axis.ROWS));
        assertEquals(2, same.numRows());
    }

    @Test
    void testTimezoneMismatchIsReported() {
        final ZonedDateTime instant = ZonedDateTime.of(2020, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        final BlockManager utc = manage(TestManagerBuilder.withRows(1) //
            .column("t", Columns.datetimes(ZoneOffset.UTC, instant)) //
            .build());
        final BlockManager berlin = manage(TestManagerBuilder.withRows(1) //
            .column("t", Columns.datetimes(ZoneId.of("Europe/Berlin"), instant)) //
            .build());
        final List<BlockManager> inputs = List.of(utc, berlin);
        assertThrows(TimezoneMismatchException.class, () -> ManagerConcat.concat(inputs, Axis.ROWS));
        assertIntact(utc);
    }

    @Test
    void testNoManagers() {
        assertThrows(IllegalArgumentException.class, () -> ManagerConcat.concat(List.of(), Axis.ROWS));
    }
}
