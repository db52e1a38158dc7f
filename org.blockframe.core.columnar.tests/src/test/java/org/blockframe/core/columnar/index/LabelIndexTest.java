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
package org.blockframe.core.columnar.index;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.blockframe.core.columnar.KeyNotFoundException;
import org.junit.jupiter.api.Test;

final class LabelIndexTest {

    @Test
    void testLookup() {
        final Index index = Indexes.of("a", "b", "c");
        assertEquals(1, index.lookup("b"));
        assertArrayEquals(new int[]{2, 0}, index.positions(List.of("c", "a")));
        assertTrue(index.contains("a"));
        assertFalse(index.contains("d"));
        final KeyNotFoundException ex = assertThrows(KeyNotFoundException.class, () -> index.lookup("d"));
        assertEquals("d", ex.getLabel());
    }

    @Test
    void testNumbersAreNormalized() {
        final Index index = Indexes.of(1, 2L, 3.5f);
        assertEquals(0, index.lookup(1L));
        assertEquals(1, index.lookup(2));
        assertEquals(2, index.lookup(3.5));
        assertEquals(List.of(1L, 2L, 3.5), index.labels());
    }

    @Test
    void testDuplicateLabels() {
        final Index index = Indexes.of("a", "b", "a");
        assertFalse(index.isUnique());
        assertArrayEquals(new int[]{0, 2}, index.lookupAll("a"));
        assertEquals(1, index.lookup("b"));
        assertThrows(IllegalArgumentException.class, () -> index.lookup("a"));
        assertThrows(IllegalArgumentException.class, () -> index.getIndexer(Indexes.of("a")));
        assertEquals(0, index.lookupAll("x").length);
    }

    @Test
    void testGetIndexer() {
        final Index index = Indexes.of("a", "b", "c");
        assertArrayEquals(new int[]{2, -1, 0}, index.getIndexer(Indexes.of("c", "x", "a")));
    }

    @Test
    void testMonotonic() {
        assertTrue(Indexes.of(1, 2, 2, 5).isMonotonicIncreasing());
        assertFalse(Indexes.of(2, 1).isMonotonicIncreasing());
        assertFalse(Indexes.of("a", 1).isMonotonicIncreasing());
        assertFalse(Indexes.of("a", null).isMonotonicIncreasing());
        assertTrue(Indexes.of().isMonotonicIncreasing());
    }

    @Test
    void testEditsReturnNewIndexes() {
        final Index index = Indexes.of("a", "b", "c");
        assertEquals(Indexes.of("a", "x", "b", "c"), index.insert(1, "x"));
        assertEquals(Indexes.of("a", "b", "c", "x"), index.insert(3, "x"));
        assertThrows(IndexOutOfBoundsException.class, () -> index.insert(4, "x"));
        assertEquals(Indexes.of("b"), index.delete(0, 2, 0));
        assertEquals(Indexes.of("c", null), index.take(new int[]{2, -1}));
        assertEquals(Indexes.of("a", "b", "c", "d"), index.append(Indexes.of("d")));
        assertEquals(List.of("a", "b", "c"), index.labels());
    }

    @Test
    void testEqualsRangeWithSameLabels() {
        final Index labels = Indexes.of(0, 1, 2);
        assertEquals(Indexes.range(3), labels);
        assertEquals(labels, Indexes.range(3));
        assertEquals(Indexes.range(3).hashCode(), labels.hashCode());
    }
}
