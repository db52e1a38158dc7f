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

final class RangeIndexTest {

    @Test
    void testSize() {
        assertEquals(5, Indexes.range(5).size());
        assertEquals(3, new RangeIndex(0, 5, 2).size());
        assertEquals(3, new RangeIndex(5, 0, -2).size());
        assertEquals(0, new RangeIndex(5, 0, 1).size());
        assertThrows(IllegalArgumentException.class, () -> new RangeIndex(0, 1, 0));
    }

    @Test
    void testLabels() {
        final RangeIndex index = new RangeIndex(10, 4, -3);
        assertEquals(List.of(10L, 7L), index.labels());
        assertEquals(7L, index.get(1));
        assertThrows(IndexOutOfBoundsException.class, () -> index.get(2));
        assertFalse(index.isMonotonicIncreasing());
        assertTrue(Indexes.range(3).isMonotonicIncreasing());
        assertTrue(index.isUnique());
    }

    @Test
    void testLookup() {
        final RangeIndex index = new RangeIndex(2, 10, 2);
        assertEquals(1, index.lookup(4));
        assertEquals(3, index.lookup(8L));
        assertThrows(KeyNotFoundException.class, () -> index.lookup(5));
        assertThrows(KeyNotFoundException.class, () -> index.lookup(10));
        assertThrows(KeyNotFoundException.class, () -> index.lookup("2"));
        assertArrayEquals(new int[]{0}, index.lookupAll(2));
        assertEquals(0, index.lookupAll(0).length);
    }

    @Test
    void testGetIndexer() {
        assertArrayEquals(new int[]{2, -1, 0}, Indexes.range(3).getIndexer(Indexes.of(2, "x", 0)));
        assertArrayEquals(new int[]{0, 1, -1}, Indexes.range(2).getIndexer(Indexes.range(3)));
    }

    @Test
    void testEditsBecomeLabelIndexes() {
        final Index inserted = Indexes.range(2).insert(0, "a");
        assertEquals(List.of("a", 0L, 1L), inserted.labels());
        assertEquals(Indexes.of(0, 2), Indexes.range(3).delete(1));
    }
}
