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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.util.List;

import org.junit.jupiter.api.Test;

final class IndexesTest {

    @Test
    void testConsecutiveRangesStayRanges() {
        final Index index = Indexes.concat(List.of(Indexes.range(3), new RangeIndex(3, 5, 1)));
        assertInstanceOf(RangeIndex.class, index);
        assertEquals(Indexes.range(5), index);
    }

    @Test
    void testSingleLabelRangesDefineTheStep() {
        final Index index =
            Indexes.concat(List.of(new RangeIndex(0, 1, 1), new RangeIndex(2, 3, 1), new RangeIndex(4, 8, 2)));
        assertInstanceOf(RangeIndex.class, index);
        final RangeIndex range = (RangeIndex)index;
        assertEquals(0, range.getStart());
        assertEquals(2, range.getStep());
        assertEquals(List.of(0L, 2L, 4L, 6L), index.labels());
    }

    @Test
    void testEmptyRangesAreSkipped() {
        final Index index = Indexes.concat(List.of(Indexes.range(0), Indexes.range(2), new RangeIndex(2, 2, 1)));
        assertInstanceOf(RangeIndex.class, index);
        assertEquals(2, index.size());
        assertEquals(0, Indexes.concat(List.of(Indexes.range(0))).size());
    }

    @Test
    void testRepeatedRangesBecomeLabels() {
        final Index index = Indexes.concat(List.of(Indexes.range(2), Indexes.range(2)));
        assertInstanceOf(LabelIndex.class, index);
        assertEquals(List.of(0L, 1L, 0L, 1L), index.labels());
        assertFalse(index.isUnique());
    }

    @Test
    void testConcatOfLabelsAndRanges() {
        final Index index = Indexes.concat(List.of(Indexes.of("a"), Indexes.range(2)));
        assertEquals(List.of("a", 0L, 1L), index.labels());
        assertEquals(0, Indexes.concat(List.of()).size());
    }

    @Test
    void testUnionKeepsFirstSeenOrder() {
        final Index union = Indexes.union(List.of(Indexes.of("b", "c"), Indexes.of("a", "b"), Indexes.of(1)));
        assertEquals(List.of("b", "c", "a", 1L), union.labels());
        assertEquals(List.of(0L, 1L, 2L), Indexes.union(List.of(Indexes.range(2), Indexes.of(1, 2))).labels());
    }
}
