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
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests the default methods of {@link Index} against a minimal implementation.
 */
final class IndexDefaultsTest {

    private static final List<Object> LABELS = List.of("x", "y", "z");

    private Index m_index;

    @BeforeEach
    void mockIndex() {
        m_index = mock(Index.class, CALLS_REAL_METHODS);
        when(m_index.size()).thenReturn(LABELS.size());
        when(m_index.get(anyInt())).thenAnswer(inv -> LABELS.get(inv.<Integer> getArgument(0)));
        when(m_index.labels()).thenReturn(LABELS);
    }

    @Test
    void testPositionsLookUpEveryLabel() {
        when(m_index.lookup(any())).thenReturn(2, 0);
        assertArrayEquals(new int[]{2, 0}, m_index.positions(List.of("z", "x")));
        verify(m_index, times(2)).lookup(any());
    }

    @Test
    void testContainsUsesLookupAll() {
        when(m_index.lookupAll("y")).thenReturn(new int[]{1});
        when(m_index.lookupAll("w")).thenReturn(new int[0]);
        assertTrue(m_index.contains("y"));
        assertFalse(m_index.contains("w"));
    }

    @Test
    void testEditsReadLabelsByPosition() {
        assertEquals(List.of("z", "x"), m_index.take(new int[]{2, 0}).labels());
        assertEquals(List.of("x", "w", "y", "z"), m_index.insert(1, "w").labels());
        assertEquals(List.of("y"), m_index.delete(0, 2).labels());
    }

    @Test
    void testEqualLabels() {
        assertTrue(m_index.equalLabels(Indexes.of("x", "y", "z")));
        assertFalse(m_index.equalLabels(Indexes.of("x", "y")));
    }
}
