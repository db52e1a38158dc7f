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

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;

import org.blockframe.core.columnar.KeyNotFoundException;
import org.blockframe.core.columnar.data.DataSpecs;

import com.google.common.base.Preconditions;

/**
 * An index of the {@code long} labels {@code start, start + step, ...} up to (excluding) {@code stop}. Lookups are
 * computed arithmetically.
 */
public final class RangeIndex implements Index {

    private final long m_start;

    private final long m_stop;

    private final long m_step;

    private final int m_size;

    /**
     * @param start the first label
     * @param stop the bound (exclusive)
     * @param step the non-zero step
     */
    public RangeIndex(final long start, final long stop, final long step) {
        Preconditions.checkArgument(step != 0, "Step must not be zero.");
        m_start = start;
        m_stop = stop;
        m_step = step;
        final long span = step > 0 ? (stop - start) : (start - stop);
        final long absStep = Math.abs(step);
        m_size = span <= 0 ? 0 : Math.toIntExact((span + absStep - 1) / absStep);
    }

    public long getStart() {
        return m_start;
    }

    public long getStop() {
        return m_stop;
    }

    public long getStep() {
        return m_step;
    }

    @Override
    public int size() {
        return m_size;
    }

    @Override
    public Long get(final int position) {
        Objects.checkIndex(position, m_size);
        return m_start + position * m_step;
    }

    @Override
    public int lookup(final Object label) {
        final int position = positionOf(label);
        if (position == -1) {
            throw new KeyNotFoundException(label);
        }
        return position;
    }

    private int positionOf(final Object label) {
        final Object key = DataSpecs.normalize(label);
        if (!(key instanceof Long)) {
            return -1;
        }
        final long offset = (Long)key - m_start;
        if (offset % m_step != 0) {
            return -1;
        }
        final long position = offset / m_step;
        return position >= 0 && position < m_size ? (int)position : -1;
    }

    @Override
    public int[] lookupAll(final Object label) {
        final int position = positionOf(label);
        return position == -1 ? new int[0] : new int[]{position};
    }

    @Override
    public int[] getIndexer(final Index target) {
        final int[] indexer = new int[target.size()];
        for (int i = 0; i < indexer.length; i++) {
            indexer[i] = positionOf(target.get(i));
        }
        return indexer;
    }

    @Override
    public boolean isUnique() {
        return true;
    }

    @Override
    public boolean isMonotonicIncreasing() {
        return m_step > 0 || m_size <= 1;
    }

    @Override
    public List<Object> labels() {
        return new AbstractList<Object>() {

            @Override
            public Object get(final int index) {
                return RangeIndex.this.get(index);
            }

            @Override
            public int size() {
                return m_size;
            }
        };
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof Index other && equalLabels(other);
    }

    @Override
    public int hashCode() {
        return labels().hashCode();
    }

    @Override
    public String toString() {
        return String.format("RangeIndex(start=%d, stop=%d, step=%d)", m_start, m_stop, m_step);
    }
}
