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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.blockframe.core.columnar.KeyNotFoundException;
import org.blockframe.core.columnar.data.DataSpecs;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * An index of arbitrary labels, backed by a hash map from label to first position.
 */
public final class LabelIndex implements Index {

    private final List<Object> m_labels;

    private final Object2IntOpenHashMap<Object> m_firstPositions;

    private final boolean m_unique;

    LabelIndex(final Object[] labels) {
        final Object[] normalized = new Object[labels.length];
        m_firstPositions = new Object2IntOpenHashMap<>(labels.length);
        m_firstPositions.defaultReturnValue(-1);
        boolean unique = true;
        for (int i = 0; i < labels.length; i++) {
            normalized[i] = DataSpecs.normalize(labels[i]);
            if (m_firstPositions.putIfAbsent(normalized[i], i) != -1) {
                unique = false;
            }
        }
        m_labels = Collections.unmodifiableList(Arrays.asList(normalized));
        m_unique = unique;
    }

    @Override
    public int size() {
        return m_labels.size();
    }

    @Override
    public Object get(final int position) {
        return m_labels.get(position);
    }

    @Override
    public int lookup(final Object label) {
        final Object key = DataSpecs.normalize(label);
        final int position = m_firstPositions.getInt(key);
        if (position == -1) {
            throw new KeyNotFoundException(label);
        }
        if (!m_unique && lookupAll(key).length > 1) {
            throw new IllegalArgumentException(String.format("Label '%s' is not unique.", label));
        }
        return position;
    }

    @Override
    public int[] lookupAll(final Object label) {
        final Object key = DataSpecs.normalize(label);
        final int first = m_firstPositions.getInt(key);
        if (first == -1) {
            return new int[0];
        }
        if (m_unique) {
            return new int[]{first};
        }
        final var positions = new IntArrayList();
        for (int i = first; i < m_labels.size(); i++) {
            if (Objects.equals(m_labels.get(i), key)) {
                positions.add(i);
            }
        }
        return positions.toIntArray();
    }

    @Override
    public int[] getIndexer(final Index target) {
        if (!m_unique) {
            throw new IllegalArgumentException("Cannot compute an indexer from an index with duplicate labels.");
        }
        final int[] indexer = new int[target.size()];
        for (int i = 0; i < indexer.length; i++) {
            indexer[i] = m_firstPositions.getInt(DataSpecs.normalize(target.get(i)));
        }
        return indexer;
    }

    @Override
    public boolean isUnique() {
        return m_unique;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public boolean isMonotonicIncreasing() {
        for (int i = 1; i < m_labels.size(); i++) {
            final Object prev = m_labels.get(i - 1);
            final Object next = m_labels.get(i);
            if (!(prev instanceof Comparable) || next == null || prev.getClass() != next.getClass()
                || ((Comparable)prev).compareTo(next) > 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<Object> labels() {
        return m_labels;
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof Index other && equalLabels(other);
    }

    @Override
    public int hashCode() {
        return m_labels.hashCode();
    }

    @Override
    public String toString() {
        return "LabelIndex" + new ArrayList<>(m_labels);
    }
}
