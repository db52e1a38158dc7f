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

import java.util.List;
import java.util.Objects;

import org.blockframe.core.columnar.KeyNotFoundException;

/**
 * An immutable sequence of labels along one axis of a manager, together with the lookups the manager needs.
 * Labels are compared by {@link Objects#equals(Object, Object)} after normalization of boxed numbers (see
 * {@link org.blockframe.core.columnar.data.DataSpecs#normalize(Object)}).
 */
public interface Index {

    /**
     * @return the number of labels
     */
    int size();

    /**
     * @param position a position
     * @return the label at the position
     */
    Object get(int position);

    /**
     * @param label a label
     * @return the position of the label
     * @throws KeyNotFoundException if the label does not exist
     * @throws IllegalArgumentException if the label occurs more than once
     */
    int lookup(Object label);

    /**
     * @param label a label
     * @return all positions of the label in ascending order, empty if it does not exist
     */
    int[] lookupAll(Object label);

    /**
     * @param labels labels
     * @return the position of every label
     * @throws KeyNotFoundException if a label does not exist
     */
    default int[] positions(final List<?> labels) {
        final int[] result = new int[labels.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = lookup(labels.get(i));
        }
        return result;
    }

    /**
     * Computes the indexer that reorders this index into the target: entry {@code i} is the position of
     * {@code target.get(i)} in this index or {@code -1} if this index does not contain it.
     *
     * @param target the target labels
     * @return the indexer
     * @throws IllegalArgumentException if this index is not unique
     */
    int[] getIndexer(Index target);

    /**
     * @return true if no label occurs more than once
     */
    boolean isUnique();

    /**
     * @return true if the labels are comparable and non-decreasing
     */
    boolean isMonotonicIncreasing();

    /**
     * @param label a label
     * @return true if the index contains the label
     */
    default boolean contains(final Object label) {
        return lookupAll(label).length > 0;
    }

    /**
     * @param positions positions, {@code -1} for a {@code null} label
     * @return the index of the labels at the positions
     */
    default Index take(final int[] positions) {
        final Object[] labels = new Object[positions.length];
        for (int i = 0; i < positions.length; i++) {
            labels[i] = positions[i] == -1 ? null : get(positions[i]);
        }
        return Indexes.of(labels);
    }

    /**
     * @param position the position of the new label
     * @param label the label
     * @return the index with the label inserted
     */
    default Index insert(final int position, final Object label) {
        Objects.checkIndex(position, size() + 1);
        final Object[] labels = new Object[size() + 1];
        for (int i = 0, j = 0; i < labels.length; i++) {
            labels[i] = i == position ? label : get(j++);
        }
        return Indexes.of(labels);
    }

    /**
     * @param positions the positions to remove
     * @return the index without the labels at the positions
     */
    default Index delete(final int... positions) {
        final boolean[] remove = new boolean[size()];
        int removed = 0;
        for (final int position : positions) {
            if (!remove[Objects.checkIndex(position, size())]) {
                remove[position] = true;
                removed++;
            }
        }
        final Object[] labels = new Object[size() - removed];
        for (int i = 0, j = 0; i < remove.length; i++) {
            if (!remove[i]) {
                labels[j++] = get(i);
            }
        }
        return Indexes.of(labels);
    }

    /**
     * @param other another index
     * @return the labels of this index followed by the labels of the other
     */
    default Index append(final Index other) {
        return Indexes.concat(List.of(this, other));
    }

    /**
     * @return the labels in order
     */
    List<Object> labels();

    /**
     * @param other another index
     * @return true if both indexes hold the same labels in the same order
     */
    default boolean equalLabels(final Index other) {
        return other == this || labels().equals(other.labels());
    }
}
