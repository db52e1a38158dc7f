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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.blockframe.core.columnar.data.DataSpecs;

/**
 * Factories and combinations of {@link Index indexes}.
 */
public final class Indexes {

    private Indexes() {
    }

    /**
     * @param n the size
     * @return the index {@code 0, ..., n - 1}
     */
    public static RangeIndex range(final int n) {
        return new RangeIndex(0, n, 1);
    }

    /**
     * @param labels the labels
     * @return an index of the labels
     */
    public static Index of(final Object... labels) {
        return new LabelIndex(labels);
    }

    /**
     * @param labels the labels
     * @return an index of the labels
     */
    public static Index of(final List<?> labels) {
        return new LabelIndex(labels.toArray());
    }

    /**
     * Concatenates indexes. If all non-empty inputs are {@link RangeIndex range indexes} that continue each other with
     * the same step, the result is a range index again.
     *
     * @param indexes the indexes in order
     * @return the concatenated index
     */
    public static Index concat(final List<? extends Index> indexes) {
        if (!indexes.isEmpty() && indexes.stream().allMatch(RangeIndex.class::isInstance)) {
            final Index range = concatRanges(indexes);
            if (range != null) {
                return range;
            }
        }
        final List<Object> labels = new ArrayList<>();
        for (final Index index : indexes) {
            labels.addAll(index.labels());
        }
        return of(labels);
    }

    /**
     * @return the concatenated range or {@code null} if the ranges are not consecutive
     */
    private static RangeIndex concatRanges(final List<? extends Index> indexes) {
        Long start = null;
        Long step = null;
        Long next = null;
        for (final Index index : indexes) {
            final var range = (RangeIndex)index;
            if (range.size() == 0) {
                continue;
            }
            if (start == null) {
                start = range.getStart();
                if (range.size() > 1) {
                    step = range.getStep();
                }
            } else if (step == null) {
                if (range.getStart() == start) {
                    return null;
                }
                step = range.getStart() - start;
            }
            final boolean consecutive = (step == null || range.size() == 1 || step == range.getStep())
                && (next == null || range.getStart() == next);
            if (!consecutive) {
                return null;
            }
            if (step != null) {
                next = range.get(range.size() - 1) + step;
            }
        }
        if (start == null) {
            return new RangeIndex(0, 0, 1);
        }
        if (step == null) {
            // a single label
            return new RangeIndex(start, start + 1, 1);
        }
        return new RangeIndex(start, next, step);
    }

    /**
     * @param indexes the indexes
     * @return the distinct labels of all indexes in the order they are first seen
     */
    public static Index union(final List<? extends Index> indexes) {
        final Set<Object> labels = new LinkedHashSet<>();
        for (final Index index : indexes) {
            for (final Object label : index.labels()) {
                labels.add(DataSpecs.normalize(label));
            }
        }
        return of(new ArrayList<>(labels));
    }
}
