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
package org.blockframe.core.columnar;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Strategy for per-block work (take, reindex, deep copies). The strategy is always passed explicitly by the caller;
 * convenience overloads fall back to {@link ColumnarParameters#COMPUTE_BACKEND}.
 *
 * Parallel execution is only used for functions that read their input and write into freshly allocated output.
 */
public enum ComputeBackend {

        /** Process blocks one after another on the calling thread. */
        SERIAL {
            @Override
            public <T, R> List<R> map(final List<T> items, final Function<? super T, ? extends R> fn,
                final long workSize) {
                return items.stream().map(fn).collect(Collectors.toList());
            }
        },

        /**
         * Process blocks on the common fork-join pool once the amount of work exceeds
         * {@link ColumnarParameters#PARALLEL_THRESHOLD}.
         */
        PARALLEL {
            @Override
            public <T, R> List<R> map(final List<T> items, final Function<? super T, ? extends R> fn,
                final long workSize) {
                if (items.size() < 2 || workSize < ColumnarParameters.PARALLEL_THRESHOLD) {
                    return SERIAL.map(items, fn, workSize);
                }
                return items.parallelStream().map(fn).collect(Collectors.toList());
            }
        };

    /**
     * Applies the function to every item, preserving the order of the items in the result.
     *
     * @param <T> input type
     * @param <R> output type
     * @param items the items
     * @param fn the function, must not mutate shared state
     * @param workSize a rough measure of the amount of work (e.g. number of cells)
     * @return the mapped items in input order
     */
    public abstract <T, R> List<R> map(List<T> items, Function<? super T, ? extends R> fn, long workSize);

}
