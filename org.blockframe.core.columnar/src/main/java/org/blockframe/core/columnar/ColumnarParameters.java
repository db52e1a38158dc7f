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

import java.util.Locale;

/**
 * Configuration constants of the columnar core, read once from system properties.
 */
public final class ColumnarParameters {

    // number of blocks above which an insert logs a fragmentation warning
    private static final int FRAGMENTATION_WARNING_THRESHOLD_DEF = 100;

    private static final String FRAGMENTATION_WARNING_THRESHOLD_PROPERTY = "blockframe.columnar.fragmentation.warning";

    /**
     * The number of blocks above which inserting another column logs a warning recommending consolidation.
     */
    public static final int FRAGMENTATION_WARNING_THRESHOLD =
        Integer.getInteger(FRAGMENTATION_WARNING_THRESHOLD_PROPERTY, FRAGMENTATION_WARNING_THRESHOLD_DEF);

    private static final String COMPUTE_BACKEND_PROPERTY = "blockframe.columnar.compute.backend";

    /**
     * The {@link ComputeBackend} used by operations that are not given one explicitly. (Default is serial)
     */
    public static final ComputeBackend COMPUTE_BACKEND = parseBackend(System.getProperty(COMPUTE_BACKEND_PROPERTY));

    // the amount of work (cells) from which the parallel backend really forks
    private static final long PARALLEL_THRESHOLD_DEF = 1L << 20;

    private static final String PARALLEL_THRESHOLD_PROPERTY = "blockframe.columnar.parallel.threshold";

    /**
     * The number of cells from which {@link ComputeBackend#PARALLEL} distributes per-block work. (Default is 1M)
     */
    public static final long PARALLEL_THRESHOLD = Long.getLong(PARALLEL_THRESHOLD_PROPERTY, PARALLEL_THRESHOLD_DEF);

    private static final String NA_REP_PROPERTY = "blockframe.columnar.na.rep";

    /**
     * The default text rendering of missing values. (Default is the empty string)
     */
    public static final String NA_REP = System.getProperty(NA_REP_PROPERTY, "");

    private ColumnarParameters() {

    }

    private static ComputeBackend parseBackend(final String value) {
        if (value == null || value.isBlank()) {
            return ComputeBackend.SERIAL;
        }
        try {
            return ComputeBackend.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                String.format("Unknown compute backend '%s' in property %s.", value, COMPUTE_BACKEND_PROPERTY), ex);
        }
    }
}
