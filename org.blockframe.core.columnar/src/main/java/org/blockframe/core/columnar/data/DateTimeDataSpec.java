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
package org.blockframe.core.columnar.data;

import java.time.ZoneId;

/**
 * Timestamps with nanosecond precision, stored as {@code long} nanoseconds since the epoch. Missing values are
 * {@link Temporals#NAT}. Without a zone the nanoseconds describe a wall-clock time in UTC; with a zone they describe an
 * instant that is presented in that zone.
 *
 * @param zone the zone or {@code null} for naive timestamps
 */
public record DateTimeDataSpec(ZoneId zone) implements DataSpec {

    /** Timestamps without a timezone. */
    public static final DateTimeDataSpec NAIVE = new DateTimeDataSpec(null);

    /**
     * @return true if the timestamps carry a zone
     */
    public boolean isTimezoneAware() {
        return zone != null;
    }

    @Override
    public <R> R accept(final Mapper<R> v) {
        return v.visit(this);
    }

    @Override
    public Kind kind() {
        return zone == null ? Kind.DATETIME : Kind.DATETIME_TZ;
    }

    @Override
    public String toString() {
        return zone == null ? "datetime64[ns]" : ("datetime64[ns, " + zone + "]");
    }
}
