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
import java.util.List;

import org.blockframe.core.columnar.data.PeriodDataSpec.Frequency;

import com.google.common.collect.ImmutableList;

/**
 * The element type of a buffer. The set of specs is closed; code that needs to treat specs differently does so through
 * a {@link Mapper}, so that adding a spec breaks every place that has to handle it.
 */
@SuppressWarnings("javadoc")
public interface DataSpec {

    public static BooleanDataSpec booleanSpec() {
        return BooleanDataSpec.INSTANCE;
    }

    public static LongDataSpec longSpec() {
        return LongDataSpec.INSTANCE;
    }

    public static DoubleDataSpec doubleSpec() {
        return DoubleDataSpec.INSTANCE;
    }

    public static ObjectDataSpec objectSpec() {
        return ObjectDataSpec.INSTANCE;
    }

    public static ObjectDataSpec textSpec() {
        return ObjectDataSpec.TEXT;
    }

    public static DateTimeDataSpec dateTimeSpec() {
        return DateTimeDataSpec.NAIVE;
    }

    public static DateTimeDataSpec dateTimeSpec(final ZoneId zone) {
        return zone == null ? DateTimeDataSpec.NAIVE : new DateTimeDataSpec(zone);
    }

    public static DurationDataSpec durationSpec() {
        return DurationDataSpec.INSTANCE;
    }

    public static PeriodDataSpec periodSpec(final Frequency frequency) {
        return new PeriodDataSpec(frequency);
    }

    public static CategoricalDataSpec categoricalSpec(final List<?> categories, final boolean ordered) {
        return new CategoricalDataSpec(ImmutableList.<Object> copyOf(categories), ordered);
    }

    public static SparseDataSpec sparseSpec(final DataSpec subtype, final Object fillValue) {
        return new SparseDataSpec(subtype, fillValue);
    }

    public static interface Mapper<R> {

        R visit(BooleanDataSpec spec);

        R visit(LongDataSpec spec);

        R visit(DoubleDataSpec spec);

        R visit(ObjectDataSpec spec);

        R visit(DateTimeDataSpec spec);

        R visit(DurationDataSpec spec);

        R visit(PeriodDataSpec spec);

        R visit(CategoricalDataSpec spec);

        R visit(SparseDataSpec spec);
    }

    <R> R accept(Mapper<R> v);

    /**
     * @return the kind of this spec
     */
    Kind kind();

    /**
     * Extension specs are stored one column per block and are never consolidated with other blocks.
     *
     * @return true if values of this spec are one-dimensional extension values
     */
    default boolean isExtension() {
        return false;
    }

}
