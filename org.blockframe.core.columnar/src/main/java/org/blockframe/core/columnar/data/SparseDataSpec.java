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

import com.google.common.base.Preconditions;

/**
 * Values of which only the ones different from a fill value are stored. The subtype is the spec of the stored values
 * and must be one of the non-extension, non-datetime-like specs.
 *
 * @param subtype the spec of the stored values
 * @param fillValue the value of all positions that are not stored; {@code null} means the default fill of the
 *            subtype (missing for float and object, {@code 0} for integers and {@code false} for booleans)
 */
public record SparseDataSpec(DataSpec subtype, Object fillValue) implements DataSpec {

    /**
     * @param subtype the spec of the stored values
     * @param fillValue the value of all positions that are not stored
     */
    public SparseDataSpec {
        Preconditions.checkNotNull(subtype, "Sparse subtype must not be null.");
        Preconditions.checkArgument(!subtype.isExtension() && !subtype.kind().isDatetimeLike(),
            "Unsupported sparse subtype %s.", subtype);
        fillValue = fillValue == null ? DataSpecs.defaultFillValue(subtype) : DataSpecs.normalize(fillValue);
        Preconditions.checkArgument(DataSpecs.canHold(subtype, fillValue), "Fill value %s cannot be held by %s.",
            fillValue, subtype);
        // the fill has the boxed type of the stored values
        if (subtype.kind() == Kind.FLOAT && fillValue instanceof Number n) {
            fillValue = n.doubleValue();
        } else if (subtype.kind() == Kind.INTEGER && fillValue instanceof Number n) {
            fillValue = n.longValue();
        }
    }

    @Override
    public <R> R accept(final Mapper<R> v) {
        return v.visit(this);
    }

    @Override
    public Kind kind() {
        return Kind.SPARSE;
    }

    @Override
    public boolean isExtension() {
        return true;
    }

    @Override
    public String toString() {
        return "Sparse[" + subtype + ", " + fillValue + "]";
    }
}
