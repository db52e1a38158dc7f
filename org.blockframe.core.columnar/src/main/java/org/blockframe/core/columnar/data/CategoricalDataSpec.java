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

import java.util.HashSet;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Values drawn from a fixed list of categories, stored as {@code int} codes into that list. Code {@code -1} denotes a
 * missing value.
 *
 * @param categories the distinct, non-null categories
 * @param ordered whether the order of the categories is meaningful
 */
public record CategoricalDataSpec(List<Object> categories, boolean ordered) implements DataSpec {

    /** The code of a missing value. */
    public static final int MISSING_CODE = -1;

    /**
     * @param categories the distinct, non-null categories
     * @param ordered whether the order of the categories is meaningful
     */
    public CategoricalDataSpec {
        categories = categories.stream().map(DataSpecs::normalize).collect(ImmutableList.toImmutableList());
        if (new HashSet<>(categories).size() != categories.size()) {
            throw new IllegalArgumentException("Categories must be unique: " + categories);
        }
    }

    /**
     * Two categorical specs describe the same type if they are equally ordered and hold the same categories, where the
     * order of the categories only matters for ordered specs.
     *
     * @param other the other spec
     * @return true if both specs describe the same type
     */
    public boolean isTypeEqual(final CategoricalDataSpec other) {
        if (ordered != other.ordered) {
            return false;
        }
        if (ordered) {
            return categories.equals(other.categories);
        }
        return categories.size() == other.categories.size() && new HashSet<>(categories).containsAll(other.categories);
    }

    /**
     * @return the spec of the category values themselves
     */
    public DataSpec categoriesSpec() {
        return DataSpecs.inferSpec(categories);
    }

    /**
     * @param value a value
     * @return the code of the value or {@link #MISSING_CODE} if it is not a category
     */
    public int codeOf(final Object value) {
        return value == null ? MISSING_CODE : categories.indexOf(DataSpecs.normalize(value));
    }

    @Override
    public <R> R accept(final Mapper<R> v) {
        return v.visit(this);
    }

    @Override
    public Kind kind() {
        return Kind.CATEGORICAL;
    }

    @Override
    public boolean isExtension() {
        return true;
    }

    @Override
    public String toString() {
        return "category" + (ordered ? "[ordered]" : "") + categories;
    }
}
