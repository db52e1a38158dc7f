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
package org.blockframe.core.columnar.concat;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.blockframe.core.columnar.IncompatibleCategoriesException;
import org.blockframe.core.columnar.IncompatibleCategoriesException.Reason;
import org.blockframe.core.columnar.data.CategoricalDataSpec;
import org.blockframe.core.columnar.data.CategoricalValues;
import org.blockframe.core.columnar.data.DataSpec;
import org.blockframe.core.columnar.data.DataSpecs;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Concatenates categorical columns while combining their categories.
 *
 * <p>
 * Unordered categories are combined in order of first appearance, e.g. {@code [b, c]} and {@code [a, b]} result in
 * {@code [b, c, a]}. Ordered categoricals can only be combined if all of them hold the same categories in the same
 * order.
 */
public final class CategoricalUnion {

    private CategoricalUnion() {
    }

    /**
     * Concatenates categorical columns.
     *
     * @param inputs at least one categorical column
     * @param sortCategories whether the categories of the result are sorted
     * @param ignoreOrder whether the ordered property of the inputs is ignored; the result is unordered then
     * @return the concatenated column
     * @throws IllegalArgumentException if no input is given
     * @throws IncompatibleCategoriesException if the categories cannot be combined
     */
    public static CategoricalValues union(final List<CategoricalValues> inputs, final boolean sortCategories,
        final boolean ignoreOrder) {
        Preconditions.checkArgument(!inputs.isEmpty(), "No categoricals to union.");
        final CategoricalDataSpec first = inputs.get(0).spec();
        final DataSpec categoriesSpec = first.categoriesSpec();
        for (final CategoricalValues input : inputs) {
            if (!input.spec().categories().isEmpty() && !first.categories().isEmpty()
                && !input.spec().categoriesSpec().equals(categoriesSpec)) {
                throw new IncompatibleCategoriesException(Reason.CATEGORY_TYPE_DIFFERS);
            }
        }
        final boolean ordered = first.ordered() && !ignoreOrder;

        if (inputs.stream().allMatch(v -> v.spec().equals(first))) {
            if (sortCategories && ordered) {
                throw new IncompatibleCategoriesException(Reason.SORT_ORDERED);
            }
            final List<Object> categories =
                sortCategories ? DataSpecs.sortIfComparable(first.categories()) : first.categories();
            return recode(inputs, DataSpec.categoricalSpec(categories, ordered));
        }

        if (inputs.stream().allMatch(v -> v.spec().ordered() == first.ordered())) {
            if (inputs.stream().allMatch(v -> v.spec().isTypeEqual(first))
                || (!first.ordered() && sameCategorySet(inputs, first))) {
                if (sortCategories && ordered) {
                    throw new IncompatibleCategoriesException(Reason.SORT_ORDERED);
                }
                final List<Object> categories =
                    sortCategories ? DataSpecs.sortIfComparable(first.categories()) : first.categories();
                return recode(inputs, DataSpec.categoricalSpec(categories, ordered));
            }
            if (first.ordered() && !ignoreOrder) {
                throw new IncompatibleCategoriesException(Reason.CATEGORIES_DIFFER);
            }
        } else if (!ignoreOrder) {
            throw new IncompatibleCategoriesException(Reason.ORDERED_DIFFERS);
        }

        if (sortCategories && ordered) {
            throw new IncompatibleCategoriesException(Reason.SORT_ORDERED);
        }
        final Set<Object> union = new LinkedHashSet<>();
        for (final CategoricalValues input : inputs) {
            union.addAll(input.spec().categories());
        }
        List<Object> categories = new ArrayList<>(union);
        if (sortCategories) {
            categories = DataSpecs.sortIfComparable(categories);
        }
        return recode(inputs, DataSpec.categoricalSpec(categories, false));
    }

    private static boolean sameCategorySet(final List<CategoricalValues> inputs, final CategoricalDataSpec first) {
        final Set<Object> expected = Set.copyOf(first.categories());
        return inputs.stream().allMatch(v -> v.spec().categories().size() == expected.size()
            && expected.containsAll(v.spec().categories()));
    }

    /**
     * Concatenates the codes of all inputs, translated into codes of the target categories.
     */
    private static CategoricalValues recode(final List<CategoricalValues> inputs, final CategoricalDataSpec target) {
        final var targetCodes = new Object2IntOpenHashMap<Object>(target.categories().size());
        targetCodes.defaultReturnValue(CategoricalDataSpec.MISSING_CODE);
        for (int i = 0; i < target.categories().size(); i++) {
            targetCodes.put(target.categories().get(i), i);
        }
        int length = 0;
        for (final CategoricalValues input : inputs) {
            length += input.length();
        }
        final int[] codes = new int[length];
        int offset = 0;
        for (final CategoricalValues input : inputs) {
            final List<Object> categories = input.spec().categories();
            final int[] translation = new int[categories.size()];
            for (int i = 0; i < translation.length; i++) {
                translation[i] = targetCodes.getInt(categories.get(i));
            }
            for (int r = 0; r < input.length(); r++) {
                final int code = input.getCode(r);
                codes[offset + r] = code == CategoricalDataSpec.MISSING_CODE ? code : translation[code];
            }
            offset += input.length();
        }
        return CategoricalValues.fromCodes(target, codes);
    }
}
