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

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.blockframe.core.columnar.TimezoneMismatchException;
import org.blockframe.core.columnar.data.BlockValues;
import org.blockframe.core.columnar.data.CategoricalDataSpec;
import org.blockframe.core.columnar.data.CategoricalValues;
import org.blockframe.core.columnar.data.DataSpec;
import org.blockframe.core.columnar.data.DataSpecs;
import org.blockframe.core.columnar.data.DateTimeDataSpec;
import org.blockframe.core.columnar.data.Kind;
import org.blockframe.core.columnar.data.SparseDataSpec;
import org.blockframe.core.columnar.data.SparseValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Concatenation of single columns of possibly different specs.
 *
 * <p>
 * The spec of the result is decided in this order:
 * <ol>
 * <li>categorical inputs of the same type are combined through {@link CategoricalUnion}, any other mix with a
 * categorical is concatenated as object</li>
 * <li>datetime-like inputs are only concatenated as such if all of them have the same spec, datetimes in different
 * timezones are rejected, any other mix is concatenated as object</li>
 * <li>sparse inputs with the same spec keep their encoding, otherwise they are densified and encoded again if all other
 * inputs are numeric</li>
 * <li>everything else is cast to {@link DataSpecs#commonSpec(List)}</li>
 * </ol>
 * Empty inputs are dropped unless all inputs are empty, so they do not take part in this decision.
 */
public final class ArrayConcat {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArrayConcat.class);

    private static final Set<Kind> SPARSE_COMPATIBLE = EnumSet.of(Kind.SPARSE, Kind.FLOAT, Kind.INTEGER);

    private ArrayConcat() {
    }

    /**
     * Concatenates single columns. The inputs are left untouched.
     *
     * @param inputs at least one single-column buffer
     * @return a new buffer holding the rows of all inputs
     * @throws TimezoneMismatchException if datetimes of different timezones are concatenated
     */
    public static BlockValues concat(final List<? extends BlockValues> inputs) {
        Preconditions.checkArgument(!inputs.isEmpty(), "Nothing to concatenate.");
        for (final BlockValues input : inputs) {
            Preconditions.checkArgument(input.numColumns() == 1, "Only single columns can be concatenated, not %s.",
                input);
        }
        final List<BlockValues> nonEmpty = new ArrayList<>(inputs.size());
        for (final BlockValues input : inputs) {
            if (input.length() > 0) {
                nonEmpty.add(input);
            }
        }
        // empty inputs contribute no rows
        final List<? extends BlockValues> parts = nonEmpty.isEmpty() ? inputs : nonEmpty;
        final Set<Kind> kinds = DataSpecs.kinds(parts);

        if (kinds.contains(Kind.CATEGORICAL)) {
            return concatCategorical(parts);
        } else if (kinds.stream().anyMatch(Kind::isDatetimeLike)) {
            return concatDatetimeLike(parts, kinds);
        } else if (kinds.contains(Kind.SPARSE)) {
            return concatSparse(parts, kinds);
        }
        if (nonEmpty.isEmpty() && kinds.size() > 1 && !EnumSet.of(Kind.INTEGER, Kind.FLOAT).containsAll(kinds)
            && !EnumSet.of(Kind.BOOL, Kind.INTEGER).containsAll(kinds)) {
            return concatAsObject(parts);
        }
        return concatAs(parts, DataSpecs.commonSpec(specs(parts)));
    }

    /**
     * Concatenates single columns after casting all of them to object.
     *
     * @param inputs at least one single-column buffer
     * @return a new object buffer holding the rows of all inputs
     */
    public static BlockValues concatAsObject(final List<? extends BlockValues> inputs) {
        return concatAs(inputs, DataSpec.objectSpec());
    }

    private static BlockValues concatCategorical(final List<? extends BlockValues> parts) {
        final DataSpec first = parts.get(0).spec();
        final boolean sameType = first instanceof CategoricalDataSpec categorical
            && parts.stream().allMatch(v -> v instanceof CategoricalValues c && c.spec().isTypeEqual(categorical));
        if (sameType) {
            final List<CategoricalValues> categoricals = new ArrayList<>(parts.size());
            parts.forEach(v -> categoricals.add((CategoricalValues)v));
            return CategoricalUnion.union(categoricals, false, false);
        }
        LOGGER.debug("Concatenating categoricals of different types {} as object.", specs(parts));
        return concatAsObject(parts);
    }

    private static BlockValues concatDatetimeLike(final List<? extends BlockValues> parts, final Set<Kind> kinds) {
        if (kinds.size() == 1 && kinds.contains(Kind.DATETIME_TZ)) {
            final Set<ZoneId> zones = new LinkedHashSet<>();
            parts.forEach(v -> zones.add(((DateTimeDataSpec)v.spec()).zone()));
            if (zones.size() > 1) {
                throw new TimezoneMismatchException(zones);
            }
        }
        final DataSpec first = parts.get(0).spec();
        if (parts.stream().allMatch(v -> v.spec().equals(first))) {
            return concatAs(parts, first);
        }
        LOGGER.debug("Concatenating datetime-like values of types {} as object.", specs(parts));
        return concatAsObject(parts);
    }

    private static BlockValues concatSparse(final List<? extends BlockValues> parts, final Set<Kind> kinds) {
        final DataSpec first = parts.get(0).spec();
        if (kinds.size() == 1 && parts.stream().allMatch(v -> v.spec().equals(first))) {
            return concatSparseIndices(parts, (SparseDataSpec)first);
        }
        if (SPARSE_COMPATIBLE.containsAll(kinds)) {
            final DataSpec common = DataSpecs.commonSpec(specs(parts));
            LOGGER.debug("Concatenating sparse values of types {} as {}.", specs(parts), common);
            return concatAs(parts, common);
        }
        LOGGER.debug("Concatenating sparse values with values of types {} as object.", specs(parts));
        return concatAsObject(parts);
    }

    private static SparseValues concatSparseIndices(final List<? extends BlockValues> inputs,
        final SparseDataSpec spec) {
        final var indices = new IntArrayList();
        final List<BlockValues> stored = new ArrayList<>(inputs.size());
        int offset = 0;
        try {
            for (final BlockValues input : inputs) {
                final var sparse = (SparseValues)input;
                for (final int index : sparse.indices()) {
                    indices.add(index + offset);
                }
                stored.add(sparse.storedValues());
                offset += sparse.length();
            }
            final BlockValues storedValues = BlockValues.concatRows(stored);
            try {
                return SparseValues.of(spec, offset, indices.toIntArray(), storedValues);
            } finally {
                storedValues.release();
            }
        } finally {
            stored.forEach(BlockValues::release);
        }
    }

    private static BlockValues concatAs(final List<? extends BlockValues> inputs, final DataSpec spec) {
        final List<BlockValues> cast = new ArrayList<>(inputs.size());
        try {
            for (final BlockValues input : inputs) {
                cast.add(input.spec().equals(spec) ? input.shallowCopy() : input.astype(spec));
            }
            return BlockValues.concatRows(cast);
        } finally {
            cast.forEach(BlockValues::release);
        }
    }

    private static List<DataSpec> specs(final List<? extends BlockValues> values) {
        final List<DataSpec> specs = new ArrayList<>(values.size());
        values.forEach(v -> specs.add(v.spec()));
        return specs;
    }
}
