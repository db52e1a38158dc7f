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

import java.util.Arrays;

import org.blockframe.core.columnar.ReferenceCounter;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * A single column of sparse values. Only the values that differ from the fill value of the spec are stored, together
 * with their (strictly ascending) row indices.
 *
 * <p>
 * Row slices of sparse values are materialized instead of sharing the storage.
 */
public final class SparseValues extends BlockValues {

    private final SparseDataSpec m_spec;

    private final int m_length;

    private int[] m_indices;

    // one column of the subtype, holding the value of every stored index
    private BlockValues m_stored;

    private SparseValues(final SparseDataSpec spec, final int length, final int[] indices, final BlockValues stored,
        final ReferenceCounter refCounter) {
        super(refCounter);
        m_spec = spec;
        m_length = length;
        m_indices = indices;
        m_stored = stored;
    }

    static SparseValues allocateSparse(final DataSpec spec, final int numColumns, final int length) {
        Preconditions.checkArgument(spec instanceof SparseDataSpec, "%s is not stored as sparse values.", spec);
        CategoricalValues.checkSingleColumn(numColumns);
        final var sparse = (SparseDataSpec)spec;
        return new SparseValues(sparse, length, new int[0], Columns.allocate(sparse.subtype(), 1, 0),
            new ReferenceCounter());
    }

    /**
     * Creates sparse values from their parts.
     *
     * @param spec the sparse spec
     * @param length the number of rows
     * @param indices strictly ascending row indices of the stored values; the array is copied
     * @param stored one column of values of the subtype, one per index; the values are copied
     * @return the sparse values
     * @throws IllegalArgumentException if the parts are inconsistent
     */
    public static SparseValues of(final SparseDataSpec spec, final int length, final int[] indices,
        final BlockValues stored) {
        Preconditions.checkArgument(stored.spec().equals(spec.subtype()), "Stored values of type %s do not match %s.",
            stored.spec(), spec);
        Preconditions.checkArgument(stored.numColumns() == 1 && stored.length() == indices.length,
            "Expected one stored value per index.");
        for (int i = 0; i < indices.length; i++) {
            Preconditions.checkArgument(indices[i] >= 0 && indices[i] < length, "Sparse index %s out of range.",
                indices[i]);
            Preconditions.checkArgument(i == 0 || indices[i - 1] < indices[i],
                "Sparse indices must be strictly ascending.");
        }
        return new SparseValues(spec, length, indices.clone(), stored.copy(), new ReferenceCounter());
    }

    /**
     * Encodes a dense column.
     *
     * @param dense one column of a non-extension, non-datetime-like spec
     * @param fillValue the fill value, {@code null} for the default fill of the spec
     * @return the sparse values
     */
    public static SparseValues fromDense(final BlockValues dense, final Object fillValue) {
        CategoricalValues.checkSingleColumn(dense.numColumns());
        final SparseDataSpec spec = DataSpec.sparseSpec(dense.spec(), fillValue);
        final var indices = new IntArrayList();
        for (int r = 0; r < dense.length(); r++) {
            if (!DataSpecs.isFill(spec, dense.get(0, r))) {
                indices.add(r);
            }
        }
        final int[] positions = indices.toIntArray();
        return new SparseValues(spec, dense.length(), positions, dense.take(positions, false, null),
            new ReferenceCounter());
    }

    /**
     * @return the value of all positions that are not stored
     */
    public Object fillValue() {
        return m_spec.fillValue();
    }

    /**
     * @return the number of stored values
     */
    public int numStored() {
        return m_indices.length;
    }

    /**
     * @return a copy of the row indices of the stored values
     */
    public int[] indices() {
        return m_indices.clone();
    }

    /**
     * @return a copy of the stored values, one column of the subtype
     */
    public BlockValues storedValues() {
        return m_stored.copy();
    }

    /**
     * @return the decoded values, one column of the subtype
     */
    public BlockValues toDense() {
        final BlockValues dense = Columns.allocate(m_spec.subtype(), 1, m_length);
        for (int r = 0; r < m_length; r++) {
            dense.write(0, r, get(0, r));
        }
        return dense;
    }

    @Override
    public SparseDataSpec spec() {
        return m_spec;
    }

    @Override
    public int numColumns() {
        return 1;
    }

    @Override
    public int length() {
        return m_length;
    }

    @Override
    public boolean isMissing(final int column, final int row) {
        return DataSpecs.isNa(get(column, row));
    }

    @Override
    public Object get(final int column, final int row) {
        Preconditions.checkElementIndex(row, m_length);
        final int pos = Arrays.binarySearch(m_indices, row);
        return pos >= 0 ? m_stored.get(0, pos) : m_spec.fillValue();
    }

    @Override
    protected void setUnchecked(final int column, final int row, final Object value) {
        final int pos = Arrays.binarySearch(m_indices, row);
        if (DataSpecs.isFill(m_spec, value)) {
            if (pos >= 0) {
                remove(pos);
            }
        } else if (pos >= 0) {
            m_stored.write(0, pos, value);
        } else {
            insert(-(pos + 1), row, value);
        }
    }

    private void insert(final int pos, final int row, final Object value) {
        final int n = m_indices.length;
        final int[] indices = new int[n + 1];
        System.arraycopy(m_indices, 0, indices, 0, pos);
        indices[pos] = row;
        System.arraycopy(m_indices, pos, indices, pos + 1, n - pos);
        final BlockValues stored = m_stored.allocate(1, n + 1);
        m_stored.copyRange(0, 0, stored, 0, 0, pos);
        stored.write(0, pos, value);
        m_stored.copyRange(0, pos, stored, 0, pos + 1, n - pos);
        replace(indices, stored);
    }

    private void remove(final int pos) {
        final int n = m_indices.length;
        final int[] indices = new int[n - 1];
        System.arraycopy(m_indices, 0, indices, 0, pos);
        System.arraycopy(m_indices, pos + 1, indices, pos, n - pos - 1);
        final BlockValues stored = m_stored.allocate(1, n - 1);
        m_stored.copyRange(0, 0, stored, 0, 0, pos);
        m_stored.copyRange(0, pos + 1, stored, 0, pos, n - pos - 1);
        replace(indices, stored);
    }

    private void replace(final int[] indices, final BlockValues stored) {
        m_stored.release();
        m_indices = indices;
        m_stored = stored;
    }

    @Override
    protected void setMissingUnchecked(final int column, final int row) {
        if (!m_spec.subtype().kind().canHoldMissing()) {
            throw new IllegalStateException(m_spec + " cannot hold missing values.");
        }
        setUnchecked(column, row, DataSpecs.naValue(m_spec.subtype()));
    }

    @Override
    protected void copyElement(final int srcColumn, final int srcRow, final BlockValues dst, final int dstColumn,
        final int dstRow) {
        ((SparseValues)dst).setUnchecked(dstColumn, dstRow, get(srcColumn, srcRow));
    }

    @Override
    protected void copyRange(final int srcColumn, final int srcStart, final BlockValues dst, final int dstColumn,
        final int dstStart, final int length) {
        final var target = (SparseValues)dst;
        final int lo = lowerBound(m_indices, srcStart);
        final int hi = lowerBound(m_indices, srcStart + length);
        final int targetLo = lowerBound(target.m_indices, dstStart);
        final int targetHi = lowerBound(target.m_indices, dstStart + length);
        final int tail = target.m_indices.length - targetHi;
        final int n = targetLo + (hi - lo) + tail;

        final int[] indices = new int[n];
        final BlockValues stored = target.m_stored.allocate(1, n);
        System.arraycopy(target.m_indices, 0, indices, 0, targetLo);
        target.m_stored.copyRange(0, 0, stored, 0, 0, targetLo);
        for (int i = lo; i < hi; i++) {
            indices[targetLo + i - lo] = m_indices[i] - srcStart + dstStart;
        }
        m_stored.copyRange(0, lo, stored, 0, targetLo, hi - lo);
        System.arraycopy(target.m_indices, targetHi, indices, targetLo + hi - lo, tail);
        target.m_stored.copyRange(0, targetHi, stored, 0, targetLo + hi - lo, tail);
        target.replace(indices, stored);
    }

    private static int lowerBound(final int[] sorted, final int key) {
        final int pos = Arrays.binarySearch(sorted, key);
        return pos >= 0 ? pos : -(pos + 1);
    }

    @Override
    public SparseValues allocate(final int numColumns, final int length) {
        return allocateSparse(m_spec, numColumns, length);
    }

    @Override
    protected SparseValues viewColumns(final int[] columns) {
        CategoricalValues.checkSingleColumn(columns.length);
        return new SparseValues(m_spec, m_length, m_indices, m_stored, retainedCounter());
    }

    @Override
    protected SparseValues viewRows(final int start, final int length) {
        final SparseValues slice = allocate(1, length);
        copyRange(0, start, slice, 0, 0, length);
        return slice;
    }

    @Override
    public long sizeOf() {
        return (long)Integer.BYTES * m_indices.length + m_stored.sizeOf();
    }
}
