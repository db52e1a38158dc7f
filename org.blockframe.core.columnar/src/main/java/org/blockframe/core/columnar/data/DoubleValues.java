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

import org.blockframe.core.columnar.ReferenceCounter;

/**
 * float64 values stored as one {@code double[]} per column. Missing values are {@link Double#NaN}.
 */
public final class DoubleValues extends BlockValues {

    private final double[][] m_data;

    private final int m_offset;

    private final int m_length;

    DoubleValues(final double[][] data, final int offset, final int length, final ReferenceCounter refCounter) {
        super(refCounter);
        m_data = data;
        m_offset = offset;
        m_length = length;
    }

    static DoubleValues allocateDoubles(final int numColumns, final int length) {
        return new DoubleValues(new double[numColumns][length], 0, length, new ReferenceCounter());
    }

    /**
     * @param column the column
     * @param row the row
     * @return the value, {@link Double#NaN} if missing
     */
    public double getDouble(final int column, final int row) {
        return m_data[column][m_offset + row];
    }

    /**
     * @param column the column
     * @param row the row
     * @param value the value
     * @throws IllegalStateException if the storage is shared
     */
    public void setDouble(final int column, final int row, final double value) {
        checkWritable();
        m_data[column][m_offset + row] = value;
    }

    @Override
    public DataSpec spec() {
        return DataSpec.doubleSpec();
    }

    @Override
    public int numColumns() {
        return m_data.length;
    }

    @Override
    public int length() {
        return m_length;
    }

    @Override
    public boolean isMissing(final int column, final int row) {
        return Double.isNaN(getDouble(column, row));
    }

    @Override
    public Object get(final int column, final int row) {
        return getDouble(column, row);
    }

    @Override
    protected void setUnchecked(final int column, final int row, final Object value) {
        m_data[column][m_offset + row] = ((Number)value).doubleValue();
    }

    @Override
    protected void setMissingUnchecked(final int column, final int row) {
        m_data[column][m_offset + row] = Double.NaN;
    }

    @Override
    protected void copyElement(final int srcColumn, final int srcRow, final BlockValues dst, final int dstColumn,
        final int dstRow) {
        final var target = (DoubleValues)dst;
        target.m_data[dstColumn][target.m_offset + dstRow] = m_data[srcColumn][m_offset + srcRow];
    }

    @Override
    protected void copyRange(final int srcColumn, final int srcStart, final BlockValues dst, final int dstColumn,
        final int dstStart, final int length) {
        final var target = (DoubleValues)dst;
        System.arraycopy(m_data[srcColumn], m_offset + srcStart, target.m_data[dstColumn], target.m_offset + dstStart,
            length);
    }

    @Override
    public DoubleValues allocate(final int numColumns, final int length) {
        return allocateDoubles(numColumns, length);
    }

    @Override
    protected DoubleValues viewColumns(final int[] columns) {
        final double[][] data = new double[columns.length][];
        for (int i = 0; i < columns.length; i++) {
            data[i] = m_data[columns[i]];
        }
        return new DoubleValues(data, m_offset, m_length, retainedCounter());
    }

    @Override
    protected DoubleValues viewRows(final int start, final int length) {
        return new DoubleValues(m_data, m_offset + start, length, retainedCounter());
    }

    @Override
    public long sizeOf() {
        return (long)Double.BYTES * numColumns() * m_length;
    }
}
