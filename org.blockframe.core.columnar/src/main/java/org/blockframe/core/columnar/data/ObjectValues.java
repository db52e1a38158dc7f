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

import com.google.common.base.Preconditions;

/**
 * Arbitrary references stored as one {@code Object[]} per column. Missing values are stored as {@code null}.
 */
public final class ObjectValues extends BlockValues {

    // rough estimate of an object reference plus a small object header
    private static final long REFERENCE_SIZE = 16;

    private final ObjectDataSpec m_spec;

    private final Object[][] m_data;

    private final int m_offset;

    private final int m_length;

    ObjectValues(final ObjectDataSpec spec, final Object[][] data, final int offset, final int length,
        final ReferenceCounter refCounter) {
        super(refCounter);
        m_spec = spec;
        m_data = data;
        m_offset = offset;
        m_length = length;
    }

    static ObjectValues allocateObjects(final DataSpec spec, final int numColumns, final int length) {
        Preconditions.checkArgument(spec instanceof ObjectDataSpec, "%s is not stored as object values.", spec);
        return new ObjectValues((ObjectDataSpec)spec, new Object[numColumns][length], 0, length,
            new ReferenceCounter());
    }

    @Override
    public DataSpec spec() {
        return m_spec;
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
        return DataSpecs.isNa(get(column, row));
    }

    @Override
    public Object get(final int column, final int row) {
        return m_data[column][m_offset + row];
    }

    @Override
    protected void setUnchecked(final int column, final int row, final Object value) {
        m_data[column][m_offset + row] = value;
    }

    @Override
    protected void setMissingUnchecked(final int column, final int row) {
        m_data[column][m_offset + row] = null;
    }

    @Override
    protected void copyElement(final int srcColumn, final int srcRow, final BlockValues dst, final int dstColumn,
        final int dstRow) {
        final var target = (ObjectValues)dst;
        target.m_data[dstColumn][target.m_offset + dstRow] = m_data[srcColumn][m_offset + srcRow];
    }

    @Override
    protected void copyRange(final int srcColumn, final int srcStart, final BlockValues dst, final int dstColumn,
        final int dstStart, final int length) {
        final var target = (ObjectValues)dst;
        System.arraycopy(m_data[srcColumn], m_offset + srcStart, target.m_data[dstColumn], target.m_offset + dstStart,
            length);
    }

    @Override
    public ObjectValues allocate(final int numColumns, final int length) {
        return allocateObjects(m_spec, numColumns, length);
    }

    @Override
    protected ObjectValues viewColumns(final int[] columns) {
        final Object[][] data = new Object[columns.length][];
        for (int i = 0; i < columns.length; i++) {
            data[i] = m_data[columns[i]];
        }
        return new ObjectValues(m_spec, data, m_offset, m_length, retainedCounter());
    }

    @Override
    protected ObjectValues viewRows(final int start, final int length) {
        return new ObjectValues(m_spec, m_data, m_offset + start, length, retainedCounter());
    }

    @Override
    public long sizeOf() {
        return REFERENCE_SIZE * numColumns() * m_length;
    }
}
