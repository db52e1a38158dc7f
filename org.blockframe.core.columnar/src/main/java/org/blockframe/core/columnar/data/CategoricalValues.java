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

/**
 * A single column of categorical values, stored as {@code int} codes into the categories of the spec.
 */
public final class CategoricalValues extends BlockValues {

    private final CategoricalDataSpec m_spec;

    private final int[] m_codes;

    private final int m_offset;

    private final int m_length;

    CategoricalValues(final CategoricalDataSpec spec, final int[] codes, final int offset, final int length,
        final ReferenceCounter refCounter) {
        super(refCounter);
        m_spec = spec;
        m_codes = codes;
        m_offset = offset;
        m_length = length;
    }

    static CategoricalValues allocateCategorical(final DataSpec spec, final int numColumns, final int length) {
        Preconditions.checkArgument(spec instanceof CategoricalDataSpec, "%s is not stored as categorical values.",
            spec);
        checkSingleColumn(numColumns);
        final int[] codes = new int[length];
        Arrays.fill(codes, CategoricalDataSpec.MISSING_CODE);
        return new CategoricalValues((CategoricalDataSpec)spec, codes, 0, length, new ReferenceCounter());
    }

    /**
     * Creates categorical values from codes.
     *
     * @param spec the categorical spec
     * @param codes codes into the categories of the spec, {@code -1} for missing values; the array is copied
     * @return the values
     * @throws IllegalArgumentException if a code is out of range
     */
    public static CategoricalValues fromCodes(final CategoricalDataSpec spec, final int[] codes) {
        final int numCategories = spec.categories().size();
        for (final int code : codes) {
            Preconditions.checkArgument(code >= CategoricalDataSpec.MISSING_CODE && code < numCategories,
                "Code %s is out of range for %s categories.", code, numCategories);
        }
        return new CategoricalValues(spec, codes.clone(), 0, codes.length, new ReferenceCounter());
    }

    static void checkSingleColumn(final int numColumns) {
        Preconditions.checkArgument(numColumns == 1, "Extension values hold exactly one column, not %s.", numColumns);
    }

    /**
     * @param row the row
     * @return the code at the row, {@code -1} if missing
     */
    public int getCode(final int row) {
        return m_codes[m_offset + row];
    }

    /**
     * @return a copy of the codes
     */
    public int[] codes() {
        return Arrays.copyOfRange(m_codes, m_offset, m_offset + m_length);
    }

    @Override
    public CategoricalDataSpec spec() {
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
        return getCode(row) == CategoricalDataSpec.MISSING_CODE;
    }

    @Override
    public Object get(final int column, final int row) {
        final int code = getCode(row);
        return code == CategoricalDataSpec.MISSING_CODE ? null : m_spec.categories().get(code);
    }

    @Override
    protected void setUnchecked(final int column, final int row, final Object value) {
        m_codes[m_offset + row] = m_spec.codeOf(value);
    }

    @Override
    protected void setMissingUnchecked(final int column, final int row) {
        m_codes[m_offset + row] = CategoricalDataSpec.MISSING_CODE;
    }

    @Override
    protected void copyElement(final int srcColumn, final int srcRow, final BlockValues dst, final int dstColumn,
        final int dstRow) {
        final var target = (CategoricalValues)dst;
        target.m_codes[target.m_offset + dstRow] = m_codes[m_offset + srcRow];
    }

    @Override
    protected void copyRange(final int srcColumn, final int srcStart, final BlockValues dst, final int dstColumn,
        final int dstStart, final int length) {
        final var target = (CategoricalValues)dst;
        System.arraycopy(m_codes, m_offset + srcStart, target.m_codes, target.m_offset + dstStart, length);
    }

    @Override
    public CategoricalValues allocate(final int numColumns, final int length) {
        return allocateCategorical(m_spec, numColumns, length);
    }

    @Override
    protected CategoricalValues viewColumns(final int[] columns) {
        checkSingleColumn(columns.length);
        return new CategoricalValues(m_spec, m_codes, m_offset, m_length, retainedCounter());
    }

    @Override
    protected CategoricalValues viewRows(final int start, final int length) {
        return new CategoricalValues(m_spec, m_codes, m_offset + start, length, retainedCounter());
    }

    @Override
    public long sizeOf() {
        return (long)Integer.BYTES * m_length;
    }
}
