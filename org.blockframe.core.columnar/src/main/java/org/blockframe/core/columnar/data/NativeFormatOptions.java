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

import org.blockframe.core.columnar.ColumnarParameters;

import com.google.common.base.Preconditions;

/**
 * Immutable options for rendering values as text, see {@link BlockValues#toNativeTypes(NativeFormatOptions)}.
 */
public final class NativeFormatOptions {

    private static final NativeFormatOptions DEFAULTS =
        new NativeFormatOptions(ColumnarParameters.NA_REP, null, '.', null, Quoting.NONE, '"', ',');

    private final String m_naRep;

    private final String m_floatFormat;

    private final char m_decimal;

    private final String m_dateFormat;

    private final Quoting m_quoting;

    private final char m_quoteChar;

    private final char m_separator;

    private NativeFormatOptions(final String naRep, final String floatFormat, final char decimal,
        final String dateFormat, final Quoting quoting, final char quoteChar, final char separator) {
        m_naRep = naRep;
        m_floatFormat = floatFormat;
        m_decimal = decimal;
        m_dateFormat = dateFormat;
        m_quoting = quoting;
        m_quoteChar = quoteChar;
        m_separator = separator;
    }

    /**
     * @return options without float or date format, {@code '.'} as decimal separator, no quoting and the missing
     *         value rendering of {@link ColumnarParameters#NA_REP}
     */
    public static NativeFormatOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @param naRep the text of missing values
     * @return new options
     */
    public NativeFormatOptions withNaRep(final String naRep) {
        Preconditions.checkNotNull(naRep);
        return new NativeFormatOptions(naRep, m_floatFormat, m_decimal, m_dateFormat, m_quoting, m_quoteChar,
            m_separator);
    }

    /**
     * @param floatFormat a {@link java.util.Formatter} pattern for a single double, e.g. {@code %.2f}, or {@code null}
     * @return new options
     */
    public NativeFormatOptions withFloatFormat(final String floatFormat) {
        return new NativeFormatOptions(m_naRep, floatFormat, m_decimal, m_dateFormat, m_quoting, m_quoteChar,
            m_separator);
    }

    /**
     * @param decimal the decimal separator of floats
     * @return new options
     */
    public NativeFormatOptions withDecimal(final char decimal) {
        return new NativeFormatOptions(m_naRep, m_floatFormat, decimal, m_dateFormat, m_quoting, m_quoteChar,
            m_separator);
    }

    /**
     * @param dateFormat a {@link java.time.format.DateTimeFormatter} pattern, or {@code null}
     * @return new options
     */
    public NativeFormatOptions withDateFormat(final String dateFormat) {
        return new NativeFormatOptions(m_naRep, m_floatFormat, m_decimal, dateFormat, m_quoting, m_quoteChar,
            m_separator);
    }

    /**
     * @param quoting the quoting policy
     * @return new options
     */
    public NativeFormatOptions withQuoting(final Quoting quoting) {
        Preconditions.checkNotNull(quoting);
        return new NativeFormatOptions(m_naRep, m_floatFormat, m_decimal, m_dateFormat, quoting, m_quoteChar,
            m_separator);
    }

    /**
     * @param quoteChar the quote character
     * @return new options
     */
    public NativeFormatOptions withQuoteChar(final char quoteChar) {
        return new NativeFormatOptions(m_naRep, m_floatFormat, m_decimal, m_dateFormat, m_quoting, quoteChar,
            m_separator);
    }

    /**
     * @param separator the field separator, which forces quoting under {@link Quoting#MINIMAL}
     * @return new options
     */
    public NativeFormatOptions withSeparator(final char separator) {
        return new NativeFormatOptions(m_naRep, m_floatFormat, m_decimal, m_dateFormat, m_quoting, m_quoteChar,
            separator);
    }

    public String getNaRep() {
        return m_naRep;
    }

    public String getFloatFormat() {
        return m_floatFormat;
    }

    public char getDecimal() {
        return m_decimal;
    }

    public String getDateFormat() {
        return m_dateFormat;
    }

    public Quoting getQuoting() {
        return m_quoting;
    }

    public char getQuoteChar() {
        return m_quoteChar;
    }

    public char getSeparator() {
        return m_separator;
    }
}
