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

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Renders buffers as text.
 */
final class NativeFormatter {

    private static final DateTimeFormatter DEFAULT_DATE_TIME = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE).appendLiteral(' ').append(DateTimeFormatter.ISO_LOCAL_TIME)
        .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter DEFAULT_ZONED_DATE_TIME =
        new DateTimeFormatterBuilder().append(DEFAULT_DATE_TIME).appendOffsetId().toFormatter(Locale.ROOT);

    private NativeFormatter() {
    }

    static String[][] format(final BlockValues values, final NativeFormatOptions options) {
        final DateTimeFormatter dateFormat = options.getDateFormat() == null ? null
            : DateTimeFormatter.ofPattern(options.getDateFormat(), Locale.ROOT);
        final boolean quoteColumn = options.getQuoting() == Quoting.ALL
            || (options.getQuoting() == Quoting.NON_NUMERIC && !isNumeric(values.spec()));
        final String[][] result = new String[values.numColumns()][values.length()];
        for (int c = 0; c < values.numColumns(); c++) {
            for (int r = 0; r < values.length(); r++) {
                final String text =
                    values.isMissing(c, r) ? options.getNaRep() : render(values.get(c, r), options, dateFormat);
                result[c][r] = quoteColumn || (options.getQuoting() == Quoting.MINIMAL && needsQuotes(text, options))
                    ? quote(text, options.getQuoteChar()) : text;
            }
        }
        return result;
    }

    private static boolean isNumeric(final DataSpec spec) {
        final DataSpec storage = spec instanceof SparseDataSpec sparse ? sparse.subtype() : spec;
        return storage.kind().isNumeric();
    }

    private static String render(final Object value, final NativeFormatOptions options,
        final DateTimeFormatter dateFormat) {
        if (value instanceof Double d) {
            final String text = options.getFloatFormat() == null ? Double.toString(d)
                : String.format(Locale.ROOT, options.getFloatFormat(), d);
            return options.getDecimal() == '.' ? text : text.replace('.', options.getDecimal());
        }
        if (value instanceof TemporalAccessor temporal && dateFormat != null) {
            try {
                return dateFormat.format(temporal);
            } catch (DateTimeException ex) {
                throw new IllegalArgumentException(
                    String.format("Date format '%s' cannot render %s.", options.getDateFormat(), value), ex);
            }
        }
        return canonical(value);
    }

    /**
     * @param value a non-missing value
     * @return the canonical text of the value
     */
    static String canonical(final Object value) {
        if (value instanceof LocalDateTime dateTime) {
            return DEFAULT_DATE_TIME.format(dateTime);
        } else if (value instanceof ZonedDateTime zoned) {
            return DEFAULT_ZONED_DATE_TIME.format(zoned);
        }
        return String.valueOf(DataSpecs.normalize(value));
    }

    private static boolean needsQuotes(final String text, final NativeFormatOptions options) {
        return StringUtils.containsAny(text, options.getSeparator(), options.getQuoteChar(), '\n', '\r');
    }

    private static String quote(final String text, final char quoteChar) {
        final String q = String.valueOf(quoteChar);
        return StringUtils.wrap(StringUtils.replace(text, q, q + q), quoteChar);
    }
}
