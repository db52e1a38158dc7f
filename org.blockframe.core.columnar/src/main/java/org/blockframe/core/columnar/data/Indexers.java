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

/**
 * Validation of positional indexers. An indexer maps every result position to a source position.
 */
public final class Indexers {

    /** The source position of a result position that has no source. */
    public static final int MISSING = -1;

    private Indexers() {
    }

    /**
     * Validates an indexer and resolves negative positions.
     *
     * <ul>
     * <li>without fill, positions in {@code [-n, n)} are valid and negative positions count from the end</li>
     * <li>with fill, positions in {@code [-1, n)} are valid and {@code -1} is kept as {@link #MISSING}</li>
     * </ul>
     *
     * @param indexer the positions
     * @param n the number of source positions
     * @param allowFill whether {@code -1} denotes a missing source
     * @return the resolved positions (a new array if any position was resolved)
     * @throws IndexOutOfBoundsException if a position is out of range
     */
    public static int[] validate(final int[] indexer, final int n, final boolean allowFill) {
        int[] result = indexer;
        for (int i = 0; i < indexer.length; i++) {
            final int pos = indexer[i];
            if (pos >= n || pos < (allowFill ? MISSING : -n)) {
                throw new IndexOutOfBoundsException(
                    String.format("Position %d is out of bounds for length %d.", pos, n));
            }
            if (pos < 0 && !allowFill) {
                if (result == indexer) {
                    result = indexer.clone();
                }
                result[i] = pos + n;
            }
        }
        return result;
    }

    /**
     * @param positions validated positions
     * @return true if any position is {@link #MISSING}
     */
    public static boolean containsMissing(final int[] positions) {
        for (final int pos : positions) {
            if (pos == MISSING) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param n a length
     * @return the positions {@code 0, ..., n - 1}
     */
    public static int[] identity(final int n) {
        final int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = i;
        }
        return result;
    }
}
