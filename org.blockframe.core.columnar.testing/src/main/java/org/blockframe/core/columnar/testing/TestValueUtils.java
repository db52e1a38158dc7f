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
package org.blockframe.core.columnar.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.blockframe.core.columnar.data.BlockValues;
import org.blockframe.core.columnar.data.Columns;
import org.blockframe.core.columnar.data.DataSpec;
import org.blockframe.core.columnar.manager.BlockManager;

/**
 * Assertions and generators for buffers and managers.
 */
@SuppressWarnings("javadoc")
public final class TestValueUtils {

    private TestValueUtils() {
    }

    /**
     * Asserts the values of a single-column buffer. {@code null} in the expected values stands for a missing value.
     */
    public static void assertValues(final BlockValues values, final Object... expected) {
        assertColumn(values, 0, expected);
    }

    public static void assertColumn(final BlockValues values, final int column, final Object... expected) {
        assertEquals(expected.length, values.length(), "Unexpected number of rows.");
        for (int r = 0; r < expected.length; r++) {
            if (expected[r] == null) {
                assertTrue(values.isMissing(column, r), "Row " + r + " should be missing.");
            } else {
                assertFalse(values.isMissing(column, r), "Row " + r + " should not be missing.");
                assertEquals(expected[r], values.get(column, r), "Unexpected value in row " + r + ".");
            }
        }
    }

    /**
     * Asserts the values of the column at the given position of a manager.
     */
    public static void assertColumn(final BlockManager manager, final int position, final Object... expected) {
        final BlockValues column = manager.iget(position);
        try {
            assertValues(column, expected);
        } finally {
            column.release();
        }
    }

    public static void assertSpec(final BlockManager manager, final int position, final DataSpec expected) {
        assertEquals(expected, manager.specs().get(position), "Unexpected type of column " + position + ".");
    }

    /**
     * Asserts that the manager is intact and that its labels match its blocks.
     */
    public static void assertIntact(final BlockManager manager) {
        manager.verifyIntegrity();
        assertEquals(manager.numColumns(), manager.specs().size());
    }

    /**
     * @return a float64 column of random values, where roughly every tenth value is missing
     */
    public static BlockValues randomDoubles(final Random random, final int length) {
        final double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = random.nextInt(10) == 0 ? Double.NaN : random.nextDouble();
        }
        return Columns.doubles(values);
    }

    public static BlockValues randomLongs(final Random random, final int length) {
        final long[] values = new long[length];
        for (int i = 0; i < length; i++) {
            values[i] = random.nextLong();
        }
        return Columns.longs(values);
    }
}
