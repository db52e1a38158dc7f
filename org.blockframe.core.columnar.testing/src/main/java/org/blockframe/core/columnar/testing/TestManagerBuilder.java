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

import java.util.ArrayList;
import java.util.List;

import org.blockframe.core.columnar.block.Block;
import org.blockframe.core.columnar.block.BlockPlacement;
import org.blockframe.core.columnar.data.BlockValues;
import org.blockframe.core.columnar.index.Index;
import org.blockframe.core.columnar.index.Indexes;
import org.blockframe.core.columnar.manager.BlockManager;

/**
 * Builds {@link BlockManager managers} column by column for tests.
 *
 * <pre>
 * BlockManager manager = TestManagerBuilder.withRows(3) //
 *     .column("a", Columns.longs(1, 2, 3)) //
 *     .column("b", Columns.doubles(1.5, 2.5, 3.5)) //
 *     .build();
 * </pre>
 *
 * The builder takes over the references to the added values.
 */
@SuppressWarnings("javadoc")
public final class TestManagerBuilder {

    private final Index m_rows;

    private final List<Object> m_labels = new ArrayList<>();

    private final List<BlockValues> m_columns = new ArrayList<>();

    private TestManagerBuilder(final Index rows) {
        m_rows = rows;
    }

    public static TestManagerBuilder withRows(final int numRows) {
        return new TestManagerBuilder(Indexes.range(numRows));
    }

    public static TestManagerBuilder withRows(final Index rows) {
        return new TestManagerBuilder(rows);
    }

    public TestManagerBuilder column(final Object label, final BlockValues values) {
        m_labels.add(label);
        m_columns.add(values);
        return this;
    }

    /**
     * @return a consolidated manager
     */
    public BlockManager build() {
        try {
            return BlockManager.fromColumns(Indexes.of(m_labels), m_rows, m_columns);
        } finally {
            m_columns.forEach(BlockValues::release);
        }
    }

    /**
     * @return a manager holding one block per column, in column order
     */
    public BlockManager buildFragmented() {
        final List<Block> blocks = new ArrayList<>(m_columns.size());
        for (int i = 0; i < m_columns.size(); i++) {
            blocks.add(new Block(m_columns.get(i), BlockPlacement.of(i)));
        }
        return new BlockManager(blocks, Indexes.of(m_labels), m_rows);
    }
}
