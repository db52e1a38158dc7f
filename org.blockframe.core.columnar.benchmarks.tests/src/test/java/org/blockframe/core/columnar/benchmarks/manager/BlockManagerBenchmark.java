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
package org.blockframe.core.columnar.benchmarks.manager;

import java.util.concurrent.TimeUnit;

import org.blockframe.core.columnar.ComputeBackend;
import org.blockframe.core.columnar.benchmarks.BenchmarkUtils.MissingValues;
import org.blockframe.core.columnar.benchmarks.params.LayoutParam;
import org.blockframe.core.columnar.index.Index;
import org.blockframe.core.columnar.index.RangeIndex;
import org.blockframe.core.columnar.manager.BlockManager;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 1, time = 5, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 2, time = 5, timeUnit = TimeUnit.SECONDS)
@SuppressWarnings("javadoc")
public class BlockManagerBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {

        @Param({"10000", "1000000"})
        int numRows;

        @Param({"10", "100"})
        int numColumns;

        @Param
        LayoutParam layout;

        @Param({"NONE", "SOME"})
        MissingValues missingValues;

        @Param
        ComputeBackend backend;

        BlockManager manager;

        // every second row of the manager and as many new rows
        Index shiftedRows;

        @Setup(Level.Trial)
        public void setup() {
            manager = layout.createManager(numRows, numColumns, missingValues);
            shiftedRows = new RangeIndex(0, 2L * numRows, 2);
        }

        @TearDown(Level.Trial)
        public void tearDown() {
            manager.release();
        }
    }

    @State(Scope.Benchmark)
    public static class FreshCopyState extends BenchmarkState {

        BlockManager copy;

        @Setup(Level.Invocation)
        public void setupCopy() {
            copy = manager.copy(false);
        }

        @TearDown(Level.Invocation)
        public void tearDownCopy() {
            copy.release();
        }
    }

    @Benchmark
    public void reindexRows(final BenchmarkState state, final Blackhole bh) {
        final BlockManager reindexed = state.manager.reindex(state.shiftedRows, null, state.backend);
        bh.consume(reindexed.numBlocks());
        reindexed.release();
    }

    @Benchmark
    public void deepCopy(final BenchmarkState state, final Blackhole bh) {
        final BlockManager copy = state.manager.copy(true, state.backend);
        bh.consume(copy.numBlocks());
        copy.release();
    }

    @Benchmark
    public void consolidate(final FreshCopyState state, final Blackhole bh) {
        state.copy.consolidateInPlace();
        bh.consume(state.copy.numBlocks());
    }

    @Benchmark
    public void upcastOneValuePerColumn(final FreshCopyState state) {
        for (int c = 0; c < state.copy.numColumns(); c++) {
            state.copy.setValue(0, c, 0.5);
        }
    }
}
