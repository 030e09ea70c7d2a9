package io.github.eutro.spv2sl.passes.meta;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.MetadataState;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.BasicBlock;
import io.github.eutro.spv2sl.ssa.Function;
import io.github.eutro.spv2sl.util.GraphWalker;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/

/**
 * Computes {@link CommonExts#IDOM} for every block reachable from the entry.
 * Unreachable blocks are left without an immediate dominator.
 */
public class ComputeDoms implements InPlaceIRPass<Function> {
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Function function) {
        List<BasicBlock> reachable = GraphWalker.blockWalker(function).preOrder().toList();
        for (BasicBlock block : function.blocks) {
            block.removeExt(CommonExts.IDOM);
        }
        new Runner(reachable).run();

        MetadataState ms = function.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.DOMS);
    }

    /**
     * Check whether {@code a} dominates {@code b}. Every block dominates itself.
     *
     * @param a The potential dominator.
     * @param b The block.
     * @return Whether every path from the entry to {@code b} passes through {@code a}.
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        @Nullable BasicBlock cursor = b;
        while (cursor != null) {
            if (cursor == a) return true;
            cursor = cursor.getNullable(CommonExts.IDOM);
        }
        return false;
    }

    private static class Runner {
        final List<BasicBlock> blocks;
        final Map<BasicBlock, Integer> index = new HashMap<>();
        int n;
        final int[][] succ;
        final int[] dom;
        final int[] parent;
        final int[] ancestor;
        final int[] child;
        final int[] vertex;
        final int[] label;
        final int[] semi;
        final int[] size;
        final List<Set<Integer>> pred = new ArrayList<>();
        final List<Set<Integer>> bucket = new ArrayList<>();

        Runner(List<BasicBlock> blocks) {
            this.blocks = blocks;
            n = blocks.size();
            succ = new int[n + 1][];
            dom = new int[n + 1];
            parent = new int[n + 1];
            ancestor = new int[n + 1];
            child = new int[n + 1];
            vertex = new int[n + 1];
            label = new int[n + 1];
            semi = new int[n + 1];
            size = new int[n + 1];
        }

        void dfs(int root) {
            // iterative, since shader functions can be long chains of blocks
            Deque<int[]> stack = new ArrayDeque<>();
            visit(root);
            stack.push(new int[]{root, 0});
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int v = frame[0];
                if (frame[1] == succ[v].length) {
                    stack.pop();
                    continue;
                }
                int w = succ[v][frame[1]++];
                if (semi[w] == 0) {
                    parent[w] = v;
                    visit(w);
                    stack.push(new int[]{w, 0});
                }
                pred.get(w).add(v);
            }
        }

        void visit(int v) {
            semi[v] = ++n;
            vertex[n] = label[v] = v;
            ancestor[v] = child[v] = 0;
            size[v] = 1;
        }

        void compress(int v) {
            if (ancestor[ancestor[v]] != 0) {
                compress(ancestor[v]);
                if (semi[label[ancestor[v]]] < semi[label[v]]) {
                    label[v] = label[ancestor[v]];
                }
                ancestor[v] = ancestor[ancestor[v]];
            }
        }

        int eval(int v) {
            if (ancestor[v] == 0) {
                return label[v];
            } else {
                compress(v);
                return semi[label[ancestor[v]]] >= semi[label[v]]
                        ? label[v]
                        : label[ancestor[v]];
            }
        }

        void link(int v, int w) {
            int s = w;
            while (semi[label[w]] < semi[label[child[s]]]) {
                if (size[s] + size[child[child[s]]] >= 2 * size[child[s]]) {
                    ancestor[child[s]] = s;
                    child[s] = child[child[s]];
                } else {
                    size[child[s]] = size[s];
                    s = ancestor[s] = child[s];
                }
            }
            label[s] = label[w];
            size[v] += size[w];
            if (size[v] < 2 * size[w]) {
                int t = s;
                s = child[v];
                child[v] = t;
            }
            while (s != 0) {
                ancestor[s] = v;
                s = child[s];
            }
        }

        void run() {
            if (n == 0) return;
            for (int i = 0; i < n; i++) {
                index.put(blocks.get(i), i + 1);
            }
            for (BasicBlock block : blocks) {
                int i = index.get(block);
                List<BasicBlock> targets = block.getControl().targets;
                succ[i] = new int[targets.size()];
                for (int j = 0; j < succ[i].length; j++) {
                    succ[i][j] = index.get(targets.get(j));
                }
            }

            pred.add(null);
            bucket.add(null);
            for (int v = 1; v <= n; ++v) {
                pred.add(new HashSet<>());
                bucket.add(new HashSet<>());
                semi[v] = 0;
            }
            n = 0;
            dfs(1);
            size[0] = label[0] = semi[0] = 0;
            int u, w;
            for (int i = n; i >= 2; i--) {
                w = vertex[i];
                for (int v : pred.get(w)) {
                    u = eval(v);
                    if (semi[u] < semi[w]) {
                        semi[w] = semi[u];
                    }
                }
                bucket.get(vertex[semi[w]]).add(w);
                link(parent[w], w);
                for (int v : bucket.get(parent[w])) {
                    u = eval(v);
                    dom[v] = semi[u] < semi[v] ? u : parent[w];
                }
                bucket.get(parent[w]).clear();
            }
            for (int i = 2; i <= n; ++i) {
                w = vertex[i];
                if (dom[w] != vertex[semi[w]]) {
                    dom[w] = dom[dom[w]];
                }
            }
            dom[1] = 0;

            for (int i = 1; i < blocks.size(); i++) {
                blocks.get(i).attachExt(CommonExts.IDOM, blocks.get(dom[i + 1] - 1));
            }
        }
    }
}
