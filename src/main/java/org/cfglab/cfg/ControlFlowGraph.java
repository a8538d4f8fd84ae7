package org.cfglab.cfg;

import org.cfglab.ast.Statement;
import org.cfglab.graph.DirectedGraph;

import java.util.*;

/**
 * 控制流图：顶点为语句，外加一个独立保存的起点引用。
 * <p>
 * 起点不会自动注册为顶点；{@link #breadthFirstSearch()} 要求起点同时是图中的顶点。
 */
public class ControlFlowGraph extends DirectedGraph<Statement> {

    private Statement start;

    public ControlFlowGraph() {
        this(null);
    }

    public ControlFlowGraph(Statement start) {
        this.start = start;
    }

    public Statement getStart() {
        return start;
    }

    public void setStart(Statement start) {
        this.start = start;
    }

    /**
     * 从起点做广度优先遍历，把全部顶点划分为可达与不可达两部分。
     * 起点未设置时两部分都为空。
     *
     * @throws org.cfglab.graph.VertexNotFoundException 起点已设置但不是图中的顶点
     */
    public Reachability breadthFirstSearch() {
        if (start == null) {
            return new Reachability(List.of(), List.of());
        }

        List<Statement> reachable = new ArrayList<>();
        Set<Statement> visited = new HashSet<>();
        Deque<Statement> queue = new ArrayDeque<>();

        // neighbors 负责校验起点是否在图中
        List<Statement> first = neighbors(start);
        visited.add(start);
        reachable.add(start);
        enqueueUnvisited(first, visited, reachable, queue);

        while (!queue.isEmpty()) {
            Statement current = queue.poll();
            enqueueUnvisited(adjacency.get(current), visited, reachable, queue);
        }

        List<Statement> unreachable = new ArrayList<>();
        for (Statement vertex : vertices()) {
            if (!visited.contains(vertex)) {
                unreachable.add(vertex);
            }
        }
        return new Reachability(reachable, unreachable);
    }

    private static void enqueueUnvisited(Collection<Statement> successors, Set<Statement> visited,
                                         List<Statement> reachable, Deque<Statement> queue) {
        for (Statement next : successors) {
            if (visited.add(next)) {
                reachable.add(next);
                queue.offer(next);
            }
        }
    }

    /**
     * 转置后的控制流图，沿用同一个起点引用
     */
    @Override
    public ControlFlowGraph transpose() {
        ControlFlowGraph reversed = new ControlFlowGraph(start);
        copyReversedInto(reversed);
        return reversed;
    }
}
