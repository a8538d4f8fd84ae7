package org.cfglab.graph;

import java.util.*;

/**
 * 基于邻接表的通用有向图
 * <p>
 * 顶点以 equals/hashCode 区分，每个顶点对应一个有序的出边集合（同一目标只保留一条边，允许自环）。
 * 顶点和出边都按插入顺序保存，因此未修改的图上遍历顺序是稳定的。
 * <p>
 * 该类不做任何同步：构建阶段只能由单线程修改；构建完成后，只读算法（DFS、SCC、转置）可以并发调用。
 * 所有遍历均使用显式栈实现，不依赖方法调用栈的深度。
 *
 * @param <V> 顶点类型
 */
public class DirectedGraph<V> {

    // 顶点 -> 出边邻居（有序、去重）
    protected final Map<V, Set<V>> adjacency = new LinkedHashMap<>();

    /**
     * 添加顶点
     *
     * @return 顶点原本不存在、本次新加入时返回 true
     */
    public boolean addVertex(V vertex) {
        Objects.requireNonNull(vertex, "vertex");
        if (adjacency.containsKey(vertex)) {
            return false;
        }
        adjacency.put(vertex, new LinkedHashSet<>());
        return true;
    }

    /**
     * 添加有向边 source -> destination
     *
     * @return 边已存在时返回 false
     * @throws VertexNotFoundException 任一端点不在图中
     */
    public boolean addEdge(V source, V destination) {
        requireVertex(source);
        requireVertex(destination);
        return adjacency.get(source).add(destination);
    }

    /**
     * 删除顶点以及所有以它为起点或终点的边
     *
     * @return 顶点不存在时返回 false
     */
    public boolean removeVertex(V vertex) {
        if (vertex == null || !adjacency.containsKey(vertex)) {
            return false;
        }
        for (Set<V> successors : adjacency.values()) {
            successors.remove(vertex);
        }
        adjacency.remove(vertex);
        return true;
    }

    /**
     * 删除有向边 source -> destination
     *
     * @return 边不存在时返回 false
     * @throws VertexNotFoundException 任一端点不在图中
     */
    public boolean removeEdge(V source, V destination) {
        requireVertex(source);
        requireVertex(destination);
        return adjacency.get(source).remove(destination);
    }

    /**
     * 判断边是否存在。起点不在图中时直接返回 false，不抛异常。
     */
    public boolean hasEdge(V source, V destination) {
        Set<V> successors = source == null ? null : adjacency.get(source);
        return successors != null && successors.contains(destination);
    }

    /**
     * @return vertex 的出边邻居（快照，按加边顺序）
     * @throws VertexNotFoundException vertex 不在图中
     */
    public List<V> neighbors(V vertex) {
        requireVertex(vertex);
        return new ArrayList<>(adjacency.get(vertex));
    }

    public boolean containsVertex(V vertex) {
        return vertex != null && adjacency.containsKey(vertex);
    }

    /**
     * @return 所有顶点的只读视图，可重复迭代
     */
    public Iterable<V> vertices() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public int vertexCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        int count = 0;
        for (Set<V> successors : adjacency.values()) {
            count += successors.size();
        }
        return count;
    }

    /**
     * 对整张图做深度优先遍历（忽略任何起点概念，逐个处理未访问的顶点）。
     * <p>
     * 顶点在其所有后继处理完毕时压栈，因此从返回的栈顶依次弹出即为完成时间由晚到早的顺序，
     * 可直接作为 Kosaraju 第二趟的处理顺序。每个顶点恰好出现一次。
     *
     * @return 完成顺序栈（栈顶为最后完成的顶点）
     */
    public Deque<V> depthFirstSearch() {
        Deque<V> finished = new ArrayDeque<>();
        Set<V> visited = new HashSet<>();

        for (V root : adjacency.keySet()) {
            if (!visited.add(root)) {
                continue;
            }
            Deque<Frame<V>> stack = new ArrayDeque<>();
            stack.push(new Frame<>(root, adjacency.get(root).iterator()));

            while (!stack.isEmpty()) {
                Frame<V> top = stack.peek();
                if (top.successors().hasNext()) {
                    V next = top.successors().next();
                    if (visited.add(next)) {
                        stack.push(new Frame<>(next, adjacency.get(next).iterator()));
                    }
                } else {
                    // 所有后继处理完毕
                    stack.pop();
                    finished.push(top.vertex());
                }
            }
        }
        return finished;
    }

    /**
     * 生成转置图：顶点集合相同，每条边 (u, v) 变为 (v, u)。原图不变。
     */
    public DirectedGraph<V> transpose() {
        DirectedGraph<V> reversed = new DirectedGraph<>();
        copyReversedInto(reversed);
        return reversed;
    }

    protected void copyReversedInto(DirectedGraph<V> target) {
        for (V vertex : adjacency.keySet()) {
            target.addVertex(vertex);
        }
        for (Map.Entry<V, Set<V>> entry : adjacency.entrySet()) {
            for (V successor : entry.getValue()) {
                target.addEdge(successor, entry.getKey());
            }
        }
    }

    /**
     * 用 Kosaraju 算法求强连通分量
     * <ol>
     *     <li>在原图上做完整 DFS，得到完成顺序栈</li>
     *     <li>求转置图</li>
     *     <li>按出栈顺序，在转置图上从每个尚未归类的顶点出发做 DFS，收集到的顶点构成一个分量</li>
     * </ol>
     * 每个顶点恰好属于一个分量；分量列表的顺序不作保证。
     *
     * @return 强连通分量列表
     */
    public List<List<V>> findStronglyConnectedComponents() {
        Deque<V> order = depthFirstSearch();
        DirectedGraph<V> transposed = transpose();

        Set<V> assigned = new HashSet<>();
        List<List<V>> components = new ArrayList<>();

        while (!order.isEmpty()) {
            V vertex = order.pop();
            if (!assigned.add(vertex)) {
                continue;
            }

            List<V> component = new ArrayList<>();
            Deque<V> stack = new ArrayDeque<>();
            stack.push(vertex);
            while (!stack.isEmpty()) {
                V current = stack.pop();
                component.add(current);
                for (V neighbor : transposed.adjacency.get(current)) {
                    if (assigned.add(neighbor)) {
                        stack.push(neighbor);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    protected void requireVertex(V vertex) {
        if (vertex == null || !adjacency.containsKey(vertex)) {
            throw new VertexNotFoundException(vertex);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Vertices: ").append(vertexCount())
                .append(" Edges: ").append(edgeCount());
        adjacency.forEach((vertex, successors) ->
                sb.append('\n').append("  ").append(vertex).append(" -> ").append(successors));
        return sb.toString();
    }

    // DFS 的显式栈帧：顶点 + 其尚未处理的后继迭代器
    private record Frame<V>(V vertex, Iterator<V> successors) {
    }
}
