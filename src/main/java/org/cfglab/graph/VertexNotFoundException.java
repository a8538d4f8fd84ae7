package org.cfglab.graph;

/**
 * 引用了图中不存在的顶点时抛出（addEdge / removeEdge / neighbors）。
 */
public class VertexNotFoundException extends IllegalArgumentException {

    private final transient Object vertex;

    public VertexNotFoundException(Object vertex) {
        super("Vertex " + vertex + " not found in graph");
        this.vertex = vertex;
    }

    /**
     * @return 缺失的顶点
     */
    public Object getVertex() {
        return vertex;
    }
}
