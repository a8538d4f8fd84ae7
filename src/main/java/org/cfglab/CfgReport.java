package org.cfglab;

import org.cfglab.ast.Statement;

import java.util.*;

/**
 * 一个方法的分析结果：语句节点 + CFG + 可达性 + 强连通分量
 */
public class CfgReport {
    public String method;

    // 按源码顺序收集的语句列表
    public List<StmtNode> stmts = new ArrayList<>();

    // 入口语句 id，方法体为空时为 -1
    public int start = -1;

    // CFG：控制流后继边  id -> 后继 id 列表
    public Map<Integer, List<Integer>> cfgSucc = new LinkedHashMap<>();

    // BFS 可达 / 不可达语句 id
    public List<Integer> reachable = new ArrayList<>();
    public List<Integer> unreachable = new ArrayList<>();

    // 强连通分量，每个分量是一组语句 id
    public List<List<Integer>> sccs = new ArrayList<>();

    public int vertexCount;
    public int edgeCount;

    // 语句到 id 的映射（内部使用，不输出 JSON）
    public transient Map<Statement, Integer> stmtIndex = new IdentityHashMap<>();

    /**
     * @return 语句对应的 id
     */
    public int idOf(Statement s) {
        Integer id = stmtIndex.get(s);
        if (id == null) {
            throw new IllegalArgumentException("Statement not part of this report: " + s);
        }
        return id;
    }
}
