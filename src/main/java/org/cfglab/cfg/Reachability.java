package org.cfglab.cfg;

import org.cfglab.ast.Statement;

import java.util.List;

/**
 * 从起点出发的可达性划分
 *
 * @param reachable   按 BFS 访问顺序排列的可达语句，第一个元素即起点
 * @param unreachable 其余所有顶点
 */
public record Reachability(List<Statement> reachable, List<Statement> unreachable) {

    public Reachability {
        reachable = List.copyOf(reachable);
        unreachable = List.copyOf(unreachable);
    }
}
