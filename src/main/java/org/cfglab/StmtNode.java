package org.cfglab;

import org.cfglab.ast.Statement;

/**
 * 报告中的一条语句（控制流图中的一个顶点）
 */
public class StmtNode {
    public int id;              // 语句在方法内的编号
    public String code;         // 语句源码
    public String kind;         // Assignment 或 Return
    public int lineStart;       // 起始行号
    public int lineEnd;         // 结束行号
    public boolean reachable;   // 是否可从入口语句到达

    // 语句树节点引用（不参与 JSON 序列化）
    public transient Statement astNode;
}
