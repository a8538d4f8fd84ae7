package org.cfglab;

import com.github.javaparser.ast.body.MethodDeclaration;
import org.cfglab.ast.Assignment;
import org.cfglab.ast.Block;
import org.cfglab.ast.Return;
import org.cfglab.ast.Statement;
import org.cfglab.cfg.ControlFlowGraph;
import org.cfglab.cfg.ControlFlowGraphBuilder;
import org.cfglab.cfg.Reachability;

import java.util.ArrayList;
import java.util.List;

/**
 * 方法分析器
 * <p>
 * 把方法体转换成语句树，构建控制流图，再计算可达性和强连通分量，结果汇总到 {@link CfgReport}。
 */
public class MethodAnalyzer {

    private CfgReport report;
    private int idCounter = 0;

    /**
     * 分析给定的方法声明
     *
     * @param md 要分析的方法声明
     * @return 分析报告；没有方法体（抽象方法、接口方法）时报告为空
     * @throws UnsupportedStatementException 方法体中含有不支持的语句
     */
    public CfgReport analyze(MethodDeclaration md) {
        if (md.getBody().isEmpty()) {
            CfgReport empty = new CfgReport();
            empty.method = md.getNameAsString();
            return empty;
        }
        return analyze(md.getNameAsString(), StatementLowering.lower(md.getBody().get()));
    }

    /**
     * 分析一棵已经构建好的语句树
     *
     * @param method 方法名
     * @param body   方法体
     */
    public CfgReport analyze(String method, Block body) {
        report = new CfgReport();
        report.method = method;
        idCounter = 0;

        // 先按源码顺序给语句编号，再构建 CFG
        collectStmtRecursive(body);
        ControlFlowGraph cfg = ControlFlowGraphBuilder.build(body);

        if (cfg.getStart() != null) {
            report.start = report.idOf(cfg.getStart());
        }
        for (StmtNode node : report.stmts) {
            report.cfgSucc.put(node.id, ids(cfg.neighbors(node.astNode)));
        }

        Reachability reachability = cfg.breadthFirstSearch();
        report.reachable = ids(reachability.reachable());
        report.unreachable = ids(reachability.unreachable());
        for (Statement s : reachability.reachable()) {
            report.stmts.get(report.idOf(s)).reachable = true;
        }

        for (List<Statement> component : cfg.findStronglyConnectedComponents()) {
            report.sccs.add(ids(component));
        }

        report.vertexCount = cfg.vertexCount();
        report.edgeCount = cfg.edgeCount();
        return report;
    }

    /**
     * 递归收集语句节点，语句块本身不建节点
     */
    private void collectStmtRecursive(Statement s) {
        if (s instanceof Block block) {
            for (Statement child : block.statements) {
                collectStmtRecursive(child);
            }
            return;
        }

        StmtNode node = new StmtNode();
        node.id = idCounter++;
        node.code = s.toString();
        node.kind = s.kind();
        node.astNode = s;
        if (s instanceof Assignment a) {
            node.lineStart = a.span.lineStart();
            node.lineEnd = a.span.lineEnd();
        } else if (s instanceof Return r) {
            node.lineStart = r.span.lineStart();
            node.lineEnd = r.span.lineEnd();
        }

        report.stmts.add(node);
        report.stmtIndex.put(s, node.id);
    }

    private List<Integer> ids(List<Statement> statements) {
        List<Integer> result = new ArrayList<>();
        for (Statement s : statements) {
            result.add(report.idOf(s));
        }
        return result;
    }
}
