package org.cfglab.cfg;

import org.cfglab.ast.*;

import java.util.Iterator;

/**
 * 把语句树降低为控制流图的访问者
 * <p>
 * 每条赋值和返回语句对应一个顶点；语句块本身不产生顶点，只按顺序把前驱传给子语句。
 * return 之后的死代码仍然加入图中，但不会从可达部分连边过来，具体规则见 {@link Flow}。
 */
public class ControlFlowGraphBuilder implements StatementVisitor<Flow, Flow> {

    private final ControlFlowGraph cfg = new ControlFlowGraph();

    /**
     * 从根语句构建一张完整的控制流图，并把第一条产生顶点的语句设为起点
     *
     * @param root 语句树根节点（通常是方法体语句块）
     * @return 构建好的控制流图
     */
    public static ControlFlowGraph build(Statement root) {
        ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder();
        root.accept(builder, Flow.entry());

        ControlFlowGraph graph = builder.getGraph();
        Iterator<Statement> it = graph.vertices().iterator();
        if (it.hasNext()) {
            graph.setStart(it.next());
        }
        return graph;
    }

    @Override
    public Flow visit(Assignment node, Flow prev) {
        return addStatement(node, prev);
    }

    @Override
    public Flow visit(Return node, Flow prev) {
        return addStatement(node, prev);
    }

    @Override
    public Flow visit(Block node, Flow prev) {
        Flow current = prev == null ? Flow.entry() : prev;
        for (Statement child : node.statements) {
            Flow entered = current;
            current = child.accept(this, current);
            if (child instanceof Block) {
                current = current.leaveBlock(entered);
            }
        }
        return current;
    }

    private Flow addStatement(Statement node, Flow prev) {
        Flow from = prev == null ? Flow.entry() : prev;
        cfg.addVertex(node);
        if (from.connects()) {
            cfg.addEdge(from.last(), node);
        }
        return from.after(node);
    }

    public ControlFlowGraph getGraph() {
        return cfg;
    }
}
