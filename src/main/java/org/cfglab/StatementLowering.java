package org.cfglab;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import org.cfglab.ast.Assignment;
import org.cfglab.ast.Block;
import org.cfglab.ast.Return;
import org.cfglab.ast.SourceSpan;
import org.cfglab.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 JavaParser 的方法体转换成语句树
 * <p>
 * 只接受语言支持的语句：语句块、赋值（含带初始值的变量声明）、return 和空语句。
 * 其余语句抛出 {@link UnsupportedStatementException}。
 */
public class StatementLowering {

    /**
     * @param body 方法体
     * @return 对应的根语句块
     */
    public static Block lower(BlockStmt body) {
        return lowerBlock(body);
    }

    private static Block lowerBlock(BlockStmt block) {
        List<Statement> children = new ArrayList<>();
        for (com.github.javaparser.ast.stmt.Statement s : block.getStatements()) {
            lowerInto(s, children);
        }
        return new Block(children, spanOf(block));
    }

    /**
     * 转换一条语句，结果追加到 out（一条语句可能对应零条或多条）
     */
    private static void lowerInto(com.github.javaparser.ast.stmt.Statement s, List<Statement> out) {
        if (s.isBlockStmt()) {
            // 嵌套块保留为独立的 Block，由控制流图构建时折叠
            out.add(lowerBlock(s.asBlockStmt()));
        } else if (s.isReturnStmt()) {
            ReturnStmt rs = s.asReturnStmt();
            String value = rs.getExpression().map(Expression::toString).orElse("");
            out.add(new Return(value, spanOf(rs)));
        } else if (s.isEmptyStmt()) {
            // 空语句不产生节点
        } else if (s.isExpressionStmt()) {
            lowerExpression(s, s.asExpressionStmt().getExpression(), out);
        } else {
            throw new UnsupportedStatementException(s.getClass().getSimpleName(), lineOf(s));
        }
    }

    private static void lowerExpression(com.github.javaparser.ast.stmt.Statement owner, Expression expr,
                                        List<Statement> out) {
        if (expr instanceof AssignExpr assign) {
            out.add(new Assignment(assign.getTarget().toString(),
                    assign.getOperator().asString(),
                    assign.getValue().toString(),
                    spanOf(owner)));
            return;
        }

        if (expr instanceof VariableDeclarationExpr decl) {
            // 多个声明符时，每个带初始值的声明符各成一条赋值
            boolean single = decl.getVariables().size() == 1;
            for (VariableDeclarator vd : decl.getVariables()) {
                if (vd.getInitializer().isEmpty()) {
                    continue;
                }
                SourceSpan span = single ? spanOf(owner) : spanOf(vd);
                out.add(new Assignment(vd.getNameAsString(), "=",
                        vd.getInitializer().get().toString(), span));
            }
            return;
        }

        throw new UnsupportedStatementException(
                "ExpressionStmt(" + expr.getClass().getSimpleName() + ")", lineOf(owner));
    }

    private static SourceSpan spanOf(Node node) {
        return new SourceSpan(node.toString(),
                node.getBegin().map(p -> p.line).orElse(-1),
                node.getEnd().map(p -> p.line).orElse(-1));
    }

    private static int lineOf(Node node) {
        return node.getBegin().map(p -> p.line).orElse(-1);
    }
}
