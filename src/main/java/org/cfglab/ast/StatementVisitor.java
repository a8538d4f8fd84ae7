package org.cfglab.ast;

/**
 * 语句树访问者
 *
 * @param <P> 向下传递的参数类型
 * @param <R> 返回值类型
 */
public interface StatementVisitor<P, R> {

    R visit(Assignment node, P param);

    R visit(Return node, P param);

    R visit(Block node, P param);
}
