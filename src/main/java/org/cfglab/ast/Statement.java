package org.cfglab.ast;

/**
 * 语句树节点（封闭的三种变体：赋值、返回、语句块）
 * <p>
 * 语句以引用身份区分，不重写 equals/hashCode：两条文本相同的语句在控制流图中是两个不同的顶点。
 */
public sealed interface Statement permits Assignment, Return, Block {

    /**
     * 双分派入口
     *
     * @param visitor 访问者
     * @param param   访问者携带的参数（例如前驱）
     * @return 访问者的返回值
     */
    <P, R> R accept(StatementVisitor<P, R> visitor, P param);

    /**
     * @return 语句类型名称，用于输出
     */
    default String kind() {
        return getClass().getSimpleName();
    }
}
