package org.cfglab.ast;

import java.util.Objects;

/**
 * 赋值语句 {@code target = value}
 */
public final class Assignment implements Statement {

    public final String target;     // 被赋值的变量
    public final String operator;   // 赋值运算符，例如 "=" 或 "+="
    public final String value;      // 右侧表达式源码
    public final SourceSpan span;

    public Assignment(String target, String value) {
        this(target, "=", value, SourceSpan.UNKNOWN);
    }

    public Assignment(String target, String operator, String value, SourceSpan span) {
        this.target = Objects.requireNonNull(target, "target");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
        this.span = Objects.requireNonNull(span, "span");
    }

    @Override
    public <P, R> R accept(StatementVisitor<P, R> visitor, P param) {
        return visitor.visit(this, param);
    }

    @Override
    public String toString() {
        if (span.code() != null) {
            return span.code();
        }
        return target + " " + operator + " " + value;
    }
}
