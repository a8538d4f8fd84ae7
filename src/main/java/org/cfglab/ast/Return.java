package org.cfglab.ast;

import java.util.Objects;

/**
 * 返回语句。控制流在此终止。
 */
public final class Return implements Statement {

    public final String value;      // 返回值表达式源码，没有返回值时为空串
    public final SourceSpan span;

    public Return(String value) {
        this(value, SourceSpan.UNKNOWN);
    }

    public Return(String value, SourceSpan span) {
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
        return value.isEmpty() ? "return" : "return " + value;
    }
}
