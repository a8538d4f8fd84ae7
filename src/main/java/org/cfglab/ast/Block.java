package org.cfglab.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 语句块：按顺序持有子语句。自身不会成为控制流图的顶点。
 */
public final class Block implements Statement {

    public final List<Statement> statements;
    public final SourceSpan span;

    public Block(Statement... statements) {
        this(List.of(statements), SourceSpan.UNKNOWN);
    }

    public Block(List<Statement> statements, SourceSpan span) {
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.span = Objects.requireNonNull(span, "span");
    }

    @Override
    public <P, R> R accept(StatementVisitor<P, R> visitor, P param) {
        return visitor.visit(this, param);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{ ");
        for (Statement s : statements) {
            sb.append(s).append("; ");
        }
        return sb.append('}').toString();
    }
}
