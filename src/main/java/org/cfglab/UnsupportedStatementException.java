package org.cfglab;

/**
 * 方法体中出现了语言不支持的语句（循环、条件、方法调用等）
 */
public class UnsupportedStatementException extends RuntimeException {

    private final String kind;
    private final int line;

    public UnsupportedStatementException(String kind, int line) {
        super("Unsupported statement " + kind + " at line " + line);
        this.kind = kind;
        this.line = line;
    }

    public String getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }
}
