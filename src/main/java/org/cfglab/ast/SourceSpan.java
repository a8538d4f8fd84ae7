package org.cfglab.ast;

/**
 * 语句在源码中的位置与原文
 *
 * @param code      语句源码
 * @param lineStart 起始行号，未知时为 -1
 * @param lineEnd   结束行号，未知时为 -1
 */
public record SourceSpan(String code, int lineStart, int lineEnd) {

    public static final SourceSpan UNKNOWN = new SourceSpan(null, -1, -1);
}
