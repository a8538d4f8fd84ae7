package org.cfglab;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * 源码解析与语法检查，所有 JavaParser 的配置集中在这里
 */
public class SyntaxValidator {

    /**
     * @return 解析源码使用的配置（Java 17 语法）
     */
    public static ParserConfiguration parserConfiguration() {
        return new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    /**
     * 解析一个编译单元
     *
     * @throws ParseProblemException 源码有语法错误
     */
    public static CompilationUnit parse(String code) {
        StaticJavaParser.setConfiguration(parserConfiguration());
        return StaticJavaParser.parse(code);
    }

    /**
     * 检查源码语法
     *
     * @param code 源代码字符串
     * @return 语法问题列表，格式为 "Line N: message"；为空表示语法正确
     */
    public static List<String> validate(String code) {
        // 空字符串直接视为错误
        if (code == null || code.trim().isEmpty()) {
            return List.of("Line -1: empty source");
        }

        try {
            parse(code);
            return List.of();
        } catch (ParseProblemException e) {
            return describe(e);
        }
    }

    /**
     * @return true = 语法正确; false = 语法错误（错误明细打印到 stderr）
     */
    public static boolean validateSyntax(String code) {
        List<String> problems = validate(code);
        if (problems.isEmpty()) {
            return true;
        }
        System.err.println("❌ [语法验证失败]");
        problems.forEach(p -> System.err.println("   -> " + p));
        return false;
    }

    /**
     * 把 JavaParser 收集的错误整理成带行号的文本
     */
    public static List<String> describe(ParseProblemException e) {
        List<String> problems = new ArrayList<>();
        e.getProblems().forEach(p -> {
            // TokenRange -> 开始 Token -> Range -> 行号，取不到时为 -1
            int line = p.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.line)
                    .orElse(-1);
            problems.add("Line " + line + ": " + p.getMessage());
        });
        return problems;
    }
}
