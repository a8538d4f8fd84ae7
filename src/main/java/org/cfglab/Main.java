package org.cfglab;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 读取一个 Java 文件，对其中的每个方法：
 * - 转换为语句树
 * - 构建 CFG，计算可达性与强连通分量
 * - 输出 JSON
 */
public class Main {

    public static void main(String[] args) throws IOException {
        // 要分析的 Java 文件路径（默认用示例文件）
        Path file = Path.of(args.length > 0 ? args[0] : "src/test/resources/Sample.java");
        String source = Files.readString(file);

        int status = run(source, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return 进程退出码：0 成功，1 有语法错误或不支持的语句
     */
    static int run(String source, PrintStream out, PrintStream err) {
        CompilationUnit cu;
        try {
            cu = SyntaxValidator.parse(source);
        } catch (ParseProblemException e) {
            err.println("❌ [语法验证失败]");
            SyntaxValidator.describe(e).forEach(p -> err.println("   -> " + p));
            return 1;
        }

        Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .create();

        int status = 0;
        for (MethodDeclaration md : cu.findAll(MethodDeclaration.class)) {
            out.println("===== Method: " + md.getNameAsString() + " =====");
            try {
                CfgReport report = new MethodAnalyzer().analyze(md);
                out.println(gson.toJson(report));
            } catch (UnsupportedStatementException e) {
                // 单个方法失败不影响其余方法
                err.println("❌ [" + md.getNameAsString() + "] " + e.getMessage());
                status = 1;
            }
        }
        return status;
    }
}
