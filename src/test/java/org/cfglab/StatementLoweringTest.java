package org.cfglab;

import com.github.javaparser.StaticJavaParser;
import org.cfglab.ast.Assignment;
import org.cfglab.ast.Block;
import org.cfglab.ast.Return;
import org.junit.Test;

import static org.junit.Assert.*;

public class StatementLoweringTest {

    private static Block lower(String body) {
        return StatementLowering.lower(StaticJavaParser.parseBlock(body));
    }

    @Test
    public void assignmentsAndReturn() {
        Block block = lower("{\n  int x = 10;\n  x += 2;\n  return x;\n}");

        assertEquals(3, block.statements.size());

        Assignment decl = (Assignment) block.statements.get(0);
        assertEquals("x", decl.target);
        assertEquals("=", decl.operator);
        assertEquals("10", decl.value);
        assertEquals(2, decl.span.lineStart());
        assertEquals("int x = 10;", decl.toString());

        Assignment compound = (Assignment) block.statements.get(1);
        assertEquals("+=", compound.operator);
        assertEquals("2", compound.value);

        Return ret = (Return) block.statements.get(2);
        assertEquals("x", ret.value);
        assertEquals(4, ret.span.lineStart());
    }

    @Test
    public void nestedBlocksArePreserved() {
        Block block = lower("{ x = 1; { y = 2; { } } ; }");

        assertEquals(2, block.statements.size());
        Block inner = (Block) block.statements.get(1);
        assertEquals(2, inner.statements.size());
        assertTrue(inner.statements.get(1) instanceof Block);
        assertTrue(((Block) inner.statements.get(1)).statements.isEmpty());
    }

    @Test
    public void declaratorsWithoutInitializerAreSkipped() {
        Block block = lower("{ int a, b = 2, c = 3; }");

        assertEquals(2, block.statements.size());
        assertEquals("b", ((Assignment) block.statements.get(0)).target);
        assertEquals("c", ((Assignment) block.statements.get(1)).target);
    }

    @Test
    public void bareReturnHasEmptyValue() {
        Block block = lower("{ return; }");
        Return ret = (Return) block.statements.get(0);
        assertEquals("", ret.value);
    }

    @Test
    public void loopsAreRejected() {
        try {
            lower("{\n  x = 1;\n  while (x < 3) { x = x + 1; }\n}");
            fail("expected UnsupportedStatementException");
        } catch (UnsupportedStatementException e) {
            assertEquals("WhileStmt", e.getKind());
            assertEquals(3, e.getLine());
        }
    }

    @Test
    public void conditionalsAreRejected() {
        try {
            lower("{ if (x > 0) { return 1; } }");
            fail("expected UnsupportedStatementException");
        } catch (UnsupportedStatementException e) {
            assertEquals("IfStmt", e.getKind());
        }
    }

    @Test(expected = UnsupportedStatementException.class)
    public void methodCallsAreRejected() {
        lower("{ foo(); }");
    }
}
