package com.github.musiKk.minic.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.minic.Tokenizer;
import com.github.musiKk.minic.parser.Parser;

public class CodeGeneratorTest {

    private static String generate(String code) {
        var tokens = new Tokenizer().tokenize(code);
        var compilationUnit = new Parser().parseCompilationUnit(tokens);
        return new CodeGenerator().generate(compilationUnit);
    }

    private static List<String> instructionsOf(String code, String method) {
        var generated = generate(code);
        StackSimulator.verify(generated);
        return StackSimulator.method(generated, method).instructions();
    }

    @Test
    public void testDeclarationWithArithmetic() {
        var instructions = instructionsOf("void f() { int x = 1 + 2; }", "f");
        assertEquals(List.of("ldc.i4 1", "ldc.i4 2", "add", "stloc 0", "ret"), instructions);
    }

    @Test
    public void testIfElseUsesTwoLabels() {
        var method = StackSimulator.method(
                generate("void f(bool a, int b, int c) { if (a) { b; } else { c; } }"), "f");
        StackSimulator.verify(method);

        var labels = method.labels();
        assertEquals(2, labels.size());
        assertEquals(2, labels.stream().distinct().count());
        assertEquals(List.of(
                "ldarg 0",
                "brfalse " + labels.get(0),
                "ldarg 1",
                "pop",
                "br " + labels.get(1),
                "ldarg 2",
                "pop",
                "ret"), method.instructions());
    }

    @Test
    public void testIfWithoutElseUsesOneLabel() {
        var method = StackSimulator.method(generate("void f(bool a) { if (a) { a = false; } }"), "f");
        assertEquals(List.of("IL_0001"), method.labels());
        assertEquals(List.of("ldarg 0", "brfalse IL_0001", "ldc.i4 0", "starg 0", "ret"), method.instructions());
    }

    @Test
    public void testWhileLowering() {
        var method = StackSimulator.method(generate("void f(int n) { while (n > 0) { n = n - 1; } }"), "f");
        assertEquals(List.of("IL_0001:", "ldarg 0", "ldc.i4 0", "cgt", "brfalse IL_0002",
                "ldarg 0", "ldc.i4 1", "sub", "starg 0", "br IL_0001", "IL_0002:", "ret"), method.lines().subList(1, method.lines().size()));
    }

    @Test
    public void testForLowering() {
        var instructions = instructionsOf("int f() { int s = 0; for (int i = 0; i < 3; i++) { s = s + i; } return s; }", "f");
        assertEquals(List.of(
                "ldc.i4 0", "stloc 0",
                "ldc.i4 0", "stloc 1",
                "ldloc 1", "ldc.i4 3", "clt", "brfalse IL_0002",
                "ldloc 0", "ldloc 1", "add", "stloc 0",
                "ldloc 1", "ldc.i4 1", "add", "stloc 1",
                "br IL_0001",
                "ldloc 0", "ret"), instructions);
    }

    @Test
    public void testDoWhileBranchesBackWhenTrue() {
        var instructions = instructionsOf("void f(int n) { do { n--; } while (n > 0); }", "f");
        assertEquals(List.of("ldarg 0", "ldc.i4 1", "sub", "starg 0",
                "ldarg 0", "ldc.i4 0", "cgt", "brtrue IL_0001", "ret"), instructions);
    }

    private static Object[][] operators() {
        return new Object[][] {
            { "a + b", List.of("add") },
            { "a - b", List.of("sub") },
            { "a * b", List.of("mul") },
            { "a / b", List.of("div") },
            { "a % b", List.of("rem") },
            { "a == b", List.of("ceq") },
            { "a < b", List.of("clt") },
            { "a > b", List.of("cgt") },
            { "a != b", List.of("ceq", "ldc.i4 0", "ceq") },
            { "a <= b", List.of("cgt", "ldc.i4 0", "ceq") },
            { "a >= b", List.of("clt", "ldc.i4 0", "ceq") },
        };
    }

    @ParameterizedTest
    @MethodSource("operators")
    public void testBinaryOperator(String expression, List<String> expected) {
        var instructions = instructionsOf("int f(int a, int b) { return " + expression + "; }", "f");
        assertEquals(List.of("ldarg 0", "ldarg 1"), instructions.subList(0, 2));
        assertEquals(expected, instructions.subList(2, instructions.size() - 1));
    }

    @Test
    public void testLogicalAndUnaryOperators() {
        assertEquals(List.of("ldarg 0", "ldarg 1", "and", "ret"),
                instructionsOf("bool f(bool a, bool b) { return a && b; }", "f"));
        assertEquals(List.of("ldarg 0", "ldarg 1", "or", "ret"),
                instructionsOf("bool f(bool a, bool b) { return a || b; }", "f"));
        assertEquals(List.of("ldarg 0", "ldc.i4 0", "ceq", "ret"),
                instructionsOf("bool f(bool a) { return !a; }", "f"));
        assertEquals(List.of("ldarg 0", "neg", "ret"),
                instructionsOf("int f(int a) { return -a; }", "f"));
    }

    @Test
    public void testAssignmentValueIsDuplicatedOnlyWhenUsed() {
        assertEquals(List.of("ldc.i4 3", "stloc 0", "ret"),
                instructionsOf("void f() { int a; a = 3; }", "f"));
        assertEquals(List.of("ldc.i4 3", "dup", "stloc 0", "stloc 1", "ret"),
                instructionsOf("void f() { int a; int b = a = 3; }", "f"));
    }

    @Test
    public void testExpressionStatementResultIsPopped() {
        var code = "int one() { return 1; } void nothing() { } void f() { one(); nothing(); }";
        assertEquals(List.of(
                "call int32 generated_code::one()", "pop",
                "call void generated_code::nothing()",
                "ret"), instructionsOf(code, "f"));
    }

    @Test
    public void testCallPassesArgumentsInOrder() {
        var code = "int add(int a, int b) { return a + b; } int main() { return add(1, 2); }";
        assertEquals(List.of("ldc.i4 1", "ldc.i4 2", "call int32 generated_code::add(int32, int32)", "ret"),
                instructionsOf(code, "main"));
    }

    @Test
    public void testGlobalsLiveInStaticFields() {
        var generated = generate("int g = 4; int main() { g++; return g; }");
        StackSimulator.verify(generated);

        assertTrue(generated.contains(".field public static int32 g"));
        assertEquals(List.of("ldc.i4 4", "stsfld int32 generated_code::g", "ret"),
                StackSimulator.method(generated, ".cctor").instructions());
        assertEquals(List.of(
                "ldsfld int32 generated_code::g", "ldc.i4 1", "add", "stsfld int32 generated_code::g",
                "ldsfld int32 generated_code::g", "ret"), StackSimulator.method(generated, "main").instructions());
    }

    @Test
    public void testNoTypeInitializerWithoutTopLevelCode() {
        var generated = generate("int main() { return 0; }");
        assertFalse(generated.contains(".cctor"));
    }

    @Test
    public void testMethodHeaderAndDirectives() {
        var generated = generate("int main() { int a = 1; char c = 'x'; return a; }");
        var main = StackSimulator.method(generated, "main");
        assertEquals(".method public static int32 main() cil managed", main.header());
        assertEquals(List.of(".entrypoint", ".maxstack 1", ".locals init (int32 V_0, char V_1)"), main.lines().subList(0, 3));
        assertTrue(generated.contains(".assembly generated_code {}"));
        assertTrue(generated.contains(".class public abstract sealed auto ansi generated_code"));
    }

    @Test
    public void testCustomAssemblyName() {
        var compilationUnit = new Parser().parseCompilationUnit(new Tokenizer().tokenize("int g; int main() { return g; }"));
        var generated = new CodeGenerator("demo").generate(compilationUnit);
        assertTrue(generated.contains(".assembly demo {}"));
        assertTrue(generated.contains("ldsfld int32 demo::g"));
    }

    @Test
    public void testVoidFunctionGetsImplicitReturn() {
        assertEquals(List.of("ret"), instructionsOf("void f() { }", "f"));
        assertEquals(List.of("ret"), instructionsOf("void f() { return; }", "f"));
    }

    @Test
    public void testArrays() {
        var instructions = instructionsOf("int f() { int a[2] = {7, 8}; a[1] = 9; return a[0]; }", "f");
        assertEquals(List.of(
                "ldc.i4 2", "newarr int32", "stloc 0",
                "ldloc 0", "ldc.i4 0", "ldc.i4 7", "stelem.i4",
                "ldloc 0", "ldc.i4 1", "ldc.i4 8", "stelem.i4",
                "ldloc 0", "ldc.i4 1", "ldc.i4 9", "stelem.i4",
                "ldloc 0", "ldc.i4 0", "ldelem.i4", "ret"), instructions);
    }

    @Test
    public void testArrayAssignmentAsValueUsesTemporary() {
        var generated = generate("int f() { char s[1]; int i = s[0] = 'q'; return i; }");
        StackSimulator.verify(generated);
        var f = StackSimulator.method(generated, "f");
        assertTrue(f.lines().contains(".locals init (char[] V_0, char V_1, int32 V_2)"));
        assertEquals(List.of(
                "ldc.i4 1", "newarr char", "stloc 0",
                "ldloc 0", "ldc.i4 0", "ldc.i4 113", "dup", "stloc 1", "stelem.i2", "ldloc 1", "stloc 2",
                "ldloc 2", "ret"), f.instructions());
    }

    @Test
    public void testConsoleInputAndOutput() {
        var instructions = instructionsOf(
                "void f() { int n; bool b; char c; cin >> n; cin >> b; cin >> c; cout << n << \"!\" << c << b << abs(n) << endl; }", "f");
        assertEquals(List.of(
                "call string [mscorlib]System.Console::ReadLine()",
                "call int32 [mscorlib]System.Int32::Parse(string)",
                "stloc 0",
                "call string [mscorlib]System.Console::ReadLine()",
                "call bool [mscorlib]System.Boolean::Parse(string)",
                "stloc 1",
                "call int32 [mscorlib]System.Console::Read()",
                "conv.u2",
                "stloc 2",
                "ldloc 0", "call void [mscorlib]System.Console::Write(int32)",
                "ldstr \"!\"", "call void [mscorlib]System.Console::Write(string)",
                "ldloc 2", "call void [mscorlib]System.Console::Write(char)",
                "ldloc 1", "call void [mscorlib]System.Console::Write(bool)",
                "ldloc 0", "call int32 [mscorlib]System.Math::Abs(int32)",
                "call void [mscorlib]System.Console::Write(int32)",
                "call void [mscorlib]System.Console::WriteLine()",
                "ret"), instructions);
    }

    @Test
    public void testShadowedLocalsGetOwnSlots() {
        var instructions = instructionsOf("int f() { int x = 1; { int x = 2; x = 3; } return x; }", "f");
        assertEquals(List.of("ldc.i4 1", "stloc 0", "ldc.i4 2", "stloc 1", "ldc.i4 3", "stloc 1", "ldloc 0", "ret"),
                instructions);
    }

    @Test
    public void testTopLevelStatementsRunInTypeInitializer() {
        var generated = generate("int n = 2; void show() { cout << n; } show();");
        StackSimulator.verify(generated);
        assertEquals(List.of("ldc.i4 2", "stsfld int32 generated_code::n", "call void generated_code::show()", "ret"),
                StackSimulator.method(generated, ".cctor").instructions());
    }

    @Test
    public void testIntStoredAsBoolIsNormalized() {
        assertEquals(List.of("ldc.i4 2", "ldc.i4 0", "cgt.un", "stloc 0", "ret"),
                instructionsOf("void f() { bool a = 2; }", "f"));
        assertEquals(List.of("ldc.i4 7", "ldc.i4 0", "cgt.un", "starg 0", "ret"),
                instructionsOf("void f(bool a) { a = 7; }", "f"));
        assertEquals(List.of(
                "ldc.i4 1", "newarr bool", "stloc 0",
                "ldloc 0", "ldc.i4 0", "ldc.i4 5", "ldc.i4 0", "cgt.un", "stelem.i1", "ret"),
                instructionsOf("void f() { bool a[1]; a[0] = 5; }", "f"));
    }

    @Test
    public void testBoolStoredAsBoolIsNotNormalized() {
        assertEquals(List.of("ldc.i4 1", "stloc 0", "ret"), instructionsOf("void f() { bool a = true; }", "f"));
    }

    @Test
    public void testNormalizedBoolsCombineWithAnd() {
        var instructions = instructionsOf("bool f() { bool a = 2; bool b = 1; return a && b; }", "f");
        assertEquals(List.of("ldc.i4 2", "ldc.i4 0", "cgt.un", "stloc 0",
                "ldc.i4 1", "ldc.i4 0", "cgt.un", "stloc 1"), instructions.subList(0, 8));
    }

    @Test
    public void testMinimumIntIsLoadedDirectly() {
        assertEquals(List.of("ldc.i4 -2147483648", "stloc 0", "ret"),
                instructionsOf("void f() { int m = -2147483648; }", "f"));
        assertEquals(List.of("ldc.i4 5", "neg", "stloc 0", "ret"),
                instructionsOf("void f() { int m = -5; }", "f"));
    }

    @Test
    public void testLabelsRestartForEveryGeneration() {
        var compilationUnit = new Parser().parseCompilationUnit(
                new Tokenizer().tokenize("void f(int n) { while (n > 0) { n--; } }"));
        var generator = new CodeGenerator();
        assertEquals(generator.generate(compilationUnit), generator.generate(compilationUnit));
    }
}
