package com.github.musiKk.minic.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.musiKk.minic.Diagnostic;
import com.github.musiKk.minic.Tokenizer;
import com.github.musiKk.minic.parser.CompilationUnit;
import com.github.musiKk.minic.parser.Parser;

public class SemanticAnalyzerTest {

    private static CompilationUnit parse(String code) {
        return new Parser().parseCompilationUnit(new Tokenizer().tokenize(code));
    }

    private static List<String> analyze(String code) {
        return new SemanticAnalyzer().analyze(parse(code)).stream()
                .map(Diagnostic::toString)
                .toList();
    }

    @Test
    public void testValidProgram() {
        var code = """
                int total;
                int add(int a, int b) {
                    return a + b;
                }
                bool positive(int n) {
                    return n > 0;
                }
                void report(char c) {
                    cout << "c = " << c << endl;
                }
                int main() {
                    int values[3] = {1, 2, 3};
                    for (int i = 0; i < 3; i++) {
                        total = add(total, values[i]);
                    }
                    if (positive(total) && !false) {
                        report('x');
                    }
                    cin >> total;
                    return abs(total);
                }
                """;
        assertEquals(List.of(), analyze(code));
    }

    @Test
    public void testRedeclarationReportedOnce() {
        assertEquals(List.of("line 1: 'a' is already declared in this scope"),
                analyze("int main() { int a = 1; int a = 2; return 0; }"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "int main() { for (int i = 0; i < 3; i++) { } i = 1; return 0; }",
        "int main() { while (true) { int w = 1; } w = 2; return 0; }",
        "int main() { do { int d = 1; } while (false); d = 2; return 0; }",
        "int main() { if (true) { int k = 1; } cout << k; return 0; }",
        "int main() { if (true) { } else { int k = 1; } cout << k; return 0; }",
        "int main() { { int b = 1; } b++; return 0; }",
    })
    public void testNameEndsWithItsBlock(String code) {
        var diagnostics = analyze(code);
        assertEquals(1, diagnostics.size(), diagnostics::toString);
        assertTrue(diagnostics.get(0).contains("is not visible here: its declaring block has ended"), diagnostics::toString);
    }

    @ParameterizedTest
    @MethodSource("arrayIndices")
    public void testStaticArrayBounds(String index, List<String> expected) {
        assertEquals(expected, analyze("int main() { int x[3]; x[" + index + "] = 1; return 0; }"));
    }

    private static Object[][] arrayIndices() {
        return new Object[][] {
            { "0", List.of() },
            { "2", List.of() },
            { "3", List.of() },
            { "5", List.of("line 1: array index 5 is out of range for 'x' of size 3") },
            { "-1", List.of("line 1: array index -1 is out of range for 'x' of size 3") },
            { "'a'", List.of("line 1: array index must be int, got char") },
        };
    }

    @Test
    public void testArityMismatchReportedOnce() {
        assertEquals(List.of("line 1: function 'add' expects 2 argument(s) but got 1"),
                analyze("int add(int a, int b) { return a + b; } int main() { return add(1); }"));
    }

    @Test
    public void testArgumentTypesMustMatchExactly() {
        assertEquals(List.of("line 1: argument 1 of 'twice' must be int, got char"),
                analyze("int twice(int a) { return a * 2; } int main() { return twice('a'); }"));
    }

    @Test
    public void testReturnTypes() {
        assertEquals(List.of("line 1: function 'f' returns bool but the returned value is int"),
                analyze("bool f() { return 5; } int main() { return 0; }"));
        assertEquals(List.of(), analyze("bool f() { return true; } int main() { return 0; }"));
        assertEquals(List.of(), analyze("int f() { return 'a'; } int main() { return 0; }"));
        assertEquals(List.of("line 1: void function 'g' cannot return a value"),
                analyze("void g() { return 1; } int main() { return 0; }"));
        assertEquals(List.of("line 1: function 'main' must return a value of type int"),
                analyze("int main() { return; }"));
    }

    @Test
    public void testReturnOutsideFunction() {
        assertEquals(List.of("line 1: return outside of a function"), analyze("return 1;"));
    }

    @Test
    public void testFunctionsAreKnownBeforeTheirDefinition() {
        assertEquals(List.of(), analyze("int main() { return later(2); } int later(int n) { return n; }"));
    }

    @Test
    public void testDuplicateFunctionComesFirst() {
        var code = """
                int main() {
                    x = 1;
                    return 0;
                }
                int main() {
                    return 0;
                }
                """;
        assertEquals(List.of(
                "line 5: function 'main' is already defined",
                "line 2: undeclared identifier 'x'"), analyze(code));
    }

    @Test
    public void testShadowingIsAllowed() {
        assertEquals(List.of(),
                analyze("int x = 1; int main() { char x = 'a'; { bool x = true; } return 0; }"));
    }

    @Test
    public void testInitializerSeesOuterVariable() {
        assertEquals(List.of(), analyze("int main() { int y = 1; { int y = y + 1; } return 0; }"));
    }

    @Test
    public void testInitializerCannotSeeItself() {
        assertEquals(List.of("line 1: undeclared identifier 'y'"), analyze("int main() { int y = y; return 0; }"));
    }

    @Test
    public void testMismatchReportedOnce() {
        assertEquals(List.of("line 1: type mismatch: operator + cannot be applied to char and bool"),
                analyze("int main() { int r = 'a' + true; return 0; }"));
    }

    @Test
    public void testConditions() {
        assertEquals(List.of("line 1: if condition must be bool, got char"),
                analyze("int main() { if ('c') { } return 0; }"));
        assertEquals(List.of(), analyze("int main() { int n = 3; while (n) { n--; } return 0; }"));
    }

    @Test
    public void testAssignmentCompatibility() {
        assertEquals(List.of("line 1: cannot assign a value of type bool to 'n' of type int"),
                analyze("int main() { int n; n = true; return 0; }"));
        assertEquals(List.of("line 1: cannot assign to array 'a' as a whole"),
                analyze("int main() { int a[2]; a = 1; return 0; }"));
        assertEquals(List.of("line 1: 'n' is not an array"),
                analyze("int main() { int n; n[0] = 1; return 0; }"));
    }

    @Test
    public void testFunctionUsedAsValue() {
        assertEquals(List.of("line 1: function 'f' cannot be used as a value"),
                analyze("int f() { return 1; } int main() { int v = f; return 0; }"));
    }

    @Test
    public void testCallingAVariable() {
        assertEquals(List.of("line 1: 'n' is not a function"),
                analyze("int main() { int n = 1; return n(); }"));
        assertEquals(List.of("line 1: call to undefined function 'nowhere'"),
                analyze("int main() { return nowhere(); }"));
    }

    @Test
    public void testBuiltinNames() {
        assertEquals(List.of(), analyze("int main() { int p = NULL; cout << endl; return p; }"));
    }

    @Test
    public void testDiagnosticsCarryLines() {
        var code = """
                int main() {
                    int a = 1;
                    bool b = a;
                    char c = a;
                    return 0;
                }
                """;
        assertEquals(List.of("line 4: cannot initialize 'c' of type char with a value of type int"), analyze(code));
    }

    @Test
    public void testIntegerLiteralsMustFitInInt() {
        assertEquals(List.of(
                "line 1: integer literal 3000000000 is out of range for int",
                "line 1: array 'a' size 5000000000 is out of range for int"),
                analyze("int main() { int big = 3000000000; int a[5000000000]; return big; }"));
        assertEquals(List.of("line 1: integer literal 2147483648 is out of range for int"),
                analyze("int m = 2147483648;"));
        assertEquals(List.of("line 1: integer literal 2147483648 is out of range for int"),
                analyze("int m = 0 - 2147483648;"));
    }

    @Test
    public void testMinimumIntLiteralIsAccepted() {
        assertEquals(List.of(), analyze("int m = -2147483648; int n = 2147483647; int k = -(5);"));
    }

    @Test
    public void testBoolOperandsCompare() {
        assertEquals(List.of(), analyze("bool c = true < false; bool d = c >= true;"));
    }

    @Test
    public void testAnalysisIsRepeatable() {
        var unit = parse("int main() { int a; int a; undefined = 1; return true; }");
        var analyzer = new SemanticAnalyzer();
        var first = analyzer.analyze(unit);
        var second = analyzer.analyze(unit);
        assertEquals(first, second);
        assertEquals(3, first.size());
    }

    @Test
    public void testStateIsBalancedAfterAnalysis() {
        var analyzer = new SemanticAnalyzer();
        analyzer.analyze(parse("int main() { for (;;) { while (true) { do { } while (false); } } return 0; }"));
        assertEquals(0, analyzer.loopDepth());
        assertEquals(List.of("main"), List.copyOf(analyzer.functions().keySet()));
    }
}
