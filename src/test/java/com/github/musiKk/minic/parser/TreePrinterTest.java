package com.github.musiKk.minic.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.musiKk.minic.Tokenizer;

public class TreePrinterTest {

    private static CompilationUnit parse(String code) {
        return new Parser().parseCompilationUnit(new Tokenizer().tokenize(code));
    }

    @Test
    public void testRender() {
        var expected = """
                program
                └ int main()
                  └ ...
                    ├ int x
                    │ └ +
                    │   ├ 1
                    │   └ 2
                    └ cout
                      └ x""";
        assertEquals(expected, TreePrinter.render(parse("int main() { int x = 1 + 2; cout << x; }")));
    }

    @Test
    public void testHeaderLinesComeFirst() {
        var lines = TreePrinter.lines(parse("#include <iostream>\nusing namespace std;\nint g;"));
        assertEquals(List.of(
                "program",
                "├ #include <iostream>",
                "├ using namespace std",
                "└ int g"), lines);
    }

    @Test
    public void testStatementLabels() {
        var lines = TreePrinter.lines(parse("void f(int a) { if (a > 0) a--; else return; }"));
        assertEquals(List.of(
                "program",
                "└ void f()",
                "  ├ int a",
                "  └ ...",
                "    └ if",
                "      ├ >",
                "      │ ├ a",
                "      │ └ 0",
                "      ├ a--",
                "      │ └ a",
                "      └ return"), lines);
    }
}
