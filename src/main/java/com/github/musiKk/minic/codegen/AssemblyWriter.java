package com.github.musiKk.minic.codegen;

import java.util.List;

import com.github.musiKk.minic.codegen.Assembly.Comment;
import com.github.musiKk.minic.codegen.Assembly.Instruction;
import com.github.musiKk.minic.codegen.Assembly.Label;
import com.github.musiKk.minic.codegen.Assembly.Method;

/**
 * Renders an {@link Assembly} as indented instruction text.
 */
class AssemblyWriter {

    private final StringBuilder out = new StringBuilder();
    private int indent = 0;

    static String write(Assembly assembly) {
        var writer = new AssemblyWriter();
        writer.emit(assembly);
        return writer.out.toString();
    }

    private void emit(Assembly assembly) {
        emitLineNl("// Generated MSIL code");
        emitLineNl(".assembly extern mscorlib {}");
        emitLineNl(".assembly " + assembly.name() + " {}");
        emitLineNl("");
        emitLineNl(".class public abstract sealed auto ansi " + assembly.name());
        indent();
        emitLineNl("extends [mscorlib]System.Object");
        outdent();
        emitLineNl("{");
        indent();
        for (var field : assembly.fields()) {
            emitLineNl(".field public static " + field.type() + " " + field.name());
        }
        for (var method : assembly.methods()) {
            emitLineNl("");
            emitMethod(method);
        }
        outdent();
        emitLineNl("}");
    }

    private void emitMethod(Method method) {
        emitLineNl(method.header());
        emitLineNl("{");
        indent();
        if (method.entryPoint()) {
            emitLineNl(".entrypoint");
        }
        emitLineNl(".maxstack " + method.maxStack());
        emitLocals(method.locals());
        for (var element : method.body()) {
            if (element instanceof Label label) {
                outdent();
                emitLineNl(label.name() + ":");
                indent();
            } else if (element instanceof Comment comment) {
                emitLineNl("// " + comment.text());
            } else if (element instanceof Instruction instruction) {
                emitLineNl(instruction.operand() == null
                        ? instruction.opcode().mnemonic
                        : instruction.opcode().mnemonic + " " + instruction.operand());
            }
        }
        outdent();
        emitLineNl("}");
    }

    private void emitLocals(List<String> locals) {
        if (locals.isEmpty()) {
            return;
        }
        emitLineNl(".locals init (" + String.join(", ", locals) + ")");
    }

    void indent() {
        indent++;
    }

    void outdent() {
        indent--;
    }

    void emitLineNl(String line) {
        if (!line.isEmpty()) {
            out.append("  ".repeat(indent));
        }
        out.append(line).append('\n');
    }
}
