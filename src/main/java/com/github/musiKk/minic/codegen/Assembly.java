package com.github.musiKk.minic.codegen;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * In-memory form of one generated assembly: a single static class holding
 * fields and methods. Methods are built instruction by instruction through a
 * {@link MethodBuilder}, which keeps track of the operand stack depth.
 */
@RequiredArgsConstructor
@Getter
@Accessors(fluent = true)
public class Assembly {

    private final String name;
    private final List<Field> fields = new ArrayList<>();
    private final List<Method> methods = new ArrayList<>();

    public MethodBuilder method(String header, boolean returnsValue) {
        return new MethodBuilder(header, returnsValue);
    }

    public void field(String type, String fieldName) {
        fields.add(new Field(type, fieldName));
    }

    public record Field(String type, String name) {}

    public record Method(String header, boolean entryPoint, int maxStack, List<String> locals, List<Element> body) {}

    public interface Element {}
    public record Instruction(Opcode opcode, String operand) implements Element {}
    public record Label(String name) implements Element {}
    public record Comment(String text) implements Element {}

    @RequiredArgsConstructor
    public class MethodBuilder {
        final String header;
        final boolean returnsValue;
        final List<String> locals = new ArrayList<>();
        final List<Element> body = new ArrayList<>();
        boolean entryPoint;
        int depth;
        int maxDepth;

        void entryPoint() {
            entryPoint = true;
        }

        /** Declares a new local and returns its slot index. */
        int local(String type) {
            locals.add(type + " V_" + locals.size());
            return locals.size() - 1;
        }

        void emit(Opcode opcode) {
            emit(opcode, null);
        }

        void emit(Opcode opcode, String operand) {
            adjust(opcode.pops, opcode.pushes);
            body.add(new Instruction(opcode, operand));
        }

        void call(String target, int arguments, boolean returnsValue) {
            adjust(arguments, returnsValue ? 1 : 0);
            body.add(new Instruction(Opcode.CALL, target));
        }

        void ret() {
            adjust(returnsValue ? 1 : 0, 0);
            body.add(new Instruction(Opcode.RET, null));
        }

        void label(String name) {
            body.add(new Label(name));
        }

        void comment(String text) {
            body.add(new Comment(text));
        }

        boolean isEmpty() {
            return body.isEmpty();
        }

        int depth() {
            return depth;
        }

        private void adjust(int pops, int pushes) {
            depth -= pops;
            if (depth < 0) {
                throw new IllegalStateException("operand stack underflow in " + header);
            }
            depth += pushes;
            maxDepth = Math.max(maxDepth, depth);
        }

        void finish() {
            methods.add(new Method(header, entryPoint, maxDepth, List.copyOf(locals), List.copyOf(body)));
        }
    }
}
