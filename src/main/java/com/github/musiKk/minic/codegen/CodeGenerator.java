package com.github.musiKk.minic.codegen;

import static com.github.musiKk.minic.semantic.Type.Builtin.BOOL;
import static com.github.musiKk.minic.semantic.Type.Builtin.CHAR;
import static com.github.musiKk.minic.semantic.Type.Builtin.INT;
import static com.github.musiKk.minic.semantic.Type.Builtin.STRING;
import static com.github.musiKk.minic.semantic.Type.Builtin.VOID;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.apache.log4j.Logger;

import com.github.musiKk.minic.Tokenizer.TokenType;
import com.github.musiKk.minic.parser.CompilationUnit;
import com.github.musiKk.minic.parser.CompilationUnit.ArrayAccess;
import com.github.musiKk.minic.parser.CompilationUnit.ArrayAssignmentExpression;
import com.github.musiKk.minic.parser.CompilationUnit.ArrayDeclaration;
import com.github.musiKk.minic.parser.CompilationUnit.AssignmentExpression;
import com.github.musiKk.minic.parser.CompilationUnit.BinaryExpression;
import com.github.musiKk.minic.parser.CompilationUnit.Block;
import com.github.musiKk.minic.parser.CompilationUnit.BooleanLiteral;
import com.github.musiKk.minic.parser.CompilationUnit.CharLiteral;
import com.github.musiKk.minic.parser.CompilationUnit.DoWhileStatement;
import com.github.musiKk.minic.parser.CompilationUnit.Expression;
import com.github.musiKk.minic.parser.CompilationUnit.ExpressionStatement;
import com.github.musiKk.minic.parser.CompilationUnit.ExpressionVisitor;
import com.github.musiKk.minic.parser.CompilationUnit.ForStatement;
import com.github.musiKk.minic.parser.CompilationUnit.FunctionCall;
import com.github.musiKk.minic.parser.CompilationUnit.FunctionDefinition;
import com.github.musiKk.minic.parser.CompilationUnit.Identifier;
import com.github.musiKk.minic.parser.CompilationUnit.IfStatement;
import com.github.musiKk.minic.parser.CompilationUnit.IncrementDecrement;
import com.github.musiKk.minic.parser.CompilationUnit.InputStatement;
import com.github.musiKk.minic.parser.CompilationUnit.NumberLiteral;
import com.github.musiKk.minic.parser.CompilationUnit.OutputStatement;
import com.github.musiKk.minic.parser.CompilationUnit.ReturnStatement;
import com.github.musiKk.minic.parser.CompilationUnit.Statement;
import com.github.musiKk.minic.parser.CompilationUnit.StatementVisitor;
import com.github.musiKk.minic.parser.CompilationUnit.StringLiteral;
import com.github.musiKk.minic.parser.CompilationUnit.SystemFunctionCall;
import com.github.musiKk.minic.parser.CompilationUnit.UnaryExpression;
import com.github.musiKk.minic.parser.CompilationUnit.VariableDeclaration;
import com.github.musiKk.minic.parser.CompilationUnit.WhileStatement;
import com.github.musiKk.minic.semantic.FunctionSignature;
import com.github.musiKk.minic.semantic.OperatorTable;
import com.github.musiKk.minic.semantic.SemanticAnalyzer;
import com.github.musiKk.minic.semantic.Type;

/**
 * Lowers an analyzed program to stack machine text.
 * <p>
 * Every expression leaves exactly one value on the operand stack and every
 * statement leaves the depth it found. Function definitions become static
 * methods; global declarations become static fields, and top-level
 * statements together with global initializers run in the type initializer.
 * <p>
 * Only call this on a tree the analyzer accepted. Inconsistencies that slip
 * through are lowered best-effort and logged instead of failing.
 */
public class CodeGenerator implements StatementVisitor<Void>, ExpressionVisitor<Void> {

    public static final String DEFAULT_ASSEMBLY_NAME = "generated_code";

    private static final String WRITE_LINE = "void [mscorlib]System.Console::WriteLine()";
    private static final String READ_LINE = "string [mscorlib]System.Console::ReadLine()";
    private static final String READ_CHAR = "int32 [mscorlib]System.Console::Read()";
    private static final String PARSE_INT = "int32 [mscorlib]System.Int32::Parse(string)";
    private static final String PARSE_BOOL = "bool [mscorlib]System.Boolean::Parse(string)";
    private static final String ABS = "int32 [mscorlib]System.Math::Abs(int32)";

    private final Logger log = Logger.getLogger(getClass());

    private final String assemblyName;
    private final ExpressionTyper typer = new ExpressionTyper();

    private Assembly assembly;
    private Assembly.MethodBuilder method;
    private Map<String, FunctionSignature> functions;
    private Map<String, Slot> globals;
    private Deque<Map<String, Slot>> locals;
    private int labelCounter;

    public CodeGenerator() {
        this(DEFAULT_ASSEMBLY_NAME);
    }

    public CodeGenerator(String assemblyName) {
        this.assemblyName = assemblyName;
    }

    public String generate(CompilationUnit compilationUnit) {
        assembly = new Assembly(assemblyName);
        functions = new LinkedHashMap<>();
        globals = new LinkedHashMap<>();
        locals = new ArrayDeque<>();
        labelCounter = 0;

        for (var definition : compilationUnit.functions()) {
            functions.putIfAbsent(definition.name(), FunctionSignature.of(definition));
        }

        var typeInitializer = assembly.method(
                ".method private hidebysig specialname rtspecialname static void .cctor() cil managed", false);
        for (var item : compilationUnit.items()) {
            method = typeInitializer;
            item.accept(this);
        }
        if (!typeInitializer.isEmpty()) {
            typeInitializer.ret();
            typeInitializer.finish();
        }
        method = null;

        return AssemblyWriter.write(assembly);
    }

    private String newLabel() {
        return String.format("IL_%04d", ++labelCounter);
    }

    private void inLocalScope(Runnable body) {
        locals.push(new HashMap<>());
        try {
            body.run();
        } finally {
            locals.pop();
        }
    }

    private Slot declare(String name, Type type) {
        if (locals.isEmpty()) {
            assembly.field(IlTypes.of(type), name);
            var slot = Slot.global(type, name);
            globals.put(name, slot);
            return slot;
        }
        var slot = Slot.local(method.local(IlTypes.of(type)), type, name);
        locals.peek().put(name, slot);
        return slot;
    }

    private Optional<Slot> resolve(String name) {
        for (var scope : locals) {
            var slot = scope.get(name);
            if (slot != null) {
                return Optional.of(slot);
            }
        }
        return Optional.ofNullable(globals.get(name));
    }

    private void load(Slot slot) {
        slot.load(method, assemblyName);
    }

    private void store(Slot slot) {
        slot.store(method, assemblyName);
    }

    private void negate() {
        method.emit(Opcode.LDC_I4, "0");
        method.emit(Opcode.CEQ);
    }

    // any non-zero int becomes 1 so bool values stay 0 or 1 for and/or/ceq
    private void coerce(Expression value, Type target) {
        if (target == BOOL && value.accept(typer) != BOOL) {
            method.emit(Opcode.LDC_I4, "0");
            method.emit(Opcode.CGT_UN);
        }
    }

    private String callTarget(FunctionSignature signature) {
        var parameters = signature.parameterTypes().stream()
                .map(IlTypes::of)
                .collect(Collectors.joining(", "));
        return IlTypes.of(signature.returnType()) + " " + assemblyName + "::" + signature.name() + "(" + parameters + ")";
    }

    private static boolean endsWithReturn(Block body) {
        var statements = body.statements();
        return !statements.isEmpty() && statements.get(statements.size() - 1) instanceof ReturnStatement;
    }

    // statements

    @Override
    public Void visitFunctionDefinition(FunctionDefinition definition) {
        var signature = FunctionSignature.of(definition);
        var parameters = signature.parameters().stream()
                .map(p -> IlTypes.of(p.type()) + " " + p.name())
                .collect(Collectors.joining(", "));
        var header = ".method public static " + IlTypes.of(signature.returnType()) + " " + definition.name()
                + "(" + parameters + ") cil managed";

        var enclosing = method;
        method = assembly.method(header, signature.returnType() != VOID);
        if (definition.name().equals("main")) {
            method.entryPoint();
        }

        Map<String, Slot> arguments = new HashMap<>();
        for (int i = 0; i < signature.parameters().size(); i++) {
            var parameter = signature.parameters().get(i);
            arguments.put(parameter.name(), Slot.argument(i, parameter.type(), parameter.name()));
        }
        locals.push(arguments);
        try {
            for (var statement : definition.body().statements()) {
                statement.accept(this);
            }
        } finally {
            locals.pop();
        }
        if (signature.returnType() == VOID && !endsWithReturn(definition.body())) {
            method.ret();
        }
        log.debug("generated " + header + " (maxstack " + method.maxDepth + ")");
        method.finish();
        method = enclosing;
        return null;
    }

    @Override
    public Void visitBlock(Block block) {
        inLocalScope(() -> block.statements().forEach(s -> s.accept(this)));
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement statement) {
        var expression = statement.expression();
        if (expression instanceof AssignmentExpression assignment) {
            assign(assignment, false);
        } else if (expression instanceof ArrayAssignmentExpression assignment) {
            assignElement(assignment, false);
        } else {
            int before = method.depth();
            expression.accept(this);
            // void calls push nothing
            if (method.depth() > before) {
                method.emit(Opcode.POP);
            }
        }
        return null;
    }

    private void nested(Statement statement) {
        inLocalScope(() -> statement.accept(this));
    }

    @Override
    public Void visitIf(IfStatement statement) {
        statement.condition().accept(this);
        if (statement.elseBranch().isPresent()) {
            var elseLabel = newLabel();
            var endLabel = newLabel();
            method.emit(Opcode.BRFALSE, elseLabel);
            nested(statement.thenBranch());
            method.emit(Opcode.BR, endLabel);
            method.label(elseLabel);
            nested(statement.elseBranch().get());
            method.label(endLabel);
        } else {
            var endLabel = newLabel();
            method.emit(Opcode.BRFALSE, endLabel);
            nested(statement.thenBranch());
            method.label(endLabel);
        }
        return null;
    }

    @Override
    public Void visitFor(ForStatement statement) {
        inLocalScope(() -> {
            statement.init().ifPresent(s -> s.accept(this));
            var startLabel = newLabel();
            var endLabel = newLabel();
            method.label(startLabel);
            statement.condition().ifPresent(c -> {
                c.accept(this);
                method.emit(Opcode.BRFALSE, endLabel);
            });
            nested(statement.body());
            statement.step().ifPresent(s -> s.accept(this));
            method.emit(Opcode.BR, startLabel);
            method.label(endLabel);
        });
        return null;
    }

    @Override
    public Void visitWhile(WhileStatement statement) {
        var startLabel = newLabel();
        var endLabel = newLabel();
        method.label(startLabel);
        statement.condition().accept(this);
        method.emit(Opcode.BRFALSE, endLabel);
        nested(statement.body());
        method.emit(Opcode.BR, startLabel);
        method.label(endLabel);
        return null;
    }

    @Override
    public Void visitDoWhile(DoWhileStatement statement) {
        var startLabel = newLabel();
        method.label(startLabel);
        nested(statement.body());
        statement.condition().accept(this);
        method.emit(Opcode.BRTRUE, startLabel);
        return null;
    }

    @Override
    public Void visitVariableDeclaration(VariableDeclaration declaration) {
        // evaluated before the name exists, like in the analyzer
        var type = Type.of(declaration.type());
        declaration.initializer().ifPresent(e -> {
            e.accept(this);
            coerce(e, type);
        });
        var slot = declare(declaration.name(), type);
        if (declaration.initializer().isPresent()) {
            store(slot);
        }
        return null;
    }

    @Override
    public Void visitArrayDeclaration(ArrayDeclaration declaration) {
        var elementType = Type.of(declaration.elementType());
        method.emit(Opcode.LDC_I4, Long.toString(declaration.size()));
        method.emit(Opcode.NEWARR, IlTypes.of(elementType));
        var slot = declare(declaration.name(), Type.arrayOf(elementType, declaration.size()));
        store(slot);
        var elements = declaration.initializer().orElse(List.of());
        for (int i = 0; i < elements.size(); i++) {
            load(slot);
            method.emit(Opcode.LDC_I4, Integer.toString(i));
            elements.get(i).accept(this);
            method.emit(IlTypes.storeElement(elementType));
        }
        return null;
    }

    @Override
    public Void visitInput(InputStatement statement) {
        var target = resolve(statement.target().name());
        if (target.isEmpty()) {
            log.warn("line " + statement.line() + ": no storage for input target '" + statement.target().name() + "'");
            method.comment("unresolved input target " + statement.target().name());
            return null;
        }
        var slot = target.get();
        if (slot.type() == CHAR) {
            method.call(READ_CHAR, 0, true);
            method.emit(Opcode.CONV_U2);
        } else if (slot.type() == BOOL) {
            method.call(READ_LINE, 0, true);
            method.call(PARSE_BOOL, 1, true);
        } else {
            method.call(READ_LINE, 0, true);
            method.call(PARSE_INT, 1, true);
        }
        store(slot);
        return null;
    }

    @Override
    public Void visitOutput(OutputStatement statement) {
        for (var argument : statement.arguments()) {
            if (argument instanceof Identifier identifier && identifier.name().equals("endl")
                    && resolve("endl").isEmpty()) {
                method.call(WRITE_LINE, 0, false);
                continue;
            }
            var type = argument.accept(typer);
            argument.accept(this);
            method.call("void [mscorlib]System.Console::Write(" + IlTypes.of(type) + ")", 1, false);
        }
        return null;
    }

    @Override
    public Void visitIncrementDecrement(IncrementDecrement statement) {
        var target = resolve(statement.target().name());
        if (target.isEmpty()) {
            log.warn("line " + statement.line() + ": no storage for '" + statement.target().name() + "'");
            method.comment("unresolved increment target " + statement.target().name());
            return null;
        }
        var slot = target.get();
        load(slot);
        method.emit(Opcode.LDC_I4, "1");
        method.emit(statement.operator() == TokenType.PLUS_PLUS ? Opcode.ADD : Opcode.SUB);
        if (slot.type() == CHAR) {
            method.emit(Opcode.CONV_U2);
        }
        store(slot);
        return null;
    }

    @Override
    public Void visitReturn(ReturnStatement statement) {
        statement.value().ifPresent(e -> e.accept(this));
        method.ret();
        return null;
    }

    // expressions

    @Override
    public Void visitNumber(NumberLiteral number) {
        method.emit(Opcode.LDC_I4, Long.toString(number.value()));
        return null;
    }

    @Override
    public Void visitBoolean(BooleanLiteral bool) {
        method.emit(Opcode.LDC_I4, bool.value() ? "1" : "0");
        return null;
    }

    @Override
    public Void visitChar(CharLiteral character) {
        method.emit(Opcode.LDC_I4, Integer.toString(character.value()));
        return null;
    }

    @Override
    public Void visitString(StringLiteral string) {
        var escaped = string.value()
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
        method.emit(Opcode.LDSTR, "\"" + escaped + "\"");
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier identifier) {
        var slot = resolve(identifier.name());
        if (slot.isPresent()) {
            load(slot.get());
        } else {
            if (!identifier.name().equals("NULL")) {
                log.warn("line " + identifier.line() + ": no storage for '" + identifier.name() + "', loading 0");
            }
            method.emit(Opcode.LDC_I4, "0");
        }
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpression binary) {
        binary.left().accept(this);
        binary.right().accept(this);
        switch (binary.operator()) {
            case PLUS -> method.emit(Opcode.ADD);
            case MINUS -> method.emit(Opcode.SUB);
            case STAR -> method.emit(Opcode.MUL);
            case SLASH -> method.emit(Opcode.DIV);
            case PERCENT -> method.emit(Opcode.REM);
            case EQUALS_EQUALS -> method.emit(Opcode.CEQ);
            case LT -> method.emit(Opcode.CLT);
            case GT -> method.emit(Opcode.CGT);
            case NOT_EQUALS -> {
                method.emit(Opcode.CEQ);
                negate();
            }
            case LE -> {
                method.emit(Opcode.CGT);
                negate();
            }
            case GE -> {
                method.emit(Opcode.CLT);
                negate();
            }
            case AND_AND -> method.emit(Opcode.AND);
            case OR_OR -> method.emit(Opcode.OR);
            default -> {
                log.warn("line " + binary.line() + ": no instruction for operator " + binary.operator());
                method.comment("unsupported operation: " + binary.operator().constantPattern);
                // keep the left operand as the result
                method.emit(Opcode.POP);
            }
        }
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpression unary) {
        if (SemanticAnalyzer.isMinimumInt(unary)) {
            method.emit(Opcode.LDC_I4, Integer.toString(Integer.MIN_VALUE));
            return null;
        }
        unary.operand().accept(this);
        if (unary.operator() == TokenType.BANG) {
            negate();
        } else if (unary.operator() == TokenType.MINUS) {
            method.emit(Opcode.NEG);
        } else {
            log.warn("line " + unary.line() + ": no instruction for unary operator " + unary.operator());
            method.comment("unsupported operation: " + unary.operator().constantPattern);
        }
        return null;
    }

    @Override
    public Void visitAssignment(AssignmentExpression assignment) {
        assign(assignment, true);
        return null;
    }

    private void assign(AssignmentExpression assignment, boolean keepValue) {
        assignment.value().accept(this);
        var target = resolve(assignment.target().name());
        if (target.isEmpty()) {
            log.warn("line " + assignment.line() + ": no storage for '" + assignment.target().name() + "'");
            if (!keepValue) {
                method.emit(Opcode.POP);
            }
            return;
        }
        coerce(assignment.value(), target.get().type());
        if (keepValue) {
            method.emit(Opcode.DUP);
        }
        store(target.get());
    }

    @Override
    public Void visitArrayAssignment(ArrayAssignmentExpression assignment) {
        assignElement(assignment, true);
        return null;
    }

    private void assignElement(ArrayAssignmentExpression assignment, boolean keepValue) {
        var access = assignment.target();
        var elementType = access.accept(typer);
        access.array().accept(this);
        access.index().accept(this);
        assignment.value().accept(this);
        coerce(assignment.value(), elementType);
        int temporary = -1;
        if (keepValue) {
            temporary = method.local(IlTypes.of(elementType));
            method.emit(Opcode.DUP);
            method.emit(Opcode.STLOC, Integer.toString(temporary));
        }
        method.emit(IlTypes.storeElement(elementType));
        if (keepValue) {
            method.emit(Opcode.LDLOC, Integer.toString(temporary));
        }
    }

    @Override
    public Void visitFunctionCall(FunctionCall call) {
        call.arguments().forEach(a -> a.accept(this));
        var signature = functions.get(call.name());
        if (signature == null) {
            log.warn("line " + call.line() + ": call to unknown function '" + call.name() + "', loading 0");
            call.arguments().forEach(a -> method.emit(Opcode.POP));
            method.emit(Opcode.LDC_I4, "0");
            return null;
        }
        method.call(callTarget(signature), call.arguments().size(), signature.returnType() != VOID);
        return null;
    }

    @Override
    public Void visitArrayAccess(ArrayAccess access) {
        var elementType = access.accept(typer);
        access.array().accept(this);
        access.index().accept(this);
        method.emit(IlTypes.loadElement(elementType));
        return null;
    }

    @Override
    public Void visitSystemFunctionCall(SystemFunctionCall call) {
        call.argument().accept(this);
        method.call(ABS, 1, true);
        return null;
    }

    /**
     * Static type of an expression as far as instruction selection needs it.
     */
    private class ExpressionTyper implements ExpressionVisitor<Type> {

        @Override
        public Type visitNumber(NumberLiteral number) {
            return INT;
        }

        @Override
        public Type visitBoolean(BooleanLiteral bool) {
            return BOOL;
        }

        @Override
        public Type visitChar(CharLiteral character) {
            return CHAR;
        }

        @Override
        public Type visitString(StringLiteral string) {
            return STRING;
        }

        @Override
        public Type visitIdentifier(Identifier identifier) {
            return resolve(identifier.name()).map(Slot::type).orElse(INT);
        }

        @Override
        public Type visitBinary(BinaryExpression binary) {
            return OperatorTable.nominalResult(binary.operator());
        }

        @Override
        public Type visitUnary(UnaryExpression unary) {
            return unary.operator() == TokenType.BANG ? BOOL : INT;
        }

        @Override
        public Type visitAssignment(AssignmentExpression assignment) {
            return assignment.target().accept(this);
        }

        @Override
        public Type visitArrayAssignment(ArrayAssignmentExpression assignment) {
            return assignment.target().accept(this);
        }

        @Override
        public Type visitFunctionCall(FunctionCall call) {
            var signature = functions.get(call.name());
            return signature == null ? INT : signature.returnType();
        }

        @Override
        public Type visitArrayAccess(ArrayAccess access) {
            var type = access.array().accept(this);
            return type instanceof Type.ArrayType array ? array.elementType() : INT;
        }

        @Override
        public Type visitSystemFunctionCall(SystemFunctionCall call) {
            return INT;
        }
    }
}
