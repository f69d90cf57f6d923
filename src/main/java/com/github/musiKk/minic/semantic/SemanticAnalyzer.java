package com.github.musiKk.minic.semantic;

import static com.github.musiKk.minic.semantic.Type.Builtin.ANY;
import static com.github.musiKk.minic.semantic.Type.Builtin.BOOL;
import static com.github.musiKk.minic.semantic.Type.Builtin.CHAR;
import static com.github.musiKk.minic.semantic.Type.Builtin.INT;
import static com.github.musiKk.minic.semantic.Type.Builtin.STRING;
import static com.github.musiKk.minic.semantic.Type.Builtin.VOID;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.log4j.Logger;

import com.github.musiKk.minic.Diagnostic;
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
import com.github.musiKk.minic.parser.CompilationUnit.StatementVisitor;
import com.github.musiKk.minic.parser.CompilationUnit.StringLiteral;
import com.github.musiKk.minic.parser.CompilationUnit.SystemFunctionCall;
import com.github.musiKk.minic.parser.CompilationUnit.UnaryExpression;
import com.github.musiKk.minic.parser.CompilationUnit.VariableDeclaration;
import com.github.musiKk.minic.parser.CompilationUnit.WhileStatement;

/**
 * Checks declarations, visibility and types of a parsed program.
 * <p>
 * Function signatures are collected before any body is visited so calls may
 * refer to functions defined further down. Every problem is recorded as a
 * {@link Diagnostic} and the walk continues; names that could not be typed
 * get {@link Type.Builtin#ANY} so a single mistake is reported once.
 * <p>
 * An instance may be reused; {@link #analyze} starts from fresh state.
 */
public class SemanticAnalyzer implements StatementVisitor<Void>, ExpressionVisitor<Type> {

    private final Logger log = Logger.getLogger(getClass());

    static final Set<String> BUILTINS = Set.of("cout", "cin", "endl", "abs", "main", "true", "false", "NULL");

    private ScopeTable scopes;
    private Map<String, FunctionSignature> functions;
    private List<Diagnostic> diagnostics;
    private FunctionSignature currentFunction;
    private int loopDepth;

    public List<Diagnostic> analyze(CompilationUnit compilationUnit) {
        scopes = new ScopeTable();
        functions = new LinkedHashMap<>();
        diagnostics = new ArrayList<>();
        currentFunction = null;
        loopDepth = 0;

        collectFunctions(compilationUnit.functions());
        for (var item : compilationUnit.items()) {
            item.accept(this);
        }
        return List.copyOf(diagnostics);
    }

    /** Signatures known after the last {@link #analyze} call, in definition order. */
    public Map<String, FunctionSignature> functions() {
        return functions == null ? Map.of() : Map.copyOf(functions);
    }

    private void collectFunctions(List<FunctionDefinition> definitions) {
        for (var definition : definitions) {
            if (functions.containsKey(definition.name())) {
                error(definition.line(), "function '" + definition.name() + "' is already defined");
                continue;
            }
            functions.put(definition.name(), FunctionSignature.of(definition));
        }
    }

    private void error(int line, String message) {
        var diagnostic = Diagnostic.semantic(message, line);
        log.debug(diagnostic);
        diagnostics.add(diagnostic);
    }

    private void inNewScope(Runnable body) {
        scopes.push();
        try {
            body.run();
        } finally {
            scopes.pop();
        }
    }

    private void inLoop(Runnable body) {
        loopDepth++;
        try {
            inNewScope(body);
        } finally {
            loopDepth--;
        }
    }

    private void checkCondition(Expression condition, String construct) {
        var type = condition.accept(this);
        if (!OperatorTable.isAssignable(type, BOOL)) {
            error(condition.line(), construct + " condition must be bool, got " + type);
        }
    }

    private Optional<Variable> declare(String name, Type type, int line) {
        var variable = scopes.declare(name, type);
        if (variable.isEmpty()) {
            error(line, "'" + name + "' is already declared in this scope");
        } else {
            log.debug("line " + line + ": declared '" + name + "' of type " + type + " at scope level " + scopes.level());
        }
        return variable;
    }

    // statements

    @Override
    public Void visitFunctionDefinition(FunctionDefinition definition) {
        var signature = functions.get(definition.name());
        if (signature == null || signature.line() != definition.line()) {
            // a duplicate definition, still checked against its own signature
            signature = FunctionSignature.of(definition);
        }
        currentFunction = signature;
        try {
            inNewScope(() -> {
                Set<String> seen = new HashSet<>();
                for (var parameter : definition.parameters()) {
                    if (!seen.add(parameter.name())) {
                        error(parameter.line(), "duplicate parameter '" + parameter.name() + "' in function '" + definition.name() + "'");
                        continue;
                    }
                    var type = Type.of(parameter.type());
                    if (type == VOID) {
                        error(parameter.line(), "parameter '" + parameter.name() + "' cannot have type void");
                        type = ANY;
                    }
                    scopes.declare(parameter.name(), type)
                            .ifPresent(v -> v.initialized(true));
                }
                // parameters and body share one scope
                for (var statement : definition.body().statements()) {
                    statement.accept(this);
                }
            });
        } finally {
            currentFunction = null;
        }
        return null;
    }

    @Override
    public Void visitBlock(Block block) {
        inNewScope(() -> block.statements().forEach(s -> s.accept(this)));
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement statement) {
        statement.expression().accept(this);
        return null;
    }

    @Override
    public Void visitIf(IfStatement statement) {
        checkCondition(statement.condition(), "if");
        inNewScope(() -> statement.thenBranch().accept(this));
        statement.elseBranch().ifPresent(e -> inNewScope(() -> e.accept(this)));
        return null;
    }

    @Override
    public Void visitFor(ForStatement statement) {
        inLoop(() -> {
            statement.init().ifPresent(s -> s.accept(this));
            statement.condition().ifPresent(c -> checkCondition(c, "for"));
            statement.step().ifPresent(s -> s.accept(this));
            statement.body().accept(this);
        });
        return null;
    }

    @Override
    public Void visitWhile(WhileStatement statement) {
        checkCondition(statement.condition(), "while");
        inLoop(() -> statement.body().accept(this));
        return null;
    }

    @Override
    public Void visitDoWhile(DoWhileStatement statement) {
        inLoop(() -> statement.body().accept(this));
        checkCondition(statement.condition(), "do-while");
        return null;
    }

    @Override
    public Void visitVariableDeclaration(VariableDeclaration declaration) {
        // the initializer cannot see the name it initializes
        var initializerType = declaration.initializer().map(e -> e.accept(this));
        var type = Type.of(declaration.type());
        if (type == VOID) {
            error(declaration.line(), "variable '" + declaration.name() + "' cannot have type void");
            type = ANY;
        }
        if (initializerType.isPresent() && !OperatorTable.isAssignable(initializerType.get(), type)) {
            error(declaration.line(), "cannot initialize '" + declaration.name() + "' of type " + type
                    + " with a value of type " + initializerType.get());
        }
        declare(declaration.name(), type, declaration.line())
                .ifPresent(v -> v.initialized(declaration.initializer().isPresent()));
        return null;
    }

    @Override
    public Void visitArrayDeclaration(ArrayDeclaration declaration) {
        var elementType = Type.of(declaration.elementType());
        if (elementType == VOID) {
            error(declaration.line(), "array '" + declaration.name() + "' cannot have element type void");
            elementType = ANY;
        }
        if (declaration.size() <= 0) {
            error(declaration.line(), "array '" + declaration.name() + "' must have a positive size, got " + declaration.size());
        } else if (declaration.size() > Integer.MAX_VALUE) {
            error(declaration.line(), "array '" + declaration.name() + "' size " + declaration.size() + " is out of range for int");
        }
        if (declaration.initializer().isPresent()) {
            var elements = declaration.initializer().get();
            if (elements.size() > declaration.size()) {
                error(declaration.line(), "too many initializers for array '" + declaration.name() + "': "
                        + elements.size() + " for size " + declaration.size());
            }
            for (var element : elements) {
                var type = element.accept(this);
                if (!type.isAny() && !elementType.isAny() && !type.equals(elementType)) {
                    error(element.line(), "array '" + declaration.name() + "' element must be " + elementType + ", got " + type);
                }
            }
        }
        declare(declaration.name(), Type.arrayOf(elementType, declaration.size()), declaration.line())
                .ifPresent(v -> v.initialized(declaration.initializer().isPresent()));
        return null;
    }

    @Override
    public Void visitInput(InputStatement statement) {
        var type = statement.target().accept(this);
        if (type.isArray()) {
            error(statement.line(), "cannot read input into array '" + statement.target().name() + "'");
        }
        scopes.lookup(statement.target().name()).ifPresent(v -> v.initialized(true));
        return null;
    }

    @Override
    public Void visitOutput(OutputStatement statement) {
        for (var argument : statement.arguments()) {
            var type = argument.accept(this);
            if (type.isArray()) {
                error(argument.line(), "cannot print array '" + argument.label() + "'");
            } else if (type == VOID) {
                error(argument.line(), "cannot print a void value");
            }
        }
        return null;
    }

    @Override
    public Void visitIncrementDecrement(IncrementDecrement statement) {
        var type = statement.target().accept(this);
        if (!type.isAny() && type != INT && type != CHAR) {
            error(statement.line(), "operator " + statement.operator().constantPattern + " requires an int or char variable, got " + type);
        }
        return null;
    }

    @Override
    public Void visitReturn(ReturnStatement statement) {
        var valueType = statement.value().map(e -> e.accept(this));
        if (currentFunction == null) {
            error(statement.line(), "return outside of a function");
            return null;
        }
        var returnType = currentFunction.returnType();
        if (valueType.isEmpty()) {
            if (returnType != VOID) {
                error(statement.line(), "function '" + currentFunction.name() + "' must return a value of type " + returnType);
            }
        } else if (returnType == VOID) {
            error(statement.line(), "void function '" + currentFunction.name() + "' cannot return a value");
        } else if (!OperatorTable.widensTo(valueType.get(), returnType)) {
            error(statement.line(), "function '" + currentFunction.name() + "' returns " + returnType
                    + " but the returned value is " + valueType.get());
        }
        return null;
    }

    // expressions

    @Override
    public Type visitNumber(NumberLiteral number) {
        if (number.value() > Integer.MAX_VALUE) {
            error(number.line(), "integer literal " + number.value() + " is out of range for int");
        }
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
        var name = identifier.name();
        var variable = scopes.lookup(name);
        if (variable.isPresent()) {
            var v = variable.get();
            if (!v.initialized() && !v.type().isArray()) {
                log.debug("line " + identifier.line() + ": '" + name + "' may be used before it is assigned");
            }
            return v.type();
        }
        if (BUILTINS.contains(name)) {
            return name.equals("NULL") ? INT : ANY;
        }
        if (functions.containsKey(name)) {
            error(identifier.line(), "function '" + name + "' cannot be used as a value");
            return ANY;
        }
        if (scopes.lookupClosed(name).isPresent()) {
            error(identifier.line(), "'" + name + "' is not visible here: its declaring block has ended");
        } else {
            error(identifier.line(), "undeclared identifier '" + name + "'");
        }
        return ANY;
    }

    @Override
    public Type visitBinary(BinaryExpression binary) {
        var left = binary.left().accept(this);
        var right = binary.right().accept(this);
        var operator = binary.operator();
        if (left.isAny() || right.isAny()) {
            return OperatorTable.nominalResult(operator);
        }
        var result = OperatorTable.binaryResult(operator, left, right);
        if (result.isEmpty()) {
            error(binary.line(), "type mismatch: operator " + operator.constantPattern + " cannot be applied to "
                    + left + " and " + right);
            return ANY;
        }
        return result.get();
    }

    @Override
    public Type visitUnary(UnaryExpression unary) {
        if (isMinimumInt(unary)) {
            return INT;
        }
        var type = unary.operand().accept(this);
        if (unary.operator() == TokenType.BANG) {
            if (!OperatorTable.isAssignable(type, BOOL)) {
                error(unary.line(), "operator ! cannot be applied to " + type);
            }
            return BOOL;
        }
        if (!type.isAny() && type != INT && type != CHAR) {
            error(unary.line(), "operator " + unary.operator().constantPattern + " cannot be applied to " + type);
        }
        return INT;
    }

    @Override
    public Type visitAssignment(AssignmentExpression assignment) {
        var valueType = assignment.value().accept(this);
        var targetType = assignment.target().accept(this);
        if (targetType.isArray()) {
            error(assignment.line(), "cannot assign to array '" + assignment.target().name() + "' as a whole");
            return ANY;
        }
        if (!OperatorTable.isAssignable(valueType, targetType)) {
            error(assignment.line(), "cannot assign a value of type " + valueType + " to '"
                    + assignment.target().name() + "' of type " + targetType);
        }
        scopes.lookup(assignment.target().name()).ifPresent(v -> v.initialized(true));
        return targetType;
    }

    @Override
    public Type visitArrayAssignment(ArrayAssignmentExpression assignment) {
        var valueType = assignment.value().accept(this);
        var elementType = assignment.target().accept(this);
        if (!OperatorTable.isAssignable(valueType, elementType)) {
            error(assignment.line(), "cannot assign a value of type " + valueType + " to an element of '"
                    + assignment.target().array().name() + "' of type " + elementType);
        }
        return elementType;
    }

    @Override
    public Type visitArrayAccess(ArrayAccess access) {
        var arrayType = access.array().accept(this);
        var indexType = access.index().accept(this);
        if (!indexType.isAny() && indexType != INT) {
            error(access.index().line(), "array index must be int, got " + indexType);
        }
        if (arrayType.isAny()) {
            return ANY;
        }
        if (!(arrayType instanceof Type.ArrayType array)) {
            error(access.line(), "'" + access.array().name() + "' is not an array");
            return ANY;
        }
        var size = array.size();
        staticIndex(access.index()).ifPresent(index -> {
            if (size.isPresent() && (index < 0 || index > size.get())) {
                error(access.line(), "array index " + index + " is out of range for '" + access.array().name()
                        + "' of size " + size.get());
            }
        });
        return array.elementType();
    }

    /** {@code -2147483648}, the one literal that only fits in an int when negated. */
    public static boolean isMinimumInt(UnaryExpression unary) {
        return unary.operator() == TokenType.MINUS
                && unary.operand() instanceof NumberLiteral n
                && n.value() == -(long) Integer.MIN_VALUE;
    }

    /** A literal index, possibly negated. */
    static Optional<Long> staticIndex(Expression index) {
        if (index instanceof NumberLiteral n) {
            return Optional.of(n.value());
        }
        if (index instanceof UnaryExpression u && u.operator() == TokenType.MINUS
                && u.operand() instanceof NumberLiteral n) {
            return Optional.of(-n.value());
        }
        return Optional.empty();
    }

    @Override
    public Type visitFunctionCall(FunctionCall call) {
        var argumentTypes = call.arguments().stream().map(a -> a.accept(this)).toList();
        var signature = functions.get(call.name());
        if (signature == null) {
            if (scopes.lookup(call.name()).isPresent()) {
                error(call.line(), "'" + call.name() + "' is not a function");
            } else {
                error(call.line(), "call to undefined function '" + call.name() + "'");
            }
            return ANY;
        }
        var parameterTypes = signature.parameterTypes();
        if (parameterTypes.size() != argumentTypes.size()) {
            error(call.line(), "function '" + call.name() + "' expects " + parameterTypes.size()
                    + " argument(s) but got " + argumentTypes.size());
            return signature.returnType();
        }
        for (int i = 0; i < argumentTypes.size(); i++) {
            var argumentType = argumentTypes.get(i);
            var parameterType = parameterTypes.get(i);
            if (!argumentType.isAny() && !parameterType.isAny() && !argumentType.equals(parameterType)) {
                error(call.arguments().get(i).line(), "argument " + (i + 1) + " of '" + call.name() + "' must be "
                        + parameterType + ", got " + argumentType);
            }
        }
        return signature.returnType();
    }

    @Override
    public Type visitSystemFunctionCall(SystemFunctionCall call) {
        var type = call.argument().accept(this);
        if (!type.isAny() && type != INT && type != CHAR) {
            error(call.line(), call.name() + " requires an int or char argument, got " + type);
        }
        return INT;
    }

    int loopDepth() {
        return loopDepth;
    }
}
