package com.github.musiKk.minic.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.musiKk.minic.Tokenizer.TokenType;

/**
 * Program root: header lines followed by top-level items in source order.
 * Every node type of the tree is declared here so the hierarchy stays closed.
 */
public record CompilationUnit(List<Include> includes, List<Using> usings, List<Statement> items) implements Node {

    public List<FunctionDefinition> functions() {
        List<FunctionDefinition> functions = new ArrayList<>();
        for (var item : items) {
            if (item instanceof FunctionDefinition fd) {
                functions.add(fd);
            }
        }
        return functions;
    }

    @Override
    public int line() {
        return 1;
    }

    @Override
    public String label() {
        return "program";
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(includes);
        children.addAll(usings);
        children.addAll(items);
        return children;
    }

    public enum TypeName {
        INT("int"), BOOL("bool"), CHAR("char"), VOID("void");

        public final String keyword;

        TypeName(String keyword) {
            this.keyword = keyword;
        }
    }

    public record Include(String header, int line) implements Node {
        public String label() { return "#include " + header; }
        public List<Node> children() { return List.of(); }
    }

    public record Using(String namespace, int line) implements Node {
        public String label() { return "using namespace " + namespace; }
        public List<Node> children() { return List.of(); }
    }

    public record Parameter(TypeName type, String name, int line) implements Node {
        public String label() { return type.keyword + " " + name; }
        public List<Node> children() { return List.of(); }
    }

    // expressions

    public sealed interface Expression extends Node {
        <R> R accept(ExpressionVisitor<R> visitor);
    }

    public interface ExpressionVisitor<R> {
        R visitNumber(NumberLiteral number);
        R visitBoolean(BooleanLiteral bool);
        R visitChar(CharLiteral character);
        R visitString(StringLiteral string);
        R visitIdentifier(Identifier identifier);
        R visitBinary(BinaryExpression binary);
        R visitUnary(UnaryExpression unary);
        R visitAssignment(AssignmentExpression assignment);
        R visitArrayAssignment(ArrayAssignmentExpression assignment);
        R visitFunctionCall(FunctionCall call);
        R visitArrayAccess(ArrayAccess access);
        R visitSystemFunctionCall(SystemFunctionCall call);
    }

    public record NumberLiteral(long value, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitNumber(this); }
        public String label() { return Long.toString(value); }
        public List<Node> children() { return List.of(); }
    }

    public record BooleanLiteral(boolean value, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitBoolean(this); }
        public String label() { return Boolean.toString(value); }
        public List<Node> children() { return List.of(); }
    }

    public record CharLiteral(char value, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitChar(this); }
        public String label() { return "'" + value + "'"; }
        public List<Node> children() { return List.of(); }
    }

    public record StringLiteral(String value, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitString(this); }
        public String label() { return "\"" + value + "\""; }
        public List<Node> children() { return List.of(); }
    }

    public record Identifier(String name, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitIdentifier(this); }
        public String label() { return name; }
        public List<Node> children() { return List.of(); }
    }

    public record BinaryExpression(Expression left, TokenType operator, Expression right, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitBinary(this); }
        public String label() { return operator.constantPattern; }
        public List<Node> children() { return List.of(left, right); }
    }

    public record UnaryExpression(TokenType operator, Expression operand, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitUnary(this); }
        public String label() { return operator.constantPattern; }
        public List<Node> children() { return List.of(operand); }
    }

    public record AssignmentExpression(Identifier target, Expression value, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitAssignment(this); }
        public String label() { return "="; }
        public List<Node> children() { return List.of(target, value); }
    }

    public record ArrayAssignmentExpression(ArrayAccess target, Expression value, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitArrayAssignment(this); }
        public String label() { return "="; }
        public List<Node> children() { return List.of(target, value); }
    }

    public record FunctionCall(String name, List<Expression> arguments, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitFunctionCall(this); }
        public String label() { return name + "()"; }
        public List<Expression> children() { return arguments; }
    }

    public record ArrayAccess(Identifier array, Expression index, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitArrayAccess(this); }
        public String label() { return "[]"; }
        public List<Node> children() { return List.of(array, index); }
    }

    public record SystemFunctionCall(String name, Expression argument, int line) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitSystemFunctionCall(this); }
        public String label() { return name; }
        public List<Node> children() { return List.of(argument); }
    }

    // statements

    public sealed interface Statement extends Node {
        <R> R accept(StatementVisitor<R> visitor);
    }

    public interface StatementVisitor<R> {
        R visitBlock(Block block);
        R visitExpressionStatement(ExpressionStatement statement);
        R visitIf(IfStatement statement);
        R visitFor(ForStatement statement);
        R visitWhile(WhileStatement statement);
        R visitDoWhile(DoWhileStatement statement);
        R visitVariableDeclaration(VariableDeclaration declaration);
        R visitArrayDeclaration(ArrayDeclaration declaration);
        R visitInput(InputStatement statement);
        R visitOutput(OutputStatement statement);
        R visitIncrementDecrement(IncrementDecrement statement);
        R visitReturn(ReturnStatement statement);
        R visitFunctionDefinition(FunctionDefinition definition);
    }

    /**
     * A brace-delimited statement list. The parser grows it with {@link #add}
     * while the closing brace has not been read yet.
     */
    public record Block(List<Statement> statements, int line) implements Statement {
        static Block open(int line) {
            return new Block(new ArrayList<>(), line);
        }
        void add(Statement statement) {
            statements.add(statement);
        }
        Block close() {
            return new Block(List.copyOf(statements), line);
        }
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitBlock(this); }
        public String label() { return "..."; }
        public List<Statement> children() { return statements; }
    }

    public record ExpressionStatement(Expression expression, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitExpressionStatement(this); }
        public String label() { return ";"; }
        public List<Node> children() { return List.of(expression); }
    }

    public record IfStatement(Expression condition, Statement thenBranch, Optional<Statement> elseBranch, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitIf(this); }
        public String label() { return "if"; }
        public List<Node> children() {
            List<Node> children = new ArrayList<>(List.of(condition, thenBranch));
            elseBranch.ifPresent(children::add);
            return children;
        }
    }

    public record ForStatement(Optional<Statement> init, Optional<Expression> condition, Optional<Statement> step, Statement body, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitFor(this); }
        public String label() { return "for"; }
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            init.ifPresent(children::add);
            condition.ifPresent(children::add);
            step.ifPresent(children::add);
            children.add(body);
            return children;
        }
    }

    public record WhileStatement(Expression condition, Statement body, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitWhile(this); }
        public String label() { return "while"; }
        public List<Node> children() { return List.of(condition, body); }
    }

    public record DoWhileStatement(Statement body, Expression condition, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitDoWhile(this); }
        public String label() { return "do while"; }
        public List<Node> children() { return List.of(body, condition); }
    }

    public record VariableDeclaration(TypeName type, String name, Optional<Expression> initializer, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitVariableDeclaration(this); }
        public String label() { return type.keyword + " " + name; }
        public List<Expression> children() { return initializer.map(List::of).orElse(List.of()); }
    }

    public record ArrayDeclaration(TypeName elementType, String name, long size, Optional<List<Expression>> initializer, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitArrayDeclaration(this); }
        public String label() { return elementType.keyword + " " + name + "[" + size + "]"; }
        public List<Expression> children() { return initializer.orElse(List.of()); }
    }

    public record InputStatement(Identifier target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitInput(this); }
        public String label() { return "cin"; }
        public List<Node> children() { return List.of(target); }
    }

    public record OutputStatement(List<Expression> arguments, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitOutput(this); }
        public String label() { return "cout"; }
        public List<Expression> children() { return arguments; }
    }

    public record IncrementDecrement(Identifier target, TokenType operator, boolean prefix, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitIncrementDecrement(this); }
        public String label() {
            return prefix ? operator.constantPattern + target.name() : target.name() + operator.constantPattern;
        }
        public List<Node> children() { return List.of(target); }
    }

    public record ReturnStatement(Optional<Expression> value, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitReturn(this); }
        public String label() { return "return"; }
        public List<Expression> children() { return value.map(List::of).orElse(List.of()); }
    }

    public record FunctionDefinition(TypeName returnType, String name, List<Parameter> parameters, Block body, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) { return visitor.visitFunctionDefinition(this); }
        public String label() { return returnType.keyword + " " + name + "()"; }
        public List<Node> children() {
            List<Node> children = new ArrayList<>(parameters);
            children.add(body);
            return children;
        }
    }

}
