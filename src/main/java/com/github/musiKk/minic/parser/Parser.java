package com.github.musiKk.minic.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.musiKk.minic.Tokenizer.Token;
import com.github.musiKk.minic.Tokenizer.TokenType;
import com.github.musiKk.minic.Tokenizer.Tokens;
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
import com.github.musiKk.minic.parser.CompilationUnit.ForStatement;
import com.github.musiKk.minic.parser.CompilationUnit.FunctionCall;
import com.github.musiKk.minic.parser.CompilationUnit.FunctionDefinition;
import com.github.musiKk.minic.parser.CompilationUnit.Identifier;
import com.github.musiKk.minic.parser.CompilationUnit.IfStatement;
import com.github.musiKk.minic.parser.CompilationUnit.Include;
import com.github.musiKk.minic.parser.CompilationUnit.IncrementDecrement;
import com.github.musiKk.minic.parser.CompilationUnit.InputStatement;
import com.github.musiKk.minic.parser.CompilationUnit.NumberLiteral;
import com.github.musiKk.minic.parser.CompilationUnit.OutputStatement;
import com.github.musiKk.minic.parser.CompilationUnit.Parameter;
import com.github.musiKk.minic.parser.CompilationUnit.ReturnStatement;
import com.github.musiKk.minic.parser.CompilationUnit.Statement;
import com.github.musiKk.minic.parser.CompilationUnit.StringLiteral;
import com.github.musiKk.minic.parser.CompilationUnit.SystemFunctionCall;
import com.github.musiKk.minic.parser.CompilationUnit.TypeName;
import com.github.musiKk.minic.parser.CompilationUnit.UnaryExpression;
import com.github.musiKk.minic.parser.CompilationUnit.Using;
import com.github.musiKk.minic.parser.CompilationUnit.VariableDeclaration;
import com.github.musiKk.minic.parser.CompilationUnit.WhileStatement;

public class Parser {

    private static final TokenType[] TYPE_KEYWORDS = { TokenType.INT, TokenType.BOOL, TokenType.CHAR, TokenType.VOID };

    public CompilationUnit parseCompilationUnit(Tokens tokens) {
        List<Include> includes = new ArrayList<>();
        List<Using> usings = new ArrayList<>();

        while (tokens.matches(TokenType.INCLUDE, TokenType.USING)) {
            if (tokens.matches(TokenType.INCLUDE)) {
                includes.add(parseInclude(tokens));
            } else {
                usings.add(parseUsing(tokens));
            }
        }

        List<Statement> items = new ArrayList<>();
        while (!tokens.matches(TokenType.EOF)) {
            if (tokens.matches(TokenType.SEMICOLON)) {
                tokens.next();
                continue;
            }
            if (isFunctionDefinitionAhead(tokens)) {
                items.add(parseFunctionDefinition(tokens));
            } else {
                items.add(parseStatement(tokens));
            }
        }

        return new CompilationUnit(includes, usings, items);
    }

    // <> #include "<" name ("." name)* ">" | #include "file"
    private Include parseInclude(Tokens tokens) {
        var includeToken = tokens.next(TokenType.INCLUDE);
        if (tokens.matches(TokenType.STRING)) {
            return new Include("\"" + tokens.next().image() + "\"", includeToken.line());
        }
        tokens.next(TokenType.LT);
        var header = new StringBuilder(tokens.next(TokenType.IDENTIFIER).image());
        while (tokens.matches(TokenType.DOT)) {
            tokens.next();
            header.append('.').append(tokens.next(TokenType.IDENTIFIER).image());
        }
        tokens.next(TokenType.GT);
        return new Include("<" + header + ">", includeToken.line());
    }

    // <> using namespace name ;
    private Using parseUsing(Tokens tokens) {
        var usingToken = tokens.next(TokenType.USING);
        tokens.next(TokenType.NAMESPACE);
        var name = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.SEMICOLON);
        return new Using(name.image(), usingToken.line());
    }

    private boolean isFunctionDefinitionAhead(Tokens tokens) {
        return tokens.matches(TYPE_KEYWORDS)
                && tokens.peek(1).type() == TokenType.IDENTIFIER
                && tokens.peek(2).type() == TokenType.LPAREN;
    }

    // <> type name "(" (type name ("," type name)*)? ")" block
    private FunctionDefinition parseFunctionDefinition(Tokens tokens) {
        var typeToken = tokens.peek();
        var returnType = parseTypeName(tokens);
        var nameToken = tokens.next(TokenType.IDENTIFIER);

        List<Parameter> parameters = new ArrayList<>();
        tokens.next(TokenType.LPAREN);
        if (!tokens.matches(TokenType.RPAREN)) {
            parameters.add(parseParameter(tokens));
            while (tokens.matches(TokenType.COMMA)) {
                tokens.next();
                parameters.add(parseParameter(tokens));
            }
        }
        tokens.next(TokenType.RPAREN);

        var body = parseBlock(tokens);
        return new FunctionDefinition(returnType, nameToken.image(), parameters, body, typeToken.line());
    }

    private Parameter parseParameter(Tokens tokens) {
        var typeToken = tokens.peek();
        var type = parseTypeName(tokens);
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        return new Parameter(type, nameToken.image(), typeToken.line());
    }

    private TypeName parseTypeName(Tokens tokens) {
        var token = tokens.next();
        return switch (token.type()) {
            case INT -> TypeName.INT;
            case BOOL -> TypeName.BOOL;
            case CHAR -> TypeName.CHAR;
            case VOID -> TypeName.VOID;
            default -> throw unexpected(token, "a type");
        };
    }

    Statement parseStatement(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case LBRACE -> parseBlock(tokens);
            case IF -> parseIf(tokens);
            case FOR -> parseFor(tokens);
            case WHILE -> parseWhile(tokens);
            case DO -> parseDoWhile(tokens);
            case RETURN -> parseReturn(tokens);
            case CIN -> parseInput(tokens);
            case COUT -> parseOutput(tokens);
            case SEMICOLON -> {
                tokens.next();
                yield new Block(List.of(), token.line());
            }
            default -> {
                var statement = parseSimpleStatement(tokens);
                tokens.next(TokenType.SEMICOLON);
                yield statement;
            }
        };
    }

    // declaration, increment/decrement or expression; the caller owns the terminator
    private Statement parseSimpleStatement(Tokens tokens) {
        var token = tokens.peek();
        if (tokens.matches(TYPE_KEYWORDS)) {
            return parseDeclaration(tokens);
        }
        if (tokens.matches(TokenType.PLUS_PLUS, TokenType.MINUS_MINUS)) {
            var operator = tokens.next().type();
            var target = parseIdentifier(tokens);
            return new IncrementDecrement(target, operator, true, token.line());
        }
        if (token.type() == TokenType.IDENTIFIER
                && (tokens.peek(1).type() == TokenType.PLUS_PLUS || tokens.peek(1).type() == TokenType.MINUS_MINUS)) {
            var target = parseIdentifier(tokens);
            var operator = tokens.next().type();
            return new IncrementDecrement(target, operator, false, token.line());
        }
        return new ExpressionStatement(parseExpression(tokens), token.line());
    }

    // <> type name ("=" expression)? | type name "[" number "]" ("=" "{" expressions "}")?
    private Statement parseDeclaration(Tokens tokens) {
        var typeToken = tokens.peek();
        var type = parseTypeName(tokens);
        var nameToken = tokens.next(TokenType.IDENTIFIER);

        if (tokens.matches(TokenType.LBRACKET)) {
            tokens.next();
            var size = Long.parseLong(tokens.next(TokenType.NUMBER).image());
            tokens.next(TokenType.RBRACKET);
            Optional<List<Expression>> initializer = Optional.empty();
            if (tokens.matches(TokenType.EQUALS)) {
                tokens.next();
                initializer = Optional.of(parseInitializerList(tokens));
            }
            return new ArrayDeclaration(type, nameToken.image(), size, initializer, typeToken.line());
        }

        Optional<Expression> initializer = Optional.empty();
        if (tokens.matches(TokenType.EQUALS)) {
            tokens.next();
            initializer = Optional.of(parseExpression(tokens));
        }
        return new VariableDeclaration(type, nameToken.image(), initializer, typeToken.line());
    }

    private List<Expression> parseInitializerList(Tokens tokens) {
        tokens.next(TokenType.LBRACE);
        List<Expression> elements = new ArrayList<>();
        if (!tokens.matches(TokenType.RBRACE)) {
            elements.add(parseLogicalOr(tokens));
            while (tokens.matches(TokenType.COMMA)) {
                tokens.next();
                elements.add(parseLogicalOr(tokens));
            }
        }
        tokens.next(TokenType.RBRACE);
        return elements;
    }

    private Block parseBlock(Tokens tokens) {
        var lbrace = tokens.next(TokenType.LBRACE);
        var block = Block.open(lbrace.line());
        while (true) {
            var token = tokens.peek();
            if (token.type() == TokenType.RBRACE) {
                tokens.next();
                break;
            }
            if (token.type() == TokenType.EOF) {
                throw unexpected(token, "'}'");
            }
            block.add(parseStatement(tokens));
        }
        return block.close();
    }

    // the nearest unmatched if takes the else
    private IfStatement parseIf(Tokens tokens) {
        var ifToken = tokens.next(TokenType.IF);
        tokens.next(TokenType.LPAREN);
        var condition = parseExpression(tokens);
        tokens.next(TokenType.RPAREN);
        var thenBranch = parseStatement(tokens);
        Optional<Statement> elseBranch = Optional.empty();
        if (tokens.matches(TokenType.ELSE)) {
            tokens.next();
            elseBranch = Optional.of(parseStatement(tokens));
        }
        return new IfStatement(condition, thenBranch, elseBranch, ifToken.line());
    }

    // <> for "(" init? ";" condition? ";" step? ")" statement
    private ForStatement parseFor(Tokens tokens) {
        var forToken = tokens.next(TokenType.FOR);
        tokens.next(TokenType.LPAREN);

        Optional<Statement> init = Optional.empty();
        if (!tokens.matches(TokenType.SEMICOLON)) {
            init = Optional.of(parseSimpleStatement(tokens));
        }
        tokens.next(TokenType.SEMICOLON);

        Optional<Expression> condition = Optional.empty();
        if (!tokens.matches(TokenType.SEMICOLON)) {
            condition = Optional.of(parseExpression(tokens));
        }
        tokens.next(TokenType.SEMICOLON);

        Optional<Statement> step = Optional.empty();
        if (!tokens.matches(TokenType.RPAREN)) {
            step = Optional.of(parseSimpleStatement(tokens));
        }
        tokens.next(TokenType.RPAREN);

        var body = parseStatement(tokens);
        return new ForStatement(init, condition, step, body, forToken.line());
    }

    private WhileStatement parseWhile(Tokens tokens) {
        var whileToken = tokens.next(TokenType.WHILE);
        tokens.next(TokenType.LPAREN);
        var condition = parseExpression(tokens);
        tokens.next(TokenType.RPAREN);
        var body = parseStatement(tokens);
        return new WhileStatement(condition, body, whileToken.line());
    }

    // <> do statement while "(" expression ")" ";"?
    private DoWhileStatement parseDoWhile(Tokens tokens) {
        var doToken = tokens.next(TokenType.DO);
        var body = parseStatement(tokens);
        tokens.next(TokenType.WHILE);
        tokens.next(TokenType.LPAREN);
        var condition = parseExpression(tokens);
        tokens.next(TokenType.RPAREN);
        if (tokens.matches(TokenType.SEMICOLON)) {
            tokens.next();
        }
        return new DoWhileStatement(body, condition, doToken.line());
    }

    private ReturnStatement parseReturn(Tokens tokens) {
        var returnToken = tokens.next(TokenType.RETURN);
        Optional<Expression> value = Optional.empty();
        if (!tokens.matches(TokenType.SEMICOLON)) {
            value = Optional.of(parseExpression(tokens));
        }
        tokens.next(TokenType.SEMICOLON);
        return new ReturnStatement(value, returnToken.line());
    }

    // <> cin ">>" name ";"
    private InputStatement parseInput(Tokens tokens) {
        var cinToken = tokens.next(TokenType.CIN);
        tokens.next(TokenType.SHIFT_RIGHT);
        var target = parseIdentifier(tokens);
        tokens.next(TokenType.SEMICOLON);
        return new InputStatement(target, cinToken.line());
    }

    // <> cout ("<<" expression)+ ";"
    private OutputStatement parseOutput(Tokens tokens) {
        var coutToken = tokens.next(TokenType.COUT);
        List<Expression> arguments = new ArrayList<>();
        do {
            tokens.next(TokenType.SHIFT_LEFT);
            arguments.add(parseLogicalOr(tokens));
        } while (tokens.matches(TokenType.SHIFT_LEFT));
        tokens.next(TokenType.SEMICOLON);
        return new OutputStatement(arguments, coutToken.line());
    }

    Expression parseExpression(Tokens tokens) {
        return parseAssignment(tokens);
    }

    private Expression parseAssignment(Tokens tokens) {
        var expr = parseLogicalOr(tokens);

        if (tokens.matches(TokenType.EQUALS)) {
            var equals = tokens.next();
            if (expr instanceof Identifier id) {
                var right = parseAssignment(tokens);
                expr = new AssignmentExpression(id, right, equals.line());
            } else if (expr instanceof ArrayAccess aa) {
                var right = parseAssignment(tokens);
                expr = new ArrayAssignmentExpression(aa, right, equals.line());
            } else {
                throw new SyntaxException("left-hand side of assignment must be a variable or array element", equals.line());
            }
        }
        return expr;
    }

    private Expression parseLogicalOr(Tokens tokens) {
        var expr = parseLogicalAnd(tokens);

        while (tokens.matches(TokenType.OR_OR)) {
            var operator = tokens.next();
            var right = parseLogicalAnd(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, operator.line());
        }
        return expr;
    }

    private Expression parseLogicalAnd(Tokens tokens) {
        var expr = parseEquality(tokens);

        while (tokens.matches(TokenType.AND_AND)) {
            var operator = tokens.next();
            var right = parseEquality(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, operator.line());
        }
        return expr;
    }

    private Expression parseEquality(Tokens tokens) {
        var expr = parseRelational(tokens);

        while (tokens.matches(TokenType.EQUALS_EQUALS, TokenType.NOT_EQUALS)) {
            var operator = tokens.next();
            var right = parseRelational(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, operator.line());
        }
        return expr;
    }

    private Expression parseRelational(Tokens tokens) {
        var expr = parsePlus(tokens);

        while (tokens.matches(TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE)) {
            var operator = tokens.next();
            var right = parsePlus(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, operator.line());
        }
        return expr;
    }

    private Expression parsePlus(Tokens tokens) {
        var expr = parseTimes(tokens);

        while (tokens.matches(TokenType.PLUS, TokenType.MINUS)) {
            var operator = tokens.next();
            var right = parseTimes(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, operator.line());
        }
        return expr;
    }

    private Expression parseTimes(Tokens tokens) {
        var expr = parseUnary(tokens);

        while (tokens.matches(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            var operator = tokens.next();
            var right = parseUnary(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, operator.line());
        }
        return expr;
    }

    private Expression parseUnary(Tokens tokens) {
        if (tokens.matches(TokenType.BANG, TokenType.MINUS)) {
            var operator = tokens.next();
            var operand = parseUnary(tokens);
            return new UnaryExpression(operator.type(), operand, operator.line());
        }
        return parseAtom(tokens);
    }

    private Expression parseAtom(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case TRUE, FALSE -> {
                var booleanToken = tokens.next();
                yield new BooleanLiteral(booleanToken.type() == TokenType.TRUE, booleanToken.line());
            }
            case IDENTIFIER -> parseNameExpression(tokens);
            case NUMBER -> {
                var numberToken = tokens.next();
                yield new NumberLiteral(Long.parseLong(numberToken.image()), numberToken.line());
            }
            case CHAR_LITERAL -> {
                var charToken = tokens.next();
                yield new CharLiteral(charToken.image().charAt(0), charToken.line());
            }
            case STRING -> {
                var stringToken = tokens.next();
                yield new StringLiteral(stringToken.image(), stringToken.line());
            }
            case ABS -> {
                var absToken = tokens.next();
                tokens.next(TokenType.LPAREN);
                var argument = parseExpression(tokens);
                tokens.next(TokenType.RPAREN);
                yield new SystemFunctionCall(absToken.image(), argument, absToken.line());
            }
            case LPAREN -> {
                tokens.next(TokenType.LPAREN);
                var e = parseExpression(tokens);
                tokens.next(TokenType.RPAREN);
                yield e;
            }
            default -> throw unexpected(token, "an expression");
        };
    }

    // name | name "(" arguments ")" | name "[" expression "]"
    private Expression parseNameExpression(Tokens tokens) {
        var identifier = parseIdentifier(tokens);

        return switch (tokens.peek().type()) {
            case LPAREN -> parseFunctionCall(tokens, identifier);
            case LBRACKET -> {
                tokens.next();
                var index = parseExpression(tokens);
                tokens.next(TokenType.RBRACKET);
                yield new ArrayAccess(identifier, index, identifier.line());
            }
            default -> identifier;
        };
    }

    private Identifier parseIdentifier(Tokens tokens) {
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        return new Identifier(nameToken.image(), nameToken.line());
    }

    private FunctionCall parseFunctionCall(Tokens tokens, Identifier name) {
        tokens.next(TokenType.LPAREN);

        List<Expression> arguments = new ArrayList<>();
        if (!tokens.matches(TokenType.RPAREN)) {
            arguments.add(parseExpression(tokens));
            while (tokens.matches(TokenType.COMMA)) {
                tokens.next();
                arguments.add(parseExpression(tokens));
            }
        }
        tokens.next(TokenType.RPAREN);
        return new FunctionCall(name.name(), arguments, name.line());
    }

    private static SyntaxException unexpected(Token token, String expected) {
        if (token.type() == TokenType.EOF) {
            return new SyntaxException("unexpected end of input, expected " + expected, token.line());
        }
        return new SyntaxException("unexpected token '" + token.image() + "', expected " + expected, token.line());
    }

}
