package com.github.musiKk.minic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.log4j.Logger;

import com.github.musiKk.minic.parser.SyntaxException;

public class Tokenizer {

    private static final Logger log = Logger.getLogger(Tokenizer.class);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (var tokenType : TokenType.values()) {
            if (tokenType.keyword) {
                KEYWORDS.put(tokenType.constantPattern, tokenType);
            }
        }
    }

    List<Pattern> patterns = new ArrayList<>();

    {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && !tokenType.keyword) {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }

        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());
        patterns.add(new CharPattern());
        patterns.add(new StringPattern());
        patterns.add(new LineCommentPattern());
        patterns.add(new BlockCommentPattern());

        patterns.sort(Comparator.comparingInt(Pattern::priority).reversed());
    }

    public Tokens tokenize(String programString) {
        List<Token> tokens = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        int index = 0;
        int line = 1;
        while (index < programString.length()) {
            char c = programString.charAt(index);
            if (Character.isWhitespace(c)) {
                if (c == '\n') {
                    line++;
                }
                index++;
                continue;
            }

            Optional<Token> match = Optional.empty();
            for (var pattern : patterns) {
                match = pattern.match(programString, index, line);
                if (match.isPresent()) {
                    break;
                }
            }
            if (match.isEmpty()) {
                var diagnostic = Diagnostic.lexical("unrecognized character '" + c + "'", line);
                log.warn(diagnostic);
                diagnostics.add(diagnostic);
                index++;
                continue;
            }

            var token = match.get();
            if (token.type() == TokenType.NUMBER && !fitsInLong(token.image())) {
                var diagnostic = Diagnostic.lexical("integer literal " + token.image() + " is too large", line);
                log.warn(diagnostic);
                diagnostics.add(diagnostic);
                token = new Token(TokenType.NUMBER, "0", token.line(), token.start(), token.end());
            }
            if (token.type() == TokenType.COMMENT && isUnterminatedBlockComment(token.image())) {
                var diagnostic = Diagnostic.lexical("unterminated block comment", line);
                log.warn(diagnostic);
                diagnostics.add(diagnostic);
            }
            if (token.type() != TokenType.COMMENT) {
                tokens.add(token);
            }
            line += countNewlines(programString, token.start(), token.end());
            index = token.end();
        }

        tokens.add(new Token(TokenType.EOF, "", line, index, index));

        return new Tokens(tokens, diagnostics);
    }

    private static boolean fitsInLong(String digits) {
        try {
            Long.parseLong(digits);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // "/*/" is the shortest image that looks closed but is not
    private static boolean isUnterminatedBlockComment(String image) {
        return image.startsWith("/*") && (image.length() < 4 || !image.endsWith("*/"));
    }

    private static int countNewlines(String s, int start, int end) {
        int count = 0;
        for (int i = start; i < end; i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    interface Pattern {
        Optional<Token> match(String programString, int index, int line);

        /** Patterns are tried in descending priority. */
        int priority();
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (programString.startsWith(pattern, index)) {
                return Optional.of(new Token(tokenType, pattern, line, index, index + pattern.length()));
            } else {
                return Optional.empty();
            }
        }

        @Override
        public int priority() {
            return pattern.length();
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (Character.isDigit(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && Character.isDigit(programString.charAt(index))) {
                    index++;
                }
                return Optional.of(new Token(TokenType.NUMBER, programString.substring(start, index), line, start, index));
            } else {
                return Optional.empty();
            }
        }

        @Override
        public int priority() {
            return Integer.MIN_VALUE;
        }
    }

    // longest identifier first, then the keyword table decides
    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            char first = programString.charAt(index);
            if (first == '_' || Character.isLetter(first)) {
                int start = index;
                while (index < programString.length() && isIdentifierPart(programString.charAt(index))) {
                    index++;
                }
                var image = programString.substring(start, index);
                var type = KEYWORDS.getOrDefault(image, TokenType.IDENTIFIER);
                return Optional.of(new Token(type, image, line, start, index));
            } else {
                return Optional.empty();
            }
        }

        private static boolean isIdentifierPart(char c) {
            return c == '_' || Character.isLetterOrDigit(c);
        }

        @Override
        public int priority() {
            return Integer.MIN_VALUE;
        }
    }

    static class CharPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (programString.charAt(index) != '\'') {
                return Optional.empty();
            }
            int start = index;
            index++;
            if (index >= programString.length()) {
                return Optional.empty();
            }
            char value = programString.charAt(index);
            if (value == '\'' || value == '\n') {
                return Optional.empty();
            }
            if (value == '\\') {
                index++;
                if (index >= programString.length()) {
                    return Optional.empty();
                }
                value = unescape(programString.charAt(index));
            }
            index++;
            if (index >= programString.length() || programString.charAt(index) != '\'') {
                return Optional.empty();
            }
            index++;
            return Optional.of(new Token(TokenType.CHAR_LITERAL, String.valueOf(value), line, start, index));
        }

        private static char unescape(char c) {
            return switch (c) {
                case 'n' -> '\n';
                case 't' -> '\t';
                case 'r' -> '\r';
                case '0' -> '\0';
                default -> c;
            };
        }

        @Override
        public int priority() {
            return Integer.MIN_VALUE;
        }
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (programString.charAt(index) == '"') {
                int end = programString.indexOf('"', index + 1);
                if (end < 0) {
                    return Optional.empty();
                }
                return Optional.of(new Token(TokenType.STRING, programString.substring(index + 1, end), line, index, end + 1));
            } else {
                return Optional.empty();
            }
        }

        @Override
        public int priority() {
            return Integer.MIN_VALUE;
        }
    }

    static class LineCommentPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (programString.startsWith("//", index)) {
                int start = index;
                index += 2;
                while (index < programString.length() && programString.charAt(index) != '\n') {
                    index++;
                }
                return Optional.of(new Token(TokenType.COMMENT, programString.substring(start, index), line, start, index));
            } else {
                return Optional.empty();
            }
        }

        @Override
        public int priority() {
            return Integer.MAX_VALUE;
        }
    }

    static class BlockCommentPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, int line) {
            if (programString.startsWith("/*", index)) {
                int close = programString.indexOf("*/", index + 2);
                int end = close < 0 ? programString.length() : close + 2;
                return Optional.of(new Token(TokenType.COMMENT, programString.substring(index, end), line, index, end));
            } else {
                return Optional.empty();
            }
        }

        @Override
        public int priority() {
            return Integer.MAX_VALUE;
        }
    }

    public record Token(TokenType type, String image, int line, int start, int end) {}

    public enum TokenType {
        INCLUDE("#include"),
        USING("using", true), NAMESPACE("namespace", true),

        INT("int", true), BOOL("bool", true), CHAR("char", true), VOID("void", true),
        IF("if", true), ELSE("else", true),
        FOR("for", true), WHILE("while", true), DO("do", true),
        RETURN("return", true),
        CIN("cin", true), COUT("cout", true),
        TRUE("true", true), FALSE("false", true),
        ABS("abs", true),

        NUMBER,
        CHAR_LITERAL,
        STRING,

        SHIFT_LEFT("<<"), SHIFT_RIGHT(">>"),
        PLUS_PLUS("++"), MINUS_MINUS("--"),
        AND_AND("&&"), OR_OR("||"),
        EQUALS_EQUALS("=="), NOT_EQUALS("!="),
        LT("<"), GT(">"), LE("<="), GE(">="),
        PLUS("+"), MINUS("-"),
        STAR("*"), SLASH("/"), PERCENT("%"),
        BANG("!"),

        COMMENT,

        LBRACE("{"),
        RBRACE("}"),
        LPAREN("("),
        RPAREN(")"),
        LBRACKET("["),
        RBRACKET("]"),

        SEMICOLON(";"),
        EQUALS("="),
        IDENTIFIER,
        DOT("."),
        COMMA(","),
        EOF;

        public final String constantPattern;
        final boolean keyword;

        private TokenType() {
            this(null);
        }
        private TokenType(String constantPattern) {
            this(constantPattern, false);
        }
        private TokenType(String constantPattern, boolean keyword) {
            this.constantPattern = constantPattern;
            this.keyword = keyword;
        }
    }

    public static class Tokens {
        final List<Token> tokens;
        final List<Diagnostic> diagnostics;
        int index;

        Tokens(List<Token> tokens, List<Diagnostic> diagnostics) {
            this.tokens = tokens;
            this.diagnostics = diagnostics;
        }

        public List<Token> tokens() {
            return List.copyOf(tokens);
        }

        public List<Diagnostic> diagnostics() {
            return List.copyOf(diagnostics);
        }

        /** Restarts reading from the first token. */
        public void rewind() {
            index = 0;
        }

        public Token next() {
            var token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        public Token peek() {
            return peek(0);
        }

        public Token peek(int offset) {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public Token peek(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw unexpected(type, token);
            }
            return token;
        }

        public Token next(TokenType type) {
            var token = next();
            if (token.type() != type) {
                throw unexpected(type, token);
            }
            return token;
        }

        private static SyntaxException unexpected(TokenType expected, Token actual) {
            if (actual.type() == TokenType.EOF) {
                return new SyntaxException("unexpected end of input, expected " + expected, actual.line());
            }
            return new SyntaxException("expected " + expected + " but got '" + actual.image() + "'", actual.line());
        }
    }

}
