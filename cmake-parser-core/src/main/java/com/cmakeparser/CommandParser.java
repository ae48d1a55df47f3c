package com.cmakeparser;

import com.cmakeparser.ast.Command;
import com.cmakeparser.ast.Comment;
import com.cmakeparser.ast.Node;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Groups the token stream into a flat sequence of {@link Command} and {@link Comment} nodes.
 *
 * <p>Only command name syntax and parenthesis balance are checked here; the meaning of
 * commands is left to {@link Parser}. Nested parentheses inside an argument list are kept
 * in the argument tokens so condition expressions can use them for grouping.
 */
public final class CommandParser implements Iterator<Node> {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String source;
    private final Lexer lexer;
    private final boolean skipComments;
    private Node lookahead;

    public CommandParser(String source) {
        this(source, false);
    }

    public CommandParser(String source, boolean skipComments) {
        this.source = source;
        this.lexer = new Lexer(source);
        this.skipComments = skipComments;
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null) {
            lookahead = parseNext();
        }
        return lookahead != null;
    }

    @Override
    public Node next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more commands");
        }
        Node node = lookahead;
        lookahead = null;
        return node;
    }

    private Node parseNext() {
        while (lexer.hasNext()) {
            Token token = lexer.next();
            if (token.is(TokenKind.COMMENT)) {
                if (skipComments) {
                    continue;
                }
                return new Comment(token.start(), token.end(), token.line(), token.column(), token.value());
            }
            return parseCommand(token);
        }
        return null;
    }

    private Command parseCommand(Token name) {
        if (name.is(TokenKind.UNMATCHED_BRACKET)) {
            throw error("Unmatched opening bracket", name);
        }
        if (!name.is(TokenKind.RAW)) {
            throw error("Expected command name", name);
        }
        if (!isIdentifier(name.value())) {
            throw error("Invalid command name identifier", name);
        }
        if (!lexer.hasNext()) {
            throw error("Expected '(' and got unexpected end of file", name);
        }
        Token lparen = lexer.next();
        if (!lparen.is(TokenKind.LPAREN)) {
            throw error("Expected '('", lparen);
        }
        List<Token> args = new ArrayList<>();
        Token rparen = collectArguments(name, args);
        return new Command(name.start(), rparen.end(), name.line(), name.column(), name.value(), args);
    }

    /**
     * Collects argument tokens up to the closing parenthesis that matches an already
     * consumed opening one. Inner parenthesis tokens are collected as arguments.
     *
     * @param name the command being parsed, for error reporting
     * @return the matching closing parenthesis
     */
    private Token collectArguments(Token name, List<Token> args) {
        while (lexer.hasNext()) {
            Token token = lexer.next();
            switch (token.kind()) {
                case RPAREN:
                    return token;
                case LPAREN:
                    args.add(token);
                    Token inner = collectArguments(name, args);
                    args.add(inner);
                    break;
                case SEMICOLON:
                case COMMENT:
                    break;
                case UNMATCHED_BRACKET:
                    throw error("Unmatched opening bracket", token);
                case UNPARSEABLE:
                    throw error("Unparseable argument", token);
                default:
                    args.add(token);
                    break;
            }
        }
        throw error("Expected ')' and got unexpected end of file", name);
    }

    private ParseException error(String message, Token token) {
        return new ParseException(message, token.line(), token.column(), token.span().slice(source));
    }
}
