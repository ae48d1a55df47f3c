package com.cmakeparser;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Scanner for CMake source text.
 *
 * <p>The lexer is a lazy iterator: each call to {@link #next()} matches one more token
 * from the current position. Whitespace is consumed silently. The lexer never throws
 * on bad input; text it cannot match is returned as a single trailing
 * {@link TokenKind#UNPARSEABLE} token (or {@link TokenKind#UNMATCHED_BRACKET} when the
 * remainder opens a bracket argument or bracket comment that is never closed), and the
 * caller decides whether that is fatal.
 */
public final class Lexer implements Iterator<Token> {

    // Alternatives are tried in order, the first one that matches at the current
    // position wins. Quoted and raw arguments use possessive loops so very long
    // arguments do not blow the regex engine's stack.
    private static final Pattern TOKEN = Pattern.compile(
        "(?<space>\\s+)"
            + "|(?<lparen>\\()"
            + "|(?<rparen>\\))"
            + "|(?<semicolon>;)"
            + "|(?<quoted>\"[^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+\")"
            + "|(?<bracketComment>#\\[(?<commentFill>=*)\\[.*?\\]\\k<commentFill>\\])"
            + "|(?<bracketed>\\[(?<bracketFill>=*)\\[.*?\\]\\k<bracketFill>\\])"
            + "|(?<lineComment>#(?!\\[=*\\[)[^\\r\\n]*)"
            + "|(?<raw>(?:[^\\\\()\"# \\t\\r\\n;]++|\\\\.)++)",
        Pattern.DOTALL
    );

    private static final Pattern BRACKET_OPEN = Pattern.compile("#?\\[=*\\[");

    private final String source;
    private final int length;
    private final Matcher matcher;
    private int pos = 0;

    // Line tracking: [lineStart, lineEnd) is the content of the current line,
    // nextLineStart is the first offset after its line break.
    private int line = 1;
    private int lineStart = 0;
    private int lineEnd;
    private int nextLineStart;

    private Token lookahead;
    private boolean exhausted = false;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
        this.matcher = TOKEN.matcher(source);
        findLineEnd(0);
    }

    /**
     * Returns the tokens of {@code source} as a lazy stream.
     */
    public static Stream<Token> tokenize(String source) {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(new Lexer(source), Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }

    /**
     * Converts CRLF line endings to LF.
     */
    public static String normalizeLineEndings(String source) {
        return source.replace("\r\n", "\n");
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null && !exhausted) {
            lookahead = scanToken();
        }
        return lookahead != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens");
        }
        Token token = lookahead;
        lookahead = null;
        return token;
    }

    private Token scanToken() {
        while (pos < length) {
            matcher.region(pos, length);
            if (!matcher.lookingAt()) {
                Token rest = remainder();
                pos = length;
                exhausted = true;
                return rest;
            }
            int start = pos;
            int end = matcher.end();
            Token token = matcher.group("space") == null ? buildToken(start, end) : null;
            pos = end;
            advanceLines(pos);
            if (token != null) {
                return token;
            }
        }
        exhausted = true;
        return null;
    }

    private Token buildToken(int start, int end) {
        String text = source.substring(start, end);
        TokenKind kind;
        String value;
        if (matcher.group("lparen") != null) {
            kind = TokenKind.LPAREN;
            value = text;
        } else if (matcher.group("rparen") != null) {
            kind = TokenKind.RPAREN;
            value = text;
        } else if (matcher.group("semicolon") != null) {
            kind = TokenKind.SEMICOLON;
            value = text;
        } else if (matcher.group("quoted") != null) {
            kind = TokenKind.QUOTED;
            value = removeLineContinuations(text.substring(1, text.length() - 1));
        } else if (matcher.group("bracketComment") != null) {
            kind = TokenKind.COMMENT;
            value = stripBracket(text.substring(1), matcher.group("commentFill").length());
        } else if (matcher.group("bracketed") != null) {
            kind = TokenKind.BRACKETED;
            value = stripBracket(text, matcher.group("bracketFill").length());
        } else if (matcher.group("lineComment") != null) {
            kind = TokenKind.COMMENT;
            value = text.substring(1);
        } else {
            kind = BRACKET_OPEN.matcher(text).lookingAt() ? TokenKind.UNMATCHED_BRACKET : TokenKind.RAW;
            value = text;
        }
        return new Token(kind, value, start, end, line, start + 1 - lineStart);
    }

    private Token remainder() {
        String text = source.substring(pos);
        if (BRACKET_OPEN.matcher(text).lookingAt()) {
            return new Token(TokenKind.UNMATCHED_BRACKET, text, pos, length, line, pos + 1 - lineStart);
        }
        return new Token(TokenKind.UNPARSEABLE, null, pos, length, line, pos + 1 - lineStart);
    }

    /**
     * Strips {@code [==[} and {@code ]==]} from a bracket argument, along with a newline
     * that immediately follows the opening bracket.
     */
    private static String stripBracket(String text, int fill) {
        String content = text.substring(fill + 2, text.length() - fill - 2);
        if (content.startsWith("\r\n")) {
            return content.substring(2);
        }
        if (content.startsWith("\n")) {
            return content.substring(1);
        }
        return content;
    }

    /**
     * Deletes backslash-newline pairs. All other escape sequences are kept verbatim,
     * they are decoded during variable resolution.
     */
    private static String removeLineContinuations(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == '\n') {
                    i += 2;
                    continue;
                }
                if (next == '\r' && i + 2 < text.length() && text.charAt(i + 2) == '\n') {
                    i += 3;
                    continue;
                }
                sb.append(ch).append(next);
                i += 2;
                continue;
            }
            sb.append(ch);
            i++;
        }
        return sb.toString();
    }

    private void advanceLines(int offset) {
        while (lineEnd < offset && nextLineStart <= length && nextLineStart > lineStart) {
            line++;
            lineStart = nextLineStart;
            findLineEnd(lineStart);
        }
    }

    private void findLineEnd(int from) {
        int newline = source.indexOf('\n', from);
        if (newline < 0) {
            lineEnd = length;
            nextLineStart = from;
            return;
        }
        lineEnd = newline > from && source.charAt(newline - 1) == '\r' ? newline - 1 : newline;
        nextLineStart = newline + 1;
    }
}
