package com.cmakeparser.interpreter;

import com.cmakeparser.ResolveException;
import com.cmakeparser.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Substitutes {@code ${VAR}}, {@code $ENV{VAR}} and {@code $CACHE{VAR}} references in
 * argument tokens and applies CMake's list semantics to unquoted arguments.
 *
 * <p>References nest: in {@code ${OUTER_${INNER}}} the inner reference is resolved
 * first and its value becomes part of the outer variable name. Unknown variables
 * expand to the empty string.
 *
 * <p>Escape sequences are decoded during substitution: {@code \r}, {@code \n} and
 * {@code \t} become control characters, {@code \;} stays escaped until the list is
 * split, and any other {@code \X} becomes {@code X}.
 */
public final class VariableResolver {

    private static final Logger LOG = LoggerFactory.getLogger(VariableResolver.class);

    private final Context context;
    private final Token token;
    private final String text;
    private final int length;
    private int offset = 0;

    private VariableResolver(Context context, Token token) {
        this.context = context;
        this.token = token;
        this.text = token.value();
        this.length = text.length();
    }

    /**
     * Resolves the arguments of a command.
     *
     * <p>Quoted tokens stay one argument. Unquoted tokens are split at unescaped
     * semicolons into one token per list element, empty elements are dropped, and
     * {@code \;} becomes a literal {@code ;}. Other tokens pass through unchanged.
     * Every produced token keeps the position of the token it came from.
     *
     * @throws ResolveException if a variable reference is not terminated
     */
    public static List<Token> resolve(Context context, List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            switch (token.kind()) {
                case RAW:
                    for (String element : splitList(substitute(context, token))) {
                        result.add(token.withValue(element));
                    }
                    break;
                case QUOTED:
                    result.add(token.withValue(substitute(context, token)));
                    break;
                default:
                    result.add(token);
                    break;
            }
        }
        return result;
    }

    /**
     * Substitutes variable references in the value of a single token without splitting it.
     */
    public static String substitute(Context context, Token token) {
        if (token.value() == null) {
            return null;
        }
        return new VariableResolver(context, token).scan(-1);
    }

    /**
     * Splits a CMake list at unescaped semicolons. Empty elements are dropped and
     * {@code \;} is unescaped to {@code ;}.
     */
    public static List<String> splitList(String value) {
        List<String> elements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < value.length()) {
            char ch = value.charAt(i);
            if (ch == '\\' && i + 1 < value.length()) {
                char next = value.charAt(i + 1);
                if (next == ';') {
                    current.append(';');
                } else {
                    current.append(ch).append(next);
                }
                i += 2;
                continue;
            }
            if (ch == ';') {
                addElement(elements, current);
            } else {
                current.append(ch);
            }
            i++;
        }
        addElement(elements, current);
        return elements;
    }

    private static void addElement(List<String> elements, StringBuilder current) {
        if (current.length() > 0) {
            elements.add(current.toString());
            current.setLength(0);
        }
    }

    /**
     * Scans from the current offset, substituting references on the way.
     *
     * @param referenceStart offset of the dollar sign of the enclosing reference when
     *     scanning a variable name, or -1 at top level, where a closing brace is literal
     */
    private String scan(int referenceStart) {
        StringBuilder result = new StringBuilder();
        while (offset < length) {
            char ch = text.charAt(offset);
            if (ch == '\\' && offset + 1 < length) {
                appendEscape(result, text.charAt(offset + 1));
                offset += 2;
                continue;
            }
            if (ch == '$') {
                int typeEnd = offset + 1;
                while (typeEnd < length && isAsciiLetter(text.charAt(typeEnd))) {
                    typeEnd++;
                }
                if (typeEnd < length && text.charAt(typeEnd) == '{') {
                    int start = offset;
                    String type = text.substring(offset + 1, typeEnd);
                    offset = typeEnd + 1;
                    String name = scan(start);
                    result.append(lookup(type, name));
                    continue;
                }
            }
            if (ch == '}' && referenceStart >= 0) {
                offset++;
                return result.toString();
            }
            result.append(ch);
            offset++;
        }
        if (referenceStart >= 0) {
            throw new ResolveException("Variable reference without terminating '}'",
                token, text.substring(referenceStart));
        }
        return result.toString();
    }

    private static void appendEscape(StringBuilder result, char escaped) {
        switch (escaped) {
            case 'r':
                result.append('\r');
                break;
            case 'n':
                result.append('\n');
                break;
            case 't':
                result.append('\t');
                break;
            case ';':
                // Still escaped: the list splitter turns it into a literal semicolon
                result.append("\\;");
                break;
            default:
                result.append(escaped);
                break;
        }
    }

    private String lookup(String type, String name) {
        Map<String, String> scope;
        switch (type) {
            case "":
                scope = context.var();
                break;
            case "ENV":
                scope = context.env();
                break;
            case "CACHE":
                scope = context.cache();
                break;
            default:
                LOG.debug("Unknown variable reference type ${}{{}} at line {}, expanding to empty string",
                    type, name, token.line());
                return "";
        }
        return scope.getOrDefault(name, "");
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }
}
