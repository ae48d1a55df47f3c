package com.cmakeparser;

import com.cmakeparser.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Folds the flat command stream into structured nodes.
 *
 * <p>Block boundaries are found by keyword pairs only: a block started by
 * {@code foreach()} collects elements until the {@code endforeach()} at its own
 * nesting level. Inner blocks of the same kind are consumed by the recursive call
 * that handles them, so they never close the outer one.
 *
 * <p>The parser is a lazy iterator over top-level nodes; only the body of the block
 * currently being parsed is held in memory.
 */
public final class Parser implements Iterator<Node> {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    // An unescaped '$', i.e. one preceded by an even number of backslashes
    private static final Pattern VAR_REF = Pattern.compile("(?<!\\\\)(?:\\\\\\\\)*\\$");

    @FunctionalInterface
    private interface Transformer {
        Node transform(Parser parser, Command command);
    }

    @FunctionalInterface
    private interface ArgumentParser {
        Expr parse(List<Token> args);
    }

    @FunctionalInterface
    private interface CompoundFactory {
        Compound create(int start, int end, int line, int column, Expr args, List<Node> body);
    }

    private static final Map<String, Transformer> BUILTINS = Map.of(
        "block", (p, c) -> p.parseCompound(c, Parser::parseUnparsedExpr, Block::new),
        "macro", (p, c) -> p.parseCompound(c, Parser::parseCallSignatureExpr, Macro::new),
        "foreach", (p, c) -> p.parseCompound(c, Parser::parseUnparsedExpr, ForEach::new),
        "function", (p, c) -> p.parseCompound(c, Parser::parseCallSignatureExpr, Function::new),
        "while", (p, c) -> p.parseCompound(c, Parser::parseBooleanExpr, While::new),
        "break", (p, c) -> p.parseNoArgs(c, Break::new),
        "continue", (p, c) -> p.parseNoArgs(c, Continue::new),
        "return", (p, c) -> new Return(c.start(), c.end(), c.line(), c.column(), c.args()),
        "if", Parser::parseIf
    );

    private static final List<String> IF_TERMINATORS = List.of("else", "elseif", "endif");
    private static final List<String> ELSE_TERMINATORS = List.of("endif");

    private final String source;
    private final CommandParser commands;

    public Parser(String source) {
        this(source, false);
    }

    public Parser(String source, boolean skipComments) {
        this.source = source;
        this.commands = new CommandParser(source, skipComments);
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    /**
     * Scans {@code source} into a lazy token stream. Never throws; bad input ends the
     * stream with an {@link TokenKind#UNPARSEABLE} or {@link TokenKind#UNMATCHED_BRACKET} token.
     */
    public static Stream<Token> scan(String source) {
        return Lexer.tokenize(source);
    }

    public static Stream<Node> parseFlat(String source) {
        return parseFlat(source, false);
    }

    /**
     * Parses {@code source} into a lazy stream of {@link Command} and {@link Comment} nodes.
     *
     * @throws ParseException while the stream is consumed, if the script is malformed
     */
    public static Stream<Node> parseFlat(String source, boolean skipComments) {
        return stream(new CommandParser(source, skipComments));
    }

    public static Stream<Node> parseTree(String source) {
        return parseTree(source, false);
    }

    /**
     * Parses {@code source} into a lazy stream of structured nodes.
     *
     * @throws ParseException while the stream is consumed, if the script is malformed
     *     or a block is not terminated
     */
    public static Stream<Node> parseTree(String source, boolean skipComments) {
        return stream(new Parser(source, skipComments));
    }

    /**
     * Parses the whole script eagerly.
     */
    public static List<Node> parse(String source) {
        return parse(source, false);
    }

    public static List<Node> parse(String source, boolean skipComments) {
        List<Node> nodes = new ArrayList<>();
        new Parser(source, skipComments).forEachRemaining(nodes::add);
        return nodes;
    }

    private static <T> Stream<T> stream(Iterator<T> iterator) {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }

    // ========================================================================
    // Iteration
    // ========================================================================

    @Override
    public boolean hasNext() {
        return commands.hasNext();
    }

    @Override
    public Node next() {
        if (!commands.hasNext()) {
            throw new NoSuchElementException("No more nodes");
        }
        Node element = commands.next();
        if (element instanceof Command command) {
            return transform(command);
        }
        return element;
    }

    private Node transform(Command command) {
        Transformer transformer = BUILTINS.get(keyword(command));
        return transformer != null ? transformer.transform(this, command) : command;
    }

    private static String keyword(Command command) {
        return command.identifier().toLowerCase(Locale.ROOT);
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    /** Elements of a block body and the command that ended it. */
    private record Body(List<Node> nodes, Command terminator) {}

    /**
     * Collects elements until one of the {@code terminators} appears at this nesting level.
     *
     * @param opening the command that opened the block, reported if input ends first
     */
    private Body parseBody(Command opening, List<String> terminators) {
        List<Node> nodes = new ArrayList<>();
        while (commands.hasNext()) {
            Node element = commands.next();
            if (element instanceof Command command) {
                if (terminators.contains(keyword(command))) {
                    return new Body(nodes, command);
                }
                nodes.add(transform(command));
            } else {
                nodes.add(element);
            }
        }
        String expected = terminators.stream()
            .map(t -> "'" + t + "()'")
            .collect(Collectors.joining(" nor "));
        throw error("No " + expected + " for command", opening);
    }

    private Compound parseCompound(Command command, ArgumentParser argumentParser, CompoundFactory factory) {
        Expr args = parseArgs(command, argumentParser);
        Body body = parseBody(command, List.of("end" + keyword(command)));
        LOG.debug("Parsed {}() block at line {} with {} elements",
            keyword(command), command.line(), body.nodes().size());
        return factory.create(
            command.start(),
            body.terminator().end(),
            command.line(),
            command.column(),
            args,
            body.nodes()
        );
    }

    private If parseIf(Command command) {
        Expr condition = parseArgs(command, Parser::parseBooleanExpr);
        Body ifTrue = parseBody(command, IF_TERMINATORS);
        Command terminator = ifTrue.terminator();
        String keyword = keyword(terminator);

        if (keyword.equals("elseif")) {
            // The nested If owns the rest of the chain; this node ends with its own branch
            List<Node> branch = ifTrue.nodes();
            int end = branch.isEmpty() ? command.end() : branch.get(branch.size() - 1).end();
            If elseIf = parseIf(terminator);
            return new If(command.start(), end, command.line(), command.column(),
                condition, branch, List.of(elseIf));
        }

        List<Node> ifFalse = null;
        if (keyword.equals("else")) {
            Body elseBody = parseBody(command, ELSE_TERMINATORS);
            ifFalse = elseBody.nodes();
            terminator = elseBody.terminator();
        }
        return new If(command.start(), terminator.end(), command.line(), command.column(),
            condition, ifTrue.nodes(), ifFalse);
    }

    private Node parseNoArgs(Command command, LeafFactory factory) {
        if (!command.args().isEmpty()) {
            throw error("Builtin command accepts no arguments", command);
        }
        return factory.create(command.start(), command.end(), command.line(), command.column());
    }

    @FunctionalInterface
    private interface LeafFactory {
        Builtin create(int start, int end, int line, int column);
    }

    // ========================================================================
    // Argument interpreters
    // ========================================================================

    private Expr parseArgs(Command command, ArgumentParser argumentParser) {
        try {
            return argumentParser.parse(command.args());
        } catch (IllegalArgumentException e) {
            throw error(e.getMessage(), command);
        }
    }

    /**
     * Returns true if a raw token holds an unescaped {@code $}, i.e. a variable
     * reference that must be substituted before the arguments can be interpreted.
     */
    public static boolean hasVariableReference(Token token) {
        return token.value() != null && VAR_REF.matcher(token.value()).find();
    }

    private static boolean hasVariableReference(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.is(TokenKind.RAW) && hasVariableReference(token)) {
                return true;
            }
        }
        return false;
    }

    static Expr parseUnparsedExpr(List<Token> args) {
        return new UnparsedExpr(args);
    }

    /**
     * Conditions are evaluated by {@link com.cmakeparser.interpreter.ExpressionEvaluator}
     * after variable resolution, so they are kept as tokens here.
     */
    static Expr parseBooleanExpr(List<Token> args) {
        return new UnparsedExpr(args);
    }

    /**
     * Interprets {@code name param...} of a function or macro definition.
     *
     * @throws IllegalArgumentException if the list is empty or holds a non-identifier
     */
    static Expr parseCallSignatureExpr(List<Token> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("Argument list must not be empty");
        }
        if (hasVariableReference(args)) {
            return new UnparsedExpr(args);
        }
        List<String> params = new ArrayList<>(args.size() - 1);
        for (Token token : args) {
            if (!CommandParser.isIdentifier(token.value())) {
                throw new IllegalArgumentException("Argument list has invalid identifiers");
            }
        }
        for (Token token : args.subList(1, args.size())) {
            params.add(token.value());
        }
        return new CallSignature(args.get(0).value().toLowerCase(Locale.ROOT), params);
    }

    private ParseException error(String message, Node node) {
        return new ParseException(message, node.line(), node.column(), node.span().slice(source));
    }
}
