package com.cmakeparser;

import com.cmakeparser.ast.Command;
import com.cmakeparser.ast.Comment;
import com.cmakeparser.ast.Node;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CommandParserTest {

    private static List<Node> parse(String source) {
        return Parser.parseFlat(source).collect(Collectors.toList());
    }

    private static List<String> values(Command command) {
        return command.args().stream().map(Token::value).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Command span runs from the name to the closing parenthesis")
    void testCommandSpan() {
        String source = "  message(hello world)\n";
        List<Node> nodes = parse(source);

        assertEquals(1, nodes.size());
        Command command = (Command) nodes.get(0);
        assertEquals("message", command.identifier());
        assertEquals(List.of("hello", "world"), values(command));
        assertEquals(new Span(2, 22), command.span());
        assertEquals("message(hello world)", command.span().slice(source));
        assertEquals(1, command.line());
        assertEquals(3, command.column());
    }

    @Test
    void testNameCaseIsKept() {
        Command command = (Command) parse("Add_Executable(app main.c)").get(0);
        assertEquals("Add_Executable", command.identifier());
    }

    @Test
    @DisplayName("Nested parentheses stay in the argument tokens")
    void testNestedParentheses() {
        Command command = (Command) parse("if((A OR B) AND C)").get(0);

        assertEquals(List.of("(", "A", "OR", "B", ")", "AND", "C"), values(command));
        assertEquals(TokenKind.LPAREN, command.args().get(0).kind());
        assertEquals(TokenKind.RPAREN, command.args().get(4).kind());
    }

    @Test
    void testSemicolonsAndCommentsAreDropped() {
        Command command = (Command) parse("set(x a;b # trailing\n  c)").get(0);
        assertEquals(List.of("x", "a", "b", "c"), values(command));
    }

    @Test
    void testArgumentKindsArePreserved() {
        Command command = (Command) parse("f(raw \"quoted\" [[bracket]])").get(0);
        assertEquals(List.of(TokenKind.RAW, TokenKind.QUOTED, TokenKind.BRACKETED),
            command.args().stream().map(Token::kind).collect(Collectors.toList()));
    }

    @Test
    void testCommentsBetweenCommands() {
        List<Node> nodes = parse("# first\nfoo()\n#[[second]]\nbar()");

        assertEquals(4, nodes.size());
        assertEquals(" first", ((Comment) nodes.get(0)).comment());
        assertEquals("second", ((Comment) nodes.get(2)).comment());
        assertEquals(3, nodes.get(2).line());
    }

    @Test
    void testSkipComments() {
        List<Node> nodes = Parser.parseFlat("# first\nfoo()\n# last", true).collect(Collectors.toList());
        assertEquals(1, nodes.size());
        assertInstanceOf(Command.class, nodes.get(0));
    }

    @Test
    void testCommandsOnOneLine() {
        List<Node> nodes = parse("a() b()c()");
        assertEquals(3, nodes.size());
        assertEquals(8, nodes.get(2).column());
    }

    @Test
    void testIdentifiers() {
        assertTrue(CommandParser.isIdentifier("a"));
        assertTrue(CommandParser.isIdentifier("_private"));
        assertTrue(CommandParser.isIdentifier("target_link_libraries2"));
        assertFalse(CommandParser.isIdentifier("1abc"));
        assertFalse(CommandParser.isIdentifier("a-b"));
        assertFalse(CommandParser.isIdentifier(""));
        assertFalse(CommandParser.isIdentifier(null));
    }

    // ==================== Errors ====================

    @Test
    void testQuotedCommandName() {
        ParseException e = assertThrows(ParseException.class, () -> parse("\"foo\"()"));
        assertTrue(e.getMessage().startsWith("Expected command name"), e.getMessage());
    }

    @Test
    void testInvalidCommandName() {
        ParseException e = assertThrows(ParseException.class, () -> parse("ok()\n1abc()"));
        assertTrue(e.getMessage().startsWith("Invalid command name identifier"), e.getMessage());
        assertEquals(2, e.line());
        assertEquals(1, e.column());
        assertEquals("1abc", e.text());
    }

    @Test
    void testMissingOpeningParenthesisAtEnd() {
        ParseException e = assertThrows(ParseException.class, () -> parse("foo"));
        assertTrue(e.getMessage().startsWith("Expected '(' and got unexpected end of file"), e.getMessage());
    }

    @Test
    void testMissingOpeningParenthesis() {
        ParseException e = assertThrows(ParseException.class, () -> parse("foo bar"));
        assertTrue(e.getMessage().startsWith("Expected '('"), e.getMessage());
        assertEquals("bar", e.text());
    }

    @Test
    @DisplayName("Missing ')' is reported at the command name")
    void testMissingClosingParenthesis() {
        ParseException e = assertThrows(ParseException.class, () -> parse("\nfoo(a (b)"));
        assertTrue(e.getMessage().startsWith("Expected ')'"), e.getMessage());
        assertEquals(2, e.line());
        assertEquals("foo", e.text());
    }

    @Test
    void testUnmatchedBracketInArguments() {
        ParseException e = assertThrows(ParseException.class, () -> parse("foo([[x)"));
        assertTrue(e.getMessage().startsWith("Unmatched opening bracket"), e.getMessage());
    }

    @Test
    void testUnmatchedBracketComment() {
        ParseException e = assertThrows(ParseException.class, () -> parse("#[==[unterminated"));
        assertTrue(e.getMessage().startsWith("Unmatched opening bracket"), e.getMessage());
    }

    @Test
    void testUnparseableArgument() {
        ParseException e = assertThrows(ParseException.class, () -> parse("foo(\"abc)"));
        assertTrue(e.getMessage().startsWith("Unparseable argument"), e.getMessage());
        assertEquals(5, e.column());
    }

    @Test
    @DisplayName("Errors surface only when the stream reaches the bad command")
    void testLazyParsing() {
        List<Node> nodes = Parser.parseFlat("a()\nb()\n1bad()").limit(2).collect(Collectors.toList());
        assertEquals(2, nodes.size());
    }
}
