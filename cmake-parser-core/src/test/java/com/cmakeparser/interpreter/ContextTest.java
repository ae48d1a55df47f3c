package com.cmakeparser.interpreter;

import com.cmakeparser.Parser;
import com.cmakeparser.ast.Function;
import com.cmakeparser.ast.Macro;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ContextTest {

    @Test
    void testRegisterParsedDefinitions() {
        Function function = (Function) Parser.parse("function(Build_All target)\nendfunction()").get(0);
        Macro macro = (Macro) Parser.parse("macro(helper)\nendmacro()").get(0);

        Context context = Context.builder().function(function).macro(macro).build();

        assertSame(function, context.functions().get("build_all"));
        assertTrue(context.isCommand("BUILD_ALL"));
        assertTrue(context.isCommand("Helper"));
        assertFalse(context.isCommand("missing"));
    }

    @Test
    void testUnresolvedDefinitionNameIsRejected() {
        Function function = (Function) Parser.parse("function(${name})\nendfunction()").get(0);
        assertThrows(IllegalArgumentException.class, () -> Context.builder().function(function));
    }

    @Test
    void testChildSharesEnvironmentAndCommands() {
        Context parent = Context.builder().env("PATH", "/bin").function("f").build();
        Context child = parent.child();

        child.env().put("NEW", "1");
        assertEquals("1", parent.env().get("NEW"));
        assertSame(parent.functions(), child.functions());
        assertNotSame(parent.var(), child.var());
    }

    @Test
    void testBuilderWithParentAndVariableMap() {
        Context global = Context.builder().var("G", "1").build();
        Context scope = Context.builder()
            .parent(global)
            .vars(Map.of("A", "x", "B", "y"))
            .var("A", "z")
            .build();

        assertSame(global, scope.parent());
        assertEquals("z", scope.var().get("A"));
        assertEquals("y", scope.var().get("B"));
        assertFalse(scope.var().containsKey("G"));
        assertNull(global.parent());
    }

    @Test
    void testFileSystemExistenceCheck(@TempDir Path dir) throws IOException {
        Path file = Files.createFile(dir.resolve("present.txt"));
        Context context = Context.empty();

        assertTrue(context.exists(file.toString()));
        assertFalse(context.exists(dir.resolve("absent.txt").toString()));
        assertFalse(ExistenceCheck.fileSystem().exists("bad\0path"));
    }
}
