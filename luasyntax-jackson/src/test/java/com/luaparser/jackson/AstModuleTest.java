package com.luaparser.jackson;

import com.luaparser.ast.SyntaxKind;
import com.luaparser.ast.SyntaxNodeOrToken;
import com.luaparser.ast.Token;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AstModuleTest {

    @Test
    void walksHierarchyFromTheRoot() {
        List<Class<?>> types = AstModule.syntaxTypes();

        assertEquals(SyntaxNodeOrToken.class, types.get(0));
        assertTrue(types.contains(Token.class));
        assertEquals(types.size(), types.stream().distinct().count());
    }

    @Test
    void everyNodeKindHasOneRecord() {
        List<Class<?>> records = AstModule.syntaxTypes().stream()
            .filter(Class::isRecord)
            .collect(Collectors.toList());
        long nodeKinds = Arrays.stream(SyntaxKind.values()).filter(SyntaxKind::isNode).count();

        // plus Token
        assertEquals(nodeKinds + 1, records.size());
        assertEquals(records.size(), records.stream().map(Class::getSimpleName).distinct().count());
    }
}
