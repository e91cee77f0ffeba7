package com.example.research_insights_backend.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ExclusionScopeTest {

    @Test
    public void testFromTokenMatchesEachScopeToken() {
        for (ExclusionScope scope : ExclusionScope.values()) {
            assertEquals(scope, ExclusionScope.fromToken(scope.getToken()));
        }
    }

    @Test
    public void testFromTokenIgnoresCaseAndWhitespace() {
        assertEquals(ExclusionScope.PER_AUTHOR, ExclusionScope.fromToken("  PER-AUTHOR "));
        assertEquals(ExclusionScope.GLOBAL, ExclusionScope.fromToken("Global"));
    }

    @Test
    public void testUnknownTokenIsGlobal() {
        assertEquals(ExclusionScope.GLOBAL, ExclusionScope.fromToken(null));
        assertEquals(ExclusionScope.GLOBAL, ExclusionScope.fromToken(""));
        assertEquals(ExclusionScope.GLOBAL, ExclusionScope.fromToken("per_author"));
        assertEquals(ExclusionScope.GLOBAL, ExclusionScope.fromToken("author"));
    }
}
