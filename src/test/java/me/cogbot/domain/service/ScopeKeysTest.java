package me.cogbot.domain.service;

import me.cogbot.domain.model.NamedScope;
import me.cogbot.domain.model.TypedScope;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScopeKeysTest {

    @Test
    void storageKey_joinsKindAndId() {
        assertEquals("guild_123", ScopeKeys.storageKey(TypedScope.of("Guild", 123)));
    }

    @Test
    void storageKey_sanitizesNamedScopes() {
        assertEquals("global", ScopeKeys.storageKey(NamedScope.GLOBAL));
        assertEquals("my_scope_v2", ScopeKeys.storageKey(NamedScope.of("My Scope.v2")));
        assertEquals("______etc", ScopeKeys.storageKey(NamedScope.of("../../etc")));
        assertEquals("global", ScopeKeys.storageKey(NamedScope.of(" global")));
    }

    @Test
    void storageKey_isStable() {
        assertEquals(ScopeKeys.storageKey(TypedScope.of("user", 9)), ScopeKeys.storageKey(TypedScope.of("USER", 9)));
    }

    @Test
    void sanitize_keepsSafeCharacters() {
        assertEquals("abc_019", ScopeKeys.sanitize("ABC_019"));
        assertEquals("a_b", ScopeKeys.sanitize("a-b"));
    }
}
