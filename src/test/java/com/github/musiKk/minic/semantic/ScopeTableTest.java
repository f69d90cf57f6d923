package com.github.musiKk.minic.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.musiKk.minic.semantic.Type.Builtin;

public class ScopeTableTest {

    @Test
    public void testRootScope() {
        var scopes = new ScopeTable();
        assertEquals(0, scopes.current());
        assertEquals(0, scopes.level());
        assertThrows(IllegalStateException.class, scopes::pop);
    }

    @Test
    public void testDeclareAndLookup() {
        var scopes = new ScopeTable();
        var declared = scopes.declare("x", Builtin.INT);
        assertTrue(declared.isPresent());
        assertEquals("x", declared.get().name());
        assertFalse(declared.get().initialized());

        var found = scopes.lookup("x");
        assertTrue(found.isPresent());
        assertEquals(Builtin.INT, found.get().type());
        assertTrue(scopes.lookup("y").isEmpty());
    }

    @Test
    public void testDuplicateInSameScope() {
        var scopes = new ScopeTable();
        scopes.declare("x", Builtin.INT);
        assertTrue(scopes.declare("x", Builtin.CHAR).isEmpty());
        assertEquals(Builtin.INT, scopes.lookup("x").get().type());
    }

    @Test
    public void testShadowingInNestedScope() {
        var scopes = new ScopeTable();
        scopes.declare("x", Builtin.INT);
        int inner = scopes.push();
        assertEquals(1, inner);
        assertEquals(1, scopes.level());

        assertTrue(scopes.declare("x", Builtin.BOOL).isPresent());
        assertEquals(Builtin.BOOL, scopes.lookup("x").get().type());

        scopes.pop();
        assertEquals(Builtin.INT, scopes.lookup("x").get().type());
    }

    @Test
    public void testInnerScopeSeesOuterNames() {
        var scopes = new ScopeTable();
        scopes.declare("outer", Builtin.CHAR);
        scopes.push();
        scopes.push();
        assertEquals(2, scopes.level());
        assertEquals(Builtin.CHAR, scopes.lookup("outer").get().type());
    }

    @Test
    public void testClosedScopes() {
        var scopes = new ScopeTable();
        scopes.push();
        scopes.declare("temp", Builtin.INT);
        scopes.pop();

        assertTrue(scopes.lookup("temp").isEmpty());
        assertTrue(scopes.lookupClosed("temp").isPresent());
        assertTrue(scopes.lookupClosed("never").isEmpty());
    }

    @Test
    public void testOpenScopesAreNotClosed() {
        var scopes = new ScopeTable();
        scopes.declare("g", Builtin.INT);
        scopes.push();
        scopes.declare("local", Builtin.INT);
        assertTrue(scopes.lookupClosed("g").isEmpty());
        assertTrue(scopes.lookupClosed("local").isEmpty());
    }

    @Test
    public void testSiblingScopesGetFreshIndices() {
        var scopes = new ScopeTable();
        int first = scopes.push();
        scopes.pop();
        int second = scopes.push();
        assertEquals(2, second);
        assertTrue(first != second);
        assertEquals(1, scopes.level());
    }
}
