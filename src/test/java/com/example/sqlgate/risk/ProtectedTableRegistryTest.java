package com.example.sqlgate.risk;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProtectedTableRegistryTest {

    @Test
    void parsesNamesWithOptionalPolicies() {
        ProtectedTableRegistry registry = ProtectedTableRegistry.parse(" users , billing.invoices:ALWAYS_CRITICAL,");

        assertEquals(Optional.of(ElevationPolicy.ESCALATE_ONE_LEVEL), registry.lookup("USERS"));
        assertEquals(Optional.of(ElevationPolicy.ALWAYS_CRITICAL), registry.lookup("billing.invoices"));
        assertFalse(registry.isProtected("invoices"));
        assertTrue(registry.isProtected("public.users"));
    }

    @Test
    void emptySpecProtectsNothing() {
        assertTrue(ProtectedTableRegistry.parse("  ").asMap().isEmpty());
        assertTrue(ProtectedTableRegistry.parse(null).asMap().isEmpty());
    }

    @Test
    void rejectsUnknownPolicy() {
        assertThrows(IllegalArgumentException.class, () -> ProtectedTableRegistry.parse("users:SOMETIMES"));
    }
}
