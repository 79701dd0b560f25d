package io.tapdb.domain.euid;

import io.tapdb.domain.error.IdentifierIntegrityException;
import io.tapdb.domain.error.InvalidIdentifierInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EuidRegistryTest {

    private EuidRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EuidRegistry();
    }

    @Test
    void corePrefixesArePreRegistered() {
        assertEquals("generic_template_seq", registry.counterFor("GT").orElseThrow());
        assertEquals("generic_instance_lineage_seq", registry.counterFor("GN").orElseThrow());
        assertEquals("gx_instance_seq", registry.counterFor("gx").orElseThrow());
    }

    @Test
    void registerUsesDefaultCounterName() {
        assertEquals("cx_instance_seq", registry.register(" cx "));
        assertTrue(registry.isRegistered("CX"));
        assertEquals("cx_instance_seq", registry.snapshot().get("CX"));
    }

    @Test
    void registeringSameBindingTwiceIsNoOp() {
        registry.register("CX");
        assertEquals("cx_instance_seq", registry.register("CX", "cx_instance_seq"));
    }

    @Test
    void rebindingToAnotherCounterFails() {
        registry.register("CX");
        assertThrows(IdentifierIntegrityException.class, () -> registry.register("CX", "other_seq"));
    }

    @Test
    void corePrefixCannotBeOverridden() {
        assertThrows(IdentifierIntegrityException.class, () -> registry.register("GT", "my_template_seq"));
        assertTrue(EuidRegistry.isCorePrefix("gn"));
        assertFalse(EuidRegistry.isCorePrefix("CX"));
    }

    @Test
    void invalidPrefixOrCounterRejected() {
        assertThrows(InvalidIdentifierInputException.class, () -> registry.register("C1"));
        assertThrows(IdentifierIntegrityException.class, () -> registry.register("CX", "Bad-Name"));
        assertFalse(registry.isRegistered(null));
    }
}
