package io.tapdb.application.service;

import io.tapdb.bootstrap.TapdbEngine;
import io.tapdb.domain.error.TemplateNotFoundException;
import io.tapdb.domain.model.Template;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import io.tapdb.support.H2TestSupport;
import io.tapdb.support.TestTemplates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Template mutations and the resolver cache across concurrent units of work.
 *
 * Tests:
 * - A template cached by another unit of work before a soft delete commits is not served afterwards
 * - A rolled back soft delete leaves the template resolvable
 */
@DisplayName("Template Service Tests")
class TemplateServiceTest {

    private static final String WELL = "content/well/standard/1.0";

    private TapdbEngine engine;
    private Template well;

    @BeforeEach
    void setUp() {
        engine = H2TestSupport.newEngine();
        well = TestTemplates.create(engine, WELL, "MX", "{}");
    }

    @Test
    @DisplayName("Soft delete committed after another unit of work cached the template")
    void testSoftDeleteVisibleAfterCommit() {
        try (UnitOfWork deleting = engine.database().begin()) {
            engine.templateService().softDelete(deleting, well);

            try (UnitOfWork reader = engine.database().begin()) {
                Template seen = engine.templateResolver().resolve(reader, WELL);
                assertFalse(seen.deleted());
                reader.commit();
            }

            deleting.commit();
        }

        try (UnitOfWork after = engine.database().begin()) {
            assertThrows(TemplateNotFoundException.class,
                () -> engine.instanceFactory().createInstance(after, WELL, "W"));
        }
    }

    @Test
    @DisplayName("Rolled back soft delete keeps the template live")
    void testSoftDeleteRolledBack() {
        try (UnitOfWork deleting = engine.database().begin()) {
            engine.templateService().softDelete(deleting, well);
            deleting.rollback();
        }

        try (UnitOfWork after = engine.database().begin()) {
            assertEquals(well.uuid(), engine.templateResolver().resolve(after, WELL).uuid());
        }
    }
}
