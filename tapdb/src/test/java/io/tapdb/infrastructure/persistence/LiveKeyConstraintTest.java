package io.tapdb.infrastructure.persistence;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.tapdb.bootstrap.TapdbEngine;
import io.tapdb.domain.error.DuplicateEdgeException;
import io.tapdb.domain.error.SingletonConflictException;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.LineageEdge;
import io.tapdb.domain.model.Template;
import io.tapdb.support.H2TestSupport;
import io.tapdb.support.TestTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Storage constraints behind the factory's pre-checks, hit directly through the repositories.
 *
 * Tests:
 * - A second live singleton row is translated to SingletonConflictException
 * - A second live edge for the same triple is translated to DuplicateEdgeException
 */
@DisplayName("Live Key Constraint Tests")
class LiveKeyConstraintTest {

    private static final String FREEZER = "equipment/freezer/minus-80/1.0";
    private static final String WELL = "content/well/standard/1.0";

    private TapdbEngine engine;
    private UnitOfWork uow;

    @BeforeEach
    void setUp() {
        engine = H2TestSupport.newEngine();
        TestTemplates.create(engine, FREEZER, "EX", "{}", null, true);
        TestTemplates.create(engine, WELL, "MX", "{}");
        uow = engine.database().begin();
    }

    @AfterEach
    void tearDown() {
        uow.close();
    }

    private Instance draft(Template template, String name) {
        return Instance.draft(template, name, JsonNodeFactory.instance.objectNode(), "created");
    }

    @Test
    @DisplayName("Duplicate live singleton row fails with SingletonConflictException")
    void testSingletonKeyConstraint() {
        Template freezer = engine.templateResolver().resolve(uow, FREEZER);
        engine.instanceRepository().insert(uow, draft(freezer, "Freezer"), freezer.instancePrefix());

        assertThrows(SingletonConflictException.class, () -> uow.atomically(() ->
            engine.instanceRepository().insert(uow, draft(freezer, "Freezer again"), freezer.instancePrefix())));

        assertEquals(1, engine.instanceRepository().count(uow, InstanceFilter.all()));
    }

    @Test
    @DisplayName("Duplicate live edge row fails with DuplicateEdgeException")
    void testLiveEdgeKeyConstraint() {
        Instance a = engine.instanceFactory().createInstance(uow, WELL, "A");
        Instance b = engine.instanceFactory().createInstance(uow, WELL, "B");
        engine.lineageRepository().insert(uow, LineageEdge.draft(a, b, "contains"));

        DuplicateEdgeException e = assertThrows(DuplicateEdgeException.class, () -> uow.atomically(() ->
            engine.lineageRepository().insert(uow, LineageEdge.draft(a, b, "contains"))));

        assertNotNull(e.getMessage());
        assertEquals(1, engine.lineageRepository().count(uow, false));
        assertDoesNotThrow(() -> engine.lineageRepository().insert(uow, LineageEdge.draft(a, b, "derived_from")));
    }
}
