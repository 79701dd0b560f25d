package io.tapdb.application.service;

import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.domain.error.TemplateNotFoundException;
import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateCode;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static io.tapdb.support.TestTemplates.stored;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

/**
 * Tests for TemplateResolver.
 *
 * Tests:
 * - Code normalization and caching
 * - Not-found and malformed codes
 * - Cache invalidation on rollback and after a committed mutation
 */
@ExtendWith(MockitoExtension.class)
class TemplateResolverTest {

    @Mock
    private TemplateRepository templateRepository;
    @Mock
    private UnitOfWork uow;

    private TemplateResolver resolver;
    private Template plate;

    @BeforeEach
    void setUp() {
        resolver = new TemplateResolver(templateRepository);
        plate = stored("container/plate/fixed-plate-96/1.0", "CX", null, null, false);
    }

    @Test
    void resolve_cachesAcrossSlashForms() {
        when(templateRepository.findByCode(uow, plate.code())).thenReturn(Optional.of(plate));

        Template first = resolver.resolve(uow, "container/plate/fixed-plate-96/1.0/");
        Template second = resolver.resolve(uow, "container/plate/fixed-plate-96/1.0");

        assertSame(first, second);
        verify(templateRepository, times(1)).findByCode(any(), any());
        assertEquals(1, resolver.cacheSize());
    }

    @Test
    void resolve_unknownCodeThrows() {
        when(templateRepository.findByCode(any(), any())).thenReturn(Optional.empty());

        TemplateNotFoundException e = assertThrows(TemplateNotFoundException.class,
            () -> resolver.resolve(uow, "container/plate/missing/1.0/"));
        assertEquals("container/plate/missing/1.0", e.getTemplateCode());
    }

    @Test
    void resolve_malformedCodeThrowsWithoutQuery() {
        assertThrows(TemplateNotFoundException.class, () -> resolver.resolve(uow, "container/plate"));
        assertThrows(TemplateNotFoundException.class, () -> resolver.resolve(uow, null));
        verifyNoInteractions(templateRepository);
    }

    @Test
    void resolveByIdentifier_usesSameCache() {
        when(templateRepository.findByEuid(uow, plate.euid(), false)).thenReturn(Optional.of(plate));

        resolver.resolveByIdentifier(uow, plate.euid());
        Template byCode = resolver.resolve(uow, "container/plate/fixed-plate-96/1.0");

        assertEquals(plate, byCode);
        verify(templateRepository, never()).findByCode(any(), any(TemplateCode.class));
    }

    @Test
    void rollbackHookClearsCache() {
        when(templateRepository.findByCode(uow, plate.code())).thenReturn(Optional.of(plate));
        resolver.resolve(uow, "container/plate/fixed-plate-96/1.0");

        ArgumentCaptor<Runnable> hook = ArgumentCaptor.forClass(Runnable.class);
        verify(uow).onRollback(hook.capture());
        hook.getValue().run();

        assertEquals(0, resolver.cacheSize());
    }

    @Test
    void invalidateCacheForcesReload() {
        when(templateRepository.findByCode(uow, plate.code())).thenReturn(Optional.of(plate));

        resolver.resolve(uow, "container/plate/fixed-plate-96/1.0");
        resolver.invalidateCache();
        resolver.resolve(uow, "container/plate/fixed-plate-96/1.0");

        verify(templateRepository, times(2)).findByCode(any(), any());
        verify(templateRepository, never()).findByEuid(any(), any(), anyBoolean());
    }

    @Test
    void templateCodeIsCanonical() {
        assertEquals("container/plate/fixed-plate-96/1.0/", TemplateResolver.templateCode(plate));
    }

    @Test
    void cacheMissesShareOneRollbackHook() {
        Template tube = stored("container/tube/generic/1.0", "CX", null, null, false);
        when(templateRepository.findByCode(uow, plate.code())).thenReturn(Optional.of(plate));
        when(templateRepository.findByCode(uow, tube.code())).thenReturn(Optional.of(tube));

        resolver.resolve(uow, "container/plate/fixed-plate-96/1.0");
        resolver.resolve(uow, "container/tube/generic/1.0");

        ArgumentCaptor<Runnable> hooks = ArgumentCaptor.forClass(Runnable.class);
        verify(uow, times(2)).onRollback(hooks.capture());
        assertSame(hooks.getAllValues().get(0), hooks.getAllValues().get(1));
    }

    @Test
    void invalidateOnCommitClearsAgainAfterCommit() {
        when(templateRepository.findByCode(uow, plate.code())).thenReturn(Optional.of(plate));

        resolver.invalidateOnCommit(uow);
        resolver.resolve(uow, "container/plate/fixed-plate-96/1.0");
        assertEquals(1, resolver.cacheSize());

        ArgumentCaptor<Runnable> hook = ArgumentCaptor.forClass(Runnable.class);
        verify(uow).onCommit(hook.capture());
        hook.getValue().run();

        assertEquals(0, resolver.cacheSize());
    }
}
