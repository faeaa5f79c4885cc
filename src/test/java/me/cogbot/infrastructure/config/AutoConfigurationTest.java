package me.cogbot.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.cogbot.domain.component.StorageComponent;
import me.cogbot.domain.service.DomainRegistry;
import me.cogbot.domain.service.DomainRegistryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Mock
    private DomainRegistryStore registryStore;
    @Mock
    private DomainRegistry registry;
    @Mock
    private StorageComponent enabledComponent;
    @Mock
    private StorageComponent disabledComponent;

    private AutoConfiguration autoConfiguration;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(enabledComponent.getDomainName()).thenReturn("msgboard");
        when(enabledComponent.isEnabled()).thenReturn(true);
        when(disabledComponent.getDomainName()).thenReturn("gpt");
        when(disabledComponent.isEnabled()).thenReturn(false);
        when(registryStore.get("msgboard")).thenReturn(registry);
        when(registryStore.getDomainNames()).thenReturn(Set.of("msgboard"));
        when(registry.getName()).thenReturn("msgboard");

        autoConfiguration = new AutoConfiguration(new BotProperties(), registryStore,
                List.of(enabledComponent, disabledComponent));
    }

    @Test
    void shouldRegisterSchemasBeforeInitializingEnabledComponents() {
        autoConfiguration.init();

        InOrder order = inOrder(enabledComponent);
        order.verify(enabledComponent).registerSchemas(registry);
        order.verify(enabledComponent).initialize();
    }

    @Test
    void shouldSkipDisabledComponentsOnInit() {
        autoConfiguration.init();

        verify(registryStore, never()).get("gpt");
        verify(disabledComponent, never()).registerSchemas(any());
        verify(disabledComponent, never()).initialize();
    }

    @Test
    void shouldDestroyComponentsThenCloseStorageOnShutdown() {
        autoConfiguration.shutdown();

        InOrder order = inOrder(enabledComponent, disabledComponent, registryStore);
        order.verify(enabledComponent).destroy();
        order.verify(disabledComponent).destroy();
        order.verify(registryStore).closeAll();
    }

    @Test
    void objectMapperWritesIsoDates() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2026-01-02T03:04:05Z\"", mapper.writeValueAsString(Instant.parse("2026-01-02T03:04:05Z")));
        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }
}
