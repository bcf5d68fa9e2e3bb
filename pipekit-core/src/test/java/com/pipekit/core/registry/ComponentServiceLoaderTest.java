package com.pipekit.core.registry;

import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for component factories.
 *
 * <p>This test ensures that:
 * <ul>
 *   <li>All factories registered in META-INF/services can be discovered via ServiceLoader</li>
 *   <li>Every factory exposes a descriptor and can create its component</li>
 *   <li>All component names are unique (no duplicates)</li>
 * </ul>
 *
 * <p>Expected component count: 5
 * <ul>
 *   <li>nlp_basic, tokenizer_whitespace</li>
 *   <li>intent_classifier_keyword</li>
 *   <li>ner_dictionary, ner_synonyms</li>
 * </ul>
 */
class ComponentServiceLoaderTest {

    /**
     * Expected number of component factories.
     * Update this constant when adding new components.
     */
    private static final int EXPECTED_COMPONENT_COUNT = 5;

    @Test
    void serviceLoader_discoversAllRegisteredFactories() {
        List<ComponentFactory> factories = ServiceLoader.load(ComponentFactory.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(factories)
            .as("ServiceLoader should discover all %d registered factories", EXPECTED_COMPONENT_COUNT)
            .hasSize(EXPECTED_COMPONENT_COUNT)
            .allMatch(factory -> factory.descriptor() != null, "All factories should expose a descriptor");
    }

    @Test
    void serviceLoader_componentNamesAreUnique() {
        List<ComponentFactory> factories = ComponentRegistry.discoverFactories();

        Set<String> names = factories.stream()
            .map(factory -> factory.descriptor().name())
            .collect(Collectors.toSet());

        assertThat(names)
            .as("All component names should be unique (no duplicates)")
            .hasSize(factories.size());
    }

    @Test
    void serviceLoader_canCreateAllComponents() {
        for (ComponentFactory factory : ComponentRegistry.discoverFactories()) {
            ComponentDescriptor descriptor = factory.descriptor();
            Component component = factory.create(Map.of("language", "en"));

            assertThat(component)
                .as("Factory for %s should create a component", descriptor.name())
                .isNotNull();
            assertThat(component.descriptor())
                .as("Component %s should report its factory's descriptor", descriptor.name())
                .isEqualTo(descriptor);
        }
    }
}
