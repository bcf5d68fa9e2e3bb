package com.pipekit.core.component.impl.nlp;

import com.pipekit.core.component.AbstractComponent;
import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.component.StageArguments;

import java.util.Map;

/**
 * Provides the shared {@code nlp} object for the configured language.
 *
 * <p>The only shipped component that opts into instance caching: it holds no trained
 * state, so pipelines built through one builder with the same {@code language} share an
 * instance.
 */
public class BasicLanguageComponent extends AbstractComponent {

    public static final String NAME = "nlp_basic";

    static final ComponentDescriptor DESCRIPTOR = ComponentDescriptor.builder(NAME)
        .requires(LifecycleStage.PIPELINE_INIT, "language")
        .provides(LifecycleStage.PIPELINE_INIT, "nlp")
        .cachedBy("language")
        .build();

    public BasicLanguageComponent() {
        super(DESCRIPTOR);
    }

    @Override
    public Map<String, Object> pipelineInit(StageArguments args) {
        String language = args.get("language", String.class);
        log.debug("Initializing text normalizer for language '{}'", language);
        return provided("nlp", new TextNormalizer(language));
    }

    /**
     * SPI entry point.
     */
    public static final class Factory implements ComponentFactory {

        @Override
        public ComponentDescriptor descriptor() {
            return DESCRIPTOR;
        }

        @Override
        public Component create(Map<String, Object> config) {
            return new BasicLanguageComponent();
        }
    }
}
