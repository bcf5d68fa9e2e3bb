package com.pipekit.core.component.impl.tokenizer;

import com.pipekit.core.component.AbstractComponent;
import com.pipekit.core.component.Component;
import com.pipekit.core.component.ComponentDescriptor;
import com.pipekit.core.component.ComponentFactory;
import com.pipekit.core.component.LifecycleStage;
import com.pipekit.core.component.StageArguments;
import com.pipekit.core.component.impl.nlp.TextNormalizer;

import java.util.Map;

/**
 * Splits the request text into whitespace-separated {@code tokens}.
 */
public class WhitespaceTokenizer extends AbstractComponent {

    public static final String NAME = "tokenizer_whitespace";

    static final ComponentDescriptor DESCRIPTOR = ComponentDescriptor.builder(NAME)
        .requires(LifecycleStage.PROCESS, "text", "nlp")
        .provides(LifecycleStage.PROCESS, "tokens")
        .build();

    public WhitespaceTokenizer() {
        super(DESCRIPTOR);
    }

    @Override
    public Map<String, Object> process(StageArguments args) {
        String text = args.get("text", String.class);
        TextNormalizer nlp = args.get("nlp", TextNormalizer.class);
        return provided("tokens", nlp.tokenize(text == null ? "" : text));
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
            return new WhitespaceTokenizer();
        }
    }
}
