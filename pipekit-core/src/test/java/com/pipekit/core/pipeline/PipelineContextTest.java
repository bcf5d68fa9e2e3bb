package com.pipekit.core.pipeline;

import com.pipekit.core.component.LifecycleStage;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PipelineContext}.
 */
class PipelineContextTest {

    @Test
    void seed_setsEveryBaseKeyOfTheStage() {
        PipelineContext context = new PipelineContext().seed(LifecycleStage.PROCESS, Map.of("text", "hi"));

        assertThat(context.keys()).containsExactly("text", "intent", "entities");
        assertThat(context.get("text")).isEqualTo("hi");
        assertThat(context.containsKey("intent")).isTrue();
        assertThat(context.get("intent")).isNull();
    }

    @Test
    void provide_keepsInsertionOrderAndAllowsReplacement() {
        PipelineContext context = new PipelineContext();
        context.provide("nlp", "n");
        context.provide("tokens", null);
        context.provide("nlp", "n2");

        assertThat(context.keys()).containsExactly("nlp", "tokens");
        assertThat(context.get("nlp")).isEqualTo("n2");
    }

    @Test
    void copy_isIndependent() {
        PipelineContext init = new PipelineContext();
        init.provide("nlp", "n");

        PipelineContext request = init.copy();
        request.provide("tokens", "t");

        assertThat(init.keys()).containsExactly("nlp");
        assertThat(request.keys()).containsExactly("nlp", "tokens");
    }

    @Test
    void asMap_isReadOnly() {
        PipelineContext context = new PipelineContext();

        assertThatThrownBy(() -> context.asMap().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
