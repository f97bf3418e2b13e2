package io.tiller.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class LangChain4jModelFactoryTest {

    @Test
    void shouldRecognizeSupportedModels() {
        assertThat(LangChain4jModelFactory.supportsModel("claude-sonnet-4")).isTrue();
        assertThat(LangChain4jModelFactory.supportsModel("gpt-4o-mini")).isTrue();
        assertThat(LangChain4jModelFactory.supportsModel("deepseek-chat")).isTrue();
        assertThat(LangChain4jModelFactory.supportsModel("llama3")).isFalse();
        assertThat(LangChain4jModelFactory.supportsModel(null)).isFalse();
    }

    @Test
    void shouldRequireApiKey() {
        assertThatThrownBy(() -> LangChain4jModelFactory.create("gpt-4o-mini", Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    void shouldRejectUnsupportedModel() {
        assertThatThrownBy(() -> LangChain4jModelFactory.create("llama3", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldPreferFirstNonBlankKey() {
        assertThat(
                        LangChain4jModelFactory.requireApiKey(
                                Map.of("openai_api_key", " ", "OPENAI_API_KEY", "sk-1"),
                                "openai_api_key",
                                "OPENAI_API_KEY"))
                .isEqualTo("sk-1");
    }
}
