package me.golemcore.toolrouter.adapter.outbound.llm;

import me.golemcore.toolrouter.domain.model.LlmRequest;
import me.golemcore.toolrouter.domain.model.LlmResponse;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private ToolRouterProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ToolRouterProperties();
    }

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertEquals("langchain4j", factory.getProviderId());
        assertSame(langchain4j, factory.getActiveAdapter());
        assertTrue(factory.isAvailable());
    }

    @Test
    void shouldFallbackToNoopWhenProviderNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noop));
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldReportNoneWhenNoAdapters() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertEquals("none", factory.getCurrentModel());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldFailChatWhenNoAdapters() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        CompletableFuture<LlmResponse> future = factory.chat(LlmRequest.builder().build());

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void shouldDelegateChatToActiveAdapter() throws Exception {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmResponse response = LlmResponse.builder().content("{\"choice\": \"a.b\"}").build();
        LlmRequest request = LlmRequest.builder().model("openai/gpt-4o-mini").build();
        when(langchain4j.chat(request)).thenReturn(CompletableFuture.completedFuture(response));
        when(langchain4j.getCurrentModel()).thenReturn("openai/gpt-4o-mini");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j));
        factory.init();

        assertSame(response, factory.chat(request).get());
        assertEquals("openai/gpt-4o-mini", factory.getCurrentModel());
    }

    @Test
    void noOpAdapterShouldBeUnavailableButAnswer() throws Exception {
        NoOpLlmAdapter noop = new NoOpLlmAdapter();

        assertFalse(noop.isAvailable());
        assertEquals("none", noop.getProviderId());
        assertEquals("[No LLM configured]", noop.chat(LlmRequest.builder().build()).get().getContent());
    }

    private static LlmProviderAdapter createMockAdapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        return adapter;
    }
}
