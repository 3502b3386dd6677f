package me.golemcore.toolrouter.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.toolrouter.domain.model.LlmRequest;
import me.golemcore.toolrouter.domain.model.LlmResponse;
import me.golemcore.toolrouter.domain.model.Message;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String MODEL = "openai/gpt-4o-mini";

    private ToolRouterProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ToolRouterProperties();
        properties.getTieBreak().setModel(MODEL);
        adapter = new Langchain4jAdapter(properties);
    }

    @Test
    void shouldSplitProviderPrefix() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-3-5-haiku-latest"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o-mini"));
        assertEquals("claude-3-5-haiku-latest",
                Langchain4jAdapter.stripProviderPrefix("anthropic/claude-3-5-haiku-latest"));
        assertEquals("gpt-4o-mini", Langchain4jAdapter.stripProviderPrefix("gpt-4o-mini"));
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());

        ToolRouterProperties.ProviderProperties blank = new ToolRouterProperties.ProviderProperties();
        blank.setApiKey(" ");
        properties.getLlm().getLangchain4j().getProviders().put("openai", blank);
        assertFalse(adapter.isAvailable());

        blank.setApiKey("sk-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldConvertMessagesAndResponse() throws Exception {
        ChatModel chatModel = mock(ChatModel.class);
        @SuppressWarnings("unchecked")
        Map<String, ChatModel> models = (Map<String, ChatModel>) ReflectionTestUtils.getField(adapter, "models");
        models.put(MODEL, chatModel);
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"choice\": \"df.summary\"}"))
                .tokenUsage(new TokenUsage(42, 7))
                .finishReason(FinishReason.STOP)
                .build());
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("pick one")
                .build();
        request.addMessage(Message.builder().role("assistant").content("earlier").build());
        request.addMessage(Message.user("candidates: df.summary, du.scan"));
        request.addMessage(Message.builder().content("no role").build());

        LlmResponse response = adapter.chat(request).get();

        assertEquals("{\"choice\": \"df.summary\"}", response.getContent());
        assertEquals(MODEL, response.getModel());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(42, response.getInputTokens());
        assertEquals(7, response.getOutputTokens());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        List<ChatMessage> sent = captor.getValue();
        assertEquals(4, sent.size());
        assertInstanceOf(SystemMessage.class, sent.get(0));
        assertInstanceOf(AiMessage.class, sent.get(1));
        assertInstanceOf(UserMessage.class, sent.get(2));
        assertInstanceOf(UserMessage.class, sent.get(3));
    }

    @Test
    void shouldFailForUnconfiguredProvider() {
        LlmRequest request = LlmRequest.builder().model("anthropic/claude-3-5-haiku-latest").build();
        request.addMessage(Message.user("hi"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> adapter.chat(request).get());

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("toolrouter.llm.langchain4j.providers.anthropic.api-key"));
    }

    @Test
    void shouldFailWithoutModel() {
        properties.getTieBreak().setModel(" ");

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().build()).get());

        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }
}
