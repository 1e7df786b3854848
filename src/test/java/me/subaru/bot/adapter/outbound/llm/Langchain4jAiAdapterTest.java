package me.subaru.bot.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import me.subaru.bot.domain.model.ChatTurn;
import me.subaru.bot.port.outbound.AiPort;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jAiAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldOrderSystemPromptHistoryAndNewMessage() {
        AiPort.AiRequest request = new AiPort.AiRequest("key", "gemini-2.0-flash", "You are Subaru.",
                List.of(ChatTurn.user("hi", NOW), ChatTurn.assistant("hello!", NOW)),
                "what's up?");

        List<ChatMessage> messages = Langchain4jAiAdapter.buildMessages(request);

        assertEquals(4, messages.size());
        assertEquals("You are Subaru.", assertInstanceOf(SystemMessage.class, messages.get(0)).text());
        assertEquals("hi", assertInstanceOf(UserMessage.class, messages.get(1)).singleText());
        assertEquals("hello!", assertInstanceOf(AiMessage.class, messages.get(2)).text());
        assertEquals("what's up?", assertInstanceOf(UserMessage.class, messages.get(3)).singleText());
    }

    @Test
    void shouldOmitBlankSystemPrompt() {
        AiPort.AiRequest request = new AiPort.AiRequest("key", "gemini-2.0-flash", " ", null, "hello");

        List<ChatMessage> messages = Langchain4jAiAdapter.buildMessages(request);

        assertEquals(1, messages.size());
        assertInstanceOf(UserMessage.class, messages.get(0));
    }
}
