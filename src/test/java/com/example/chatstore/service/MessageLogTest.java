package com.example.chatstore.service;

import com.example.chatstore.model.Chat;
import com.example.chatstore.model.Message;
import com.example.chatstore.model.MessagePart;
import com.example.chatstore.model.MessageRole;
import com.example.chatstore.model.PartType;
import com.example.chatstore.store.ItemMapper;
import com.example.chatstore.store.KeySchema;
import com.example.chatstore.support.InMemoryEntityStore;
import com.example.chatstore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MessageLogTest {

    private static final String CHAT_ID = "chat-1";
    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryEntityStore store;
    private MutableClock clock;
    private MessageLog messageLog;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        clock = new MutableClock(START);
        messageLog = new MessageLog(store, new IdGenerator(clock, 12), clock);
        store.put(ItemMapper.toItem(Chat.builder()
                .id(CHAT_ID)
                .userId("user-1")
                .title("Chat")
                .modelId("model-a")
                .createdAt(START)
                .updatedAt(START)
                .build()), true);
    }

    @Test
    void testAppend_SameTickKeepsAppendOrder() {
        // clock does not move between appends
        for (int i = 0; i < 10; i++) {
            messageLog.append(CHAT_ID, text(MessageRole.USER, "m" + i));
        }

        List<String> contents = messageLog.list(CHAT_ID).stream()
                .map(Message::getContent)
                .collect(Collectors.toList());
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9"), contents);
    }

    @Test
    void testAppend_AssignsIdTimestampAndTouchesChat() {
        clock.advance(Duration.ofMinutes(3));

        Message stored = messageLog.append(CHAT_ID, text(MessageRole.ASSISTANT, "hello"));

        assertNotNull(stored.getId());
        assertEquals(CHAT_ID, stored.getChatId());
        assertEquals(START.plus(Duration.ofMinutes(3)), stored.getCreatedAt());
        Chat chat = ItemMapper.toChat(store.get(KeySchema.chat(CHAT_ID)).orElseThrow());
        assertEquals(stored.getCreatedAt(), chat.getUpdatedAt());
        assertEquals(List.of(stored), messageLog.list(CHAT_ID));
    }

    @Test
    void testAppend_WithoutChatRecordDoesNotCreateOne() {
        Message stored = messageLog.append("no-such-chat", text(MessageRole.USER, "hi"));

        assertEquals(List.of(stored), messageLog.list("no-such-chat"));
        assertTrue(store.get(KeySchema.chat("no-such-chat")).isEmpty());
    }

    @Test
    void testAppend_PartsAreStoredAndReadBack() {
        Message message = Message.builder()
                .role(MessageRole.ASSISTANT)
                .content("")
                .parts(List.of(
                        MessagePart.text("Looking it up"),
                        MessagePart.toolCall("call-1", "search", Map.of("query", "weather")),
                        MessagePart.toolResult("call-1", "search", Map.of("temp", 21))))
                .build();

        messageLog.append(CHAT_ID, message);

        List<MessagePart> parts = messageLog.list(CHAT_ID).get(0).getParts();
        assertEquals(3, parts.size());
        assertEquals(PartType.TOOL_CALL, parts.get(1).getType());
        assertEquals("weather", parts.get(1).getArgs().get("query"));
        assertEquals(Map.of("temp", 21), parts.get(2).getResult());
    }

    @Test
    void testDeleteAfter_KeepsPrefixThroughTarget() {
        // Given
        clock.ticking(Duration.ofMillis(1));
        Message m1 = messageLog.append(CHAT_ID, text(MessageRole.USER, "one"));
        Message m2 = messageLog.append(CHAT_ID, text(MessageRole.ASSISTANT, "two"));
        Message m3 = messageLog.append(CHAT_ID, text(MessageRole.USER, "three"));
        messageLog.append(CHAT_ID, text(MessageRole.ASSISTANT, "four"));
        messageLog.append(CHAT_ID, text(MessageRole.USER, "five"));

        // When
        messageLog.deleteAfter(CHAT_ID, m3.getId());

        // Then
        assertEquals(List.of(m1.getId(), m2.getId(), m3.getId()), ids(messageLog.list(CHAT_ID)));
    }

    @Test
    void testDeleteAfter_LastMessageIsNoOp() {
        messageLog.append(CHAT_ID, text(MessageRole.USER, "one"));
        Message last = messageLog.append(CHAT_ID, text(MessageRole.ASSISTANT, "two"));

        messageLog.deleteAfter(CHAT_ID, last.getId());

        assertEquals(2, messageLog.list(CHAT_ID).size());
    }

    @Test
    void testDeleteAfter_UnknownIdLeavesLogUntouched() {
        messageLog.append(CHAT_ID, text(MessageRole.USER, "one"));
        messageLog.append(CHAT_ID, text(MessageRole.ASSISTANT, "two"));

        messageLog.deleteAfter(CHAT_ID, "missing");

        assertEquals(2, messageLog.list(CHAT_ID).size());
    }

    @Test
    void testUpdateContent_KeepsIdAndPosition() {
        clock.ticking(Duration.ofMillis(1));
        Message m1 = messageLog.append(CHAT_ID, text(MessageRole.USER, "one"));
        Message m2 = messageLog.append(CHAT_ID, text(MessageRole.ASSISTANT, "two"));
        Message m3 = messageLog.append(CHAT_ID, text(MessageRole.USER, "three"));

        Optional<Message> updated = messageLog.updateContent(CHAT_ID, m2.getId(), "edited");

        assertEquals("edited", updated.orElseThrow().getContent());
        assertEquals(m2.getCreatedAt(), updated.get().getCreatedAt());
        List<Message> log = messageLog.list(CHAT_ID);
        assertEquals(List.of(m1.getId(), m2.getId(), m3.getId()), ids(log));
        assertEquals("edited", log.get(1).getContent());
    }

    @Test
    void testUpdateContent_UnknownIdIsEmpty() {
        messageLog.append(CHAT_ID, text(MessageRole.USER, "one"));

        assertTrue(messageLog.updateContent(CHAT_ID, "missing", "x").isEmpty());
        assertEquals("one", messageLog.list(CHAT_ID).get(0).getContent());
    }

    @Test
    void testDeleteAll_RemovesOnlyMessages() {
        messageLog.append(CHAT_ID, text(MessageRole.USER, "one"));
        messageLog.append(CHAT_ID, text(MessageRole.ASSISTANT, "two"));

        messageLog.deleteAll(CHAT_ID);

        assertTrue(messageLog.list(CHAT_ID).isEmpty());
        assertTrue(store.get(KeySchema.chat(CHAT_ID)).isPresent());
    }

    @Test
    void testDeleteAll_EmptyChatIsNoOp() {
        assertDoesNotThrow(() -> messageLog.deleteAll("empty-chat"));
    }

    private static Message text(MessageRole role, String content) {
        return Message.builder()
                .role(role)
                .content(content)
                .parts(List.of(MessagePart.text(content)))
                .build();
    }

    private static List<String> ids(List<Message> messages) {
        return messages.stream().map(Message::getId).collect(Collectors.toList());
    }
}
