package com.example.chatstore.store;

import com.example.chatstore.model.*;

import java.time.Instant;
import java.util.*;

/**
 * Converts entities to and from the attribute maps kept by the {@link EntityStore}.
 * Key attributes are derived from {@link KeySchema}; timestamps are stored in its fixed-width format.
 */
public final class ItemMapper {

    public static final String ID = "id";
    public static final String USER_ID = "userId";
    public static final String CHAT_ID = "chatId";
    public static final String EMAIL = "email";
    public static final String NAME = "name";
    public static final String CREDENTIAL_HASH = "credentialHash";
    public static final String TITLE = "title";
    public static final String MODEL_ID = "modelId";
    public static final String IS_PUBLIC = "isPublic";
    public static final String SHARE_ID = "shareId";
    public static final String ROLE = "role";
    public static final String CONTENT = "content";
    public static final String PARTS = "parts";
    public static final String REGENERATED_FROM = "regeneratedFrom";
    public static final String MESSAGE_ID = "messageId";
    public static final String RATING = "rating";
    public static final String COMMENT = "comment";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    public static final String THEME = "theme";
    public static final String MCP_ENABLED = "mcpEnabled";
    public static final String PREFERRED_MODEL_ID = "preferredModelId";
    public static final String EXTERNAL_ACCESS_TOKEN = "externalAccessToken";
    public static final String EXTERNAL_REFRESH_TOKEN = "externalRefreshToken";
    public static final String EXTERNAL_TOKEN_EXPIRY = "externalTokenExpiry";
    public static final String EXTERNAL_USERNAME = "externalUsername";
    public static final String EXTERNAL_USER_ID = "externalUserId";

    private static final String PART_TYPE = "type";
    private static final String PART_TEXT = "text";
    private static final String PART_TOOL_CALL_ID = "toolCallId";
    private static final String PART_TOOL_NAME = "toolName";
    private static final String PART_ARGS = "args";
    private static final String PART_RESULT = "result";

    private ItemMapper() {
    }

    // Users

    public static Map<String, Object> toItem(User user) {
        Map<String, Object> item = keyed(KeySchema.user(user.getId()));
        Key index = KeySchema.userEmailIndex(user.getEmail());
        item.put(KeySchema.GSI1PK, index.getPartitionKey());
        item.put(KeySchema.GSI1SK, index.getSortKey());
        item.put(ID, user.getId());
        item.put(EMAIL, user.getEmail());
        putIfPresent(item, NAME, user.getName());
        item.put(CREDENTIAL_HASH, user.getCredentialHash());
        item.put(CREATED_AT, KeySchema.formatTimestamp(user.getCreatedAt()));
        item.put(UPDATED_AT, KeySchema.formatTimestamp(user.getUpdatedAt()));
        return item;
    }

    /**
     * The record that reserves the user's email address; written with a uniqueness check before the profile.
     */
    public static Map<String, Object> toEmailClaim(User user) {
        Map<String, Object> item = keyed(KeySchema.emailClaim(user.getEmail()));
        item.put(USER_ID, user.getId());
        item.put(EMAIL, user.getEmail());
        item.put(CREATED_AT, KeySchema.formatTimestamp(user.getCreatedAt()));
        return item;
    }

    public static User toUser(Map<String, Object> item) {
        return User.builder()
                .id(string(item, ID))
                .email(string(item, EMAIL))
                .name(string(item, NAME))
                .credentialHash(string(item, CREDENTIAL_HASH))
                .createdAt(instant(item, CREATED_AT))
                .updatedAt(instant(item, UPDATED_AT))
                .build();
    }

    public static UserSettings toSettings(Map<String, Object> item) {
        String theme = string(item, THEME);
        return UserSettings.builder()
                .userId(string(item, USER_ID))
                .theme(theme == null ? null : Theme.fromValue(theme))
                .mcpEnabled((Boolean) item.get(MCP_ENABLED))
                .preferredModelId(string(item, PREFERRED_MODEL_ID))
                .externalAccessToken(string(item, EXTERNAL_ACCESS_TOKEN))
                .externalRefreshToken(string(item, EXTERNAL_REFRESH_TOKEN))
                .externalTokenExpiry(string(item, EXTERNAL_TOKEN_EXPIRY))
                .externalUsername(string(item, EXTERNAL_USERNAME))
                .externalUserId(string(item, EXTERNAL_USER_ID))
                .updatedAt(instant(item, UPDATED_AT))
                .build();
    }

    // Chats

    public static Map<String, Object> toItem(Chat chat) {
        Map<String, Object> item = keyed(KeySchema.chat(chat.getId()));
        Key index = KeySchema.userChatsIndex(chat.getUserId(), chat.getCreatedAt());
        item.put(KeySchema.GSI1PK, index.getPartitionKey());
        item.put(KeySchema.GSI1SK, index.getSortKey());
        item.put(ID, chat.getId());
        item.put(USER_ID, chat.getUserId());
        item.put(TITLE, chat.getTitle());
        item.put(MODEL_ID, chat.getModelId());
        item.put(IS_PUBLIC, chat.isPublic());
        putIfPresent(item, SHARE_ID, chat.getShareId());
        item.put(CREATED_AT, KeySchema.formatTimestamp(chat.getCreatedAt()));
        item.put(UPDATED_AT, KeySchema.formatTimestamp(chat.getUpdatedAt()));
        return item;
    }

    public static Chat toChat(Map<String, Object> item) {
        return Chat.builder()
                .id(string(item, ID))
                .userId(string(item, USER_ID))
                .title(string(item, TITLE))
                .modelId(string(item, MODEL_ID))
                .isPublic(Boolean.TRUE.equals(item.get(IS_PUBLIC)))
                .shareId(string(item, SHARE_ID))
                .createdAt(instant(item, CREATED_AT))
                .updatedAt(instant(item, UPDATED_AT))
                .build();
    }

    // Messages

    public static Map<String, Object> toItem(Message message) {
        Map<String, Object> item = keyed(KeySchema.message(message.getChatId(), message.getCreatedAt(), message.getId()));
        item.put(ID, message.getId());
        item.put(CHAT_ID, message.getChatId());
        item.put(ROLE, message.getRole().getValue());
        item.put(CONTENT, message.getContent() == null ? "" : message.getContent());
        if (message.getParts() != null) {
            List<Map<String, Object>> parts = new ArrayList<>();
            for (MessagePart part : message.getParts()) {
                parts.add(toMap(part));
            }
            item.put(PARTS, parts);
        }
        putIfPresent(item, REGENERATED_FROM, message.getRegeneratedFrom());
        item.put(CREATED_AT, KeySchema.formatTimestamp(message.getCreatedAt()));
        return item;
    }

    @SuppressWarnings("unchecked")
    public static Message toMessage(Map<String, Object> item) {
        List<MessagePart> parts = null;
        Object rawParts = item.get(PARTS);
        if (rawParts instanceof List) {
            parts = new ArrayList<>();
            for (Object raw : (List<Object>) rawParts) {
                parts.add(toPart((Map<String, Object>) raw));
            }
        }
        return Message.builder()
                .id(string(item, ID))
                .chatId(string(item, CHAT_ID))
                .role(MessageRole.fromValue(string(item, ROLE)))
                .content(string(item, CONTENT))
                .parts(parts)
                .regeneratedFrom(string(item, REGENERATED_FROM))
                .createdAt(instant(item, CREATED_AT))
                .build();
    }

    public static Map<String, Object> toMap(MessagePart part) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(PART_TYPE, part.getType().getValue());
        putIfPresent(map, PART_TEXT, part.getText());
        putIfPresent(map, PART_TOOL_CALL_ID, part.getToolCallId());
        putIfPresent(map, PART_TOOL_NAME, part.getToolName());
        if (part.getArgs() != null) {
            map.put(PART_ARGS, new LinkedHashMap<>(part.getArgs()));
        }
        putIfPresent(map, PART_RESULT, part.getResult());
        return map;
    }

    @SuppressWarnings("unchecked")
    public static MessagePart toPart(Map<String, Object> map) {
        Object args = map.get(PART_ARGS);
        return MessagePart.builder()
                .type(PartType.fromValue(string(map, PART_TYPE)))
                .text(string(map, PART_TEXT))
                .toolCallId(string(map, PART_TOOL_CALL_ID))
                .toolName(string(map, PART_TOOL_NAME))
                .args(args instanceof Map ? new LinkedHashMap<>((Map<String, Object>) args) : null)
                .result(map.get(PART_RESULT))
                .build();
    }

    // Feedback and shares

    public static Map<String, Object> toItem(Feedback feedback) {
        Map<String, Object> item = keyed(KeySchema.feedback(feedback.getChatId(), feedback.getMessageId()));
        item.put(MESSAGE_ID, feedback.getMessageId());
        item.put(CHAT_ID, feedback.getChatId());
        item.put(USER_ID, feedback.getUserId());
        item.put(RATING, feedback.getRating().getValue());
        putIfPresent(item, COMMENT, feedback.getComment());
        item.put(CREATED_AT, KeySchema.formatTimestamp(feedback.getCreatedAt()));
        return item;
    }

    public static Feedback toFeedback(Map<String, Object> item) {
        return Feedback.builder()
                .messageId(string(item, MESSAGE_ID))
                .chatId(string(item, CHAT_ID))
                .userId(string(item, USER_ID))
                .rating(FeedbackRating.fromValue(string(item, RATING)))
                .comment(string(item, COMMENT))
                .createdAt(instant(item, CREATED_AT))
                .build();
    }

    public static Map<String, Object> toItem(PublicShare share) {
        Map<String, Object> item = keyed(KeySchema.publicShare(share.getShareId()));
        item.put(SHARE_ID, share.getShareId());
        item.put(CHAT_ID, share.getChatId());
        item.put(USER_ID, share.getUserId());
        item.put(CREATED_AT, KeySchema.formatTimestamp(share.getCreatedAt()));
        return item;
    }

    public static PublicShare toShare(Map<String, Object> item) {
        return PublicShare.builder()
                .shareId(string(item, SHARE_ID))
                .chatId(string(item, CHAT_ID))
                .userId(string(item, USER_ID))
                .createdAt(instant(item, CREATED_AT))
                .build();
    }

    public static Key keyOf(Map<String, Object> item) {
        return Key.of(string(item, KeySchema.PK), string(item, KeySchema.SK));
    }

    private static Map<String, Object> keyed(Key key) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put(KeySchema.PK, key.getPartitionKey());
        item.put(KeySchema.SK, key.getSortKey());
        return item;
    }

    private static void putIfPresent(Map<String, Object> map, String name, Object value) {
        if (value != null) {
            map.put(name, value);
        }
    }

    private static String string(Map<String, Object> item, String name) {
        Object value = item.get(name);
        return value == null ? null : value.toString();
    }

    private static Instant instant(Map<String, Object> item, String name) {
        String value = string(item, name);
        return value == null ? null : KeySchema.parseTimestamp(value);
    }
}
