package com.example.chatstore.store;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Maps entities to their physical keys in the single table.
 *
 * <pre>
 * USER#{userId}     PROFILE                      GSI1: USERS / {email}
 * USERS            EMAIL#{email}                 (claims the address for one user)
 * USER#{userId}     SETTINGS
 * CHAT#{chatId}     META                         GSI1: USER#{userId} / CHAT#{createdAt}
 * CHAT#{chatId}     MESSAGE#{createdAt}#{id}
 * CHAT#{chatId}     FEEDBACK#{messageId}
 * PUBLIC#{shareId}  MAPPING
 * </pre>
 *
 * Timestamps are written with a fixed six digit fraction so that string order is time order.
 */
public final class KeySchema {

    public static final String PK = "PK";
    public static final String SK = "SK";
    public static final String GSI1PK = "GSI1PK";
    public static final String GSI1SK = "GSI1SK";

    public static final String USER_PREFIX = "USER#";
    public static final String CHAT_PREFIX = "CHAT#";
    public static final String PUBLIC_PREFIX = "PUBLIC#";

    public static final String PROFILE = "PROFILE";
    public static final String SETTINGS = "SETTINGS";
    public static final String META = "META";
    public static final String MAPPING = "MAPPING";
    public static final String MESSAGE_PREFIX = "MESSAGE#";
    public static final String FEEDBACK_PREFIX = "FEEDBACK#";
    public static final String EMAIL_PREFIX = "EMAIL#";

    public static final String USERS_INDEX = "USERS";
    public static final String CHAT_INDEX_PREFIX = "CHAT#";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private KeySchema() {
    }

    public static Key user(String userId) {
        return Key.of(USER_PREFIX + requireId(userId, "userId"), PROFILE);
    }

    public static Key userSettings(String userId) {
        return Key.of(USER_PREFIX + requireId(userId, "userId"), SETTINGS);
    }

    public static Key userEmailIndex(String email) {
        return Key.of(USERS_INDEX, requireId(email, "email"));
    }

    public static Key emailClaim(String email) {
        return Key.of(USERS_INDEX, EMAIL_PREFIX + requireId(email, "email"));
    }

    public static Key chat(String chatId) {
        return Key.of(chatPartition(chatId), META);
    }

    public static Key userChatsIndex(String userId, Instant createdAt) {
        return Key.of(userChatsIndexPartition(userId), CHAT_INDEX_PREFIX + formatTimestamp(createdAt));
    }

    public static String userChatsIndexPartition(String userId) {
        return USER_PREFIX + requireId(userId, "userId");
    }

    public static String chatPartition(String chatId) {
        return CHAT_PREFIX + requireId(chatId, "chatId");
    }

    public static Key message(String chatId, Instant createdAt, String messageId) {
        return Key.of(chatPartition(chatId),
                MESSAGE_PREFIX + formatTimestamp(createdAt) + "#" + requireId(messageId, "messageId"));
    }

    public static Key feedback(String chatId, String messageId) {
        return Key.of(chatPartition(chatId), FEEDBACK_PREFIX + requireId(messageId, "messageId"));
    }

    public static Key publicShare(String shareId) {
        return Key.of(PUBLIC_PREFIX + requireId(shareId, "shareId"), MAPPING);
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP.format(storedPrecision(instant));
    }

    /**
     * The instant as it reads back after a round trip through a key or attribute.
     */
    public static Instant storedPrecision(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    public static Instant parseTimestamp(String value) {
        return Instant.from(TIMESTAMP.parse(value));
    }

    private static String requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return id;
    }
}
