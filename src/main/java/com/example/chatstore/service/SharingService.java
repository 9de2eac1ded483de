package com.example.chatstore.service;

import com.example.chatstore.error.NotFoundException;
import com.example.chatstore.kv.ShareCache;
import com.example.chatstore.model.Chat;
import com.example.chatstore.model.Message;
import com.example.chatstore.model.MessagePart;
import com.example.chatstore.model.PublicShare;
import com.example.chatstore.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Public read-only links and chat forks.
 *
 * <p>A share is an immutable {@code PUBLIC#{shareId}} record pointing at a chat. Whoever knows the
 * share id may read the chat; the record's existence is the whole authorization.
 * None of these operations check ownership; callers do that before invoking them.
 */
@Service
public class SharingService {

    private static final Logger logger = LoggerFactory.getLogger(SharingService.class);

    static final String SHARE_RESOURCE = "PublicShare";
    static final String FORK_TITLE_SUFFIX = " (Fork)";

    private final EntityStore store;
    private final ChatManager chatManager;
    private final MessageLog messageLog;
    private final ShareCache shareCache;
    private final IdGenerator ids;
    private final Clock clock;

    public SharingService(EntityStore store,
                          ChatManager chatManager,
                          MessageLog messageLog,
                          ShareCache shareCache,
                          IdGenerator ids,
                          Clock clock) {
        this.store = store;
        this.chatManager = chatManager;
        this.messageLog = messageLog;
        this.shareCache = shareCache;
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * Marks the chat public and returns its share id. A chat that is already public keeps its id,
     * and its mapping is rewritten if an earlier call stopped before writing it.
     * The chat is updated before the mapping is written, so an interrupted call never leaves a
     * resolvable link to a chat that is not marked public.
     */
    public String makePublic(String chatId, String userId) {
        Chat chat = chatManager.require(chatId);
        if (chat.isPublic() && chat.getShareId() != null) {
            String existing = chat.getShareId();
            if (getShare(existing).isEmpty()) {
                logger.warn("Chat {} is public without a mapping for {}, restoring it", chatId, existing);
                writeShare(existing, chatId, userId, KeySchema.storedPrecision(clock.instant()));
            }
            return existing;
        }

        String shareId = ids.newShareId();
        Instant now = KeySchema.storedPrecision(clock.instant());
        Map<String, FieldOp> ops = Map.of(
                ItemMapper.IS_PUBLIC, FieldOp.set(true),
                ItemMapper.SHARE_ID, FieldOp.set(shareId),
                ItemMapper.UPDATED_AT, FieldOp.set(KeySchema.formatTimestamp(now)));
        store.update(KeySchema.chat(chatId), ops)
                .orElseThrow(() -> new NotFoundException(ChatManager.RESOURCE, chatId));

        writeShare(shareId, chatId, userId, now);
        logger.info("Chat {} shared publicly by user {} as {}", chatId, userId, shareId);
        return shareId;
    }

    /**
     * Empty for unknown and blank ids alike.
     */
    public Optional<PublicShare> getShare(String shareId) {
        if (shareId == null || shareId.isBlank()) {
            return Optional.empty();
        }
        return store.get(KeySchema.publicShare(shareId)).map(ItemMapper::toShare);
    }

    /**
     * The chat behind a share id. Empty when the id is blank or unknown, or the chat has since been deleted.
     */
    public Optional<Chat> resolveShare(String shareId) {
        if (shareId == null || shareId.isBlank()) {
            return Optional.empty();
        }
        Optional<String> cached = shareCache.chatIdFor(shareId);
        String chatId;
        if (cached.isPresent()) {
            chatId = cached.get();
        } else {
            Optional<PublicShare> share = getShare(shareId);
            if (share.isEmpty()) {
                return Optional.empty();
            }
            chatId = share.get().getChatId();
            shareCache.remember(shareId, chatId);
        }

        Optional<Chat> chat = chatManager.get(chatId);
        if (chat.isEmpty()) {
            logger.debug("Share {} points at deleted chat {}", shareId, chatId);
            shareCache.forget(shareId);
        }
        return chat;
    }

    /**
     * Copies the chat and its full history to a new chat owned by {@code newOwnerId}. The copy goes
     * through {@link ChatManager#create}, so the new owner's retention cap applies. Messages get
     * fresh ids and timestamps; the two chats share nothing afterwards.
     */
    public String fork(String originalChatId, String newOwnerId) {
        // snapshot first: creating the fork may evict the original
        Chat original = chatManager.require(originalChatId);
        List<Message> history = messageLog.list(originalChatId);

        Chat fork = chatManager.create(newOwnerId, original.getTitle() + FORK_TITLE_SUFFIX, original.getModelId());
        for (Message message : history) {
            messageLog.append(fork.getId(), Message.builder()
                    .role(message.getRole())
                    .content(message.getContent())
                    .parts(copyParts(message.getParts()))
                    .build());
        }

        logger.info("Forked chat {} into {} for user {} ({} messages)",
                originalChatId, fork.getId(), newOwnerId, history.size());
        return fork.getId();
    }

    public String forkShare(String shareId, String newOwnerId) {
        PublicShare share = getShare(shareId)
                .orElseThrow(() -> new NotFoundException(SHARE_RESOURCE, shareId));
        return fork(share.getChatId(), newOwnerId);
    }

    private void writeShare(String shareId, String chatId, String userId, Instant createdAt) {
        PublicShare share = PublicShare.builder()
                .shareId(shareId)
                .chatId(chatId)
                .userId(userId)
                .createdAt(createdAt)
                .build();
        store.put(ItemMapper.toItem(share), true);
        shareCache.remember(shareId, chatId);
    }

    private static List<MessagePart> copyParts(List<MessagePart> parts) {
        if (parts == null) {
            return null;
        }
        return parts.stream()
                .map(p -> p.toBuilder()
                        .args(p.getArgs() == null ? null : new LinkedHashMap<>(p.getArgs()))
                        .build())
                .collect(Collectors.toList());
    }
}
