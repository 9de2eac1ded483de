package com.example.chatstore.service;

import com.example.chatstore.error.AlreadyExistsException;
import com.example.chatstore.model.FieldUpdate;
import com.example.chatstore.model.SettingsPatch;
import com.example.chatstore.model.Theme;
import com.example.chatstore.model.User;
import com.example.chatstore.store.EntityStore;
import com.example.chatstore.store.ItemMapper;
import com.example.chatstore.store.Key;
import com.example.chatstore.store.KeySchema;
import com.example.chatstore.store.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Account records. Credentials arrive already hashed; verifying them is the caller's job.
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    static final String RESOURCE = "User";

    private final EntityStore store;
    private final SettingsStore settingsStore;
    private final IdGenerator ids;
    private final Clock clock;

    public UserService(EntityStore store, SettingsStore settingsStore, IdGenerator ids, Clock clock) {
        this.store = store;
        this.settingsStore = settingsStore;
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * Creates the account and its default settings. The address is claimed with a unique write
     * before the profile is stored, so of two simultaneous registrations only one succeeds.
     */
    public User register(String email, String name, String credentialHash) {
        if (getByEmail(email).isPresent()) {
            throw new AlreadyExistsException(RESOURCE, email);
        }
        Instant now = KeySchema.storedPrecision(clock.instant());
        User user = User.builder()
                .id(ids.newId())
                .email(email)
                .name(name)
                .credentialHash(credentialHash)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            store.put(ItemMapper.toEmailClaim(user), true);
        } catch (AlreadyExistsException e) {
            logger.info("Registration rejected, email already claimed");
            throw new AlreadyExistsException(RESOURCE, email);
        }
        try {
            store.put(ItemMapper.toItem(user), true);
        } catch (RuntimeException e) {
            // the profile was never written, so the address is free again
            store.delete(KeySchema.emailClaim(email));
            throw e;
        }

        settingsStore.update(user.getId(), SettingsPatch.builder()
                .mcpEnabled(FieldUpdate.set(false))
                .theme(FieldUpdate.set(Theme.SYSTEM))
                .build());
        logger.info("Registered user {}", user.getId());
        return user;
    }

    public Optional<User> getById(String userId) {
        return store.get(KeySchema.user(userId)).map(ItemMapper::toUser);
    }

    public Optional<User> getByEmail(String email) {
        Key index = KeySchema.userEmailIndex(email);
        // prefix query; only an exact sort key match is the address asked for
        return store.queryIndex(index.getPartitionKey(), index.getSortKey(), SortOrder.ASC, 0).stream()
                .filter(item -> index.getSortKey().equals(item.get(KeySchema.GSI1SK)))
                .findFirst()
                .map(ItemMapper::toUser);
    }
}
