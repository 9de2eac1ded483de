package com.example.chatstore.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Url-safe identifiers. Share ids are unguessable; message ids additionally sort in creation
 * order so that messages written within one timestamp tick keep their append order.
 */
@Component
public class IdGenerator {

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz_-";
    static final int ID_LENGTH = 21;
    private static final int MESSAGE_RANDOM_SUFFIX = 6;
    private static final int MAX_SEQUENCE = 0xFFFF;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final int shareIdLength;

    private long lastMillis = -1;
    private int sequence;

    public IdGenerator(Clock clock, @Value("${app.share.id-length:12}") int shareIdLength) {
        this.clock = clock;
        this.shareIdLength = shareIdLength;
    }

    public String newId() {
        return randomString(ID_LENGTH);
    }

    public String newShareId() {
        return randomString(shareIdLength);
    }

    /**
     * 11 hex digits of epoch millis, 4 hex digits of sequence within that milli, then random characters.
     * Strictly increasing within this process even if the clock stalls or steps back.
     */
    public synchronized String newMessageId() {
        long now = clock.millis();
        if (now > lastMillis) {
            lastMillis = now;
            sequence = 0;
        } else if (sequence < MAX_SEQUENCE) {
            sequence++;
        } else {
            lastMillis++;
            sequence = 0;
        }
        return String.format("%011x%04x", lastMillis, sequence) + randomString(MESSAGE_RANDOM_SUFFIX);
    }

    private String randomString(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
