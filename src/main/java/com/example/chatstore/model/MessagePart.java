package com.example.chatstore.model;

import lombok.*;

import java.util.Map;

/**
 * One structured block of a message. Which fields are populated depends on {@link #type}:
 * text parts carry {@code text}, tool calls carry {@code toolCallId}, {@code toolName} and {@code args},
 * tool results carry {@code toolCallId}, {@code toolName} and {@code result}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MessagePart {
    private PartType type;
    private String text;
    private String toolCallId;
    private String toolName;
    private Map<String, Object> args;
    private Object result;

    public static MessagePart text(String text) {
        return MessagePart.builder().type(PartType.TEXT).text(text).build();
    }

    public static MessagePart toolCall(String toolCallId, String toolName, Map<String, Object> args) {
        return MessagePart.builder()
                .type(PartType.TOOL_CALL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .args(args)
                .build();
    }

    public static MessagePart toolResult(String toolCallId, String toolName, Object result) {
        return MessagePart.builder()
                .type(PartType.TOOL_RESULT)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .result(result)
                .build();
    }
}
