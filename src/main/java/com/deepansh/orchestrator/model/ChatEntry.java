package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatEntry {

    public enum Sender {
        user, ai, system
    }

    private Sender sender;
    private String message;

    public static ChatEntry of(Sender sender, String message) {
        return new ChatEntry(sender, message);
    }
}
