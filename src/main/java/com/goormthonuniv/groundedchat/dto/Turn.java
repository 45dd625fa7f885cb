package com.goormthonuniv.groundedchat.dto;

import java.time.Instant;

public record Turn(
        Role role,
        String content,
        Instant timestamp
) {
    /** 저장소와 같은 형태로 맞춘다: 줄바꿈은 \n 하나로 */
    public Turn {
        content = content == null ? "" : content.replace("\r\n", "\n").replace('\r', '\n');
    }

    public enum Role {
        USER("user"),
        ASSISTANT("assistant");

        private final String wire;

        Role(String wire) { this.wire = wire; }

        public String wire() { return wire; }

        public static Role fromWire(String s) {
            for (Role r : values()) if (r.wire.equalsIgnoreCase(s)) return r;
            throw new IllegalArgumentException("unknown role: " + s);
        }
    }

    public static Turn user(String content, Instant ts) { return new Turn(Role.USER, content, ts); }
    public static Turn assistant(String content, Instant ts) { return new Turn(Role.ASSISTANT, content, ts); }

    public boolean isUser() { return role == Role.USER; }
}
