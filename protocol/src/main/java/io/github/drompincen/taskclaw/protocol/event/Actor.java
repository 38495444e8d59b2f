package io.github.drompincen.taskclaw.protocol.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Actor {
    HUMAN, AGENT, SYSTEM;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Actor fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
