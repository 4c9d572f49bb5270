package com.ai.clinic.dto;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Operations the conversational front end may invoke, by wire name.
 */
public enum ToolOperation {
    BOOK("book"),
    RESCHEDULE("reschedule"),
    CANCEL("cancel"),
    LOOKUP("lookup"),
    CHECK_SLOT("check_slot"),
    UPDATE_PREFERENCES("update_preferences"),
    GET_PREFERENCES("get_preferences"),
    MODERATION_GUARD("moderation_guard");

    private final String wireName;

    ToolOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ToolOperation> fromWireName(String name) {
        if (name == null) return Optional.empty();
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(op -> op.wireName.equals(normalized)).findFirst();
    }
}
