package com.syncbridge.connector;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical, action-first event taxonomy shared by all providers.
 */
public enum SignalKind {
    ISSUE_CREATED,
    ISSUE_UPDATED,
    ISSUE_CLOSED,
    ISSUE_REOPENED,
    ISSUE_RESOLVED,
    ISSUE_COMMENT,
    PR_OPENED,
    PR_CLOSED,
    PR_MERGED,
    PR_REOPENED,
    PR_UPDATED,
    PR_REVIEW,
    CODE_PUSHED,
    RELEASE_PUBLISHED,
    MESSAGE_POSTED,
    MESSAGE_UPDATED,
    MESSAGE_DELETED,
    REACTION_ADDED,
    FILE_CREATED,
    FILE_UPDATED,
    FILE_DELETED,
    FILE_MOVED,
    CALENDAR_EVENT_CREATED,
    CALENDAR_EVENT_UPDATED,
    CALENDAR_EVENT_DELETED,
    EMAIL_RECEIVED,
    EMAIL_SENT,
    EMAIL_UPDATED,
    EMAIL_DELETED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SignalKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.wireName().equals(value))
                .findFirst();
    }

    public static boolean isCanonical(String value) {
        return fromWireName(value).isPresent();
    }
}
