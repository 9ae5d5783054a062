package com.botstate.domain.model;

import java.time.OffsetDateTime;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Consumer progress through the intent log.
 *
 * <p>{@code offset} is the byte offset just past the last processed record, so the
 * next read starts exactly there. Only {@link com.botstate.intent.IntentLog#advance}
 * produces a new cursor.
 */
@Value
@Builder
@Jacksonized
public class IntentCursor {

    long offset;
    String lastIntentId;
    OffsetDateTime lastTs;

    public static IntentCursor initial() {
        return IntentCursor.builder().offset(0).build();
    }
}
