package com.botstate.domain.model;

import lombok.Value;

/** An intent read from the log together with its byte range in the file. */
@Value
public class PendingIntent {

    IntentRecord record;
    long startOffset;
    long endOffset;
}
