package com.botstate.snapshot;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Paths of the files making up a snapshot, relative to the namespace root.
 */
public final class SnapshotLayout {

    public static final String POSITIONS = "state/positions.json";
    public static final String LEDGER = "state/ledger.jsonl";
    public static final String INTENTS = "state/intents.jsonl";
    public static final String INTENT_CURSOR = "state/intent_cursor.json";
    public static final String DIAGNOSTICS_DIR = "diagnostics/";
    public static final String MANIFEST = "MANIFEST.json";

    public static final List<String> STATE_FILES = List.of(POSITIONS, LEDGER, INTENTS, INTENT_CURSOR);

    private static final Pattern DIAGNOSTIC_NAME = Pattern.compile("diag_\\d{8}_\\d{6}\\.json");
    private static final DateTimeFormatter DIAGNOSTIC_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private SnapshotLayout() {}

    /** Only these paths may ever be staged; anything else (secrets, caches) is refused. */
    public static boolean isAllowed(String path) {
        return STATE_FILES.contains(path) || MANIFEST.equals(path) || isDiagnostic(path);
    }

    public static boolean isDiagnostic(String path) {
        return path.startsWith(DIAGNOSTICS_DIR) && isDiagnosticName(path.substring(DIAGNOSTICS_DIR.length()));
    }

    public static boolean isDiagnosticName(String name) {
        return DIAGNOSTIC_NAME.matcher(name).matches();
    }

    public static String diagnosticName(OffsetDateTime at) {
        return "diag_" + at.format(DIAGNOSTIC_STAMP) + ".json";
    }
}
