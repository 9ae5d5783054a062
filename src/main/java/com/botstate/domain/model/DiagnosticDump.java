package com.botstate.domain.model;

import lombok.Value;

/**
 * A diagnostics file carried in the snapshot. Names sort chronologically
 * ({@code diag_yyyyMMdd_HHmmss.json}), which is what retention relies on.
 */
@Value
public class DiagnosticDump {

    String name;
    byte[] content;
}
