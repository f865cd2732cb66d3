package com.petwash.ledger.audit.web;

import java.time.Instant;

public record ErrorResponse(
        String requestId,
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {}
