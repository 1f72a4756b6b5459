package com.fitcoach.backend.resolution.service;

import com.fitcoach.backend.resolution.model.RecordKind;

/**
 * strict 模式下讀取失敗（含 timeout）時丟出，由 ApiExceptionHandler 轉 503。
 */
public class ProgramResolutionException extends RuntimeException {

    public static final String CODE = "PROGRAM_RESOLUTION_UNAVAILABLE";

    private final RecordKind kind;

    public ProgramResolutionException(RecordKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public RecordKind getKind() {
        return kind;
    }
}
