package com.studio45.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

/**
 * Domain failure with a stable machine code and a message that is safe to show to the caller.
 * The reason phrase is the detail, so {@link #getReason()} reads like the message clients see.
 */
public class ProblemException extends ResponseStatusException {

    private final ErrorKind kind;
    private final String code;

    public ProblemException(ErrorKind kind, String code, String detail) {
        this(kind, code, detail, null);
    }

    public ProblemException(ErrorKind kind, String code, String detail, Throwable cause) {
        super(kind.status(), detail, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
    }

    public static ProblemException validation(String code, String detail) {
        return new ProblemException(ErrorKind.VALIDATION, code, detail);
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(ErrorKind.NOT_FOUND, code, detail);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(ErrorKind.CONFLICT, code, detail);
    }

    public static ProblemException unauthorized(String code, String detail) {
        return new ProblemException(ErrorKind.UNAUTHORIZED, code, detail);
    }

    public static ProblemException internal(String code, String detail, Throwable cause) {
        return new ProblemException(ErrorKind.INTERNAL, code, detail, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }
}
