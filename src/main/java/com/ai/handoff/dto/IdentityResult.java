package com.ai.handoff.dto;

/**
 * Outcome of identity normalization. Invalid results always carry an error kind.
 */
public record IdentityResult(
        String original,
        String identity,
        boolean valid,
        ErrorKind errorKind,
        String errorMessage,
        String countryCode,
        String nationalNumber
) {

    public enum ErrorKind {
        EMPTY,
        NO_DIGITS,
        INVALID_LENGTH,
        NOT_MOBILE
    }

    public static IdentityResult valid(String original, String identity, String countryCode, String nationalNumber) {
        return new IdentityResult(original, identity, true, null, null, countryCode, nationalNumber);
    }

    public static IdentityResult invalid(String original, ErrorKind kind, String message,
                                         String countryCode, String nationalNumber) {
        return new IdentityResult(original, "", false, kind, message, countryCode, nationalNumber);
    }
}
