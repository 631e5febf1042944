package com.ai.handoff.component;

import com.ai.handoff.dto.IdentityResult;

public class InvalidIdentityException extends RuntimeException {

    private final IdentityResult result;

    public InvalidIdentityException(IdentityResult result) {
        super("Invalid sender id '" + result.original() + "': " + result.errorMessage());
        this.result = result;
    }

    public IdentityResult getResult() {
        return result;
    }

    public IdentityResult.ErrorKind getErrorKind() {
        return result.errorKind();
    }
}
