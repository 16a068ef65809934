package com.cardledger.backend.exceptions;

import com.cardledger.backend.enums.ImportState;

public class IllegalImportStateException extends RuntimeException {

    private final ImportState state;

    public IllegalImportStateException(String operation, ImportState state) {
        super("Cannot " + operation + " an import in state " + state);
        this.state = state;
    }

    public ImportState getState() {
        return state;
    }
}
