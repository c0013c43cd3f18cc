package com.guardian.rag.cli;

public class CliUsageException extends RuntimeException {

    public CliUsageException(String message) {
        super(message);
    }
}
