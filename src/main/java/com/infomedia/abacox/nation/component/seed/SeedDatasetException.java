package com.infomedia.abacox.nation.component.seed;

public class SeedDatasetException extends RuntimeException {

    public SeedDatasetException(String message) {
        super(message);
    }

    public SeedDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
