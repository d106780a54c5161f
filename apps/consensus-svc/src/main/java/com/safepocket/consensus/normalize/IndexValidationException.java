package com.safepocket.consensus.normalize;

public class IndexValidationException extends RuntimeException {

    public IndexValidationException(String message) {
        super(message);
    }
}
