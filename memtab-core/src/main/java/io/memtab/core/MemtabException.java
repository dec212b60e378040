package io.memtab.core;

public class MemtabException extends RuntimeException {

    public MemtabException(String message, Throwable cause) {
        super(message, cause);
    }

}
