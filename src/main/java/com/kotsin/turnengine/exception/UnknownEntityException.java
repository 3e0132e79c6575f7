package com.kotsin.turnengine.exception;

public class UnknownEntityException extends RuntimeException {

    public UnknownEntityException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
