package com.signalsync.cloud.service;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String id) {
        super("Unknown session: " + id);
    }
}
