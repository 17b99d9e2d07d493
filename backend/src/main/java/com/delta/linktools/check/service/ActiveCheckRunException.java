package com.delta.linktools.check.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveCheckRunException extends RuntimeException {
    public ActiveCheckRunException(String message) {
        super(message);
    }
}
