package com.delta.linktools.check.model;

public record StopResponse(boolean stopped, boolean running) {
}
