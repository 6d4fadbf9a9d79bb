package com.pulsewire.core.config;

public record ThoughtLeader(String name, String handle) {

    public ThoughtLeader {
        handle = handle != null ? handle.trim().replaceFirst("^@", "") : "";
    }
}
