package com.podscope.model;

import java.util.Locale;

public enum ContainerStatus {
    UNKNOWN,
    CONFIGURED,
    CREATED,
    RUNNING,
    STOPPED,
    PAUSED,
    EXITED,
    REMOVING,
    STOPPING;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return label();
    }
}
