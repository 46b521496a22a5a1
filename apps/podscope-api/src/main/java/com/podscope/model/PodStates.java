package com.podscope.model;

import java.util.Collection;

public final class PodStates {

    public static final String CREATED = "Created";
    public static final String RUNNING = "Running";
    public static final String PAUSED = "Paused";
    public static final String STOPPED = "Stopped";
    public static final String EXITED = "Exited";
    public static final String DEGRADED = "Degraded";
    public static final String ERROR = "Error";

    private PodStates() {
    }

    /**
     * Folds the states of the child containers into the status reported for the whole pod.
     */
    public static String derive(Collection<ContainerStatus> statuses) {
        int total = statuses.size();
        if (total == 0) {
            return CREATED;
        }
        int running = 0;
        int paused = 0;
        int exited = 0;
        int errored = 0;
        for (ContainerStatus status : statuses) {
            switch (status) {
                case RUNNING -> running++;
                case PAUSED -> paused++;
                case EXITED, STOPPED -> exited++;
                case CREATED, CONFIGURED -> {
                }
                default -> errored++;
            }
        }
        if (running > 0 && running < total) {
            return DEGRADED;
        }
        if (running == total) {
            return RUNNING;
        }
        if (paused == total) {
            return PAUSED;
        }
        if (exited == total) {
            return EXITED;
        }
        if (exited > 0) {
            return STOPPED;
        }
        if (errored > 0) {
            return ERROR;
        }
        return CREATED;
    }
}
