package com.podscope.model;

import java.util.List;

public interface ContainerHandle {
    String id();

    String name();

    Lookup<List<String>> networks();
}
