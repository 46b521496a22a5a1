package com.podscope.k8s;

import com.podscope.model.Pod;
import com.podscope.network.NetworkRegistry;
import java.util.List;

public interface PodInventory {
    List<? extends Pod> listPods(String namespace);

    NetworkRegistry networks(String namespace);
}
