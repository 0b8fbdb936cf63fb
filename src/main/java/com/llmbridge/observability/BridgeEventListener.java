package com.llmbridge.observability;

@FunctionalInterface
public interface BridgeEventListener {
    void onEvent(BridgeEvent event);
}
