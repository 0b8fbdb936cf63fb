package com.llmbridge.providers;

import com.llmbridge.shared.model.Capabilities;

public record AdapterMetadata(
    String name,
    Capabilities capabilities,
    boolean remoteModelListing,
    String defaultModel,
    double costPer1kTokens
) {}
