package com.llmbridge.providers;

import com.llmbridge.routing.CapabilityFilter;

public record ListModelsOptions(boolean forceRefresh, CapabilityFilter filter) {

    public static ListModelsOptions defaults() {
        return new ListModelsOptions(false, null);
    }

    public static ListModelsOptions refresh() {
        return new ListModelsOptions(true, null);
    }

    public static ListModelsOptions filtered(CapabilityFilter filter) {
        return new ListModelsOptions(false, filter);
    }
}
