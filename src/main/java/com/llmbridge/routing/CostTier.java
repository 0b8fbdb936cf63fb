package com.llmbridge.routing;

public enum CostTier {
    SIMPLE, MODERATE, COMPLEX
}
