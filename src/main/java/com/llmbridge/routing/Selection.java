package com.llmbridge.routing;

public record Selection(String backend, String model, CostTier tier, String reason) {}
