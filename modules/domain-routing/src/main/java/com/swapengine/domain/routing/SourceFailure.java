package com.swapengine.domain.routing;

public record SourceFailure(String source, String reason) {}
