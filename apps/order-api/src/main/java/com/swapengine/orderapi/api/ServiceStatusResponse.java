package com.swapengine.orderapi.api;

public record ServiceStatusResponse(String status) {}
