package com.providerhub.providers;

public record ToolCallInfo(String id, String name, String arguments) {}
