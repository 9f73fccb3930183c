package tech.accessplane.platform.tenant;

public record Enterprise(String id, String name) {}
