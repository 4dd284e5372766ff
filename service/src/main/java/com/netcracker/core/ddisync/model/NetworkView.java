package com.netcracker.core.ddisync.model;

public record NetworkView(String name, String comment) {
}
