package com.jguard.platform;

public record MessageRef(String id, String jumpUrl) {
}
