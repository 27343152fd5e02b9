package com.acled.client.core.model;

/** Event type followed by its sub-event type, e.g. {@code Protests} / {@code Peaceful protest}. */
public record EventType(String type, String subType) {}
