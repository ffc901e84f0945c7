package com.anonrelay.shared.model;

/** Button attached to an outbound message; {@code data} comes back as a callback. */
public record OutboundAction(String label, String data) {}
