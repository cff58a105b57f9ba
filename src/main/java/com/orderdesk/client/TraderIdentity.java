package com.orderdesk.client;

/** Caller identity forwarded to the trading API as X-User-Id and X-User-Role. */
public record TraderIdentity(String userId, String role) {}
