package com.eainde.bidding.model;

/**
 * Issued by the namespace manager; every index and retrieval call goes through one.
 */
public record NamespaceHandle(String namespaceId, String sessionId, IsolationMode mode) {
}
