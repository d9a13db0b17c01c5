package com.memkv.storage;

import java.util.concurrent.CompletableFuture;

final class StorageCommand {

    enum Operation {
        SET,
        GET,
        DELETE
    }

    private final Operation operation;
    private final String key;
    private final String value;
    private final CompletableFuture<LookupResult> reply;

    private StorageCommand(Operation operation, String key, String value, CompletableFuture<LookupResult> reply) {
        this.operation = operation;
        this.key = key;
        this.value = value;
        this.reply = reply;
    }

    static StorageCommand set(String key, String value) {
        return new StorageCommand(Operation.SET, key, value, null);
    }

    static StorageCommand get(String key) {
        return new StorageCommand(Operation.GET, key, null, new CompletableFuture<>());
    }

    static StorageCommand delete(String key) {
        return new StorageCommand(Operation.DELETE, key, null, null);
    }

    Operation getOperation() {
        return operation;
    }

    String getKey() {
        return key;
    }

    String getValue() {
        return value;
    }

    CompletableFuture<LookupResult> getReply() {
        return reply;
    }
}
