package com.memkv.protocol;

public final class Request {

    public enum Operation {
        SET,
        GET,
        DELETE
    }

    private final Operation operation;
    private final String key;
    private final String value;

    private Request(Operation operation, String key, String value) {
        this.operation = operation;
        this.key = key;
        this.value = value;
    }

    public static Request set(String key, String value) {
        return new Request(Operation.SET, key, value);
    }

    public static Request get(String key) {
        return new Request(Operation.GET, key, null);
    }

    public static Request delete(String key) {
        return new Request(Operation.DELETE, key, null);
    }

    public Operation getOperation() {
        return operation;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return operation + " " + key;
    }
}
