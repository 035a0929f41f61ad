package com.flowstore.model;

public final class DeleteResult {

    private final String key;
    private final boolean existed;

    public DeleteResult(String key, boolean existed) {
        this.key = key;
        this.existed = existed;
    }

    public String getKey() {
        return key;
    }

    public boolean isExisted() {
        return existed;
    }

    @Override
    public String toString() {
        return "DeleteResult{key='" + key + "', existed=" + existed + '}';
    }
}
