package com.flowstore.health;

/**
 * One entry in the {@link ErrorLog}.
 */
public final class ErrorRecord {

    private final String operation;
    private final String key;
    private final String type;
    private final String message;
    private final long timestamp;

    public ErrorRecord(String operation, String key, String type, String message, long timestamp) {
        this.operation = operation;
        this.key = key;
        this.type = type;
        this.message = message;
        this.timestamp = timestamp;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return the key involved, or null for keyless operations
     */
    public String getKey() {
        return key;
    }

    /**
     * Simple class name of the exception.
     */
    public String getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "ErrorRecord{" +
               "operation='" + operation + '\'' +
               ", key='" + key + '\'' +
               ", type='" + type + '\'' +
               ", message='" + message + '\'' +
               ", timestamp=" + timestamp +
               '}';
    }
}
