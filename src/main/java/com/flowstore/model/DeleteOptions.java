package com.flowstore.model;

/**
 * Per-delete options.
 */
public final class DeleteOptions {

    private static final DeleteOptions DEFAULTS = new DeleteOptions(false);
    private static final DeleteOptions WITH_BACKUP = new DeleteOptions(true);

    private final boolean backup;

    private DeleteOptions(boolean backup) {
        this.backup = backup;
    }

    public static DeleteOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Keep a copy of the removed record in the backup store.
     */
    public static DeleteOptions withBackup() {
        return WITH_BACKUP;
    }

    public boolean isBackup() {
        return backup;
    }
}
