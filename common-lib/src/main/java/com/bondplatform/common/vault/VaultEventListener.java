package com.bondplatform.common.vault;

/**
 * Receives vault events after the emitting operation has committed.
 * Listener failures are logged and never undo the operation.
 */
@FunctionalInterface
public interface VaultEventListener {

    void onEvent(VaultEvent event);
}
