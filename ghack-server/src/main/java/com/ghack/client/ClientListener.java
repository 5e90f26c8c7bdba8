package com.ghack.client;

import com.ghack.protocol.CombatHit;
import com.ghack.protocol.DisconnectReason;
import com.ghack.protocol.EntityDeath;
import com.ghack.protocol.LoginFailure;
import com.ghack.protocol.value.StateValue;

/**
 * Callbacks from a {@link GameClient}. All of them run on the client's
 * event loop thread; implement only what you need.
 */
public interface ClientListener {

    ClientListener NONE = new ClientListener() {
    };

    /** Login succeeded; the client may now send general traffic. */
    default void onEstablished(GameClient client) {
    }

    default void onLoginFailed(GameClient client, LoginFailure reason) {
    }

    /**
     * @param name the entity's name, null if the server sent none
     */
    default void onEntityAdded(GameClient client, int id, String name) {
    }

    default void onEntityRemoved(GameClient client, int id, String name) {
    }

    default void onStateUpdated(GameClient client, int id, String stateId, StateValue value) {
    }

    default void onControlAssigned(GameClient client, int uid, boolean revoked) {
    }

    default void onEntityDeath(GameClient client, EntityDeath death) {
    }

    default void onCombatHit(GameClient client, CombatHit hit) {
    }

    /**
     * The connection is gone.
     *
     * @param reason reason the server gave, null when it closed without a Disconnect
     * @param text   reason text, null when absent
     */
    default void onDisconnected(GameClient client, DisconnectReason reason, String text) {
    }
}
