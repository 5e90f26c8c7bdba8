package com.ghack.server;

import com.ghack.protocol.Envelope;
import com.ghack.protocol.Vector3;
import com.ghack.session.ClientSession;

/**
 * Game rules plugged into the server. The protocol layer only carries data;
 * everything that decides what happens in the game lives behind this
 * interface.
 *
 * All callbacks run on the event loop of the session's channel and must not
 * block.
 */
public interface GameLogic {

    /** Logic that ignores everything. */
    GameLogic NONE = new GameLogic() {
    };

    /**
     * The session completed the handshake; general traffic may now be sent to it.
     */
    default void onSessionEstablished(ClientSession session) {
    }

    /**
     * The client asked to move in a direction. The logic decides the
     * resulting position and reports it with UpdateState.
     */
    default void onMove(ClientSession session, Vector3 direction) {
    }

    /**
     * Any other general message from the client, delivered after the
     * session's entity table was updated. Messages dropped as minor errors
     * are not delivered.
     */
    default void onMessage(ClientSession session, Envelope envelope) {
    }

    /**
     * The connection is gone. Called once per session, whatever phase it reached.
     */
    default void onSessionClosed(ClientSession session) {
    }
}
