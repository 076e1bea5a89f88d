package com.deepansh.pawsagent.session;

import com.deepansh.pawsagent.model.SessionMessage;

import java.util.Optional;

/**
 * Durable, TTL-bound conversation log keyed by normalized identity,
 * plus the delivery markers used for duplicate detection.
 *
 * Read paths fail soft ({@link #load}, {@link #isSeen}); write paths that would
 * lose a turn ({@link #append}, {@link #end}, {@link #touch}) propagate.
 */
public interface SessionStore {

    void connect();

    void disconnect();

    boolean isHealthy();

    /** Empty when the session does not exist, has expired or cannot be read. */
    Optional<Session> load(String identity);

    /** Load-or-create, append, trim to whole turns, persist with a fresh TTL. */
    Session append(String identity, SessionMessage message);

    void end(String identity);

    /** TTL renewal only, content untouched. */
    void touch(String identity);

    boolean isSeen(String inboundMessageId);

    /**
     * Records the delivery marker.
     *
     * @return true if this call created the marker, false if it already existed
     */
    boolean markSeen(String inboundMessageId);
}
