package com.ghack.session;

import com.ghack.protocol.AddEntity;
import com.ghack.protocol.Payload;
import com.ghack.protocol.RemoveEntity;
import com.ghack.protocol.UpdateState;
import com.ghack.protocol.value.StateValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entities known on one connection, with their latest states.
 *
 * Ordering rules are soft. RemoveEntity or UpdateState for an id that was
 * never added (or was already removed) is a minor error: the message is
 * dropped, a warning is logged and {@link #getMinorErrorCount()} goes up.
 * A repeated AddEntity keeps the existing states and refreshes the name.
 *
 * Thread Safety:
 * - ConcurrentHashMap for the entity map
 * - Writes come from the owning connection; reads may come from anywhere
 */
public class EntityTable {

    private static final Logger logger = LoggerFactory.getLogger(EntityTable.class);

    private final String owner;
    private final ConcurrentHashMap<Integer, EntityRecord> entities;
    private final AtomicLong minorErrors;

    /**
     * @param owner label used in log lines, typically the session id
     */
    public EntityTable(String owner) {
        this.owner = owner;
        this.entities = new ConcurrentHashMap<>();
        this.minorErrors = new AtomicLong();
    }

    /**
     * Applies an inbound entity message. Other payloads are ignored.
     */
    public SyncOutcome apply(Payload payload) {
        return apply(payload, true);
    }

    /**
     * Records an outbound entity message so the table mirrors what the peer
     * was told. Unknown ids are logged but not counted as minor errors,
     * since the fault is local.
     */
    public SyncOutcome track(Payload payload) {
        return apply(payload, false);
    }

    private SyncOutcome apply(Payload payload, boolean inbound) {
        switch (payload.type()) {
            case ADD_ENTITY: {
                AddEntity add = (AddEntity) payload;
                return add(add.getId(), add.getName());
            }
            case REMOVE_ENTITY: {
                RemoveEntity remove = (RemoveEntity) payload;
                return remove(remove.getId(), inbound);
            }
            case UPDATE_STATE: {
                UpdateState update = (UpdateState) payload;
                return update(update.getId(), update.getStateId(), update.getValue(), inbound);
            }
            default:
                return SyncOutcome.NOT_APPLICABLE;
        }
    }

    public SyncOutcome add(int id, String name) {
        EntityRecord existing = entities.putIfAbsent(id, new EntityRecord(id, name));
        if (existing == null) {
            return SyncOutcome.ADDED;
        }
        if (name != null) {
            existing.setName(name);
        }
        logger.debug("[{}] entity {} added again", owner, id);
        return SyncOutcome.REANNOUNCED;
    }

    public SyncOutcome remove(int id) {
        return remove(id, true);
    }

    private SyncOutcome remove(int id, boolean inbound) {
        if (entities.remove(id) == null) {
            return unknown("removed", id, inbound);
        }
        return SyncOutcome.REMOVED;
    }

    public SyncOutcome update(int id, String stateId, StateValue value) {
        return update(id, stateId, value, true);
    }

    private SyncOutcome update(int id, String stateId, StateValue value, boolean inbound) {
        EntityRecord record = entities.get(id);
        if (record == null) {
            return unknown("updated (" + stateId + ")", id, inbound);
        }
        record.setState(stateId, value);
        return SyncOutcome.UPDATED;
    }

    private SyncOutcome unknown(String action, int id, boolean inbound) {
        if (inbound) {
            minorErrors.incrementAndGet();
            logger.warn("[{}] entity {} {} without being added, ignoring", owner, id, action);
        } else {
            logger.warn("[{}] sent: entity {} {} without being added", owner, id, action);
        }
        return SyncOutcome.UNKNOWN_ENTITY;
    }

    public EntityRecord get(int id) {
        return entities.get(id);
    }

    public boolean contains(int id) {
        return entities.containsKey(id);
    }

    public Set<Integer> ids() {
        return Collections.unmodifiableSet(entities.keySet());
    }

    public Collection<EntityRecord> all() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public int size() {
        return entities.size();
    }

    public long getMinorErrorCount() {
        return minorErrors.get();
    }

    public void clear() {
        entities.clear();
    }
}
