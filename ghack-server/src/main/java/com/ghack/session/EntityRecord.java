package com.ghack.session;

import com.ghack.protocol.value.StateValue;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An entity as known on one connection: its id, optional type name and the
 * latest value of each named state.
 *
 * Mutated only by its {@link EntityTable}; readers on other threads see a
 * consistent value per state.
 */
public class EntityRecord {

    private final int id;
    private volatile String name;
    private final ConcurrentHashMap<String, StateValue> states;

    EntityRecord(int id, String name) {
        this.id = id;
        this.name = name;
        this.states = new ConcurrentHashMap<>();
    }

    public int getId() {
        return id;
    }

    /**
     * Entity type name, null when never announced with one.
     */
    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    /**
     * Latest value of a state, null when it was never set.
     */
    public StateValue getState(String stateId) {
        return states.get(stateId);
    }

    public boolean hasState(String stateId) {
        return states.containsKey(stateId);
    }

    /**
     * Unmodifiable live view of all states.
     */
    public Map<String, StateValue> getStates() {
        return Collections.unmodifiableMap(states);
    }

    void setState(String stateId, StateValue value) {
        states.put(stateId, value);
    }

    @Override
    public String toString() {
        return "EntityRecord{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", states=" + states +
                '}';
    }
}
