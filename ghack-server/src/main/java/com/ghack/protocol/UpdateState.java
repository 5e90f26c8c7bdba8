package com.ghack.protocol;

import com.ghack.protocol.value.StateValue;

import java.util.Objects;

/**
 * Sets one named state of an entity. The entity must have been announced
 * with AddEntity first; otherwise this is a minor error.
 */
public final class UpdateState extends Payload {

    private final int id;
    private final String stateId;
    private final StateValue value;

    public UpdateState(int id, String stateId, StateValue value) {
        this.id = id;
        this.stateId = Objects.requireNonNull(stateId, "stateId");
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public MessageType type() {
        return MessageType.UPDATE_STATE;
    }

    public int getId() {
        return id;
    }

    public String getStateId() {
        return stateId;
    }

    public StateValue getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UpdateState)) {
            return false;
        }
        UpdateState other = (UpdateState) o;
        return id == other.id && stateId.equals(other.stateId) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, stateId, value);
    }

    @Override
    public String toString() {
        return "UpdateState{id=" + id + ", stateId='" + stateId + "', value=" + value + '}';
    }
}
