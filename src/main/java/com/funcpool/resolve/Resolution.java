package com.funcpool.resolve;

import java.util.HashMap;
import java.util.Map;

/**
 * Load state of every hash touched by one resolution request.
 */
public class Resolution {

    public enum State {
        PENDING,
        LOADING,
        LOADED
    }

    private final Map<String, State> states = new HashMap<>();

    public State stateOf(String hash) {
        return states.getOrDefault(hash, State.PENDING);
    }

    /**
     * Moves a pending hash to {@link State#LOADING}. Returns false when the hash was already
     * visited, which on a cycle means a back-edge.
     */
    public boolean begin(String hash) {
        if (stateOf(hash) != State.PENDING) {
            return false;
        }
        states.put(hash, State.LOADING);
        return true;
    }

    public void complete(String hash) {
        if (stateOf(hash) != State.LOADING) {
            throw new IllegalStateException("Hash " + hash + " is not loading");
        }
        states.put(hash, State.LOADED);
    }
}
