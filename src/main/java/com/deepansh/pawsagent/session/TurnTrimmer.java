package com.deepansh.pawsagent.session;

import com.deepansh.pawsagent.model.SessionMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the last N turns of a message log. A turn starts at a user message and runs
 * until the next one; turns are kept or discarded whole. Messages before the first
 * user message belong to no turn and are always dropped.
 */
public final class TurnTrimmer {

    private TurnTrimmer() {
    }

    public static List<SessionMessage> keepLastTurns(List<SessionMessage> messages, int maxTurns) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be >= 1");
        }

        List<Integer> turnStarts = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).startsTurn()) {
                turnStarts.add(i);
            }
        }

        if (turnStarts.isEmpty()) {
            return new ArrayList<>();
        }
        if (turnStarts.size() <= maxTurns && turnStarts.get(0) == 0) {
            return messages;
        }

        int from = turnStarts.get(Math.max(0, turnStarts.size() - maxTurns));
        return new ArrayList<>(messages.subList(from, messages.size()));
    }
}
