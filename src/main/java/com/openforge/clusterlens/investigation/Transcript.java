package com.openforge.clusterlens.investigation;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only record of one session's messages.
 *
 * Appends happen on the investigation thread while the web layer may read a
 * snapshot concurrently, so every access goes through the instance lock.
 */
public class Transcript {

    private final List<Message> messages = new ArrayList<>();

    public synchronized void append(Message message) {
        messages.add(message);
    }

    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }

    /** What the model gets to see: everything except tool output. */
    public synchronized List<Message> conversationHistory() {
        return messages.stream().filter(m -> !m.isTool()).toList();
    }

    public synchronized int size() {
        return messages.size();
    }
}
