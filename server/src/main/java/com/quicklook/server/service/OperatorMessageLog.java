package com.quicklook.server.service;

import com.quicklook.server.OperatorNotifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, most-recent-first list of messages for the operator.
 */
@Service
public class OperatorMessageLog implements OperatorNotifier {

    static final int CAPACITY = 200;

    public static class Message {
        public final String level;
        public final String text;
        public final long ts;

        public Message(String level, String text, long ts) {
            this.level = level;
            this.text = text;
            this.ts = ts;
        }
    }

    private final Deque<Message> messages = new ArrayDeque<>();

    @Override
    public void warn(String message) {
        add("WARN", message);
    }

    @Override
    public void error(String message) {
        add("ERROR", message);
    }

    @Override
    public void info(String message) {
        add("INFO", message);
    }

    private synchronized void add(String level, String text) {
        messages.addFirst(new Message(level, text, System.currentTimeMillis()));
        while (messages.size() > CAPACITY) {
            messages.removeLast();
        }
    }

    public synchronized List<Message> recent(int limit) {
        List<Message> out = new ArrayList<>();
        for (Message m : messages) {
            if (out.size() >= limit) {
                break;
            }
            out.add(m);
        }
        return out;
    }
}
