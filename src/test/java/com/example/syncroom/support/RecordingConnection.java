package com.example.syncroom.support;

import com.example.syncroom.store.RoomConnection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Connection that keeps everything it was sent; can be told to fail sends. */
public class RecordingConnection implements RoomConnection {
    private static final ObjectMapper OM = new ObjectMapper();

    private final String id;
    private final String identity;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;

    public RecordingConnection(String id, String identity) {
        this.id = id;
        this.identity = identity;
    }

    public void failSends() {
        this.failSends = true;
    }

    public List<JsonNode> messages() {
        List<JsonNode> out = new ArrayList<>();
        for (String s : sent) {
            try {
                out.add(OM.readTree(s));
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
        return out;
    }

    public List<JsonNode> messagesOfType(String type) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode m : messages()) {
            if (type.equals(m.path("type").asText())) out.add(m);
        }
        return out;
    }

    public JsonNode last() {
        List<JsonNode> all = messages();
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }

    public void clear() {
        sent.clear();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getIdentity() {
        return identity;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String json) throws IOException {
        if (failSends) throw new IOException("broken pipe");
        sent.add(json);
    }

    @Override
    public void close() {
        open = false;
    }
}
