package com.ai.echomi.conversation;

import com.ai.echomi.dto.HistoryEntry;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call conversation state as resent by the caller on every turn: where the
 * call is in its stage graph, who is calling and what has been learned so far.
 */
public class SessionContext {

    private final String sessionId;
    private final String callerId;
    private CallerRole callerRole;
    private ConversationStage stage;
    private Language language;
    private final Map<String, Object> facts = new LinkedHashMap<>();
    private final List<HistoryEntry> history = new ArrayList<>();

    public SessionContext(String sessionId, String callerId, CallerRole callerRole,
                          ConversationStage stage, Language language) {
        this.sessionId = sessionId;
        this.callerId = callerId;
        this.callerRole = callerRole;
        this.stage = stage;
        this.language = language != null ? language : Language.EN;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCallerId() {
        return callerId;
    }

    public CallerRole getCallerRole() {
        return callerRole;
    }

    public ConversationStage getStage() {
        return stage;
    }

    /**
     * Moves the session onto another stage. Switching graphs goes through
     * {@link #handOver(ConversationStage)}.
     */
    public void setStage(ConversationStage stage) {
        if (stage.role() != callerRole) {
            throw new IllegalArgumentException("Stage " + stage.label() + " does not belong to role " + callerRole.label());
        }
        this.stage = stage;
    }

    public void handOver(ConversationStage stage) {
        this.callerRole = stage.role();
        this.stage = stage;
    }

    public Language getLanguage() {
        return language;
    }

    public Map<String, Object> getFacts() {
        return Collections.unmodifiableMap(facts);
    }

    public void putAll(Map<String, ?> values) {
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null) {
                    facts.put(k, v);
                }
            });
        }
    }

    public void put(String key, Object value) {
        if (value != null) {
            facts.put(key, value);
        }
    }

    public void putIfAbsent(String key, Object value) {
        if (value != null && !has(key)) {
            facts.put(key, value);
        }
    }

    public boolean has(String key) {
        Object v = facts.get(key);
        return v != null && !(v instanceof String && ((String) v).isBlank());
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object v = facts.get(key);
        return v != null && type.isInstance(v) ? (T) v : null;
    }

    public String getString(String key) {
        Object v = facts.get(key);
        return v == null ? null : v.toString();
    }

    public int getInt(String key) {
        Object v = facts.get(key);
        if (v instanceof Number) {
            return ((Number) v).intValue();
        }
        if (v instanceof String) {
            return NumberUtils.toInt(((String) v).trim());
        }
        return 0;
    }

    public boolean getBoolean(String key) {
        Object v = facts.get(key);
        return v instanceof Boolean ? (Boolean) v : v != null && Boolean.parseBoolean(v.toString());
    }

    public List<String> getStringList(String key) {
        Object v = facts.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List) {
            for (Object item : (List<?>) v) {
                if (item != null) {
                    out.add(item.toString());
                }
            }
        }
        return out;
    }

    public void appendToList(String key, String value) {
        List<String> list = getStringList(key);
        list.add(value);
        facts.put(key, list);
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public void addHistory(List<HistoryEntry> entries) {
        if (entries != null) {
            history.addAll(entries);
        }
    }

    public void appendTurn(String role, String content) {
        history.add(new HistoryEntry(role, content));
    }

    /**
     * Deep enough copy for a turn to work on without touching the request's state.
     */
    public SessionContext copy() {
        SessionContext c = new SessionContext(sessionId, callerId, callerRole, stage, language);
        facts.forEach((k, v) -> c.facts.put(k, v instanceof List ? new ArrayList<>((List<?>) v) : v));
        c.history.addAll(history);
        return c;
    }
}
