package com.ai.scheduler.component;

import com.ai.scheduler.config.BusinessRules;
import com.ai.scheduler.conversation.SchedulingSession;
import com.ai.scheduler.repository.CalendarStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions by id. Each session gets its own calendar; nothing is shared or persisted.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, SchedulingSession> sessions = new ConcurrentHashMap<>();
    private final BusinessRules rules;

    public SessionRegistry(BusinessRules rules) {
        this.rules = rules;
    }

    public SchedulingSession getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            log.debug("[{}] new session", id);
            return new SchedulingSession(id, new CalendarStore(rules));
        });
    }

    public Optional<SchedulingSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean remove(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    public int size() {
        return sessions.size();
    }
}
