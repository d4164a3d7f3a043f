package com.ai.scheduler.service;

import com.ai.scheduler.config.BusinessRules;
import com.ai.scheduler.entity.TimeSlot;
import com.ai.scheduler.repository.CalendarStore;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Finds the next free interval of the same length on the same day. Never looks at later days.
 */
@Service
public class ConflictResolver {

    public Optional<TimeSlot> suggestNextFreeSlot(CalendarStore store, TimeSlot candidate) {
        return suggestNextFreeSlot(store, candidate, null);
    }

    public Optional<TimeSlot> suggestNextFreeSlot(CalendarStore store, TimeSlot candidate, Long ignoreId) {
        BusinessRules rules = store.getRules();
        int duration = candidate.durationMinutes();
        LocalDateTime last = LocalDateTime.of(candidate.date(), rules.getLastStart());
        for (LocalDateTime t = candidate.start();
             !t.isAfter(last) && t.toLocalDate().equals(candidate.date());
             t = t.plusMinutes(rules.getGranularityMinutes())) {
            TimeSlot slot = TimeSlot.of(t, duration);
            if (store.checkBusinessHours(slot).valid() && store.findConflicts(slot, ignoreId).isEmpty()) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }
}
