package com.ai.scheduler.controller;

import com.ai.scheduler.component.SessionRegistry;
import com.ai.scheduler.conversation.SchedulingSession;
import com.ai.scheduler.dto.AppointmentView;
import com.ai.scheduler.dto.TurnRequest;
import com.ai.scheduler.dto.TurnResponse;
import com.ai.scheduler.dto.TurnResult;
import com.ai.scheduler.exception.SchedulerException;
import com.ai.scheduler.service.ConversationOrchestrator;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON surface over {@link ConversationOrchestrator}. Adds no scheduling behaviour of its own.
 */
@RestController
@RequestMapping("/api/sessions")
public class ConversationController {

    private final ConversationOrchestrator orchestrator;
    private final SessionRegistry sessions;

    public ConversationController(ConversationOrchestrator orchestrator, SessionRegistry sessions) {
        this.orchestrator = orchestrator;
        this.sessions = sessions;
    }

    @PostMapping("/{sessionId}/turns")
    public TurnResponse turn(@PathVariable String sessionId, @RequestBody TurnRequest request) {
        if (request == null || StringUtils.isBlank(request.getText())) {
            throw SchedulerException.badRequest("text must not be blank");
        }
        SchedulingSession session = sessions.getOrCreate(sessionId);
        TurnResult result = orchestrator.handleTurn(session, request.getText());
        return TurnResponse.builder()
                .sessionId(result.sessionId())
                .replies(result.replies())
                .transcript(result.transcript())
                .pending(result.state().getPhase().name())
                .appointments(views(session))
                .build();
    }

    @GetMapping("/{sessionId}/appointments")
    public List<AppointmentView> appointments(@PathVariable String sessionId) {
        SchedulingSession session = sessions.find(sessionId)
                .orElseThrow(() -> SchedulerException.sessionNotFound(sessionId));
        return views(session);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> close(@PathVariable String sessionId) {
        if (!sessions.remove(sessionId)) {
            throw SchedulerException.sessionNotFound(sessionId);
        }
        return ResponseEntity.noContent().build();
    }

    private static List<AppointmentView> views(SchedulingSession session) {
        synchronized (session) {
            return session.getCalendar().listAll().stream()
                    .map(AppointmentView::from)
                    .collect(Collectors.toList());
        }
    }
}
