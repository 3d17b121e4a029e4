package com.platform.replication.api;

import com.platform.replication.state.ReplicationStateMachine;
import com.platform.replication.state.TransitionRecord;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the state transition audit history.
 */
@RestController
@RequestMapping("/api/transitions")
public class TransitionController {

    private final ReplicationStateMachine stateMachine;

    public TransitionController(ReplicationStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    /**
     * Oldest first. {@code intent} filters by "namespace/name".
     */
    @GetMapping
    public List<TransitionRecord> getHistory(@RequestParam(required = false) String intent) {
        if (intent != null) {
            return stateMachine.getHistory(intent);
        }
        return stateMachine.getHistory();
    }
}
