package com.aceengine.orchestrator;

import com.aceengine.core.journal.JournalRepository;

import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class RunContextFactory {

    private final JournalRepository journals;
    private final Clock             clock;

    public RunContextFactory(JournalRepository journals, Clock clock) {
        this.journals = journals;
        this.clock    = clock;
    }

    public RunContext create(String runId) {
        return new RunContext(runId, clock.instant(), journals);
    }
}
