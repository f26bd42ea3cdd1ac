package org.nowstart.perpbot.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.type.RiskVerdict;
import org.nowstart.perpbot.service.AgentCycleService;
import org.nowstart.perpbot.service.AgentLifecycleService;
import org.nowstart.perpbot.service.AgentSession;
import org.nowstart.perpbot.service.NotificationService;
import org.nowstart.perpbot.service.VolatilityTracker;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Self-paced control loop. Each run is scheduled from the previous run's completion, so cycles never
 * overlap, and the trigger stops producing executions once the session is stopped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentLoopScheduler implements SchedulingConfigurer {

    static final Duration MIN_SLEEP = Duration.ofSeconds(1);
    static final Duration STARTUP_POLL = Duration.ofSeconds(1);
    static final int MAX_CONSECUTIVE_FAILURES = 3;

    private final AgentCycleService agentCycleService;
    private final AgentLifecycleService agentLifecycleService;
    private final AgentSession agentSession;
    private final AgentProperties agentProperties;
    private final VolatilityTracker volatilityTracker;
    private final NotificationService notificationService;
    private final TaskScheduler agentTaskScheduler;
    private final Clock clock;

    private volatile Duration nextDelay = Duration.ZERO;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(agentTaskScheduler);
        taskRegistrar.addTriggerTask(this::tick, this::nextExecution);
    }

    Instant nextExecution(TriggerContext triggerContext) {
        if (agentSession.isStopped()) {
            return null;
        }
        Instant lastCompletion = triggerContext.lastCompletion();
        if (lastCompletion == null) {
            return clock.instant();
        }
        return lastCompletion.plus(nextDelay);
    }

    void tick() {
        if (agentSession.isStopped()) {
            return;
        }
        if (!agentLifecycleService.isStarted()) {
            nextDelay = STARTUP_POLL;
            return;
        }

        Instant cycleStart = clock.instant();
        try {
            RiskVerdict verdict = agentCycleService.runCycle();
            agentSession.resetCycleFailures();
            if (verdict.isTerminal()) {
                agentLifecycleService.terminate(verdict);
                return;
            }
            nextDelay = sleepAfter(Duration.between(cycleStart, clock.instant()));
        } catch (RuntimeException e) {
            int failures = agentSession.recordCycleFailure();
            log.error(
                    "event=cycle_failed cycle={} consecutive_failures={} reason={}",
                    agentSession.cycleCount(),
                    failures,
                    e.getMessage(),
                    e
            );
            Duration delay = sleepAfter(Duration.between(cycleStart, clock.instant()));
            if (failures >= MAX_CONSECUTIVE_FAILURES) {
                log.warn("event=agent_paused consecutive_failures={} cooldown={}", failures, agentProperties.errorCooldown());
                notificationService.notify(
                        "Agent Paused",
                        "**" + failures + " consecutive errors, cooling off " + agentProperties.errorCooldown().toMinutes() + "min.**\n\n"
                                + "- **Last error:** " + e.getMessage() + "\n\n"
                                + "_Will resume automatically._",
                        "warning,zzz",
                        NotificationService.PRIORITY_HIGH
                );
                delay = delay.plus(agentProperties.errorCooldown());
                agentSession.resetCycleFailures();
            }
            nextDelay = delay;
        }
    }

    /**
     * {@code max(interval * volatilityMultiplier - cycleElapsed, 1s)}.
     */
    Duration sleepAfter(Duration cycleElapsed) {
        long effectiveMs = Math.round(agentProperties.interval().toMillis() * volatilityTracker.sleepMultiplier());
        Duration remaining = Duration.ofMillis(effectiveMs).minus(cycleElapsed);
        Duration sleep = remaining.compareTo(MIN_SLEEP) < 0 ? MIN_SLEEP : remaining;
        log.debug(
                "event=cycle_sleep elapsed_ms={} sleep_ms={} multiplier={}",
                cycleElapsed.toMillis(),
                sleep.toMillis(),
                volatilityTracker.sleepMultiplier()
        );
        return sleep;
    }

    Duration nextDelay() {
        return nextDelay;
    }
}
