package com.pgpulse.monitor;

import com.pgpulse.model.ConnectionProfile;
import com.pgpulse.model.ConnectionProfileView;
import com.pgpulse.store.ProfileRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the monitoring lifecycle: one active profile at most, one repeating task, one execution lane.
 *
 * <p>All cycles run on a single thread with fixed-delay scheduling, so they never overlap and a slow
 * cycle postpones the next tick instead of queueing more. Every arm/disarm bumps a generation
 * counter; a task only runs its cycle while its generation is current, so a replaced or stopped
 * schedule cannot fire once more.
 */
@Component
public class MonitoringScheduler {
    private static final Logger log = LoggerFactory.getLogger(MonitoringScheduler.class);

    private final SamplingCycle cycle;
    private final ProfileRepository profileRepository;
    private final Duration interval;
    private final Duration resumeDelay;
    private final ScheduledExecutorService lane;

    private final Object lifecycleLock = new Object();
    private final AtomicLong generation = new AtomicLong();
    private ScheduledFuture<?> scheduledTask;
    private volatile ConnectionProfile activeProfile;

    /**
     * Snapshot of the scheduler state.
     */
    public static class Status {
        private final boolean running;
        private final ConnectionProfileView profile;

        public Status(boolean running, ConnectionProfileView profile) {
            this.running = running;
            this.profile = profile;
        }

        public boolean isRunning() {
            return running;
        }

        public ConnectionProfileView getProfile() {
            return profile;
        }
    }

    @Autowired
    public MonitoringScheduler(
            SamplingCycle cycle,
            ProfileRepository profileRepository,
            @Value("${pgpulse.monitoring.interval-sec:60}") long intervalSec,
            @Value("${pgpulse.monitoring.resume-delay-ms:1000}") long resumeDelayMs
    ) {
        this(cycle, profileRepository, Duration.ofSeconds(intervalSec), Duration.ofMillis(resumeDelayMs));
    }

    public MonitoringScheduler(
            SamplingCycle cycle,
            ProfileRepository profileRepository,
            Duration interval,
            Duration resumeDelay
    ) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("monitoring interval must be positive: " + interval);
        }
        this.cycle = Objects.requireNonNull(cycle, "cycle");
        this.profileRepository = Objects.requireNonNull(profileRepository, "profileRepository");
        this.interval = interval;
        this.resumeDelay = resumeDelay;
        this.lane = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pgpulse-sampler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts monitoring {@code profile}, replacing any active schedule. Persists the profile, runs
     * one cycle and waits for it, then repeats the cycle every interval.
     *
     * @param profile target database
     * @throws IllegalArgumentException if the profile is incomplete
     * @throws UncheckedIOException if the profile cannot be persisted; the previous state is kept
     */
    public void start(ConnectionProfile profile) {
        Objects.requireNonNull(profile, "profile").validate();

        Future<?> firstCycle;
        synchronized (lifecycleLock) {
            // A failed save leaves the current schedule and its persisted profile in place.
            profileRepository.save(profile);
            boolean replaced = disarmLocked();
            long gen = generation.incrementAndGet();
            activeProfile = profile;
            firstCycle = lane.submit(() -> runIfCurrent(gen, profile));
            scheduledTask = lane.scheduleWithFixedDelay(
                    () -> runIfCurrent(gen, profile),
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS);
            log.info("Monitoring started: profile={}, interval_sec={}, replaced_previous={}",
                    profile, interval.toSeconds(), replaced);
        }

        awaitQuietly(firstCycle);
    }

    /**
     * Stops monitoring and forgets the persisted profile. A cycle already running is allowed to
     * finish. Calling it while stopped does nothing.
     */
    public void stop() {
        boolean wasRunning;
        synchronized (lifecycleLock) {
            wasRunning = disarmLocked();
            profileRepository.delete();
        }
        if (wasRunning) {
            log.info("Monitoring stopped");
        }
    }

    public Status status() {
        ConnectionProfile profile = activeProfile;
        return new Status(profile != null, ConnectionProfileView.of(profile));
    }

    public boolean isRunning() {
        return activeProfile != null;
    }

    /**
     * Resumes monitoring of a persisted profile after a process restart. Does nothing when no profile
     * is stored or monitoring was started in the meantime. An unreadable config file is discarded.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnBoot() {
        Optional<ConnectionProfile> stored;
        try {
            stored = profileRepository.load();
        } catch (UncheckedIOException e) {
            log.error("Discarding unreadable monitoring config: path={}", profileRepository.getConfigFile(), e);
            profileRepository.delete();
            return;
        }

        if (stored.isEmpty()) {
            log.debug("No persisted monitoring config found");
            return;
        }

        ConnectionProfile profile = stored.get();
        try {
            profile.validate();
        } catch (IllegalArgumentException e) {
            log.warn("Discarding invalid monitoring config: reason={}", e.getMessage());
            profileRepository.delete();
            return;
        }

        log.info("Restoring monitoring in {} ms: profile={}", resumeDelay.toMillis(), profile);
        lane.schedule(() -> resume(profile), resumeDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lifecycleLock) {
            // The persisted profile stays so that the next process resumes monitoring.
            disarmLocked();
        }
        lane.shutdown();
        try {
            if (!lane.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sampling lane did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for sampling lane to terminate");
        }
    }

    // Runs on the lane.
    private void resume(ConnectionProfile profile) {
        long gen;
        synchronized (lifecycleLock) {
            if (activeProfile != null) {
                log.debug("Monitoring already active, skipping restore");
                return;
            }
            if (!profileRepository.exists()) {
                log.debug("Monitoring config removed before restore, skipping");
                return;
            }
            gen = generation.incrementAndGet();
            activeProfile = profile;
            scheduledTask = lane.scheduleWithFixedDelay(
                    () -> runIfCurrent(gen, profile),
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS);
        }
        runIfCurrent(gen, profile);
    }

    private void runIfCurrent(long gen, ConnectionProfile profile) {
        if (generation.get() != gen) {
            return;
        }
        try {
            cycle.run(profile);
        } catch (Exception e) {
            // An exception escaping here would cancel the repeating task.
            log.error("Unexpected error in monitoring cycle: database={}", profile.getDatabase(), e);
        }
    }

    private boolean disarmLocked() {
        generation.incrementAndGet();
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        boolean wasRunning = activeProfile != null;
        activeProfile = null;
        return wasRunning;
    }

    private void awaitQuietly(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the first monitoring cycle");
        } catch (ExecutionException e) {
            log.error("First monitoring cycle failed", e.getCause());
        }
    }
}
