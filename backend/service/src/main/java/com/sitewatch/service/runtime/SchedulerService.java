package com.sitewatch.service.runtime;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.CheckCompleted;
import com.sitewatch.core.events.CheckSkipped;
import com.sitewatch.core.events.CheckStarted;
import com.sitewatch.core.model.ScheduleParseException;
import com.sitewatch.core.model.ScheduleSpec;
import com.sitewatch.service.delivery.DeliveryReport;
import com.sitewatch.service.delivery.NotificationFanOut;
import com.sitewatch.service.registry.SiteDescriptor;
import com.sitewatch.service.store.Subscriber;
import com.sitewatch.service.store.SubscriptionStore;
import com.sitewatch.sites.api.CheckResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one job per registered site. A single timer thread fires triggers and only hands work to
 * the worker pool, so a slow site never delays another site's schedule. Each site has at most one
 * check in flight, also across a job replacement; a trigger that finds its site busy is dropped,
 * not queued. Plugin code runs on its own pool and the check timeout starts when it is invoked.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final SubscriptionStore subscriptions;
    private final NotificationFanOut fanOut;
    private final SiteContextFactory contextFactory;
    private final EventBus eventBus;
    private final Clock clock;
    private final SchedulerSettings settings;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService checkExecutor;
    private final ExecutorService pluginExecutor = Executors.newCachedThreadPool();
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> inFlightBySite = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public SchedulerService(
            SubscriptionStore subscriptions,
            NotificationFanOut fanOut,
            SiteContextFactory contextFactory,
            EventBus eventBus,
            Clock clock,
            SchedulerSettings settings
    ) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions is required");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut is required");
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.checkExecutor = Executors.newFixedThreadPool(settings.workerThreads());
    }

    /**
     * Creates the site's job, replacing and cancelling any previous job for the same id. A site
     * whose schedule cannot be parsed is kept but never triggers on its own.
     *
     * @return true when a trigger was scheduled
     */
    public boolean register(SiteDescriptor site) {
        Objects.requireNonNull(site, "site is required");
        synchronized (registrationLock) {
            if (shutdown.get()) {
                LOGGER.warning("Scheduler is shut down; not scheduling site " + site.id());
                return false;
            }
            Job job = new Job(site, inFlightBySite.computeIfAbsent(site.id(), id -> new AtomicBoolean()));
            Job previous = jobs.put(site.id(), job);
            if (previous != null) {
                previous.cancel();
                LOGGER.info("Replaced job for site " + site.id());
            }
            try {
                ScheduleSpec spec = ScheduleSpec.parse(site.schedule());
                if (spec instanceof ScheduleSpec.Interval interval) {
                    scheduleInterval(job, interval);
                } else {
                    job.cron = CronTrigger.of((ScheduleSpec.Cron) spec, settings.zone());
                    if (!scheduleNextCron(job, clock.instant())) {
                        return false;
                    }
                }
                LOGGER.info("Scheduled site " + site.id() + " (" + spec.expression() + ")");
                return true;
            } catch (ScheduleParseException e) {
                LOGGER.warning("Site " + site.id() + " stays unscheduled: " + e.getMessage());
                eventBus.publish(new AlertRaised(
                        clock.instant(),
                        AlertRaised.SCHEDULE,
                        "Unparsable schedule for site " + site.id() + ": " + e.getMessage(),
                        Map.of("site", site.id(), "schedule", site.schedule())
                ));
                return false;
            }
        }
    }

    /**
     * Cancels the site's trigger. A check already running finishes, but its result is discarded.
     */
    public boolean unregister(String siteId) {
        synchronized (registrationLock) {
            Job job = jobs.remove(siteId);
            if (job == null) {
                return false;
            }
            job.cancel();
            LOGGER.info("Cancelled job for site " + siteId);
            return true;
        }
    }

    /** Runs one trigger for the site, honouring the in-flight guard. */
    public CompletableFuture<CheckOutcome> onTrigger(String siteId) {
        Job job = jobs.get(siteId);
        if (job == null) {
            return CompletableFuture.completedFuture(CheckOutcome.of(CheckOutcome.Status.UNKNOWN_SITE));
        }
        return trigger(job);
    }

    /** Manual trigger for operators; answers immediately whether the run was started. */
    public RunResult runNow(String siteId) {
        Job job = jobs.get(siteId);
        if (job == null) {
            return RunResult.NOT_FOUND;
        }
        CompletableFuture<CheckOutcome> outcome = trigger(job);
        if (outcome.isDone() && outcome.join().status() == CheckOutcome.Status.DROPPED_IN_FLIGHT) {
            return RunResult.IN_PROGRESS;
        }
        LOGGER.info("Manual check started for site " + siteId);
        return RunResult.STARTED;
    }

    public Optional<Instant> nextRun(String siteId) {
        Job job = jobs.get(siteId);
        return job == null ? Optional.empty() : Optional.ofNullable(job.nextRun);
    }

    /** Ids of sites with a live trigger, in id order. Dormant sites are not listed. */
    public List<String> scheduledSites() {
        return jobs.values().stream()
                .filter(job -> job.future != null && !job.cancelled)
                .map(job -> job.site.id())
                .sorted()
                .toList();
    }

    public boolean isInFlight(String siteId) {
        AtomicBoolean inFlight = inFlightBySite.get(siteId);
        return inFlight != null && inFlight.get();
    }

    /**
     * Cancels every trigger, waits up to the shutdown grace for running checks, then abandons
     * them. Calling it again has no effect.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        synchronized (registrationLock) {
            jobs.values().forEach(Job::cancel);
            jobs.clear();
        }
        timerExecutor.shutdownNow();
        checkExecutor.shutdown();
        pluginExecutor.shutdown();
        long deadline = System.nanoTime() + settings.shutdownGrace().toNanos();
        try {
            awaitOrAbandon(checkExecutor, "Checks", deadline);
            awaitOrAbandon(pluginExecutor, "Site plugins", deadline);
        } catch (InterruptedException e) {
            checkExecutor.shutdownNow();
            pluginExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Scheduler stopped");
    }

    private void awaitOrAbandon(ExecutorService executor, String label, long deadlineNanos) throws InterruptedException {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        if (!executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
            List<Runnable> abandoned = executor.shutdownNow();
            LOGGER.warning(label + " still running after " + settings.shutdownGrace() + "; abandoning them ("
                    + abandoned.size() + " queued)");
        }
    }

    private void scheduleInterval(Job job, ScheduleSpec.Interval interval) {
        job.nextRun = clock.instant();
        job.future = timerExecutor.scheduleAtFixedRate(() -> {
            job.nextRun = clock.instant().plusSeconds(interval.seconds());
            fire(job);
        }, 0, interval.seconds(), TimeUnit.SECONDS);
    }

    /**
     * Cron jobs are one-shot timers re-armed on every fire, so each delay is computed against the
     * wall clock of that moment.
     */
    private boolean scheduleNextCron(Job job, Instant after) {
        Instant now = clock.instant();
        Instant reference = after.isAfter(now) ? after : now;
        Optional<Instant> next = job.cron.nextAfter(reference);
        if (next.isEmpty()) {
            job.nextRun = null;
            LOGGER.warning("Cron schedule " + job.cron.expression() + " of site " + job.site.id() + " never fires again");
            return false;
        }
        Instant fireAt = next.get();
        job.nextRun = fireAt;
        long delayMillis = Math.max(0, Duration.between(now, fireAt).toMillis());
        try {
            job.future = timerExecutor.schedule(() -> {
                if (job.cancelled) {
                    return;
                }
                scheduleNextCron(job, fireAt);
                fire(job);
            }, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Timer stopped; not re-arming site " + job.site.id());
            return false;
        }
        return true;
    }

    private void fire(Job job) {
        if (job.cancelled) {
            return;
        }
        trigger(job).whenComplete((outcome, error) -> {
            if (error != null) {
                LOGGER.log(Level.WARNING, "Trigger for site " + job.site.id() + " failed unexpectedly", error);
            }
        });
    }

    private CompletableFuture<CheckOutcome> trigger(Job job) {
        String siteId = job.site.id();
        if (!job.inFlight.compareAndSet(false, true)) {
            LOGGER.fine("Check for site " + siteId + " still running; dropping trigger");
            eventBus.publish(new CheckSkipped(clock.instant(), siteId, CheckSkipped.Reason.IN_FLIGHT));
            return CompletableFuture.completedFuture(CheckOutcome.of(CheckOutcome.Status.DROPPED_IN_FLIGHT));
        }
        CompletableFuture<CheckOutcome> outcome;
        try {
            outcome = CompletableFuture.supplyAsync(() -> job, checkExecutor).thenCompose(this::runCheck);
        } catch (RejectedExecutionException e) {
            job.inFlight.set(false);
            return CompletableFuture.completedFuture(CheckOutcome.of(CheckOutcome.Status.DISCARDED));
        }
        return outcome
                .exceptionally(error -> {
                    LOGGER.log(Level.WARNING, "Check pipeline for site " + siteId + " failed", error);
                    return CheckOutcome.of(CheckOutcome.Status.FAILED);
                })
                .whenComplete((result, error) -> job.inFlight.set(false));
    }

    private CompletableFuture<CheckOutcome> runCheck(Job job) {
        String siteId = job.site.id();
        if (!subscriptions.hasSubscribers(siteId)) {
            LOGGER.fine("Site " + siteId + " has no subscribers; skipping check");
            eventBus.publish(new CheckSkipped(clock.instant(), siteId, CheckSkipped.Reason.NO_SUBSCRIBERS));
            return CompletableFuture.completedFuture(CheckOutcome.of(CheckOutcome.Status.NO_SUBSCRIBERS));
        }
        Instant started = clock.instant();
        eventBus.publish(new CheckStarted(started, siteId));
        CompletableFuture<CheckResult> check;
        try {
            check = CompletableFuture.supplyAsync(() -> invoke(job), pluginExecutor).thenCompose(raw -> raw);
        } catch (RejectedExecutionException e) {
            check = CompletableFuture.failedFuture(e);
        }
        return check
                .orTimeout(settings.checkTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> error == null ? result : failureFor(error))
                .thenApplyAsync(result -> complete(job, result, started), checkExecutor);
    }

    /** Calls the plugin; a blocking plugin holds only a plugin thread, never a worker. */
    private CompletableFuture<CheckResult> invoke(Job job) {
        try {
            CompletableFuture<CheckResult> raw = job.site.site().checkUpdates(contextFactory.contextFor(job.site));
            return raw == null
                    ? CompletableFuture.completedFuture(CheckResult.failure("Site returned no result"))
                    : raw.copy();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CheckResult failureFor(Throwable error) {
        if (CheckResult.unwrap(error) instanceof TimeoutException) {
            return CheckResult.failure("Check timed out after " + settings.checkTimeout());
        }
        return CheckResult.failure(error);
    }

    private CheckOutcome complete(Job job, CheckResult result, Instant started) {
        String siteId = job.site.id();
        long durationMillis = Duration.between(started, clock.instant()).toMillis();
        CheckResult checked = result == null ? CheckResult.failure("Site returned no result") : result;
        if (job.cancelled) {
            LOGGER.info("Site " + siteId + " was unregistered during its check; discarding result");
            return CheckOutcome.of(CheckOutcome.Status.DISCARDED);
        }
        eventBus.publish(new CheckCompleted(clock.instant(), siteId, checked.success(), checked.messages().size(), durationMillis));
        if (!checked.success()) {
            LOGGER.warning("Check failed for site " + siteId + ": " + checked.error());
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    AlertRaised.CHECK,
                    "Check failed for site " + siteId + ": " + checked.error(),
                    Map.of("site", siteId)
            ));
            return CheckOutcome.of(CheckOutcome.Status.FAILED);
        }
        if (checked.messages().isEmpty()) {
            LOGGER.fine("No updates for site " + siteId);
            return new CheckOutcome(CheckOutcome.Status.COMPLETED, 0, 0);
        }
        List<Subscriber> recipients = subscriptions.getSubscribers(siteId);
        int delivered = 0;
        for (String message : checked.messages()) {
            if (job.cancelled || recipients.isEmpty()) {
                break;
            }
            DeliveryReport report = fanOut.deliver(siteId, message, recipients);
            delivered += report.sent();
        }
        LOGGER.info("Site " + siteId + ": " + checked.messages().size() + " update(s), " + delivered + " notification(s) sent");
        return new CheckOutcome(CheckOutcome.Status.COMPLETED, checked.messages().size(), delivered);
    }

    /** Outcome of a {@link #runNow(String)} request. */
    public enum RunResult {
        STARTED,
        IN_PROGRESS,
        NOT_FOUND
    }

    private static final class Job {
        private final SiteDescriptor site;
        private final AtomicBoolean inFlight;
        private volatile CronTrigger cron;
        private volatile ScheduledFuture<?> future;
        private volatile Instant nextRun;
        private volatile boolean cancelled;

        private Job(SiteDescriptor site, AtomicBoolean inFlight) {
            this.site = site;
            this.inFlight = inFlight;
        }

        private void cancel() {
            cancelled = true;
            nextRun = null;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
