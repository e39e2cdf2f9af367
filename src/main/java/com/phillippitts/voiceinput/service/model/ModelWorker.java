package com.phillippitts.voiceinput.service.model;

import com.phillippitts.voiceinput.config.model.ModelProperties;
import com.phillippitts.voiceinput.domain.DownloadState;
import com.phillippitts.voiceinput.domain.ModelDescriptor;
import com.phillippitts.voiceinput.domain.command.ModelCommand;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.exception.ModelDownloadException;
import com.phillippitts.voiceinput.service.channel.CommandChannel;
import com.phillippitts.voiceinput.service.channel.EventChannel;
import com.phillippitts.voiceinput.service.metrics.DictationMetrics;
import com.phillippitts.voiceinput.service.worker.AbstractWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Makes sure a model family resolves to local artifact files before transcription uses it.
 *
 * <p>{@code Load} emits {@code ModelLoaded} right away when every artifact is present and
 * downloads the missing ones otherwise, reporting {@code ModelDownloadProgress} on the way.
 * {@code Download} fetches even when present. Network failures are retried with exponential
 * backoff; running out of attempts or a permanent failure reports
 * {@code ModelLoadingFailed{retryable:false}}.
 *
 * <p>The command channel is checked between download chunks and during backoff. A load for
 * the family already in flight is coalesced, loads for other families are queued behind it,
 * and {@code Cancel} abandons the in-flight download without emitting anything. Commands
 * are absorbed in arrival order, so a load that follows a cancel of the same family keeps
 * the download going.
 */
public class ModelWorker extends AbstractWorker<ModelCommand> {

    private static final Logger LOG = LogManager.getLogger(ModelWorker.class);

    public static final String COMPONENT = "model-worker";

    private final ArtifactStore store;
    private final ModelProperties props;
    private final DictationMetrics metrics;

    // Confined to the worker thread
    private final Deque<ModelCommand> pending = new ArrayDeque<>();
    private final Map<String, ModelDescriptor> descriptors = new HashMap<>();

    public ModelWorker(CommandChannel<ModelCommand> commands,
                       EventChannel events,
                       ArtifactStore store,
                       ModelProperties props,
                       DictationMetrics metrics) {
        super(COMPONENT, commands, events);
        this.store = Objects.requireNonNull(store, "store");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    protected ModelCommand nextCommand() throws InterruptedException {
        ModelCommand queued = pending.poll();
        return queued != null ? queued : commands().take();
    }

    @Override
    protected boolean handle(ModelCommand command) {
        if (command instanceof ModelCommand.Load load) {
            return load(ModelCatalog.normalize(load.name()), false);
        }
        if (command instanceof ModelCommand.Download download) {
            return load(ModelCatalog.normalize(download.name()), true);
        }
        if (command instanceof ModelCommand.Cancel cancel) {
            LOG.debug("Cancel for '{}' with nothing in flight", cancel.name());
            return true;
        }
        if (command instanceof ModelCommand.Shutdown) {
            LOG.info("Shutdown received");
            return false;
        }
        LOG.warn("Unknown command {}", command);
        return true;
    }

    /** @return false when a shutdown arrived during the load */
    private boolean load(String family, boolean force) {
        Job job = new Job(family);
        List<String> artifacts = ModelCatalog.artifactsFor(family);
        try {
            for (int i = 0; i < artifacts.size(); i++) {
                ensure(job, artifacts.get(i), i, artifacts.size(), force);
            }
            LOG.info("Model '{}' ready: {}", family, describe(artifacts));
            emit(new AppEvent.ModelLoaded(family));
        } catch (CancellationException e) {
            metrics.recordModelDownload("cancelled");
            LOG.info("Load of '{}' abandoned ({})", family, job.shutdown ? "shutdown" : "cancelled");
        } catch (ModelDownloadException e) {
            LOG.warn("Load of '{}' failed: {}", family, e.getMessage());
            emit(new AppEvent.ModelLoadingFailed(family, e.getMessage(), false));
        } catch (IOException e) {
            LOG.warn("Load of '{}' failed writing to {}: {}", family, props.getModelsDir(), e.toString());
            emit(new AppEvent.ModelLoadingFailed(family, "cannot write model files: " + e.getMessage(), true));
        } catch (RuntimeException e) {
            LOG.error("Load of '{}' failed unexpectedly", family, e);
            emit(new AppEvent.ModelLoadingFailed(family, e.getClass().getSimpleName() + ": " + e.getMessage(), true));
        }
        return !job.shutdown;
    }

    private void ensure(Job job, String artifact, int index, int count, boolean force) throws IOException {
        if (!force && store.exists(artifact)) {
            descriptors.put(artifact, new ModelDescriptor(artifact, store.localPath(artifact),
                    sizeOf(artifact), DownloadState.PRESENT));
            return;
        }
        descriptors.put(artifact, new ModelDescriptor(artifact, store.localPath(artifact), 0, DownloadState.DOWNLOADING));
        ArtifactStore.ProgressListener listener = (done, total) -> {
            absorb(job);
            job.throwIfStopped();
            int filePercent = total > 0 ? (int) Math.min(100, done * 100 / total) : 0;
            int overall = (index * 100 + filePercent) / count;
            if (overall != job.lastPercent) {
                job.lastPercent = overall;
                emit(new AppEvent.ModelDownloadProgress(job.family, overall));
            }
        };
        fetchWithRetry(job, artifact, listener);
    }

    private void fetchWithRetry(Job job, String artifact, ArtifactStore.ProgressListener listener) throws IOException {
        int maxAttempts = props.getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                store.fetch(artifact, listener);
                descriptors.put(artifact, descriptors.get(artifact).withState(DownloadState.PRESENT, sizeOf(artifact)));
                metrics.recordModelDownload("downloaded");
                return;
            } catch (ModelDownloadException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    descriptors.put(artifact, descriptors.get(artifact).withState(DownloadState.FAILED, 0));
                    metrics.recordModelDownload("failed");
                    if (!e.isRetryable()) {
                        throw e;
                    }
                    throw new ModelDownloadException(artifact, "Download of " + artifact + " failed after "
                            + attempt + " attempts: " + e.getMessage(), false, e);
                }
                long backoffMs = props.getInitialBackoffMs() << (attempt - 1);
                LOG.warn("Attempt {}/{} for {} failed ({}); retrying in {}ms",
                        attempt, maxAttempts, artifact, e.getMessage(), backoffMs);
                waitBackoff(job, backoffMs);
            }
        }
    }

    /** Sleeps on the command channel so a cancel or shutdown cuts the wait short. */
    private void waitBackoff(Job job, long backoffMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(backoffMs);
        try {
            long remaining;
            while ((remaining = deadline - System.nanoTime()) > 0) {
                ModelCommand command = commands().poll(remaining, TimeUnit.NANOSECONDS);
                if (command != null) {
                    absorb(job, command);
                    job.throwIfStopped();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.shutdown = true;
            throw new CancellationException("interrupted during backoff");
        }
    }

    private void absorb(Job job) {
        ModelCommand command;
        while ((command = commands().poll()) != null) {
            absorb(job, command);
        }
    }

    private void absorb(Job job, ModelCommand command) {
        if (command instanceof ModelCommand.Load load) {
            coalesceOrQueue(job, load.name(), command);
        } else if (command instanceof ModelCommand.Download download) {
            coalesceOrQueue(job, download.name(), command);
        } else if (command instanceof ModelCommand.Cancel cancel) {
            String name = ModelCatalog.normalize(cancel.name());
            if (name.equals(job.family)) {
                job.cancelled = true;
            } else if (pending.removeIf(queued -> name.equals(familyOf(queued)))) {
                LOG.info("Dropped queued load of '{}'", name);
            }
        } else if (command instanceof ModelCommand.Shutdown) {
            job.shutdown = true;
        }
    }

    private void coalesceOrQueue(Job job, String name, ModelCommand command) {
        String family = ModelCatalog.normalize(name);
        if (family.equals(job.family)) {
            if (job.cancelled) {
                // A request after the cancel revives the in-flight load
                job.cancelled = false;
                LOG.info("Load of '{}' requested again after cancel; resuming", family);
            } else {
                LOG.debug("Coalesced {} into the in-flight load", command);
            }
            return;
        }
        if (pending.stream().noneMatch(queued -> family.equals(familyOf(queued)))) {
            pending.add(command);
            LOG.info("Queued load of '{}' behind '{}'", family, job.family);
        }
    }

    private static String familyOf(ModelCommand command) {
        if (command instanceof ModelCommand.Load load) {
            return ModelCatalog.normalize(load.name());
        }
        if (command instanceof ModelCommand.Download download) {
            return ModelCatalog.normalize(download.name());
        }
        return null;
    }

    private long sizeOf(String artifact) {
        try {
            return Files.size(store.localPath(artifact));
        } catch (IOException e) {
            return 0L;
        }
    }

    private String describe(List<String> artifacts) {
        return artifacts.stream()
                .map(a -> {
                    ModelDescriptor d = descriptors.get(a);
                    return a + "=" + (d == null ? "?" : (d.byteSize() / (1024 * 1024)) + "MB");
                })
                .collect(Collectors.joining(", "));
    }

    /** Bookkeeping for the load currently in flight. */
    private static final class Job {
        final String family;
        boolean cancelled;
        boolean shutdown;
        int lastPercent = -1;

        Job(String family) {
            this.family = family;
        }

        void throwIfStopped() {
            if (cancelled || shutdown) {
                throw new CancellationException(family);
            }
        }
    }
}
