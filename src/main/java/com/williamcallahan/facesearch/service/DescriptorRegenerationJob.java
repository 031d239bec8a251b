package com.williamcallahan.facesearch.service;

import com.google.common.collect.Lists;
import com.williamcallahan.facesearch.config.AppProperties;
import com.williamcallahan.facesearch.domain.CandidateEntity;
import com.williamcallahan.facesearch.domain.DescriptorRecord;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.RegenerationReport;
import com.williamcallahan.facesearch.domain.RegenerationScope;
import com.williamcallahan.facesearch.domain.RegistrationOutcome;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Re-extracts descriptors for the corpus in rate-limited batches.
 *
 * <p>Candidates of one batch run concurrently; batches run one after another with a fixed pause
 * between them and none after the last. A failing candidate never stops the run. Interrupting the
 * calling thread stops the run between batches and returns the partial report.</p>
 */
@Service
public class DescriptorRegenerationJob {
    private static final Logger log = LoggerFactory.getLogger(DescriptorRegenerationJob.class);

    private final ProviderRegistry providerRegistry;
    private final CandidateCorpus candidateCorpus;
    private final EmbeddingStore embeddingStore;
    private final DescriptorRegistrationService registrationService;
    private final PhotoUrlResolver photoUrlResolver;
    private final ExecutorService regenerationExecutor;
    private final BatchPause batchPause;
    private final int batchSize;
    private final Duration batchDelay;
    private final Duration candidateTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DescriptorRegenerationJob(
            ProviderRegistry providerRegistry,
            CandidateCorpus candidateCorpus,
            EmbeddingStore embeddingStore,
            DescriptorRegistrationService registrationService,
            PhotoUrlResolver photoUrlResolver,
            @Qualifier("faceRegenerationExecutor") ExecutorService regenerationExecutor,
            BatchPause batchPause,
            AppProperties appProperties) {
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "providerRegistry");
        this.candidateCorpus = Objects.requireNonNull(candidateCorpus, "candidateCorpus");
        this.embeddingStore = Objects.requireNonNull(embeddingStore, "embeddingStore");
        this.registrationService = Objects.requireNonNull(registrationService, "registrationService");
        this.photoUrlResolver = Objects.requireNonNull(photoUrlResolver, "photoUrlResolver");
        this.regenerationExecutor = Objects.requireNonNull(regenerationExecutor, "regenerationExecutor");
        this.batchPause = Objects.requireNonNull(batchPause, "batchPause");
        AppProperties.Regeneration regeneration = appProperties.getRegeneration();
        this.batchSize = regeneration.getBatchSize();
        this.batchDelay = regeneration.getBatchDelay();
        this.candidateTimeout = regeneration.getCandidateTimeout();
    }

    /**
     * Runs one regeneration pass.
     *
     * @param scope which entities to process
     * @return counts and one aggregated message per failure category
     * @throws FaceProviderUnavailableException when no provider is active
     * @throws RegenerationInProgressException when another run has not finished
     */
    public RegenerationReport run(RegenerationScope scope) {
        Objects.requireNonNull(scope, "scope");
        if (!running.compareAndSet(false, true)) {
            throw new RegenerationInProgressException("A descriptor regeneration run is already in progress");
        }
        try {
            ProviderConfig provider = providerRegistry
                    .getActive()
                    .orElseThrow(() -> new FaceProviderUnavailableException(
                            "No active face provider is configured; activate one before regenerating descriptors"));
            List<CandidateEntity> candidates = selectCandidates(scope, provider);
            if (candidates.isEmpty()) {
                log.info("[FACE-REGENERATION] Nothing to regenerate for scope {}", scope);
                return RegenerationReport.empty();
            }
            log.info("[FACE-REGENERATION] Regenerating {} descriptors ({}) with provider {} in batches of {}",
                    candidates.size(), scope, provider.id(), batchSize);
            return processInBatches(provider, candidates);
        } finally {
            running.set(false);
        }
    }

    /**
     * Returns true while a run is executing.
     */
    public boolean isRunning() {
        return running.get();
    }

    private List<CandidateEntity> selectCandidates(RegenerationScope scope, ProviderConfig provider) {
        List<CandidateEntity> candidates = candidateCorpus.findAllWithPhoto();
        if (scope == RegenerationScope.ALL || candidates.isEmpty()) {
            return candidates;
        }
        Map<String, DescriptorRecord> storedRecords =
                embeddingStore.findAll(candidates.stream().map(CandidateEntity::entityId).toList());
        return candidates.stream()
                .filter(candidate -> needsDescriptor(candidate, storedRecords.get(candidate.entityId()), provider))
                .toList();
    }

    private boolean needsDescriptor(CandidateEntity candidate, DescriptorRecord storedRecord, ProviderConfig provider) {
        if (storedRecord == null) {
            return true;
        }
        String currentPhotoUrl = photoUrlResolver.resolve(candidate.photoReference());
        return !storedRecord.isCurrentFor(provider.providerType(), currentPhotoUrl);
    }

    private RegenerationReport processInBatches(ProviderConfig provider, List<CandidateEntity> candidates) {
        RunTally tally = new RunTally();
        List<List<CandidateEntity>> batches = Lists.partition(candidates, batchSize);
        boolean interrupted = false;

        for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }
            List<CandidateEntity> batch = batches.get(batchIndex);
            log.debug("[FACE-REGENERATION] Batch {}/{} ({} candidates)", batchIndex + 1, batches.size(), batch.size());
            if (!processBatch(provider, batch, tally)) {
                interrupted = true;
                break;
            }
            if (batchIndex < batches.size() - 1) {
                try {
                    batchPause.pause(batchDelay);
                } catch (InterruptedException pauseInterrupted) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    break;
                }
            }
        }

        RegenerationReport report = tally.toReport(interrupted);
        log.info("[FACE-REGENERATION] Finished: total={}, success={}, failed={}, interrupted={}",
                report.total(), report.success(), report.failed(), report.interrupted());
        return report;
    }

    /**
     * Runs one batch and records every observed outcome.
     *
     * @return false when the calling thread was interrupted while waiting for the batch
     */
    private boolean processBatch(ProviderConfig provider, List<CandidateEntity> batch, RunTally tally) {
        List<Future<RegistrationOutcome>> pendingOutcomes = new ArrayList<>(batch.size());
        for (CandidateEntity candidate : batch) {
            pendingOutcomes.add(regenerationExecutor.submit(() -> registrationService.register(provider, candidate)));
        }
        for (int candidateIndex = 0; candidateIndex < pendingOutcomes.size(); candidateIndex++) {
            Future<RegistrationOutcome> pendingOutcome = pendingOutcomes.get(candidateIndex);
            String entityId = batch.get(candidateIndex).entityId();
            try {
                RegistrationOutcome outcome = pendingOutcome.get(candidateTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (outcome.isExtracted()) {
                    tally.recordSuccess();
                } else {
                    tally.recordFailure(outcome.failure().orElse(FailureCategory.UNEXPECTED));
                }
            } catch (TimeoutException timeout) {
                pendingOutcome.cancel(true);
                log.warn("[FACE-REGENERATION] Entity {} timed out after {}", entityId, candidateTimeout);
                tally.recordFailure(FailureCategory.TIMEOUT);
            } catch (ExecutionException failure) {
                Throwable cause = failure.getCause();
                FailureCategory category = cause instanceof DescriptorPersistenceException
                        ? FailureCategory.PERSISTENCE_ERROR
                        : FailureCategory.UNEXPECTED;
                log.error("[FACE-REGENERATION] Entity {} failed ({})", entityId, category, cause);
                tally.recordFailure(category);
            } catch (InterruptedException interruptedWait) {
                for (int remainingIndex = candidateIndex; remainingIndex < pendingOutcomes.size(); remainingIndex++) {
                    pendingOutcomes.get(remainingIndex).cancel(true);
                }
                Thread.currentThread().interrupt();
                log.warn("[FACE-REGENERATION] Interrupted while waiting for batch; {} candidates abandoned",
                        pendingOutcomes.size() - candidateIndex);
                return false;
            }
        }
        return true;
    }

    /**
     * Counts for one run. Only touched by the thread that called {@link #run}.
     */
    private static final class RunTally {
        private int success;
        private int failed;
        private final Map<FailureCategory, Integer> failuresByCategory = new EnumMap<>(FailureCategory.class);

        void recordSuccess() {
            success++;
        }

        void recordFailure(FailureCategory category) {
            failed++;
            failuresByCategory.merge(category, 1, Integer::sum);
        }

        RegenerationReport toReport(boolean interrupted) {
            List<String> errors = new ArrayList<>(failuresByCategory.size());
            failuresByCategory.forEach((category, count) ->
                    errors.add(category.advisory() + " (" + count + (count == 1 ? " photo" : " photos") + ")"));
            return new RegenerationReport(success + failed, success, failed, errors, interrupted);
        }
    }
}
