package com.phillippitts.denoisebatch.config.properties;

import com.phillippitts.denoisebatch.domain.SessionOptions;
import com.phillippitts.denoisebatch.service.batch.OutputPathResolver;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch sessions and the worker pool.
 *
 * <p>Session options here are the defaults for new sessions; a REST caller may override
 * them per session.
 */
@Component
@ConfigurationProperties(prefix = "batch")
@Validated
public class BatchProperties {

    /** Number of workers; 0 means one per available processor. */
    @Min(value = 0, message = "Parallelism must be 0 (auto) or positive")
    private int parallelism = 0;

    private boolean continueOnError = true;

    private boolean autoClearCompleted = false;

    @NotBlank(message = "Output pattern must not be blank")
    private String outputPattern = OutputPathResolver.DEFAULT_PATTERN;

    /** Replace existing outputs; when false a free {@code _N} suffix is chosen at enqueue time. */
    private boolean overwriteExisting = true;

    /** Usable space the output directory must have when a job is queued; 0 disables the check. */
    @Min(0)
    private long minFreeDiskMb = 100;

    @NotBlank
    private String threadNamePrefix = "denoise-worker-";

    /** How long shutdown waits for an active run after stopping it. */
    @Min(0)
    private int awaitTerminationSeconds = 30;

    public SessionOptions toSessionOptions() {
        int workers = parallelism > 0 ? parallelism : SessionOptions.defaultParallelism();
        return new SessionOptions(workers, continueOnError, autoClearCompleted);
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public void setContinueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
    }

    public boolean isAutoClearCompleted() {
        return autoClearCompleted;
    }

    public void setAutoClearCompleted(boolean autoClearCompleted) {
        this.autoClearCompleted = autoClearCompleted;
    }

    public long getMinFreeDiskMb() {
        return minFreeDiskMb;
    }

    public void setMinFreeDiskMb(long minFreeDiskMb) {
        this.minFreeDiskMb = minFreeDiskMb;
    }

    public String getOutputPattern() {
        return outputPattern;
    }

    public void setOutputPattern(String outputPattern) {
        this.outputPattern = outputPattern;
    }

    public boolean isOverwriteExisting() {
        return overwriteExisting;
    }

    public void setOverwriteExisting(boolean overwriteExisting) {
        this.overwriteExisting = overwriteExisting;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public int getAwaitTerminationSeconds() {
        return awaitTerminationSeconds;
    }

    public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
        this.awaitTerminationSeconds = awaitTerminationSeconds;
    }
}
