package org.sharehub.thumbnails.dto.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Webhook body posted by CloudConvert when a job changes state.
 *
 * @see <a href="https://cloudconvert.com/api/v2/webhooks">CloudConvert Webhooks</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CloudConvertWebhookPayload(
        String event,
        Job job,
        @JsonProperty("slide_id") String slideId,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("output_filename") String outputFilename
) {

    public static final String JOB_FINISHED = "job.finished";
    public static final String JOB_FAILED = "job.failed";

    static final String EXPORT_URL = "export/url";
    static final String FINISHED = "finished";
    static final String ERROR = "error";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Job(String id, String status, String tag, List<Task> tasks) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Task(String id, String name, String operation, String status, String message, Result result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(List<File> files) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record File(String filename, String url) {
    }

    public boolean isSuccess() {
        return JOB_FINISHED.equals(event) && job != null && FINISHED.equals(job.status());
    }

    public boolean isFailure() {
        return JOB_FAILED.equals(event) || (job != null && ERROR.equals(job.status()));
    }

    /**
     * URL of the first file produced by the first finished export task.
     */
    public Optional<String> exportUrl() {
        if (job == null || job.tasks() == null) {
            return Optional.empty();
        }
        return job.tasks().stream()
                .filter(task -> EXPORT_URL.equals(task.operation()) && FINISHED.equals(task.status()))
                .findFirst()
                .map(Task::result)
                .map(Result::files)
                .filter(files -> !files.isEmpty())
                .map(files -> files.get(0).url())
                .filter(url -> !url.isBlank());
    }

    /**
     * Message of the first errored task, if any.
     */
    public Optional<String> errorMessage() {
        if (job == null || job.tasks() == null) {
            return Optional.empty();
        }
        return job.tasks().stream()
                .filter(task -> ERROR.equals(task.status()) && task.message() != null)
                .map(Task::message)
                .findFirst();
    }
}
