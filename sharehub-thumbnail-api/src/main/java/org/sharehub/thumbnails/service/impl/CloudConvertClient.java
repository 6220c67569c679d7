package org.sharehub.thumbnails.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.ConversionProperties;
import org.sharehub.thumbnails.dto.request.ConversionRequest;
import org.sharehub.thumbnails.exception.ConversionSubmissionException;
import org.sharehub.thumbnails.service.ConversionClient;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CloudConvert REST API v2 implementation of ConversionClient.
 * A job chains four tasks: import the slide from its signed URL, convert the first page to JPEG,
 * export the result to a temporary URL and notify our webhook.
 *
 * @see <a href="https://cloudconvert.com/api/v2/jobs">CloudConvert Jobs API</a>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CloudConvertClient implements ConversionClient {

    static final String IMPORT_TASK = "import-slide";
    static final String CONVERT_TASK = "convert-to-thumbnail";
    static final String EXPORT_TASK = "export-thumbnail";
    static final String WEBHOOK_TASK = "webhook-notify";

    private static final String JOBS_PATH = "/v2/jobs";
    private static final int MAX_DOWNLOAD_SIZE = 20 * 1024 * 1024;

    private final ConversionProperties conversionProperties;
    private final WebClient.Builder webClientBuilder;

    private WebClient apiClient;
    private WebClient downloadClient;

    private WebClient getApiClient() {
        if (apiClient == null) {
            apiClient = webClientBuilder.clone()
                    .baseUrl(conversionProperties.getApiUrl())
                    .defaultHeader("Authorization", "Bearer " + conversionProperties.getApiKey())
                    .build();
        }
        return apiClient;
    }

    private WebClient getDownloadClient() {
        if (downloadClient == null) {
            downloadClient = webClientBuilder.clone()
                    .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_DOWNLOAD_SIZE))
                    .build();
        }
        return downloadClient;
    }

    @Override
    public Mono<String> submit(ConversionRequest request) {
        log.debug("Creating CloudConvert job for slide {} ({})", request.slideId(), request.inputFormat());
        // Job creation is not idempotent on the CloudConvert side, so it is never retried
        return getApiClient()
                .post()
                .uri(JOBS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildJobRequest(request))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(conversionProperties.getSubmitTimeoutSeconds()))
                .flatMap(response -> {
                    String jobId = response.path("data").path("id").asText(null);
                    if (jobId == null || jobId.isBlank()) {
                        return Mono.error(new ConversionSubmissionException("CloudConvert response carries no job id"));
                    }
                    return Mono.just(jobId);
                })
                .onErrorMap(e -> !(e instanceof ConversionSubmissionException),
                        e -> new ConversionSubmissionException("CloudConvert job creation failed: " + describe(e), e))
                .doOnNext(jobId -> log.info("CloudConvert job {} created for slide {}", jobId, request.slideId()));
    }

    @Override
    public Mono<byte[]> downloadResult(String url) {
        return getDownloadClient()
                .get()
                .uri(url)
                .retrieve()
                .bodyToMono(byte[].class)
                .timeout(Duration.ofSeconds(conversionProperties.getDownloadTimeoutSeconds()))
                .retryWhen(Retry.backoff(conversionProperties.getDownloadRetries(), Duration.ofSeconds(1))
                        .doBeforeRetry(signal -> log.warn("Retrying thumbnail download, attempt {}: {}",
                                signal.totalRetries() + 1, signal.failure().getMessage())))
                .switchIfEmpty(Mono.error(new IllegalStateException("Empty thumbnail download from " + url)));
    }

    Map<String, Object> buildJobRequest(ConversionRequest request) {
        ConversionProperties.Output output = conversionProperties.getOutput();

        Map<String, Object> importTask = new LinkedHashMap<>();
        importTask.put("operation", "import/url");
        importTask.put("url", request.sourceUrl());
        importTask.put("filename", "input." + request.inputFormat().getExtension());

        Map<String, Object> convertTask = new LinkedHashMap<>();
        convertTask.put("operation", "convert");
        convertTask.put("input", IMPORT_TASK);
        convertTask.put("input_format", request.inputFormat().getExtension());
        convertTask.put("output_format", "jpg");
        convertTask.put("engine", request.inputFormat().getEngine());
        convertTask.put("pages", "1");
        convertTask.put("quality", output.getQuality());
        convertTask.put("fit", "max");
        convertTask.put("width", output.getWidth());
        convertTask.put("height", output.getHeight());

        Map<String, Object> exportTask = new LinkedHashMap<>();
        exportTask.put("operation", "export/url");
        exportTask.put("input", CONVERT_TASK);
        exportTask.put("inline", false);
        exportTask.put("archive_multiple_files", false);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("slide_id", request.slideId().toString());
        payload.put("tenant_id", request.tenantId().toString());
        payload.put("output_filename", request.outputFilename());

        Map<String, Object> webhookTask = new LinkedHashMap<>();
        webhookTask.put("operation", "webhook");
        webhookTask.put("url", request.callbackUrl());
        webhookTask.put("input", List.of(EXPORT_TASK));
        webhookTask.put("payload", payload);

        Map<String, Object> tasks = new LinkedHashMap<>();
        tasks.put(IMPORT_TASK, importTask);
        tasks.put(CONVERT_TASK, convertTask);
        tasks.put(EXPORT_TASK, exportTask);
        tasks.put(WEBHOOK_TASK, webhookTask);

        Map<String, Object> job = new LinkedHashMap<>();
        job.put("tasks", tasks);
        job.put("webhook_url", request.callbackUrl());
        job.put("tag", "thumbnail-" + request.slideId());
        return job;
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().value() + " " + responseException.getResponseBodyAsString();
        }
        return e.getMessage();
    }
}
