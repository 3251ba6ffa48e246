package com.example.prr.inference;

import com.example.prr.config.PrrProperties;
import com.example.prr.model.PipelineStage;
import com.example.prr.model.UploadedArtifact;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeTypeUtils;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gateway backed by Spring AI chat clients, with lenient JSON parsing.
 * <p>
 * Solves common LLM response issues:
 * <ul>
 *   <li>Trailing commas ({@code [{"a":1},]})</li>
 *   <li>Java-style comments in JSON</li>
 *   <li>Single quotes instead of double quotes</li>
 *   <li>Unexpected fields (ignoreUnknown)</li>
 * </ul>
 * Each call runs on the inference executor and is abandoned after the configured timeout.
 * Retries are not done here: the caller owns the retry policy.
 */
@Service
@ConditionalOnProperty(prefix = "prr.inference", name = "mode", havingValue = "model", matchIfMissing = true)
public class SpringAiInferenceGateway implements InferenceGateway {

    private static final Logger log = LoggerFactory.getLogger(SpringAiInferenceGateway.class);

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ChatClient analysisChatClient;  // OpenAI, vision-capable
    private final ChatClient reportChatClient;    // Anthropic
    private final ExecutorService inferenceExecutor;
    private final Duration timeout;

    public SpringAiInferenceGateway(@Qualifier("analysisChatClient") ChatClient analysisChatClient,
                                    @Qualifier("reportChatClient") ChatClient reportChatClient,
                                    @Qualifier("inferenceExecutor") ExecutorService inferenceExecutor,
                                    PrrProperties properties) {
        this.analysisChatClient = analysisChatClient;
        this.reportChatClient = reportChatClient;
        this.inferenceExecutor = inferenceExecutor;
        this.timeout = properties.inference().timeout();
    }

    @Override
    public <T> InferenceResult<T> infer(InferenceRequest request, Class<T> outputType) {
        var converter = new BeanOutputConverter<>(outputType, LENIENT_MAPPER);
        // Append format instructions the same way Spring AI does internally
        String fullUserPrompt = request.userPrompt() + "\n\n" + converter.getFormat();
        String label = request.stage() + "/" + request.schema();

        Future<String> call = inferenceExecutor.submit(() -> callModel(request, fullUserPrompt, label));
        String content;
        try {
            content = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("{}: no answer within {}s", label, timeout.toSeconds());
            return InferenceResult.failure(InferenceFailure.TIMED_OUT,
                    "No answer within %d seconds".formatted(timeout.toSeconds()));
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return InferenceResult.failure(InferenceFailure.UNAVAILABLE, "Interrupted while waiting for the model");
        } catch (ExecutionException e) {
            log.warn("{}: provider call failed ({})", label, rootCauseMessage(e));
            return InferenceResult.failure(InferenceFailure.UNAVAILABLE, rootCauseMessage(e));
        }

        if (content == null || content.isBlank()) {
            return InferenceResult.failure(InferenceFailure.MALFORMED, "Empty or null content in LLM response");
        }
        try {
            return InferenceResult.success(converter.convert(content));
        } catch (RuntimeException e) {
            log.warn("{}: response could not be parsed ({})", label, rootCauseMessage(e));
            return InferenceResult.failure(InferenceFailure.MALFORMED,
                    "Response is not valid JSON for the requested schema: " + rootCauseMessage(e));
        }
    }

    private String callModel(InferenceRequest request, String userPrompt, String label) {
        ChatClient client = request.stage() == PipelineStage.SYNTHESIS ? reportChatClient : analysisChatClient;
        UploadedArtifact attachment = request.attachment();

        ChatResponse chatResponse = client.prompt()
                .system(request.systemPrompt())
                .user(u -> {
                    u.text(userPrompt);
                    if (attachment != null) {
                        u.media(MimeTypeUtils.parseMimeType(attachment.mimeType()),
                                new ByteArrayResource(attachment.bytes()));
                    }
                })
                .call()
                .chatResponse();

        logTokenUsage(chatResponse, label);
        return (chatResponse != null && chatResponse.getResult() != null)
                ? chatResponse.getResult().getOutput().getText()
                : null;
    }

    private static void logTokenUsage(ChatResponse chatResponse, String label) {
        if (chatResponse == null || chatResponse.getMetadata() == null) return;
        var metadata = chatResponse.getMetadata();
        var usage = metadata.getUsage();
        if (usage == null || usage.getTotalTokens() == null) return;
        log.debug("{}: {} tokens (model={})", label, usage.getTotalTokens(), metadata.getModel());
    }

    static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
