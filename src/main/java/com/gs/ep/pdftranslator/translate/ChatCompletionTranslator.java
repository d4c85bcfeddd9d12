package com.gs.ep.pdftranslator.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gs.ep.pdftranslator.config.TranslationConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI 兼容的 chat completions 翻译器（SiliconFlow、OpenAI）。
 * 每次请求翻译一段文本；章节编号会被保留，模型多余的解释性文字会被去掉。
 */
public class ChatCompletionTranslator implements Translator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatCompletionTranslator.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Pattern SECTION_NUMBER = Pattern.compile("^(\\d+(?:\\.\\d+)*\\.?\\s*)");
    static final String TEXT_PLACEHOLDER = "${text}";

    private final String name;
    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final String sourceLanguage;
    private final String targetLanguage;
    private final String promptTemplate;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ChatCompletionTranslator(TranslationConfig config, TranslationServiceId serviceId) throws IOException {
        this(serviceId.getServiceName(), config.getApiUrl(), config.getApiKey(), config.getModelName(),
                config.getSourceLanguage(), config.getTargetLanguage(), loadPrompt(config.getPromptFile()),
                new OkHttpClient.Builder()
                        .connectTimeout(60, TimeUnit.SECONDS)
                        .readTimeout(60, TimeUnit.SECONDS)
                        .writeTimeout(60, TimeUnit.SECONDS)
                        .build());
    }

    public ChatCompletionTranslator(String name, String apiUrl, String apiKey, String model, String sourceLanguage,
            String targetLanguage, String promptTemplate, OkHttpClient httpClient) {
        this.name = name;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.sourceLanguage = sourceLanguage;
        this.targetLanguage = targetLanguage;
        this.promptTemplate = promptTemplate == null || promptTemplate.trim().isEmpty() ? null : promptTemplate;
        this.httpClient = httpClient;
    }

    private static String loadPrompt(String promptFile) throws IOException {
        if (promptFile == null || promptFile.trim().isEmpty()) {
            return null;
        }
        LOGGER.info("Using custom prompt template from {}", promptFile);
        return new String(Files.readAllBytes(Paths.get(promptFile.trim())), StandardCharsets.UTF_8);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Map<String, Object> getCacheParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("lang_in", sourceLanguage);
        params.put("lang_out", targetLanguage);
        params.put("model", model);
        if (promptTemplate != null) {
            params.put("prompt", promptTemplate);
        }
        return params;
    }

    @Override
    public TranslationResult translate(String text) {
        ObjectNode requestBody = createBaseRequest();
        ArrayNode messages = requestBody.putArray("messages");
        if (promptTemplate != null) {
            messages.addObject().put("role", "user").put("content", promptTemplate.replace(TEXT_PLACEHOLDER, text));
        } else {
            String systemPrompt = "You are a professional translation engine for technical/official documents. "
                    + "Return ONLY the translated text. NO explanation. NO introductory text. NO quotes. "
                    + "CRITICAL: Preserve ALL section numbers (e.g., 1., 1.1., 6.1.2.), list markers (e.g., (a), (b), (1)), "
                    + "and reference markers EXACTLY as they appear at the start of text.";
            messages.addObject().put("role", "system").put("content", systemPrompt);
            messages.addObject().put("role", "user").put("content",
                    "Translate from " + sourceLanguage + " into " + targetLanguage + ":\n" + text);
        }

        String content;
        try {
            content = callApi(requestBody);
        } catch (ApiStatusException e) {
            if (e.code == 429 || e.code >= 500) {
                return TranslationResult.retryable(e.getMessage());
            }
            return TranslationResult.fatal(e.getMessage());
        } catch (IOException e) {
            LOGGER.warn("{} request failed: {}", name, e.getMessage());
            return TranslationResult.retryable("Request failed: " + e.getMessage());
        }

        String result = normalize(stripConversationalFiller(content));
        if (result == null || result.isEmpty()) {
            return TranslationResult.fatal("Empty translation returned by " + name);
        }
        return TranslationResult.success(preserveSectionNumber(text, result));
    }

    /**
     * 如果原文以章节编号开头而译文丢失了编号，则补回。
     */
    static String preserveSectionNumber(String source, String translated) {
        if (source == null || translated == null) {
            return translated;
        }
        Matcher sourceMatcher = SECTION_NUMBER.matcher(source.trim());
        if (sourceMatcher.find()) {
            String sectionNumber = sourceMatcher.group(1);
            if (!translated.trim().startsWith(sectionNumber.trim())) {
                return sectionNumber + translated.trim();
            }
        }
        return translated;
    }

    /**
     * Strips common conversational filler if the LLM ignores the "NO explanation"
     * instruction.
     */
    static String stripConversationalFiller(String text) {
        if (text == null) {
            return null;
        }
        String t = text.trim();
        if (t.length() > 2 && ((t.startsWith("\"") && t.endsWith("\"")) || (t.startsWith("“") && t.endsWith("”")))) {
            t = t.substring(1, t.length() - 1);
        }
        String[] prefixes = { "Translation:", "Result:", "Translated text:", "中文翻译是：", "翻译结果：", "翻译为：" };
        for (String p : prefixes) {
            if (t.toLowerCase().startsWith(p.toLowerCase())) {
                t = t.substring(p.length()).trim();
            }
        }
        // "X 的中文翻译是“Y”": keep only the quoted part
        if (t.contains("翻译是")) {
            int quoteStart = t.indexOf("“");
            int quoteEnd = t.indexOf("”", quoteStart + 1);
            if (quoteStart != -1 && quoteEnd != -1) {
                return t.substring(quoteStart + 1, quoteEnd);
            }
            quoteStart = t.indexOf("\"");
            quoteEnd = t.indexOf("\"", quoteStart + 1);
            if (quoteStart != -1 && quoteEnd != -1) {
                return t.substring(quoteStart + 1, quoteEnd);
            }
        }
        return t.trim();
    }

    private ObjectNode createBaseRequest() {
        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("model", model);
        requestBody.put("temperature", 0.0);
        return requestBody;
    }

    private String callApi(ObjectNode requestBody) throws IOException {
        Request request = new Request.Builder()
                .url(apiUrl)
                .addHeader("Authorization", "Bearer " + apiKey)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(objectMapper.writeValueAsString(requestBody), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new ApiStatusException(response.code(), "API error " + response.code() + ": " + payload);
            }
            JsonNode root = objectMapper.readTree(payload);
            String content = root.path("choices").path(0).path("message").path("content").asText().trim();
            LOGGER.debug("--- Model Response ---\n{}", content);
            return content;
        }
    }

    private static String normalize(String text) {
        if (text == null) {
            return null;
        }
        return text.replaceAll("\\r", "").trim();
    }

    private static final class ApiStatusException extends IOException {
        private final int code;

        ApiStatusException(int code, String message) {
            super(message);
            this.code = code;
        }
    }
}
