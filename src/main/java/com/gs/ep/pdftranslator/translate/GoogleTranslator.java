package com.gs.ep.pdftranslator.translate;

import com.gs.ep.pdftranslator.config.TranslationConfig;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translator backed by the Google Translate mobile web page. No API key; the
 * result is scraped from the returned HTML.
 */
public class GoogleTranslator implements Translator {
    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTranslator.class);

    public static final String DEFAULT_ENDPOINT = "https://translate.google.com/m";
    public static final int MAX_TEXT_LENGTH = 5000;

    private static final String USER_AGENT = "Mozilla/4.0 (compatible;MSIE 6.0;Windows NT 5.1;SV1;"
            + ".NET CLR 1.1.4322;.NET CLR 2.0.50727;.NET CLR 3.0.04506.30)";
    private static final Pattern RESULT_PATTERN = Pattern.compile("(?s)class=\"(?:t0|result-container)\">(.*?)<");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(?:([0-9]+)|[xX]([0-9a-fA-F]+));");

    private final HttpUrl endpoint;
    private final String sourceLanguage;
    private final String targetLanguage;
    private final OkHttpClient httpClient;

    public GoogleTranslator(TranslationConfig config) {
        this(DEFAULT_ENDPOINT, config.getSourceLanguage(), config.getTargetLanguage(),
                new OkHttpClient.Builder()
                        .connectTimeout(30, TimeUnit.SECONDS)
                        .readTimeout(30, TimeUnit.SECONDS)
                        .build());
    }

    public GoogleTranslator(String endpoint, String sourceLanguage, String targetLanguage, OkHttpClient httpClient) {
        HttpUrl url = HttpUrl.parse(endpoint);
        if (url == null) {
            throw new IllegalArgumentException("Invalid Google Translate endpoint: " + endpoint);
        }
        this.endpoint = url;
        this.sourceLanguage = mapLanguage(sourceLanguage);
        this.targetLanguage = mapLanguage(targetLanguage);
        this.httpClient = httpClient;
    }

    static String mapLanguage(String language) {
        return "zh".equalsIgnoreCase(language) ? "zh-CN" : language;
    }

    @Override
    public String getName() {
        return TranslationServiceId.GOOGLE.getServiceName();
    }

    @Override
    public Map<String, Object> getCacheParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("lang_in", sourceLanguage);
        params.put("lang_out", targetLanguage);
        return params;
    }

    @Override
    public TranslationResult translate(String text) {
        if (text.length() > MAX_TEXT_LENGTH) {
            LOGGER.error("Text length ({}) exceeds limit ({})", text.length(), MAX_TEXT_LENGTH);
            return TranslationResult.fatal("Text too long for Google Translate (max " + MAX_TEXT_LENGTH + " chars)");
        }
        HttpUrl url = endpoint.newBuilder()
                .addQueryParameter("tl", targetLanguage)
                .addQueryParameter("sl", sourceLanguage)
                .addQueryParameter("q", text)
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .get()
                .build();

        LOGGER.debug("Sending Google translation request for: {}", abbreviate(text));
        try (Response response = httpClient.newCall(request).execute()) {
            int code = response.code();
            if (code == 429 || code >= 500) {
                return TranslationResult.retryable("Google Translate returned HTTP " + code);
            }
            if (!response.isSuccessful()) {
                return TranslationResult.fatal("Google Translate returned HTTP " + code);
            }
            ResponseBody body = response.body();
            String html = body != null ? body.string() : "";
            Matcher matcher = RESULT_PATTERN.matcher(html);
            if (!matcher.find()) {
                LOGGER.error("Failed to extract translation from Google response");
                return TranslationResult.fatal("Failed to extract translation result");
            }
            String translated = unescapeHtml(matcher.group(1)).trim();
            LOGGER.debug("Google translation result: {}", abbreviate(translated));
            return TranslationResult.success(translated);
        } catch (IOException e) {
            LOGGER.warn("Google translation request failed: {}", e.getMessage());
            return TranslationResult.retryable("Request failed: " + e.getMessage());
        }
    }

    static String unescapeHtml(String text) {
        Matcher matcher = NUMERIC_ENTITY.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String replacement;
            try {
                int codePoint = matcher.group(1) != null
                        ? Integer.parseInt(matcher.group(1))
                        : Integer.parseInt(matcher.group(2), 16);
                replacement = new String(Character.toChars(codePoint));
            } catch (IllegalArgumentException e) {
                // out of int range or not a code point: leave the entity as it came
                replacement = matcher.group();
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        // &amp; last so "&amp;lt;" stays "&lt;"
        return sb.toString()
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&");
    }

    private static String abbreviate(String text) {
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }
}
