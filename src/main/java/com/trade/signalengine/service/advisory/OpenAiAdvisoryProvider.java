package com.trade.signalengine.service.advisory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.dto.AdvisoryOpinion;
import com.trade.signalengine.dto.AdvisorySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chat-completions client for an OpenAI-compatible endpoint. Asks for {@code {"score":0-100,"rationale":"..."}};
 * a plain-text reply is mapped by keyword (BUY 70, SELL 30, anything else 50).
 */
@Slf4j
@Component
public class OpenAiAdvisoryProvider implements AdvisoryProvider {

    static final String PROVIDER = "openai";
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private final RestTemplate template;
    private final ObjectMapper mapper;
    private final SignalEngineProperties.Advisory cfg;

    public OpenAiAdvisoryProvider(@Qualifier("advisoryRestTemplate") RestTemplate template, ObjectMapper mapper,
                                  SignalEngineProperties props) {
        this.template = template;
        this.mapper = mapper;
        this.cfg = props.getAdvisory();
    }

    @Override
    public boolean isConfigured() {
        return cfg.isEnabled() && cfg.getApiKey() != null && !cfg.getApiKey().isBlank();
    }

    @Override
    public Optional<AdvisoryOpinion> advise(AdvisorySnapshot snapshot) {
        if (!isConfigured()) return Optional.empty();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(cfg.getApiKey());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", cfg.getModel());
        body.put("temperature", 0.2);
        body.put("max_tokens", 150);
        body.put("messages", List.of(
                Map.of("role", "system", "content",
                        "You are a forex market analyst. Reply only with JSON {\"score\": 0-100, \"rationale\": \"...\"}"
                                + " where above 50 is bullish and below 50 bearish."),
                Map.of("role", "user", "content", describe(snapshot))));

        String url = cfg.getBaseUrl().replaceAll("/+$", "") + "/v1/chat/completions";
        JsonNode reply = template.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
        String content = reply == null ? null : reply.path("choices").path(0).path("message").path("content").asText(null);
        if (content == null || content.isBlank()) {
            log.debug("Advisory reply without content for {}", snapshot.instrument());
            return Optional.empty();
        }
        return Optional.of(parse(content));
    }

    AdvisoryOpinion parse(String content) {
        Matcher m = JSON_OBJECT.matcher(content);
        if (m.find()) {
            try {
                JsonNode node = mapper.readTree(m.group());
                if (node.path("score").isNumber()) {
                    double score = Math.max(0.0, Math.min(100.0, node.get("score").asDouble()));
                    return new AdvisoryOpinion(score, node.path("rationale").asText(""), PROVIDER);
                }
            } catch (JsonProcessingException e) {
                log.debug("Advisory reply is not JSON, falling back to keywords: {}", e.getOriginalMessage());
            }
        }
        String upper = content.toUpperCase(Locale.ROOT);
        double score = upper.contains("NO_SIGNAL") ? 50.0
                : upper.contains("BUY") ? 70.0
                : upper.contains("SELL") ? 30.0
                : 50.0;
        return new AdvisoryOpinion(score, content.trim(), PROVIDER);
    }

    private static String describe(AdvisorySnapshot s) {
        return String.format(Locale.ROOT,
                "%s price=%.5f RSI=%.1f MACD_diff=%.6f BB%%=%.1f ADX=%.1f Stoch_K=%.1f trend=%s(%.0f) momentum=%s(%.4f%%)",
                s.instrument(), s.price(), s.rsi(), s.macdDiff(), s.bollingerPercent(), s.adx(), s.stochK(),
                s.trend().direction(), s.trend().strength(), s.momentum().direction(), s.momentum().changePct());
    }
}
