package com.locationscout.core.classifier.detectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;
import com.locationscout.core.util.JsonSupport;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * JSON-LD 구조화 데이터에 주소가 여러 개(본사 1곳이 아닌) 들어있는지.
 * streetAddress + postalCode 키 등장 수가 4 이상(= 주소 2곳 이상)이면 5점.
 * 깨진 블록은 건너뛴다.
 */
public final class JsonLdDetector implements SignalDetector {
    private static final Logger LOG = LoggerFactory.getLogger(JsonLdDetector.class);

    static final int MIN_KEYS = 4;

    private final ObjectMapper om = JsonSupport.mapper();

    @Override
    public Optional<Signal> detect(PageContext page) {
        int keys = 0;
        for (Element script : page.document().select("script[type=application/ld+json]")) {
            String body = script.data();
            if (body == null || body.isBlank()) continue;
            try {
                JsonNode node = om.readTree(body);
                String flat = om.writeValueAsString(node).toLowerCase(Locale.ROOT);
                keys += count(flat, "\"streetaddress\"") + count(flat, "\"postalcode\"");
            } catch (JsonProcessingException e) {
                LOG.debug("malformed JSON-LD skipped on {}: {}", page.url(), e.getOriginalMessage());
            }
        }
        if (keys < MIN_KEYS) return Optional.empty();
        return Optional.of(Signal.of(SignalKind.JSON_LD_LOCATIONS, Confidence.HIGH, 5,
                "JSON-LD with " + (keys / 2) + "+ locations", "Structured data with multiple addresses"));
    }

    private static int count(String s, String needle) {
        int n = 0;
        int i = s.indexOf(needle);
        while (i >= 0) {
            n++;
            i = s.indexOf(needle, i + needle.length());
        }
        return n;
    }
}
