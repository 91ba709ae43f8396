package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.model.SignalKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLdDetectorTest {

    private final JsonLdDetector det = new JsonLdDetector();

    private static String place(String street, String zip) {
        return "{\"@type\":\"Place\",\"address\":{\"@type\":\"PostalAddress\","
                + "\"streetAddress\":\"" + street + "\",\"postalCode\":\"" + zip + "\"}}";
    }

    private static String ld(String json) {
        return "<script type=\"application/ld+json\">" + json + "</script>";
    }

    private static PageContext ctx(String head) {
        return PageContext.of("<html><head>" + head + "</head><body></body></html>", "https://acme.com/x");
    }

    @Test
    void two_addresses_score_five() {
        String head = ld("[" + place("100 Main St", "75201") + "," + place("200 Oak Ave", "77002") + "]");
        assertThat(det.detect(ctx(head))).hasValueSatisfying(s -> {
            assertThat(s.kind()).isEqualTo(SignalKind.JSON_LD_LOCATIONS);
            assertThat(s.points()).isEqualTo(5);
            assertThat(s.rationale()).isEqualTo("JSON-LD with 2+ locations");
        });
    }

    @Test
    void single_headquarters_address_is_not_enough() {
        assertThat(det.detect(ctx(ld(place("100 Main St", "75201"))))).isEmpty();
    }

    @Test
    void malformed_block_is_skipped_and_others_still_count() {
        String head = ld("{ not json") + ld(place("100 Main St", "75201")) + ld(place("200 Oak Ave", "77002"));
        assertThat(det.detect(ctx(head))).isPresent();
    }
}
