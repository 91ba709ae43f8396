package com.locationscout.core.service.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.locationscout.core.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 모달리티 보고서 JSON 포맷. SiteReport 와 양방향 변환된다. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModalityReportDocument {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Page {
        @JsonProperty("url")      public String url;
        @JsonProperty("title")    public String title;
        @JsonProperty("score")    public int score;
        @JsonProperty("accepted") public boolean accepted;
        @JsonProperty("verdict")  public Verdict verdict;
        @JsonProperty("signals")  public List<SignalEntry> signals = new ArrayList<>();

        static Page from(PageClassification pc) {
            Page p = new Page();
            p.url = pc.url();
            p.title = pc.title();
            p.score = pc.totalScore();
            p.accepted = pc.accepted();
            p.verdict = pc.verdict();
            for (Signal s : pc.signals()) p.signals.add(SignalEntry.from(s));
            return p;
        }

        PageClassification toClassification() {
            List<Signal> sigs = new ArrayList<>();
            for (SignalEntry e : signals) sigs.add(e.toSignal());
            return new PageClassification(url, title, sigs, score, accepted, verdict == null ? Verdict.SCORED : verdict);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Site {
        @JsonProperty("carrier_name")         public String carrierName;
        @JsonProperty("domain")               public String domain;
        @JsonProperty("total_pages")          public int totalPages;
        @JsonProperty("location_pages")       public int locationPages;
        @JsonProperty("modalities_found")     public Map<String, Integer> modalitiesFound = new LinkedHashMap<>();
        @JsonProperty("recommended_approach") public String recommendedApproach;
        @JsonProperty("top_pages")            public List<Page> topPages = new ArrayList<>();

        static Site from(SiteReport r) {
            Site s = new Site();
            s.carrierName = r.siteId();
            s.domain = r.domain();
            s.totalPages = r.totalPagesSeen();
            s.locationPages = r.acceptedPages();
            r.modalityCounts().forEach((k, v) -> s.modalitiesFound.put(k.name(), v));
            s.recommendedApproach = r.recommendedApproach();
            for (PageClassification pc : r.topPages()) s.topPages.add(Page.from(pc));
            return s;
        }

        SiteReport toReport() {
            EnumMap<SignalKind, Integer> m = new EnumMap<>(SignalKind.class);
            modalitiesFound.forEach((k, v) -> m.put(SignalKind.valueOf(k), v));
            List<PageClassification> pages = new ArrayList<>();
            for (Page p : topPages) pages.add(p.toClassification());
            return new SiteReport(carrierName, domain, totalPages, locationPages, m, pages, recommendedApproach);
        }
    }

    @JsonProperty("generated_at")      public Instant generatedAt;
    @JsonProperty("score_threshold")   public int scoreThreshold;
    @JsonProperty("total_sites")       public int totalSites;
    @JsonProperty("sites_with_locations") public int sitesWithLocations;
    @JsonProperty("sites")             public List<Site> sites = new ArrayList<>();

    public static ModalityReportDocument of(List<SiteReport> reports, int threshold) {
        ModalityReportDocument d = new ModalityReportDocument();
        d.generatedAt = Instant.now();
        d.scoreThreshold = threshold;
        d.totalSites = reports.size();
        for (SiteReport r : reports) {
            if (r.hasLocations()) d.sitesWithLocations++;
            d.sites.add(Site.from(r));
        }
        return d;
    }

    public List<SiteReport> toReports() {
        List<SiteReport> out = new ArrayList<>();
        for (Site s : sites) out.add(s.toReport());
        return out;
    }
}
