package com.locationscout.core.classifier;

import com.locationscout.core.model.PageClassification;
import com.locationscout.core.model.SiteReport;
import com.locationscout.core.store.PageStore;
import com.locationscout.core.store.StoredPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * 사이트 단위 분류: 저장된 페이지 전부를 분류해 {@link SiteReport} 로 접는다.
 * 읽지 못한 파일은 건너뛰되 totalPagesSeen 에는 센다.
 */
public final class SiteClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(SiteClassifier.class);

    private final LocationClassifier classifier;
    private final int topLimit;

    public SiteClassifier(LocationClassifier classifier, int topLimit) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.topLimit = topLimit;
    }

    public SiteReport classifySite(String siteId, String domain, PageStore store) throws IOException {
        SiteReport.Builder b = SiteReport.builder(siteId, domain);
        for (Path f : store.pageFiles()) {
            try {
                b.add(classifyStored(store.read(f)));
            } catch (IOException e) {
                LOG.debug("unreadable page skipped: {} ({})", f, e.toString());
                b.seen();
            }
        }
        return finish(b);
    }

    public SiteReport classifySite(String siteId, String domain, List<StoredPage> pages) {
        SiteReport.Builder b = SiteReport.builder(siteId, domain);
        for (StoredPage p : pages) b.add(classifyStored(p));
        return finish(b);
    }

    /** 표식/canonical 로 URL 을 복원한 뒤 분류 */
    public PageClassification classifyStored(StoredPage page) {
        PageContext ctx = PageContext.of(page.html(), "");
        String url = UrlRecovery.recoverOr(ctx.document(), page.stem());
        return classifier.classify(page.html(), url);
    }

    private SiteReport finish(SiteReport.Builder b) {
        return b.build(topLimit, RecommendationTable.recommend(b.modalities()));
    }
}
