// ISiteDiscoverer.java
package com.locationscout.core.api;

import com.locationscout.core.model.DiscoveryResult;

/** URL 발견 계약: 사이트 루트에서 후보 URL 집합(+우선 후보)을 만든다. */
@FunctionalInterface
public interface ISiteDiscoverer {
    DiscoveryResult discover(String siteRoot);
}
