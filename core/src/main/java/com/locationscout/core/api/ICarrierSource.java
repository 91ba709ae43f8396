// ICarrierSource.java
package com.locationscout.core.api;

import com.locationscout.core.model.Carrier;

import java.io.IOException;
import java.util.List;

/** 대상 사이트 목록 공급 계약(파일/DB 등 출처 무관, 순서 유지). */
@FunctionalInterface
public interface ICarrierSource {
    List<Carrier> load() throws IOException;
}
