package secops.threatgraph.core.port.out;

import secops.threatgraph.core.domain.model.GraphEntity;

/**
 * 외부 위협 정보 보강 및 귀속 분석 포트
 *
 * <p>키 단위로 호출되며 실패는 해당 키에만 영향을 줍니다.
 */
public interface EnrichmentProvider {

  GraphEntity enrichIoc(String iocId) throws Exception;

  GraphEntity analyzeAttribution(String threatId) throws Exception;
}
