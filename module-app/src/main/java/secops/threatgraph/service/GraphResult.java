package secops.threatgraph.service;

import secops.threatgraph.core.admission.AdmissionDecision;

/**
 * @param dispatchRounds 요청 동안 실행된 배치 dispatch 라운드 수
 */
public record GraphResult<T>(T data, AdmissionDecision admission, int dispatchRounds) {}
