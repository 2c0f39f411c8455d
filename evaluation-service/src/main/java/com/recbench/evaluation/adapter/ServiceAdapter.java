package com.recbench.evaluation.adapter;

import com.recbench.evaluation.model.CanonicalRequest;
import com.recbench.evaluation.model.CanonicalResult;

/**
 * Translation layer between the canonical request/result and one target service's wire contract.
 *
 * @param <Q> native request type
 * @param <R> native response type
 */
public interface ServiceAdapter<Q, R> {

    String serviceId();

    ServiceShape shape();

    Q buildRequest(CanonicalRequest request);

    /**
     * Performs the network call. The only method allowed to block on I/O.
     */
    R call(Q nativeRequest) throws AdapterException;

    /**
     * Missing or partial recommendation fields parse to empty lists rather than failing.
     */
    CanonicalResult parse(R nativeResponse) throws AdapterException;

    default CanonicalResult execute(CanonicalRequest request) throws AdapterException {
        Q nativeRequest = buildRequest(request);
        long start = System.nanoTime();
        R response = call(nativeRequest);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        return parse(response).withProcessingTime(elapsedMs);
    }
}
