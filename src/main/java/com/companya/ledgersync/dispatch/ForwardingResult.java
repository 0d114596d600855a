package com.companya.ledgersync.dispatch;

import com.companya.ledgersync.integration.LedgerResponse;

/**
 * @param request   the forwarded request
 * @param success   whether the ledger accepted the write
 * @param elapsedMs time from call start to completion or timeout
 * @param timedOut  whether the call exceeded its deadline
 * @param response  ledger reply on success
 * @param error     cause of the failure, {@code null} on success
 */
public record ForwardingResult(
        ForwardingRequest request,
        boolean success,
        long elapsedMs,
        boolean timedOut,
        LedgerResponse response,
        Throwable error) {
}
