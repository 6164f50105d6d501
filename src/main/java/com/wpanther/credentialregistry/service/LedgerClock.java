package com.wpanther.credentialregistry.service;

/**
 * Source of the ledger height used as "current time" by every registry operation.
 * Heights never decrease and no participant can advance them.
 */
public interface LedgerClock {

    long currentHeight();
}
