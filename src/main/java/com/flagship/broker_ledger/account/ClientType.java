package com.flagship.broker_ledger.account;

/**
 * Kind of client behind an exchange account.
 *
 * Decides, at freeze time only, who shares in a loss or profit.
 */
public enum ClientType {
    /**
     * My own client. I am the only beneficiary.
     */
    PERSONAL,

    /**
     * A company client. The company takes its own share next to mine.
     */
    COMPANY
}
