package com.scheduler.lifecycle.run;

/**
 * Per-step counters recorded on an orchestration run.
 */
public enum RunCounter {
    SYNC_ACCOUNTS_INSERTED("syncAccountsInserted"),
    SYNC_ACCOUNTS_UPDATED("syncAccountsUpdated"),
    SYNC_ACCOUNTS_TOTAL("syncAccountsTotal"),
    JOBS_CREATED("jobsCreated"),
    JOBS_SKIPPED("jobsSkipped"),
    CREDENTIALS_VERIFIED("credentialsVerified"),
    CREDENTIALS_FAILED("credentialsFailed"),
    SCRAPING_REQUESTED("scrapingRequested"),
    SCRAPING_FAILED("scrapingFailed"),
    STATUSES_CHECKED("statusesChecked"),
    STATUSES_FAILED("statusesFailed");

    private final String propertyName;

    RunCounter(String propertyName) {
        this.propertyName = propertyName;
    }

    /**
     * Name used for the counter in stored runs and health details.
     */
    public String propertyName() {
        return propertyName;
    }
}
