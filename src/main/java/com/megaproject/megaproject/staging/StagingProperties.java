package com.megaproject.megaproject.staging;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized staging configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "staging")
public class StagingProperties {

    private String referenceCountry = StagingConstants.DEFAULT_REFERENCE_COUNTRY;
    private String referenceCron = StagingConstants.DEFAULT_REFERENCE_CRON;
    private String worldBankBaseUrl = StagingConstants.DEFAULT_WORLD_BANK_BASE_URL;
    private int worldBankPageSize = StagingConstants.DEFAULT_WORLD_BANK_PAGE_SIZE;
    private int insertBatchSize = StagingConstants.DEFAULT_INSERT_BATCH_SIZE;

    public String getReferenceCountry() {
        return referenceCountry;
    }

    public void setReferenceCountry(String referenceCountry) {
        this.referenceCountry = referenceCountry;
    }

    public String getReferenceCron() {
        return referenceCron;
    }

    public void setReferenceCron(String referenceCron) {
        this.referenceCron = referenceCron;
    }

    public String getWorldBankBaseUrl() {
        return worldBankBaseUrl;
    }

    public void setWorldBankBaseUrl(String worldBankBaseUrl) {
        this.worldBankBaseUrl = worldBankBaseUrl;
    }

    public int getWorldBankPageSize() {
        return worldBankPageSize;
    }

    public void setWorldBankPageSize(int worldBankPageSize) {
        this.worldBankPageSize = worldBankPageSize;
    }

    public int getInsertBatchSize() {
        return insertBatchSize;
    }

    public void setInsertBatchSize(int insertBatchSize) {
        this.insertBatchSize = insertBatchSize;
    }
}
