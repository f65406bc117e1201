package org.tanzu.commcellsdk.replication;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * The {@code blrRecoveryOpts} XML document of a new BLR pair. Every value is an attribute.
 */
@JacksonXmlRootElement(localName = "BlockReplication_BLRRecoveryOptions")
class BlrRecoveryOptions {

    @JacksonXmlProperty(isAttribute = true)
    private final int recoveryType;

    @JacksonXmlProperty(localName = "granularV2")
    private final GranularV2 granularV2;

    BlrRecoveryOptions(BlrPairSpec spec) {
        this.recoveryType = spec.getRecoveryType().getCode();
        this.granularV2 = new GranularV2(spec);
    }

    public int getRecoveryType() {
        return recoveryType;
    }

    public GranularV2 getGranularV2() {
        return granularV2;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class GranularV2 {
        @JacksonXmlProperty(isAttribute = true)
        private final int ccrpInterval;
        @JacksonXmlProperty(isAttribute = true)
        private final int acrpInterval;
        @JacksonXmlProperty(isAttribute = true)
        private final int maxRpInterval;
        @JacksonXmlProperty(isAttribute = true)
        private final int rpMergeDelay;
        @JacksonXmlProperty(isAttribute = true)
        private final int rpRetention;
        @JacksonXmlProperty(isAttribute = true)
        private final int maxRpStoreOfflineTime;
        @JacksonXmlProperty(isAttribute = true)
        private final int useOffPeakSchedule;
        @JacksonXmlProperty(isAttribute = true)
        private final Integer rpStoreId;
        @JacksonXmlProperty(isAttribute = true)
        private final String rpStoreName;

        GranularV2(BlrPairSpec spec) {
            this.ccrpInterval = spec.getCcrpInterval();
            this.acrpInterval = spec.getAcrpInterval();
            this.maxRpInterval = spec.getMaxRpInterval();
            this.rpMergeDelay = spec.getRpMergeDelay();
            this.rpRetention = spec.getRpRetention();
            this.maxRpStoreOfflineTime = spec.getRpStoreSwitchLive();
            this.useOffPeakSchedule = spec.isMergeOnlyOffPeak() ? 1 : 0;
            boolean hasRpStore = spec.getRpStoreId() != null && spec.getRpStoreName() != null;
            this.rpStoreId = hasRpStore ? spec.getRpStoreId() : null;
            this.rpStoreName = hasRpStore ? spec.getRpStoreName() : null;
        }

        public int getCcrpInterval() { return ccrpInterval; }
        public int getAcrpInterval() { return acrpInterval; }
        public int getMaxRpInterval() { return maxRpInterval; }
        public int getRpMergeDelay() { return rpMergeDelay; }
        public int getRpRetention() { return rpRetention; }
        public int getMaxRpStoreOfflineTime() { return maxRpStoreOfflineTime; }
        public int getUseOffPeakSchedule() { return useOffPeakSchedule; }
        public Integer getRpStoreId() { return rpStoreId; }
        public String getRpStoreName() { return rpStoreName; }
    }
}
