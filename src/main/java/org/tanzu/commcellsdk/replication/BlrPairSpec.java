package org.tanzu.commcellsdk.replication;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request to create a file system BLR pair between two clients.
 */
public class BlrPairSpec {

    /** How the destination is kept */
    public enum RecoveryType {
        LIVE(1), SNAPSHOT(2), GRANULAR(3), GRANULARV2(4);

        private final int code;

        RecoveryType(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final String sourceClient;
    private final String destinationClient;
    private final RecoveryType recoveryType;
    private final List<VolumeMapping> volumes = new ArrayList<>();

    private int ccrpInterval = 300;
    private int acrpInterval = 0;
    private int maxRpInterval = 21600;
    private int rpMergeDelay = 172800;
    private int rpRetention = 604800;
    private int rpStoreSwitchLive = 0;
    private boolean mergeOnlyOffPeak = false;
    private Integer rpStoreId;
    private String rpStoreName;

    /**
     * @param sourceClient source client name, host name or id
     * @param destinationClient destination client name, host name or id
     */
    public BlrPairSpec(String sourceClient, String destinationClient, RecoveryType recoveryType) {
        this.sourceClient = sourceClient;
        this.destinationClient = destinationClient;
        this.recoveryType = recoveryType;
    }

    public BlrPairSpec volume(VolumeMapping mapping) { this.volumes.add(mapping); return this; }
    public BlrPairSpec ccrpInterval(int seconds) { this.ccrpInterval = seconds; return this; }
    public BlrPairSpec acrpInterval(int seconds) { this.acrpInterval = seconds; return this; }
    public BlrPairSpec maxRpInterval(int seconds) { this.maxRpInterval = seconds; return this; }
    public BlrPairSpec rpMergeDelay(int seconds) { this.rpMergeDelay = seconds; return this; }
    public BlrPairSpec rpRetention(int seconds) { this.rpRetention = seconds; return this; }
    public BlrPairSpec rpStoreSwitchLive(int seconds) { this.rpStoreSwitchLive = seconds; return this; }
    public BlrPairSpec mergeOnlyOffPeak(boolean value) { this.mergeOnlyOffPeak = value; return this; }

    public BlrPairSpec rpStore(int id, String name) {
        this.rpStoreId = id;
        this.rpStoreName = name;
        return this;
    }

    public String getSourceClient() { return sourceClient; }
    public String getDestinationClient() { return destinationClient; }
    public RecoveryType getRecoveryType() { return recoveryType; }
    public List<VolumeMapping> getVolumes() { return Collections.unmodifiableList(volumes); }
    public int getCcrpInterval() { return ccrpInterval; }
    public int getAcrpInterval() { return acrpInterval; }
    public int getMaxRpInterval() { return maxRpInterval; }
    public int getRpMergeDelay() { return rpMergeDelay; }
    public int getRpRetention() { return rpRetention; }
    public int getRpStoreSwitchLive() { return rpStoreSwitchLive; }
    public boolean isMergeOnlyOffPeak() { return mergeOnlyOffPeak; }
    public Integer getRpStoreId() { return rpStoreId; }
    public String getRpStoreName() { return rpStoreName; }

    /**
     * A source volume replicated to a destination volume.
     */
    public static class VolumeMapping {
        private final String sourceVolumeGuid;
        private final String sourceVolume;
        private final String destinationVolumeGuid;
        private final String destinationVolume;
        private final long sourceVolumeSize;

        public VolumeMapping(String sourceVolumeGuid, String sourceVolume, String destinationVolumeGuid,
                             String destinationVolume, long sourceVolumeSize) {
            this.sourceVolumeGuid = sourceVolumeGuid;
            this.sourceVolume = sourceVolume;
            this.destinationVolumeGuid = destinationVolumeGuid;
            this.destinationVolume = destinationVolume;
            this.sourceVolumeSize = sourceVolumeSize;
        }

        public String getSourceVolumeGuid() { return sourceVolumeGuid; }
        public String getSourceVolume() { return sourceVolume; }
        public String getDestinationVolumeGuid() { return destinationVolumeGuid; }
        public String getDestinationVolume() { return destinationVolume; }
        public long getSourceVolumeSize() { return sourceVolumeSize; }
    }
}
