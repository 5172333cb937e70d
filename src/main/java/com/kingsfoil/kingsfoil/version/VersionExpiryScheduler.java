package com.kingsfoil.kingsfoil.version;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically fails multi-part versions whose remaining parts never arrived.
 */
@Component
public class VersionExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(VersionExpiryScheduler.class);

    private final VersionManager versionManager;

    public VersionExpiryScheduler(VersionManager versionManager) {
        this.versionManager = versionManager;
    }

    @Scheduled(cron = "${kingsfoil.ingest.expiry-cron:0 */15 * * * *}")
    public void expireStaleVersions() {
        List<DataVersion> expired = versionManager.expireStaleVersions();
        if (!expired.isEmpty()) {
            log.info("Expired {} stale version(s): {}", expired.size(),
                    expired.stream().map(DataVersion::key).toList());
        }
    }
}
