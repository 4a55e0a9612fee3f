package com.fuelsight.ingestion.scheduler;

import com.fuelsight.ingestion.model.ConsumptionEstimate;
import com.fuelsight.ingestion.model.TankAsset;
import com.fuelsight.ingestion.repository.AssetRepository;
import com.fuelsight.ingestion.service.ConsumptionEstimator;
import io.micronaut.context.annotation.Value;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Periodically re-estimates consumption for tanks that have not had a webhook
 * delivery recently, so days remaining keeps moving between pushes.
 *
 * <p>Each run takes up to {@code consumption.recalculation-batch-size} enabled assets
 * at enabled locations, least recently calculated first. Every asset is handled
 * independently so that a single bad asset cannot block the rest of the batch.
 * Only {@link ConsumptionEstimate.Status#ESTIMATED} results are stored.
 */
@Singleton
public class ConsumptionRecalculationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionRecalculationScheduler.class);

    private final AssetRepository assetRepository;
    private final ConsumptionEstimator consumptionEstimator;
    private final Clock clock;
    private final boolean enabled;
    private final int batchSize;

    @Inject
    public ConsumptionRecalculationScheduler(AssetRepository assetRepository,
                                             ConsumptionEstimator consumptionEstimator,
                                             Clock clock,
                                             @Value("${consumption.recalculation-enabled:true}") boolean enabled,
                                             @Value("${consumption.recalculation-batch-size:500}") int batchSize) {
        this.assetRepository = assetRepository;
        this.consumptionEstimator = consumptionEstimator;
        this.clock = clock;
        this.enabled = enabled;
        this.batchSize = batchSize;
    }

    /**
     * The {@code initialDelay} gives Flyway time to finish migrating before the first run.
     */
    @Scheduled(fixedDelay = "1h", initialDelay = "5m")
    public void recalculateAll() {
        if (!enabled) {
            log.debug("Consumption recalculation disabled");
            return;
        }

        List<TankAsset> assets;
        try {
            assets = assetRepository.findActiveForRecalculation(batchSize);
        } catch (Exception e) {
            log.error("ConsumptionRecalculationScheduler failed to query assets: {}", e.getMessage(), e);
            return;
        }

        if (assets.isEmpty()) {
            log.info("ConsumptionRecalculationScheduler found no assets to recalculate");
            return;
        }

        int updated = 0;
        int skipped = 0;
        int failed = 0;

        for (TankAsset asset : assets) {
            try {
                ConsumptionEstimate estimate = consumptionEstimator.estimate(
                        asset.getId(), asset.getCurrentLevelPercent(), asset.getCapacityLiters());
                if (estimate.isEstimated()) {
                    assetRepository.updateConsumption(asset.getId(), estimate, clock.instant());
                    updated++;
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                failed++;
                log.error("ConsumptionRecalculationScheduler failed assetId={} externalGuid={}: {}",
                        asset.getId(), asset.getExternalGuid(), e.getMessage(), e);
            }
        }

        log.info("ConsumptionRecalculationScheduler completed batch: updated={} skipped={} failed={} total={}",
                updated, skipped, failed, assets.size());
    }
}
