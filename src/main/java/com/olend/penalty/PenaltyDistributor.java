package com.olend.penalty;

import com.olend.admin.AdminCapability;
import com.olend.admin.AdminCapabilityAuthority;
import com.olend.event.RiskEvent;
import com.olend.event.RiskEventType;
import com.olend.event.RiskLevel;
import com.olend.math.SafeMath;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Splits liquidation penalties among liquidator, platform reserve, insurance fund and
 * borrower protection.
 *
 * <p>Each share is {@code floor(total x rate / 10000)}; the platform reserve takes whatever the
 * truncation leaves, so the four shares sum exactly to the input. This component only computes
 * amounts; moving funds is the caller's job.
 */
public class PenaltyDistributor {

    private static final Logger log = LoggerFactory.getLogger(PenaltyDistributor.class);

    private final AtomicReference<PenaltyDistributionConfig> config;
    private final AdminCapabilityAuthority authority;
    private final ApplicationEventPublisher applicationEventPublisher;

    public PenaltyDistributor(
            PenaltyDistributionConfig initialConfig,
            AdminCapabilityAuthority authority,
            ApplicationEventPublisher applicationEventPublisher) {
        initialConfig.validate();
        this.config = new AtomicReference<>(initialConfig);
        this.authority = authority;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Computes the split without side effects.
     */
    public PenaltySplit split(long totalPenalty) {
        PenaltyDistributionConfig current = config.get();
        long liquidator = SafeMath.percentage(totalPenalty, current.getLiquidatorShareBps());
        long insurance = SafeMath.percentage(totalPenalty, current.getInsuranceShareBps());
        long borrowerProtection = current.isBorrowerProtectionEnabled()
                ? SafeMath.percentage(totalPenalty, current.borrowerProtectionShareBps())
                : 0L;
        long platform = SafeMath.sub(
                totalPenalty, SafeMath.add(SafeMath.add(liquidator, insurance), borrowerProtection));
        return new PenaltySplit(totalPenalty, liquidator, platform, insurance, borrowerProtection);
    }

    /**
     * Computes the split and publishes a {@link RiskEventType#PENALTY_DISTRIBUTED} event.
     */
    public PenaltySplit distribute(long totalPenalty, long now) {
        PenaltySplit split = split(totalPenalty);
        log.info(
                "Penalty {} distributed: liquidator={}, platform={}, insurance={}, borrowerProtection={}",
                totalPenalty,
                split.getLiquidatorShare(),
                split.getPlatformShare(),
                split.getInsuranceShare(),
                split.getBorrowerProtectionShare());
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.PENALTY_DISTRIBUTED,
                RiskLevel.INFO,
                "penalty",
                "Penalty of " + totalPenalty + " distributed",
                Map.of(
                        "total", totalPenalty,
                        "liquidator", split.getLiquidatorShare(),
                        "platform", split.getPlatformShare(),
                        "insurance", split.getInsuranceShare(),
                        "borrowerProtection", split.getBorrowerProtectionShare()),
                now));
        return split;
    }

    public PenaltyDistributionConfig getConfig() {
        return config.get();
    }

    /**
     * Replaces the distribution config after validating it in full.
     *
     * @return the previous config
     */
    public PenaltyDistributionConfig updateConfig(AdminCapability capability, PenaltyDistributionConfig newConfig) {
        authority.verify(capability);
        newConfig.validate();
        PenaltyDistributionConfig previous = config.getAndSet(newConfig);
        log.info("Penalty distribution updated: {} -> {}", previous, newConfig);
        return previous;
    }
}
