package com.olend.mapper;

import com.olend.api.dto.request.CollateralPolicyRequest;
import com.olend.api.dto.request.DistributionRequest;
import com.olend.api.dto.request.FeedConfigRequest;
import com.olend.api.dto.request.ManipulationConfigRequest;
import com.olend.api.dto.request.MarketConditionsRequest;
import com.olend.api.dto.request.PenaltyRatesRequest;
import com.olend.api.dto.request.PositionRequest;
import com.olend.api.dto.request.ThresholdRequest;
import com.olend.circuit.ThresholdConfig;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.manipulation.ManipulationConfig;
import com.olend.penalty.PenaltyDistributionConfig;
import com.olend.risk.BorrowPosition;
import com.olend.risk.CollateralPolicy;
import com.olend.risk.MarketConditionFactors;
import com.olend.risk.PenaltyRateConfig;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.NullValueCheckStrategy;

/**
 * MapStruct mapper from REST request DTOs to the core's config and position types.
 *
 * <p>Null request fields are skipped, so builder defaults apply for omitted optional values.
 * Range validation is left to each config's {@code validate()}.
 */
@Mapper(nullValueCheckStrategy = NullValueCheckStrategy.ALWAYS)
public interface RiskDtoMapper {

    BorrowPosition toPosition(PositionRequest request);

    @Mapping(target = "asset", source = "asset")
    @Mapping(target = "feedId", expression = "java(request.getFeedId() != null ? request.getFeedId() : asset)")
    PriceFeedConfig toFeedConfig(String asset, FeedConfigRequest request);

    ThresholdConfig toThresholdConfig(ThresholdRequest request);

    CollateralPolicy toCollateralPolicy(CollateralPolicyRequest request);

    PenaltyDistributionConfig toDistributionConfig(DistributionRequest request);

    @Mapping(target = "updatedAt", ignore = true)
    MarketConditionFactors toMarketConditions(MarketConditionsRequest request);

    PenaltyRateConfig toPenaltyRateConfig(PenaltyRatesRequest request);

    ManipulationConfig toManipulationConfig(ManipulationConfigRequest request);
}
