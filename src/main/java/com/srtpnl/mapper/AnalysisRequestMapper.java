package com.srtpnl.mapper;

import com.srtpnl.api.dto.request.DealRequest;
import com.srtpnl.api.dto.request.ScenarioRequest;
import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.ScenarioInput;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from analysis request DTOs to domain inputs.
 *
 * <p>Null structural terms in {@link DealRequest} (maturity, replenishment period,
 * periods per year) leave the {@link DealParameters} builder defaults in place.
 */
@Mapper
public interface AnalysisRequestMapper {

    DealParameters toDealParameters(DealRequest dealRequest);

    ScenarioInput toScenarioInput(ScenarioRequest scenarioRequest);

    List<ScenarioInput> toScenarioInputs(List<ScenarioRequest> scenarioRequests);
}
