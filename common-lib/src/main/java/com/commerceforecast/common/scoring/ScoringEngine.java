package com.commerceforecast.common.scoring;

import com.commerceforecast.common.model.City;
import com.commerceforecast.common.model.ScoreSet;

import java.util.List;
import java.util.Map;

/**
 * Converts product and market unit payloads into the final numeric forecast.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Pure</b>: identical inputs yield an identical {@link ScoreSet}</li>
 *   <li><b>Total</b>: sparse or missing payload fields fall back to defaults, never throw</li>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 * </ul>
 */
public interface ScoringEngine {

    /**
     * @param productPayload payload of the product unit (may be empty)
     * @param marketPayload  payload of the market unit (may be empty)
     * @param cities         raw city records targeted by the forecast (read-only)
     * @return the clamped score set, never {@code null}
     */
    ScoreSet score(Map<String, Object> productPayload,
                   Map<String, Object> marketPayload,
                   List<City> cities);
}
