package com.trade.arena.sim.model.kis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * {@code inquire-price} output. KIS sends every number as a string.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KisPriceOutput {

    @JsonProperty("stck_prpr")
    private String currentPrice;

    @JsonProperty("stck_oprc")
    private String openPrice;

    @JsonProperty("stck_hgpr")
    private String highPrice;

    @JsonProperty("stck_lwpr")
    private String lowPrice;

    @JsonProperty("acml_vol")
    private String accumulatedVolume;
}
