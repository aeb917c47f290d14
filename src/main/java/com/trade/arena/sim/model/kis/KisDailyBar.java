package com.trade.arena.sim.model.kis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KisDailyBar {

    // yyyyMMdd
    @JsonProperty("stck_bsop_date")
    private String businessDate;

    @JsonProperty("stck_oprc")
    private String openPrice;

    @JsonProperty("stck_hgpr")
    private String highPrice;

    @JsonProperty("stck_lwpr")
    private String lowPrice;

    @JsonProperty("stck_clpr")
    private String closePrice;

    @JsonProperty("acml_vol")
    private String accumulatedVolume;
}
