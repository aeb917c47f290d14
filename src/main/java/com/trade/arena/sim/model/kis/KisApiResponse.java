package com.trade.arena.sim.model.kis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.trade.arena.sim.common.constants.KisConstants;
import lombok.Data;

/**
 * Envelope shared by every KIS quotation endpoint. Single-record endpoints fill {@code output},
 * chart endpoints fill {@code output1} (summary) and {@code output2} (bars).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KisApiResponse {

    @JsonProperty("rt_cd")
    private String rtCd;

    @JsonProperty("msg_cd")
    private String msgCd;

    @JsonProperty("msg1")
    private String msg;

    private JsonNode output;

    private JsonNode output1;

    private JsonNode output2;

    public boolean isOk() {
        return KisConstants.RT_CD_OK.equals(rtCd);
    }
}
