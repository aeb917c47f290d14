package com.trade.arena.sim.model.documents;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A tracked listing. The code is the identity; name and market are display fields.
 */
@Document("securities")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Security {

    @Id
    private String code;

    private String name;

    private String market;   // KOSPI / KOSDAQ
}
