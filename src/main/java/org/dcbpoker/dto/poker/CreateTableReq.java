package org.dcbpoker.dto.poker;

import jakarta.validation.constraints.*;
import lombok.Data;

/** Absent fields fall back to the configured defaults. */
@Data
public class CreateTableReq {
    @NotBlank
    private String hostId;
    private String hostName;

    @Min(2) @Max(8)
    private Integer maxPlayers;

    @Min(100) @Max(100_000)
    private Long startingBank;

    @Min(1) @Max(500)
    private Long smallBlind;

    @Min(2) @Max(1000)
    private Long bigBlind;

    @Min(10) @Max(120)
    private Integer turnTimerSeconds;
}
