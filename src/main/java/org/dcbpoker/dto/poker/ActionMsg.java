package org.dcbpoker.dto.poker;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ActionMsg {
    @NotBlank
    private String playerId;
    @NotBlank
    private String action;   // fold, check, call, bet, raise, allin
    @Min(0)
    private long amount;     // bet: mise ; raise: total visé
}
