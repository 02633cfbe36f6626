package org.dcbpoker.dto.poker;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class JoinMsg {
    @NotBlank
    private String playerId;
    @Size(max = 32)
    private String displayName;
}
