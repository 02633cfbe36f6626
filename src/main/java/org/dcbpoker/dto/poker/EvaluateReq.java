package org.dcbpoker.dto.poker;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class EvaluateReq {
    @NotNull
    @Size(min = 5, max = 7)
    private List<String> cards;
}
