package com.driftpool.trip.model;

import com.driftpool.shared.enums.CancellationReasonType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancellationRequest {

    @NotNull
    private CancellationReasonType reasonType;

    @Size(max = 512)
    private String reason;
}
