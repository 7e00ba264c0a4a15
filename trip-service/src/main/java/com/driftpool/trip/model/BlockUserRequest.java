package com.driftpool.trip.model;

import com.driftpool.shared.enums.BlockReason;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class BlockUserRequest {

    @NotBlank
    private String blockedUserId;

    @NotNull
    private BlockReason reasonType;

    @Size(max = 512)
    private String reason;
}
