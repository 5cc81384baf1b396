package com.rideeasy.dispatch.model;

import com.rideeasy.shared.enums.RideStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RideStatusUpdateRequest {

    @NotNull
    private RideStatus status;
}
