package com.copytrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManualTripRequest {

    @NotBlank
    private String actor;

    @NotBlank
    private String reason;
}
