package com.vendorhub.marketplace.modules.image.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePositionRequest {

    @NotNull(message = "position is required")
    private Integer position;
}
