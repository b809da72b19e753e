package com.bbthechange.tvguide.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for adding a channel to the catalog.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateChannelRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Logo is required")
    private String logo;

    @NotNull(message = "Stream is required")
    private String stream;

    private String category; // Defaults to "General"

    private String description;
}
