package com.phillippitts.navguide.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Free-form scene description to read out, e.g. from a vision-language model.
 */
public record SceneRequest(@NotBlank @Size(max = 2000) String description) {}
