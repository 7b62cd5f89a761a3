package com.leyesmx.interfaces.api.dto;

import com.leyesmx.domain.statute.model.SplitLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ParseRequest(
        @NotBlank(message = "El identificador del documento es obligatorio")
        @Size(max = 64, message = "El identificador no debe exceder 64 caracteres")
        @Pattern(regexp = "[A-Za-z0-9_-]+", message = "El identificador solo admite letras, dígitos, '_' y '-'")
        String documentId,

        @NotBlank(message = "El texto del documento es obligatorio")
        @Size(max = 5_000_000, message = "El texto no debe exceder 5000000 caracteres")
        String text,

        SplitLevel splitLevel,

        Boolean discardEmptyChapters
) {}
