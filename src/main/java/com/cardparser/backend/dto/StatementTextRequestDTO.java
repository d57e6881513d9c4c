package com.cardparser.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Already-extracted statement text, e.g. from a caller that ran its own PDF reader.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatementTextRequestDTO {

    @NotNull
    private String text;
}
